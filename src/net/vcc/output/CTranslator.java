package net.vcc.output;

import java.util.Iterator;
import net.vcc.graph.Expression;
import net.vcc.graph.ExpressionVisitor;
import net.vcc.graph.FunctionEntity;
import net.vcc.graph.ObjectEntity;
import net.vcc.graph.ObjectExpression;
import net.vcc.graph.OperatorExpression;
import net.vcc.graph.PackageEntity;
import net.vcc.graph.ReturnStatement;
import net.vcc.graph.ReturnType;
import net.vcc.graph.Statement;
import net.vcc.graph.StatementVisitor;

/**
 * Translates a program graph into C code, which a C compiler can then
 * turn into a working binary.
 */
public final class CTranslator {

    public static final String INDENT = "  ";

    private static final StatementVisitor<String> STATEMENTS =
        new StatementVisitor<String>() {

            public String visitReturn(ReturnStatement stmt) {
                if (! stmt.hasExpression()) return "return";
                return "return " + translate(stmt.getExpression());
            }

            public String visitExpression(Expression expr) {
                return translate(expr);
            }

        };

    private static final ExpressionVisitor<String> EXPRESSIONS =
        new ExpressionVisitor<String>() {

            public String visitObject(ObjectExpression expr) {
                return expr.getObject().getName();
            }

            public String visitOperator(OperatorExpression expr) {
                StringBuilder sb = new StringBuilder("(");
                Iterator<Expression> it = expr.getOperands().iterator();
                while (it.hasNext()) {
                    sb.append(translate(it.next()));
                    if (it.hasNext())
                        sb.append(expr.getOperatorType().getSymbol());
                }
                return sb.append(")").toString();
            }

        };

    // Prevent construction.
    private CTranslator() {}

    public static String translate(PackageEntity pkg) {
        StringBuilder sb = new StringBuilder();
        for (FunctionEntity func : pkg.getFunctions()) {
            sb.append(translate(func));
        }
        return sb.toString();
    }

    public static String translate(FunctionEntity func) {
        StringBuilder sb = new StringBuilder();
        if (func.getReturnType() == ReturnType.NONE) {
            sb.append("void ");
        } else {
            sb.append(func.getReturnClass().getName()).append(' ');
        }
        sb.append(func.getName()).append('(');
        Iterator<ObjectEntity> params = func.getObjects().iterator();
        while (params.hasNext()) {
            ObjectEntity obj = params.next();
            sb.append(obj.getObjectClass().getName()).append(' ')
              .append(obj.getName());
            if (params.hasNext()) sb.append(", ");
        }
        sb.append(") {\n");
        for (Statement stmt : func.getStatements()) {
            sb.append(INDENT).append(translate(stmt)).append(";\n");
        }
        return sb.append("}\n").toString();
    }

    public static String translate(Statement stmt) {
        return stmt.accept(STATEMENTS);
    }

    public static String translate(Expression expr) {
        return expr.accept(EXPRESSIONS);
    }

}
