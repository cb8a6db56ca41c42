package net.vcc.output;

import net.vcc.graph.ClassEntity;
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
 * Renders a program graph as an indented tree, for debugging.
 * Each entity takes one line; children are indented by two more columns
 * than their parent.
 */
public class GraphPrinter {

    public static final int INDENT_STEP = 2;

    private class NodeVisitor implements StatementVisitor<Void>,
                                         ExpressionVisitor<Void> {

        private final int indent;

        public NodeVisitor(int indent) {
            this.indent = indent;
        }

        public Void visitReturn(ReturnStatement stmt) {
            line(indent, "ReturnStatement");
            if (stmt.hasExpression())
                print(stmt.getExpression(), indent + INDENT_STEP);
            return null;
        }

        public Void visitExpression(Expression expr) {
            expr.accept((ExpressionVisitor<Void>) this);
            return null;
        }

        public Void visitObject(ObjectExpression expr) {
            line(indent, "ObjectExpression");
            print(expr.getObject(), indent + INDENT_STEP);
            return null;
        }

        public Void visitOperator(OperatorExpression expr) {
            line(indent, "OperatorExpression:" + expr.getOperatorType());
            for (Expression op : expr.getOperands()) {
                print(op, indent + INDENT_STEP);
            }
            return null;
        }

    }

    private final StringBuilder output;

    public GraphPrinter() {
        output = new StringBuilder();
    }

    public String getOutput() {
        return output.toString();
    }

    public void print(PackageEntity pkg, int indent) {
        line(indent, "Package:" + pkg.getName());
        for (FunctionEntity func : pkg.getFunctions()) {
            print(func, indent + INDENT_STEP);
        }
    }

    public void print(FunctionEntity func, int indent) {
        line(indent, "Function:" + func.getReturnType());
        if (func.getReturnType() == ReturnType.VALUE &&
                func.getReturnClass() != null)
            print(func.getReturnClass(), indent + INDENT_STEP);
        for (ObjectEntity obj : func.getObjects()) {
            print(obj, indent + INDENT_STEP);
        }
        for (Statement stmt : func.getStatements()) {
            print(stmt, indent + INDENT_STEP);
        }
    }

    public void print(ClassEntity cls, int indent) {
        line(indent, "Class:" + cls.getName());
    }

    public void print(ObjectEntity obj, int indent) {
        line(indent, "Object:" + obj.getName());
        if (obj.getObjectClass() != null)
            print(obj.getObjectClass(), indent + INDENT_STEP);
    }

    public void print(Statement stmt, int indent) {
        stmt.accept(new NodeVisitor(indent));
    }

    public void print(Expression expr, int indent) {
        expr.accept((ExpressionVisitor<Void>) new NodeVisitor(indent));
    }

    private void line(int indent, String text) {
        for (int i = 0; i < indent; i++) output.append(' ');
        output.append(text).append('\n');
    }

    public static String print(PackageEntity pkg) {
        GraphPrinter p = new GraphPrinter();
        p.print(pkg, 0);
        return p.getOutput();
    }

}
