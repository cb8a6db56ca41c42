package net.vcc.output;

import net.vcc.graph.ClassEntity;
import net.vcc.graph.Entity;
import net.vcc.graph.Expression;
import net.vcc.graph.ExpressionVisitor;
import net.vcc.graph.FunctionEntity;
import net.vcc.graph.ObjectEntity;
import net.vcc.graph.ObjectExpression;
import net.vcc.graph.OperatorExpression;
import net.vcc.graph.PackageEntity;
import net.vcc.graph.ReturnStatement;
import net.vcc.graph.Statement;
import net.vcc.graph.StatementVisitor;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Exports a program graph as JSON for external tooling.
 *
 * Every entity becomes an object with "id", "kind" and "name" members.
 * Owned children are nested; references to entities owned elsewhere
 * (an object's class, a function's return class, the object of an
 * object expression) are given as ids.
 */
public final class GraphSerializer {

    private static final StatementVisitor<JSONObject> STATEMENTS =
        new StatementVisitor<JSONObject>() {

            public JSONObject visitReturn(ReturnStatement stmt) {
                JSONObject ret = base(stmt);
                ret.put("expression", (stmt.hasExpression()) ?
                    toJSON(stmt.getExpression()) : JSONObject.NULL);
                return ret;
            }

            public JSONObject visitExpression(Expression expr) {
                return toJSON(expr);
            }

        };

    private static final ExpressionVisitor<JSONObject> EXPRESSIONS =
        new ExpressionVisitor<JSONObject>() {

            public JSONObject visitObject(ObjectExpression expr) {
                JSONObject ret = base(expr);
                ret.put("object", reference(expr.getObject()));
                return ret;
            }

            public JSONObject visitOperator(OperatorExpression expr) {
                JSONObject ret = base(expr);
                ret.put("operator", expr.getOperatorType().toString());
                JSONArray operands = new JSONArray();
                for (Expression op : expr.getOperands()) {
                    operands.put(toJSON(op));
                }
                ret.put("operands", operands);
                return ret;
            }

        };

    // Prevent construction.
    private GraphSerializer() {}

    public static JSONObject toJSON(PackageEntity pkg) {
        JSONObject ret = base(pkg);
        JSONArray classes = new JSONArray();
        for (ClassEntity cls : pkg.getClasses()) {
            classes.put(base(cls));
        }
        ret.put("classes", classes);
        JSONArray functions = new JSONArray();
        for (FunctionEntity func : pkg.getFunctions()) {
            functions.put(toJSON(func));
        }
        ret.put("functions", functions);
        return ret;
    }

    public static JSONObject toJSON(FunctionEntity func) {
        JSONObject ret = base(func);
        ret.put("returnType", func.getReturnType().toString());
        ret.put("returnClass", reference(func.getReturnClass()));
        JSONArray objects = new JSONArray();
        for (ObjectEntity obj : func.getObjects()) {
            JSONObject o = base(obj);
            o.put("class", reference(obj.getObjectClass()));
            objects.put(o);
        }
        ret.put("objects", objects);
        JSONArray statements = new JSONArray();
        for (Statement stmt : func.getStatements()) {
            statements.put(toJSON(stmt));
        }
        ret.put("statements", statements);
        return ret;
    }

    public static JSONObject toJSON(Statement stmt) {
        return stmt.accept(STATEMENTS);
    }

    public static JSONObject toJSON(Expression expr) {
        return expr.accept(EXPRESSIONS);
    }

    private static JSONObject base(Entity ent) {
        JSONObject ret = new JSONObject();
        ret.put("id", ent.getId());
        ret.put("kind", ent.getKind());
        ret.put("name", ent.getName());
        return ret;
    }

    private static Object reference(Entity ent) {
        return (ent == null) ? JSONObject.NULL : (Object) ent.getId();
    }

}
