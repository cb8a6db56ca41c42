package net.vcc.graph;

/**
 * An expression evaluating to a single object, like "a".
 * The object is referenced, not owned.
 */
public class ObjectExpression extends Expression {

    private final ObjectEntity object;

    public ObjectExpression(ObjectEntity object) {
        super();
        this.object = object;
    }
    public ObjectExpression() {
        this(null);
    }

    public String getKind() {
        return "ObjectExpression";
    }

    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    public ObjectEntity getObject() {
        return object;
    }

}
