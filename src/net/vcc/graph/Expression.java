package net.vcc.graph;

/**
 * A sequence of operations performed on objects.
 * Expressions are recursive; the set of variants is closed, see
 * {@link ExpressionVisitor}. An expression is itself a statement so that
 * it can later stand on its own in a function body.
 */
public abstract class Expression extends Statement {

    protected Expression() {
        super();
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }

}
