package net.vcc.graph;

/**
 * Exits a function, returning control back to the caller.
 * May carry an expression whose result is passed back to the caller; the
 * statement owns that expression.
 */
public class ReturnStatement extends Statement {

    private Expression expression;

    public ReturnStatement(Expression expr) {
        super();
        setExpression(expr);
    }
    public ReturnStatement() {
        this(null);
    }

    public String getKind() {
        return "ReturnStatement";
    }

    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    public Expression getExpression() {
        return expression;
    }
    /**
     * Replace the returned expression.
     * The new expression must be detached; the old one (if any) is
     * released.
     */
    public void setExpression(Expression expr) {
        if (expr == expression) return;
        if (expr != null) {
            if (expr.getParent() != null)
                throw new IllegalArgumentException("Expression " + expr +
                    " is already owned by " + expr.getParent());
            if (expr.isAncestorOf(this))
                throw new IllegalArgumentException("Setting " + expr +
                    " as expression of " + this + " would create a cycle");
        }
        if (expression != null) expression.setParent(null);
        expression = expr;
        if (expr != null) expr.setParent(this);
    }

    public boolean hasExpression() {
        return (expression != null);
    }

    public Entity findById(long id) {
        Entity ret = super.findById(id);
        if (ret == null && expression != null)
            ret = expression.findById(id);
        return ret;
    }

}
