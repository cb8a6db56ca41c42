package net.vcc.graph;

/**
 * Operation over every kind of statement.
 */
public interface StatementVisitor<R> {

    R visitReturn(ReturnStatement stmt);

    /**
     * An expression used as a statement on its own.
     */
    R visitExpression(Expression expr);

}
