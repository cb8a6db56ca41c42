package net.vcc.graph;

/**
 * Operation over every kind of expression.
 */
public interface ExpressionVisitor<R> {

    R visitObject(ObjectExpression expr);

    R visitOperator(OperatorExpression expr);

}
