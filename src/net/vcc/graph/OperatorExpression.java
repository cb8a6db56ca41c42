package net.vcc.graph;

import java.util.List;

/**
 * Combines two or more sub-expressions with a common operator.
 * For example, a+b is an operator expression of type PLUS with the
 * operands "a" and "b". Operand order is significant.
 */
public class OperatorExpression extends Expression {

    private final EntityContainer<Expression> operands;
    private OperatorType operatorType;

    public OperatorExpression(OperatorType type) {
        super();
        operands = new EntityContainer<Expression>(this, false);
        setOperatorType(type);
    }

    public String getKind() {
        return "OperatorExpression";
    }

    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    public OperatorType getOperatorType() {
        return operatorType;
    }
    public void setOperatorType(OperatorType type) {
        if (type == null)
            throw new NullPointerException(
                "Operator type may not be null");
        operatorType = type;
    }

    public List<Expression> getOperands() {
        return operands.getEntities();
    }
    public void addOperand(Expression expr) {
        operands.add(expr);
    }
    public boolean removeOperand(Expression expr) {
        return operands.remove(expr);
    }

    /**
     * Whether there are enough operands for the operator to apply.
     */
    public boolean isComplete() {
        return operands.size() >= 2;
    }

    public Entity findById(long id) {
        Entity ret = super.findById(id);
        if (ret == null) ret = operands.findById(id);
        return ret;
    }

}
