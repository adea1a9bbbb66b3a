package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * IsNullExpression - NULL判断
 *
 * 表示 x IS NULL 和 x IS NOT NULL。
 */
public class IsNullExpression implements Expression {

    private final Expression operand;

    /** true表示IS NOT NULL */
    private final boolean negated;

    public IsNullExpression(Expression operand, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IS_NULL;
    }

    @Override
    public String toSql() {
        return operand.toSql() + (negated ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "(" + toSql() + ")";
    }
}
