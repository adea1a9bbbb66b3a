package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * BetweenExpression - 区间判断
 *
 * 表示 x BETWEEN lower AND upper 和 x NOT BETWEEN lower AND upper(闭区间)。
 */
public class BetweenExpression implements Expression {

    private final Expression operand;

    private final Expression lower;

    private final Expression upper;

    private final boolean negated;

    public BetweenExpression(Expression operand, Expression lower, Expression upper, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        this.lower = Objects.requireNonNull(lower, "lower bound cannot be null");
        this.upper = Objects.requireNonNull(upper, "upper bound cannot be null");
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BETWEEN;
    }

    @Override
    public String toSql() {
        return operand.toSql() + (negated ? " NOT BETWEEN " : " BETWEEN ")
                + lower.toSql() + " AND " + upper.toSql();
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand, lower, upper);
    }

    @Override
    public String toString() {
        return "(" + toSql() + ")";
    }
}
