package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * NegateExpression - 一元负号
 *
 * 表示 -x, -(a + b)。负数字面量(-5)直接解析为LiteralExpression,不经过这里。
 */
public class NegateExpression implements Expression {

    private final Expression operand;

    public NegateExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NEGATE;
    }

    @Override
    public String toSql() {
        if (operand instanceof BinaryExpression) {
            return "-(" + operand.toSql() + ")";
        }
        return "-" + operand.toSql();
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "(-" + operand + ")";
    }
}
