package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * NotExpression - 前缀NOT
 *
 * 只表示写在表达式前面的NOT,如 NOT (a = 1 OR b = 2)、NOT active。
 * x NOT IN (...)、x NOT LIKE ...、x IS NOT NULL 等中缀否定由各谓词自己的negated标志表示,
 * 解释时两种写法得到相同的否定描述。
 */
public class NotExpression implements Expression {

    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NOT;
    }

    @Override
    public String toSql() {
        return "NOT (" + operand.toSql() + ")";
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return "(NOT " + operand + ")";
    }
}
