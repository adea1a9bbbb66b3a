package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * InExpression - 成员判断
 *
 * 表示 x IN (v1, v2, ...) 和 x NOT IN (...)。值列表保持源码顺序。
 */
public class InExpression implements Expression {

    private final Expression operand;

    private final List<Expression> values;

    private final boolean negated;

    public InExpression(Expression operand, List<Expression> values, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("IN list cannot be empty");
        }
        this.values = List.copyOf(values);
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public List<Expression> getValues() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IN;
    }

    @Override
    public String toSql() {
        String list = values.stream().map(Expression::toSql).collect(Collectors.joining(", "));
        return operand.toSql() + (negated ? " NOT IN (" : " IN (") + list + ")";
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>(values.size() + 1);
        children.add(operand);
        children.addAll(values);
        return List.copyOf(children);
    }

    @Override
    public String toString() {
        return "(" + toSql() + ")";
    }
}
