package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * CastExpression - 类型转换
 *
 * 表示 CAST(x AS DECIMAL(10, 2)) 以及 PostgreSQL的 x::INT 写法。
 * 目标类型保留源码文本,不做校验。
 */
public class CastExpression implements Expression {

    private final Expression operand;

    /** 目标类型,如"DECIMAL(10, 2)" */
    private final String targetType;

    public CastExpression(Expression operand, String targetType) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        if (targetType == null || targetType.isEmpty()) {
            throw new IllegalArgumentException("Cast target type cannot be empty");
        }
        this.targetType = targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    public String getTargetType() {
        return targetType;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CAST;
    }

    @Override
    public String toSql() {
        return "CAST(" + operand.toSql() + " AS " + targetType + ")";
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
