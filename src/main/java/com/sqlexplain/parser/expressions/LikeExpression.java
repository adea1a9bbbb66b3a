package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * LikeExpression - 模式匹配
 *
 * 表示 x LIKE pattern 和 x NOT LIKE pattern。
 * pattern通常是字符串字面量,但也允许是任意表达式(如列引用)。
 */
public class LikeExpression implements Expression {

    private final Expression operand;

    private final Expression pattern;

    private final boolean negated;

    public LikeExpression(Expression operand, Expression pattern, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand cannot be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public Expression getPattern() {
        return pattern;
    }

    /**
     * 获取字面量模式串(不含引号)
     *
     * @return 模式串,如果pattern不是字符串字面量则返回null
     */
    public String getPatternText() {
        if (pattern instanceof LiteralExpression && ((LiteralExpression) pattern).isString()) {
            return (String) ((LiteralExpression) pattern).getValue();
        }
        return null;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LIKE;
    }

    @Override
    public String toSql() {
        return operand.toSql() + (negated ? " NOT LIKE " : " LIKE ") + pattern.toSql();
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(operand, pattern);
    }

    @Override
    public String toString() {
        return "(" + toSql() + ")";
    }
}
