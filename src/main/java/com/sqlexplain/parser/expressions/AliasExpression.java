package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Objects;

/**
 * AliasExpression - 带别名的投影项
 *
 * 表示 expr AS name(AS可省略)。
 */
public class AliasExpression implements Expression {

    private final Expression child;

    private final String alias;

    public AliasExpression(Expression child, String alias) {
        this.child = Objects.requireNonNull(child, "aliased expression cannot be null");
        if (alias == null || alias.isEmpty()) {
            throw new IllegalArgumentException("Alias cannot be empty");
        }
        this.alias = alias;
    }

    public Expression getChild() {
        return child;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ALIAS;
    }

    @Override
    public String toSql() {
        return child.toSql() + " AS " + alias;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(child);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
