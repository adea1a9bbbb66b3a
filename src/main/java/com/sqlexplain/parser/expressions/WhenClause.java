package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.Objects;

/**
 * WhenClause - CASE中的一个分支
 *
 * WHEN condition THEN result。简单CASE(CASE x WHEN 1 THEN ...)中condition是被比较的值。
 */
public class WhenClause {

    private final Expression condition;

    private final Expression result;

    public WhenClause(Expression condition, Expression result) {
        this.condition = Objects.requireNonNull(condition, "WHEN condition cannot be null");
        this.result = Objects.requireNonNull(result, "THEN result cannot be null");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getResult() {
        return result;
    }

    public String toSql() {
        return "WHEN " + condition.toSql() + " THEN " + result.toSql();
    }

    @Override
    public String toString() {
        return toSql();
    }
}
