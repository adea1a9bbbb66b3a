package com.sqlexplain.parser.statements;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.Statement;

import java.util.List;
import java.util.Objects;

/**
 * ExpressionStatement - 单独的表达式
 *
 * 语法示例:
 * <pre>
 * CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category
 * </pre>
 */
public class ExpressionStatement implements Statement {

    private final Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression cannot be null");
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementType getType() {
        return StatementType.EXPRESSION;
    }

    @Override
    public List<Expression> getRootExpressions() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return "ExpressionStatement{" + expression + '}';
    }
}
