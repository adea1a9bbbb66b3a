package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;

/**
 * RawExpression - 原样保留的表达式
 *
 * 用于没有专门结构的语法,解释时按源码文本原样输出。
 */
public class RawExpression implements Expression {

    private final String sqlText;

    public RawExpression(String sqlText) {
        if (sqlText == null) {
            throw new IllegalArgumentException("SQL text cannot be null");
        }
        this.sqlText = sqlText;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.RAW;
    }

    @Override
    public String toSql() {
        return sqlText;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return sqlText;
    }
}
