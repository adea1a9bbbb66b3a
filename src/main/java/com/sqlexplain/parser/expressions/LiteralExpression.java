package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;

/**
 * LiteralExpression - 字面量表达式
 *
 * 表示SQL中的字面量值,包括:
 * - 整数: 42, -100
 * - 小数: 3.14, 10.50
 * - 字符串: 'hello', 'it''s'
 * - 布尔值: TRUE, FALSE
 * - NULL值: NULL
 *
 * 设计原则:
 * - 不可变对象
 * - 同时保存值和源码文本: 解释输出使用源码文本(10.50不会变成10.5)
 * - NULL值用null表示
 */
public class LiteralExpression implements Expression {

    /** 字面量值(可能是Long, BigDecimal, String, Boolean, 或null) */
    private final Object value;

    /** 源码文本(字符串包含引号) */
    private final String sqlText;

    public LiteralExpression(Object value) {
        this(value, formatValue(value));
    }

    public LiteralExpression(Object value, String sqlText) {
        this.value = value;
        this.sqlText = sqlText != null ? sqlText : formatValue(value);
    }

    public Object getValue() {
        return value;
    }

    /**
     * 判断是否为NULL值
     */
    public boolean isNull() {
        return value == null;
    }

    /**
     * 判断是否为字符串字面量
     */
    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
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

    private static String formatValue(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "TRUE" : "FALSE";
        }
        return value.toString();
    }
}
