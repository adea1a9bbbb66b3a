package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;

/**
 * ColumnExpression - 列引用
 *
 * 由点号分隔的标识符链组成,最后一段是列名,前面是限定名:
 * <pre>
 * age              → name=age
 * orders.amount    → qualifier=orders, name=amount
 * app.orders.id    → qualifier=app.orders, name=id
 * </pre>
 * parts中的名称已去掉引号;toSql输出源码写法,引号原样保留:
 * "first name" 的列名是 first name,toSql仍是 "first name"。
 */
public class ColumnExpression implements Expression {

    private final List<String> parts;

    /** 源码文本 */
    private final String sqlText;

    public ColumnExpression(String name) {
        this(List.of(name));
    }

    public ColumnExpression(List<String> parts) {
        this(parts, null);
    }

    /**
     * @param parts 去掉引号后的各段名称
     * @param sqlText 源码文本,为null时按点号拼接parts
     */
    public ColumnExpression(List<String> parts, String sqlText) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Column reference cannot be empty");
        }
        this.parts = List.copyOf(parts);
        this.sqlText = sqlText != null ? sqlText : String.join(".", this.parts);
    }

    /** 不带限定名的列名 */
    public String getColumnName() {
        return parts.get(parts.size() - 1);
    }

    /**
     * 限定名(表名,或schema.表名)
     *
     * @return 限定名,没有时返回null
     */
    public String getQualifier() {
        if (parts.size() == 1) {
            return null;
        }
        return String.join(".", parts.subList(0, parts.size() - 1));
    }

    public List<String> getParts() {
        return parts;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.COLUMN;
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
        return "Column(" + toSql() + ")";
    }
}
