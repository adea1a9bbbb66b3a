package com.sqlexplain.parser;

import java.util.List;

/**
 * Expression - SQL表达式接口
 *
 * 表示SQL中的各种表达式,包括:
 * - 列引用: id, name, users.age
 * - 字面量: 42, 'hello', TRUE, NULL
 * - 二元运算: age > 18, price * quantity, a AND b
 * - 谓词: x IS NULL, x IN (1, 2), name LIKE '%smith%'
 * - 函数与窗口函数: COALESCE(a, b), SUM(x) OVER (PARTITION BY y)
 * - 条件表达式: CASE WHEN ... THEN ... ELSE ... END
 *
 * 设计原则:
 * - "Good taste": 所有表达式都是Expression,通过getType()分发,消除instanceof链
 * - 不可变: 解析器创建后,解释器只读不写
 * - 可组合: getChildren()按源码顺序返回子表达式,便于统一遍历
 *
 * 使用示例:
 * <pre>
 * Expression expr = new BinaryExpression(
 *     new ColumnExpression("age"),
 *     Operator.GREATER_EQUAL,
 *     new LiteralExpression(18)
 * );
 * expr.toSql(); // "age >= 18"
 * </pre>
 */
public interface Expression {

    /**
     * 获取表达式类型
     *
     * @return 表达式类型枚举
     */
    ExpressionType getType();

    /**
     * 还原为SQL文本
     *
     * 无法用自然语言描述的表达式按此文本原样输出。
     *
     * @return SQL文本
     */
    String toSql();

    /**
     * 获取直接子表达式(按源码从左到右的顺序)
     *
     * @return 不可变列表,叶子节点返回空列表
     */
    List<Expression> getChildren();

    /**
     * SQL表达式类型枚举
     */
    enum ExpressionType {
        /** 列引用 */
        COLUMN,
        /** 字面量 */
        LITERAL,
        /** 二元运算(算术、比较、逻辑) */
        BINARY,
        /** NOT运算 */
        NOT,
        /** 一元负号 */
        NEGATE,
        /** IS [NOT] NULL */
        IS_NULL,
        /** [NOT] IN (...) */
        IN,
        /** [NOT] LIKE */
        LIKE,
        /** [NOT] BETWEEN ... AND ... */
        BETWEEN,
        /** 函数调用 */
        FUNCTION,
        /** TRIM([LEADING|TRAILING|BOTH] ... FROM ...) */
        TRIM,
        /** CAST(... AS ...) */
        CAST,
        /** 窗口函数 */
        WINDOW,
        /** CASE WHEN */
        CASE,
        /** 别名 expr AS name */
        ALIAS,
        /** 无法识别的结构,保留原文 */
        RAW
    }
}
