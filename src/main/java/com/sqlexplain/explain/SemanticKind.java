package com.sqlexplain.explain;

/**
 * SemanticKind - 表达式的语义类别
 *
 * 解释器按语义类别选择描述模板。与Expression.ExpressionType不同,
 * 二元运算会被拆成算术、比较、AND、OR四类。
 */
public enum SemanticKind {
    /** 字面量 */
    LITERAL,
    /** 列引用 */
    COLUMN,
    /** 算术运算(含一元负号、字符串拼接) */
    ARITHMETIC,
    /** 比较运算 */
    COMPARISON,
    /** IS [NOT] NULL */
    NULL_CHECK,
    /** [NOT] IN */
    MEMBERSHIP,
    /** [NOT] LIKE */
    PATTERN_MATCH,
    /** [NOT] BETWEEN */
    RANGE,
    /** 逻辑与 */
    AND,
    /** 逻辑或 */
    OR,
    /** 逻辑非 */
    NOT,
    /** 函数调用 */
    FUNCTION_CALL,
    /** TRIM */
    TRIM,
    /** 窗口函数 */
    WINDOW_FUNCTION,
    /** 类型转换 */
    CAST,
    /** CASE WHEN */
    CONDITIONAL,
    /** 别名 */
    ALIAS,
    /** 没有专门模板,原样输出 */
    OPAQUE
}
