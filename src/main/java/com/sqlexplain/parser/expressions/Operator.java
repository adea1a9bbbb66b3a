package com.sqlexplain.parser.expressions;

/**
 * Operator - 二元运算符
 *
 * 定义SQL中支持的二元运算符,按类别分为算术、比较、逻辑三类。
 */
public enum Operator {

    /** 等于 */
    EQUAL("=", 2, Category.COMPARISON),
    /** 不等于 */
    NOT_EQUAL("<>", 2, Category.COMPARISON),
    /** 大于 */
    GREATER_THAN(">", 2, Category.COMPARISON),
    /** 小于 */
    LESS_THAN("<", 2, Category.COMPARISON),
    /** 大于等于 */
    GREATER_EQUAL(">=", 2, Category.COMPARISON),
    /** 小于等于 */
    LESS_EQUAL("<=", 2, Category.COMPARISON),
    /** 加法 */
    ADD("+", 3, Category.ARITHMETIC),
    /** 减法 */
    SUBTRACT("-", 3, Category.ARITHMETIC),
    /** 字符串拼接 */
    CONCAT("||", 3, Category.ARITHMETIC),
    /** 乘法 */
    MULTIPLY("*", 4, Category.ARITHMETIC),
    /** 除法 */
    DIVIDE("/", 4, Category.ARITHMETIC),
    /** 取模 */
    MODULO("%", 4, Category.ARITHMETIC),
    /** 逻辑与 */
    AND("AND", 1, Category.LOGICAL),
    /** 逻辑或 */
    OR("OR", 0, Category.LOGICAL);

    /** 运算符字符串表示 */
    private final String symbol;

    /** 优先级(数值越大优先级越高) */
    private final int precedence;

    private final Category category;

    Operator(String symbol, int precedence, Category category) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }

    /**
     * 根据符号获取运算符
     *
     * "!=" 和 "==" 分别视为 "<>" 和 "=" 的别名,关键字不区分大小写。
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        if ("!=".equals(symbol)) {
            return NOT_EQUAL;
        }
        if ("==".equals(symbol)) {
            return EQUAL;
        }
        for (Operator op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * 运算符类别
     */
    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }
}
