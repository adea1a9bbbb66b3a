package com.sqlexplain;

/**
 * 全局常量
 */
public final class CommonConstant {

    private CommonConstant() {
    }

    /** 默认缩进: 每层一个制表符 */
    public static final String DEFAULT_INDENT = "\t";

    /** 默认最大嵌套深度,超过则拒绝解释,避免栈溢出 */
    public static final int DEFAULT_MAX_DEPTH = 200;

    /** 解析时表达式的最大嵌套层数(括号、函数参数、NOT等),同类二元运算链不计入 */
    public static final int MAX_PARSE_DEPTH = 1000;

    /** 分支条件编号标签 */
    public static final String CONDITION_LABEL = "Condition ";
}
