package com.sqlexplain.explain;

import com.sqlexplain.CommonConstant;

/**
 * ExplainOptions - 解释器配置
 *
 * 不可变对象,通过defaults()创建,通过with*方法派生新配置。
 *
 * 配置项:
 * - indentUnit: 每层嵌套的缩进(默认一个制表符)
 * - maxDepth: 最大嵌套深度(默认200)
 * - aliasHeader: 有别名时是否使用 "Column 'x' is computed as:" 标题(默认开启)
 *
 * 使用示例:
 * <pre>
 * ExplainOptions options = ExplainOptions.defaults()
 *     .withIndentSpaces(4)
 *     .withMaxDepth(64);
 * </pre>
 */
public final class ExplainOptions {

    private static final ExplainOptions DEFAULTS =
            new ExplainOptions(CommonConstant.DEFAULT_INDENT, CommonConstant.DEFAULT_MAX_DEPTH, true);

    private final String indentUnit;

    private final int maxDepth;

    private final boolean aliasHeader;

    private ExplainOptions(String indentUnit, int maxDepth, boolean aliasHeader) {
        this.indentUnit = indentUnit;
        this.maxDepth = maxDepth;
        this.aliasHeader = aliasHeader;
    }

    /**
     * 默认配置
     *
     * @return 制表符缩进、最大深度200、使用别名标题
     */
    public static ExplainOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 使用空格缩进
     *
     * @param spaces 每层空格数,必须大于0
     * @return 新配置
     */
    public ExplainOptions withIndentSpaces(int spaces) {
        if (spaces <= 0) {
            throw new IllegalArgumentException("Indent width must be positive: " + spaces);
        }
        return new ExplainOptions(" ".repeat(spaces), maxDepth, aliasHeader);
    }

    /**
     * 使用制表符缩进
     */
    public ExplainOptions withTabIndent() {
        return new ExplainOptions(CommonConstant.DEFAULT_INDENT, maxDepth, aliasHeader);
    }

    /**
     * 设置最大嵌套深度
     *
     * @param maxDepth 最大深度,必须大于0
     * @return 新配置
     */
    public ExplainOptions withMaxDepth(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
        }
        return new ExplainOptions(indentUnit, maxDepth, aliasHeader);
    }

    public ExplainOptions withAliasHeader(boolean aliasHeader) {
        return new ExplainOptions(indentUnit, maxDepth, aliasHeader);
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isAliasHeader() {
        return aliasHeader;
    }

    /**
     * 生成指定层级的缩进
     *
     * @param level 层级(0表示不缩进)
     * @return 缩进字符串
     */
    public String indent(int level) {
        return indentUnit.repeat(Math.max(0, level));
    }

    @Override
    public String toString() {
        return "ExplainOptions{" +
                "indentUnit='" + indentUnit.replace("\t", "\\t") + '\'' +
                ", maxDepth=" + maxDepth +
                ", aliasHeader=" + aliasHeader +
                '}';
    }
}
