package com.sqlexplain.explain;

/**
 * ExplainDepthExceededException - 表达式嵌套过深
 *
 * 嵌套深度超过ExplainOptions.getMaxDepth()时抛出,整个解释失败,不输出残缺的结果。
 */
public class ExplainDepthExceededException extends RuntimeException {

    private final int maxDepth;

    public ExplainDepthExceededException(int maxDepth) {
        super("Expression nesting exceeds the maximum depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
