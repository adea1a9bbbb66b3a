package com.sqlexplain.explain;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * ConditionPath - 条件编号
 *
 * 表示子句在布尔表达式树中的位置,如[2, 1, 3]表示第2个分支条件下
 * 第1个操作数的第3个操作数,显示为"2.1.3"。
 *
 * 设计原则:
 * - 不可变: child()返回新对象,递归时作为参数传递,没有共享计数器
 * - 只由结构决定: 编号与子句文本无关,同一棵树重复解释得到相同编号
 */
public final class ConditionPath {

    private final int[] segments;

    private ConditionPath(int[] segments) {
        this.segments = segments;
    }

    /**
     * 创建编号
     *
     * @param segments 各级序号,都必须为正数
     * @return 编号
     */
    public static ConditionPath of(int... segments) {
        if (segments == null || segments.length == 0) {
            throw new IllegalArgumentException("Condition path cannot be empty");
        }
        for (int segment : segments) {
            checkSegment(segment);
        }
        return new ConditionPath(segments.clone());
    }

    /**
     * 第index个子句的编号
     *
     * @param index 从1开始的序号
     * @return 新编号
     */
    public ConditionPath child(int index) {
        checkSegment(index);
        int[] next = Arrays.copyOf(segments, segments.length + 1);
        next[segments.length] = index;
        return new ConditionPath(next);
    }

    public int depth() {
        return segments.length;
    }

    public int segment(int position) {
        return segments[position];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConditionPath)) {
            return false;
        }
        return Arrays.equals(segments, ((ConditionPath) o).segments);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(segments);
    }

    @Override
    public String toString() {
        return Arrays.stream(segments)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining("."));
    }

    private static void checkSegment(int segment) {
        if (segment <= 0) {
            throw new IllegalArgumentException("Condition path segments must be positive: " + segment);
        }
    }
}
