package com.sqlexplain.explain;

/**
 * 输入中没有CASE WHEN表达式
 */
public class NoConditionalExpressionException extends RuntimeException {

    public NoConditionalExpressionException(String message) {
        super(message);
    }
}
