package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.*;

/**
 * NodeClassifier - 表达式分类器
 *
 * 只根据节点自身的类型标签和运算符分类,从不分析SQL文本。
 * 无法识别的节点归为OPAQUE,不抛异常。
 *
 * 设计原则:
 * - 纯函数: 无状态,线程安全
 * - 穷举: switch带default分支,新增节点类型默认按OPAQUE处理
 */
public final class NodeClassifier {

    private NodeClassifier() {
    }

    /**
     * 获取表达式的语义类别
     *
     * @param expr 表达式
     * @return 语义类别,永不为null
     */
    public static SemanticKind classify(Expression expr) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        if (expr.getType() == null) {
            return SemanticKind.OPAQUE;
        }

        switch (expr.getType()) {
            case LITERAL:
                return expect(expr, LiteralExpression.class, SemanticKind.LITERAL);
            case COLUMN:
                return expect(expr, ColumnExpression.class, SemanticKind.COLUMN);
            case BINARY:
                return expr instanceof BinaryExpression
                        ? classifyBinary((BinaryExpression) expr)
                        : SemanticKind.OPAQUE;
            case NEGATE:
                return expect(expr, NegateExpression.class, SemanticKind.ARITHMETIC);
            case NOT:
                return expect(expr, NotExpression.class, SemanticKind.NOT);
            case IS_NULL:
                return expect(expr, IsNullExpression.class, SemanticKind.NULL_CHECK);
            case IN:
                return expect(expr, InExpression.class, SemanticKind.MEMBERSHIP);
            case LIKE:
                return expect(expr, LikeExpression.class, SemanticKind.PATTERN_MATCH);
            case BETWEEN:
                return expect(expr, BetweenExpression.class, SemanticKind.RANGE);
            case FUNCTION:
                return expect(expr, FunctionCallExpression.class, SemanticKind.FUNCTION_CALL);
            case TRIM:
                return expect(expr, TrimExpression.class, SemanticKind.TRIM);
            case WINDOW:
                return expect(expr, WindowExpression.class, SemanticKind.WINDOW_FUNCTION);
            case CAST:
                return expect(expr, CastExpression.class, SemanticKind.CAST);
            case CASE:
                return expect(expr, CaseWhenExpression.class, SemanticKind.CONDITIONAL);
            case ALIAS:
                return expect(expr, AliasExpression.class, SemanticKind.ALIAS);
            default:
                return SemanticKind.OPAQUE;
        }
    }

    /**
     * 类型标签与实现类不一致的节点(外部实现的Expression)按OPAQUE处理,
     * 保证调用方按类别做的强制转换一定成功
     */
    private static SemanticKind expect(Expression expr, Class<? extends Expression> type, SemanticKind kind) {
        return type.isInstance(expr) ? kind : SemanticKind.OPAQUE;
    }

    private static SemanticKind classifyBinary(BinaryExpression expr) {
        Operator op = expr.getOperator();
        if (op == Operator.AND) {
            return SemanticKind.AND;
        }
        if (op == Operator.OR) {
            return SemanticKind.OR;
        }
        if (op.isComparison()) {
            return SemanticKind.COMPARISON;
        }
        if (op.isArithmetic()) {
            return SemanticKind.ARITHMETIC;
        }
        return SemanticKind.OPAQUE;
    }
}
