package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.BinaryExpression;
import com.sqlexplain.parser.expressions.Operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * BooleanFlattener - 展开同类逻辑运算链
 *
 * 把 a AND (b AND c) AND d 这样的链展开为 [a, b, c, d]。
 * 只展开与目标运算符相同的节点: a AND (b OR c) 展开为 [a, (b OR c)]。
 *
 * 设计原则:
 * - 保持源码从左到右的顺序,编号依赖这个顺序
 * - 显式栈代替递归,左深或右深的超长链都不会栈溢出
 */
public final class BooleanFlattener {

    private BooleanFlattener() {
    }

    /**
     * 展开逻辑运算链
     *
     * @param node 表达式
     * @param connective AND或OR
     * @return 操作数列表,node本身不是该运算时返回[node]
     */
    public static List<Expression> flatten(Expression node, Operator connective) {
        if (node == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        if (connective != Operator.AND && connective != Operator.OR) {
            throw new IllegalArgumentException("Only AND/OR chains can be flattened: " + connective);
        }

        List<Expression> operands = new ArrayList<>();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(node);

        while (!pending.isEmpty()) {
            Expression current = pending.pop();
            if (isConnective(current, connective)) {
                BinaryExpression binary = (BinaryExpression) current;
                // 先压右边,保证左边先出栈
                pending.push(binary.getRight());
                pending.push(binary.getLeft());
            } else {
                operands.add(current);
            }
        }
        return operands;
    }

    private static boolean isConnective(Expression expr, Operator connective) {
        return expr instanceof BinaryExpression
                && ((BinaryExpression) expr).getOperator() == connective;
    }
}
