package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.Statement;
import com.sqlexplain.parser.expressions.AliasExpression;
import com.sqlexplain.parser.expressions.CaseWhenExpression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * ConditionalLocator - 在表达式树中查找要解释的CASE
 *
 * 按深度优先、从左到右的顺序返回第一个CASE。
 * 别名只取直接包裹这个CASE的AliasExpression,不做任何文本匹配:
 * - CASE ... END AS category → 别名category
 * - COALESCE(CASE ... END, 0) AS category → 没有别名
 */
public final class ConditionalLocator {

    private ConditionalLocator() {
    }

    /**
     * 在语句中查找
     *
     * @param statement 解析结果
     * @return 找到的CASE及其别名
     */
    public static Optional<LocatedConditional> locate(Statement statement) {
        if (statement == null) {
            throw new IllegalArgumentException("Statement cannot be null");
        }
        return locate(statement.getRootExpressions());
    }

    /**
     * 在表达式中查找
     *
     * @param root 表达式树根节点
     * @return 找到的CASE及其别名
     */
    public static Optional<LocatedConditional> locate(Expression root) {
        if (root == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        return locate(List.of(root));
    }

    private static Optional<LocatedConditional> locate(List<Expression> roots) {
        Deque<Expression> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }

        while (!pending.isEmpty()) {
            Expression current = pending.pop();

            if (current instanceof AliasExpression) {
                AliasExpression alias = (AliasExpression) current;
                if (alias.getChild() instanceof CaseWhenExpression) {
                    return Optional.of(new LocatedConditional((CaseWhenExpression) alias.getChild(), alias.getAlias()));
                }
            }
            if (current instanceof CaseWhenExpression) {
                return Optional.of(new LocatedConditional((CaseWhenExpression) current, null));
            }

            List<Expression> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * 查找结果: CASE表达式和它的别名
     */
    public static final class LocatedConditional {

        private final CaseWhenExpression conditional;

        private final String alias;

        public LocatedConditional(CaseWhenExpression conditional, String alias) {
            this.conditional = conditional;
            this.alias = alias;
        }

        public CaseWhenExpression getConditional() {
            return conditional;
        }

        public Optional<String> getAlias() {
            return Optional.ofNullable(alias);
        }
    }
}
