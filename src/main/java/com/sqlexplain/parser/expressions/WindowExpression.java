package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * WindowExpression - 窗口函数
 *
 * 表示 f(args) OVER (PARTITION BY ... ORDER BY ...),两个子句都是可选的。
 *
 * 语法示例:
 * <pre>
 * ROW_NUMBER() OVER (PARTITION BY dept ORDER BY salary DESC)
 * SUM(amount) OVER (PARTITION BY customer_id)
 * </pre>
 */
public class WindowExpression implements Expression {

    private final FunctionCallExpression function;

    private final List<Expression> partitionBy;

    private final List<OrderItem> orderBy;

    public WindowExpression(FunctionCallExpression function, List<Expression> partitionBy, List<OrderItem> orderBy) {
        this.function = Objects.requireNonNull(function, "window function cannot be null");
        this.partitionBy = partitionBy != null ? List.copyOf(partitionBy) : List.of();
        this.orderBy = orderBy != null ? List.copyOf(orderBy) : List.of();
    }

    public FunctionCallExpression getFunction() {
        return function;
    }

    public List<Expression> getPartitionBy() {
        return partitionBy;
    }

    public List<OrderItem> getOrderBy() {
        return orderBy;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.WINDOW;
    }

    @Override
    public String toSql() {
        List<String> clauses = new ArrayList<>(2);
        if (!partitionBy.isEmpty()) {
            clauses.add("PARTITION BY " + partitionBy.stream()
                    .map(Expression::toSql)
                    .collect(Collectors.joining(", ")));
        }
        if (!orderBy.isEmpty()) {
            clauses.add("ORDER BY " + orderBy.stream()
                    .map(OrderItem::toSql)
                    .collect(Collectors.joining(", ")));
        }
        return function.toSql() + " OVER (" + String.join(" ", clauses) + ")";
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>();
        children.add(function);
        children.addAll(partitionBy);
        for (OrderItem item : orderBy) {
            children.add(item.getExpression());
        }
        return List.copyOf(children);
    }

    @Override
    public String toString() {
        return toSql();
    }

    /**
     * ORDER BY中的一项
     */
    public static class OrderItem {

        private final Expression expression;

        private final boolean descending;

        public OrderItem(Expression expression, boolean descending) {
            this.expression = Objects.requireNonNull(expression, "order expression cannot be null");
            this.descending = descending;
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isDescending() {
            return descending;
        }

        public String toSql() {
            return expression.toSql() + (descending ? " DESC" : "");
        }

        @Override
        public String toString() {
            return toSql();
        }
    }
}
