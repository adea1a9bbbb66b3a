package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * FunctionCallExpression - 函数调用
 *
 * 表示标量函数和聚合函数调用,包括:
 * - 标量函数: UPPER(name), COALESCE(a, b, 0), ROUND(price, 2)
 * - 聚合函数: SUM(amount), COUNT(*), COUNT(DISTINCT id)
 *
 * 设计原则:
 * - 不可变对象
 * - 函数名保留源码写法,getNormalizedName()用于分发
 */
public class FunctionCallExpression implements Expression {

    /** 函数名(源码写法) */
    private final String name;

    /** 参数列表 */
    private final List<Expression> arguments;

    /** 是否带DISTINCT */
    private final boolean distinct;

    /** 是否为 f(*) */
    private final boolean star;

    public FunctionCallExpression(String name, List<Expression> arguments) {
        this(name, arguments, false, false);
    }

    public FunctionCallExpression(String name, List<Expression> arguments, boolean distinct, boolean star) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be empty");
        }
        this.name = name;
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
        this.distinct = distinct;
        this.star = star;
    }

    public String getName() {
        return name;
    }

    /**
     * 获取大写函数名
     *
     * @return 如"COALESCE"
     */
    public String getNormalizedName() {
        return name.toUpperCase(Locale.ROOT);
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isStar() {
        return star;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.FUNCTION;
    }

    @Override
    public String toSql() {
        if (star) {
            return name + "(*)";
        }
        String args = arguments.stream().map(Expression::toSql).collect(Collectors.joining(", "));
        return name + "(" + (distinct ? "DISTINCT " : "") + args + ")";
    }

    @Override
    public List<Expression> getChildren() {
        return arguments;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
