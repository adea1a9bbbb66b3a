package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * BinaryExpression - 二元运算表达式
 *
 * 表示需要两个操作数的运算,包括:
 * - 算术运算: age + 1, price * quantity, first_name || last_name
 * - 比较运算: age > 18, name = 'John'
 * - 逻辑运算: age > 18 AND age < 65
 *
 * 设计原则:
 * - 不可变对象
 * - 左操作数、运算符、右操作数
 * - 支持嵌套: (age > 18) AND (name IS NOT NULL)
 */
public class BinaryExpression implements Expression {

    /** 左操作数 */
    private final Expression left;

    /** 运算符 */
    private final Operator operator;

    /** 右操作数 */
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left operand cannot be null");
        this.operator = Objects.requireNonNull(operator, "operator cannot be null");
        this.right = Objects.requireNonNull(right, "right operand cannot be null");
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    /**
     * 只在子表达式优先级更低时加括号,保证还原的SQL与原语义一致
     *
     * 不需要括号的左操作数沿左侧循环展开,很长的 a AND b AND c ... 链不会逐层递归。
     */
    @Override
    public String toSql() {
        Deque<BinaryExpression> chain = new ArrayDeque<>();
        BinaryExpression current = this;
        chain.push(current);
        while (current.left instanceof BinaryExpression
                && ((BinaryExpression) current.left).operator.getPrecedence() >= current.operator.getPrecedence()) {
            current = (BinaryExpression) current.left;
            chain.push(current);
        }

        StringBuilder sql = new StringBuilder(current.operand(current.left, false));
        while (!chain.isEmpty()) {
            BinaryExpression link = chain.pop();
            sql.append(' ').append(link.operator.getSymbol()).append(' ').append(link.operand(link.right, true));
        }
        return sql.toString();
    }

    private String operand(Expression child, boolean rightSide) {
        String sql = child.toSql();
        if (child instanceof BinaryExpression) {
            int childPrecedence = ((BinaryExpression) child).getOperator().getPrecedence();
            if (childPrecedence < operator.getPrecedence()
                    || (rightSide && childPrecedence == operator.getPrecedence())) {
                return "(" + sql + ")";
            }
        }
        return sql;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "Binary(" + toSql() + ")";
    }
}
