package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CaseWhenExpression - CASE条件表达式
 *
 * 按顺序判断每个WHEN条件,返回第一个成立的分支的THEN值;
 * 都不成立时返回ELSE值,没有ELSE则为NULL。
 *
 * 语法示例:
 * <pre>
 * CASE
 *     WHEN age >= 18 THEN 'adult'
 *     WHEN age >= 13 THEN 'teen'
 *     ELSE 'child'
 * END
 *
 * CASE status WHEN 'A' THEN 'active' WHEN 'D' THEN 'deleted' END
 * </pre>
 *
 * 设计原则:
 * - 不可变对象
 * - 分支保持源码顺序,顺序就是"先匹配先生效"的语义
 */
public class CaseWhenExpression implements Expression {

    /** 简单CASE的比较对象,搜索型CASE为null */
    private final Expression operand;

    /** WHEN分支 */
    private final List<WhenClause> branches;

    /** ELSE值,没有ELSE则为null */
    private final Expression elseBranch;

    public CaseWhenExpression(List<WhenClause> branches, Expression elseBranch) {
        this(null, branches, elseBranch);
    }

    public CaseWhenExpression(Expression operand, List<WhenClause> branches, Expression elseBranch) {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN branch");
        }
        this.operand = operand;
        this.branches = List.copyOf(branches);
        this.elseBranch = elseBranch;
    }

    public Optional<Expression> getOperand() {
        return Optional.ofNullable(operand);
    }

    public List<WhenClause> getBranches() {
        return branches;
    }

    public Optional<Expression> getElseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CASE;
    }

    @Override
    public String toSql() {
        StringBuilder sql = new StringBuilder("CASE");
        if (operand != null) {
            sql.append(' ').append(operand.toSql());
        }
        for (WhenClause branch : branches) {
            sql.append(' ').append(branch.toSql());
        }
        if (elseBranch != null) {
            sql.append(" ELSE ").append(elseBranch.toSql());
        }
        return sql.append(" END").toString();
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>(branches.size() * 2 + 2);
        if (operand != null) {
            children.add(operand);
        }
        for (WhenClause branch : branches) {
            children.add(branch.getCondition());
            children.add(branch.getResult());
        }
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return List.copyOf(children);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
