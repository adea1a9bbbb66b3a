package com.sqlexplain.parser.statements;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SelectStatement - SELECT查询语句
 *
 * 派生列通常定义在视图或查询的投影列表中。
 *
 * 语法示例:
 * <pre>
 * SELECT id, CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category FROM users;
 * </pre>
 *
 * 设计原则:
 * - 只保留投影列表、表名和WHERE条件,其他子句与解释无关
 */
public class SelectStatement implements Statement {

    /** SELECT列表 */
    private final List<Expression> selectItems;

    /** 表名(可能没有FROM子句) */
    private final String tableName;

    /** WHERE条件(如果没有WHERE子句则为空) */
    private final Expression whereClause;

    public SelectStatement(List<Expression> selectItems, String tableName, Expression whereClause) {
        this.selectItems = selectItems != null ? List.copyOf(selectItems) : List.of();
        this.tableName = tableName;
        this.whereClause = whereClause;
    }

    public List<Expression> getSelectItems() {
        return selectItems;
    }

    public Optional<String> getTableName() {
        return Optional.ofNullable(tableName);
    }

    public Optional<Expression> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    @Override
    public StatementType getType() {
        return StatementType.SELECT;
    }

    @Override
    public List<Expression> getRootExpressions() {
        if (whereClause == null) {
            return selectItems;
        }
        List<Expression> roots = new ArrayList<>(selectItems);
        roots.add(whereClause);
        return List.copyOf(roots);
    }

    @Override
    public String toString() {
        return "SelectStatement{" +
                "selectItems=" + selectItems +
                ", tableName='" + tableName + '\'' +
                ", whereClause=" + whereClause +
                '}';
    }
}
