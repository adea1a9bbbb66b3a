package com.sqlexplain.parser;

import java.util.List;

/**
 * Statement - 解析结果接口
 *
 * 解析器的输入可以是完整的SELECT语句,也可以是单独的表达式(常见于
 * 从视图定义或ETL脚本中拷贝出来的派生列)。两者统一为Statement。
 *
 * 使用示例:
 * <pre>
 * Statement stmt = parser.parse("CASE WHEN age >= 18 THEN 'adult' END AS category");
 * for (Expression root : stmt.getRootExpressions()) {
 *     ...
 * }
 * </pre>
 */
public interface Statement {

    /**
     * 获取语句类型
     *
     * @return 语句类型枚举
     */
    StatementType getType();

    /**
     * 获取顶层表达式(按源码顺序)
     *
     * SELECT返回投影列表后接WHERE条件,单独表达式返回它自身。
     *
     * @return 不可变列表
     */
    List<Expression> getRootExpressions();

    /**
     * 语句类型枚举
     */
    enum StatementType {
        /** SELECT - 查询 */
        SELECT,
        /** 单独的表达式 */
        EXPRESSION
    }
}
