package com.sqlexplain.explain;

import com.sqlexplain.CommonConstant;
import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.Statement;
import com.sqlexplain.parser.expressions.BinaryExpression;
import com.sqlexplain.parser.expressions.CaseWhenExpression;
import com.sqlexplain.parser.expressions.Operator;
import com.sqlexplain.parser.expressions.WhenClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CaseExplainer - 把CASE表达式解释为完整的英文报告
 *
 * 输出格式:
 * <pre>
 * Column 'category' is computed as:
 *
 * Condition 1: IF
 *     Condition 1.1: age is greater than or equal to 18
 *     THEN return 'adult'
 *
 * ELSE return 'minor'
 * </pre>
 *
 * 分支严格按源码顺序输出(第一个成立的分支生效),第i个分支的条件编号从i.1开始。
 * 没有别名时标题为 "Computed column is derived as:";没有ELSE时不输出ELSE行。
 * 简单CASE(CASE x WHEN v ...)的条件按 "x equals v" 解释。
 *
 * 设计原则:
 * - 输入中没有CASE时抛NoConditionalExpressionException,不返回原始文本
 * - 无状态: 同一实例可以并发使用,相同输入输出完全相同
 *
 * 使用示例:
 * <pre>
 * CaseExplainer explainer = new CaseExplainer();
 * String text = explainer.explain(new SQLParser().parse(sql));
 * </pre>
 */
public class CaseExplainer {

    private static final Logger logger = LoggerFactory.getLogger(CaseExplainer.class);

    static final String ALIAS_HEADER = "Column '%s' is computed as:";

    static final String GENERIC_HEADER = "Computed column is derived as:";

    private final ExplainOptions options;

    private final ValueRenderer valueRenderer;

    private final PredicateExplainer predicateExplainer;

    public CaseExplainer() {
        this(ExplainOptions.defaults());
    }

    public CaseExplainer(ExplainOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.valueRenderer = new ValueRenderer(options);
        this.predicateExplainer = new PredicateExplainer(valueRenderer, options);
    }

    /**
     * 解释语句中的第一个CASE
     *
     * @param statement 解析结果
     * @return 报告文本
     * @throws NoConditionalExpressionException 语句中没有CASE
     */
    public String explain(Statement statement) {
        ConditionalLocator.LocatedConditional located = ConditionalLocator.locate(statement)
                .orElseThrow(() -> new NoConditionalExpressionException(
                        "No CASE WHEN expression found in " + statement.getType() + " statement"));
        return explain(located.getConditional(), located.getAlias().orElse(null));
    }

    /**
     * 解释表达式树中的第一个CASE
     *
     * @param root 表达式树根节点,可以是带别名的CASE
     * @return 报告文本
     * @throws NoConditionalExpressionException 表达式中没有CASE
     */
    public String explain(Expression root) {
        ConditionalLocator.LocatedConditional located = ConditionalLocator.locate(root)
                .orElseThrow(() -> new NoConditionalExpressionException(
                        "No CASE WHEN expression found in: " + root.toSql()));
        return explain(located.getConditional(), located.getAlias().orElse(null));
    }

    /**
     * 解释CASE表达式
     *
     * @param conditional CASE表达式
     * @param alias 列别名,可以为null
     * @return 报告文本
     */
    public String explain(CaseWhenExpression conditional, String alias) {
        if (conditional == null) {
            throw new NoConditionalExpressionException("No CASE WHEN expression to explain");
        }

        logger.debug("解释CASE表达式: 分支数={}, 别名={}", conditional.getBranches().size(), alias);

        List<String> lines = new ArrayList<>();
        lines.add(header(alias));
        lines.add("");

        Optional<Expression> operand = conditional.getOperand();
        List<WhenClause> branches = conditional.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            WhenClause branch = branches.get(i);
            int number = i + 1;

            Expression condition = operand
                    .<Expression>map(subject -> new BinaryExpression(subject, Operator.EQUAL, branch.getCondition()))
                    .orElse(branch.getCondition());

            lines.add(CommonConstant.CONDITION_LABEL + number + ": IF");
            lines.add(predicateExplainer.explain(condition, 1, ConditionPath.of(number, 1)));
            lines.add(options.indent(1) + "THEN return " + valueRenderer.render(branch.getResult()));
            lines.add("");
        }

        Optional<Expression> elseBranch = conditional.getElseBranch();
        if (elseBranch.isPresent()) {
            lines.add("ELSE return " + valueRenderer.render(elseBranch.get()));
        } else {
            // 没有ELSE时去掉最后一个分支后的空行
            lines.remove(lines.size() - 1);
        }

        return String.join("\n", lines);
    }

    private String header(String alias) {
        if (alias != null && options.isAliasHeader()) {
            return String.format(ALIAS_HEADER, alias);
        }
        return GENERIC_HEADER;
    }
}
