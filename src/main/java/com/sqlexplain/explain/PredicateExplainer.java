package com.sqlexplain.explain;

import com.sqlexplain.CommonConstant;
import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * PredicateExplainer - 把布尔条件解释为带编号的英文子句
 *
 * 每个子句一行,格式为 "缩进 + Condition 编号: 描述"。
 * AND/OR先展开为平铺列表,再逐个递归,子句编号为父编号加序号:
 * <pre>
 * Condition 1.1: All of the following must be true:
 *     Condition 1.1.1: a is greater than 0
 *     Condition 1.1.2: At least one of the following must be true:
 *         Condition 1.1.2.1: b equals 2
 *         Condition 1.1.2.2: c equals 3
 * </pre>
 *
 * NOT包裹的IS NULL、IN、LIKE、BETWEEN、比较运算直接输出否定形式
 * ("is not null", "is not one of", "does not contain"...),
 * 其他NOT输出 "NOT 条件": NOT active;内层是二元运算时加括号,NOT (a = 1 AND b = 2)。
 * 无法识别的条件交给ValueRenderer。
 *
 * 设计原则:
 * - 编号只由树结构决定,与子句内容无关
 * - 无状态: 编号作为参数传递,可以多线程共享一个实例
 */
public class PredicateExplainer {

    static final String ALL_OF = "All of the following must be true:";

    static final String ANY_OF = "At least one of the following must be true:";

    private static final Map<Operator, String> COMPARISON_PHRASES = new EnumMap<>(Operator.class);

    private static final Map<Operator, String> NEGATED_COMPARISON_PHRASES = new EnumMap<>(Operator.class);

    static {
        COMPARISON_PHRASES.put(Operator.EQUAL, "equals");
        COMPARISON_PHRASES.put(Operator.NOT_EQUAL, "is not equal to");
        COMPARISON_PHRASES.put(Operator.LESS_THAN, "is less than");
        COMPARISON_PHRASES.put(Operator.LESS_EQUAL, "is less than or equal to");
        COMPARISON_PHRASES.put(Operator.GREATER_THAN, "is greater than");
        COMPARISON_PHRASES.put(Operator.GREATER_EQUAL, "is greater than or equal to");

        NEGATED_COMPARISON_PHRASES.put(Operator.EQUAL, "is not equal to");
        NEGATED_COMPARISON_PHRASES.put(Operator.NOT_EQUAL, "equals");
        NEGATED_COMPARISON_PHRASES.put(Operator.LESS_THAN, "is not less than");
        NEGATED_COMPARISON_PHRASES.put(Operator.LESS_EQUAL, "is not less than or equal to");
        NEGATED_COMPARISON_PHRASES.put(Operator.GREATER_THAN, "is not greater than");
        NEGATED_COMPARISON_PHRASES.put(Operator.GREATER_EQUAL, "is not greater than or equal to");
    }

    private final ValueRenderer valueRenderer;

    private final ExplainOptions options;

    public PredicateExplainer(ValueRenderer valueRenderer, ExplainOptions options) {
        this.valueRenderer = Objects.requireNonNull(valueRenderer, "valueRenderer cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /**
     * 解释布尔条件
     *
     * @param condition 条件表达式
     * @param level 缩进层级
     * @param path 当前子句编号
     * @return 多行文本,不以换行结尾
     * @throws ExplainDepthExceededException 嵌套过深
     */
    public String explain(Expression condition, int level, ConditionPath path) {
        if (condition == null) {
            throw new IllegalArgumentException("Condition cannot be null");
        }
        Objects.requireNonNull(path, "path cannot be null");
        if (path.depth() > options.getMaxDepth()) {
            throw new ExplainDepthExceededException(options.getMaxDepth());
        }

        String prefix = options.indent(level) + CommonConstant.CONDITION_LABEL + path + ": ";

        switch (NodeClassifier.classify(condition)) {
            case AND:
                return explainConnective(condition, Operator.AND, ALL_OF, prefix, level, path);
            case OR:
                return explainConnective(condition, Operator.OR, ANY_OF, prefix, level, path);
            case NOT:
                return prefix + describeNot((NotExpression) condition);
            case ALIAS:
                return explain(((AliasExpression) condition).getChild(), level, path);
            default:
                return prefix + describe(condition, false);
        }
    }

    private String explainConnective(Expression condition, Operator connective, String header,
                                     String prefix, int level, ConditionPath path) {
        List<Expression> operands = BooleanFlattener.flatten(condition, connective);

        StringBuilder text = new StringBuilder(prefix).append(header);
        for (int i = 0; i < operands.size(); i++) {
            text.append('\n').append(explain(operands.get(i), level + 1, path.child(i + 1)));
        }
        return text.toString();
    }

    /**
     * NOT包裹可直接否定的谓词时输出否定形式,否则输出 "NOT 条件"
     */
    private String describeNot(NotExpression not) {
        Expression inner = not.getOperand();
        switch (NodeClassifier.classify(inner)) {
            case NULL_CHECK:
            case MEMBERSHIP:
            case PATTERN_MATCH:
            case RANGE:
            case COMPARISON:
                return describe(inner, true);
            default:
                // 去掉括号后 NOT a = 1 AND b = 2 的含义会变
                return inner instanceof BinaryExpression
                        ? "NOT (" + inner.toSql() + ")"
                        : "NOT " + inner.toSql();
        }
    }

    /**
     * 描述单个谓词
     *
     * @param condition 谓词
     * @param negate 是否在谓词本身的否定之上再取反(NOT包裹)
     * @return 不带编号的描述
     */
    private String describe(Expression condition, boolean negate) {
        switch (NodeClassifier.classify(condition)) {
            case NULL_CHECK: {
                IsNullExpression isNull = (IsNullExpression) condition;
                boolean notNull = isNull.isNegated() != negate;
                return value(isNull.getOperand()) + (notNull ? " is not null" : " is null");
            }

            case MEMBERSHIP: {
                InExpression in = (InExpression) condition;
                boolean notIn = in.isNegated() != negate;
                String values = in.getValues().stream()
                        .map(Expression::toSql)
                        .collect(Collectors.joining(", "));
                return value(in.getOperand()) + (notIn ? " is not one of (" : " is one of (") + values + ")";
            }

            case PATTERN_MATCH:
                return describeLike((LikeExpression) condition, negate);

            case RANGE: {
                BetweenExpression between = (BetweenExpression) condition;
                boolean notBetween = between.isNegated() != negate;
                return value(between.getOperand()) + (notBetween ? " is not between " : " is between ")
                        + value(between.getLower()) + " and " + value(between.getUpper());
            }

            case COMPARISON: {
                BinaryExpression comparison = (BinaryExpression) condition;
                Map<Operator, String> phrases = negate ? NEGATED_COMPARISON_PHRASES : COMPARISON_PHRASES;
                return value(comparison.getLeft()) + " " + phrases.get(comparison.getOperator())
                        + " " + value(comparison.getRight());
            }

            default:
                return value(condition);
        }
    }

    /**
     * LIKE: '%text%'(text中没有通配符)描述为子串包含,其他模式原样输出
     */
    private String describeLike(LikeExpression like, boolean negate) {
        boolean notLike = like.isNegated() != negate;
        String operand = value(like.getOperand());
        String pattern = like.getPatternText();

        if (pattern == null) {
            return operand + (notLike ? " does not match the pattern given by " : " matches the pattern given by ")
                    + value(like.getPattern());
        }

        String substring = substringOf(pattern);
        if (substring != null) {
            return operand + (notLike ? " does not contain '" : " contains '") + substring + "' as a substring";
        }
        return operand + (notLike ? " does not match the pattern '" : " matches the pattern '") + pattern + "'";
    }

    /**
     * 判断模式是否为 %text% 形式
     *
     * @param pattern LIKE模式
     * @return text,不是该形式时返回null
     */
    static String substringOf(String pattern) {
        if (pattern.length() < 3 || !pattern.startsWith("%") || !pattern.endsWith("%")) {
            return null;
        }
        String inner = pattern.substring(1, pattern.length() - 1);
        if (inner.indexOf('%') >= 0 || inner.indexOf('_') >= 0) {
            return null;
        }
        return inner;
    }

    private String value(Expression expr) {
        return valueRenderer.render(expr);
    }
}
