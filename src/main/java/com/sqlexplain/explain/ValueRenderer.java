package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ValueRenderer - 把值表达式描述为英文名词短语
 *
 * 递归描述表达式计算出的值,支持:
 * - 列引用、字面量: 原样输出 → amount, 'adult'
 * - 算术: a + b → "a plus b"
 * - 函数: COALESCE(a, b) → "the first non-null value among (a, b)"
 * - TRIM、CAST、窗口函数、嵌套CASE
 *
 * 没有模板的表达式(比较、未知函数、RawExpression等)原样输出SQL文本,不抛异常。
 *
 * 设计原则:
 * - 全函数: 任何输入都有输出
 * - 无状态: 可以多线程共享一个实例
 * - 深度保护: 嵌套超过maxDepth时抛ExplainDepthExceededException
 *
 * 使用示例:
 * <pre>
 * ValueRenderer renderer = new ValueRenderer(ExplainOptions.defaults());
 * renderer.render(new BinaryExpression(
 *     new ColumnExpression("price"), Operator.MULTIPLY, new ColumnExpression("qty")));
 * // "price multiplied by qty"
 * </pre>
 */
public class ValueRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ValueRenderer.class);

    /** 嵌套CASE作为值时的描述 */
    static final String NESTED_CASE_PHRASE = "a conditional value (CASE expression)";

    private static final Map<Operator, String> ARITHMETIC_PHRASES = new EnumMap<>(Operator.class);

    static {
        ARITHMETIC_PHRASES.put(Operator.ADD, "plus");
        ARITHMETIC_PHRASES.put(Operator.SUBTRACT, "minus");
        ARITHMETIC_PHRASES.put(Operator.MULTIPLY, "multiplied by");
        ARITHMETIC_PHRASES.put(Operator.DIVIDE, "divided by");
        ARITHMETIC_PHRASES.put(Operator.MODULO, "modulo");
        ARITHMETIC_PHRASES.put(Operator.CONCAT, "concatenated with");
    }

    private final ExplainOptions options;

    public ValueRenderer() {
        this(ExplainOptions.defaults());
    }

    public ValueRenderer(ExplainOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /**
     * 描述表达式的值
     *
     * @param expr 表达式
     * @return 英文短语
     * @throws ExplainDepthExceededException 嵌套过深
     */
    public String render(Expression expr) {
        return render(expr, 0);
    }

    private String render(Expression expr, int depth) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        if (depth > options.getMaxDepth()) {
            throw new ExplainDepthExceededException(options.getMaxDepth());
        }

        switch (NodeClassifier.classify(expr)) {
            case LITERAL:
            case COLUMN:
                return expr.toSql();

            case ARITHMETIC:
                return renderArithmetic(expr, depth);

            case FUNCTION_CALL:
                return renderFunction((FunctionCallExpression) expr, depth);

            case TRIM:
                return renderTrim((TrimExpression) expr, depth);

            case CAST: {
                CastExpression cast = (CastExpression) expr;
                return render(cast.getOperand(), depth + 1) + " cast to " + cast.getTargetType();
            }

            case WINDOW_FUNCTION:
                return renderWindow((WindowExpression) expr, depth);

            case CONDITIONAL:
                return NESTED_CASE_PHRASE;

            case ALIAS:
                return render(((AliasExpression) expr).getChild(), depth + 1);

            default:
                return verbatim(expr);
        }
    }

    // ==================== 算术 ====================

    /**
     * 左结合的算术链(a + b - c ...)沿左侧循环展开,链长不增加递归深度
     */
    private String renderArithmetic(Expression expr, int depth) {
        if (expr instanceof NegateExpression) {
            return "negative " + render(((NegateExpression) expr).getOperand(), depth + 1);
        }

        Deque<BinaryExpression> chain = new ArrayDeque<>();
        Expression current = expr;
        while (current instanceof BinaryExpression && ARITHMETIC_PHRASES.containsKey(((BinaryExpression) current).getOperator())) {
            chain.push((BinaryExpression) current);
            current = ((BinaryExpression) current).getLeft();
        }
        if (chain.isEmpty()) {
            return verbatim(expr);
        }

        StringBuilder text = new StringBuilder(render(current, depth + 1));
        while (!chain.isEmpty()) {
            BinaryExpression link = chain.pop();
            text.append(' ').append(ARITHMETIC_PHRASES.get(link.getOperator()))
                    .append(' ').append(render(link.getRight(), depth + 1));
        }
        return text.toString();
    }

    // ==================== 函数 ====================

    private String renderFunction(FunctionCallExpression function, int depth) {
        if (function.isStar()) {
            if ("COUNT".equals(function.getNormalizedName())) {
                return "the number of rows";
            }
            return verbatim(function);
        }

        List<Expression> args = function.getArguments();
        int argc = args.size();

        switch (function.getNormalizedName()) {
            case "UPPER":
            case "UCASE":
                return argc == 1 ? "the upper case of " + render(args.get(0), depth + 1) : verbatim(function);

            case "LOWER":
            case "LCASE":
                return argc == 1 ? "the lower case of " + render(args.get(0), depth + 1) : verbatim(function);

            case "COALESCE":
            case "IFNULL":
            case "NVL":
                return argc >= 1 ? "the first non-null value among (" + renderList(args, depth) + ")" : verbatim(function);

            case "GREATEST":
                return argc >= 1 ? "the greatest value among (" + renderList(args, depth) + ")" : verbatim(function);

            case "LEAST":
                return argc >= 1 ? "the least value among (" + renderList(args, depth) + ")" : verbatim(function);

            case "ROUND":
                if (argc == 1) {
                    return render(args.get(0), depth + 1) + " rounded";
                }
                if (argc == 2) {
                    return render(args.get(0), depth + 1) + " rounded to "
                            + render(args.get(1), depth + 1) + " decimal places";
                }
                return verbatim(function);

            case "ABS":
                return argc == 1 ? "the absolute value of " + render(args.get(0), depth + 1) : verbatim(function);

            case "LENGTH":
            case "LEN":
            case "CHAR_LENGTH":
                return argc == 1 ? "the length of " + render(args.get(0), depth + 1) : verbatim(function);

            case "CONCAT":
                return argc >= 1 ? "the concatenation of (" + renderList(args, depth) + ")" : verbatim(function);

            case "SUM":
                return aggregate("the sum of ", function, depth);
            case "AVG":
                return aggregate("the average of ", function, depth);
            case "MIN":
                return aggregate("the minimum of ", function, depth);
            case "MAX":
                return aggregate("the maximum of ", function, depth);
            case "COUNT":
                return aggregate("the number of ", function, depth);

            default:
                return verbatim(function);
        }
    }

    /**
     * 聚合函数: 单参数 "the sum of x",多参数 "the sum of (a, b)"
     */
    private String aggregate(String phrase, FunctionCallExpression function, int depth) {
        List<Expression> args = function.getArguments();
        if (args.isEmpty()) {
            return verbatim(function);
        }
        String distinct = function.isDistinct() ? "distinct " : "";
        if (args.size() == 1) {
            return phrase + distinct + render(args.get(0), depth + 1);
        }
        return phrase + distinct + "(" + renderList(args, depth) + ")";
    }

    private String renderTrim(TrimExpression trim, int depth) {
        String target = render(trim.getTarget(), depth + 1);
        String removed = trim.getCharacters() == null
                ? "whitespace"
                : render(trim.getCharacters(), depth + 1) + " characters";

        switch (trim.getSide()) {
            case LEADING:
                return target + " with leading " + removed + " removed";
            case TRAILING:
                return target + " with trailing " + removed + " removed";
            default:
                return target + " with leading and trailing " + removed + " removed";
        }
    }

    /**
     * 窗口函数: "SUM of amount (partitioned by region, ordered by day descending)"
     */
    private String renderWindow(WindowExpression window, int depth) {
        FunctionCallExpression function = window.getFunction();

        StringBuilder text = new StringBuilder(function.getName());
        if (function.isStar()) {
            text.append(" of all rows");
        } else if (!function.getArguments().isEmpty()) {
            text.append(" of ").append(renderList(function.getArguments(), depth));
        }

        List<String> clauses = new ArrayList<>(2);
        if (!window.getPartitionBy().isEmpty()) {
            clauses.add("partitioned by " + renderList(window.getPartitionBy(), depth));
        }
        if (!window.getOrderBy().isEmpty()) {
            clauses.add("ordered by " + window.getOrderBy().stream()
                    .map(item -> render(item.getExpression(), depth + 1) + (item.isDescending() ? " descending" : ""))
                    .collect(Collectors.joining(", ")));
        }
        if (!clauses.isEmpty()) {
            text.append(" (").append(String.join(", ", clauses)).append(")");
        }
        return text.toString();
    }

    // ==================== 辅助方法 ====================

    private String renderList(List<Expression> exprs, int depth) {
        return exprs.stream()
                .map(e -> render(e, depth + 1))
                .collect(Collectors.joining(", "));
    }

    private String verbatim(Expression expr) {
        String sql = expr.toSql();
        logger.debug("没有描述模板,原样输出: {}", sql);
        return sql;
    }
}
