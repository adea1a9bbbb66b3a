package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.SQLParser;
import com.sqlexplain.parser.expressions.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CaseExplainerTest - CASE报告测试
 *
 * 测试内容:
 * - 端到端的SQL → 报告
 * - 标题与别名
 * - 分支编号与ELSE
 * - 无CASE的错误
 * - 并发使用
 */
@DisplayName("CASE报告测试")
class CaseExplainerTest {

    private final SQLParser parser = new SQLParser();

    private final CaseExplainer explainer = new CaseExplainer();

    private String explain(String sql) {
        return explainer.explain(parser.parse(sql));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    // ==================== 端到端场景 ====================

    @Test
    @DisplayName("带别名和ELSE的单分支CASE")
    void testAliasWithElse() {
        String text = explain("CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category");

        assertEquals(lines(
                "Column 'category' is computed as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: age is greater than or equal to 18",
                "\tTHEN return 'adult'",
                "",
                "ELSE return 'minor'"), text);
    }

    @Test
    @DisplayName("AND条件展开,没有ELSE")
    void testAndWithoutElse() {
        String text = explain("CASE WHEN a > 0 AND b > 0 THEN 'pos' END");

        assertEquals(lines(
                "Computed column is derived as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: All of the following must be true:",
                "\t\tCondition 1.1.1: a is greater than 0",
                "\t\tCondition 1.1.2: b is greater than 0",
                "\tTHEN return 'pos'"), text);
    }

    @Test
    @DisplayName("LIKE '%smith%'")
    void testLikeSubstring() {
        String text = explain("CASE WHEN name LIKE '%smith%' THEN 1 END");

        assertTrue(text.contains("\tCondition 1.1: name contains 'smith' as a substring\n"), text);
        assertTrue(text.endsWith("\tTHEN return 1"), text);
    }

    @Test
    @DisplayName("IS NULL")
    void testIsNull() {
        String text = explain("CASE WHEN x IS NULL THEN 'unknown' END");

        assertTrue(text.contains("\tCondition 1.1: x is null\n"), text);
    }

    @Test
    @DisplayName("没有CASE时抛出异常")
    void testNoConditional() {
        assertThrows(NoConditionalExpressionException.class, () -> explain("SELECT a, b FROM t"));
        assertThrows(NoConditionalExpressionException.class, () -> explain("a + 1"));
        assertThrows(NoConditionalExpressionException.class,
                () -> explainer.explain(new ColumnExpression("a")));
    }

    @Test
    @DisplayName("AND中的OR作为一个子句")
    void testOrInsideAnd() {
        String text = explain("CASE WHEN a = 1 AND (b = 2 OR c = 3) THEN 'x' END");

        assertEquals(lines(
                "Computed column is derived as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: All of the following must be true:",
                "\t\tCondition 1.1.1: a equals 1",
                "\t\tCondition 1.1.2: At least one of the following must be true:",
                "\t\t\tCondition 1.1.2.1: b equals 2",
                "\t\t\tCondition 1.1.2.2: c equals 3",
                "\tTHEN return 'x'"), text);
    }

    // ==================== 分支与值 ====================

    @Test
    @DisplayName("多分支按源码顺序编号")
    void testMultipleBranches() {
        String text = explain("SELECT CASE WHEN score >= 90 THEN 'A' WHEN score >= 80 THEN 'B' "
                + "ELSE 'C' END AS grade FROM exams");

        assertEquals(lines(
                "Column 'grade' is computed as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: score is greater than or equal to 90",
                "\tTHEN return 'A'",
                "",
                "Condition 2: IF",
                "\tCondition 2.1: score is greater than or equal to 80",
                "\tTHEN return 'B'",
                "",
                "ELSE return 'C'"), text);
    }

    @Test
    @DisplayName("简单CASE按 equals 解释")
    void testSimpleCase() {
        String text = explain("CASE status WHEN 'A' THEN 'active' WHEN 'I' THEN 'inactive' END AS status_name");

        assertEquals(lines(
                "Column 'status_name' is computed as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: status equals 'A'",
                "\tTHEN return 'active'",
                "",
                "Condition 2: IF",
                "\tCondition 2.1: status equals 'I'",
                "\tTHEN return 'inactive'"), text);
    }

    @Test
    @DisplayName("分支值和ELSE经过值描述")
    void testRenderedValues() {
        String text = explain("CASE WHEN qty > 0 THEN price * qty ELSE NULL END AS total");

        assertTrue(text.contains("\tTHEN return price multiplied by qty\n"), text);
        assertTrue(text.endsWith("\nELSE return NULL"), text);
    }

    @Test
    @DisplayName("嵌套CASE作为值时输出占位描述")
    void testNestedCase() {
        String text = explain("CASE WHEN a = 1 THEN CASE WHEN b = 2 THEN 'x' END ELSE 'y' END AS v");

        assertTrue(text.contains("\tTHEN return " + ValueRenderer.NESTED_CASE_PHRASE + "\n"), text);
        assertFalse(text.contains("Condition 1.2"), text);
    }

    @Test
    @DisplayName("别名不直接包裹CASE时使用通用标题")
    void testAliasNotOnCase() {
        String text = explain("SELECT COALESCE(CASE WHEN a = 1 THEN 2 END, 0) AS category FROM t");

        assertTrue(text.startsWith(CaseExplainer.GENERIC_HEADER + "\n"), text);
    }

    // ==================== 配置 ====================

    @Test
    @DisplayName("关闭别名标题")
    void testNoAliasHeader() {
        CaseExplainer plain = new CaseExplainer(ExplainOptions.defaults().withAliasHeader(false));

        String text = plain.explain(parser.parse("CASE WHEN a = 1 THEN 2 END AS category"));

        assertTrue(text.startsWith("Computed column is derived as:\n"), text);
    }

    @Test
    @DisplayName("空格缩进")
    void testSpaceIndent() {
        CaseExplainer spaced = new CaseExplainer(ExplainOptions.defaults().withIndentSpaces(2));

        String text = spaced.explain(parser.parse("CASE WHEN a = 1 OR b = 2 THEN 'x' END"));

        assertEquals(lines(
                "Computed column is derived as:",
                "",
                "Condition 1: IF",
                "  Condition 1.1: At least one of the following must be true:",
                "    Condition 1.1.1: a equals 1",
                "    Condition 1.1.2: b equals 2",
                "  THEN return 'x'"), text);
    }

    @Test
    @DisplayName("条件嵌套超过最大深度")
    void testDepthExceeded() {
        CaseExplainer shallow = new CaseExplainer(ExplainOptions.defaults().withMaxDepth(3));

        assertThrows(ExplainDepthExceededException.class, () -> shallow.explain(parser.parse(
                "CASE WHEN a = 1 AND (b = 2 OR (c = 3 AND (d = 4 OR e = 5))) THEN 1 END")));
    }

    // ==================== 稳定性 ====================

    @Test
    @DisplayName("重复解释结果相同")
    void testIdempotent() {
        Expression root = parser.parse("CASE WHEN a = 1 AND (b IN (1, 2) OR c NOT LIKE '%z%') THEN 1 "
                + "WHEN d BETWEEN 1 AND 5 THEN 2 ELSE 3 END AS bucket").getRootExpressions().get(0);

        assertEquals(explainer.explain(root), explainer.explain(root));
    }

    @Test
    @DisplayName("同一实例并发使用")
    void testConcurrentUse() throws Exception {
        List<String> inputs = List.of(
                "CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category",
                "CASE WHEN a > 0 AND b > 0 THEN 'pos' END",
                "CASE WHEN a = 1 AND (b = 2 OR c = 3) THEN 'x' END",
                "CASE status WHEN 'A' THEN 'active' END AS s");
        List<String> expected = new ArrayList<>();
        for (String sql : inputs) {
            expected.add(explain(sql));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String sql = inputs.get(i % inputs.size());
                futures.add(executor.submit(() -> explain(sql)));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % inputs.size()), futures.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("直接解释CASE节点")
    void testExplainNode() {
        CaseWhenExpression conditional = new CaseWhenExpression(
                List.of(new WhenClause(
                        new BinaryExpression(new ColumnExpression("x"), Operator.LESS_THAN, new LiteralExpression(0L)),
                        new LiteralExpression("negative"))),
                new LiteralExpression("non-negative"));

        assertEquals(lines(
                "Column 'sign' is computed as:",
                "",
                "Condition 1: IF",
                "\tCondition 1.1: x is less than 0",
                "\tTHEN return 'negative'",
                "",
                "ELSE return 'non-negative'"), explainer.explain(conditional, "sign"));
    }
}
