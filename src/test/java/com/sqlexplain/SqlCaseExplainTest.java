package com.sqlexplain;

import com.sqlexplain.explain.NoConditionalExpressionException;
import com.sqlexplain.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SqlCaseExplainTest - 命令行测试
 *
 * 测试内容:
 * - 参数、标准输入、文件三种输入方式
 * - 选项解析
 * - 退出码
 */
@DisplayName("命令行测试")
class SqlCaseExplainTest {

    private static final String CATEGORY_SQL = "CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return SqlCaseExplain.run(args, in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("translate返回报告文本")
    void testTranslate() {
        String text = SqlCaseExplain.translate(CATEGORY_SQL);

        assertTrue(text.startsWith("Column 'category' is computed as:"), text);
        assertTrue(text.endsWith("ELSE return 'minor'"), text);
        assertThrows(NoConditionalExpressionException.class, () -> SqlCaseExplain.translate("SELECT a FROM t"));
        assertThrows(ParseException.class, () -> SqlCaseExplain.translate("CASE WHEN THEN END"));
    }

    @Test
    @DisplayName("从参数读取SQL")
    void testArgument() {
        int code = run("", CATEGORY_SQL);

        assertEquals(SqlCaseExplain.EXIT_OK, code);
        assertEquals(SqlCaseExplain.translate(CATEGORY_SQL) + System.lineSeparator(), stdout());
        assertEquals("", stderr());
    }

    @Test
    @DisplayName("从标准输入读取SQL")
    void testStdin() {
        assertEquals(SqlCaseExplain.EXIT_OK, run(CATEGORY_SQL + ";\n"));
        assertTrue(stdout().startsWith("Column 'category' is computed as:"));
    }

    @Test
    @DisplayName("'-' 表示标准输入")
    void testDashMeansStdin() {
        assertEquals(SqlCaseExplain.EXIT_OK, run("CASE WHEN x IS NULL THEN 'unknown' END", "-"));
        assertTrue(stdout().contains("Condition 1.1: x is null"));
    }

    @Test
    @DisplayName("从文件读取SQL")
    void testFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("view.sql");
        Files.writeString(file, "-- grading view\nSELECT CASE WHEN score >= 90 THEN 'A' ELSE 'B' END AS grade\n"
                + "FROM exams;\n", StandardCharsets.UTF_8);

        assertEquals(SqlCaseExplain.EXIT_OK, run("", "-f", file.toString()));
        assertTrue(stdout().startsWith("Column 'grade' is computed as:"));
    }

    @Test
    @DisplayName("文件不存在")
    void testMissingFile(@TempDir Path dir) {
        assertEquals(SqlCaseExplain.EXIT_USAGE, run("", "-f", dir.resolve("missing.sql").toString()));
        assertTrue(stderr().startsWith("Cannot read input"));
    }

    @Test
    @DisplayName("--indent 与 --no-alias")
    void testOptions() {
        int code = run("", "--indent=2", "--no-alias", CATEGORY_SQL);

        assertEquals(SqlCaseExplain.EXIT_OK, code);
        assertTrue(stdout().startsWith("Computed column is derived as:"));
        assertTrue(stdout().contains("\n  Condition 1.1: age is greater than or equal to 18"));
    }

    @Test
    @DisplayName("没有CASE退出码为1")
    void testNoConditional() {
        assertEquals(SqlCaseExplain.EXIT_NO_CONDITIONAL, run("", "SELECT a FROM t"));
        assertEquals("", stdout());
        assertFalse(stderr().isEmpty());
    }

    @Test
    @DisplayName("语法错误退出码为2")
    void testSyntaxError() {
        assertEquals(SqlCaseExplain.EXIT_INVALID_INPUT, run("", "CASE WHEN a = THEN 1 END"));
        assertEquals("", stdout());
        assertTrue(stderr().contains("Syntax error"));
    }

    @Test
    @DisplayName("超过最大深度退出码为2")
    void testDepthExceeded() {
        assertEquals(SqlCaseExplain.EXIT_INVALID_INPUT,
                run("", "--max-depth=2", "CASE WHEN a = 1 AND (b = 2 OR c = 3) THEN 1 END"));
        assertTrue(stderr().contains("maximum depth of 2"));
    }

    @Test
    @DisplayName("参数错误退出码为64")
    void testUsageErrors() {
        assertEquals(SqlCaseExplain.EXIT_USAGE, run("", "--bogus", CATEGORY_SQL));
        assertEquals(SqlCaseExplain.EXIT_USAGE, run("", "--indent=abc", CATEGORY_SQL));
        assertEquals(SqlCaseExplain.EXIT_USAGE, run("", "--indent=0", CATEGORY_SQL));
        assertEquals(SqlCaseExplain.EXIT_USAGE, run("", CATEGORY_SQL, "extra"));
    }

    @Test
    @DisplayName("帮助信息")
    void testHelp() {
        assertEquals(SqlCaseExplain.EXIT_OK, run("", "--help"));
        assertTrue(stdout().startsWith("Usage:"));
    }

    @Test
    @DisplayName("两万项的 AND 条件逐项编号")
    void testWideCondition() {
        StringBuilder sql = new StringBuilder("CASE WHEN a0 = 0");
        for (int i = 1; i < 20_000; i++) {
            sql.append(" AND a").append(i).append(" = ").append(i);
        }
        sql.append(" THEN 1 END");

        assertEquals(SqlCaseExplain.EXIT_OK, run("", sql.toString()));
        assertTrue(stdout().contains("\tCondition 1.1: All of the following must be true:\n"));
        assertTrue(stdout().contains("\t\tCondition 1.1.20000: a19999 equals 19999\n"));
    }

    @Test
    @DisplayName("嵌套很深的括号退出码为2")
    void testDeeplyNestedInput() {
        String sql = "CASE WHEN " + "(".repeat(5_000) + "a = 1" + ")".repeat(5_000) + " THEN 1 END";

        assertEquals(SqlCaseExplain.EXIT_INVALID_INPUT, run("", sql));
        assertEquals("", stdout());
        assertFalse(stderr().isEmpty());
    }

    @Test
    @DisplayName("带引号的列名按源码输出")
    void testQuotedIdentifiers() {
        String text = SqlCaseExplain.translate("CASE WHEN \"first name\" = 'x' THEN \"order total\" END AS \"Label\"");

        assertTrue(text.startsWith("Column 'Label' is computed as:"), text);
        assertTrue(text.contains("\tCondition 1.1: \"first name\" equals 'x'\n"), text);
        assertTrue(text.endsWith("\tTHEN return \"order total\""), text);
    }
}
