package com.sqlexplain;

import com.sqlexplain.explain.CaseExplainer;
import com.sqlexplain.explain.ExplainDepthExceededException;
import com.sqlexplain.explain.ExplainOptions;
import com.sqlexplain.explain.NoConditionalExpressionException;
import com.sqlexplain.parser.ParseException;
import com.sqlexplain.parser.SQLParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * SQL CASE Explainer - 命令行入口
 *
 * 读取一段SQL(CASE表达式或包含CASE的SELECT),输出英文解释。
 *
 * 用法:
 * <pre>
 * sql-case-explain [options] "CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category"
 * sql-case-explain [options] -f view.sql
 * cat view.sql | sql-case-explain [options]
 *
 * options:
 *   --indent=N      每层缩进N个空格(默认制表符)
 *   --max-depth=N   最大嵌套深度(默认200)
 *   --no-alias      不使用别名标题
 * </pre>
 *
 * 退出码: 0成功, 1没有CASE, 2语法错误或嵌套过深, 64参数错误
 */
public class SqlCaseExplain {

    private static final Logger logger = LoggerFactory.getLogger(SqlCaseExplain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_CONDITIONAL = 1;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_USAGE = 64;

    private static final String USAGE =
            "Usage: sql-case-explain [--indent=N] [--max-depth=N] [--no-alias] [-f FILE | SQL]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * 解析SQL并解释其中的CASE(默认配置)
     *
     * @param sql SQL文本
     * @return 报告文本
     * @throws ParseException SQL语法错误
     * @throws NoConditionalExpressionException 没有CASE
     */
    public static String translate(String sql) {
        return translate(sql, ExplainOptions.defaults());
    }

    public static String translate(String sql, ExplainOptions options) {
        return new CaseExplainer(options).explain(new SQLParser().parse(sql));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        ExplainOptions options = ExplainOptions.defaults();
        String file = null;
        String sql = null;

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--indent=")) {
                    options = options.withIndentSpaces(parseNumber(arg, "--indent="));
                } else if (arg.startsWith("--max-depth=")) {
                    options = options.withMaxDepth(parseNumber(arg, "--max-depth="));
                } else if ("--no-alias".equals(arg)) {
                    options = options.withAliasHeader(false);
                } else if ("-f".equals(arg) && i + 1 < args.length) {
                    file = args[++i];
                } else if ("-h".equals(arg) || "--help".equals(arg)) {
                    out.println(USAGE);
                    return EXIT_OK;
                } else if (arg.startsWith("-") && !"-".equals(arg)) {
                    err.println("Unknown option: " + arg);
                    err.println(USAGE);
                    return EXIT_USAGE;
                } else if (sql == null) {
                    sql = arg;
                } else {
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (file != null && sql != null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        logger.debug("解释配置: {}", options);

        try {
            if (file != null) {
                sql = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            } else if (sql == null || "-".equals(sql)) {
                sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            logger.error("读取输入失败: {}", file != null ? file : "stdin", e);
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            out.println(translate(sql, options));
            return EXIT_OK;
        } catch (NoConditionalExpressionException e) {
            err.println(e.getMessage());
            return EXIT_NO_CONDITIONAL;
        } catch (ParseException | ExplainDepthExceededException e) {
            err.println(e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    private static int parseNumber(String arg, String prefix) {
        String value = arg.substring(prefix.length());
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + arg, e);
        }
    }
}
