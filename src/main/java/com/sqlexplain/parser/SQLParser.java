package com.sqlexplain.parser;

import com.sqlexplain.CommonConstant;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * SQLParser - CASE表达式所在SQL的解析入口
 *
 * 接受两种输入,末尾分号可有可无:
 * <pre>
 * CASE WHEN age >= 18 THEN 'adult' ELSE 'minor' END AS category
 * SELECT id, CASE status WHEN 'A' THEN 'active' END AS s FROM users WHERE id > 0
 * </pre>
 * 前者得到ExpressionStatement,后者得到SelectStatement。
 *
 * 词法和语法错误全部收集后一次性抛出,每条一行:
 * "Syntax error at line 1:10 - mismatched input ..."
 *
 * 每次parse都新建lexer和parser,同一实例可以多线程共享。
 *
 * 嵌套层数超过maxDepth,或者嵌套深到ANTLR自身耗尽调用栈时,同样抛出ParseException。
 * a AND b AND c ... 这样的同类运算链按循环构建,长度不受限制。
 */
public class SQLParser {

    private static final Logger logger = LoggerFactory.getLogger(SQLParser.class);

    private final int maxDepth;

    public SQLParser() {
        this(CommonConstant.MAX_PARSE_DEPTH);
    }

    /**
     * @param maxDepth 表达式最大嵌套层数
     */
    public SQLParser(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * 解析SQL
     *
     * @param sql SELECT语句或单个表达式
     * @return 语句
     * @throws ParseException 输入为空或有语法错误
     */
    public Statement parse(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new ParseException("SQL input cannot be null or empty");
        }

        logger.debug("解析SQL: {}", sql);

        try {
            SyntaxErrors errors = new SyntaxErrors();
            CaseSqlParser.SqlInputContext tree = buildParseTree(sql, errors);
            if (!errors.isEmpty()) {
                logger.debug("语法错误: {}", errors);
                throw new ParseException(errors.toString());
            }
            return new ASTBuilder(maxDepth).visitSqlInput(tree);
        } catch (ParseException e) {
            throw e;
        } catch (StackOverflowError e) {
            logger.warn("SQL嵌套过深,解析时栈溢出: 长度={}", sql.length());
            throw new ParseException("Expression is nested too deeply to parse", e);
        } catch (RuntimeException e) {
            throw new ParseException("Failed to parse SQL: " + e.getMessage(), e);
        }
    }

    private static CaseSqlParser.SqlInputContext buildParseTree(String sql, SyntaxErrors errors) {
        CaseSqlLexer lexer = new CaseSqlLexer(CharStreams.fromString(sql));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CaseSqlParser parser = new CaseSqlParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        return parser.sqlInput();
    }

    /**
     * 收集lexer和parser报告的错误,替代默认打印到stderr的监听器
     */
    private static final class SyntaxErrors extends BaseErrorListener {

        private final List<String> messages = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            messages.add("Syntax error at line " + line + ":" + charPositionInLine + " - " + msg);
        }

        boolean isEmpty() {
            return messages.isEmpty();
        }

        @Override
        public String toString() {
            return String.join("\n", messages);
        }
    }
}
