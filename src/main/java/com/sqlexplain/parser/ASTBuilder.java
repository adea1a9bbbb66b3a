package com.sqlexplain.parser;

import com.sqlexplain.CommonConstant;
import com.sqlexplain.parser.expressions.*;
import com.sqlexplain.parser.statements.ExpressionStatement;
import com.sqlexplain.parser.statements.SelectStatement;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * ASTBuilder - 将ANTLR语法树转换为Expression对象
 *
 * 使用访问者模式遍历ANTLR生成的语法树,将其转换为强类型的Expression对象。
 *
 * 设计原则:
 * - "Good taste": 每个visit方法只做一件事,清晰明了
 * - 消除特殊情况: 括号直接剥掉,LTRIM/RTRIM统一成TrimExpression
 * - 类型安全: 将ANTLR的弱类型语法树转换为强类型对象
 *
 * 错误处理:
 * - 如果遇到不支持的语法,抛出ParseException
 * - 表达式嵌套超过maxDepth层时抛出ParseException
 *
 * 有状态(记录当前嵌套层数),每次解析使用新实例。
 */
public class ASTBuilder extends CaseSqlBaseVisitor<Object> {

    /** 表达式最大嵌套层数,超过时抛ParseException */
    private final int maxDepth;

    /** 当前嵌套层数 */
    private int depth;

    public ASTBuilder() {
        this(CommonConstant.MAX_PARSE_DEPTH);
    }

    public ASTBuilder(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public Statement visitSqlInput(CaseSqlParser.SqlInputContext ctx) {
        if (ctx.selectStatement() != null) {
            return visitSelectStatement(ctx.selectStatement());
        }
        return new ExpressionStatement(visitSelectItem(ctx.selectItem()));
    }

    // ==================== SELECT ====================

    @Override
    public SelectStatement visitSelectStatement(CaseSqlParser.SelectStatementContext ctx) {
        List<Expression> selectItems = new ArrayList<>();
        for (CaseSqlParser.SelectItemContext itemCtx : ctx.selectItem()) {
            selectItems.add(visitSelectItem(itemCtx));
        }

        String tableName = null;
        if (ctx.tableName != null) {
            tableName = String.join(".", visitQualifiedName(ctx.tableName));
        }

        // 解析WHERE条件(如果有)
        Expression whereClause = null;
        if (ctx.whereExpr != null) {
            whereClause = expr(ctx.whereExpr);
        }

        return new SelectStatement(selectItems, tableName, whereClause);
    }

    @Override
    public Expression visitSelectItem(CaseSqlParser.SelectItemContext ctx) {
        Expression expression = expr(ctx.expression());
        if (ctx.alias != null) {
            return new AliasExpression(expression, visitIdentifier(ctx.alias));
        }
        return expression;
    }

    // ==================== 表达式 ====================

    @Override
    public Expression visitParenthesisExpr(CaseSqlParser.ParenthesisExprContext ctx) {
        return expr(ctx.expression());
    }

    @Override
    public Expression visitCaseExpr(CaseSqlParser.CaseExprContext ctx) {
        return visitCaseExpression(ctx.caseExpression());
    }

    @Override
    public CaseWhenExpression visitCaseExpression(CaseSqlParser.CaseExpressionContext ctx) {
        Expression operand = ctx.operand != null ? expr(ctx.operand) : null;

        List<WhenClause> branches = new ArrayList<>();
        for (CaseSqlParser.WhenClauseContext whenCtx : ctx.whenClause()) {
            branches.add(visitWhenClause(whenCtx));
        }

        Expression elseBranch = ctx.elseExpr != null ? expr(ctx.elseExpr) : null;
        return new CaseWhenExpression(operand, branches, elseBranch);
    }

    @Override
    public WhenClause visitWhenClause(CaseSqlParser.WhenClauseContext ctx) {
        return new WhenClause(expr(ctx.condition), expr(ctx.result));
    }

    @Override
    public Expression visitCastExpr(CaseSqlParser.CastExprContext ctx) {
        return new CastExpression(expr(ctx.expression()), visitDataType(ctx.dataType()));
    }

    @Override
    public Expression visitPgCastExpr(CaseSqlParser.PgCastExprContext ctx) {
        return new CastExpression(expr(ctx.expression()), visitDataType(ctx.dataType()));
    }

    @Override
    public Expression visitTrimExpr(CaseSqlParser.TrimExprContext ctx) {
        TrimExpression.Side side = TrimExpression.Side.BOTH;
        if (ctx.side != null) {
            side = TrimExpression.Side.valueOf(ctx.side.getText().toUpperCase(Locale.ROOT));
        }
        Expression characters = ctx.chars != null ? expr(ctx.chars) : null;
        return new TrimExpression(side, characters, expr(ctx.target));
    }

    @Override
    public Expression visitWindowExpr(CaseSqlParser.WindowExprContext ctx) {
        FunctionCallExpression function = visitFunctionCall(ctx.functionCall());
        CaseSqlParser.OverClauseContext over = ctx.overClause();

        List<Expression> partitionBy = new ArrayList<>();
        for (CaseSqlParser.ExpressionContext exprCtx : over.expression()) {
            partitionBy.add(expr(exprCtx));
        }

        List<WindowExpression.OrderItem> orderBy = new ArrayList<>();
        for (CaseSqlParser.OrderItemContext itemCtx : over.orderItem()) {
            orderBy.add(new WindowExpression.OrderItem(expr(itemCtx.expression()), itemCtx.DESC() != null));
        }

        return new WindowExpression(function, partitionBy, orderBy);
    }

    @Override
    public Expression visitFunctionExpr(CaseSqlParser.FunctionExprContext ctx) {
        FunctionCallExpression function = visitFunctionCall(ctx.functionCall());

        // LTRIM(x) / RTRIM(x) 与 TRIM(LEADING/TRAILING FROM x) 等价
        if (function.getArgumentCount() == 1 && !function.isDistinct()) {
            String name = function.getNormalizedName();
            if ("LTRIM".equals(name)) {
                return new TrimExpression(TrimExpression.Side.LEADING, null, function.getArguments().get(0));
            }
            if ("RTRIM".equals(name)) {
                return new TrimExpression(TrimExpression.Side.TRAILING, null, function.getArguments().get(0));
            }
        }
        return function;
    }

    @Override
    public FunctionCallExpression visitFunctionCall(CaseSqlParser.FunctionCallContext ctx) {
        String name = visitIdentifier(ctx.name);
        if (ctx.STAR() != null) {
            return new FunctionCallExpression(name, List.of(), false, true);
        }

        List<Expression> arguments = new ArrayList<>();
        for (CaseSqlParser.ExpressionContext exprCtx : ctx.expression()) {
            arguments.add(expr(exprCtx));
        }
        return new FunctionCallExpression(name, arguments, ctx.DISTINCT() != null, false);
    }

    @Override
    public Expression visitLiteralExpr(CaseSqlParser.LiteralExprContext ctx) {
        return visitLiteral(ctx.literal());
    }

    @Override
    public Expression visitColumnExpr(CaseSqlParser.ColumnExprContext ctx) {
        // 名称去掉引号,toSql保留源码写法("first name", `order`)
        return column(ctx.qualifiedName());
    }

    @Override
    public Expression visitUnaryExpr(CaseSqlParser.UnaryExprContext ctx) {
        Expression operand = expr(ctx.expression());
        if (ctx.op.getType() == CaseSqlParser.PLUS) {
            return operand;
        }
        return negate(operand);
    }

    @Override
    public Expression visitMultiplicativeExpr(CaseSqlParser.MultiplicativeExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitAdditiveExpr(CaseSqlParser.AdditiveExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitConcatExpr(CaseSqlParser.ConcatExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitComparisonExpr(CaseSqlParser.ComparisonExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitAndExpr(CaseSqlParser.AndExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitOrExpr(CaseSqlParser.OrExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Expression visitNotExpr(CaseSqlParser.NotExprContext ctx) {
        return new NotExpression(expr(ctx.expression()));
    }

    @Override
    public Expression visitIsNullExpr(CaseSqlParser.IsNullExprContext ctx) {
        return new IsNullExpression(expr(ctx.expression()), ctx.NOT() != null);
    }

    @Override
    public Expression visitInExpr(CaseSqlParser.InExprContext ctx) {
        List<CaseSqlParser.ExpressionContext> exprs = ctx.expression();
        Expression operand = expr(exprs.get(0));

        List<Expression> values = new ArrayList<>();
        for (int i = 1; i < exprs.size(); i++) {
            values.add(expr(exprs.get(i)));
        }
        return new InExpression(operand, values, ctx.NOT() != null);
    }

    @Override
    public Expression visitLikeExpr(CaseSqlParser.LikeExprContext ctx) {
        return new LikeExpression(expr(ctx.expression(0)), expr(ctx.expression(1)), ctx.NOT() != null);
    }

    @Override
    public Expression visitBetweenExpr(CaseSqlParser.BetweenExprContext ctx) {
        return new BetweenExpression(
                expr(ctx.expression()),
                visitBetweenBound(ctx.lower),
                visitBetweenBound(ctx.upper),
                ctx.NOT() != null);
    }

    @Override
    public Expression visitBetweenBound(CaseSqlParser.BetweenBoundContext ctx) {
        if (ctx.literal() != null) {
            Expression literal = visitLiteral(ctx.literal());
            return ctx.MINUS() != null ? negate(literal) : literal;
        }
        if (ctx.functionCall() != null) {
            return visitFunctionCall(ctx.functionCall());
        }
        if (ctx.qualifiedName() != null) {
            return column(ctx.qualifiedName());
        }
        return expr(ctx.expression());
    }

    // ==================== 字面量 ====================

    @Override
    public Expression visitLiteral(CaseSqlParser.LiteralContext ctx) {
        String text = ctx.getText();
        if (ctx.INTEGER_LITERAL() != null) {
            return new LiteralExpression(parseInteger(text), text);
        } else if (ctx.DECIMAL_LITERAL() != null) {
            return new LiteralExpression(new BigDecimal(text), text);
        } else if (ctx.STRING_LITERAL() != null) {
            // 去除单引号,处理双单引号转义
            String value = text.substring(1, text.length() - 1).replace("''", "'");
            return new LiteralExpression(value, text);
        } else if (ctx.BOOLEAN_LITERAL() != null) {
            return new LiteralExpression("TRUE".equalsIgnoreCase(text), text);
        } else if (ctx.NULL_() != null) {
            return new LiteralExpression(null, text);
        } else {
            throw new ParseException("Unknown literal: " + text);
        }
    }

    // ==================== 类型与标识符 ====================

    @Override
    public String visitDataType(CaseSqlParser.DataTypeContext ctx) {
        String typeName = visitIdentifier(ctx.identifier());
        List<TerminalNode> params = ctx.INTEGER_LITERAL();
        if (params.isEmpty()) {
            return typeName;
        }
        return typeName + "(" + params.stream()
                .map(TerminalNode::getText)
                .collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public List<String> visitQualifiedName(CaseSqlParser.QualifiedNameContext ctx) {
        List<String> parts = new ArrayList<>();
        for (CaseSqlParser.IdentifierContext identCtx : ctx.identifier()) {
            parts.add(visitIdentifier(identCtx));
        }
        return parts;
    }

    @Override
    public String visitIdentifier(CaseSqlParser.IdentifierContext ctx) {
        String text = ctx.getText();
        if (ctx.QUOTED_IDENTIFIER() != null) {
            return text.substring(1, text.length() - 1).replace("\"\"", "\"");
        }
        if (ctx.BACKTICK_IDENTIFIER() != null) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    // ==================== 辅助方法 ====================

    private Expression expr(CaseSqlParser.ExpressionContext ctx) {
        if (++depth > maxDepth) {
            throw new ParseException("Expression nesting exceeds the maximum depth of " + maxDepth);
        }
        try {
            return (Expression) visit(ctx);
        } finally {
            depth--;
        }
    }

    /**
     * 构建左结合的二元运算链
     *
     * a AND b AND c 在语法树中是向左嵌套的同类节点,逐层递归访问会随项数加深调用栈。
     * 这里沿左侧循环下行收集同类节点,再从最内层开始向外组装BinaryExpression,
     * 调用栈深度与链长无关。
     */
    private Expression binaryChain(CaseSqlParser.ExpressionContext ctx) {
        Deque<CaseSqlParser.ExpressionContext> chain = new ArrayDeque<>();
        CaseSqlParser.ExpressionContext current = ctx;
        while (current.getClass() == ctx.getClass()) {
            chain.push(current);
            current = current.getRuleContext(CaseSqlParser.ExpressionContext.class, 0);
        }

        Expression result = expr(current);
        while (!chain.isEmpty()) {
            CaseSqlParser.ExpressionContext link = chain.pop();
            // 二元运算的子节点固定为: 左操作数, 运算符, 右操作数
            String symbol = link.getChild(1).getText();
            Operator operator = Operator.fromSymbol(symbol);
            if (operator == null) {
                throw new ParseException("Unknown operator: " + symbol);
            }
            result = new BinaryExpression(result, operator,
                    expr(link.getRuleContext(CaseSqlParser.ExpressionContext.class, 1)));
        }
        return result;
    }

    private ColumnExpression column(CaseSqlParser.QualifiedNameContext ctx) {
        return new ColumnExpression(visitQualifiedName(ctx), ctx.getText());
    }

    /**
     * 数字字面量直接取负,保留源码写法(-5而不是"negative 5")
     */
    private Expression negate(Expression operand) {
        if (operand instanceof LiteralExpression) {
            LiteralExpression literal = (LiteralExpression) operand;
            if (literal.getValue() instanceof Long) {
                return new LiteralExpression(-(Long) literal.getValue(), "-" + literal.toSql());
            }
            if (literal.getValue() instanceof BigDecimal) {
                return new LiteralExpression(((BigDecimal) literal.getValue()).negate(), "-" + literal.toSql());
            }
        }
        return new NegateExpression(operand);
    }

    private static Object parseInteger(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return new BigDecimal(text);
        }
    }
}
