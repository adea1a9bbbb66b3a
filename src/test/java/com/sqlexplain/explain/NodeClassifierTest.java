package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("表达式分类器测试")
class NodeClassifierTest {

    private final Expression a = new ColumnExpression("a");
    private final Expression one = new LiteralExpression(1L);

    @Test
    @DisplayName("二元运算按运算符分类")
    void testBinaryByOperator() {
        assertEquals(SemanticKind.ARITHMETIC,
                NodeClassifier.classify(new BinaryExpression(a, Operator.ADD, one)));
        assertEquals(SemanticKind.ARITHMETIC,
                NodeClassifier.classify(new BinaryExpression(a, Operator.CONCAT, one)));
        assertEquals(SemanticKind.COMPARISON,
                NodeClassifier.classify(new BinaryExpression(a, Operator.LESS_EQUAL, one)));
        assertEquals(SemanticKind.AND,
                NodeClassifier.classify(new BinaryExpression(a, Operator.AND, one)));
        assertEquals(SemanticKind.OR,
                NodeClassifier.classify(new BinaryExpression(a, Operator.OR, one)));
    }

    @Test
    @DisplayName("每种节点对应一个语义类别")
    void testNodeKinds() {
        assertEquals(SemanticKind.COLUMN, NodeClassifier.classify(a));
        assertEquals(SemanticKind.LITERAL, NodeClassifier.classify(one));
        assertEquals(SemanticKind.ARITHMETIC, NodeClassifier.classify(new NegateExpression(a)));
        assertEquals(SemanticKind.NOT, NodeClassifier.classify(new NotExpression(a)));
        assertEquals(SemanticKind.NULL_CHECK, NodeClassifier.classify(new IsNullExpression(a, false)));
        assertEquals(SemanticKind.MEMBERSHIP, NodeClassifier.classify(new InExpression(a, List.of(one), false)));
        assertEquals(SemanticKind.PATTERN_MATCH,
                NodeClassifier.classify(new LikeExpression(a, new LiteralExpression("%x%"), false)));
        assertEquals(SemanticKind.RANGE, NodeClassifier.classify(new BetweenExpression(a, one, one, false)));
        assertEquals(SemanticKind.FUNCTION_CALL,
                NodeClassifier.classify(new FunctionCallExpression("UPPER", List.of(a))));
        assertEquals(SemanticKind.TRIM, NodeClassifier.classify(new TrimExpression(null, null, a)));
        assertEquals(SemanticKind.CAST, NodeClassifier.classify(new CastExpression(a, "INT")));
        assertEquals(SemanticKind.WINDOW_FUNCTION, NodeClassifier.classify(
                new WindowExpression(new FunctionCallExpression("RANK", List.of()), null, null)));
        assertEquals(SemanticKind.CONDITIONAL, NodeClassifier.classify(
                new CaseWhenExpression(List.of(new WhenClause(a, one)), null)));
        assertEquals(SemanticKind.ALIAS, NodeClassifier.classify(new AliasExpression(a, "x")));
    }

    @Test
    @DisplayName("原样表达式归为 OPAQUE")
    void testRawIsOpaque() {
        assertEquals(SemanticKind.OPAQUE, NodeClassifier.classify(new RawExpression("EXISTS (SELECT 1)")));
    }

    @Test
    @DisplayName("类型标签与实现类不一致时归为 OPAQUE")
    void testMismatchedTagIsOpaque() {
        assertEquals(SemanticKind.OPAQUE, NodeClassifier.classify(foreign(Expression.ExpressionType.BINARY)));
        assertEquals(SemanticKind.OPAQUE, NodeClassifier.classify(foreign(Expression.ExpressionType.CASE)));
        assertEquals(SemanticKind.OPAQUE, NodeClassifier.classify(foreign(null)));
    }

    @Test
    @DisplayName("null 输入抛出异常")
    void testNullInput() {
        assertThrows(IllegalArgumentException.class, () -> NodeClassifier.classify(null));
    }

    private static Expression foreign(Expression.ExpressionType type) {
        return new Expression() {
            @Override
            public ExpressionType getType() {
                return type;
            }

            @Override
            public String toSql() {
                return "foreign";
            }

            @Override
            public List<Expression> getChildren() {
                return List.of();
            }
        };
    }
}
