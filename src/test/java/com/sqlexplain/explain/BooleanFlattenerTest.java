package com.sqlexplain.explain;

import com.sqlexplain.parser.Expression;
import com.sqlexplain.parser.expressions.BinaryExpression;
import com.sqlexplain.parser.expressions.ColumnExpression;
import com.sqlexplain.parser.expressions.Operator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("逻辑链展开测试")
class BooleanFlattenerTest {

    private static List<Expression> leaves(int n) {
        List<Expression> leaves = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            leaves.add(new ColumnExpression("c" + i));
        }
        return leaves;
    }

    private static Expression leftDeep(List<Expression> leaves, Operator op) {
        Expression tree = leaves.get(0);
        for (int i = 1; i < leaves.size(); i++) {
            tree = new BinaryExpression(tree, op, leaves.get(i));
        }
        return tree;
    }

    private static Expression rightDeep(List<Expression> leaves, Operator op) {
        Expression tree = leaves.get(leaves.size() - 1);
        for (int i = leaves.size() - 2; i >= 0; i--) {
            tree = new BinaryExpression(leaves.get(i), op, tree);
        }
        return tree;
    }

    @Test
    @DisplayName("左深 AND 链按源码顺序展开")
    void testLeftDeepChain() {
        List<Expression> leaves = leaves(5);

        List<Expression> flat = BooleanFlattener.flatten(leftDeep(leaves, Operator.AND), Operator.AND);

        assertEquals(leaves, flat);
    }

    @Test
    @DisplayName("右深 AND 链按源码顺序展开")
    void testRightDeepChain() {
        List<Expression> leaves = leaves(5);

        List<Expression> flat = BooleanFlattener.flatten(rightDeep(leaves, Operator.AND), Operator.AND);

        assertEquals(leaves, flat);
    }

    @Test
    @DisplayName("不跨类型展开")
    void testMixedConnectives() {
        Expression a = new ColumnExpression("a");
        Expression or = new BinaryExpression(new ColumnExpression("b"), Operator.OR, new ColumnExpression("c"));
        Expression and = new BinaryExpression(a, Operator.AND, or);

        assertEquals(List.of(a, or), BooleanFlattener.flatten(and, Operator.AND));
        assertEquals(List.of(and), BooleanFlattener.flatten(and, Operator.OR));
    }

    @Test
    @DisplayName("非逻辑节点返回自身")
    void testSingleNode() {
        Expression a = new ColumnExpression("a");

        assertEquals(List.of(a), BooleanFlattener.flatten(a, Operator.AND));
    }

    @Test
    @DisplayName("超长链不会栈溢出")
    void testVeryLongChain() {
        List<Expression> leaves = leaves(20_000);

        List<Expression> flat = BooleanFlattener.flatten(leftDeep(leaves, Operator.OR), Operator.OR);

        assertEquals(20_000, flat.size());
        assertSame(leaves.get(0), flat.get(0));
        assertSame(leaves.get(19_999), flat.get(19_999));
    }

    @Test
    @DisplayName("只能按 AND/OR 展开")
    void testInvalidConnective() {
        assertThrows(IllegalArgumentException.class,
                () -> BooleanFlattener.flatten(new ColumnExpression("a"), Operator.ADD));
    }
}
