package com.sqlexplain.parser.expressions;

import com.sqlexplain.parser.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TrimExpression - TRIM函数
 *
 * 支持SQL标准写法:
 * - TRIM(name)
 * - TRIM(LEADING FROM name)
 * - TRIM(BOTH 'x' FROM name)
 *
 * LTRIM/RTRIM由ASTBuilder转换为LEADING/TRAILING形式。
 */
public class TrimExpression implements Expression {

    /**
     * 去除位置
     */
    public enum Side {
        LEADING,
        TRAILING,
        BOTH
    }

    private final Side side;

    /** 被去除的字符,为null表示空白 */
    private final Expression characters;

    private final Expression target;

    public TrimExpression(Side side, Expression characters, Expression target) {
        this.side = side != null ? side : Side.BOTH;
        this.characters = characters;
        this.target = Objects.requireNonNull(target, "trim target cannot be null");
    }

    public Side getSide() {
        return side;
    }

    public Expression getCharacters() {
        return characters;
    }

    public Expression getTarget() {
        return target;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.TRIM;
    }

    @Override
    public String toSql() {
        if (side == Side.BOTH && characters == null) {
            return "TRIM(" + target.toSql() + ")";
        }
        return "TRIM(" + side + " " + (characters != null ? characters.toSql() + " " : "")
                + "FROM " + target.toSql() + ")";
    }

    @Override
    public List<Expression> getChildren() {
        List<Expression> children = new ArrayList<>(2);
        if (characters != null) {
            children.add(characters);
        }
        children.add(target);
        return List.copyOf(children);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
