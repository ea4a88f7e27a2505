package org.csu.astrodsl.compiler.parser.ast;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * AST 节点: 表示一个数字字面量 (e.g., 10, 23.5)
 */
public record NumberLiteralNode(BigDecimal value) implements ExpressionNode {

    public NumberLiteralNode {
        Objects.requireNonNull(value, "value");
    }

    public static NumberLiteralNode of(String text) {
        return new NumberLiteralNode(new BigDecimal(text));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
