package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个裸标识符，作为符号常量使用 (e.g., Aries, Exaltation)。
 * 求值时不会在星盘数据中查找。
 */
public record IdentifierNode(String name) implements ExpressionNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
