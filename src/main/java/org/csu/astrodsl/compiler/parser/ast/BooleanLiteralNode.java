package org.csu.astrodsl.compiler.parser.ast;

/**
 * AST 节点: 表示 True / False
 */
public record BooleanLiteralNode(boolean value) implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String toString() {
        return value ? "True" : "False";
    }
}
