package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元逻辑表达式 (e.g., Sun.Sign == Aries AND Moon.House == 1)
 */
public record BinaryExpressionNode(
        LogicalOperator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
