package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一元逻辑表达式 (e.g., NOT Mars.Retrograde)
 */
public record UnaryExpressionNode(
        UnaryOperator operator,
        ExpressionNode operand
) implements ExpressionNode {

    public UnaryExpressionNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator + " " + operand;
    }
}
