package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一次比较 (e.g., Mars.House IN [1, 4, 7, 10])
 */
public record ComparisonNode(
        ComparisonOperator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    public ComparisonNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return operand(left) + " " + operator.symbol() + " " + operand(right);
    }

    // 比较的操作数只能是 primary，嵌套的比较和 NOT 需要括号
    private static String operand(ExpressionNode node) {
        if (node instanceof ComparisonNode || node instanceof UnaryExpressionNode) {
            return "(" + node + ")";
        }
        return node.toString();
    }
}
