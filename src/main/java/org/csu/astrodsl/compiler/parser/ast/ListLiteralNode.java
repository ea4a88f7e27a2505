package org.csu.astrodsl.compiler.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST 节点: 表示一个列表字面量 (e.g., [1, 4, 7, 10], [Aries, Leo])
 * @param items 按书写顺序排列的元素，构造时复制为不可变列表
 */
public record ListLiteralNode(List<ExpressionNode> items) implements ExpressionNode {

    public ListLiteralNode {
        items = List.copyOf(items);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public String toString() {
        return items.stream()
                .map(ExpressionNode::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
