package org.csu.astrodsl.compiler.parser.ast;

/**
 * 公式 AST 的节点。
 *
 * 节点种类是封闭的：新增一种节点必须同时在 {@link ExpressionVisitor} 中增加对应方法，
 * 所有访问者都会在编译期被迫处理它。所有节点都是不可变的 record，
 * {@code toString()} 输出可以重新解析的公式文本。
 */
public sealed interface ExpressionNode
        permits BinaryExpressionNode, UnaryExpressionNode, ComparisonNode,
        PropertyAccessNode, AggregatorAccessNode, IdentifierNode,
        NumberLiteralNode, StringLiteralNode, BooleanLiteralNode, ListLiteralNode {

    <R> R accept(ExpressionVisitor<R> visitor);
}
