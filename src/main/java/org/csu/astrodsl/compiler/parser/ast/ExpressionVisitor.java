package org.csu.astrodsl.compiler.parser.ast;

/**
 * AST 访问者，每种节点一个方法。
 *
 * @param <R> 访问结果类型
 */
public interface ExpressionVisitor<R> {

    R visitBinary(BinaryExpressionNode node);

    R visitUnary(UnaryExpressionNode node);

    R visitComparison(ComparisonNode node);

    R visitPropertyAccess(PropertyAccessNode node);

    R visitAggregatorAccess(AggregatorAccessNode node);

    R visitIdentifier(IdentifierNode node);

    R visitNumber(NumberLiteralNode node);

    R visitString(StringLiteralNode node);

    R visitBoolean(BooleanLiteralNode node);

    R visitList(ListLiteralNode node);
}
