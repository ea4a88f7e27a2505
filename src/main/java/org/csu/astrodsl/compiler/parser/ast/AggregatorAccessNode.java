package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个聚合访问 (e.g., planets.Dignity, aspects.Type)
 * @param aggregator   聚合的类别
 * @param propertyName 要投影的属性名
 */
public record AggregatorAccessNode(
        Aggregator aggregator,
        String propertyName
) implements ExpressionNode {

    public AggregatorAccessNode {
        Objects.requireNonNull(aggregator, "aggregator");
        Objects.requireNonNull(propertyName, "propertyName");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAggregatorAccess(this);
    }

    @Override
    public String toString() {
        return aggregator.keyword() + "." + propertyName;
    }
}
