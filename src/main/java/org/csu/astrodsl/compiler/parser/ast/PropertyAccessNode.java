package org.csu.astrodsl.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示对某个星盘对象属性的访问 (e.g., Sun.Sign)
 * @param objectName   对象名 (e.g., "Sun")
 * @param propertyName 属性名 (e.g., "Sign")
 */
public record PropertyAccessNode(
        String objectName,
        String propertyName
) implements ExpressionNode {

    public PropertyAccessNode {
        Objects.requireNonNull(objectName, "objectName");
        Objects.requireNonNull(propertyName, "propertyName");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }

    @Override
    public String toString() {
        return objectName + "." + propertyName;
    }
}
