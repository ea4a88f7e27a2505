package org.csu.astrodsl.engine;

import org.csu.astrodsl.common.exception.EvalException;
import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 表达式求值器。
 * 在一张星盘数据上遍历 AST，得到带类型的结果。
 *
 * 求值器只读取 AST 和星盘数据，不修改任何输入，也不持有可变状态，
 * 同一个 AST 可以在多个线程中对不同星盘同时求值。
 */
public class ExpressionEvaluator implements ExpressionVisitor<Value> {

    private final ChartData chart;

    public ExpressionEvaluator(ChartData chart) {
        this.chart = Objects.requireNonNull(chart, "chart");
    }

    /**
     * 对表达式求值
     * @throws EvalException 对象或属性缺失、类型不匹配、IN 右侧不是列表
     */
    public static Value evaluate(ExpressionNode expression, ChartData chart) {
        return expression.accept(new ExpressionEvaluator(chart));
    }

    /**
     * 对条件公式求值，顶层结果必须是布尔值
     */
    public static boolean evaluateCondition(ExpressionNode expression, ChartData chart) {
        Value result = evaluate(expression, chart);
        if (!result.isBoolean()) {
            throw new EvalException(EvalException.Reason.TYPE_MISMATCH, expression,
                    "condition must evaluate to a boolean, got " + result.getType() + " (" + result + ")");
        }
        return result.asBoolean();
    }

    // --- 逻辑运算 ---

    @Override
    public Value visitBinary(BinaryExpressionNode node) {
        boolean left = requireBoolean(node, node.left().accept(this), "left operand of " + node.operator());
        // 求值没有副作用，可以短路
        return switch (node.operator()) {
            case AND -> left
                    ? Value.of(requireBoolean(node, node.right().accept(this), "right operand of AND"))
                    : Value.FALSE;
            case OR -> left
                    ? Value.TRUE
                    : Value.of(requireBoolean(node, node.right().accept(this), "right operand of OR"));
        };
    }

    @Override
    public Value visitUnary(UnaryExpressionNode node) {
        boolean operand = requireBoolean(node, node.operand().accept(this), "operand of " + node.operator());
        return switch (node.operator()) {
            case NOT -> Value.of(!operand);
        };
    }

    // --- 比较运算 ---

    @Override
    public Value visitComparison(ComparisonNode node) {
        Value left = node.left().accept(this);
        Value right = node.right().accept(this);
        return switch (node.operator()) {
            case EQ -> Value.of(left.equals(right));
            case NEQ -> Value.of(!left.equals(right));
            case LT -> Value.of(compareNumbers(node, left, right) < 0);
            case GT -> Value.of(compareNumbers(node, left, right) > 0);
            case LTE -> Value.of(compareNumbers(node, left, right) <= 0);
            case GTE -> Value.of(compareNumbers(node, left, right) >= 0);
            case IN -> Value.of(contains(node, left, right));
        };
    }

    private int compareNumbers(ComparisonNode node, Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) {
            throw new EvalException(EvalException.Reason.TYPE_MISMATCH, node,
                    "comparison requires numeric operands, got " + left.getType() + " and " + right.getType());
        }
        return left.asNumber().compareTo(right.asNumber());
    }

    private boolean contains(ComparisonNode node, Value needle, Value haystack) {
        if (!haystack.isList()) {
            throw new EvalException(EvalException.Reason.NOT_A_SEQUENCE, node,
                    "IN requires a list on the right, got " + haystack.getType() + " (" + haystack + ")");
        }
        for (Value element : haystack.asList()) {
            if (needle.equals(element)) {
                return true;
            }
        }
        return false;
    }

    // --- 数据访问 ---

    @Override
    public Value visitPropertyAccess(PropertyAccessNode node) {
        Map<String, Object> entity = chart.findEntity(node.objectName())
                .orElseThrow(() -> new EvalException(EvalException.Reason.MISSING_ENTITY, node,
                        "object '" + node.objectName() + "' not found in chart data, available planets: "
                                + chart.getPlanets().keySet(),
                        node.objectName()));
        Object raw = entity.get(node.propertyName());
        if (raw == null) {
            throw new EvalException(EvalException.Reason.MISSING_PROPERTY, node,
                    "property '" + node.propertyName() + "' not found on '" + node.objectName()
                            + "', available properties: " + entity.keySet(),
                    node.propertyName());
        }
        return toValue(node, raw);
    }

    /**
     * 聚合访问：按条目顺序收集每个条目的同名属性，缺少该属性的条目被跳过。
     */
    @Override
    public Value visitAggregatorAccess(AggregatorAccessNode node) {
        List<Value> values = new ArrayList<>();
        for (Map<String, Object> entry : chart.entriesOf(node.aggregator().keyword())) {
            Object raw = entry.get(node.propertyName());
            if (raw != null) {
                values.add(toValue(node, raw));
            }
        }
        return new Value(values);
    }

    // --- 字面量 ---

    @Override
    public Value visitIdentifier(IdentifierNode node) {
        return new Value(node.name());
    }

    @Override
    public Value visitNumber(NumberLiteralNode node) {
        return new Value(node.value());
    }

    @Override
    public Value visitString(StringLiteralNode node) {
        return new Value(node.value());
    }

    @Override
    public Value visitBoolean(BooleanLiteralNode node) {
        return Value.of(node.value());
    }

    @Override
    public Value visitList(ListLiteralNode node) {
        List<Value> values = new ArrayList<>(node.items().size());
        for (ExpressionNode item : node.items()) {
            values.add(item.accept(this));
        }
        return new Value(values);
    }

    // --- 辅助方法 ---

    private static boolean requireBoolean(ExpressionNode node, Value value, String role) {
        if (!value.isBoolean()) {
            throw new EvalException(EvalException.Reason.TYPE_MISMATCH, node,
                    role + " must be a boolean, got " + value.getType() + " (" + value + ")");
        }
        return value.asBoolean();
    }

    private static Value toValue(ExpressionNode node, Object raw) {
        try {
            return Value.fromAttribute(raw);
        } catch (IllegalArgumentException e) {
            throw new EvalException(EvalException.Reason.UNSUPPORTED_VALUE, node, e.getMessage());
        }
    }
}
