package org.csu.astrodsl.common.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 表示一个求值结果，可以是数字、文本、布尔值或有序列表。
 *
 * 数字统一使用 BigDecimal，按数值比较 (1 与 1.0 相等)。
 * 不同类型之间从不相等，也不做隐式转换。
 */
@Getter
public final class Value {

    public static final Value TRUE = new Value(Boolean.TRUE);
    public static final Value FALSE = new Value(Boolean.FALSE);

    private final ValueType type;
    private final Object value;
    @Getter(AccessLevel.NONE)
    private final List<Value> items; // 仅 LIST 类型非空

    public Value(BigDecimal value) {
        this.type = ValueType.NUMBER;
        this.value = Objects.requireNonNull(value, "value");
        this.items = null;
    }

    public Value(String value) {
        this.type = ValueType.TEXT;
        this.value = Objects.requireNonNull(value, "value");
        this.items = null;
    }

    public Value(Boolean value) {
        this.type = ValueType.BOOLEAN;
        this.value = Objects.requireNonNull(value, "value");
        this.items = null;
    }

    public Value(List<Value> values) {
        this.type = ValueType.LIST;
        this.items = List.copyOf(values);
        this.value = items;
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * 将星盘数据中的原始属性值转换为 Value。
     *
     * @param raw 原始值，支持 CharSequence、Character、Enum、Number、Boolean、Collection 和数组
     * @return 对应的 Value
     * @throws IllegalArgumentException 值为 null、非有限浮点数或类型不受支持
     */
    public static Value fromAttribute(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("null is not a value");
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new Value(raw.toString());
        }
        if (raw instanceof Enum<?> e) {
            return new Value(e.name());
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Number n) {
            return new Value(toBigDecimal(n));
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> values = new ArrayList<>(collection.size());
            for (Object item : collection) {
                values.add(fromAttribute(item));
            }
            return new Value(values);
        }
        if (raw instanceof Object[] array) {
            List<Value> values = new ArrayList<>(array.length);
            for (Object item : array) {
                values.add(fromAttribute(item));
            }
            return new Value(values);
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite number: " + number);
            }
            // 使用十进制文本表示，避免 0.1 变成二进制近似值
            return new BigDecimal(number.toString());
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported number: " + number, e);
        }
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isList() {
        return type == ValueType.LIST;
    }

    public BigDecimal asNumber() {
        requireType(ValueType.NUMBER);
        return (BigDecimal) value;
    }

    public String asText() {
        requireType(ValueType.TEXT);
        return (String) value;
    }

    public boolean asBoolean() {
        requireType(ValueType.BOOLEAN);
        return (Boolean) value;
    }

    public List<Value> asList() {
        requireType(ValueType.LIST);
        return items;
    }

    /**
     * 转换回普通 Java 对象：BigDecimal、String、Boolean 或 List
     */
    public Object toJava() {
        if (type == ValueType.LIST) {
            return Collections.unmodifiableList(asList().stream().map(Value::toJava).collect(Collectors.toList()));
        }
        return value;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected a " + expected + " value but was " + type + ": " + this);
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case NUMBER -> asNumber().toPlainString();
            case LIST -> asList().stream().map(Value::toString).collect(Collectors.joining(", ", "[", "]"));
            default -> value.toString();
        };
    }

    // 数字按数值相等，列表逐个元素比较；hashCode 与之保持一致
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value other = (Value) o;
        if (type != other.type) {
            return false;
        }
        if (type == ValueType.NUMBER) {
            return asNumber().compareTo(other.asNumber()) == 0;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (type == ValueType.NUMBER) {
            return Objects.hash(type, asNumber().stripTrailingZeros());
        }
        return Objects.hash(type, value);
    }
}
