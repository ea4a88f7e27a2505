package org.csu.astrodsl.common.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一张星盘的只读快照，包含三个类别：
 * <ul>
 *     <li>planets: 名称 → 属性表 (e.g., "Sun" → {Sign=Capricorn, House=9})</li>
 *     <li>houses: 宫位编号 → 属性表</li>
 *     <li>aspects: 相位属性表的有序列表</li>
 * </ul>
 * 构造时做深拷贝并保持插入顺序，之后任何集合都不可修改，可在多个线程间共享。
 */
@Getter
public final class ChartData {

    public static final String PLANETS = "planets";
    public static final String HOUSES = "houses";
    public static final String ASPECTS = "aspects";

    private static final ChartData EMPTY = new ChartData(Map.of(), Map.of(), List.of());

    private final Map<String, Map<String, Object>> planets;
    private final Map<Integer, Map<String, Object>> houses;
    private final List<Map<String, Object>> aspects;

    private ChartData(Map<String, ? extends Map<String, ?>> planets,
                      Map<Integer, ? extends Map<String, ?>> houses,
                      List<? extends Map<String, ?>> aspects) {
        this.planets = copyEntries(planets);
        this.houses = copyEntries(houses);
        List<Map<String, Object>> aspectCopy = new ArrayList<>(aspects.size());
        for (Map<String, ?> aspect : aspects) {
            aspectCopy.add(copyAttributes(aspect));
        }
        this.aspects = Collections.unmodifiableList(aspectCopy);
    }

    public static ChartData empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从嵌套 Map 构造星盘数据，格式为
     * {@code {"planets": {...}, "houses": {...}, "aspects": [...]}}，缺失的类别视为空。
     * houses 的键可以是整数，也可以是数字字符串。
     *
     * @throws IllegalArgumentException 结构不符合上述格式
     */
    public static ChartData fromMap(Map<String, ?> raw) {
        Builder builder = builder();
        Object planets = raw.get(PLANETS);
        if (planets != null) {
            for (Map.Entry<?, ?> entry : asMap(planets, PLANETS).entrySet()) {
                builder.planet(String.valueOf(entry.getKey()), asAttributes(entry.getValue(), PLANETS));
            }
        }
        Object houses = raw.get(HOUSES);
        if (houses != null) {
            for (Map.Entry<?, ?> entry : asMap(houses, HOUSES).entrySet()) {
                builder.house(toHouseNumber(entry.getKey()), asAttributes(entry.getValue(), HOUSES));
            }
        }
        Object aspects = raw.get(ASPECTS);
        if (aspects != null) {
            if (!(aspects instanceof Collection<?> aspectList)) {
                throw new IllegalArgumentException("'aspects' must be a list, got: " + aspects.getClass().getName());
            }
            for (Object aspect : aspectList) {
                builder.aspect(asAttributes(aspect, ASPECTS));
            }
        }
        return builder.build();
    }

    /**
     * 按名称查找实体：先在 planets 中查找，再在 houses 中按编号的十进制文本查找。
     */
    public Optional<Map<String, Object>> findEntity(String name) {
        Map<String, Object> planet = planets.get(name);
        if (planet != null) {
            return Optional.of(planet);
        }
        for (Map.Entry<Integer, Map<String, Object>> house : houses.entrySet()) {
            if (house.getKey().toString().equals(name)) {
                return Optional.of(house.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * @return 指定类别下所有条目的属性表，保持条目顺序
     */
    public List<Map<String, Object>> entriesOf(String category) {
        return switch (category) {
            case PLANETS -> List.copyOf(planets.values());
            case HOUSES -> List.copyOf(houses.values());
            case ASPECTS -> aspects;
            default -> throw new IllegalArgumentException("Unknown chart category: " + category);
        };
    }

    @Override
    public String toString() {
        return "ChartData[planets=" + planets.keySet()
                + ", houses=" + houses.keySet()
                + ", aspects=" + aspects.size() + "]";
    }

    private static <K> Map<K, Map<String, Object>> copyEntries(Map<K, ? extends Map<String, ?>> source) {
        Map<K, Map<String, Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<K, ? extends Map<String, ?>> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyAttributes(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, Object> copyAttributes(Map<String, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    // 集合、数组和嵌套 Map 逐层复制为不可变结构，调用方之后的修改不会影响快照
    private static Object copyValue(Object value) {
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(copyValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Object[] array) {
            List<Object> items = new ArrayList<>(array.length);
            for (Object item : array) {
                items.add(copyValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    private static Map<?, ?> asMap(Object value, String category) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("'" + category + "' must be a map, got: " + value.getClass().getName());
    }

    private static Map<String, Object> asAttributes(Object value, String category) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : asMap(value, category).entrySet()) {
            attributes.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return attributes;
    }

    private static int toHouseNumber(Object key) {
        if (key instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(key).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("House key must be a number, got: " + key, e);
        }
    }

    /**
     * ChartData 的构建器，条目按添加顺序保存；同名条目以最后一次为准。
     */
    public static final class Builder {
        private final Map<String, Map<String, ?>> planets = new LinkedHashMap<>();
        private final Map<Integer, Map<String, ?>> houses = new LinkedHashMap<>();
        private final List<Map<String, ?>> aspects = new ArrayList<>();

        private Builder() {
        }

        public Builder planet(String name, Map<String, ?> attributes) {
            planets.put(name, attributes);
            return this;
        }

        public Builder house(int number, Map<String, ?> attributes) {
            houses.put(number, attributes);
            return this;
        }

        public Builder aspect(Map<String, ?> attributes) {
            aspects.add(attributes);
            return this;
        }

        public ChartData build() {
            return new ChartData(planets, houses, aspects);
        }
    }
}
