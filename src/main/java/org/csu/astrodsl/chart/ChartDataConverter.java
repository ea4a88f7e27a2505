package org.csu.astrodsl.chart;

import org.csu.astrodsl.common.model.ChartData;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 将星历计算结果 (行星黄经 + 宫头) 转换为公式求值所需的 {@link ChartData}
 *
 * 每颗行星得到 Sign、House、Dignity、Retrograde、Degree、Longitude、Speed 属性；
 * 宫头恰好 12 个时，每个宫位得到 Sign 和 Cusp 属性。
 * 只转换十颗行星，交点、凯龙星等其他天体被忽略。
 */
public final class ChartDataConverter {

    public static final List<String> PLANETS = List.of(
            "Sun", "Moon", "Mercury", "Venus", "Mars",
            "Jupiter", "Saturn", "Uranus", "Neptune", "Pluto");

    public static final int HOUSE_COUNT = 12;

    private ChartDataConverter() {
    }

    /**
     * @param positions 天体名称 → 位置
     * @param cusps     第 1 至第 12 宫的宫头黄经；不是 12 个时不计算宫位
     */
    public static ChartData convert(Map<String, PlanetPosition> positions, List<Double> cusps) {
        boolean withHouses = cusps != null && cusps.size() == HOUSE_COUNT;
        ChartData.Builder builder = ChartData.builder();

        for (Map.Entry<String, PlanetPosition> entry : positions.entrySet()) {
            String name = entry.getKey();
            if (!PLANETS.contains(name)) {
                continue;
            }
            PlanetPosition position = entry.getValue();
            double longitude = normalize(position.longitude());
            ZodiacSign sign = ZodiacSign.fromLongitude(longitude);

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("Sign", sign.name());
            if (withHouses) {
                attributes.put("House", houseOf(longitude, cusps));
            }
            attributes.put("Dignity", Dignities.of(name, sign));
            attributes.put("Retrograde", position.retrograde());
            attributes.put("Degree", round(longitude % 30.0, 2));
            attributes.put("Longitude", round(longitude, 2));
            attributes.put("Speed", round(requireFinite(position.speed(), name + " speed"), 4));
            builder.planet(name, attributes);
        }

        if (withHouses) {
            for (int i = 0; i < HOUSE_COUNT; i++) {
                double cusp = normalize(cusps.get(i));
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("Sign", ZodiacSign.fromLongitude(cusp).name());
                attributes.put("Cusp", round(cusp, 2));
                builder.house(i + 1, attributes);
            }
        }
        return builder.build();
    }

    /**
     * 找到包含该黄经的宫位：[当前宫头, 下一宫头)，宫头跨越 0° 白羊时按环绕处理
     *
     * @return 1 到 12 的宫位编号
     */
    public static int houseOf(double longitude, List<Double> cusps) {
        if (cusps.size() != HOUSE_COUNT) {
            throw new IllegalArgumentException("Expected " + HOUSE_COUNT + " house cusps, got " + cusps.size());
        }
        double point = normalize(longitude);
        for (int i = 0; i < HOUSE_COUNT; i++) {
            double current = normalize(cusps.get(i));
            double next = normalize(cusps.get((i + 1) % HOUSE_COUNT));
            if (current < next) {
                if (point >= current && point < next) {
                    return i + 1;
                }
            } else if (point >= current || point < next) {
                return i + 1;
            }
        }
        // 宫头全部相同时落到这里
        return 1;
    }

    static double normalize(double longitude) {
        double normalized = requireFinite(longitude, "Longitude") % 360.0;
        return normalized < 0 ? normalized + 360.0 : normalized;
    }

    private static double requireFinite(double value, String what) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(what + " must be finite, got: " + value);
        }
        return value;
    }

    private static BigDecimal round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN);
    }
}
