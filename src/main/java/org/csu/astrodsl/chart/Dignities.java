package org.csu.astrodsl.chart;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.csu.astrodsl.chart.ZodiacSign.*;

/**
 * 行星的本质尊贵表 (入庙、擢升、落陷、入弱)。
 *
 * 外行星只有入庙，没有擢升、落陷和入弱。
 */
public final class Dignities {

    public static final String RULERSHIP = "Rulership";
    public static final String EXALTATION = "Exaltation";
    public static final String DETRIMENT = "Detriment";
    public static final String FALL = "Fall";
    public static final String NEUTRAL = "Neutral";
    public static final String PEREGRINE = "Peregrine";

    // 同一时刻一颗行星只能处于其中一种状态
    private static final Set<String> STATES = Set.of(RULERSHIP, EXALTATION, DETRIMENT, FALL, NEUTRAL, PEREGRINE);

    private static final Map<String, Set<ZodiacSign>> RULERSHIPS = Map.of(
            "Sun", EnumSet.of(Leo),
            "Moon", EnumSet.of(Cancer),
            "Mercury", EnumSet.of(Gemini, Virgo),
            "Venus", EnumSet.of(Taurus, Libra),
            "Mars", EnumSet.of(Aries, Scorpio),
            "Jupiter", EnumSet.of(Sagittarius, Pisces),
            "Saturn", EnumSet.of(Capricorn, Aquarius),
            "Uranus", EnumSet.of(Aquarius),
            "Neptune", EnumSet.of(Pisces),
            "Pluto", EnumSet.of(Scorpio)
    );

    private static final Map<String, ZodiacSign> EXALTATIONS = Map.of(
            "Sun", Aries,
            "Moon", Taurus,
            "Mercury", Virgo,
            "Venus", Pisces,
            "Mars", Capricorn,
            "Jupiter", Cancer,
            "Saturn", Libra
    );

    private static final Map<String, Set<ZodiacSign>> DETRIMENTS = Map.of(
            "Sun", EnumSet.of(Aquarius),
            "Moon", EnumSet.of(Capricorn),
            "Mercury", EnumSet.of(Sagittarius, Pisces),
            "Venus", EnumSet.of(Aries, Scorpio),
            "Mars", EnumSet.of(Libra, Taurus),
            "Jupiter", EnumSet.of(Gemini, Virgo),
            "Saturn", EnumSet.of(Cancer, Leo)
    );

    private static final Map<String, ZodiacSign> FALLS = Map.of(
            "Sun", Libra,
            "Moon", Scorpio,
            "Mercury", Pisces,
            "Venus", Virgo,
            "Mars", Cancer,
            "Jupiter", Capricorn,
            "Saturn", Aries
    );

    private Dignities() {
    }

    /**
     * 按 入庙 → 擢升 → 落陷 → 入弱 的顺序判断，都不满足时为 Neutral
     */
    public static String of(String planet, ZodiacSign sign) {
        if (RULERSHIPS.getOrDefault(planet, Set.of()).contains(sign)) {
            return RULERSHIP;
        }
        if (EXALTATIONS.get(planet) == sign) {
            return EXALTATION;
        }
        if (DETRIMENTS.getOrDefault(planet, Set.of()).contains(sign)) {
            return DETRIMENT;
        }
        if (FALLS.get(planet) == sign) {
            return FALL;
        }
        return NEUTRAL;
    }

    public static boolean isDignity(String name) {
        return STATES.contains(name);
    }

    /**
     * 判断 "planet 在 sign 中，且尊贵状态为 dignity" 是否与尊贵表矛盾。
     * 表中没有对应条目 (外行星的擢升、未知天体等) 时不视为矛盾。
     */
    public static boolean contradicts(String planet, ZodiacSign sign, String dignity) {
        if (!RULERSHIPS.containsKey(planet)) {
            return false;
        }
        return switch (dignity) {
            case RULERSHIP -> !RULERSHIPS.get(planet).contains(sign);
            case EXALTATION -> EXALTATIONS.containsKey(planet) && EXALTATIONS.get(planet) != sign;
            case DETRIMENT -> DETRIMENTS.containsKey(planet) && !DETRIMENTS.get(planet).contains(sign);
            case FALL -> FALLS.containsKey(planet) && FALLS.get(planet) != sign;
            case NEUTRAL -> !NEUTRAL.equals(of(planet, sign));
            default -> false;
        };
    }
}
