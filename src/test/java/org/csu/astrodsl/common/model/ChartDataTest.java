package org.csu.astrodsl.common.model;

import org.csu.astrodsl.engine.FormulaEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ChartDataTest {

    @Test
    void testFromMapAcceptsNumericStringHouseKeys() {
        Map<Object, Object> houses = new LinkedHashMap<>();
        houses.put("1", Map.of("Sign", "Taurus"));
        houses.put(10, Map.of("Sign", "Aquarius"));
        Map<String, Object> raw = new HashMap<>();
        raw.put("houses", houses);

        ChartData chart = ChartData.fromMap(raw);
        assertEquals(List.of(1, 10), List.copyOf(chart.getHouses().keySet()));
        assertTrue(chart.getPlanets().isEmpty());
        assertTrue(chart.getAspects().isEmpty());
    }

    @Test
    void testFromMapRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> ChartData.fromMap(Map.of("planets", List.of())));
        assertThrows(IllegalArgumentException.class, () -> ChartData.fromMap(Map.of("aspects", Map.of())));
        assertThrows(IllegalArgumentException.class,
                () -> ChartData.fromMap(Map.of("houses", Map.of("first", Map.of()))));
    }

    @Test
    void testFindEntityPrefersPlanetsThenHouses() {
        ChartData chart = ChartData.builder()
                .planet("Sun", Map.of("Sign", "Leo"))
                .house(1, Map.of("Sign", "Taurus"))
                .build();

        assertEquals("Leo", chart.findEntity("Sun").orElseThrow().get("Sign"));
        assertEquals("Taurus", chart.findEntity("1").orElseThrow().get("Sign"));
        assertTrue(chart.findEntity("Moon").isEmpty());
    }

    @Test
    void testDataIsCopiedAndImmutable() {
        Map<String, Object> sun = new HashMap<>();
        sun.put("Sign", "Leo");
        ChartData chart = ChartData.builder().planet("Sun", sun).build();

        sun.put("Sign", "Virgo");
        assertEquals("Leo", chart.getPlanets().get("Sun").get("Sign"));
        assertThrows(UnsupportedOperationException.class, () -> chart.getPlanets().get("Sun").put("House", 1));
        assertThrows(UnsupportedOperationException.class, () -> chart.getPlanets().remove("Sun"));
    }

    @Test
    void testNestedCollectionsAreCopied() {
        System.out.println("--- Running test: testNestedCollectionsAreCopied ---");
        List<String> tags = new ArrayList<>(List.of("Trine"));
        String[] rulers = {"Sun"};
        Map<String, Object> sun = new HashMap<>();
        sun.put("Tags", tags);
        sun.put("Rulers", rulers);
        ChartData chart = ChartData.builder().planet("Sun", sun).build();

        tags.add("Square");
        rulers[0] = "Moon";

        Map<String, Object> copy = chart.getPlanets().get("Sun");
        assertEquals(List.of("Trine"), copy.get("Tags"));
        assertEquals(List.of("Sun"), copy.get("Rulers"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<?>) copy.get("Tags")).clear());

        // 求值看到的是构造时的内容
        Value tagValue = new FormulaEngine().evaluate("Sun.Tags", chart);
        assertEquals(List.of(new Value("Trine")), tagValue.asList());
        assertFalse(new FormulaEngine().test("Square IN Sun.Tags", chart));
    }

    @Test
    void testEntriesOfUnknownCategory() {
        assertThrows(IllegalArgumentException.class, () -> ChartData.empty().entriesOf("stars"));
        assertTrue(ChartData.empty().entriesOf(ChartData.ASPECTS).isEmpty());
    }
}
