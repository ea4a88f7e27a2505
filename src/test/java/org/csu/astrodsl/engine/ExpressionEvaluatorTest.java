package org.csu.astrodsl.engine;

import org.csu.astrodsl.common.exception.EvalException;
import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.lexer.Lexer;
import org.csu.astrodsl.compiler.parser.Parser;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式求值器的单元测试，使用一张手工构造的星盘。
 */
public class ExpressionEvaluatorTest {

    private ChartData chart;

    @BeforeEach
    void setUp() {
        chart = ChartData.builder()
                .planet("Sun", Map.of("Sign", "Capricorn", "House", 9, "Dignity", "Neutral",
                        "Retrograde", false, "Degree", 17.5))
                .planet("Moon", Map.of("Sign", "Cancer", "House", 3, "Dignity", "Rulership",
                        "Retrograde", false))
                .planet("Mars", Map.of("Sign", "Leo", "House", 4, "Retrograde", true, "Speed", -0.25))
                .house(1, Map.of("Sign", "Taurus", "Cusp", 45.6))
                .house(10, Map.of("Sign", "Aquarius"))
                .aspect(Map.of("Type", "Trine", "Orb", 2.5))
                .aspect(Map.of("Type", "Square"))
                .build();
    }

    private Value eval(String formula, ChartData data) {
        ExpressionNode ast = new Parser(new Lexer(formula).tokenize()).parse();
        Value result = ExpressionEvaluator.evaluate(ast, data);
        System.out.println(formula + " => " + result);
        return result;
    }

    private Value eval(String formula) {
        return eval(formula, chart);
    }

    private EvalException evalError(String formula) {
        return assertThrows(EvalException.class, () -> eval(formula));
    }

    @Test
    void testSignEquality() {
        System.out.println("--- Test: Sign equality ---");
        ChartData data = ChartData.fromMap(Map.of("planets", Map.of("Sun", Map.of("Sign", "Capricorn"))));
        assertEquals(Value.TRUE, eval("Sun.Sign == Capricorn", data));
        assertEquals(Value.FALSE, eval("Sun.Sign == Aries", data));
        assertEquals(Value.TRUE, eval("Sun.Sign == 'Capricorn'", data));
    }

    @Test
    void testNotOnBooleanProperty() {
        ChartData data = ChartData.fromMap(Map.of("planets", Map.of("Mars", Map.of("Retrograde", false))));
        assertEquals(Value.TRUE, eval("NOT Mars.Retrograde", data));
        assertEquals(Value.FALSE, eval("NOT NOT Mars.Retrograde", data));
    }

    @Test
    void testMissingEntityNamesTheObject() {
        ChartData data = ChartData.fromMap(Map.of("planets", Map.of()));
        EvalException e = assertThrows(EvalException.class, () -> eval("Mercury.Sign", data));
        assertEquals(EvalException.Reason.MISSING_ENTITY, e.getReason());
        assertEquals("Mercury", e.getMissingKey());
        assertTrue(e.getMessage().contains("Mercury"), e.getMessage());
    }

    @Test
    void testMissingPropertyNamesTheProperty() {
        EvalException e = evalError("Mars.Dignity == Fall");
        assertEquals(EvalException.Reason.MISSING_PROPERTY, e.getReason());
        assertEquals("Dignity", e.getMissingKey());
        assertTrue(e.getMessage().contains("Mars.Dignity"), e.getMessage());
    }

    @Test
    void testNullAttributeCountsAsMissing() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("Sign", null);
        ChartData data = ChartData.builder().planet("Venus", attributes).build();
        EvalException e = assertThrows(EvalException.class, () -> eval("Venus.Sign == Libra", data));
        assertEquals(EvalException.Reason.MISSING_PROPERTY, e.getReason());
    }

    @Test
    void testHouseAggregator() {
        assertEquals(List.of(new Value("Taurus"), new Value("Aquarius")), eval("houses.Sign").asList());
        assertEquals(Value.TRUE, eval("Taurus IN houses.Sign"));
    }

    @Test
    void testNumericComparisons() {
        assertEquals(Value.TRUE, eval("Sun.House > 6"));
        assertEquals(Value.TRUE, eval("Sun.House >= 9"));
        assertEquals(Value.FALSE, eval("Sun.House < 9"));
        assertEquals(Value.TRUE, eval("Sun.House <= 9.0"));
        assertEquals(Value.TRUE, eval("Sun.Degree == 17.50"));
        assertEquals(Value.TRUE, eval("Sun.House != 10"));
    }

    @Test
    void testMixedTypesAreNeverEqual() {
        assertEquals(Value.FALSE, eval("Sun.House == '9'"));
        assertEquals(Value.TRUE, eval("Sun.House != '9'"));
        assertEquals(Value.FALSE, eval("Mars.Retrograde == 1"));
    }

    @Test
    void testOrderingRequiresNumbers() {
        EvalException e = evalError("Sun.Sign > 3");
        assertEquals(EvalException.Reason.TYPE_MISMATCH, e.getReason());
        assertTrue(e.getMessage().contains("numeric"), e.getMessage());
    }

    @Test
    void testInMembership() {
        assertEquals(Value.TRUE, eval("Mars.House IN [1, 4, 7, 10]"));
        assertEquals(Value.FALSE, eval("Sun.House IN [1, 4, 7, 10]"));
        assertEquals(Value.TRUE, eval("Sun.Sign IN [Capricorn, Aquarius]"));
        assertEquals(Value.FALSE, eval("Sun.Sign IN []"));
    }

    @Test
    void testInRequiresList() {
        EvalException e = evalError("Sun.House IN 9");
        assertEquals(EvalException.Reason.NOT_A_SEQUENCE, e.getReason());
    }

    @Test
    void testAggregatorCollectsInOrder() {
        Value signs = eval("planets.Sign");
        assertEquals(List.of(new Value("Capricorn"), new Value("Cancer"), new Value("Leo")), signs.asList());
        assertEquals(Value.TRUE, eval("Leo IN planets.Sign"));
        assertEquals(Value.FALSE, eval("Virgo IN planets.Sign"));
    }

    @Test
    void testAggregatorSkipsEntriesWithoutProperty() {
        // 只有 Sun 有 Degree，只有第一个相位有 Orb
        assertEquals(1, eval("planets.Degree").asList().size());
        assertEquals(List.of(new Value(new BigDecimal("2.5"))), eval("aspects.Orb").asList());
        assertEquals(Value.TRUE, eval("Square IN aspects.Type"));
        assertTrue(eval("planets.Nothing").asList().isEmpty());
    }

    @Test
    void testLogicalOperatorsShortCircuit() {
        // 右侧会因缺失对象而失败，但不会被求值
        assertEquals(Value.FALSE, eval("Sun.House == 1 AND Pluto.Sign == Leo"));
        assertEquals(Value.TRUE, eval("Sun.House == 9 OR Pluto.Sign == Leo"));
        assertThrows(EvalException.class, () -> eval("Sun.House == 9 AND Pluto.Sign == Leo"));
    }

    @Test
    void testLogicalOperatorsRequireBooleans() {
        EvalException e = evalError("Sun.Sign AND Mars.Retrograde");
        assertEquals(EvalException.Reason.TYPE_MISMATCH, e.getReason());

        e = evalError("NOT Sun.House");
        assertEquals(EvalException.Reason.TYPE_MISMATCH, e.getReason());
    }

    @Test
    void testBareIdentifierIsText() {
        assertEquals(new Value("Aries"), eval("Aries"));
    }

    @Test
    void testConditionMustBeBoolean() {
        ExpressionNode ast = new Parser(new Lexer("Sun.House").tokenize()).parse();
        EvalException e = assertThrows(EvalException.class, () -> ExpressionEvaluator.evaluateCondition(ast, chart));
        assertEquals(EvalException.Reason.TYPE_MISMATCH, e.getReason());

        ExpressionNode condition = new Parser(new Lexer("Mars.Retrograde").tokenize()).parse();
        assertTrue(ExpressionEvaluator.evaluateCondition(condition, chart));
    }

    @Test
    void testUnsupportedAttributeValue() {
        ChartData data = ChartData.builder().planet("Sun", Map.of("Sign", new Object())).build();
        EvalException e = assertThrows(EvalException.class, () -> eval("Sun.Sign == Leo", data));
        assertEquals(EvalException.Reason.UNSUPPORTED_VALUE, e.getReason());
    }

    @Test
    void testEvaluationDoesNotModifyChart() {
        String before = chart.getPlanets().toString();
        eval("Mars.House IN [1, 4] AND Leo IN planets.Sign");
        assertEquals(before, chart.getPlanets().toString());
    }
}
