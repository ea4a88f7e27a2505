package org.csu.astrodsl.engine;

import org.csu.astrodsl.common.exception.EvalException;
import org.csu.astrodsl.common.exception.FormulaException;
import org.csu.astrodsl.common.exception.LexException;
import org.csu.astrodsl.common.exception.ParseException;
import org.csu.astrodsl.common.exception.SemanticException;
import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.lexer.Token;
import org.csu.astrodsl.compiler.lexer.TokenType;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;
import org.csu.astrodsl.compiler.semantic.FormulaValidator;
import org.csu.astrodsl.config.FormulaPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * FormulaEngine 的测试：完整管道、复杂度限制、批量求值的错误隔离和领域校验器的接入。
 */
@ExtendWith(MockitoExtension.class)
public class FormulaEngineTest {

    @Mock
    private FormulaValidator validator;

    private FormulaEngine engine;
    private ChartData natal;
    private ChartData transit;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        natal = ChartData.builder()
                .planet("Sun", Map.of("Sign", "Capricorn", "House", 9, "Retrograde", false))
                .planet("Mars", Map.of("Sign", "Leo", "House", 4, "Retrograde", true))
                .build();
        transit = ChartData.builder()
                .planet("Sun", Map.of("Sign", "Leo", "House", 1, "Retrograde", false))
                .build();
    }

    @Test
    void testTokenize() {
        List<Token> tokens = engine.tokenize("Sun.Sign == Aries");
        assertEquals(6, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(5).type());
    }

    @Test
    void testEvaluateAndTest() {
        System.out.println("--- Running test: testEvaluateAndTest ---");
        assertEquals(Value.TRUE, engine.evaluate("Sun.Sign == Capricorn AND Mars.House IN [1, 4, 7, 10]", natal));
        assertTrue(engine.test("Mars.Retrograde", natal));
        assertFalse(engine.test("NOT Mars.Retrograde", natal));
        assertEquals(new Value("Capricorn"), engine.evaluate("Sun.Sign", natal));
    }

    @Test
    void testCompiledFormulaIsReusable() {
        CompiledFormula formula = engine.compile("Sun.House > 5");
        assertTrue(formula.test(natal));
        assertFalse(formula.test(transit));
        assertEquals("Sun.House > 5", formula.source());
    }

    @Test
    void testErrorsCarryTheirStage() {
        assertEquals(FormulaException.Stage.LEX,
                assertThrows(LexException.class, () -> engine.compile("Sun.Sign = Leo")).getStage());
        assertEquals(FormulaException.Stage.PARSE,
                assertThrows(ParseException.class, () -> engine.compile("Sun.Sign ==")).getStage());
        assertEquals(FormulaException.Stage.EVAL,
                assertThrows(EvalException.class, () -> engine.evaluate("Moon.Sign == Leo", natal)).getStage());
    }

    @Test
    void testFormulaLengthLimit() {
        FormulaEngine strict = new FormulaEngine(new FormulaPolicy("tiny", 10, 4));
        assertTrue(strict.test("Sun.House", ChartData.builder().planet("Sun", Map.of("House", true)).build()));

        LexException e = assertThrows(LexException.class, () -> strict.compile("Sun.House == 9"));
        assertEquals(LexException.Reason.INPUT_TOO_LONG, e.getReason());
        assertTrue(e.getMessage().contains("14 characters"), e.getMessage());
        assertThrows(LexException.class, () -> strict.tokenize("Sun.House == 9"));
    }

    @Test
    void testNestingLimitComesFromPolicy() {
        FormulaEngine shallow = new FormulaEngine(new FormulaPolicy("shallow", 100, 2));
        assertTrue(shallow.test("NOT NOT Mars.Retrograde", natal));

        ParseException e = assertThrows(ParseException.class, () -> shallow.compile("NOT NOT NOT Mars.Retrograde"));
        assertEquals(ParseException.Reason.NESTING_TOO_DEEP, e.getReason());
    }

    @Test
    void testValidatorIsConsultedAfterParsing() {
        FormulaEngine validated = new FormulaEngine(FormulaPolicy.defaults(), validator);
        assertTrue(validated.test("Sun.House == 9", natal));
        verify(validator).validate(any(ExpressionNode.class));

        doThrow(new SemanticException("rejected")).when(validator).validate(any());
        SemanticException e = assertThrows(SemanticException.class, () -> validated.compile("Sun.House == 9"));
        assertEquals(FormulaException.Stage.VALIDATION, e.getStage());
    }

    @Test
    void testValidatorIsNotCalledForSyntaxErrors() {
        FormulaEngine validated = new FormulaEngine(FormulaPolicy.defaults(), validator);
        assertThrows(ParseException.class, () -> validated.compile("(Sun.House == 9"));
        verifyNoInteractions(validator);
    }

    @Test
    void testEvaluateAllIsolatesFailures() {
        System.out.println("--- Running test: testEvaluateAllIsolatesFailures ---");
        List<String> formulas = List.of("Sun.Sign == Leo", "Mars.Retrograde", "Sun.Sign ==");
        List<FormulaOutcome> outcomes = engine.evaluateAll(formulas, List.of(natal, transit));

        assertEquals(6, outcomes.size());

        // 公式优先，星盘其次
        assertEquals("Sun.Sign == Leo", outcomes.get(0).formula());
        assertEquals(0, outcomes.get(0).chartIndex());
        assertEquals(Value.FALSE, outcomes.get(0).result());
        assertEquals(1, outcomes.get(1).chartIndex());
        assertEquals(Value.TRUE, outcomes.get(1).result());

        // transit 中没有 Mars，只有这个组合失败
        assertTrue(outcomes.get(2).isSuccess());
        assertFalse(outcomes.get(3).isSuccess());
        assertInstanceOf(EvalException.class, outcomes.get(3).error());

        // 语法错误对每张星盘都报告一次
        assertInstanceOf(ParseException.class, outcomes.get(4).error());
        assertInstanceOf(ParseException.class, outcomes.get(5).error());
        assertNull(outcomes.get(5).result());
    }

    @Test
    void testEvaluateAllWithNoCharts() {
        assertTrue(engine.evaluateAll(List.of("Sun.Sign == Leo", "(("), List.of()).isEmpty());
    }

    @Test
    void testEvaluateAllRejectsNullEntriesUpFront() {
        System.out.println("--- Running test: testEvaluateAllRejectsNullEntriesUpFront ---");
        FormulaEngine validated = new FormulaEngine(FormulaPolicy.defaults(), validator);

        NullPointerException chartError = assertThrows(NullPointerException.class,
                () -> validated.evaluateAll(List.of("Sun.Sign == Leo"), Arrays.asList(natal, null)));
        assertEquals("charts must not contain null", chartError.getMessage());
        NullPointerException formulaError = assertThrows(NullPointerException.class,
                () -> validated.evaluateAll(Arrays.asList("Mars.Retrograde", null), List.of(natal)));
        assertEquals("formulas must not contain null", formulaError.getMessage());

        // 检查发生在编译之前，没有任何公式被处理
        verifyNoInteractions(validator);
    }

    @Test
    void testRepeatedEvaluationIsDeterministic() {
        CompiledFormula formula = engine.compile("Leo IN planets.Sign OR Sun.House >= 10");
        Value first = formula.evaluate(natal);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, formula.evaluate(natal));
        }
        assertEquals(engine.compile("Leo IN planets.Sign OR Sun.House >= 10").root(), formula.root());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 9, 12})
    void testInMatchesEqualityDisjunction(int house) {
        ChartData chart = ChartData.builder().planet("Mars", Map.of("House", house)).build();
        boolean viaIn = engine.test("Mars.House IN [1, 4, 7, 10]", chart);
        boolean viaOr = engine.test("Mars.House == 1 OR Mars.House == 4 OR Mars.House == 7 OR Mars.House == 10", chart);
        assertEquals(viaOr, viaIn);
    }

    @Test
    void testSharedFormulaAcrossThreads() throws Exception {
        CompiledFormula formula = engine.compile("Sun.Sign == Capricorn AND NOT (Mars.House IN [1, 7])");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                ChartData chart = i % 2 == 0 ? natal : transit;
                futures.add(pool.submit(() -> chart == natal ? formula.test(chart) : !engine.test("Sun.House == 9", chart)));
            }
            for (Future<Boolean> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
