package org.csu.astrodsl.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csu.astrodsl.common.exception.FormulaException;
import org.csu.astrodsl.common.exception.LexException;
import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.lexer.Lexer;
import org.csu.astrodsl.compiler.lexer.Token;
import org.csu.astrodsl.compiler.parser.Parser;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;
import org.csu.astrodsl.compiler.semantic.FormulaValidator;
import org.csu.astrodsl.config.FormulaPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 公式处理的入口：长度检查 → 词法分析 → 语法分析 → (可选) 领域校验 → 求值。
 *
 * 引擎本身不保存可变状态，可以在多个线程中共享。
 */
@Slf4j
public class FormulaEngine {

    @Getter
    private final FormulaPolicy policy;
    private final FormulaValidator validator;

    public FormulaEngine() {
        this(FormulaPolicy.defaults());
    }

    public FormulaEngine(FormulaPolicy policy) {
        this(policy, null);
    }

    /**
     * @param policy    复杂度限制
     * @param validator 领域校验器，可以为 null
     */
    public FormulaEngine(FormulaPolicy policy, FormulaValidator validator) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.validator = validator;
    }

    public List<Token> tokenize(String formula) {
        checkLength(formula);
        return new Lexer(formula).tokenize();
    }

    /**
     * 将公式文本编译为可重复求值的 {@link CompiledFormula}
     * @throws FormulaException 任一阶段失败
     */
    public CompiledFormula compile(String formula) {
        List<Token> tokens = tokenize(formula);
        ExpressionNode root = new Parser(tokens, policy.maxNestingDepth()).parse();
        if (validator != null) {
            validator.validate(root);
        }
        log.debug("Compiled formula '{}' ({} tokens) into {}", formula, tokens.size(), root);
        return new CompiledFormula(formula, root);
    }

    public Value evaluate(String formula, ChartData chart) {
        return compile(formula).evaluate(chart);
    }

    public boolean test(String formula, ChartData chart) {
        return compile(formula).test(chart);
    }

    /**
     * 对每个公式和每张星盘的组合分别求值。
     * 某个组合失败只会得到一个失败的结果，不影响其他组合。
     *
     * @return 按公式优先、星盘其次的顺序排列的结果
     * @throws NullPointerException 参数或其中的元素为 null，此时不会求值任何组合
     */
    public List<FormulaOutcome> evaluateAll(Collection<String> formulas, List<ChartData> charts) {
        formulas.forEach(formula -> Objects.requireNonNull(formula, "formulas must not contain null"));
        charts.forEach(chart -> Objects.requireNonNull(chart, "charts must not contain null"));
        List<FormulaOutcome> outcomes = new ArrayList<>(formulas.size() * charts.size());
        for (String formula : formulas) {
            CompiledFormula compiled;
            try {
                compiled = compile(formula);
            } catch (FormulaException e) {
                log.warn("Formula '{}' rejected at {} stage: {}", formula, e.getStage(), e.getMessage());
                for (int i = 0; i < charts.size(); i++) {
                    outcomes.add(FormulaOutcome.failure(formula, i, e));
                }
                continue;
            }
            for (int i = 0; i < charts.size(); i++) {
                try {
                    outcomes.add(FormulaOutcome.success(formula, i, compiled.evaluate(charts.get(i))));
                } catch (FormulaException e) {
                    log.warn("Formula '{}' failed on chart #{}: {}", formula, i, e.getMessage());
                    outcomes.add(FormulaOutcome.failure(formula, i, e));
                }
            }
        }
        return outcomes;
    }

    private void checkLength(String formula) {
        Objects.requireNonNull(formula, "formula");
        if (formula.length() > policy.maxFormulaLength()) {
            throw new LexException(LexException.Reason.INPUT_TOO_LONG,
                    "Formula too long: " + formula.length() + " characters (max: "
                            + policy.maxFormulaLength() + ", policy " + policy.name() + ")",
                    1, policy.maxFormulaLength());
        }
    }
}
