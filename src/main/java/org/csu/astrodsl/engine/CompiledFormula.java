package org.csu.astrodsl.engine;

import org.csu.astrodsl.common.model.ChartData;
import org.csu.astrodsl.common.model.Value;
import org.csu.astrodsl.compiler.parser.ast.ExpressionNode;

import java.util.Objects;

/**
 * 解析完成的公式，可以对任意多张星盘重复求值，也可以在线程间共享。
 *
 * @param source 原始公式文本
 * @param root   AST 根节点
 */
public record CompiledFormula(String source, ExpressionNode root) {

    public CompiledFormula {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(root, "root");
    }

    public Value evaluate(ChartData chart) {
        return ExpressionEvaluator.evaluate(root, chart);
    }

    public boolean test(ChartData chart) {
        return ExpressionEvaluator.evaluateCondition(root, chart);
    }
}
