package org.csu.astrodsl.engine;

import org.csu.astrodsl.common.exception.FormulaException;
import org.csu.astrodsl.common.model.Value;

/**
 * 封装一次 (公式, 星盘) 求值的结果：成功时 result 非空，失败时 error 非空。
 */
public record FormulaOutcome(
        String formula,     // 公式文本
        int chartIndex,     // 星盘在输入中的下标
        Value result,
        FormulaException error
) {

    public static FormulaOutcome success(String formula, int chartIndex, Value result) {
        return new FormulaOutcome(formula, chartIndex, result, null);
    }

    public static FormulaOutcome failure(String formula, int chartIndex, FormulaException error) {
        return new FormulaOutcome(formula, chartIndex, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
