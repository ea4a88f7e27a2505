package org.csu.astrodsl.common.exception;

/**
 * 公式处理过程中所有错误的根类型。
 *
 * 每个阶段只抛出自己的子类型，调用方可以通过 {@link #getStage()} 或 instanceof 区分失败阶段，
 * 而不需要匹配异常消息。
 */
public abstract sealed class FormulaException extends RuntimeException
        permits LexException, ParseException, SemanticException, EvalException {

    /**
     * 出错的处理阶段
     */
    public enum Stage {
        LEX,
        PARSE,
        VALIDATION,
        EVAL
    }

    protected FormulaException(String message) {
        super(message);
    }

    public abstract Stage getStage();
}
