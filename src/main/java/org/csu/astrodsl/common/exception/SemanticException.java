package org.csu.astrodsl.common.exception;

/**
 * 语义校验阶段的异常：公式语法正确，但在占星领域内没有意义。
 */
public final class SemanticException extends FormulaException {

    public SemanticException(String message) {
        super(message);
    }

    @Override
    public Stage getStage() {
        return Stage.VALIDATION;
    }
}
