package org.csu.astrodsl.common.exception;

import lombok.Getter;

/**
 * 词法分析阶段的异常，携带出错字符所在的行号 (从1开始) 和列号 (从0开始)。
 */
@Getter
public final class LexException extends FormulaException {

    public enum Reason {
        INVALID_CHARACTER,
        UNTERMINATED_STRING,
        INVALID_ESCAPE,
        INPUT_TOO_LONG
    }

    private final Reason reason;
    private final int line;
    private final int column;

    public LexException(Reason reason, String message, int line, int column) {
        super(String.format("Lexical error at line %d, column %d: %s", line, column, message));
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    @Override
    public Stage getStage() {
        return Stage.LEX;
    }
}
