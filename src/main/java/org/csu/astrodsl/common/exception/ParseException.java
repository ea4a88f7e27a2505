package org.csu.astrodsl.common.exception;

import lombok.Getter;
import org.csu.astrodsl.compiler.lexer.Token;
import org.csu.astrodsl.compiler.lexer.TokenType;

/**
 * 语法分析阶段的异常。
 *
 * 记录出错的 Token、期望的内容以及实际遇到的内容。
 */
@Getter
public final class ParseException extends FormulaException {

    public enum Reason {
        EMPTY_FORMULA,
        UNEXPECTED_TOKEN,
        MISSING_CLOSING_DELIMITER,
        MALFORMED_ACCESS,
        NESTING_TOO_DEEP
    }

    private final Reason reason;
    private final transient Token token;
    private final String expected;
    private final String found;

    public ParseException(Reason reason, Token token, String expected) {
        super(String.format("Syntax error at line %d, column %d: Expected %s, but found %s",
                token.line(),
                token.column(),
                expected,
                describe(token)));
        this.reason = reason;
        this.token = token;
        this.expected = expected;
        this.found = describe(token);
    }

    public int getLine() {
        return token.line();
    }

    public int getColumn() {
        return token.column();
    }

    @Override
    public Stage getStage() {
        return Stage.PARSE;
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.EOF) {
            return "end of formula";
        }
        return "'" + token.lexeme() + "' (" + token.type() + ")";
    }
}
