package org.csu.astrodsl.compiler.parser.ast;

import org.csu.astrodsl.compiler.lexer.TokenType;

/**
 * 比较运算符及其在公式中的书写形式。
 */
public enum ComparisonOperator {
    EQ("=="),
    NEQ("!="),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">="),
    IN("IN");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return 与 Token 类型对应的运算符；不是比较运算符时返回 null
     */
    public static ComparisonOperator fromTokenType(TokenType type) {
        return switch (type) {
            case EQ -> EQ;
            case NEQ -> NEQ;
            case LT -> LT;
            case GT -> GT;
            case LTE -> LTE;
            case GTE -> GTE;
            case IN -> IN;
            default -> null;
        };
    }
}
