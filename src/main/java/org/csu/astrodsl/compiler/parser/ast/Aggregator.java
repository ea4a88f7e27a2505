package org.csu.astrodsl.compiler.parser.ast;

import org.csu.astrodsl.compiler.lexer.TokenType;

/**
 * 聚合器：对星盘中某一类条目的同名属性做投影。
 */
public enum Aggregator {
    PLANETS("planets"),
    HOUSES("houses"),
    ASPECTS("aspects");

    private final String keyword;

    Aggregator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return 与 Token 类型对应的聚合器；不是聚合器关键字时返回 null
     */
    public static Aggregator fromTokenType(TokenType type) {
        return switch (type) {
            case PLANETS -> PLANETS;
            case HOUSES -> HOUSES;
            case ASPECTS -> ASPECTS;
            default -> null;
        };
    }
}
