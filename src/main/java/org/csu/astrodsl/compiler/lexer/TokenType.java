package org.csu.astrodsl.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 公式语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 逻辑运算符 ----
    AND,        // AND, &&
    OR,         // OR, ||
    NOT,        // NOT, !

    // ---- 比较运算符 ----
    EQ,         // ==
    NEQ,        // !=
    LT,         // <
    GT,         // >
    LTE,        // <=
    GTE,        // >=
    IN,         // IN

    // ---- 聚合器关键字 (只识别小写) ----
    PLANETS,    // planets
    ASPECTS,    // aspects
    HOUSES,     // houses

    // ---- 分隔符 ----
    LPAREN,     // (
    RPAREN,     // )
    LBRACKET,   // [
    RBRACKET,   // ]
    DOT,        // .
    COMMA,      // ,

    // ---- 字面量 ----
    NUMBER,     // 123, 45.6
    STRING,     // "text", 'text'
    BOOLEAN,    // True, False

    // ---- 标识符 ----
    IDENTIFIER, // Sun, Sign, Aries ...

    // ---- 特殊 Token ----
    EOF,        // 输入结束
    ILLEGAL     // 非法字符，tokenize() 遇到即失败
}
