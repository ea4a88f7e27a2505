package org.csu.astrodsl.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的文本值；字符串常量为去掉引号并处理转义后的内容
 * @param line 所在的行号，从1开始
 * @param column 所在的列号，从0开始
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
