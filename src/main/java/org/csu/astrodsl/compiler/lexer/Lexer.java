package org.csu.astrodsl.compiler.lexer;

import org.csu.astrodsl.common.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的公式字符串分解为一系列的Token，以 EOF 结尾。
 * 遇到第一个非法字符或未闭合的字符串即抛出 {@link LexException}，不返回部分结果。
 * 一个实例只分析一段文本，不可复用。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号，从1开始
    private int column = 0;   // 当前列号，从0开始

    // 关键字映射表，区分大小写
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IN", TokenType.IN,
            "planets", TokenType.PLANETS,
            "aspects", TokenType.ASPECTS,
            "houses", TokenType.HOUSES,
            "True", TokenType.BOOLEAN,
            "False", TokenType.BOOLEAN
    );

    // 双字符运算符，优先于其单字符前缀匹配
    private static final Map<String, TokenType> TWO_CHAR_OPERATORS = Map.of(
            "==", TokenType.EQ,
            "!=", TokenType.NEQ,
            "<=", TokenType.LTE,
            ">=", TokenType.GTE,
            "&&", TokenType.AND,
            "||", TokenType.OR
    );

    private static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.of(
            '<', TokenType.LT,
            '>', TokenType.GT,
            '!', TokenType.NOT,
            '(', TokenType.LPAREN,
            ')', TokenType.RPAREN,
            '[', TokenType.LBRACKET,
            ']', TokenType.RBRACKET,
            '.', TokenType.DOT,
            ',', TokenType.COMMA
    );

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return 不可变的Token列表，最后一个总是 EOF
     * @throws LexException 遇到非法字符、非法转义或未闭合的字符串
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            if (token.type() == TokenType.ILLEGAL) {
                throw new LexException(LexException.Reason.INVALID_CHARACTER,
                        "Unexpected character '" + token.lexeme() + "'", token.line(), token.column());
            }
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return Collections.unmodifiableList(tokens);
    }

    private Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }
        if (isDigit(currentChar)) {
            return readNumber();
        }
        if (currentChar == '"' || currentChar == '\'') {
            return readString(currentChar);
        }

        // 最长匹配：先尝试双字符运算符
        if (position + 1 < input.length()) {
            String twoChars = input.substring(position, position + 2);
            TokenType type = TWO_CHAR_OPERATORS.get(twoChars);
            if (type != null) {
                Token token = new Token(type, twoChars, line, column);
                advance();
                advance();
                return token;
            }
        }

        TokenType type = SINGLE_CHAR_TOKENS.get(currentChar);
        if (type != null) {
            return consumeAndReturn(type, String.valueOf(currentChar));
        }
        return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(currentChar));
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        while (position < input.length() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, startLine, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        // 小数点后必须紧跟数字，否则 '.' 留给后续的 DOT
        if (position < input.length() && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        return new Token(TokenType.NUMBER, input.substring(startPos, position), line, startCol);
    }

    private Token readString(char quote) {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始引号
        StringBuilder value = new StringBuilder();
        while (position < input.length() && peek() != quote) {
            char ch = peek();
            if (ch == '\\') {
                int escapeLine = line;
                int escapeCol = column;
                advance();
                if (position >= input.length()) {
                    break;
                }
                char escaped = peek();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '\\', '"', '\'' -> value.append(escaped);
                    default -> throw new LexException(LexException.Reason.INVALID_ESCAPE,
                            "Unknown escape sequence '\\" + escaped + "'", escapeLine, escapeCol);
                }
                advance();
            } else {
                value.append(ch);
                advance();
            }
        }
        if (position >= input.length()) {
            throw new LexException(LexException.Reason.UNTERMINATED_STRING,
                    "Unterminated string, expected closing " + quote, startLine, startCol);
        }
        advance(); // 跳过结束引号
        return new Token(TokenType.STRING, value.toString(), startLine, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (Character.isWhitespace(ch)) {
                advance();
            } else if (ch == '#') {
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        if (input.charAt(position) == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return Character.isLetter(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
