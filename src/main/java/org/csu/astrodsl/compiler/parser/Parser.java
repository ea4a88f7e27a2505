package org.csu.astrodsl.compiler.parser;

import org.csu.astrodsl.common.exception.ParseException;
import org.csu.astrodsl.compiler.lexer.Token;
import org.csu.astrodsl.compiler.lexer.TokenType;
import org.csu.astrodsl.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 *
 * 优先级从高到低为 NOT、AND、OR，括号可以改变优先级；每一层最多一个比较运算符。
 * 每次进入括号、NOT 或列表时深度加一，超过 maxDepth 立即失败，避免恶意嵌套耗尽调用栈。
 * 一个实例只解析一个Token流，不可复用。
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final List<Token> tokens;
    private final int maxDepth;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.tokens = withEndMarker(tokens);
        this.maxDepth = maxDepth;
    }

    /**
     * 解析整个Token流
     * @return AST 根节点
     * @throws ParseException 公式为空、出现意外的Token、括号未闭合、点号访问不完整或嵌套过深
     */
    public ExpressionNode parse() {
        if (isAtEnd()) {
            throw new ParseException(ParseException.Reason.EMPTY_FORMULA, peek(), "a formula");
        }
        ExpressionNode expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException(ParseException.Reason.UNEXPECTED_TOKEN, peek(),
                    "end of formula or a logical operator (AND, OR)");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        return parseOrExpression();
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            ExpressionNode right = parseAndExpression();
            left = new BinaryExpressionNode(LogicalOperator.OR, left, right);
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (match(TokenType.AND)) {
            ExpressionNode right = parseNotExpression();
            left = new BinaryExpressionNode(LogicalOperator.AND, left, right);
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        if (match(TokenType.NOT)) {
            descend(previous());
            try {
                return new UnaryExpressionNode(UnaryOperator.NOT, parseNotExpression());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parsePrimaryExpression();
        ComparisonOperator operator = ComparisonOperator.fromTokenType(peek().type());
        if (operator == null) {
            return left;
        }
        advance();
        ExpressionNode right = parsePrimaryExpression();
        if (ComparisonOperator.fromTokenType(peek().type()) != null) {
            throw new ParseException(ParseException.Reason.UNEXPECTED_TOKEN, peek(),
                    "a single comparison (chained comparisons are not allowed)");
        }
        return new ComparisonNode(operator, left, right);
    }

    private ExpressionNode parsePrimaryExpression() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return NumberLiteralNode.of(token.lexeme());
            case STRING:
                advance();
                return new StringLiteralNode(token.lexeme());
            case BOOLEAN:
                advance();
                return new BooleanLiteralNode("True".equals(token.lexeme()));
            case LBRACKET:
                return parseListLiteral();
            case PLANETS:
            case ASPECTS:
            case HOUSES:
                return parseAggregatorAccess();
            case IDENTIFIER:
                return parseIdentifierOrPropertyAccess();
            case LPAREN:
                return parseParenthesized();
            default:
                throw new ParseException(ParseException.Reason.UNEXPECTED_TOKEN, token,
                        "an expression (a literal, a list, an identifier, a property access or '(')");
        }
    }

    private ExpressionNode parseParenthesized() {
        Token open = advance();
        descend(open);
        try {
            ExpressionNode expression = parseExpression();
            expectClosing(TokenType.RPAREN, "')'");
            return expression;
        } finally {
            depth--;
        }
    }

    private ListLiteralNode parseListLiteral() {
        Token open = advance();
        descend(open);
        try {
            List<ExpressionNode> items = new ArrayList<>();
            if (match(TokenType.RBRACKET)) {
                return new ListLiteralNode(items);
            }
            do {
                items.add(parsePrimaryExpression());
            } while (match(TokenType.COMMA));
            expectClosing(TokenType.RBRACKET, "',' or ']'");
            return new ListLiteralNode(items);
        } finally {
            depth--;
        }
    }

    private AggregatorAccessNode parseAggregatorAccess() {
        Token aggregatorToken = advance();
        if (!match(TokenType.DOT)) {
            throw new ParseException(ParseException.Reason.MALFORMED_ACCESS, peek(),
                    "'.' after aggregator '" + aggregatorToken.lexeme() + "'");
        }
        Token property = expectPropertyName(aggregatorToken);
        return new AggregatorAccessNode(Aggregator.fromTokenType(aggregatorToken.type()), property.lexeme());
    }

    private ExpressionNode parseIdentifierOrPropertyAccess() {
        Token identifier = advance();
        if (match(TokenType.DOT)) {
            Token property = expectPropertyName(identifier);
            return new PropertyAccessNode(identifier.lexeme(), property.lexeme());
        }
        return new IdentifierNode(identifier.lexeme());
    }

    private Token expectPropertyName(Token owner) {
        if (check(TokenType.IDENTIFIER)) {
            return advance();
        }
        throw new ParseException(ParseException.Reason.MALFORMED_ACCESS, peek(),
                "property name after '" + owner.lexeme() + ".'");
    }

    private void expectClosing(TokenType type, String expected) {
        if (match(type)) {
            return;
        }
        ParseException.Reason reason = isAtEnd()
                ? ParseException.Reason.MISSING_CLOSING_DELIMITER
                : ParseException.Reason.UNEXPECTED_TOKEN;
        throw new ParseException(reason, peek(), expected);
    }

    private void descend(Token opening) {
        depth++;
        if (depth > maxDepth) {
            throw new ParseException(ParseException.Reason.NESTING_TOO_DEEP, opening,
                    "at most " + maxDepth + " levels of nesting");
        }
    }

    // --- 辅助方法 ---

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }

    private static List<Token> withEndMarker(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF) {
            return tokens;
        }
        List<Token> copy = new ArrayList<>(tokens);
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        copy.add(last == null
                ? new Token(TokenType.EOF, "", 1, 0)
                : new Token(TokenType.EOF, "", last.line(), last.column() + last.lexeme().length()));
        return copy;
    }
}
