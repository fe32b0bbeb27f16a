package com.github.musiKk.haumea;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import com.github.musiKk.haumea.exception.LexicalException;
import com.github.musiKk.haumea.exception.SyntaxException;

public class Tokenizer {

    static final Set<String> RESERVED_WORDS = Set.of(
            "to", "with", "is", "return", "do", "end",
            "if", "then", "else", "let", "be", "forever",
            "while", "for", "each", "in",
            "set", "through", "change", "by", "variable");

    static final Set<String> OPERATOR_WORDS = Set.of("and", "or", "not", "modulo");

    private static final String OPERATOR_CHARS = "+=-*/<>~|&!";

    /**
     * Returns the tokens of {@code programString}. Scanning happens while the result is iterated and
     * every call to {@code iterator()} starts over from the first character. The end of the input is
     * the end of the iteration; no EOF token is handed out.
     *
     * @throws LexicalException during iteration, for an unterminated comment or an integer literal
     *         that does not fit in 32 bits
     */
    public Iterable<Token> tokenize(String programString) {
        return () -> new Scanner(programString);
    }

    static class Scanner implements Iterator<Token> {
        private final String programString;
        private int index;
        private int line = 1;
        private int column = 1;

        private Token lookahead;

        Scanner(String programString) {
            this.programString = programString;
        }

        @Override
        public boolean hasNext() {
            if (lookahead == null) {
                lookahead = nextToken();
            }
            return lookahead.type() != TokenType.EOF;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var token = lookahead;
            lookahead = null;
            return token;
        }

        Token nextToken() {
            skipWhitespaceAndComments();
            var position = new Position(line, column);

            if (atEnd()) {
                return new Token(TokenType.EOF, "", position);
            }

            char c = peek();
            if (isIdentifierStart(c)) {
                return wordToken(position);
            }
            if (isDigit(c)) {
                return numberToken(position);
            }
            for (var tokenType : TokenType.values()) {
                if (tokenType.constantPattern != null && programString.startsWith(tokenType.constantPattern, index)) {
                    advance();
                    return new Token(tokenType, tokenType.constantPattern, position);
                }
            }
            if (isOperatorChar(c)) {
                return operatorToken(position);
            }

            advance();
            return new Token(TokenType.ERROR, String.valueOf(c), position);
        }

        private void skipWhitespaceAndComments() {
            while (!atEnd()) {
                if (Character.isWhitespace(peek())) {
                    advance();
                } else if (programString.startsWith("/*", index)) {
                    skipComment();
                } else {
                    break;
                }
            }
        }

        // comments nest: "/* a /* b */ c */" is one comment
        private void skipComment() {
            var opening = new Position(line, column);
            int depth = 0;
            while (true) {
                if (atEnd()) {
                    throw new LexicalException(opening, "unterminated comment");
                }
                if (programString.startsWith("/*", index)) {
                    depth++;
                    advance();
                    advance();
                } else if (programString.startsWith("*/", index)) {
                    depth--;
                    advance();
                    advance();
                    if (depth == 0) {
                        return;
                    }
                } else {
                    advance();
                }
            }
        }

        private Token wordToken(Position position) {
            int start = index;
            while (!atEnd() && isIdentifierPart(peek())) {
                advance();
            }
            var word = programString.substring(start, index);
            if (RESERVED_WORDS.contains(word)) {
                return new Token(TokenType.KEYWORD, word, position);
            } else if (OPERATOR_WORDS.contains(word)) {
                return new Token(TokenType.OPERATOR, word, position);
            } else {
                return new Token(TokenType.IDENTIFIER, word, position);
            }
        }

        private Token numberToken(Position position) {
            int start = index;
            while (!atEnd() && isDigit(peek())) {
                advance();
            }
            var digits = programString.substring(start, index);
            try {
                Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                throw new LexicalException(position, "integer literal " + digits + " does not fit in 32 bits");
            }
            return new Token(TokenType.NUMBER, digits, position);
        }

        private Token operatorToken(Position position) {
            int start = index;
            while (!atEnd() && isOperatorChar(peek()) && !programString.startsWith("/*", index)) {
                advance();
            }
            return new Token(TokenType.OPERATOR, programString.substring(start, index), position);
        }

        private boolean atEnd() {
            return index >= programString.length();
        }

        private char peek() {
            return programString.charAt(index);
        }

        private void advance() {
            char c = programString.charAt(index++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || isDigit(c);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isOperatorChar(char c) {
            return OPERATOR_CHARS.indexOf(c) >= 0;
        }
    }

    public record Position(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public record Token(TokenType type, String image, Position position) {

        public boolean is(TokenType type, String image) {
            return this.type == type && this.image.equals(image);
        }

        public int intValue() {
            return Integer.parseInt(image);
        }

        public String describe() {
            return switch (type) {
                case NUMBER -> "number " + image;
                case IDENTIFIER -> "identifier '" + image + "'";
                case KEYWORD -> "keyword '" + image + "'";
                case OPERATOR -> "operator '" + image + "'";
                case ERROR -> "unexpected character '" + image + "'";
                case EOF -> "end of input";
                default -> "'" + image + "'";
            };
        }
    }

    public enum TokenType {
        NUMBER,
        IDENTIFIER,
        KEYWORD,
        OPERATOR,

        LPAREN("("),
        RPAREN(")"),
        COMMA(","),

        ERROR,
        EOF;

        final String constantPattern;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this.constantPattern = constantPattern;
        }
    }

    /**
     * The parser's view of a token sequence: a queue with one token of lookahead. Once the sequence is
     * exhausted, {@link #peek()} keeps returning an EOF token positioned just past the last real token.
     */
    public static class Tokens {
        private final Iterator<Token> iterator;
        private Token lookahead;
        private Position end = new Position(1, 1);

        public Tokens(Iterable<Token> tokens) {
            this.iterator = tokens.iterator();
        }

        /**
         * @throws LexicalException if the next token is an error token
         */
        public Token peek() {
            if (lookahead == null) {
                if (iterator.hasNext()) {
                    lookahead = iterator.next();
                    var position = lookahead.position();
                    end = new Position(position.line(), position.column() + lookahead.image().length());
                } else {
                    lookahead = new Token(TokenType.EOF, "", end);
                }
            }
            if (lookahead.type() == TokenType.ERROR) {
                throw new LexicalException(lookahead.position(), lookahead.describe());
            }
            return lookahead;
        }

        public Token next() {
            var token = peek();
            if (token.type() != TokenType.EOF) {
                lookahead = null;
            }
            return token;
        }

        public boolean atEnd() {
            return peek().type() == TokenType.EOF;
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public boolean matches(TokenType type, String image) {
            return peek().is(type, image);
        }

        public boolean matchesKeyword(String word) {
            return matches(TokenType.KEYWORD, word);
        }

        public Token next(TokenType type, String expected) {
            var token = peek();
            if (token.type() != type) {
                throw new SyntaxException(expected, token);
            }
            return next();
        }

        public Token nextKeyword(String word) {
            var token = peek();
            if (!token.is(TokenType.KEYWORD, word)) {
                throw new SyntaxException("'" + word + "'", token);
            }
            return next();
        }
    }

}
