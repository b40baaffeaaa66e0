package me.christianrobert.mspgsync.script.service;

import me.christianrobert.mspgsync.core.exception.ScriptConversionException;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits T-SQL text into tokens.
 *
 * <p>Concatenating the text of all tokens gives back the input unchanged. String literals
 * (including N'...'), bracket and double-quoted identifiers and comments each become one token.
 * Block comments nest as they do in SQL Server.</p>
 */
public final class SqlTokenizer {

    private SqlTokenizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws ScriptConversionException on an unterminated literal, identifier or block comment
     */
    public static List<SqlToken> tokenize(String sql) {
        return new Scanner(sql).scan();
    }

    private static final class Scanner {
        private final String sql;
        private final List<SqlToken> tokens = new ArrayList<>();
        private int pos;
        private int line = 1;
        private int column = 1;

        Scanner(String sql) {
            this.sql = sql;
        }

        List<SqlToken> scan() {
            while (pos < sql.length()) {
                int start = pos;
                int startLine = line;
                int startColumn = column;
                TokenType type = next();
                tokens.add(new SqlToken(type, sql.substring(start, pos), startLine, startColumn));
            }
            return tokens;
        }

        private TokenType next() {
            char c = sql.charAt(pos);

            if (Character.isWhitespace(c)) {
                while (pos < sql.length() && Character.isWhitespace(sql.charAt(pos))) {
                    advance();
                }
                return TokenType.WHITESPACE;
            }
            if (c == '-' && peek(1) == '-') {
                while (pos < sql.length() && sql.charAt(pos) != '\n' && sql.charAt(pos) != '\r') {
                    advance();
                }
                return TokenType.LINE_COMMENT;
            }
            if (c == '/' && peek(1) == '*') {
                blockComment();
                return TokenType.BLOCK_COMMENT;
            }
            if (c == '\'') {
                delimited('\'', "Unterminated string literal");
                return TokenType.STRING_LITERAL;
            }
            if ((c == 'N' || c == 'n') && peek(1) == '\'') {
                advance();
                delimited('\'', "Unterminated string literal");
                return TokenType.STRING_LITERAL;
            }
            if (c == '[') {
                delimitedBy('[', ']', "Unterminated bracket identifier");
                return TokenType.BRACKET_IDENTIFIER;
            }
            if (c == '"') {
                delimited('"', "Unterminated quoted identifier");
                return TokenType.QUOTED_IDENTIFIER;
            }
            if (c == '@') {
                advance();
                if (peek(0) == '@') {
                    advance();
                }
                while (pos < sql.length() && isWordPart(sql.charAt(pos))) {
                    advance();
                }
                return TokenType.VARIABLE;
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                number();
                return TokenType.NUMBER;
            }
            if (isWordStart(c)) {
                while (pos < sql.length() && isWordPart(sql.charAt(pos))) {
                    advance();
                }
                return TokenType.WORD;
            }
            advance();
            return TokenType.SYMBOL;
        }

        private void blockComment() {
            int startLine = line;
            int startColumn = column;
            int depth = 0;
            while (pos < sql.length()) {
                if (sql.charAt(pos) == '/' && peek(1) == '*') {
                    depth++;
                    advance();
                    advance();
                } else if (sql.charAt(pos) == '*' && peek(1) == '/') {
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
            throw new ScriptConversionException("Unterminated block comment", startLine, startColumn);
        }

        /**
         * Same opening and closing character, doubled to escape.
         */
        private void delimited(char quote, String error) {
            delimitedBy(quote, quote, error);
        }

        private void delimitedBy(char open, char close, String error) {
            int startLine = line;
            int startColumn = column;
            advance();
            while (pos < sql.length()) {
                char c = sql.charAt(pos);
                advance();
                if (c == close) {
                    if (peek(0) == close) {
                        advance();
                    } else {
                        return;
                    }
                }
            }
            throw new ScriptConversionException(error, startLine, startColumn);
        }

        private void number() {
            if (sql.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
                advance();
                advance();
                while (pos < sql.length() && Character.digit(sql.charAt(pos), 16) >= 0) {
                    advance();
                }
                return;
            }
            while (pos < sql.length() && (Character.isDigit(sql.charAt(pos)) || sql.charAt(pos) == '.')) {
                advance();
            }
            if ((peek(0) == 'e' || peek(0) == 'E')
                    && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
                advance();
                advance();
                while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) {
                    advance();
                }
            }
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < sql.length() ? sql.charAt(index) : '\0';
        }

        private void advance() {
            char c = sql.charAt(pos++);
            if (c == '\n' || (c == '\r' && peek(0) != '\n')) {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
        }

        private static boolean isWordStart(char c) {
            return Character.isLetter(c) || c == '_' || c == '#';
        }

        private static boolean isWordPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '#' || c == '$';
        }
    }
}
