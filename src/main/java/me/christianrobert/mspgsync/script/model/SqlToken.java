package me.christianrobert.mspgsync.script.model;

/**
 * One lexical unit of a T-SQL script. Literals, quoted identifiers and comments are single
 * opaque tokens, so rules working on tokens never see their content as keywords.
 */
public final class SqlToken {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;

    public SqlToken(TokenType type, String text, int line, int column) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public SqlToken withPosition(int newLine, int newColumn) {
        return new SqlToken(type, text, newLine, newColumn);
    }

    /**
     * Whitespace or comment.
     */
    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.LINE_COMMENT || type == TokenType.BLOCK_COMMENT;
    }

    public boolean isWord(String word) {
        return type == TokenType.WORD && text.equalsIgnoreCase(word);
    }

    public boolean isSymbol(char symbol) {
        return type == TokenType.SYMBOL && text.length() == 1 && text.charAt(0) == symbol;
    }

    public boolean isIdentifier() {
        return type == TokenType.WORD || type == TokenType.BRACKET_IDENTIFIER || type == TokenType.QUOTED_IDENTIFIER;
    }

    /**
     * The identifier's name without delimiters, or null if this token is no identifier.
     * "[Order]]s]" -> "Order]s", "\"a\"\"b\"" -> "a\"b".
     */
    public String identifierName() {
        switch (type) {
            case WORD:
                return text;
            case BRACKET_IDENTIFIER:
                return text.substring(1, text.length() - 1).replace("]]", "]");
            case QUOTED_IDENTIFIER:
                return text.substring(1, text.length() - 1).replace("\"\"", "\"");
            default:
                return null;
        }
    }

    public boolean hasIdentifierName(String name) {
        String own = identifierName();
        return own != null && own.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + line + ":" + column;
    }
}
