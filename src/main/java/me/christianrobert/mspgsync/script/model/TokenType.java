package me.christianrobert.mspgsync.script.model;

public enum TokenType {
    WORD,
    BRACKET_IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING_LITERAL,
    NUMBER,
    VARIABLE,
    SYMBOL,
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT
}
