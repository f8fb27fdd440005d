package org.dxworks.sieveframe.sieve;

public enum TokenType {
    TAG,
    IDENTIFIER,
    QUOTED_STRING,
    MULTI_LINE_STRING,
    NUMBER,
    COMMENT,
    BLOCK_COMMENT,
    SEMICOLON,
    COMMA,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET;

    public boolean isComment() {
        return this == COMMENT || this == BLOCK_COMMENT;
    }
}
