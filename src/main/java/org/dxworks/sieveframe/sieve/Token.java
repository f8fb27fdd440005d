package org.dxworks.sieveframe.sieve;

/**
 * A lexical token with the source span it was read from.
 * For strings and comments {@link #text} is the decoded value, for punctuation the character itself.
 */
public final class Token {
    public final TokenType type;
    public final String text;
    public final int offset;
    public final int length;

    public Token(TokenType type, String text, int offset, int length) {
        this.type = type;
        this.text = text;
        this.offset = offset;
        this.length = length;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /** Case-insensitive identifier check. */
    public boolean isIdentifier(String name) {
        return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + offset;
    }
}
