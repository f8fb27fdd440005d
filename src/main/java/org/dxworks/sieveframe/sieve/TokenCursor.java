package org.dxworks.sieveframe.sieve;

import java.util.List;

/**
 * Read position over a token list. Owned by a single parse call.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int position;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    boolean atEnd() {
        return position >= tokens.size();
    }

    /** Current token, or null at end of input. */
    Token peek() {
        return atEnd() ? null : tokens.get(position);
    }

    boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.type == type;
    }

    boolean checkIdentifier(String name) {
        Token token = peek();
        return token != null && token.isIdentifier(name);
    }

    Token advance() {
        Token token = peek();
        if (token != null) position++;
        return token;
    }

    /** Consumes the current token when it has the given type. */
    boolean match(TokenType type) {
        if (check(type)) {
            position++;
            return true;
        }
        return false;
    }

    int offset() {
        Token token = peek();
        return token == null ? SieveParseException.END_OF_INPUT : token.offset;
    }

    String describeCurrent() {
        Token token = peek();
        return token == null ? "end of input" : describe(token);
    }

    static String describe(Token token) {
        return token.type + " '" + token.text + "' at offset " + token.offset;
    }
}
