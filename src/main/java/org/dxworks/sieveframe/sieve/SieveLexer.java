package org.dxworks.sieveframe.sieve;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single-pass tokenizer for SIEVE script text (RFC 5228 subset).
 * <p>
 * Whitespace separates tokens and is dropped. Matching is ASCII-level; anything that is not
 * ASCII is only accepted inside string literals and comments.
 */
public final class SieveLexer {

    private final String input;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private SieveLexer(String input) {
        this.input = input;
        this.length = input.length();
    }

    public static List<Token> tokenize(String input) throws SieveParseException {
        SieveLexer lexer = new SieveLexer(input);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws SieveParseException {
        while (pos < length) {
            char c = input.charAt(pos);
            if (isWhitespace(c)) {
                pos++;
                continue;
            }

            TokenType punctuation = punctuation(c);
            if (punctuation != null) {
                tokens.add(new Token(punctuation, String.valueOf(c), pos, 1));
                pos++;
            } else if (c == '#') {
                readLineComment();
            } else if (c == '/' && peek(1) == '*') {
                readBlockComment();
            } else if (c == '"') {
                readQuotedString();
            } else if ((c == 't' || c == 'T') && input.regionMatches(true, pos, "text:", 0, 5)) {
                readMultiLineString();
            } else if (c == ':') {
                readTag();
            } else if (isDigit(c)) {
                readNumber();
            } else if (isLetter(c) || c == '_') {
                readIdentifier();
            } else {
                throw new SieveParseException(ErrorKind.UNEXPECTED_CHARACTER, pos,
                        "Unexpected character '" + c + "' at offset " + pos);
            }
        }
    }

    private void readLineComment() {
        int start = pos;
        pos++;
        while (pos < length && input.charAt(pos) != '\n') {
            pos++;
        }
        String text = input.substring(start + 1, pos).trim();
        tokens.add(new Token(TokenType.COMMENT, text, start, pos - start));
    }

    private void readBlockComment() throws SieveParseException {
        int start = pos;
        pos += 2;
        int bodyStart = pos;
        while (true) {
            if (pos + 1 >= length) {
                throw new SieveParseException(ErrorKind.UNTERMINATED_COMMENT, start,
                        "Unterminated block comment at offset " + start);
            }
            if (input.charAt(pos) == '*' && input.charAt(pos + 1) == '/') {
                break;
            }
            pos++;
        }
        String text = input.substring(bodyStart, pos).trim();
        pos += 2;
        tokens.add(new Token(TokenType.BLOCK_COMMENT, text, start, pos - start));
    }

    private void readQuotedString() throws SieveParseException {
        int start = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= length) {
                throw new SieveParseException(ErrorKind.UNTERMINATED_STRING, start,
                        "Unterminated string at offset " + start);
            }
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < length) {
                // only the next character is taken literally, no other escapes exist
                value.append(input.charAt(pos + 1));
                pos += 2;
            } else if (c == '"') {
                pos++;
                break;
            } else {
                value.append(c);
                pos++;
            }
        }
        tokens.add(new Token(TokenType.QUOTED_STRING, value.toString(), start, pos - start));
    }

    /**
     * {@code text:} literal. The rest of the introducing line is ignored; the body runs until a
     * line holding only a dot, which is consumed but not part of the value.
     */
    private void readMultiLineString() throws SieveParseException {
        int start = pos;
        pos += 5;
        skipPastLineEnd();
        int bodyStart = pos;
        while (true) {
            if (pos >= length) {
                throw new SieveParseException(ErrorKind.UNTERMINATED_MULTILINE, start,
                        "Unterminated multi-line string at offset " + start);
            }
            if (input.charAt(pos) == '.' && endsTerminatorLine(pos + 1)) {
                String body = input.substring(bodyStart, pos);
                pos++;
                if (pos < length && input.charAt(pos) == '\r') pos++;
                if (pos < length && input.charAt(pos) == '\n') pos++;
                tokens.add(new Token(TokenType.MULTI_LINE_STRING, body, start, pos - start));
                return;
            }
            skipPastLineEnd();
        }
    }

    private boolean endsTerminatorLine(int next) {
        if (next >= length) return true;
        char c = input.charAt(next);
        if (c == '\n') return true;
        return c == '\r' && (next + 1 >= length || input.charAt(next + 1) == '\n');
    }

    private void skipPastLineEnd() {
        while (pos < length && input.charAt(pos) != '\n') {
            pos++;
        }
        if (pos < length) pos++;
    }

    private void readTag() {
        int start = pos;
        pos++;
        while (pos < length && isWordChar(input.charAt(pos))) {
            pos++;
        }
        String tag = input.substring(start, pos).toLowerCase(Locale.ROOT);
        tokens.add(new Token(TokenType.TAG, tag, start, pos - start));
    }

    private void readNumber() {
        int start = pos;
        while (pos < length && isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < length && isQuantifier(input.charAt(pos))) {
            pos++;
        }
        tokens.add(new Token(TokenType.NUMBER, input.substring(start, pos), start, pos - start));
    }

    private void readIdentifier() {
        int start = pos;
        while (pos < length && isWordChar(input.charAt(pos))) {
            pos++;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, input.substring(start, pos), start, pos - start));
    }

    private char peek(int ahead) {
        int index = pos + ahead;
        return index < length ? input.charAt(index) : '\0';
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case ';' -> TokenType.SEMICOLON;
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            default -> null;
        };
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isWordChar(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }

    static boolean isQuantifier(char c) {
        return c == 'K' || c == 'k' || c == 'M' || c == 'm' || c == 'G' || c == 'g';
    }
}
