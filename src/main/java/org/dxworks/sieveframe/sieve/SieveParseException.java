package org.dxworks.sieveframe.sieve;

/**
 * Raised by the lexer and parser when script text does not fit the accepted grammar.
 */
public class SieveParseException extends Exception {

    /** Offset used when the problem is the end of input itself. */
    public static final int END_OF_INPUT = -1;

    private final ErrorKind kind;
    private final int offset;

    public SieveParseException(ErrorKind kind, int offset, String message) {
        super(message);
        this.kind = kind;
        this.offset = offset;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Renders the offset as a 1-based {@code line:column} pair against the source it came from.
     */
    public String describePosition(String source) {
        if (offset < 0 || source == null) return "end of input";
        int line = 1;
        int column = 1;
        int limit = Math.min(offset, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return line + ":" + column;
    }
}
