package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * Action argument. {@link #value} holds the text of scalar kinds, {@link #values} the items of a
 * string list (and is empty otherwise).
 */
public final class Argument {

    public enum Kind {
        QUOTED_STRING,
        NUMBER,
        TAG,
        STRING_LIST,
        MULTI_LINE_STRING
    }

    public final Kind kind;
    public final String value;
    public final List<String> values;

    private Argument(Kind kind, String value, List<String> values) {
        this.kind = kind;
        this.value = value;
        this.values = List.copyOf(values);
    }

    public static Argument quoted(String value) {
        return new Argument(Kind.QUOTED_STRING, value, List.of());
    }

    public static Argument number(String value) {
        return new Argument(Kind.NUMBER, value, List.of());
    }

    public static Argument tag(String value) {
        return new Argument(Kind.TAG, value, List.of());
    }

    public static Argument multiLine(String body) {
        return new Argument(Kind.MULTI_LINE_STRING, body, List.of());
    }

    public static Argument stringList(List<String> values) {
        return new Argument(Kind.STRING_LIST, null, values);
    }

    public boolean isString() {
        return kind == Kind.QUOTED_STRING || kind == Kind.MULTI_LINE_STRING;
    }
}
