package org.dxworks.sieveframe.sieve.ast;

public final class SizeTest implements TestExpr {
    public final String comparator; // ":over" or ":under" as written
    public final String limit;      // kept as text, K/M/G suffix included

    public SizeTest(String comparator, String limit) {
        this.comparator = comparator;
        this.limit = limit;
    }
}
