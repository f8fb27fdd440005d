package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * Boolean combinator over an ordered list of tests.
 */
public abstract class TestListExpr implements TestExpr {
    public final List<TestExpr> tests;

    protected TestListExpr(List<TestExpr> tests) {
        this.tests = List.copyOf(tests);
    }

    public abstract String keyword();
}
