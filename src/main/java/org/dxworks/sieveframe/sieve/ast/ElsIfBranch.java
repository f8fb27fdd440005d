package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

public final class ElsIfBranch extends Alternative {
    public final TestExpr condition;

    public ElsIfBranch(TestExpr condition, List<ActionCommand> actions) {
        super(actions);
        this.condition = condition;
    }
}
