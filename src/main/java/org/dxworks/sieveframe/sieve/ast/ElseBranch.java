package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

public final class ElseBranch extends Alternative {

    public ElseBranch(List<ActionCommand> actions) {
        super(actions);
    }
}
