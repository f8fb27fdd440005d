package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * A branch following an {@code if} block: {@link ElsIfBranch} or the terminal {@link ElseBranch}.
 */
public abstract class Alternative {
    public final List<ActionCommand> actions;

    protected Alternative(List<ActionCommand> actions) {
        this.actions = List.copyOf(actions);
    }
}
