package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * {@code if <test> { ... }} with its elsif/else chain.
 * <p>
 * {@link #name} and {@link #enabled} are not SIEVE syntax; they are recovered from the comment
 * line in front of the {@code if} and written back there on emission.
 */
public final class IfBlock implements Command {
    public final String name; // nullable
    public final boolean enabled;
    public final TestExpr condition;
    public final List<ActionCommand> actions;
    public final List<Alternative> alternatives;

    public IfBlock(String name, boolean enabled, TestExpr condition,
                   List<ActionCommand> actions, List<Alternative> alternatives) {
        this.name = name;
        this.enabled = enabled;
        this.condition = condition;
        this.actions = List.copyOf(actions);
        this.alternatives = List.copyOf(alternatives);
    }

    public IfBlock withMetadata(String newName, boolean newEnabled) {
        return new IfBlock(newName, newEnabled, condition, actions, alternatives);
    }

    public boolean hasAlternatives() {
        return !alternatives.isEmpty();
    }
}
