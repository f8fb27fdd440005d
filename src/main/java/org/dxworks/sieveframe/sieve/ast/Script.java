package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * A parsed SIEVE script: its top-level commands in source order.
 */
public final class Script {
    public final List<Command> commands;

    public Script(List<Command> commands) {
        this.commands = List.copyOf(commands);
    }

    public static Script empty() {
        return new Script(List.of());
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
