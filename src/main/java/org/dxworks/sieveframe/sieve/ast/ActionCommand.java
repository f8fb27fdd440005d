package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

/**
 * An action such as {@code fileinto "Junk";}, either inside a block or bare at top level.
 */
public final class ActionCommand implements Command {
    public final String name;
    public final List<Argument> arguments;

    public ActionCommand(String name, List<Argument> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }
}
