package org.dxworks.sieveframe.sieve.ast;

import java.util.List;

public final class RequireCommand implements Command {
    public final List<String> extensions;

    public RequireCommand(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }
}
