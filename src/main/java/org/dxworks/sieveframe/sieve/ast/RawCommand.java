package org.dxworks.sieveframe.sieve.ast;

/**
 * Text that is carried through emission byte for byte.
 */
public final class RawCommand implements Command {
    public final String text;

    public RawCommand(String text) {
        this.text = text;
    }
}
