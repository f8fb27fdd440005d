package org.dxworks.sieveframe.sieve.ast;

public final class CommentCommand implements Command {
    public final String text; // without the leading '#', trimmed

    public CommentCommand(String text) {
        this.text = text;
    }
}
