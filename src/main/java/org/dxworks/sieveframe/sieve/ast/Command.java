package org.dxworks.sieveframe.sieve.ast;

/**
 * Top-level script command. Implemented by {@link RequireCommand}, {@link IfBlock},
 * {@link ActionCommand}, {@link CommentCommand} and {@link RawCommand}.
 */
public interface Command {
}
