package org.dxworks.sieveframe.sieve;

/**
 * Display metadata of a filter rule that SIEVE itself has no syntax for.
 */
public final class RuleMetadata {
    public static final RuleMetadata NONE = new RuleMetadata(null, true);

    public final String name; // nullable
    public final boolean enabled;

    public RuleMetadata(String name, boolean enabled) {
        this.name = name;
        this.enabled = enabled;
    }
}
