package org.dxworks.sieveframe.sieve;

/**
 * The {@code # Filter: <name>} / {@code # Filter: <name> [DISABLED]} comment convention.
 */
public class FilterCommentConvention implements MetadataConvention {

    static final String PREFIX = "Filter:";
    static final String DISABLED_SUFFIX = "[DISABLED]";

    @Override
    public RuleMetadata read(String comment) {
        if (comment == null) return RuleMetadata.NONE;
        String trimmed = comment.trim();
        if (!trimmed.startsWith(PREFIX)) {
            return RuleMetadata.NONE;
        }

        String name = trimmed.substring(PREFIX.length()).trim();
        boolean disabled = name.endsWith(DISABLED_SUFFIX);
        if (disabled) {
            name = name.substring(0, name.length() - DISABLED_SUFFIX.length()).trim();
        }
        return new RuleMetadata(name.isEmpty() ? null : name, !disabled);
    }

    /**
     * Returns null only for an unnamed enabled rule. An unnamed disabled rule is written as
     * {@code Filter: [DISABLED]}. A trailing {@code [DISABLED]} inside the name cannot be told
     * apart from the flag, so it is dropped from the name and the rule's own flag is written.
     */
    @Override
    public String write(RuleMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        String name = metadata.name == null ? "" : sanitize(metadata.name);
        if (name.isEmpty()) {
            return metadata.enabled ? null : PREFIX + " " + DISABLED_SUFFIX;
        }
        return metadata.enabled
                ? PREFIX + " " + name
                : PREFIX + " " + name + " " + DISABLED_SUFFIX;
    }

    private static String sanitize(String name) {
        // a line break in the name would end the comment early
        String clean = name.replaceAll("[\\r\\n]+", " ").trim();
        while (clean.endsWith(DISABLED_SUFFIX)) {
            clean = clean.substring(0, clean.length() - DISABLED_SUFFIX.length()).trim();
        }
        return clean;
    }
}
