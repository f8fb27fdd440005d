package org.dxworks.sieveframe.sieve;

/**
 * Encoding of {@link RuleMetadata} into the comment line that precedes an {@code if}.
 */
public interface MetadataConvention {

    /**
     * @param comment comment text without the leading {@code #}, trimmed
     * @return the metadata the comment carries, {@link RuleMetadata#NONE} when it carries none
     */
    RuleMetadata read(String comment);

    /**
     * @return comment text (without {@code #}) to write in front of the rule, or null to write nothing
     */
    String write(RuleMetadata metadata);
}
