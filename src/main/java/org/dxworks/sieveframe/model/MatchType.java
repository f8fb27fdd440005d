package org.dxworks.sieveframe.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Match type tag of header, address, envelope and body tests.
 */
public enum MatchType {
    IS(":is"),
    CONTAINS(":contains"),
    MATCHES(":matches"),
    REGEX(":regex");

    private static final Map<String, MatchType> BY_SIEVE_NAME = new HashMap<>();

    static {
        for (MatchType value : values()) {
            BY_SIEVE_NAME.put(value.sieveName, value);
        }
    }

    private final String sieveName;

    MatchType(String sieveName) {
        this.sieveName = sieveName;
    }

    public String getSieveName() {
        return sieveName;
    }

    public static Optional<MatchType> fromSieve(String sieveName) {
        if (sieveName == null) return Optional.empty();
        return Optional.ofNullable(BY_SIEVE_NAME.get(sieveName.toLowerCase(Locale.ROOT)));
    }
}
