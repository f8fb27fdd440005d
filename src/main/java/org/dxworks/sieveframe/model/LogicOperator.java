package org.dxworks.sieveframe.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * How the conditions of a rule combine.
 */
public enum LogicOperator {
    ALL_OF("allof"),
    ANY_OF("anyof");

    private static final Map<String, LogicOperator> BY_SIEVE_NAME = new HashMap<>();

    static {
        for (LogicOperator value : values()) {
            BY_SIEVE_NAME.put(value.sieveName, value);
        }
    }

    private final String sieveName;

    LogicOperator(String sieveName) {
        this.sieveName = sieveName;
    }

    public String getSieveName() {
        return sieveName;
    }

    public static Optional<LogicOperator> fromSieve(String sieveName) {
        if (sieveName == null) return Optional.empty();
        return Optional.ofNullable(BY_SIEVE_NAME.get(sieveName.toLowerCase(Locale.ROOT)));
    }
}
