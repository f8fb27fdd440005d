package org.dxworks.sieveframe.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum AddressPart {
    ALL(":all"),
    LOCALPART(":localpart"),
    DOMAIN(":domain");

    private static final Map<String, AddressPart> BY_SIEVE_NAME = new HashMap<>();

    static {
        for (AddressPart value : values()) {
            BY_SIEVE_NAME.put(value.sieveName, value);
        }
    }

    private final String sieveName;

    AddressPart(String sieveName) {
        this.sieveName = sieveName;
    }

    public String getSieveName() {
        return sieveName;
    }

    public static Optional<AddressPart> fromSieve(String sieveName) {
        if (sieveName == null) return Optional.empty();
        return Optional.ofNullable(BY_SIEVE_NAME.get(sieveName.toLowerCase(Locale.ROOT)));
    }
}
