package org.dxworks.sieveframe.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum SizeComparator {
    OVER(":over"),
    UNDER(":under");

    private static final Map<String, SizeComparator> BY_SIEVE_NAME = new HashMap<>();

    static {
        for (SizeComparator value : values()) {
            BY_SIEVE_NAME.put(value.sieveName, value);
        }
    }

    private final String sieveName;

    SizeComparator(String sieveName) {
        this.sieveName = sieveName;
    }

    public String getSieveName() {
        return sieveName;
    }

    public static Optional<SizeComparator> fromSieve(String sieveName) {
        if (sieveName == null) return Optional.empty();
        return Optional.ofNullable(BY_SIEVE_NAME.get(sieveName.toLowerCase(Locale.ROOT)));
    }
}
