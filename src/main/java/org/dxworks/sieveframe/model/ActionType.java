package org.dxworks.sieveframe.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum ActionType {
    FILEINTO("fileinto"),
    REDIRECT("redirect"),
    REJECT("reject"),
    DISCARD("discard"),
    KEEP("keep"),
    STOP("stop"),
    SETFLAG("setflag"),
    ADDFLAG("addflag"),
    REMOVEFLAG("removeflag");

    private static final Map<String, ActionType> BY_SIEVE_NAME = new HashMap<>();

    static {
        for (ActionType value : values()) {
            BY_SIEVE_NAME.put(value.sieveName, value);
        }
    }

    private final String sieveName;

    ActionType(String sieveName) {
        this.sieveName = sieveName;
    }

    public String getSieveName() {
        return sieveName;
    }

    public static Optional<ActionType> fromSieve(String sieveName) {
        if (sieveName == null) return Optional.empty();
        return Optional.ofNullable(BY_SIEVE_NAME.get(sieveName.toLowerCase(Locale.ROOT)));
    }

    /** keep, stop and discard take no argument; every other action takes one string. */
    public boolean takesArgument() {
        return this != DISCARD && this != KEEP && this != STOP;
    }
}
