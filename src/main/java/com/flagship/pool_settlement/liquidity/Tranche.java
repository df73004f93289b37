package com.flagship.pool_settlement.liquidity;

import java.util.Locale;

public enum Tranche {
    SENIOR,
    JUNIOR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses "senior" / "junior" in any case.
     */
    public static Tranche fromId(String id) {
        for (Tranche tranche : values()) {
            if (tranche.name().equalsIgnoreCase(id)) {
                return tranche;
            }
        }
        throw new IllegalArgumentException("Unknown tranche: " + id);
    }
}
