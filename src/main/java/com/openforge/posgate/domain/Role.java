package com.openforge.posgate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Strictly nested role hierarchy: SUPER_ADMIN ⊇ SHOP_ADMIN ⊇ STAFF.
 */
public enum Role {

    STAFF(1),
    SHOP_ADMIN(2),
    SUPER_ADMIN(3);

    private final int rank;

    Role(int rank) {
        this.rank = rank;
    }

    /** True when this role is {@code other} or sits above it. */
    public boolean isAtLeast(Role other) {
        return rank >= other.rank;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
