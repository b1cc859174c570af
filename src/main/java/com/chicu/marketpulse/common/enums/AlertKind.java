package com.chicu.marketpulse.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertKind {

    PRICE_ABOVE("price_above"),
    PRICE_BELOW("price_below");

    private final String code;

    AlertKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Условие срабатывания: границы включительно.
     */
    public boolean matches(double price, double threshold) {
        return switch (this) {
            case PRICE_ABOVE -> price >= threshold;
            case PRICE_BELOW -> price <= threshold;
        };
    }

    @JsonCreator
    public static AlertKind fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("alert kind is required");
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertKind k : values()) {
            if (k.code.equals(s) || k.name().equalsIgnoreCase(s)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown alert kind: " + raw);
    }
}
