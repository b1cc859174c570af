package com.chicu.marketpulse.common.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Symbols {

    private static final Pattern TICKER = Pattern.compile("^[A-Z0-9.\\-]{1,16}$");

    private Symbols() {
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Проверка на границе (REST/WS): пустой или "мусорный" тикер → IllegalArgumentException.
     */
    public static String require(String raw) {
        String s = normalize(raw);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (!TICKER.matcher(s).matches()) {
            throw new IllegalArgumentException("Invalid symbol: " + raw);
        }
        return s;
    }
}
