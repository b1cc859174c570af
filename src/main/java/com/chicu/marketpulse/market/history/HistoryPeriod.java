package com.chicu.marketpulse.market.history;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

public enum HistoryPeriod {

    ONE_DAY("1d", 1),
    FIVE_DAYS("5d", 5),
    ONE_MONTH("1mo", 30),
    THREE_MONTHS("3mo", 90),
    SIX_MONTHS("6mo", 180),
    ONE_YEAR("1y", 365),
    TWO_YEARS("2y", 730),
    FIVE_YEARS("5y", 1825),
    TEN_YEARS("10y", 3650),
    YEAR_TO_DATE("ytd", 365),   // упрощённо: год
    MAX("max", 3650);

    private final String code;
    private final int days;

    HistoryPeriod(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public String code() {
        return code;
    }

    public Duration duration() {
        return Duration.ofDays(days);
    }

    public static HistoryPeriod fromCode(String raw) {
        if (raw != null) {
            String s = raw.trim();
            for (HistoryPeriod p : values()) {
                if (p.code.equalsIgnoreCase(s)) return p;
            }
        }
        throw new IllegalArgumentException("Invalid period '" + raw + "'. Must be one of: " + validCodes());
    }

    public static String validCodes() {
        return Arrays.stream(values()).map(HistoryPeriod::code).collect(Collectors.joining(", "));
    }
}
