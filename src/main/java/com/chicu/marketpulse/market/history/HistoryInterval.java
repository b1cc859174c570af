package com.chicu.marketpulse.market.history;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Интервал точки графика + разрешение свечей Finnhub (1, 5, 15, 30, 60, D, W, M).
 */
public enum HistoryInterval {

    M1("1m", 1, "1"),
    M2("2m", 2, "1"),
    M5("5m", 5, "5"),
    M15("15m", 15, "15"),
    M30("30m", 30, "30"),
    M60("60m", 60, "60"),
    M90("90m", 90, "60"),
    H1("1h", 60, "60"),
    D1("1d", 1_440, "D"),
    D5("5d", 7_200, "D"),
    W1("1wk", 10_080, "W"),
    MO1("1mo", 43_200, "M"),
    MO3("3mo", 129_600, "M");

    private final String code;
    private final long minutes;
    private final String finnhubResolution;

    HistoryInterval(String code, long minutes, String finnhubResolution) {
        this.code = code;
        this.minutes = minutes;
        this.finnhubResolution = finnhubResolution;
    }

    public String code() {
        return code;
    }

    public Duration duration() {
        return Duration.ofMinutes(minutes);
    }

    public String finnhubResolution() {
        return finnhubResolution;
    }

    public static HistoryInterval fromCode(String raw) {
        if (raw != null) {
            String s = raw.trim();
            for (HistoryInterval i : values()) {
                if (i.code.equals(s)) return i;
            }
        }
        throw new IllegalArgumentException("Invalid interval '" + raw + "'. Must be one of: " + validCodes());
    }

    public static String validCodes() {
        return Arrays.stream(values()).map(HistoryInterval::code).collect(Collectors.joining(", "));
    }
}
