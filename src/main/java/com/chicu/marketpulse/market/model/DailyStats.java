package com.chicu.marketpulse.market.model;

/**
 * Дневная статистика по символу.
 *
 * high/low только расширяются за время жизни процесса и не сбрасываются до рестарта.
 */
public record DailyStats(
        double high,
        double low,
        double open,
        double previousClose,
        long volume
) {

    private static final double HIGH_SPREAD = 1.02;
    private static final double LOW_SPREAD = 0.98;
    private static final double OPEN_SPREAD = 0.99;

    /**
     * Стартовые статистики при первом касании символа: небольшой синтетический спред вокруг цены.
     */
    public static DailyStats initial(double price, double previousClose, long volume) {
        return new DailyStats(
                price * HIGH_SPREAD,
                price * LOW_SPREAD,
                price * OPEN_SPREAD,
                previousClose,
                volume
        );
    }

    public DailyStats widen(double price) {
        double newHigh = Math.max(high, price);
        double newLow = Math.min(low, price);
        if (newHigh == high && newLow == low) {
            return this;
        }
        return new DailyStats(newHigh, newLow, open, previousClose, volume);
    }

    public DailyStats withVolume(long newVolume) {
        return new DailyStats(high, low, open, previousClose, newVolume);
    }
}
