package com.hilo.market.core;

/**
 * Betting and settlement windows, derived from the last settlement time. All times are epoch
 * seconds; the betting deadline itself already counts as closed.
 */
public final class WindowPolicy {

    private WindowPolicy() {
    }

    public static long bettingDeadline(long lastSettlement, long interval, long cutoff) {
        return lastSettlement + interval - cutoff;
    }

    public static long settlementTime(long lastSettlement, long interval) {
        return lastSettlement + interval;
    }

    public static boolean bettingOpen(long now, long lastSettlement, long interval, long cutoff, boolean halted) {
        if (halted) {
            return false;
        }
        return now < bettingDeadline(lastSettlement, interval, cutoff);
    }

    /**
     * Zero exactly when {@link #bettingOpen} is false.
     */
    public static long timeUntilBettingCloses(long now, long lastSettlement, long interval, long cutoff,
            boolean halted) {
        if (halted) {
            return 0;
        }
        return Math.max(0, bettingDeadline(lastSettlement, interval, cutoff) - now);
    }

    public static long timeUntilSettlement(long now, long lastSettlement, long interval) {
        return Math.max(0, settlementTime(lastSettlement, interval) - now);
    }

    public static boolean settlementDue(long now, long lastSettlement, long interval) {
        return now >= settlementTime(lastSettlement, interval);
    }
}
