package dao.tron.msig.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline arithmetic. A deadline is inclusive: something expires only once "now" is
 * strictly after it.
 */
public final class Expiry {
    private Expiry() {}

    public static Instant deadline(Instant createdAt, Duration period) {
        return createdAt.plus(period);
    }

    public static boolean isExpired(Instant now, Instant deadline) {
        return now.isAfter(deadline);
    }

    public static boolean isExpired(long nowMillis, long deadlineMillis) {
        return nowMillis > deadlineMillis;
    }

    public static long remainingMillis(long nowMillis, long deadlineMillis) {
        return Math.max(0L, deadlineMillis - nowMillis);
    }
}
