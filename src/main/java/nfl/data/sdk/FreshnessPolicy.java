package nfl.data.sdk;

import java.time.Duration;
import java.time.Instant;

/**
 * Решает, можно ли ещё отдавать сохранённую запись.
 */
public final class FreshnessPolicy {
    public static final Duration DEFAULT_MAX_AGE = Duration.ofDays(7);

    private FreshnessPolicy() {
    }

    /**
     * Запись свежая, пока строго моложе {@code maxAge}. Отсутствующая запись
     * ({@code writtenAt == null}) свежей не бывает.
     */
    public static boolean isFresh(Instant writtenAt, Instant now, Duration maxAge) {
        if (writtenAt == null) {
            return false;
        }
        return Duration.between(writtenAt, now).compareTo(maxAge) < 0;
    }
}
