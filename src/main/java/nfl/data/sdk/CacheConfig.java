package nfl.data.sdk;

import io.github.cdimascio.dotenv.Dotenv;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Настройки кэша и удалённого источника из {@code .env} или переменных окружения.
 */
public class CacheConfig {
    public static final String DEFAULT_CACHE_DIR = "nfl_data_cache";
    public static final String DEFAULT_BASE_URL = "https://github.com/nflverse/nflverse-data/releases/download";
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);

    public final Path cacheRoot;
    public final Duration maxAge;
    public final String baseUrl;
    public final Duration readTimeout;

    public CacheConfig(Path cacheRoot, Duration maxAge, String baseUrl, Duration readTimeout) {
        this.cacheRoot = Objects.requireNonNull(cacheRoot, "cacheRoot");
        this.maxAge = requirePositive(maxAge, "maxAge");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.readTimeout = requirePositive(readTimeout, "readTimeout");
    }

    public static CacheConfig defaults() {
        return new CacheConfig(Paths.get(DEFAULT_CACHE_DIR), FreshnessPolicy.DEFAULT_MAX_AGE,
                DEFAULT_BASE_URL, DEFAULT_READ_TIMEOUT);
    }

    /** Читает {@code .env} из рабочего каталога, если он есть. */
    public static CacheConfig load() {
        return from(Dotenv.configure().ignoreIfMissing().load());
    }

    static CacheConfig from(Dotenv dotenv) {
        Path cacheRoot = Paths.get(dotenv.get("NFL_DATA_CACHE_DIR", DEFAULT_CACHE_DIR));
        long maxAgeDays = parseLong(dotenv.get("NFL_DATA_MAX_AGE_DAYS", "7"), "NFL_DATA_MAX_AGE_DAYS");
        String baseUrl = dotenv.get("NFL_DATA_BASE_URL", DEFAULT_BASE_URL);
        long timeout = parseLong(dotenv.get("NFL_DATA_TIMEOUT_SECONDS",
                String.valueOf(DEFAULT_READ_TIMEOUT.getSeconds())), "NFL_DATA_TIMEOUT_SECONDS");
        return new CacheConfig(cacheRoot, days(maxAgeDays, "NFL_DATA_MAX_AGE_DAYS"), baseUrl,
                seconds(timeout, "NFL_DATA_TIMEOUT_SECONDS"));
    }

    public CacheConfig withCacheRoot(Path cacheRoot) {
        return new CacheConfig(cacheRoot, maxAge, baseUrl, readTimeout);
    }

    public CacheConfig withMaxAge(Duration maxAge) {
        return new CacheConfig(cacheRoot, maxAge, baseUrl, readTimeout);
    }

    public CacheConfig withBaseUrl(String baseUrl) {
        return new CacheConfig(cacheRoot, maxAge, baseUrl, readTimeout);
    }

    private static long parseLong(String value, String name) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " должно быть целым числом, получено '" + value + "'", e);
        }
    }

    private static Duration days(long value, String name) {
        try {
            return Duration.ofDays(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " слишком велико: " + value, e);
        }
    }

    private static Duration seconds(long value, String name) {
        try {
            Duration duration = Duration.ofSeconds(value);
            // OkHttp переводит таймаут в миллисекунды
            duration.toMillis();
            return duration;
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " слишком велико: " + value, e);
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " должно быть положительным, получено " + value);
        }
        return value;
    }
}
