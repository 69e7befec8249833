package nfl.data.sdk;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Файл в каталоге кэша, как его возвращает {@link CacheStore#list()}.
 */
public class CachedFile {
    private static final DateTimeFormatter MODIFIED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public final String name;
    public final long sizeBytes;
    public final Instant writtenAt;

    public CachedFile(String name, long sizeBytes, Instant writtenAt) {
        this.name = name;
        this.sizeBytes = sizeBytes;
        this.writtenAt = writtenAt;
    }

    /** Размер в мегабайтах с одним знаком, например {@code 12.3 MB}. */
    public String sizeDisplay() {
        return String.format(Locale.ROOT, "%.1f MB", sizeBytes / (1024.0 * 1024.0));
    }

    public String modifiedDisplay(ZoneId zone) {
        return MODIFIED_FORMAT.format(writtenAt.atZone(zone));
    }
}
