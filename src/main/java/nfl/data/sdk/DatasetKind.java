package nfl.data.sdk;

/**
 * Категории данных, которые отдаёт SDK.
 */
public enum DatasetKind {
    WEEKLY("weekly", 1999),
    PBP("pbp", 1999),
    DRAFT("draft", 1980);

    private final String cacheName;
    private final int firstSeason;

    DatasetKind(String cacheName, int firstSeason) {
        this.cacheName = cacheName;
        this.firstSeason = firstSeason;
    }

    /** Префикс в именах файлов кэша. */
    public String cacheName() {
        return cacheName;
    }

    /** Первый сезон, который публикует удалённый источник. */
    public int firstSeason() {
        return firstSeason;
    }
}
