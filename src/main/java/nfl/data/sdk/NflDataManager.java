package nfl.data.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Основной сервис данных — отдаёт свежие записи из локального кэша, иначе скачивает.
 *
 * <p>Не потокобезопасен. Каждый экземпляр владеет одним каталогом кэша, который
 * создаётся в конструкторе.
 */
public class NflDataManager {
    private static final Logger log = LoggerFactory.getLogger(NflDataManager.class);

    private final CacheStore store;
    private final RemoteFetcher fetcher;
    private final UserInteraction interaction;
    private final Duration maxAge;
    private final Clock clock;

    public NflDataManager(CacheStore store, RemoteFetcher fetcher, UserInteraction interaction,
                          Duration maxAge, Clock clock) {
        this.store = store;
        this.fetcher = fetcher;
        this.interaction = interaction;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public NflDataManager(CacheStore store, RemoteFetcher fetcher, UserInteraction interaction) {
        this(store, fetcher, interaction, FreshnessPolicy.DEFAULT_MAX_AGE, Clock.systemDefaultZone());
    }

    public Dataset getWeeklyData(List<Integer> seasons, boolean forceRefresh, List<String> columns)
            throws FetchException {
        return getDataset(DatasetKind.WEEKLY, seasons, forceRefresh, FetchOptions.columns(columns));
    }

    public Dataset getPbpData(List<Integer> seasons, boolean forceRefresh) throws FetchException {
        return getDataset(DatasetKind.PBP, seasons, forceRefresh, FetchOptions.none());
    }

    public Dataset getDraftData(List<Integer> seasons, boolean forceRefresh) throws FetchException {
        return getDataset(DatasetKind.DRAFT, seasons, forceRefresh, FetchOptions.none());
    }

    public Dataset getDataset(DatasetKind kind, List<Integer> seasons, boolean forceRefresh,
                              FetchOptions options) throws FetchException {
        return getDataset(kind, seasons, forceRefresh, options, maxAge);
    }

    /**
     * Возвращает закэшированный набор для {@code (kind, seasons)}, если он моложе
     * {@code maxAge}, иначе скачивает и кэширует его.
     *
     * <p>В кэше всегда лежит полный набор колонок; {@code options.columns} применяется
     * к результату одинаково для кэша и для свежей загрузки. Ошибка загрузки
     * пробрасывается, существующая запись не трогается. Ошибка записи в кэш только
     * логируется. Нечитаемые записи считаются промахом.
     */
    public Dataset getDataset(DatasetKind kind, List<Integer> seasons, boolean forceRefresh,
                              FetchOptions options, Duration maxAge) throws FetchException {
        if (seasons == null || seasons.isEmpty()) {
            throw new FetchException("Нужен хотя бы один сезон");
        }
        String key = CacheKeys.buildKey(kind, seasons);

        if (!forceRefresh && store.exists(key)
                && FreshnessPolicy.isFresh(store.writtenAt(key).orElse(null), clock.instant(), maxAge)) {
            try {
                Dataset cached = store.read(key);
                log.info("Загрузка данных {} из кэша: {}", kind.cacheName(), store.pathFor(key));
                return project(kind, cached, options);
            } catch (EntryNotFoundException | CorruptEntryException e) {
                log.warn("Запись кэша {} непригодна, пропускаем: {}", key, e.getMessage());
            } catch (StorageException e) {
                log.warn("Не удалось прочитать запись кэша {}, скачиваем заново: {}", key, e.getMessage());
            }
        }

        log.info("Скачивание данных {} за сезоны {}", kind.cacheName(), seasons);
        Dataset fresh = fetcher.fetch(kind, seasons);

        try {
            store.write(key, fresh);
            log.info("Данные {} сохранены в кэш: {}", kind.cacheName(), store.pathFor(key));
        } catch (StorageException e) {
            log.warn("Не удалось закэшировать данные {} под ключом {}: {}", kind.cacheName(), key, e.getMessage());
        }
        return project(kind, fresh, options);
    }

    private static Dataset project(DatasetKind kind, Dataset dataset, FetchOptions options) throws FetchException {
        if (options.columns == null) {
            return dataset;
        }
        try {
            return dataset.select(options.columns);
        } catch (IllegalArgumentException e) {
            throw new FetchException("Нельзя выбрать колонки из данных " + kind.cacheName() + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Удаляет запись для {@code (kind, seasons)}.
     *
     * @return {@code true}, если запись была удалена
     */
    public boolean invalidate(DatasetKind kind, List<Integer> seasons) throws StorageException {
        String key = CacheKeys.buildKey(kind, seasons);
        boolean removed = store.delete(key);
        if (removed) {
            log.info("Запись кэша {} удалена", key);
        }
        return removed;
    }

    /**
     * Строки для вывода: имя файла, размер в МБ и время изменения.
     */
    public List<String> listCachedEntries() throws StorageException {
        List<CachedFile> files = store.list();
        List<String> lines = new ArrayList<>(files.size());
        if (files.isEmpty()) {
            log.info("В {} нет закэшированных файлов", store.root());
            return lines;
        }
        ZoneId zone = clock.getZone();
        for (CachedFile file : files) {
            lines.add(String.format("%s  Размер: %s  Изменён: %s",
                    file.name, file.sizeDisplay(), file.modifiedDisplay(zone)));
        }
        log.info("Закэшированные файлы в {}:", store.root());
        lines.forEach(line -> log.info("  {}", line));
        return lines;
    }

    /**
     * Очищает весь кэш. С {@code requireConfirmation} сначала спрашивает пользователя;
     * отказ оставляет кэш нетронутым.
     *
     * @return {@code true}, если кэш очищен
     */
    public boolean clearCache(boolean requireConfirmation) throws StorageException {
        if (requireConfirmation
                && !interaction.confirm("Вы уверены, что хотите удалить все закэшированные данные?")) {
            log.info("Очистка кэша отменена");
            return false;
        }
        store.purgeAll();
        log.info("Кэш успешно очищен");
        return true;
    }

    public CacheStore store() {
        return store;
    }
}
