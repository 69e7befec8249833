package nfl.data.sdk;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Главный класс SDK — один общий экземпляр на каталог кэша.
 */
public class NflDataSDK implements AutoCloseable {
    private static final ConcurrentHashMap<Path, NflDataSDK> INSTANCES = new ConcurrentHashMap<>();

    private final Path cacheRoot;
    private final CacheConfig config;
    private final NflverseFetcher fetcher;
    private final NflDataManager manager;

    private NflDataSDK(Path cacheRoot, CacheConfig config, UserInteraction interaction) throws StorageException {
        this.cacheRoot = cacheRoot;
        this.config = config;
        CacheStore store = new CacheStore(cacheRoot);
        this.fetcher = new NflverseFetcher(config.baseUrl, config.readTimeout);
        this.manager = new NflDataManager(store, fetcher, interaction, config.maxAge, Clock.systemDefaultZone());
    }

    public static NflDataSDK getInstance(CacheConfig config) throws StorageException {
        return getInstance(config, new ConsoleInteraction());
    }

    /**
     * Возвращает экземпляр для каталога {@code config.cacheRoot}, создавая его при первом
     * вызове. {@code interaction} используется только при создании: для уже открытого
     * каталога остаётся подтверждение первого вызова. Другой срок жизни для открытого
     * каталога — ошибка.
     */
    public static NflDataSDK getInstance(CacheConfig config, UserInteraction interaction) throws StorageException {
        if (config == null) {
            throw new IllegalArgumentException("Конфигурация не может быть null");
        }
        Path root = config.cacheRoot.toAbsolutePath().normalize();

        synchronized (INSTANCES) {
            NflDataSDK existing = INSTANCES.get(root);
            if (existing != null) {
                if (!existing.config.maxAge.equals(config.maxAge)) {
                    throw new IllegalArgumentException(
                            "Каталог кэша " + root + " уже открыт со сроком жизни " + existing.config.maxAge
                                    + ". Закройте его, прежде чем открывать с другим сроком.");
                }
                return existing;
            }
            NflDataSDK created = new NflDataSDK(root, config, interaction);
            INSTANCES.put(root, created);
            return created;
        }
    }

    public Dataset getWeeklyData(List<Integer> seasons, boolean forceRefresh, List<String> columns)
            throws FetchException {
        return manager.getWeeklyData(seasons, forceRefresh, columns);
    }

    public Dataset getPbpData(List<Integer> seasons, boolean forceRefresh) throws FetchException {
        return manager.getPbpData(seasons, forceRefresh);
    }

    public Dataset getDraftData(List<Integer> seasons, boolean forceRefresh) throws FetchException {
        return manager.getDraftData(seasons, forceRefresh);
    }

    public List<String> listCachedEntries() throws StorageException {
        return manager.listCachedEntries();
    }

    public boolean invalidate(DatasetKind kind, List<Integer> seasons) throws StorageException {
        return manager.invalidate(kind, seasons);
    }

    public boolean clearCache(boolean requireConfirmation) throws StorageException {
        return manager.clearCache(requireConfirmation);
    }

    public Path cacheRoot() {
        return cacheRoot;
    }

    @Override
    public void close() {
        fetcher.close();
        INSTANCES.remove(cacheRoot, this);
    }
}
