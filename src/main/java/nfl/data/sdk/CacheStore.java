package nfl.data.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Хранилище наборов данных: один файл на ключ в одном каталоге кэша.
 *
 * <p>Запись лежит в {@code <root>/<key>.json.gz}. Время изменения файла и есть время
 * записи; других метаданных нет. Запись идёт во временный файл, который затем
 * переименовывается поверх целевого, поэтому читатель видит либо старую запись, либо
 * новую. Блокировок нет: два процесса, пишущие один ключ, оба успешны, побеждает
 * последнее переименование.
 */
public class CacheStore {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    static final String EXTENSION = ".json.gz";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    /**
     * Открывает хранилище, создавая {@code root}, если его ещё нет.
     */
    public CacheStore(Path root) throws StorageException {
        this.root = root;
        ensureRoot();
    }

    public Path root() {
        return root;
    }

    public Path pathFor(String key) {
        if (key == null || key.isEmpty() || key.contains("/") || key.contains("\\")) {
            throw new IllegalArgumentException("Некорректный ключ кэша: " + key);
        }
        return root.resolve(key + EXTENSION);
    }

    public boolean exists(String key) {
        return Files.isRegularFile(pathFor(key));
    }

    public Optional<Instant> writtenAt(String key) {
        try {
            return Optional.of(Files.getLastModifiedTime(pathFor(key)).toInstant());
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public Dataset read(String key) throws EntryNotFoundException, CorruptEntryException, StorageException {
        Path path = pathFor(key);
        try (InputStream in = Files.newInputStream(path)) {
            return DatasetCodec.decode(in);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(key);
        } catch (CorruptEntryException e) {
            throw new CorruptEntryException("Запись кэша " + path.getFileName() + " повреждена: "
                    + e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageException("Не удалось прочитать запись кэша " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Заменяет запись для {@code key} на {@code dataset}.
     */
    public void write(String key, Dataset dataset) throws StorageException {
        Path target = pathFor(key);
        ensureRoot();
        Path temp = root.resolve(key + EXTENSION + "." + System.nanoTime() + TEMP_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                DatasetCodec.encode(dataset, out);
            }
            Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Не удалось записать запись кэша " + target + ": " + e.getMessage(), e);
        }
        log.debug("Записано {} строк в {}", dataset.rowCount(), target);
    }

    /**
     * @return {@code true}, если запись была удалена
     */
    public boolean delete(String key) throws StorageException {
        Path path = pathFor(key);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Не удалось удалить запись кэша " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Файлы кэша, отсортированные по имени. Пустой список, если каталога нет или он пуст.
     */
    public List<CachedFile> list() throws StorageException {
        List<CachedFile> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    continue;
                }
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(path, BasicFileAttributes.class);
                } catch (NoSuchFileException e) {
                    // удалён во время обхода
                    continue;
                }
                if (attrs.isRegularFile()) {
                    files.add(new CachedFile(name, attrs.size(), attrs.lastModifiedTime().toInstant()));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Не удалось прочитать каталог кэша " + root + ": " + e.getMessage(), e);
        }
        files.sort(Comparator.comparing(f -> f.name));
        return files;
    }

    /**
     * Удаляет всё содержимое каталога кэша и создаёт его заново пустым. Успешно
     * завершается, если каталога нет. После сбоя часть файлов может остаться; повторный
     * вызов безопасен.
     */
    public void purgeAll() throws StorageException {
        if (Files.exists(root)) {
            try (Stream<Path> walk = Files.walk(root)) {
                List<Path> paths = new ArrayList<>();
                walk.forEach(paths::add);
                paths.sort(Comparator.reverseOrder());
                for (Path path : paths) {
                    deletePath(path);
                }
            } catch (IOException | UncheckedIOException e) {
                throw new StorageException("Не удалось очистить каталог кэша " + root + ": " + e.getMessage(), e);
            }
            log.info("Каталог кэша {} удалён", root);
        }
        ensureRoot();
    }

    /**
     * Удаляет один файл или пустой каталог при очистке.
     */
    protected void deletePath(Path path) throws IOException {
        Files.deleteIfExists(path);
    }

    private void ensureRoot() throws StorageException {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Не удалось создать каталог кэша " + root + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Не удалось удалить временный файл {}: {}", path, e.getMessage());
        }
    }
}
