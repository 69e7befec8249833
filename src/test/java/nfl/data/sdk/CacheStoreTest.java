package nfl.data.sdk;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class CacheStoreTest {

    @TempDir
    Path tempDir;

    private Path root;
    private CacheStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = tempDir.resolve("nfl_data_cache");
        store = new CacheStore(root);
    }

    @Test
    void constructor_missingDirectory_createsIt() throws Exception {
        Path nested = tempDir.resolve("a").resolve("b");
        new CacheStore(nested);
        assertTrue(Files.isDirectory(nested));

        new CacheStore(nested);
        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void writeThenRead_returnsEqualDataset() throws Exception {
        Dataset dataset = Fixtures.smallDataset();
        store.write("weekly_2023", dataset);

        assertTrue(store.exists("weekly_2023"));
        assertTrue(Files.isRegularFile(root.resolve("weekly_2023.json.gz")));
        assertEquals(dataset, store.read("weekly_2023"));
    }

    @Test
    void write_existingKey_lastWriteWins() throws Exception {
        store.write("draft_2020", Fixtures.smallDataset());
        store.write("draft_2020", Fixtures.otherDataset());

        assertEquals(Fixtures.otherDataset(), store.read("draft_2020"));
        assertEquals(List.of("draft_2020.json.gz"), fileNames());
    }

    @Test
    void write_emptyDataset_roundTrips() throws Exception {
        store.write("pbp_2023", Dataset.empty());
        assertEquals(Dataset.empty(), store.read("pbp_2023"));
    }

    @Test
    void write_rootRemovedExternally_recreatesIt() throws Exception {
        Files.delete(root);
        store.write("weekly_2023", Fixtures.smallDataset());
        assertTrue(store.exists("weekly_2023"));
    }

    @Test
    void write_targetBlocked_throwsStorageException() throws Exception {
        Path blocker = root.resolve("weekly_2023.json.gz");
        Files.createDirectories(blocker.resolve("child"));

        assertThrows(StorageException.class, () -> store.write("weekly_2023", Fixtures.smallDataset()));
        assertFalse(fileNames().stream().anyMatch(name -> name.endsWith(".tmp")));
    }

    @Test
    void read_missingKey_throwsNotFound() {
        assertThrows(EntryNotFoundException.class, () -> store.read("weekly_1999"));
    }

    @Test
    void read_notGzip_throwsCorrupt() throws Exception {
        Files.writeString(root.resolve("weekly_2023.json.gz"), "not a cache file");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_emptyFile_throwsCorrupt() throws Exception {
        Files.createFile(root.resolve("weekly_2023.json.gz"));
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_truncatedFile_throwsCorrupt() throws Exception {
        store.write("weekly_2023", Fixtures.smallDataset());
        Path path = root.resolve("weekly_2023.json.gz");
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, Arrays.copyOf(bytes, bytes.length / 2));

        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_wrongFormatMarker_throwsCorrupt() throws Exception {
        writeGzipJson("weekly_2023", "{\"format\":\"pickle\",\"version\":1,\"columns\":[],\"rows\":[]}");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_unsupportedVersion_throwsCorrupt() throws Exception {
        writeGzipJson("weekly_2023", "{\"format\":\"nfl-data-cache\",\"version\":2,\"columns\":[],\"rows\":[]}");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_cellTypeMismatch_throwsCorrupt() throws Exception {
        writeGzipJson("weekly_2023", "{\"format\":\"nfl-data-cache\",\"version\":1,"
                + "\"columns\":[{\"name\":\"season\",\"type\":\"LONG\"}],\"rows\":[[\"2023\"]]}");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_rowArityMismatch_throwsCorrupt() throws Exception {
        writeGzipJson("weekly_2023", "{\"format\":\"nfl-data-cache\",\"version\":1,"
                + "\"columns\":[{\"name\":\"season\",\"type\":\"LONG\"}],\"rows\":[[2023,1]]}");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void read_unknownColumnType_throwsCorrupt() throws Exception {
        writeGzipJson("weekly_2023", "{\"format\":\"nfl-data-cache\",\"version\":1,"
                + "\"columns\":[{\"name\":\"season\",\"type\":\"DECIMAL\"}],\"rows\":[]}");
        assertThrows(CorruptEntryException.class, () -> store.read("weekly_2023"));
    }

    @Test
    void writtenAt_followsFileModificationTime() throws Exception {
        assertEquals(Optional.empty(), store.writtenAt("draft_2020"));

        store.write("draft_2020", Fixtures.otherDataset());
        Instant past = Instant.parse("2024-01-02T03:04:05Z");
        Files.setLastModifiedTime(root.resolve("draft_2020.json.gz"), FileTime.from(past));

        assertEquals(Optional.of(past), store.writtenAt("draft_2020"));
    }

    @Test
    void list_returnsEntriesSortedByName() throws Exception {
        store.write("weekly_2020-2024", Fixtures.smallDataset());
        store.write("draft_2020", Fixtures.otherDataset());
        store.write("pbp_2023", Fixtures.smallDataset());
        Files.writeString(root.resolve("pbp_2022.json.gz.123.tmp"), "in flight");

        List<CachedFile> files = store.list();

        assertEquals(List.of("draft_2020.json.gz", "pbp_2023.json.gz", "weekly_2020-2024.json.gz"),
                files.stream().map(f -> f.name).collect(Collectors.toList()));
        for (CachedFile file : files) {
            assertEquals(Files.size(root.resolve(file.name)), file.sizeBytes);
            assertEquals(Files.getLastModifiedTime(root.resolve(file.name)).toInstant(), file.writtenAt);
        }
    }

    @Test
    void list_emptyOrMissingRoot_returnsEmpty() throws Exception {
        assertTrue(store.list().isEmpty());
        Files.delete(root);
        assertTrue(store.list().isEmpty());
    }

    @Test
    void delete_removesOnlyThatEntry() throws Exception {
        store.write("draft_2020", Fixtures.otherDataset());
        store.write("draft_2021", Fixtures.otherDataset());

        assertTrue(store.delete("draft_2020"));
        assertFalse(store.delete("draft_2020"));
        assertEquals(List.of("draft_2021.json.gz"), fileNames());
    }

    @Test
    void purgeAll_removesEverythingAndKeepsEmptyRoot() throws Exception {
        store.write("draft_2020", Fixtures.otherDataset());
        Files.createDirectories(root.resolve("stray").resolve("nested"));
        Files.writeString(root.resolve("stray").resolve("nested").resolve("file.txt"), "x");

        store.purgeAll();

        assertTrue(Files.isDirectory(root));
        assertTrue(fileNames().isEmpty());
        assertFalse(store.exists("draft_2020"));

        store.purgeAll();
        assertTrue(Files.isDirectory(root));
    }

    @Test
    void purgeAll_missingRoot_createsEmptyRoot() throws Exception {
        Files.delete(root);

        store.purgeAll();

        assertTrue(Files.isDirectory(root));
        assertTrue(fileNames().isEmpty());
    }

    @Test
    void purgeAll_blockedDelete_throwsStorageExceptionAndRetrySucceeds() throws Exception {
        BlockingStore blocking = new BlockingStore(root);
        blocking.write("draft_2020", Fixtures.otherDataset());

        StorageException e = assertThrows(StorageException.class, blocking::purgeAll);
        assertNotNull(e.getCause());
        assertTrue(blocking.exists("draft_2020"));

        blocking.blocked = false;
        blocking.purgeAll();

        assertTrue(Files.isDirectory(root));
        assertTrue(fileNames().isEmpty());
    }

    @Test
    void pathFor_keyWithSeparator_rejected() {
        assertThrows(IllegalArgumentException.class, () -> store.pathFor("../weekly_2023"));
        assertThrows(IllegalArgumentException.class, () -> store.pathFor(""));
    }

    private List<String> fileNames() throws IOException {
        try (Stream<Path> files = Files.list(root)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private void writeGzipJson(String key, String json) throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(root.resolve(key + ".json.gz")))) {
            out.write(json.getBytes(StandardCharsets.UTF_8));
        }
    }

    /** Отказывает в удалении файлов записей, пока {@code blocked} выставлен. */
    static class BlockingStore extends CacheStore {
        volatile boolean blocked = true;

        BlockingStore(Path root) throws StorageException {
            super(root);
        }

        @Override
        protected void deletePath(Path path) throws IOException {
            if (blocked && path.getFileName().toString().endsWith(".json.gz")) {
                throw new AccessDeniedException(path.toString());
            }
            super.deletePath(path);
        }
    }
}
