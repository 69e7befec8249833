package nfl.data.sdk;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void from_envFile_readsAllSettings() throws Exception {
        Files.writeString(tempDir.resolve("test.env"), String.join("\n",
                "NFL_DATA_CACHE_DIR=/var/cache/nfl",
                "NFL_DATA_MAX_AGE_DAYS=3",
                "NFL_DATA_BASE_URL=http://mirror.local/releases",
                "NFL_DATA_TIMEOUT_SECONDS=15"));

        CacheConfig config = CacheConfig.from(load("test.env"));

        assertEquals(Paths.get("/var/cache/nfl"), config.cacheRoot);
        assertEquals(Duration.ofDays(3), config.maxAge);
        assertEquals("http://mirror.local/releases", config.baseUrl);
        assertEquals(Duration.ofSeconds(15), config.readTimeout);
    }

    @Test
    void from_emptyEnvFile_usesDefaults() throws Exception {
        Files.writeString(tempDir.resolve("empty.env"), "# nothing configured\n");

        CacheConfig config = CacheConfig.from(load("empty.env"));

        assertEquals(CacheConfig.defaults().cacheRoot, config.cacheRoot);
        assertEquals(Duration.ofDays(7), config.maxAge);
        assertEquals(CacheConfig.DEFAULT_BASE_URL, config.baseUrl);
    }

    @Test
    void from_invalidMaxAge_throws() throws Exception {
        Files.writeString(tempDir.resolve("bad.env"), "NFL_DATA_MAX_AGE_DAYS=seven\n");
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.from(load("bad.env")));

        Files.writeString(tempDir.resolve("zero.env"), "NFL_DATA_MAX_AGE_DAYS=0\n");
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.from(load("zero.env")));
    }

    @Test
    void from_overflowingNumbers_throwIllegalArgument() throws Exception {
        Files.writeString(tempDir.resolve("huge.env"), "NFL_DATA_MAX_AGE_DAYS=999999999999999\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.from(load("huge.env")));
        assertTrue(e.getMessage().contains("NFL_DATA_MAX_AGE_DAYS"));

        Files.writeString(tempDir.resolve("timeout.env"), "NFL_DATA_TIMEOUT_SECONDS=9223372036854775807\n");
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.from(load("timeout.env")));
    }

    @Test
    void withMaxAge_keepsOtherSettings() {
        CacheConfig config = CacheConfig.defaults().withCacheRoot(tempDir).withMaxAge(Duration.ofHours(12));

        assertEquals(tempDir, config.cacheRoot);
        assertEquals(Duration.ofHours(12), config.maxAge);
        assertEquals(CacheConfig.DEFAULT_READ_TIMEOUT, config.readTimeout);
    }

    private Dotenv load(String filename) {
        return Dotenv.configure()
                .directory(tempDir.toString())
                .filename(filename)
                .load();
    }
}
