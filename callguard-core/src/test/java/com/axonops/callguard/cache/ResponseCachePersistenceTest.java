package com.axonops.callguard.cache;

import com.axonops.callguard.api.PersistenceException;
import com.axonops.callguard.test.MutableClock;
import com.axonops.callguard.test.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Snapshot persistence: save on shutdown, restore on startup, tolerate bad files.
 */
class ResponseCachePersistenceTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock();

    private CacheConfig.Builder persistent(Path file) {
        return CacheConfig.builder()
            .name("test")
            .persistPath(file)
            .compressionThreshold(64)
            .clock(clock);
    }

    @Test
    void testShutdownThenRestartRestoresEntries() {
        Path file = tempDir.resolve("cache.json");
        String large = "speech ".repeat(100);

        ResponseCache<String> first = ResponseCache.create(String.class, persistent(file).build());
        first.set("small", "hi");
        first.set("large", large);
        first.get("small");
        first.get("missing");
        first.shutdown();

        assertThat(file).exists();

        ResponseCache<String> second = ResponseCache.create(String.class, persistent(file).build());
        try {
            assertThat(second.get("small")).contains("hi");
            assertThat(second.get("large")).contains(large);

            CacheStatistics stats = second.getStatistics();
            assertThat(stats.totalEntries()).isEqualTo(2);
            // One hit and one miss restored, plus the two hits above
            assertThat(stats.hits()).isEqualTo(3);
            assertThat(stats.misses()).isEqualTo(1);
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testRepeatedRestartsAreStable() {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        cache.set("a", "1");
        cache.set("b", "2");
        cache.shutdown();

        for (int i = 0; i < 3; i++) {
            cache = ResponseCache.create(String.class, persistent(file).build());
            assertThat(cache.size()).isEqualTo(2);
            cache.shutdown();
        }
    }

    @Test
    void testExpiredEntriesDroppedOnLoad() {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> first = ResponseCache.create(String.class, persistent(file).build());
        first.set("short", "v", Duration.ofSeconds(1));
        first.set("long", "v", Duration.ofHours(1));
        first.persist();
        first.shutdown();

        clock.advance(Duration.ofSeconds(2));

        ResponseCache<String> second = ResponseCache.create(String.class, persistent(file).build());
        try {
            assertThat(second.containsKey("short")).isFalse();
            assertThat(second.containsKey("long")).isTrue();
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testBoundsEnforcedOnLoadKeepingMostRecent() {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> first = ResponseCache.create(String.class, persistent(file).build());
        for (String key : new String[] {"a", "b", "c", "d", "e"}) {
            first.set(key, key);
            clock.advance(Duration.ofSeconds(1));
        }
        first.get("a");
        first.shutdown();

        ResponseCache<String> second = ResponseCache.create(String.class, persistent(file).maxEntries(2).build());
        try {
            assertThat(second.size()).isEqualTo(2);
            assertThat(second.containsKey("a")).isTrue();
            assertThat(second.containsKey("e")).isTrue();
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testUndecodableRestoredEntryTreatedAsMiss() {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> strings = ResponseCache.create(String.class, persistent(file).build());
        strings.set("k", "hello");
        strings.shutdown();

        // Same cache name and file, different value type
        ResponseCache<Integer> numbers = ResponseCache.create(Integer.class, persistent(file).build());
        try {
            assertThat(numbers.containsKey("k")).isTrue();

            assertThat(numbers.getOrSet("k", () -> 42)).isEqualTo(42);
            assertThat(numbers.get("k")).contains(42);

            CacheStatistics stats = numbers.getStatistics();
            assertThat(stats.totalEntries()).isEqualTo(1);
        } finally {
            numbers.shutdown();
        }
    }

    @Test
    void testSnapshotOfAnotherCacheIgnored() {
        Path file = tempDir.resolve("shared.json");

        ResponseCache<String> chat = ResponseCache.create(String.class, persistent(file).name("chat").build());
        chat.set("k", "chat reply");
        chat.shutdown();

        ResponseCache<String> speech = ResponseCache.create(String.class, persistent(file).name("speech").build());
        try {
            assertThat(speech.size()).isZero();
            assertThat(speech.get("k")).isEmpty();
        } finally {
            speech.shutdown();
        }
    }

    @Test
    void testMissingFileStartsEmpty() {
        Path file = tempDir.resolve("nested/dir/cache.json");

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        try {
            assertThat(cache.size()).isZero();
            cache.set("k", "v");
            cache.persist();
            assertThat(file).exists();
        } finally {
            cache.shutdown();
        }
    }

    @Test
    void testCorruptFileStartsEmpty() throws Exception {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "{not json at all", StandardCharsets.UTF_8);

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        try {
            assertThat(cache.size()).isZero();
        } finally {
            cache.shutdown();
        }

        // Shutdown replaced the corrupt file with a valid snapshot
        assertThat(Files.readString(file)).contains("callguard-cache-snapshot");
    }

    @Test
    void testForeignFormatStartsEmpty() throws Exception {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "{\"format\":\"something-else\",\"version\":7,\"entries\":[]}", StandardCharsets.UTF_8);

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        try {
            assertThat(cache.size()).isZero();
        } finally {
            cache.shutdown();
        }
    }

    @Test
    void testPersistLeavesNoTempFile() {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        try {
            cache.set("k", "v");
            cache.persist();
            cache.persist();

            assertThat(file).exists();
            assertThat(tempDir.resolve("cache.json.tmp")).doesNotExist();
        } finally {
            cache.shutdown();
        }
    }

    @Test
    void testPersistFailureRaisesPersistenceException() throws Exception {
        // A directory where the file should be makes the final move fail
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file).build());
        try {
            Files.createDirectories(file);
            Files.writeString(file.resolve("occupied"), "x");
            cache.set("k", "v");

            assertThatThrownBy(cache::persist).isInstanceOf(PersistenceException.class);
            assertThat(tempDir.resolve("cache.json.tmp")).doesNotExist();
        } finally {
            // Shutdown logs the failure instead of throwing
            assertThatCode(cache::shutdown).doesNotThrowAnyException();
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testBackgroundPersistence() throws Exception {
        Path file = tempDir.resolve("cache.json");

        ResponseCache<String> cache = ResponseCache.create(String.class, persistent(file)
            .cleanupInterval(Duration.ofMillis(50))
            .persistInterval(Duration.ofMillis(100))
            .build());
        try {
            cache.set("k", "v");

            assertThat(TestUtils.waitFor(() -> Files.exists(file), Duration.ofSeconds(5))).isTrue();
        } finally {
            cache.shutdown();
        }
    }
}
