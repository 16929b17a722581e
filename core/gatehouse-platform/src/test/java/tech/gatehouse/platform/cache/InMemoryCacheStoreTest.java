package tech.gatehouse.platform.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InMemoryCacheStore.
 */
class InMemoryCacheStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private InMemoryCacheStore store;

    static CacheConfig config(Duration ttl) {
        return new CacheConfig() {
            @Override
            public CacheStore.CacheType type() {
                return CacheStore.CacheType.MEMORY;
            }

            @Override
            public Duration ttl() {
                return ttl;
            }

            @Override
            public long maxSize() {
                return 1000;
            }

            @Override
            public Redis redis() {
                return new Redis() {
                    @Override
                    public String keyPrefix() {
                        return "gh:cache:";
                    }

                    @Override
                    public int scanCount() {
                        return 100;
                    }
                };
            }
        };
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore(config(Duration.ofMinutes(5)), ticker);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    // ========================================
    // GET / PUT TESTS
    // ========================================

    @Test
    @DisplayName("get should return stored value until its TTL elapses")
    void get_shouldReturnValue_untilTtlElapses() {
        // Arrange
        store.put("permissions", "prn_1", "[\"a:b\"]", Duration.ofMinutes(15));

        // Act & Assert
        advance(Duration.ofMinutes(14));
        assertThat(store.get("permissions", "prn_1")).contains("[\"a:b\"]");
        advance(Duration.ofMinutes(2));
        assertThat(store.get("permissions", "prn_1")).isEmpty();
    }

    @Test
    @DisplayName("put should use the configured default TTL when none given")
    void put_shouldUseDefaultTtl() {
        store.put("permissions", "prn_1", "x");

        advance(Duration.ofMinutes(4));
        assertThat(store.get("permissions", "prn_1")).contains("x");
        advance(Duration.ofMinutes(2));
        assertThat(store.get("permissions", "prn_1")).isEmpty();
    }

    @Test
    @DisplayName("put should keep separate TTLs per entry")
    void put_shouldKeepTtlPerEntry() {
        store.put("relationships", "short", "true", Duration.ofMinutes(1));
        store.put("relationships", "long", "true", Duration.ofMinutes(10));

        advance(Duration.ofMinutes(5));

        assertThat(store.get("relationships", "short")).isEmpty();
        assertThat(store.get("relationships", "long")).contains("true");
    }

    @Test
    @DisplayName("get should keep cache namespaces apart")
    void get_shouldSeparateNamespaces() {
        store.put("permissions", "k", "p");
        store.put("relationships", "k", "r");

        assertThat(store.get("permissions", "k")).contains("p");
        assertThat(store.get("relationships", "k")).contains("r");
    }

    // ========================================
    // INVALIDATION TESTS
    // ========================================

    @Test
    @DisplayName("invalidate should remove only the given key")
    void invalidate_shouldRemoveKey() {
        store.put("permissions", "prn_1", "a");
        store.put("permissions", "prn_2", "b");

        store.invalidate("permissions", "prn_1");

        assertThat(store.get("permissions", "prn_1")).isEmpty();
        assertThat(store.get("permissions", "prn_2")).contains("b");
    }

    @Test
    @DisplayName("invalidateByPrefix should remove matching keys of one namespace only")
    void invalidateByPrefix_shouldRemoveMatchingKeys() {
        // Arrange
        store.put("relationships", "prn_1:prn_2:manages", "true");
        store.put("relationships", "prn_1:prn_3:manages", "false");
        store.put("relationships", "prn_10:prn_2:manages", "true");
        store.put("permissions", "prn_1:x", "[]");

        // Act
        store.invalidateByPrefix("relationships", "prn_1:");

        // Assert
        assertThat(store.get("relationships", "prn_1:prn_2:manages")).isEmpty();
        assertThat(store.get("relationships", "prn_1:prn_3:manages")).isEmpty();
        assertThat(store.get("relationships", "prn_10:prn_2:manages")).contains("true");
        assertThat(store.get("permissions", "prn_1:x")).contains("[]");
    }

    @Test
    @DisplayName("invalidateAll should clear one namespace and tolerate unknown ones")
    void invalidateAll_shouldClearNamespace() {
        store.put("permissions", "prn_1", "a");
        store.put("relationships", "k", "r");

        store.invalidateAll("permissions");
        store.invalidateAll("never-used");

        assertThat(store.get("permissions", "prn_1")).isEmpty();
        assertThat(store.get("relationships", "k")).contains("r");
    }
}
