package io.github.cyfko.eqschema.core.config;

import io.github.cyfko.eqschema.core.cache.BoundedLRUCache;

import java.util.Optional;

/**
 * Sizing of the canonical-schema cache kept by a canonicalizer.
 * <p>
 * Equations are often canonicalized repeatedly (the same formula submitted by many
 * requests, or re-validated on every edit). When enabled, the canonicalizer remembers
 * the canonical string of each successfully processed input, up to {@code cacheSize}
 * distinct inputs. A disabled policy has no size: its {@code cacheSize} is always 0.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();    // 1000 schemas
 * CachePolicy.strict();      // 500 schemas, for memory-constrained hosts
 * CachePolicy.relaxed();     // 2000 schemas
 * CachePolicy.none();        // every call re-parses
 * CachePolicy.custom(5000);
 * }</pre>
 *
 * @param cacheEnabled whether canonical schemas are cached
 * @param cacheSize    maximum number of cached schemas, 0 when disabled
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    /**
     * Number of schemas kept by {@link #defaults()}.
     */
    public static final int DEFAULT_CACHE_SIZE = 1000;

    private static final CachePolicy DISABLED = new CachePolicy(false, 0);

    public CachePolicy {
        if (cacheEnabled && cacheSize <= 0) {
            throw new IllegalArgumentException("An enabled schema cache needs a positive size, got: " + cacheSize);
        }
        if (!cacheEnabled && cacheSize != 0) {
            throw new IllegalArgumentException("A disabled schema cache cannot have a size, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return custom(DEFAULT_CACHE_SIZE);
    }

    public static CachePolicy strict() {
        return custom(DEFAULT_CACHE_SIZE / 2);
    }

    public static CachePolicy relaxed() {
        return custom(DEFAULT_CACHE_SIZE * 2);
    }

    /**
     * Disables caching: every call re-parses its input.
     *
     * @return the shared disabled policy
     */
    public static CachePolicy none() {
        return DISABLED;
    }

    /**
     * @param cacheSize maximum number of cached schemas, must be positive
     * @return an enabled policy of the given size
     * @throws IllegalArgumentException if {@code cacheSize} is not positive
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }

    /**
     * Creates the cache this policy describes.
     *
     * @param <V> the cached value type
     * @return a new empty cache keyed by raw input, or empty when caching is disabled
     */
    public <V> Optional<BoundedLRUCache<String, V>> newCache() {
        return cacheEnabled ? Optional.of(new BoundedLRUCache<>(cacheSize)) : Optional.empty();
    }
}
