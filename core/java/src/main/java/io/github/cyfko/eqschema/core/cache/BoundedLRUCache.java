package io.github.cyfko.eqschema.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache for canonicalization results.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}: every successful lookup moves the
 * entry to the most-recently-used end and inserting past capacity evicts the eldest entry.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li>Lookups reorder the map, so they take the write lock</li>
 *   <li>{@link #size()} and {@link #containsKey(Object)} only take the read lock</li>
 *   <li>{@link #computeIfAbsent(Object, Function)} runs the mapping function outside any lock;
 *       concurrent misses on the same key may compute twice and keep the first stored value</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(1000);
 * String schema = cache.computeIfAbsent("F = NOT A", raw -> canonicalize(raw));
 * cache.getStats();   // "BoundedLRUCache[size=1, maxSize=1000, hits=0, misses=1]"
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final ReadWriteLock lock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Retrieves a value and marks it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            V value = entries.get(key);
            (value != null ? hits : misses).incrementAndGet();
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a key-value pair, evicting the least recently used entry when full.
     *
     * @param key the key to store
     * @param value the value to store, must not be null
     */
    public void put(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("Cached value cannot be null");
        }
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * <p>
     * If the mapping function throws, the exception propagates and nothing is cached.
     * </p>
     *
     * @param key the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V value = get(key);
        if (value != null) {
            return value;
        }

        V computed = mappingFunction.apply(key);
        if (computed == null) {
            return null;
        }

        lock.writeLock().lock();
        try {
            V existing = entries.putIfAbsent(key, computed);
            return existing != null ? existing : computed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes all entries; hit and miss counters are kept.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
            size(),
            maxSize,
            hits.get(),
            misses.get()
        );
    }
}
