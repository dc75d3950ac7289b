package pagesync.opencv.page;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Least-recently-used cache with a fixed maximum size. Evicted values are handed to an eviction
 * callback. Thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class BoundedCache<K, V> {

    private final int maxSize;
    private final Consumer<V> onEviction;
    private final LinkedHashMap<K, V> entries;
    private long hits = 0;
    private long misses = 0;

    public BoundedCache(int maxSize, Consumer<V> onEviction) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("The cache size must not be less than one, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.onEviction = onEviction;
        this.entries = new LinkedHashMap<K, V>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                if (size() > BoundedCache.this.maxSize) {
                    BoundedCache.this.onEviction.accept(eldest.getValue());
                    return true;
                }
                return false;
            }
        };
    }

    public synchronized V get(K key, Function<K, V> loader) {
        V value = entries.get(key);
        if (value != null) {
            hits++;
            return value;
        }
        misses++;
        value = loader.apply(key);
        entries.put(key, value);
        return value;
    }

    public synchronized boolean contains(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.values().forEach(onEviction);
        entries.clear();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }
}
