package com.tablecache;

/**
 * Supplies entries for keys missing from a table.
 *
 * @param <K> key type
 * @param <V> value type
 */
@FunctionalInterface
public interface EntryLoader<K, V> {

    /**
     * Loads the entry for {@code key}.
     *
     * @param key missing key
     * @param args extra arguments passed through {@link CacheTable#get(Object, Object...)}
     * @return loaded entry, or {@code null} when the key cannot be loaded
     */
    CacheEntry<K, V> load(K key, Object... args);
}
