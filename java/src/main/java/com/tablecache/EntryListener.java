package com.tablecache;

/**
 * Table-level callback fired when an entry is added or about to be deleted.
 *
 * @param <K> key type
 * @param <V> value type
 */
@FunctionalInterface
public interface EntryListener<K, V> {
    void onEntry(CacheEntry<K, V> entry);
}
