package com.tablecache;

/**
 * Callback receiving the key of an entry that is about to be removed.
 *
 * @param <K> key type
 */
@FunctionalInterface
public interface KeyListener<K> {
    void onKey(K key);
}
