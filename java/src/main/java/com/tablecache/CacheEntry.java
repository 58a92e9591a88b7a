package com.tablecache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents a single cached value together with its access metadata.
 *
 * <p>The key, value, idle TTL and creation time never change. Access time,
 * access count and the eviction listener are guarded by the entry's own lock,
 * independent of the owning table's lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class CacheEntry<K, V> {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final K key;
    private final V value;
    private final Duration idleTtl;
    private final Instant createdAt;
    private final Clock clock;

    private Instant lastAccessedAt;
    private long accessCount;
    private KeyListener<K> evictionListener;

    // guarded by the owning table's write lock
    boolean removalPending;

    CacheEntry(K key, V value, Duration idleTtl, Clock clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
        this.idleTtl = requireValidTtl(idleTtl);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.lastAccessedAt = createdAt;
    }

    /**
     * Creates a detached entry, typically returned from an {@link EntryLoader}.
     *
     * @param key cache key
     * @param value cached value, may be {@code null}
     * @param idleTtl how long the entry may stay unread; {@link Duration#ZERO} disables expiry
     * @return new entry
     * @throws NullPointerException if {@code key} or {@code idleTtl} is {@code null}
     * @throws IllegalArgumentException if {@code idleTtl} is negative
     */
    public static <K, V> CacheEntry<K, V> of(K key, V value, Duration idleTtl) {
        return new CacheEntry<>(key, value, idleTtl, Clock.systemUTC());
    }

    static Duration requireValidTtl(Duration idleTtl) {
        Objects.requireNonNull(idleTtl, "idleTtl");
        if (idleTtl.isNegative()) {
            throw new IllegalArgumentException("idleTtl must not be negative, got: " + idleTtl);
        }
        return idleTtl;
    }

    /**
     * Marks the entry as read: refreshes the last access time and bumps the access count.
     */
    public void keepAlive() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            if (now.isAfter(lastAccessedAt)) {
                lastAccessedAt = now;
            }
            accessCount++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cache key for this entry.
     *
     * @return cache key
     */
    public K getKey() {
        return key;
    }

    /**
     * Returns the cached value.
     *
     * @return value, possibly {@code null}
     */
    public V getValue() {
        return value;
    }

    /**
     * Returns how long the entry may remain unread before it expires.
     *
     * @return idle TTL, {@link Duration#ZERO} when the entry never expires
     */
    public Duration getIdleTtl() {
        return idleTtl;
    }

    /**
     * Returns when the entry was created.
     *
     * @return creation instant
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns when the entry was last read, or its creation time if never read.
     *
     * @return last access instant
     */
    public Instant getLastAccessedAt() {
        lock.readLock().lock();
        try {
            return lastAccessedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns how many times the entry has been read through its table.
     *
     * @return access count
     */
    public long getAccessCount() {
        lock.readLock().lock();
        try {
            return accessCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the listener invoked with the key right before this entry is removed.
     *
     * @param listener listener, or {@code null} to clear it
     */
    public void setEvictionListener(KeyListener<K> listener) {
        lock.writeLock().lock();
        try {
            this.evictionListener = listener;
        } finally {
            lock.writeLock().unlock();
        }
    }

    KeyListener<K> getEvictionListener() {
        lock.readLock().lock();
        try {
            return evictionListener;
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean expires() {
        return !idleTtl.isZero();
    }

    /**
     * Remaining idle time at {@code now}; zero or negative once expired.
     * {@code null} for entries that never expire.
     */
    Duration expiresIn(Instant now) {
        if (!expires()) {
            return null;
        }
        Duration idleFor = Duration.between(getLastAccessedAt(), now);
        if (idleFor.isNegative()) {
            return idleTtl;
        }
        return idleTtl.minus(idleFor);
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", idleTtl=" + idleTtl + ", createdAt=" + createdAt + '}';
    }
}
