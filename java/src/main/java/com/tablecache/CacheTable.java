package com.tablecache;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

/**
 * Named, thread-safe collection of entries that expire after sitting unread for their idle TTL.
 *
 * <p>Expiration is driven by a one-shot task that always sleeps until the nearest known expiry,
 * then reschedules itself. Adding an entry that would expire sooner pulls the task forward.
 * Listeners and loaders are never invoked while the table lock is held, so they may call back
 * into the table.
 *
 * <p>Tables are obtained from {@link CacheRegistry#getOrCreateTable(String)}.
 *
 * @param <K> key type, must implement {@code equals} and {@code hashCode}
 * @param <V> value type
 */
public final class CacheTable<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(CacheTable.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final String name;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    // guarded by lock
    private Map<K, CacheEntry<K, V>> entries = new HashMap<>();
    private ScheduledFuture<?> sweepTask;
    private Instant nextSweepAt;
    private Duration sweepInterval;

    private volatile EntryLoader<K, V> entryLoader;
    private volatile EntryListener<K, V> addedListener;
    private volatile EntryListener<K, V> aboutToDeleteListener;
    private volatile Logger logger = NOPLogger.NOP_LOGGER;

    CacheTable(String name, Clock clock, ScheduledExecutorService scheduler) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Returns the name this table is registered under.
     *
     * @return table name
     */
    public String getName() {
        return name;
    }

    /**
     * Stores {@code value} under {@code key}, replacing any existing entry.
     *
     * @param key cache key
     * @param value value to cache
     * @param idleTtl how long the entry may stay unread; {@link Duration#ZERO} keeps it forever
     * @return the stored entry
     * @throws NullPointerException if {@code key} or {@code idleTtl} is {@code null}
     * @throws IllegalArgumentException if {@code idleTtl} is negative
     */
    public CacheEntry<K, V> add(K key, V value, Duration idleTtl) {
        CacheEntry<K, V> entry = new CacheEntry<>(key, value, idleTtl, clock);
        lock.writeLock().lock();
        try {
            addInternal(entry);
        } finally {
            lock.writeLock().unlock();
        }
        fireAdded(entry);
        return entry;
    }

    /**
     * Stores {@code value} under {@code key} only if the key is absent.
     *
     * @param key cache key
     * @param value value to cache
     * @param idleTtl idle TTL for the new entry
     * @return {@code true} if the entry was inserted, {@code false} if the key already existed
     */
    public boolean notFoundAdd(K key, V value, Duration idleTtl) {
        CacheEntry<K, V> entry = new CacheEntry<>(key, value, idleTtl, clock);
        lock.writeLock().lock();
        try {
            if (entries.containsKey(key)) {
                return false;
            }
            addInternal(entry);
        } finally {
            lock.writeLock().unlock();
        }
        fireAdded(entry);
        return true;
    }

    /**
     * Returns the entry for {@code key} and marks it as accessed. On a miss the configured
     * {@link EntryLoader} is consulted with {@code args}; a loaded entry is stored and returned.
     *
     * @param key cache key
     * @param args extra arguments forwarded to the loader
     * @return the cached or loaded entry
     * @throws KeyNotLoadableException if the key is absent and the loader returned {@code null}
     * @throws KeyNotFoundException if the key is absent and no loader is configured
     */
    public CacheEntry<K, V> get(K key, Object... args) throws KeyNotFoundException {
        Objects.requireNonNull(key, "key");
        CacheEntry<K, V> entry = lookup(key);
        if (entry != null) {
            entry.keepAlive();
            return entry;
        }

        EntryLoader<K, V> loader = entryLoader;
        if (loader == null) {
            throw new KeyNotFoundException(name, key);
        }
        CacheEntry<K, V> loaded = loader.load(key, args);
        if (loaded == null) {
            throw new KeyNotLoadableException(name, key);
        }
        add(key, loaded.getValue(), loaded.getIdleTtl());
        return loaded;
    }

    /**
     * Returns the entry for {@code key} if cached, marking it as accessed. Never consults the loader.
     *
     * @param key cache key
     * @return optional entry
     */
    public Optional<CacheEntry<K, V>> getIfPresent(K key) {
        Objects.requireNonNull(key, "key");
        CacheEntry<K, V> entry = lookup(key);
        if (entry == null) {
            return Optional.empty();
        }
        entry.keepAlive();
        return Optional.of(entry);
    }

    /**
     * Removes the entry for {@code key}. The table's about-to-delete listener and then the
     * entry's own eviction listener run before the entry leaves the table.
     *
     * @param key cache key
     * @return the removed entry
     * @throws KeyNotFoundException if the key is absent
     */
    public CacheEntry<K, V> delete(K key) throws KeyNotFoundException {
        Objects.requireNonNull(key, "key");
        CacheEntry<K, V> entry;
        lock.writeLock().lock();
        try {
            entry = entries.get(key);
            if (entry == null || entry.removalPending) {
                throw new KeyNotFoundException(name, key);
            }
            entry.removalPending = true;
        } finally {
            lock.writeLock().unlock();
        }

        try {
            notifyRemoval(entry, false);
        } catch (RuntimeException e) {
            releaseClaim(entry);
            throw e;
        }
        removeClaimed(entry);
        return entry;
    }

    /**
     * Checks whether {@code key} is cached without touching its access time.
     *
     * @param key cache key
     * @return {@code true} if present
     */
    public boolean exists(K key) {
        return lookup(key) != null;
    }

    /**
     * Returns the number of cached entries.
     *
     * @return entry count
     */
    public int count() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Visits every entry while holding the table's read lock. The visitor must not modify this table.
     *
     * @param visitor callback receiving each key and entry
     */
    public void forEach(BiConsumer<? super K, ? super CacheEntry<K, V>> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        lock.readLock().lock();
        try {
            entries.forEach(visitor);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns up to {@code count} entries ordered by descending access count.
     *
     * @param count maximum number of entries
     * @return most accessed entries, never {@code null}
     */
    public List<CacheEntry<K, V>> mostAccessed(int count) {
        if (count <= 0) {
            return List.of();
        }
        List<AccessSnapshot<K, V>> snapshots;
        lock.readLock().lock();
        try {
            snapshots = new ArrayList<>(entries.size());
            for (CacheEntry<K, V> entry : entries.values()) {
                snapshots.add(new AccessSnapshot<>(entry, entry.getAccessCount()));
            }
        } finally {
            lock.readLock().unlock();
        }

        snapshots.sort(Comparator.comparingLong((AccessSnapshot<K, V> s) -> s.accessCount()).reversed());
        List<CacheEntry<K, V>> result = new ArrayList<>(Math.min(count, snapshots.size()));
        for (AccessSnapshot<K, V> snapshot : snapshots) {
            if (result.size() >= count) {
                break;
            }
            result.add(snapshot.entry());
        }
        return result;
    }

    /**
     * Drops every entry without notifying listeners and cancels the pending expiration check.
     */
    public void flush() {
        lock.writeLock().lock();
        try {
            logger.debug("Flushing table {}", name);
            entries = new HashMap<>();
            cancelSweep();
            sweepInterval = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets the loader consulted by {@link #get(Object, Object...)} on a miss.
     *
     * @param loader loader, or {@code null} to disable loading
     */
    public void setEntryLoader(EntryLoader<K, V> loader) {
        this.entryLoader = loader;
    }

    /**
     * Sets the listener fired after an entry is added.
     *
     * @param listener listener, or {@code null} to clear it
     */
    public void setAddedListener(EntryListener<K, V> listener) {
        this.addedListener = listener;
    }

    /**
     * Sets the listener fired before an entry is deleted or expires.
     *
     * @param listener listener, or {@code null} to clear it
     */
    public void setAboutToDeleteListener(EntryListener<K, V> listener) {
        this.aboutToDeleteListener = listener;
    }

    /**
     * Routes this table's diagnostic output (DEBUG level) to {@code logger}.
     *
     * @param logger destination, or {@code null} to silence diagnostics
     */
    public void setLogger(Logger logger) {
        this.logger = logger == null ? NOPLogger.NOP_LOGGER : logger;
    }

    Optional<Instant> nextSweepAt() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sweepTask == null ? null : nextSweepAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every entry whose idle time has reached its TTL and schedules the next run for
     * the nearest remaining expiry.
     */
    void expirationCheck() {
        List<CacheEntry<K, V>> expired = new ArrayList<>();
        lock.writeLock().lock();
        try {
            cancelSweep();
            if (sweepInterval != null) {
                logger.debug("Expiration check triggered after {} for table {}", sweepInterval, name);
            } else {
                logger.debug("Expiration check installed for table {}", name);
            }

            Instant now = clock.instant();
            Duration nearest = null;
            for (CacheEntry<K, V> entry : entries.values()) {
                Duration remaining = entry.expiresIn(now);
                if (remaining == null || entry.removalPending) {
                    continue;
                }
                if (isPositive(remaining)) {
                    if (nearest == null || remaining.compareTo(nearest) < 0) {
                        nearest = remaining;
                    }
                } else {
                    entry.removalPending = true;
                    expired.add(entry);
                }
            }

            sweepInterval = nearest;
            if (nearest != null) {
                arm(nearest);
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (CacheEntry<K, V> entry : expired) {
            expire(entry);
        }
    }

    private void runScheduledCheck() {
        try {
            expirationCheck();
        } catch (RuntimeException e) {
            LOG.error("Expiration check failed for table {}", name, e);
        }
    }

    private void expire(CacheEntry<K, V> entry) {
        Duration remaining = entry.expiresIn(clock.instant());
        if (isPositive(remaining)) {
            // read between the scan and now
            lock.writeLock().lock();
            try {
                entry.removalPending = false;
                if (entries.get(entry.getKey()) == entry) {
                    armIfSooner(remaining);
                }
            } finally {
                lock.writeLock().unlock();
            }
            return;
        }

        lock.writeLock().lock();
        try {
            if (entries.get(entry.getKey()) != entry) {
                // overwritten or flushed since the scan
                entry.removalPending = false;
                return;
            }
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemoval(entry, true);
        removeClaimed(entry);
    }

    private CacheEntry<K, V> lookup(K key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void addInternal(CacheEntry<K, V> entry) {
        logger.debug("Adding entry with key {} and idle TTL {} to table {}",
                entry.getKey(), entry.getIdleTtl(), name);
        entries.put(entry.getKey(), entry);
        if (entry.expires()) {
            armIfSooner(entry.getIdleTtl());
        }
    }

    // Caller holds the write lock.
    private void armIfSooner(Duration wait) {
        Instant fireAt = fireTimeAfter(wait);
        if (sweepTask == null || nextSweepAt == null || fireAt.isBefore(nextSweepAt)) {
            arm(wait);
        }
    }

    // Caller holds the write lock.
    private void arm(Duration wait) {
        cancelSweep();
        // convert saturates at Long.MAX_VALUE for waits beyond ~292 years
        long delayNanos = Math.max(1L, TimeUnit.NANOSECONDS.convert(wait));
        try {
            sweepTask = scheduler.schedule(this::runScheduledCheck, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler shut down, expiration check for table {} not scheduled", name);
            return;
        }
        nextSweepAt = fireTimeAfter(wait);
        sweepInterval = wait;
        logger.debug("Expiration check scheduled in {} for table {}", wait, name);
    }

    // Caller holds the write lock.
    private void cancelSweep() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        nextSweepAt = null;
    }

    private void fireAdded(CacheEntry<K, V> entry) {
        EntryListener<K, V> listener = addedListener;
        if (listener != null) {
            listener.onEntry(entry);
        }
    }

    private void notifyRemoval(CacheEntry<K, V> entry, boolean expiring) {
        EntryListener<K, V> deleteListener = aboutToDeleteListener;
        if (deleteListener != null) {
            runListener(() -> deleteListener.onEntry(entry), entry, expiring);
        }
        KeyListener<K> evictionListener = entry.getEvictionListener();
        if (evictionListener != null) {
            runListener(() -> evictionListener.onKey(entry.getKey()), entry, expiring);
        }
    }

    private void runListener(Runnable call, CacheEntry<K, V> entry, boolean expiring) {
        if (!expiring) {
            call.run();
            return;
        }
        try {
            call.run();
        } catch (RuntimeException e) {
            LOG.warn("Listener failed while expiring key {} from table {}", entry.getKey(), name, e);
        }
    }

    private void removeClaimed(CacheEntry<K, V> entry) {
        lock.writeLock().lock();
        try {
            if (entries.remove(entry.getKey(), entry)) {
                logger.debug("Deleting entry with key {} created at {} and accessed {} times from table {}",
                        entry.getKey(), entry.getCreatedAt(), entry.getAccessCount(), name);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void releaseClaim(CacheEntry<K, V> entry) {
        lock.writeLock().lock();
        try {
            entry.removalPending = false;
            if (entry.expires() && entries.get(entry.getKey()) == entry) {
                Duration remaining = entry.expiresIn(clock.instant());
                armIfSooner(isPositive(remaining) ? remaining : Duration.ofNanos(1));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Instant fireTimeAfter(Duration wait) {
        Instant now = clock.instant();
        try {
            return now.plus(wait);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private record AccessSnapshot<K, V>(CacheEntry<K, V> entry, long accessCount) { }
}
