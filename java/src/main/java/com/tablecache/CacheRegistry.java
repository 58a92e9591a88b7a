package com.tablecache;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory of {@link CacheTable}s keyed by name. Tables are created on first lookup and kept
 * for the lifetime of the registry; all of them share one scheduler for expiration checks.
 */
public final class CacheRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CacheRegistry.class);

    private final ConcurrentMap<String, CacheTable<?, ?>> tables = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledThreadPoolExecutor sweepScheduler;
    private final boolean shared;
    private volatile boolean closed = false;

    private CacheRegistry(Builder builder, boolean shared) {
        this.clock = builder.clock;
        this.shared = shared;
        AtomicInteger threadIndex = new AtomicInteger();
        String threadName = builder.threadName;
        int threads = builder.sweepThreads;
        this.sweepScheduler = new ScheduledThreadPoolExecutor(threads, r -> {
            String suffix = threads == 1 ? "" : "-" + threadIndex.incrementAndGet();
            Thread t = new Thread(r, threadName + suffix);
            t.setDaemon(true);
            return t;
        });
        // cancelled checks leave the queue at once; pending ones are dropped on shutdown
        this.sweepScheduler.setRemoveOnCancelPolicy(true);
        this.sweepScheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Returns the process-wide registry, creating it on first use. It cannot be closed.
     *
     * @return shared registry
     */
    public static CacheRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Creates a builder for a standalone registry.
     *
     * @return builder for further customization
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Returns the table registered as {@code name}, creating an empty one if needed.
     * Concurrent callers asking for the same name always receive the same instance.
     *
     * @param name table name
     * @return the table
     * @throws IllegalStateException if the registry is closed
     */
    public <K, V> CacheTable<K, V> getOrCreateTable(String name) {
        Objects.requireNonNull(name, "name");
        checkNotClosed();
        CacheTable<?, ?> table = tables.computeIfAbsent(name, n -> {
            LOG.debug("Creating cache table {}", n);
            return new CacheTable<>(n, clock, sweepScheduler);
        });
        @SuppressWarnings("unchecked")
        CacheTable<K, V> typed = (CacheTable<K, V>) table;
        return typed;
    }

    /**
     * Returns the names of all tables created so far.
     *
     * @return sorted snapshot of table names
     */
    public Set<String> tableNames() {
        return new TreeSet<>(tables.keySet());
    }

    /**
     * Stops the expiration scheduler. Pending checks are dropped; entries stay in their tables.
     *
     * @throws UnsupportedOperationException if called on {@link #global()}
     */
    @Override
    public void close() {
        if (shared) {
            throw new UnsupportedOperationException("The global CacheRegistry cannot be closed");
        }
        if (closed) {
            return;
        }
        closed = true;
        sweepScheduler.shutdown();
        try {
            if (!sweepScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Expiration checks still running after 5s, forcing shutdown");
                sweepScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("CacheRegistry is closed");
        }
    }

    private static final class GlobalHolder {
        static final CacheRegistry INSTANCE = new CacheRegistry(newBuilder(), true);
    }

    /**
     * Builder for configuring {@link CacheRegistry} instances.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private String threadName = "TableCache-Sweeper";
        private int sweepThreads = 1;

        private Builder() {
        }

        /**
         * Sets the clock used to timestamp entries and measure idle time.
         *
         * @param clock time source
         * @return this builder
         * @throws NullPointerException if {@code clock} is {@code null}
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the name of the expiration scheduler thread(s).
         *
         * @param name thread name prefix
         * @return this builder
         * @throws IllegalArgumentException if {@code name} is blank
         */
        public Builder threadName(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("threadName must not be blank");
            }
            this.threadName = name;
            return this;
        }

        /**
         * Sets how many threads run expiration checks and the listeners they trigger.
         *
         * @param threads thread count
         * @return this builder
         * @throws IllegalArgumentException if {@code threads} is less than 1
         */
        public Builder sweepThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("sweepThreads must be positive, got: " + threads);
            }
            this.sweepThreads = threads;
            return this;
        }

        /**
         * Builds a {@link CacheRegistry} with the configured options.
         *
         * @return new registry
         */
        public CacheRegistry build() {
            return new CacheRegistry(this, false);
        }
    }
}
