package com.tablecache;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CacheTableExpirationTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private CacheRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    /**
     * Drives the sweep by hand against a clock that only moves when told to.
     * TTLs are measured in minutes so the real scheduler never fires during a test.
     */
    @Nested
    class WithManualClock {

        private final MutableClock clock = new MutableClock(START);
        private final CacheTable<String, String> table;

        WithManualClock() {
            registry = CacheRegistry.newBuilder().clock(clock).build();
            table = registry.getOrCreateTable("manual");
        }

        @Test
        void removesIdleEntriesAndKeepsZeroTtl() {
            AtomicInteger evictions = new AtomicInteger();
            table.add("short", "s", Duration.ofMinutes(10)).setEvictionListener(key -> evictions.incrementAndGet());
            table.add("forever", "f", Duration.ZERO);

            clock.advance(Duration.ofMinutes(10));
            table.expirationCheck();

            assertFalse(table.exists("short"));
            assertTrue(table.exists("forever"));
            assertEquals(1, evictions.get());
            assertTrue(table.nextSweepAt().isEmpty());
        }

        @Test
        void zeroTtlNeverArmsSweep() {
            table.add("forever", "f", Duration.ZERO);
            assertTrue(table.nextSweepAt().isEmpty());

            clock.advance(Duration.ofDays(3650));
            table.expirationCheck();

            assertTrue(table.exists("forever"));
            assertTrue(table.nextSweepAt().isEmpty());
        }

        @Test
        void sweepReschedulesForNearestRemainingExpiry() {
            table.add("a", "1", Duration.ofMinutes(10));
            table.add("b", "2", Duration.ofMinutes(30));

            clock.advance(Duration.ofMinutes(4));
            table.expirationCheck();

            assertEquals(2, table.count());
            assertEquals(START.plus(Duration.ofMinutes(10)), table.nextSweepAt().orElseThrow());
        }

        @Test
        void addPullsSweepForwardOnlyWhenSooner() {
            table.add("slow", "s", Duration.ofMinutes(60));
            assertEquals(START.plus(Duration.ofMinutes(60)), table.nextSweepAt().orElseThrow());

            table.add("fast", "f", Duration.ofMinutes(5));
            assertEquals(START.plus(Duration.ofMinutes(5)), table.nextSweepAt().orElseThrow());

            table.add("medium", "m", Duration.ofMinutes(30));
            assertEquals(START.plus(Duration.ofMinutes(5)), table.nextSweepAt().orElseThrow());
        }

        @Test
        void readResetsIdleClock() throws KeyNotFoundException {
            table.add("k", "v", Duration.ofMinutes(10));

            clock.advance(Duration.ofMinutes(9));
            table.get("k");
            clock.advance(Duration.ofMinutes(5));
            table.expirationCheck();

            assertTrue(table.exists("k"));
            assertEquals(START.plus(Duration.ofMinutes(19)), table.nextSweepAt().orElseThrow());

            clock.advance(Duration.ofMinutes(5));
            table.expirationCheck();
            assertFalse(table.exists("k"));
        }

        @Test
        void expiryRunsDeleteListenersOnce() {
            List<String> events = new CopyOnWriteArrayList<>();
            table.setAboutToDeleteListener(entry -> events.add("table:" + entry.getKey()));
            table.add("k", "v", Duration.ofMinutes(1)).setEvictionListener(key -> events.add("entry:" + key));

            clock.advance(Duration.ofMinutes(2));
            table.expirationCheck();
            table.expirationCheck();

            assertEquals(List.of("table:k", "entry:k"), events);
        }

        @Test
        void failingListenerDoesNotBlockExpiry() {
            table.setAboutToDeleteListener(entry -> {
                throw new IllegalStateException("boom");
            });
            table.add("a", "1", Duration.ofMinutes(1));
            table.add("b", "2", Duration.ofMinutes(1));
            table.add("c", "3", Duration.ofMinutes(20));

            clock.advance(Duration.ofMinutes(1));
            assertDoesNotThrow(table::expirationCheck);

            assertEquals(1, table.count());
            assertTrue(table.exists("c"));
            assertEquals(START.plus(Duration.ofMinutes(20)), table.nextSweepAt().orElseThrow());
        }

        @Test
        void listenerMayReenterTableDuringExpiry() {
            table.setAboutToDeleteListener(entry -> table.add("replacement-" + entry.getKey(), "r", Duration.ZERO));
            table.add("k", "v", Duration.ofMinutes(1));

            clock.advance(Duration.ofMinutes(1));
            assertTimeoutPreemptively(Duration.ofSeconds(5), table::expirationCheck);

            assertFalse(table.exists("k"));
            assertTrue(table.exists("replacement-k"));
        }

        @Test
        void overwriteDuringExpiryIsKept() throws KeyNotFoundException {
            table.setAboutToDeleteListener(entry -> {
                if ("old".equals(entry.getValue())) {
                    table.add(entry.getKey(), "new", Duration.ZERO);
                }
            });
            table.add("k", "old", Duration.ofMinutes(1));

            clock.advance(Duration.ofMinutes(1));
            table.expirationCheck();

            assertEquals("new", table.get("k").getValue());
        }

        @Test
        void flushCancelsPendingSweep() {
            table.add("k", "v", Duration.ofMinutes(10));
            table.flush();

            assertTrue(table.nextSweepAt().isEmpty());
            table.add("again", "v", Duration.ofMinutes(30));
            assertEquals(START.plus(Duration.ofMinutes(30)), table.nextSweepAt().orElseThrow());
        }

        @Test
        void centuriesLongTtlIsStoredAndScheduled() {
            List<String> added = new CopyOnWriteArrayList<>();
            table.setAddedListener(entry -> added.add(entry.getKey()));
            Duration centuries = Duration.ofDays(365L * 300);

            assertDoesNotThrow(() -> table.add("k", "v", centuries));

            assertTrue(table.exists("k"));
            assertEquals(List.of("k"), added);
            assertEquals(START.plus(centuries), table.nextSweepAt().orElseThrow());
        }

        @Test
        void ttlBeyondInstantRangeSchedulesAtTheEndOfTime() {
            assertDoesNotThrow(() -> table.add("k", "v", Duration.ofSeconds(Long.MAX_VALUE)));

            assertTrue(table.exists("k"));
            assertEquals(Instant.MAX, table.nextSweepAt().orElseThrow());
        }

        @Test
        void centuriesLongTtlDoesNotStallSweep() {
            table.add("short", "s", Duration.ofMinutes(1));
            table.add("long", "l", Duration.ofDays(365L * 300));

            clock.advance(Duration.ofMinutes(2));
            assertDoesNotThrow(table::expirationCheck);
            assertDoesNotThrow(table::expirationCheck);

            assertFalse(table.exists("short"));
            assertTrue(table.exists("long"));
            assertTrue(table.nextSweepAt().isPresent());
        }

        @Test
        void entryOverwrittenMidSweepIsNotReportedAsDeleted() throws KeyNotFoundException {
            List<String> events = new CopyOnWriteArrayList<>();
            table.setAboutToDeleteListener(entry -> {
                events.add("delete:" + entry.getKey() + "=" + entry.getValue());
                if ("a".equals(entry.getKey())) {
                    table.add("b", "new", Duration.ZERO);
                }
            });
            List<String> evicted = new CopyOnWriteArrayList<>();
            table.add("a", "1", Duration.ofMinutes(1));
            table.add("b", "old", Duration.ofMinutes(1)).setEvictionListener(evicted::add);

            clock.advance(Duration.ofMinutes(1));
            table.expirationCheck();

            assertEquals(List.of("delete:a=1"), events);
            assertTrue(evicted.isEmpty());
            assertEquals("new", table.get("b").getValue());
            assertEquals(1, table.count());
        }
    }

    /**
     * Real time against the registry's scheduler.
     */
    @Nested
    class WithSystemClock {

        private final CacheTable<String, String> table;

        WithSystemClock() {
            registry = CacheRegistry.newBuilder().build();
            table = registry.getOrCreateTable("timed");
        }

        @Test
        void untouchedEntryExpires() throws InterruptedException {
            List<String> evicted = new CopyOnWriteArrayList<>();
            table.add("a", "value", Duration.ofMillis(50)).setEvictionListener(evicted::add);

            Thread.sleep(200);

            assertFalse(table.exists("a"));
            assertEquals(List.of("a"), evicted);
        }

        @Test
        void entryDoesNotExpireEarly() throws InterruptedException {
            table.add("k", "v", Duration.ofMillis(300));

            Thread.sleep(100);
            assertTrue(table.exists("k"));

            await().atMost(2, TimeUnit.SECONDS)
                    .pollInterval(10, TimeUnit.MILLISECONDS)
                    .until(() -> !table.exists("k"));
        }

        @Test
        void regularReadsKeepEntryAlive() throws Exception {
            table.add("b", "value", Duration.ofMillis(100));

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
            while (System.nanoTime() < deadline) {
                Thread.sleep(30);
                table.get("b");
            }

            assertTrue(table.exists("b"));
        }

        @Test
        void zeroTtlSurvivesNeighbourExpiry() {
            table.add("forever", "f", Duration.ZERO);
            table.add("short", "s", Duration.ofMillis(20));

            await().atMost(2, TimeUnit.SECONDS).until(() -> !table.exists("short"));

            assertTrue(table.exists("forever"));
            assertEquals(1, table.count());
        }

        @Test
        void sweepKeepsRearmingUntilTableEmpty() {
            table.add("first", "1", Duration.ofMillis(30));
            table.add("second", "2", Duration.ofMillis(120));
            table.add("third", "3", Duration.ofMillis(250));

            await().atMost(2, TimeUnit.SECONDS)
                    .pollInterval(10, TimeUnit.MILLISECONDS)
                    .until(() -> table.count() == 0);
            assertTrue(table.nextSweepAt().isEmpty());
        }
    }
}
