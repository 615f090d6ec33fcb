package io.fullerstack.observables.property;

import io.fullerstack.observables.event.Event;
import io.fullerstack.observables.hook.Hook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Multi-threaded access to a single Property or Event.
 */
class PropertyConcurrencyTest {

    private static final int WRITERS = 4;
    private static final int WRITES_PER_WRITER = 5_000;

    /** Values carry their writer and sequence so a torn or invented value is detectable. */
    private record Stamp(int writer, int sequence) {
    }

    @Test
    @Timeout(30)
    void shouldOnlyExposeWrittenValuesUnderConcurrentWriters() throws Exception {
        Property<Stamp> property = new Property<>(new Stamp(-1, -1));
        Set<Stamp> written = ConcurrentHashMap.newKeySet();
        written.add(property.get());
        Queue<Stamp> notified = new ConcurrentLinkedQueue<>();
        Queue<Stamp> observedByReaders = new ConcurrentLinkedQueue<>();

        Hook hook = property.hook(notified::add);
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger finishedWriters = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < WRITERS; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < WRITES_PER_WRITER; i++) {
                        Stamp stamp = new Stamp(writer, i);
                        written.add(stamp);
                        property.set(stamp);
                    }
                    finishedWriters.incrementAndGet();
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                while (finishedWriters.get() < WRITERS) {
                    observedByReaders.add(property.get());
                }
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(notified).hasSize(WRITERS * WRITES_PER_WRITER);
        assertThat(written).containsAll(notified);
        assertThat(written).containsAll(observedByReaders);
        assertThat(written).contains(property.get());
        assertThat(hook.isActive()).isTrue();
        hook.release();
    }

    @Test
    @Timeout(30)
    void shouldPreserveEachWritersOrderInNotifications() throws Exception {
        Property<Stamp> property = new Property<>(new Stamp(-1, -1));
        Queue<Stamp> notified = new ConcurrentLinkedQueue<>();
        Hook hook = property.hook(notified::add);

        Thread[] threads = new Thread[WRITERS];
        for (int w = 0; w < WRITERS; w++) {
            int writer = w;
            threads[w] = new Thread(() -> {
                for (int i = 0; i < WRITES_PER_WRITER; i++) {
                    property.set(new Stamp(writer, i));
                }
            });
            threads[w].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        int[] lastSeen = new int[WRITERS];
        Arrays.fill(lastSeen, -1);
        for (Stamp stamp : notified) {
            assertThat(stamp.sequence()).isGreaterThan(lastSeen[stamp.writer()]);
            lastSeen[stamp.writer()] = stamp.sequence();
        }
        assertThat(lastSeen).containsOnly(WRITES_PER_WRITER - 1);
        hook.release();
    }

    @Test
    @Timeout(30)
    void shouldTolerateHookChurnDuringEmission() throws Exception {
        Event<Long> event = new Event<>();
        AtomicLong delivered = new AtomicLong();
        Hook anchor = event.hook(value -> delivered.incrementAndGet());
        int emissions = 20_000;

        Thread churn = new Thread(() -> {
            for (int i = 0; i < emissions; i++) {
                Hook temporary = event.hook(value -> { });
                temporary.release();
            }
        });
        churn.start();
        for (long i = 0; i < emissions; i++) {
            event.emit(i);
        }
        churn.join();

        assertThat(delivered.get()).isEqualTo(emissions);
        assertThat(event.hookCount()).isEqualTo(1);
        anchor.release();
        assertThat(event.hookCount()).isZero();
    }
}
