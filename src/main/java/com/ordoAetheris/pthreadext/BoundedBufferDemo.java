package com.ordoAetheris.pthreadext;

import com.ordoAetheris.pthreadext.sync.BoundedQueue;
import com.ordoAetheris.pthreadext.sync.EventAction;
import com.ordoAetheris.pthreadext.sync.EventFlag;
import com.ordoAetheris.pthreadext.sync.EventTest;
import com.ordoAetheris.pthreadext.sync.SyncResult;
import com.ordoAetheris.pthreadext.sync.Timeouts;

import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 Producer/consumer run over a BoundedQueue with an EventFlag as the shutdown protocol.

 - Producers: put (producerId, seq) messages of 8 bytes; a full queue blocks them (backpressure).
   When done, producer i sets bit i on the flag.
 - Consumers: receive FOREVER until the queue answers CANCELED.
 - Coordinator: waits ALL producer bits, waits the DRAINED bit (set by whoever consumes the last
   message), then reset()s the queue so blocked consumers leave through CANCELED.
 */
public class BoundedBufferDemo {

    private static final Logger logger = LoggerFactory.getLogger(BoundedBufferDemo.class);

    static final int MESSAGE_SIZE = 8;
    static final int DRAINED_BIT = 1 << 31;
    static final int MAX_PRODUCERS = 31;

    public record Settings(int producers, int consumers, int perProducer, int capacity, long waitMs) {
        public Settings {
            if (producers <= 0 || producers > MAX_PRODUCERS) {
                throw new IllegalArgumentException("producers must be in 1.." + MAX_PRODUCERS);
            }
            if (consumers <= 0) throw new IllegalArgumentException("consumers must be > 0");
            if (perProducer < 0) throw new IllegalArgumentException("perProducer must be >= 0");
            if ((long) producers * perProducer > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("producers * perProducer exceeds " + Integer.MAX_VALUE);
            }
            if (!Timeouts.isValid(waitMs)) throw new IllegalArgumentException("invalid waitMs " + waitMs);
        }

        public static Settings defaults() {
            return new Settings(2, 2, 50, 8, 10_000);
        }
    }

    public record Report(int produced, int consumed, int duplicates, SyncResult producersDone, SyncResult drained) {
        public boolean clean() {
            return produced == consumed && duplicates == 0
                    && producersDone.isSuccess() && drained.isSuccess();
        }
    }

    public static void main(String[] args) throws Exception {
        Settings defaults = Settings.defaults();
        Settings settings = new Settings(
                intArg(args, 0, defaults.producers()),
                intArg(args, 1, defaults.consumers()),
                intArg(args, 2, defaults.perProducer()),
                intArg(args, 3, defaults.capacity()),
                defaults.waitMs());

        Report report = run(settings);
        System.out.printf("produced=%d consumed=%d duplicates=%d producersDone=%s drained=%s%n",
                report.produced(), report.consumed(), report.duplicates(),
                report.producersDone(), report.drained());
    }

    public static Report run(Settings s) throws InterruptedException {
        int total = s.producers() * s.perProducer();
        int producerBits = (int) ((1L << s.producers()) - 1);

        AtomicInteger produced = new AtomicInteger();
        AtomicInteger consumed = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        BitSet seen = new BitSet(total);

        try (BoundedQueue q = BoundedQueue.create(s.capacity(), MESSAGE_SIZE);
             EventFlag progress = EventFlag.create()) {

            if (total == 0) progress.set(DRAINED_BIT);

            ExecutorService pool = Executors.newFixedThreadPool(s.producers() + s.consumers());
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int c = 0; c < s.consumers(); c++) {
                    final int consumerId = c;
                    pool.submit(() -> {
                        await(start);
                        byte[] buf = new byte[MESSAGE_SIZE];
                        try {
                            while (true) {
                                SyncResult r = q.receive(buf, Timeouts.FOREVER);
                                if (r == SyncResult.CANCELED) {
                                    logger.debug("consumer-{}: queue reset, leaving", consumerId);
                                    return;
                                }
                                ByteBuffer msg = ByteBuffer.wrap(buf);
                                int index = msg.getInt() * s.perProducer() + msg.getInt();
                                synchronized (seen) {
                                    if (seen.get(index)) duplicates.incrementAndGet();
                                    seen.set(index);
                                }
                                if (consumed.incrementAndGet() == total) progress.set(DRAINED_BIT);
                                microJitter();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            logger.warn("consumer-{} interrupted", consumerId);
                        }
                    });
                }

                for (int p = 0; p < s.producers(); p++) {
                    final int producerId = p;
                    pool.submit(() -> {
                        await(start);
                        byte[] buf = new byte[MESSAGE_SIZE];
                        try {
                            for (int i = 0; i < s.perProducer(); i++) {
                                ByteBuffer.wrap(buf).putInt(producerId).putInt(i);
                                long t0 = System.nanoTime();
                                SyncResult r = q.send(buf, Timeouts.FOREVER); // backpressure
                                if (r != SyncResult.SUCCESS) {
                                    logger.warn("producer-{}: send returned {}", producerId, r);
                                    return;
                                }
                                long blockedMicros = (System.nanoTime() - t0) / 1_000;
                                int n = produced.incrementAndGet();
                                if (blockedMicros > 200) {
                                    logger.debug("producer-{}: send blocked ~{}µs (queue likely full), totalProduced={}",
                                            producerId, blockedMicros, n);
                                }
                                microJitter();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            logger.warn("producer-{} interrupted", producerId);
                        } finally {
                            progress.set(1 << producerId);
                        }
                    });
                }

                start.countDown();

                SyncResult producersDone = progress.await(producerBits, EventTest.ALL, EventAction.KEEP, s.waitMs());
                SyncResult drained = progress.await(DRAINED_BIT, EventTest.ANY, EventAction.CLEAR, s.waitMs());
                if (!drained.isSuccess()) {
                    logger.warn("queue not drained ({}), {} elements left", drained, q.count());
                }

                // graceful shutdown: consumers blocked on the empty queue leave with CANCELED
                q.reset();
                pool.shutdown();
                if (!pool.awaitTermination(s.waitMs() > 0 ? s.waitMs() : 10_000, TimeUnit.MILLISECONDS)) {
                    logger.warn("pool didn't finish in time; calling shutdownNow()");
                    pool.shutdownNow();
                }

                return new Report(produced.get(), consumed.get(), duplicates.get(), producersDone, drained);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    private static int intArg(String[] args, int i, int dflt) {
        return args.length > i ? Integer.parseInt(args[i]) : dflt;
    }

    private static void await(CountDownLatch latch) {
        try { latch.await(); } catch (InterruptedException e) { throw new RuntimeException(e); }
    }

    private static void microJitter() {
        // 1/64 chance of a pause up to 50µs, enough to shuffle interleavings
        if ((ThreadLocalRandom.current().nextInt() & 63) != 0) return;
        LockSupport.parkNanos(ThreadLocalRandom.current().nextInt(50_000));
    }
}
