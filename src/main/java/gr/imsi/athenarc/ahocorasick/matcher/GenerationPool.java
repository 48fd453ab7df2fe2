package gr.imsi.athenarc.ahocorasick.matcher;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pool of dedup tables for {@link Matcher#matchThreadSafe(String)}. Each table maps a
 * dictionary index to the generation of the call that last reported it. A table is used
 * by one call at a time; generations are unique per call, so stale entries never need clearing.
 */
class GenerationPool {
    private static final Logger LOG = LoggerFactory.getLogger(GenerationPool.class);

    private final Queue<long[]> idle = new ConcurrentLinkedQueue<>();
    private final AtomicInteger idleCount = new AtomicInteger();
    private final int tableSize;
    private final int capacity;

    GenerationPool(int tableSize, int capacity) {
        this.tableSize = tableSize;
        this.capacity = capacity;
    }

    long[] acquire() {
        long[] table = idle.poll();
        if (table == null) {
            LOG.debug("Generation pool miss, allocating table of {} entries", tableSize);
            return new long[tableSize];
        }
        idleCount.decrementAndGet();
        return table;
    }

    void release(long[] table) {
        if (idleCount.incrementAndGet() > capacity) {
            idleCount.decrementAndGet();
            return;
        }
        idle.offer(table);
    }

    int idleTables() {
        return idleCount.get();
    }
}
