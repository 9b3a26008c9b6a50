package io.marketstream.gateway.dispatch;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Registration of one consumer, with its delivery statistics.
 */
public final class ConsumerHandle {

    private final long id;
    private final String name;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    ConsumerHandle(long id, String name) {
        this.id = id;
        this.name = name;
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failureCount() {
        return failures.get();
    }

    void recordDelivered() {
        delivered.incrementAndGet();
    }

    long recordDropped() {
        return dropped.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }

    @Override
    public String toString() {
        return "ConsumerHandle[" + name + "]";
    }
}
