package io.marketstream.gateway.dispatch;

import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.normalizer.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans events out to registered consumers.
 *
 * <p>Every consumer has a bounded queue and a dedicated daemon worker. Under
 * {@link OverflowPolicy#BACKPRESSURE} a consumer whose queue stays full for the publish
 * timeout is marked saturated: further events are offered without waiting and dropped
 * until its queue drains, so a stuck consumer costs the publisher one timeout, not one
 * per event. Dropped events are counted per consumer.
 */
public class EventDispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long JOIN_TIMEOUT_MS = 2000;
    private static final long DROP_LOG_EVERY = 1000;

    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final long publishTimeoutMs;
    private final GatewayMetrics metrics;
    private final Map<Long, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private volatile boolean closed;

    /**
     * @param queueCapacity    Per-consumer queue capacity
     * @param overflowPolicy   Behaviour when a queue is full
     * @param publishTimeoutMs Longest {@link #publish} may wait under {@link OverflowPolicy#BACKPRESSURE}
     * @param metrics          Metrics sink, may be null
     */
    public EventDispatcher(int queueCapacity, OverflowPolicy overflowPolicy, long publishTimeoutMs, GatewayMetrics metrics) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (publishTimeoutMs < 0) {
            throw new IllegalArgumentException("publishTimeoutMs cannot be negative");
        }
        this.queueCapacity = queueCapacity;
        this.overflowPolicy = overflowPolicy;
        this.publishTimeoutMs = publishTimeoutMs;
        this.metrics = metrics;
    }

    public ConsumerHandle subscribe(EventConsumer consumer) {
        return subscribe("consumer-" + (ids.get() + 1), consumer);
    }

    /**
     * Registers a consumer and starts its worker.
     *
     * @throws IllegalStateException if the dispatcher is closed
     */
    public ConsumerHandle subscribe(String name, EventConsumer consumer) {
        if (closed) {
            throw new IllegalStateException("dispatcher is closed");
        }
        ConsumerHandle handle = new ConsumerHandle(ids.incrementAndGet(), name);
        Subscriber subscriber = new Subscriber(handle, consumer, new ArrayBlockingQueue<>(queueCapacity));
        subscribers.put(handle.id(), subscriber);
        subscriber.start();
        LOGGER.info("Registered consumer {} (capacity={}, policy={})", name, queueCapacity, overflowPolicy);
        return handle;
    }

    /**
     * Stops delivery to a consumer. Events still queued for it are discarded.
     *
     * @return false if the handle was not registered
     */
    public boolean unsubscribe(ConsumerHandle handle) {
        Subscriber subscriber = subscribers.remove(handle.id());
        if (subscriber == null) {
            return false;
        }
        subscriber.stop();
        LOGGER.info("Unregistered consumer {}", handle.name());
        return true;
    }

    /**
     * Enqueues an event for every consumer.
     */
    public void publish(StreamEvent event) {
        if (closed) {
            return;
        }
        for (Subscriber subscriber : subscribers.values()) {
            subscriber.offer(event);
        }
        if (metrics != null) {
            metrics.recordEventDispatched(event.exchange());
        }
    }

    public int consumerCount() {
        return subscribers.size();
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscriber subscriber : subscribers.values()) {
            subscriber.stop();
        }
        subscribers.clear();
        LOGGER.info("Event dispatcher closed");
    }

    private void recordDrop(ConsumerHandle handle) {
        long dropped = handle.recordDropped();
        if (metrics != null) {
            metrics.recordEventDropped(handle.name());
        }
        if (dropped == 1 || dropped % DROP_LOG_EVERY == 0) {
            LOGGER.warn("Consumer {} is falling behind: {} events dropped ({})",
                handle.name(), dropped, overflowPolicy);
        }
    }

    private final class Subscriber implements Runnable {
        private final ConsumerHandle handle;
        private final EventConsumer consumer;
        private final BlockingQueue<StreamEvent> queue;
        private final Thread worker;
        private volatile boolean running = true;
        private volatile boolean saturated;

        private Subscriber(ConsumerHandle handle, EventConsumer consumer, BlockingQueue<StreamEvent> queue) {
            this.handle = handle;
            this.consumer = consumer;
            this.queue = queue;
            this.worker = new Thread(this, "dispatch-" + handle.name());
            this.worker.setDaemon(true);
        }

        private void start() {
            worker.start();
        }

        private void offer(StreamEvent event) {
            if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                while (!queue.offer(event)) {
                    if (queue.poll() != null) {
                        recordDrop(handle);
                    }
                }
                return;
            }
            if (saturated) {
                if (!queue.isEmpty()) {
                    if (!queue.offer(event)) {
                        recordDrop(handle);
                    }
                    return;
                }
                saturated = false;
                LOGGER.info("Consumer {} caught up", handle.name());
            }
            try {
                if (!queue.offer(event, publishTimeoutMs, TimeUnit.MILLISECONDS)) {
                    saturated = true;
                    recordDrop(handle);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordDrop(handle);
            }
        }

        @Override
        public void run() {
            while (running) {
                StreamEvent event;
                try {
                    event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    if (!running) {
                        break;
                    }
                    continue;
                }
                if (event == null) {
                    continue;
                }
                try {
                    consumer.onEvent(event);
                    handle.recordDelivered();
                } catch (RuntimeException e) {
                    handle.recordFailure();
                    if (metrics != null) {
                        metrics.recordConsumerFailure(handle.name());
                    }
                    LOGGER.error("Consumer {} failed on {}", handle.name(), event.getClass().getSimpleName(), e);
                }
            }
        }

        private void stop() {
            running = false;
            if (Thread.currentThread() == worker) {
                // unsubscribed from inside its own callback
                queue.clear();
                return;
            }
            worker.interrupt();
            try {
                worker.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            queue.clear();
        }
    }
}
