package com.simdash.dashboard.source;

import com.simdash.dashboard.model.VariableEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process event source for simulation producers running in the same JVM.
 *
 * Producers {@link #publish(VariableEvent)} onto a bounded queue; a scheduled
 * dispatcher drains it in FIFO batches and hands each batch to every subscriber.
 * When the queue is full new events are rejected and counted as overflow.
 */
@Slf4j
@Component
public class InMemoryEventBus implements EventSource {

    private final BlockingQueue<VariableEvent> queue;
    private final int maxBatchSize;

    private final Set<EventConsumer> consumers = new CopyOnWriteArraySet<>();

    /**
     * Held while delivering and while unsubscribing, so a consumer never sees
     * a batch after {@link #unsubscribe(EventConsumer)} returns.
     */
    private final Object deliveryLock = new Object();

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong overflowCount = new AtomicLong();

    public InMemoryEventBus(
            @Value("${dashboard.source.queue-capacity:100000}") int queueCapacity,
            @Value("${dashboard.source.max-batch-size:1000}") int maxBatchSize
    ) {
        if (queueCapacity < 1 || maxBatchSize < 1) {
            throw new IllegalArgumentException(
                    "queueCapacity and maxBatchSize must be >= 1, were " + queueCapacity + " and " + maxBatchSize);
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.maxBatchSize = maxBatchSize;
        log.info("Initialized InMemoryEventBus with queue capacity {} and max batch size {}",
                queueCapacity, maxBatchSize);
    }

    /**
     * Enqueue one event without blocking.
     *
     * @return false if the queue is full and the event was rejected
     */
    public boolean publish(VariableEvent event) {
        if (event == null) {
            return false;
        }
        if (queue.offer(event)) {
            return true;
        }
        long dropped = overflowCount.incrementAndGet();
        log.warn("Event queue full, rejected event for key {} (total rejected={})", event.getKey(), dropped);
        return false;
    }

    /**
     * @return number of events accepted
     */
    public int publishAll(Collection<VariableEvent> events) {
        int accepted = 0;
        for (VariableEvent event : events) {
            if (publish(event)) {
                accepted++;
            }
        }
        return accepted;
    }

    @Scheduled(fixedDelayString = "${dashboard.source.dispatch-interval-ms:10}")
    public void dispatchPending() {
        drain();
    }

    /**
     * Drain the queue in batches of at most {@code maxBatchSize} and deliver them.
     *
     * @return number of events delivered
     */
    public int drain() {
        int delivered = 0;
        List<VariableEvent> batch = new ArrayList<>(Math.min(maxBatchSize, 1024));
        while (queue.drainTo(batch, maxBatchSize) > 0) {
            List<VariableEvent> view = List.copyOf(batch);
            batch.clear();
            deliver(view);
            delivered += view.size();
            totalProcessed.addAndGet(view.size());
        }
        if (delivered > 0) {
            log.debug("Dispatched {} events to {} subscribers", delivered, consumers.size());
        }
        return delivered;
    }

    private void deliver(List<VariableEvent> batch) {
        synchronized (deliveryLock) {
            for (EventConsumer consumer : consumers) {
                try {
                    consumer.processEventBatch(batch);
                } catch (Exception e) {
                    log.error("Subscriber {} failed on batch of {} events", consumer, batch.size(), e);
                }
            }
        }
    }

    @Override
    public Subscription subscribe(EventConsumer consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer must not be null");
        }
        if (consumers.add(consumer)) {
            log.info("Subscribed {} (subscribers={})", consumer, consumers.size());
        }
        return new BusSubscription(consumer);
    }

    @Override
    public void unsubscribe(EventConsumer consumer) {
        if (consumer == null) {
            return;
        }
        synchronized (deliveryLock) {
            if (consumers.remove(consumer)) {
                log.info("Unsubscribed {} (subscribers={})", consumer, consumers.size());
            }
        }
    }

    @Override
    public int queueDepth() {
        return queue.size();
    }

    @Override
    public long totalEventsProcessed() {
        return totalProcessed.get();
    }

    @Override
    public long overflowCount() {
        return overflowCount.get();
    }

    public int subscriberCount() {
        return consumers.size();
    }

    private final class BusSubscription implements Subscription {
        private final EventConsumer consumer;
        private final AtomicBoolean active = new AtomicBoolean(true);

        BusSubscription(EventConsumer consumer) {
            this.consumer = consumer;
        }

        @Override
        public boolean isActive() {
            return active.get() && consumers.contains(consumer);
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                unsubscribe(consumer);
            }
        }
    }
}
