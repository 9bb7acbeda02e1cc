package com.taskforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for task list progress events.
 * <p>
 * Supports per-list subscriptions and global subscriptions that receive all events.
 * {@link #publish} never blocks: events go into a bounded queue drained by a single
 * dispatcher thread, and when the queue is full the event is dropped and counted.
 * Subscribers therefore see events in publish order but can never stall the engine.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-list subscribers keyed by taskListId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<EngineEvent>>> listSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all task lists. */
    private final CopyOnWriteArrayList<Consumer<EngineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final BlockingQueue<EngineEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong undelivered = new AtomicLong();
    private final Object idleMonitor = new Object();
    private final Thread dispatcher;
    private volatile boolean running = true;

    public EventBus(int queueCapacity) {
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.dispatcher = new Thread(this::dispatchLoop, "taskforge-events");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    /**
     * Queue an event for delivery to all matching subscribers (list-specific and global).
     *
     * @param event the event to publish
     * @return false if the event was dropped because the queue is full or the bus is closed
     */
    public boolean publish(EngineEvent event) {
        if (!running) {
            return false;
        }
        undelivered.incrementAndGet();
        if (!queue.offer(event)) {
            markDelivered();
            long total = dropped.incrementAndGet();
            log.warn("Event queue full, dropped {} for task list {} ({} dropped so far)",
                    event.eventType(), event.taskListId(), total);
            return false;
        }
        return true;
    }

    /**
     * Subscribe to events for a specific task list.
     *
     * @param taskListId the task list to subscribe to
     * @param consumer   callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskListId, Consumer<EngineEvent> consumer) {
        listSubscribers.computeIfAbsent(taskListId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task list {}", taskListId);
        return () -> {
            CopyOnWriteArrayList<Consumer<EngineEvent>> subs = listSubscribers.get(taskListId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all task lists (global subscription).
     *
     * @param consumer callback invoked for each event regardless of task list
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<EngineEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Number of events dropped because the queue was full. */
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Waits until every accepted event has been delivered.
     *
     * @return true if the bus became idle before the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (undelivered.get() > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                idleMonitor.wait(remaining);
            }
            return true;
        }
    }

    /** Stops the dispatcher. Events still queued are discarded. */
    @Override
    public void close() {
        running = false;
        dispatcher.interrupt();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void dispatchLoop() {
        while (running) {
            EngineEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                break;
            }
            try {
                deliver(event);
            } finally {
                markDelivered();
            }
        }
        log.debug("Event dispatcher stopped");
    }

    private void deliver(EngineEvent event) {
        log.debug("Delivering event: {} for task list {}", event.eventType(), event.taskListId());

        List<Consumer<EngineEvent>> listSubs = listSubscribers.get(event.taskListId());
        if (listSubs != null) {
            for (Consumer<EngineEvent> subscriber : listSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<EngineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void markDelivered() {
        if (undelivered.decrementAndGet() == 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }

    private void deliverSafely(Consumer<EngineEvent> subscriber, EngineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
