package com.regimetrader.core.engine;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single serialization point for both exchange streams.
 *
 * <p>The market and order socket handlers are producers: they only {@link #submit} decoded
 * events. One dedicated consumer thread takes events in arrival order and hands each to the
 * {@link EngineEventHandler}, so metric updates, classification, submissions and fill
 * reconciliation never run concurrently.
 *
 * <p>The queue is bounded; a full queue blocks the producing socket thread rather than dropping
 * an event.
 *
 * <p>The run ends once every expected stream has sent its {@link EngineEvent.StreamClosed}, or
 * once one has closed and no further event arrives within the close grace period. Fills that
 * trail the end of market data are therefore still applied. On the way out the loop drains
 * whatever is still queued, then releases {@link #awaitCompletion} callers.
 */
public class EngineEventLoop {

    private static final Logger log = LoggerFactory.getLogger(EngineEventLoop.class);

    /** Upper bound on how long {@link #stop} waits for the consumer to drain. */
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final EngineEventHandler handler;
    private final BlockingQueue<EngineEvent> queue;
    private final Set<String> expectedStreams;
    private final Duration closeGracePeriod;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Thread consumerThread;

    // consumer thread only
    private final Set<String> closedStreams = new HashSet<>();

    public EngineEventLoop(
            EngineEventHandler handler, int capacity, Set<String> expectedStreams, Duration closeGracePeriod) {
        if (expectedStreams.isEmpty()) {
            throw new IllegalArgumentException("At least one stream must be expected");
        }
        this.handler = handler;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.expectedStreams = Set.copyOf(expectedStreams);
        this.closeGracePeriod = closeGracePeriod;
    }

    /**
     * Enqueues an event, blocking while the queue is full.
     *
     * @return false if the calling thread was interrupted before the event could be queued
     */
    public boolean submit(EngineEvent event) {
        try {
            queue.put(event);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing {}, event dropped", event.getClass().getSimpleName());
            return false;
        }
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread consumer = new Thread(this::processLoop, "engine-event-loop");
            consumer.setDaemon(true);
            consumerThread = consumer;
            consumer.start();
            log.info("EngineEventLoop started, run ends when {} have closed", expectedStreams);
        }
    }

    /**
     * Stops taking new work and waits for the consumer to drain what is already queued.
     * When this returns normally every queued event has been handled, so engine state can be
     * read safely from the calling thread.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("EngineEventLoop stopping");
            Thread consumer = consumerThread;
            if (consumer != null) {
                consumer.interrupt();
            }
        }
        joinConsumer();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Blocks until the loop has finished, or the timeout elapses. */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pendingEvents() {
        return queue.size();
    }

    private void joinConsumer() {
        Thread consumer = consumerThread;
        if (consumer == null || consumer == Thread.currentThread()) {
            return;
        }
        try {
            consumer.join(SHUTDOWN_TIMEOUT.toMillis());
            if (consumer.isAlive()) {
                log.warn("EngineEventLoop still draining after {}, {} events pending", SHUTDOWN_TIMEOUT, queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for EngineEventLoop to drain");
        }
    }

    private void processLoop() {
        try {
            while (running.get()) {
                try {
                    EngineEvent event = closedStreams.isEmpty()
                            ? queue.take()
                            : queue.poll(closeGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
                    if (event == null) {
                        log.info("No events within {} of {} closing, ending run", closeGracePeriod, closedStreams);
                        running.set(false);
                        break;
                    }
                    dispatch(event);
                    if (event instanceof EngineEvent.StreamClosed closed) {
                        onStreamClosed(closed);
                    }
                } catch (InterruptedException e) {
                    if (!running.get()) {
                        log.info("EngineEventLoop interrupted during shutdown");
                        break;
                    }
                    log.warn("EngineEventLoop interrupted unexpectedly, resuming");
                }
            }
            // a shutdown interrupt that landed during dispatch must not abort the drain
            Thread.interrupted();
            drainRemaining();
        } finally {
            finished.countDown();
        }
    }

    private void onStreamClosed(EngineEvent.StreamClosed closed) {
        closedStreams.add(closed.stream());
        if (closedStreams.containsAll(expectedStreams)) {
            log.info("All streams closed, ending run");
            running.set(false);
        } else {
            log.info("Stream {} closed, run ends after {} without events", closed.stream(), closeGracePeriod);
        }
    }

    private void dispatch(EngineEvent event) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            log.error("Engine event {} failed, continuing", event.getClass().getSimpleName(), e);
        }
    }

    /** Processes events queued before shutdown so late fills still reach the position. */
    private void drainRemaining() {
        int drained = 0;
        EngineEvent remaining;
        while ((remaining = queue.poll()) != null) {
            dispatch(remaining);
            drained++;
        }
        if (drained > 0) {
            log.info("Drained {} remaining engine events during shutdown", drained);
        }
    }
}
