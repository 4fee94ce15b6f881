/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.lumina;

import io.lumina.config.OverflowPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Single-consumer message queue of an engine. Callers {@link #enqueue} from any thread; one
 * consumer task delivers messages to the handler in strict FIFO order.
 *
 * <p>Closing is cooperative. {@link #close()} stops new entries from being accepted, and the
 * consumer keeps delivering until the queue is both closed and empty, then exits. The consumer
 * checks for close between messages and at least every {@value #IDLE_POLL_MILLIS}ms while idle,
 * never while a message is being delivered. It is never interrupted by the pipeline, because an
 * interrupt during a channel write would close the file underneath it.</p>
 *
 * <p>Every accepted message is delivered exactly once, by the consumer, by
 * {@link #drainSynchronously()}, or (when a submitter raced with the consumer's exit) handed back
 * to the submitter as {@link Enqueued#REJECTED} for a synchronous write.</p>
 *
 * <p>This class is package-private and owned by {@link Lumina}.</p>
 *
 * @since 4.0.0
 */
final class DispatchPipeline {

    private static final Logger logger = LogManager.getLogger(DispatchPipeline.class);
    static final long IDLE_POLL_MILLIS = 50;

    /**
     * Outcome of {@link #enqueue(Message)}.
     */
    enum Enqueued {
        /** The consumer or a drain will deliver the message. */
        QUEUED,
        /** The queue was full under {@link OverflowPolicy#DROP}; the message is gone. */
        DROPPED,
        /** The pipeline no longer accepts messages; the caller must write it itself. */
        REJECTED
    }

    private final String engineName;
    private final BlockingQueue<Message> queue;
    private final OverflowPolicy overflowPolicy;
    private final Consumer<Message> handler;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed = false;
    private volatile boolean consumerExited = false;

    DispatchPipeline(String engineName, int capacity, OverflowPolicy overflowPolicy, Consumer<Message> handler) {
        this.engineName = engineName;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.overflowPolicy = overflowPolicy;
        this.handler = handler;
    }

    /**
     * Starts the consumer task. Must be called exactly once.
     *
     * @param executor where the consumer runs; it occupies one thread until the pipeline closes
     */
    void start(Executor executor) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatch pipeline for '" + engineName + "' already started");
        }
        executor.execute(this::consume);
    }

    /**
     * Hands a message to the consumer.
     *
     * @param message the message
     * @return whether the message was queued, dropped, or must be written by the caller
     */
    Enqueued enqueue(Message message) {
        if (closed) {
            return Enqueued.REJECTED;
        }
        if (overflowPolicy == OverflowPolicy.BLOCK) {
            try {
                queue.put(message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Enqueued.REJECTED;
            }
        } else if (!queue.offer(message)) {
            long count = dropped.incrementAndGet();
            logger.warn("[{}] Log queue full, dropped {} message(s) so far", engineName, count);
            return Enqueued.DROPPED;
        }
        // the consumer may have finished its last pass between our closed check and the insert
        if (consumerExited && queue.removeIf(queued -> queued == message)) {
            return Enqueued.REJECTED;
        }
        return Enqueued.QUEUED;
    }

    private void consume() {
        boolean interrupted = false;
        try {
            while (!(closed && queue.isEmpty())) {
                Message message = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    deliver(message);
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
            logger.warn("[{}] Log consumer interrupted, {} message(s) left for shutdown drain", engineName, queue.size());
        } finally {
            consumerExited = true;
            if (!interrupted) {
                drainSynchronously();
            }
            terminated.countDown();
        }
    }

    private void deliver(Message message) {
        try {
            handler.accept(message);
        } catch (Throwable t) {
            logger.error("[{}] Log consumer error: {}", engineName, t.getMessage(), t);
        }
    }

    /**
     * Stops accepting new messages. Already queued messages stay deliverable. Idempotent.
     */
    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * Waits for the consumer to deliver everything and exit.
     *
     * @param timeout the longest time to wait
     * @return true if the consumer exited in time, false on timeout or interruption
     */
    boolean awaitTermination(Duration timeout) {
        try {
            return terminated.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Delivers whatever is queued right now on the calling thread, without waiting for more.
     * Safe to run while the consumer is still active; each message is taken by exactly one side.
     *
     * @return the number of messages delivered
     */
    int drainSynchronously() {
        int count = 0;
        Message message;
        while ((message = queue.poll()) != null) {
            deliver(message);
            count++;
        }
        return count;
    }

    boolean hasConsumerExited() {
        return consumerExited;
    }

    int pending() {
        return queue.size();
    }

    long droppedCount() {
        return dropped.get();
    }
}
