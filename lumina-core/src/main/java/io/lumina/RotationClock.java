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

import io.lumina.config.LuminaConfig;
import io.lumina.config.RotationPolicy;
import io.lumina.sinks.LogFileSystem;
import io.lumina.sinks.SinkCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic retention sweep over the period directories of one engine.
 *
 * <p>The clock runs on a single daemon thread. Each sweep lists the directory that holds the
 * per-period directories (the parent of the current period's directory), parses every child's
 * name as a period key, and deletes those whose period started before {@code now - retention}.
 * Children whose names do not parse are left alone. Before a directory is deleted, every cached
 * sink under it is closed so no writer keeps a handle into a removed file.</p>
 *
 * <p>Lifecycle: {@code STOPPED -> RUNNING -> STOPPING -> STOPPED}. The first sweep runs
 * immediately on {@link #start()}; {@link #stop()} cancels the schedule and waits for a sweep in
 * progress to finish, so once it returns no further deletion happens.</p>
 *
 * @since 4.0.0
 */
final class RotationClock implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RotationClock.class);
    private static final long STOP_WAIT_SECONDS = 30;

    enum State {
        STOPPED,
        RUNNING,
        STOPPING
    }

    private final LuminaConfig config;
    private final SinkCache sinkCache;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> schedule;

    RotationClock(LuminaConfig config, SinkCache sinkCache) {
        this.config = config;
        this.sinkCache = sinkCache;
    }

    /**
     * Starts periodic sweeping if rotation is enabled. Does nothing when the clock is already
     * running or rotation is disabled. A log directory without a parent leaves nothing to sweep;
     * that is reported once and the clock stays stopped.
     */
    synchronized void start() {
        RotationPolicy policy = config.getRotation();
        if (!policy.enabled() || state.get() != State.STOPPED) {
            return;
        }
        Path root = sweepRoot(config.getClock().instant());
        if (root == null) {
            logger.warn("[{}] Log directory {} has no parent to sweep, rotation is off",
                config.getName(), config.directoryFor(config.periodKey(config.getClock().instant())));
            return;
        }
        state.set(State.RUNNING);
        String threadName = "lumina-rotation-" + config.getName();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        long interval = policy.sweepInterval().toMillis();
        schedule = scheduler.scheduleWithFixedDelay(this::sweepSafely, 0, Math.max(1, interval), TimeUnit.MILLISECONDS);
        logger.debug("[{}] Rotation clock started, retention {}, sweep every {}",
            config.getName(), policy.retention(), policy.sweepInterval());
    }

    /**
     * Cancels future sweeps and waits for a sweep in progress. Idempotent.
     */
    synchronized void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            return;
        }
        schedule.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("[{}] Rotation sweep still running after {}s, abandoning it",
                    config.getName(), STOP_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(State.STOPPED);
        }
        logger.debug("[{}] Rotation clock stopped", config.getName());
    }

    State getState() {
        return state.get();
    }

    @Override
    public void close() {
        stop();
    }

    // period directories are siblings under the parent of the current one
    private Path sweepRoot(Instant now) {
        return config.directoryFor(config.periodKey(now)).getParent();
    }

    private void sweepSafely() {
        if (state.get() != State.RUNNING) {
            return;
        }
        try {
            sweep();
        } catch (Throwable t) {
            // an exception escaping here would silently cancel all later sweeps
            logger.error("[{}] Log rotation sweep failed: {}", config.getName(), t.getMessage(), t);
        }
    }

    /**
     * Runs one retention pass.
     *
     * @return the number of period directories deleted
     */
    int sweep() {
        Instant now = config.getClock().instant();
        Instant threshold = now.minus(config.getRotation().retention());
        Path root = sweepRoot(now);
        if (root == null) {
            return 0;
        }
        LogFileSystem fs = config.getFileSystem();
        if (!fs.isDirectory(root)) {
            return 0;
        }

        List<Path> children;
        try {
            children = fs.list(root);
        } catch (IOException e) {
            logger.warn("[{}] Cannot list log root {}: {}", config.getName(), root, e.getMessage());
            return 0;
        }

        int deleted = 0;
        for (Path child : children) {
            if (!fs.isDirectory(child) || child.getFileName() == null) {
                continue;
            }
            Instant periodStart;
            try {
                periodStart = config.parsePeriodKey(child.getFileName().toString());
            } catch (DateTimeParseException e) {
                continue;
            }
            if (!periodStart.isBefore(threshold)) {
                continue;
            }
            int closed = sinkCache.releaseUnder(child);
            try {
                fs.deleteRecursively(child);
                deleted++;
                logger.debug("[{}] Deleted expired log directory {} ({} open sink(s) closed)",
                    config.getName(), child, closed);
            } catch (IOException e) {
                logger.warn("[{}] Failed to delete expired log directory {}: {}",
                    config.getName(), child, e.getMessage());
            }
        }
        return deleted;
    }
}
