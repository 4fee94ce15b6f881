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

import io.lumina.ansi.Ansi;
import io.lumina.config.LuminaConfig;
import io.lumina.sinks.SinkCache;
import io.lumina.strategy.LoggingStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the shutdown protocol of one engine exactly once.
 *
 * <ol>
 *   <li>mark the engine as shutting down, so new submissions are written synchronously</li>
 *   <li>close the dispatch queue for new entries</li>
 *   <li>wait up to the timeout for the consumer to drain and exit</li>
 *   <li>on timeout, drain the rest on the calling thread, print the loss warning, and give the
 *       consumer a short grace period to finish the message it holds</li>
 *   <li>stop the rotation clock, waiting for a sweep in progress</li>
 *   <li>flush and close every cached sink</li>
 *   <li>shut down the consumer executor if the engine created it</li>
 * </ol>
 *
 * @since 4.0.0
 */
final class ShutdownCoordinator {

    private static final Logger logger = LogManager.getLogger(ShutdownCoordinator.class);
    static final String TIMEOUT_WARNING = "WARNING: Logger shutdown timed out, some logs may be lost.";
    static final Duration IN_FLIGHT_GRACE = Duration.ofSeconds(2);

    private final LuminaConfig config;
    private final DispatchPipeline pipeline;
    private final RotationClock rotationClock;
    private final SinkCache sinkCache;
    private final ExecutorService ownedExecutor;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private volatile boolean closingSinks = false;
    private volatile boolean terminated = false;

    /**
     * @param ownedExecutor the consumer executor if the engine created it, {@code null} if the
     *     caller supplied one
     */
    ShutdownCoordinator(LuminaConfig config, DispatchPipeline pipeline, RotationClock rotationClock,
                        SinkCache sinkCache, ExecutorService ownedExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.rotationClock = Objects.requireNonNull(rotationClock, "rotationClock");
        this.sinkCache = Objects.requireNonNull(sinkCache, "sinkCache");
        this.ownedExecutor = ownedExecutor;
    }

    boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * True from just before the sink cache is closed. A write that takes the cache lock after
     * {@code closeAll} sees this flag and must release the sink it reopened.
     */
    boolean isClosingSinks() {
        return closingSinks;
    }

    /**
     * Releases the strategy's sink if the cache has already been closed, for a consumer that
     * finished its last write after the shutdown grace period.
     *
     * @return true if the sink was released
     */
    boolean releaseIfSinksClosed(LoggingStrategy strategy) {
        if (!closingSinks) {
            return false;
        }
        strategy.release();
        return true;
    }

    boolean isTerminated() {
        return terminated;
    }

    /**
     * Runs the protocol. Only the first call does anything; later and concurrent calls return
     * immediately.
     *
     * @param timeout how long to wait for the consumer before draining on this thread
     * @return true if this call ran the protocol and the consumer drained within the timeout
     */
    boolean shutdown(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (!shuttingDown.compareAndSet(false, true)) {
            return false;
        }
        boolean drained = false;
        try {
            pipeline.close();
            drained = pipeline.awaitTermination(timeout);
            if (drained) {
                pipeline.drainSynchronously();
            } else {
                int remaining = pipeline.drainSynchronously();
                config.getConsole().println(Ansi.BOLD_YELLOW + TIMEOUT_WARNING + Ansi.RESET);
                logger.warn("[{}] Consumer did not drain within {}, wrote {} message(s) synchronously",
                    config.getName(), timeout, remaining);
                // the consumer may still hold the message it took last
                if (!pipeline.awaitTermination(IN_FLIGHT_GRACE)) {
                    logger.warn("[{}] Consumer still busy after {}, closing sinks under it", config.getName(), IN_FLIGHT_GRACE);
                }
            }
            rotationClock.stop();
            closingSinks = true;
            sinkCache.closeAll();
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
            }
        } finally {
            closingSinks = true;
            terminated = true;
        }
        logger.debug("[{}] Engine shut down", config.getName());
        return drained;
    }
}
