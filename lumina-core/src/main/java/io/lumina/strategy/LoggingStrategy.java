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

package io.lumina.strategy;

import io.lumina.ansi.Ansi;
import io.lumina.config.LuminaConfig;
import io.lumina.sinks.LogSink;
import io.lumina.sinks.SinkCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes entries of one severity. A strategy owns the severity's current output file: it
 * remembers the period key it last wrote to and the sink for that period's file, and rolls
 * over to a new file when a message's period key differs.
 *
 * <p>Every {@link #write} runs the rollover, console echo and file append while holding the
 * {@link SinkCache#lock()}, so writes across all severities of an engine (and of engines sharing
 * the cache) are serialized and each entry lands in its file as one contiguous block.</p>
 *
 * <p>I/O failures are reported through the diagnostic logger and never thrown to the caller.
 * The failed sink is closed and dropped; the next write reopens the file, and after a failed
 * rollover the strategy retries the rollover on its next write.</p>
 *
 * @see RenderStyle
 * @since 4.0.0
 */
public final class LoggingStrategy {

    private static final Logger logger = LogManager.getLogger(LoggingStrategy.class);

    private final String name;
    private final String color;
    private final RenderStyle style;
    private final LuminaConfig config;
    private final SinkCache sinkCache;
    private final String label;
    private final String fileStem;

    // guarded by sinkCache.lock()
    private String currentPeriodKey;
    private Path currentPath;
    private LogSink currentSink;

    public LoggingStrategy(String name, String color, RenderStyle style, LuminaConfig config, SinkCache sinkCache) {
        this.name = Objects.requireNonNull(name, "name");
        this.color = Objects.requireNonNull(color, "color");
        this.style = Objects.requireNonNull(style, "style");
        this.config = Objects.requireNonNull(config, "config");
        this.sinkCache = Objects.requireNonNull(sinkCache, "sinkCache");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Strategy name cannot be blank.");
        }
        this.label = Ansi.colorize(color, name);
        this.fileStem = name.toLowerCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public String getColor() {
        return color;
    }

    public RenderStyle getStyle() {
        return style;
    }

    /**
     * Formats one entry, echoes it to the console if requested, and appends it to this
     * severity's file for the timestamp's period.
     *
     * @param timestamp when the message was created; selects the period and the displayed time
     * @param echoToConsole whether to also print the entry to the console stream
     * @param lines the message content
     * @return true if the entry reached the file, false if an I/O failure was reported instead
     */
    public boolean write(Instant timestamp, boolean echoToConsole, List<String> lines) {
        String periodKey = config.periodKey(timestamp);
        String time = config.formatTime(timestamp);

        ReentrantLock lock = sinkCache.lock();
        lock.lock();
        try {
            LogSink sink = rotateIfNeeded(periodKey);
            String rendered = style.render(config.getFormatter(), time, label, config.getName(), lines);
            if (echoToConsole) {
                config.getConsole().println(Ansi.toDisplay(rendered));
            }
            // color markers are only translated for the console; the file keeps the text as given
            sink.appendLine(Ansi.toPlain(rendered));
            return true;
        } catch (IOException e) {
            logger.error("[{}] Log write error for {} entry in {}: {}",
                config.getName(), name, currentPath, e.getMessage(), e);
            discardSink();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases this strategy's current sink from the cache. The next write reopens it.
     */
    public void release() {
        ReentrantLock lock = sinkCache.lock();
        lock.lock();
        try {
            if (currentPath != null) {
                sinkCache.release(currentPath);
            }
        } catch (IOException e) {
            logger.error("[{}] Error releasing {} sink {}: {}", config.getName(), name, currentPath, e.getMessage(), e);
        } finally {
            currentSink = null;
            lock.unlock();
        }
    }

    // a failed writer may still hold the entry in its buffer; reopen instead of reusing it
    private void discardSink() {
        if (currentPath == null) {
            return;
        }
        try {
            sinkCache.release(currentPath);
        } catch (IOException e) {
            logger.debug("[{}] Discarded failed sink {}: {}", config.getName(), currentPath, e.getMessage());
        } finally {
            currentSink = null;
        }
    }

    private LogSink rotateIfNeeded(String periodKey) throws IOException {
        if (periodKey.equals(currentPeriodKey)) {
            if (currentSink == null || !currentSink.isOpen()) {
                // evicted by shutdown, a sweep, or another strategy's rollover on a shared file
                currentSink = sinkCache.acquire(currentPath);
            }
            return currentSink;
        }

        if (currentPath != null) {
            Path previous = currentPath;
            currentPeriodKey = null;
            currentPath = null;
            currentSink = null;
            try {
                sinkCache.release(previous);
            } catch (IOException e) {
                logger.error("[{}] Error closing {} before rollover: {}", config.getName(), previous, e.getMessage(), e);
            }
        }

        Path target = config.fileFor(periodKey, fileStem);
        currentSink = sinkCache.acquire(target);
        currentPath = target;
        currentPeriodKey = periodKey;
        logger.debug("[{}] {} now writing to {}", config.getName(), name, target);
        return currentSink;
    }

    @Override
    public String toString() {
        return "LoggingStrategy[" + name + ", " + style + "]";
    }
}
