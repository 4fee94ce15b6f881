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

package io.lumina.sinks;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Arena of open {@link LogSink}s keyed by absolute file path, together with the single lock that
 * serializes every rotation and write going through it.
 *
 * <p>Key Responsibilities:
 * <ul>
 *   <li><strong>Handle sharing:</strong> at most one open sink exists per path, so strategies whose
 *       file-naming function resolves to the same file write through the same handle</li>
 *   <li><strong>Lifecycle:</strong> sinks are opened lazily on first {@link #acquire(Path)} and are
 *       flushed and closed before they leave the map</li>
 *   <li><strong>Mutual exclusion:</strong> {@link #lock()} guards the map and every sink in it.
 *       Engines that share a cache share the lock as well</li>
 * </ul>
 *
 * <p>All methods except {@link #lock()}, {@link #closeAll()} and {@link #releaseUnder(Path)}
 * require the caller to hold the lock. The latter two take it themselves.</p>
 *
 * @since 4.0.0
 */
public final class SinkCache {

    private static final Logger logger = LogManager.getLogger(SinkCache.class);

    private final LogFileSystem fileSystem;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Path, LogSink> sinks = new HashMap<>();

    public SinkCache(LogFileSystem fileSystem) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    }

    /**
     * @return the lock guarding this cache and all of its sinks
     */
    public ReentrantLock lock() {
        return lock;
    }

    public LogFileSystem getFileSystem() {
        return fileSystem;
    }

    /**
     * Returns the open sink for a file, opening it (and creating its parent directories) if no
     * open sink is cached for that path.
     *
     * @param file the log file
     * @return an open sink
     * @throws IOException if the directories or the file cannot be created
     */
    public LogSink acquire(Path file) throws IOException {
        checkLocked();
        Path key = file.toAbsolutePath().normalize();
        LogSink sink = sinks.get(key);
        if (sink != null && sink.isOpen()) {
            return sink;
        }
        Path parent = key.getParent();
        if (parent != null && !fileSystem.exists(parent)) {
            fileSystem.createDirectories(parent);
        }
        sink = new LogSink(key, fileSystem.openAppending(key));
        sinks.put(key, sink);
        logger.debug("Opened log sink {}", key);
        return sink;
    }

    /**
     * Flushes, closes and forgets the sink for a file, if one is cached.
     *
     * @param file the log file
     * @throws IOException if flushing or closing fails; the entry is removed regardless
     */
    public void release(Path file) throws IOException {
        checkLocked();
        LogSink sink = sinks.remove(file.toAbsolutePath().normalize());
        if (sink != null) {
            sink.close();
            logger.debug("Released log sink {}", sink.getPath());
        }
    }

    /**
     * Closes every cached sink located under a directory. Used before that directory is deleted.
     *
     * @param directory the directory about to go away
     * @return the number of sinks closed
     */
    public int releaseUnder(Path directory) {
        Path prefix = directory.toAbsolutePath().normalize();
        lock.lock();
        try {
            List<LogSink> evicted = new ArrayList<>();
            Iterator<Map.Entry<Path, LogSink>> it = sinks.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Path, LogSink> entry = it.next();
                if (entry.getKey().startsWith(prefix)) {
                    evicted.add(entry.getValue());
                    it.remove();
                }
            }
            closeQuietly(evicted);
            return evicted.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes and closes every cached sink and empties the cache. A failure on one sink is
     * reported and does not prevent the others from being closed.
     */
    public void closeAll() {
        lock.lock();
        try {
            List<LogSink> all = new ArrayList<>(sinks.values());
            sinks.clear();
            closeQuietly(all);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sinks.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<Path> openPaths() {
        lock.lock();
        try {
            return Set.copyOf(sinks.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void closeQuietly(List<LogSink> toClose) {
        for (LogSink sink : toClose) {
            try {
                sink.close();
            } catch (IOException e) {
                logger.error("Error closing log sink {}: {}", sink.getPath(), e.getMessage(), e);
            }
        }
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("SinkCache lock must be held by the calling thread");
        }
    }
}
