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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * A buffered append-mode handle on one log file. Instances are created and closed only by
 * {@link SinkCache}; all methods are called with the cache lock held.
 *
 * <p>A closed sink stays closed. Holders check {@link #isOpen()} and ask the cache for a
 * fresh handle when theirs was evicted.</p>
 *
 * @since 4.0.0
 */
public final class LogSink implements Closeable {

    private final Path path;
    private final BufferedWriter writer;
    private boolean open = true;

    LogSink(Path path, Writer writer) {
        this.path = path;
        this.writer = new BufferedWriter(writer);
    }

    public Path getPath() {
        return path;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Appends one entry followed by a line separator and flushes it to the file, so the
     * entry's bytes are contiguous on disk.
     *
     * @param entry the fully rendered entry
     * @throws IOException if the write or flush fails, or the sink is closed
     */
    public void appendLine(String entry) throws IOException {
        if (!open) {
            throw new IOException("Sink for " + path + " is closed");
        }
        writer.write(entry);
        writer.write('\n');
        writer.flush();
    }

    public void flush() throws IOException {
        if (open) {
            writer.flush();
        }
    }

    /**
     * Flushes and closes the underlying writer. Idempotent.
     */
    @Override
    public void close() throws IOException {
        if (!open) {
            return;
        }
        open = false;
        try {
            writer.flush();
        } finally {
            writer.close();
        }
    }

    @Override
    public String toString() {
        return "LogSink[" + path + (open ? "" : ", closed") + "]";
    }
}
