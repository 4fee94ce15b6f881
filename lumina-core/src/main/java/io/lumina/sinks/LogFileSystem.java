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

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * The file operations the engine needs, kept behind an interface so tests can substitute
 * in-memory or fault-injecting implementations.
 *
 * <p>Implementations must be safe for use from the consumer thread, the rotation thread and
 * caller threads at the same time. The engine never calls {@link #openAppending(Path)} for
 * the same path twice without closing the first writer.</p>
 *
 * @see NioLogFileSystem
 * @since 4.0.0
 */
public interface LogFileSystem {

    boolean exists(Path path);

    boolean isDirectory(Path path);

    void createDirectories(Path directory) throws IOException;

    /**
     * Lists the direct children of a directory.
     *
     * @param directory the directory to list
     * @return the children, in no particular order; empty if the directory does not exist
     * @throws IOException if the directory exists but cannot be read
     */
    List<Path> list(Path directory) throws IOException;

    /**
     * Deletes a file or a directory with everything below it.
     *
     * @param path the path to delete
     * @throws IOException if any entry could not be deleted
     */
    void deleteRecursively(Path path) throws IOException;

    /**
     * Opens a writer that appends UTF-8 text to a file, creating the file if needed.
     * The parent directory must already exist.
     *
     * @param file the file to append to
     * @return an unbuffered or buffered writer; the caller adds its own buffering
     * @throws IOException if the file cannot be opened
     */
    Writer openAppending(Path file) throws IOException;
}
