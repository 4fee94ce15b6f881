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

import io.lumina.sinks.LogFileSystem;
import io.lumina.sinks.NioLogFileSystem;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Real file system with switchable failures and an optional gate that holds every write until
 * the test opens it.
 */
public class FaultyLogFileSystem implements LogFileSystem {

    private final LogFileSystem delegate = NioLogFileSystem.getInstance();
    private final AtomicInteger opens = new AtomicInteger();
    private final CountDownLatch writeBlocked = new CountDownLatch(1);
    private volatile boolean failOpen;
    private volatile boolean failWrites;
    private volatile boolean failDelete;
    private volatile CountDownLatch writeGate;

    public void failOpen(boolean fail) {
        this.failOpen = fail;
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failDelete(boolean fail) {
        this.failDelete = fail;
    }

    /**
     * Makes every following write wait until the gate is counted down.
     */
    public void gateWrites(CountDownLatch gate) {
        this.writeGate = gate;
    }

    /**
     * @return true once some writer is parked at the gate
     */
    public boolean awaitBlockedWrite(long timeout, TimeUnit unit) throws InterruptedException {
        return writeBlocked.await(timeout, unit);
    }

    public int openCount() {
        return opens.get();
    }

    @Override
    public boolean exists(Path path) {
        return delegate.exists(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return delegate.isDirectory(path);
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        delegate.createDirectories(directory);
    }

    @Override
    public List<Path> list(Path directory) throws IOException {
        return delegate.list(directory);
    }

    @Override
    public void deleteRecursively(Path path) throws IOException {
        if (failDelete) {
            throw new IOException("injected delete failure: " + path);
        }
        delegate.deleteRecursively(path);
    }

    @Override
    public Writer openAppending(Path file) throws IOException {
        if (failOpen) {
            throw new IOException("injected open failure: " + file);
        }
        opens.incrementAndGet();
        return new GatedWriter(delegate.openAppending(file));
    }

    private final class GatedWriter extends FilterWriter {

        GatedWriter(Writer out) {
            super(out);
        }

        private void beforeWrite() throws IOException {
            if (failWrites) {
                throw new IOException("injected write failure");
            }
            CountDownLatch gate = writeGate;
            if (gate != null) {
                writeBlocked.countDown();
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted at write gate");
                }
            }
        }

        @Override
        public void write(int c) throws IOException {
            beforeWrite();
            super.write(c);
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            beforeWrite();
            super.write(cbuf, off, len);
        }

        @Override
        public void write(String str, int off, int len) throws IOException {
            beforeWrite();
            super.write(str, off, len);
        }
    }
}
