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

package io.lumina.config;

import io.lumina.sinks.LogFileSystem;
import io.lumina.sinks.NioLogFileSystem;
import io.lumina.sinks.SinkCache;
import io.lumina.strategy.EntryFormatter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Immutable configuration of a {@link io.lumina.Lumina} engine. Instances are created through
 * {@link #builder()}, which validates the settings in {@link Builder#build()}.
 *
 * <h2>Directory Layout</h2>
 * <p>Each timestamp maps to a <em>period key</em>, the timestamp formatted with the date format
 * in the configured zone. The directory function turns a period key into a directory, and the
 * file-naming function turns that directory and a lower-case severity name into a file. With
 * the defaults this gives {@code ./logs/19.10.2026/info.log}.</p>
 *
 * <p>The rotation clock lists the parent of the current period's directory and parses each
 * child's name back with the date format, so a custom directory function should keep one
 * directory per period below a common root.</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LuminaConfig config = LuminaConfig.builder()
 *     .withName("ServiceA")
 *     .withDirectory(periodKey -> Path.of("/var/log/service-a", periodKey))
 *     .withRotation(new RotationPolicy(true, Duration.ofDays(7), Duration.ofHours(6)))
 *     .build();
 * }</pre>
 *
 * @since 4.0.0
 */
public final class LuminaConfig {

    public static final String DEFAULT_NAME = "Lumina";
    public static final Path DEFAULT_ROOT = Path.of("logs");
    public static final String DEFAULT_TIME_PATTERN = "HH:mm:ss.SSS";
    public static final String DEFAULT_DATE_PATTERN = "dd.MM.yyyy";
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final String name;
    private final Function<String, Path> directory;
    private final BiFunction<Path, String, Path> fileNaming;
    private final EntryFormatter formatter;
    private final DateTimeFormatter timeFormat;
    private final DateTimeFormatter dateFormat;
    private final ZoneId zone;
    private final RotationPolicy rotation;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final LogFileSystem fileSystem;
    private final Clock clock;
    private final PrintStream console;
    private final ExecutorService executor;
    private final SinkCache sinkCache;

    private LuminaConfig(Builder builder) {
        this.name = builder.name;
        this.directory = builder.directory;
        this.fileNaming = builder.fileNaming;
        this.formatter = builder.formatter;
        this.zone = builder.zone;
        this.timeFormat = builder.timeFormat.withZone(builder.zone);
        this.dateFormat = builder.dateFormat.withZone(builder.zone);
        this.rotation = builder.rotation;
        this.queueCapacity = builder.queueCapacity;
        this.overflowPolicy = builder.overflowPolicy;
        this.fileSystem = builder.fileSystem;
        this.clock = builder.clock;
        this.console = builder.console;
        this.executor = builder.executor;
        this.sinkCache = builder.sinkCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static LuminaConfig defaults() {
        return builder().build();
    }

    public String getName() {
        return name;
    }

    public EntryFormatter getFormatter() {
        return formatter;
    }

    public ZoneId getZone() {
        return zone;
    }

    public RotationPolicy getRotation() {
        return rotation;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public LogFileSystem getFileSystem() {
        return fileSystem;
    }

    public Clock getClock() {
        return clock;
    }

    public PrintStream getConsole() {
        return console;
    }

    /**
     * @return the caller-supplied executor for the consumer task, if any. The engine never
     *     shuts a supplied executor down.
     */
    public Optional<ExecutorService> getExecutor() {
        return Optional.ofNullable(executor);
    }

    /**
     * @return the caller-supplied sink cache, if engines are meant to share one
     */
    public Optional<SinkCache> getSinkCache() {
        return Optional.ofNullable(sinkCache);
    }

    /**
     * @param instant a point in time
     * @return the period key (formatted date) the instant falls into
     */
    public String periodKey(Instant instant) {
        return dateFormat.format(instant);
    }

    public String formatTime(Instant instant) {
        return timeFormat.format(instant);
    }

    /**
     * Parses a directory name back into the instant its period starts at.
     *
     * @param periodKey a directory name
     * @return the start of that period in the configured zone
     * @throws java.time.format.DateTimeParseException if the name is not a period key
     */
    public Instant parsePeriodKey(String periodKey) {
        LocalDate date = LocalDate.from(dateFormat.parse(periodKey));
        return date.atStartOfDay(zone).toInstant();
    }

    public Path directoryFor(String periodKey) {
        return directory.apply(periodKey);
    }

    public Path fileFor(String periodKey, String severityName) {
        return fileNaming.apply(directoryFor(periodKey), severityName);
    }

    @Override
    public String toString() {
        return "LuminaConfig{name='" + name + "', zone=" + zone + ", rotation=" + rotation
            + ", queueCapacity=" + (queueCapacity == UNBOUNDED ? "unbounded" : queueCapacity)
            + ", overflowPolicy=" + overflowPolicy + "}";
    }

    /**
     * Fluent builder for {@link LuminaConfig}. Every setting has a default; setters only reject
     * nulls, range checks happen in {@link #build()}.
     */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private Function<String, Path> directory = periodKey -> DEFAULT_ROOT.resolve(periodKey);
        private BiFunction<Path, String, Path> fileNaming = (dir, severity) -> dir.resolve(severity + ".log");
        private EntryFormatter formatter = EntryFormatter.standard();
        private DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern(DEFAULT_TIME_PATTERN);
        private DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern(DEFAULT_DATE_PATTERN);
        private ZoneId zone = ZoneOffset.UTC;
        private RotationPolicy rotation = RotationPolicy.DEFAULT;
        private int queueCapacity = UNBOUNDED;
        private OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;
        private LogFileSystem fileSystem = NioLogFileSystem.getInstance();
        private Clock clock = Clock.systemUTC();
        private PrintStream console = System.out;
        private ExecutorService executor;
        private SinkCache sinkCache;

        Builder() {
        }

        /**
         * Sets the logger name shown in every entry. Default is {@value LuminaConfig#DEFAULT_NAME}.
         *
         * @param name the logger name
         * @return this builder
         */
        public Builder withName(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Sets the function from period key to log directory. Default is {@code ./logs/<periodKey>}.
         *
         * @param directory the directory function
         * @return this builder
         */
        public Builder withDirectory(Function<String, Path> directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        /**
         * Convenience for {@code withDirectory(key -> root.resolve(key))}.
         *
         * @param root the directory holding one sub-directory per period
         * @return this builder
         */
        public Builder withRoot(Path root) {
            Objects.requireNonNull(root, "root");
            return withDirectory(periodKey -> root.resolve(periodKey));
        }

        public Builder withFileNaming(BiFunction<Path, String, Path> fileNaming) {
            this.fileNaming = Objects.requireNonNull(fileNaming, "fileNaming");
            return this;
        }

        public Builder withFormatter(EntryFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        public Builder withTimeFormat(String pattern) {
            return withTimeFormat(DateTimeFormatter.ofPattern(Objects.requireNonNull(pattern, "pattern")));
        }

        public Builder withTimeFormat(DateTimeFormatter timeFormat) {
            this.timeFormat = Objects.requireNonNull(timeFormat, "timeFormat");
            return this;
        }

        public Builder withDateFormat(String pattern) {
            return withDateFormat(DateTimeFormatter.ofPattern(Objects.requireNonNull(pattern, "pattern")));
        }

        /**
         * Sets the format of period keys. It must round-trip: formatting an instant and parsing the
         * result must yield a date, otherwise the rotation clock skips every directory.
         *
         * @param dateFormat the period key format
         * @return this builder
         */
        public Builder withDateFormat(DateTimeFormatter dateFormat) {
            this.dateFormat = Objects.requireNonNull(dateFormat, "dateFormat");
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public Builder withRotation(RotationPolicy rotation) {
            this.rotation = Objects.requireNonNull(rotation, "rotation");
            return this;
        }

        public Builder withRotation(boolean enabled, Duration retention, Duration sweepInterval) {
            return withRotation(new RotationPolicy(enabled, retention, sweepInterval));
        }

        /**
         * Sets the dispatch queue capacity. Default is unbounded.
         *
         * @param queueCapacity maximum number of queued messages
         * @return this builder
         */
        public Builder withQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
            return this;
        }

        public Builder withFileSystem(LogFileSystem fileSystem) {
            this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the stream for console echo and the shutdown warning. Default is {@code System.out}.
         *
         * @param console the console stream
         * @return this builder
         */
        public Builder withConsole(PrintStream console) {
            this.console = Objects.requireNonNull(console, "console");
            return this;
        }

        /**
         * Runs the consumer task on a caller-owned executor instead of a dedicated thread. The
         * executor must have a thread to spare for the engine's lifetime.
         *
         * @param executor the executor to run the consumer on
         * @return this builder
         */
        public Builder withExecutor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Shares a sink cache, and with it the write lock, with other engines.
         *
         * @param sinkCache the cache to share
         * @return this builder
         */
        public Builder withSinkCache(SinkCache sinkCache) {
            this.sinkCache = Objects.requireNonNull(sinkCache, "sinkCache");
            return this;
        }

        /**
         * Validates the settings and creates the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if the name is blank, the queue capacity is not
         *     positive, or the rotation retention or sweep interval is not positive
         */
        public LuminaConfig build() {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Logger name cannot be blank.");
            }
            if (queueCapacity <= 0) {
                throw new IllegalArgumentException("Log queue capacity must be greater than 0.");
            }
            if (rotation.retention().isZero() || rotation.retention().isNegative()) {
                throw new IllegalArgumentException("Log rotation duration must be greater than 0.");
            }
            if (rotation.enabled()
                && (rotation.sweepInterval().isZero() || rotation.sweepInterval().isNegative())) {
                throw new IllegalArgumentException("Log rotation interval must be greater than 0.");
            }
            return new LuminaConfig(this);
        }
    }
}
