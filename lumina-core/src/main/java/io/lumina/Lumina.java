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
import io.lumina.sinks.LogFileSystem;
import io.lumina.sinks.SinkCache;
import io.lumina.strategy.LoggingStrategy;
import io.lumina.strategy.RenderStyle;
import io.lumina.strategy.StackTraceLines;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Asynchronous per-severity file logging engine.
 *
 * <p>Callers submit {@link Message}s from any thread. A single background consumer takes them
 * off the dispatch queue in submission order and hands each one to its {@link LoggingStrategy},
 * which formats the entry, optionally echoes it to the console, and appends it to
 * {@code <root>/<periodKey>/<severity>.log}. A rotation clock deletes period directories older
 * than the configured retention.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li><strong>Construction:</strong> validates nothing further (the {@link LuminaConfig} is
 *       already valid), creates today's directory, registers the default severities and starts
 *       the consumer and the rotation clock</li>
 *   <li><strong>Running:</strong> {@link #submit(Message)} queues; {@link #logSync(Message)}
 *       writes on the calling thread</li>
 *   <li><strong>Shutdown:</strong> {@link #shutdown(Duration)} drains the queue within a soft
 *       deadline and closes all files. Messages submitted afterwards are still written, each
 *       one synchronously, and their file is closed again right away</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Lumina lumina = new Lumina(LuminaConfig.builder().withName("ServiceA").build())) {
 *     lumina.info("Started", "port=" + port);
 *     lumina.warnEcho(false, "Slow response");
 *     lumina.exception(e);
 * }
 * }</pre>
 *
 * <h2>Ordering</h2>
 * <p>Queued messages are written in FIFO order. Messages written synchronously (through
 * {@link #logSync}, or while shutdown is in progress) may interleave with queued ones.</p>
 *
 * @since 4.0.0
 */
public final class Lumina implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Lumina.class);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    public static final String DEBUG = "DEBUG";
    public static final String INFO = "INFO";
    public static final String WARN = "WARN";
    public static final String ERROR = "ERROR";
    public static final String FATAL = "FATAL";
    public static final String STACKTRACE = "STACKTRACE";

    private final LuminaConfig config;
    private final SinkCache sinkCache;
    private final Map<String, LoggingStrategy> strategies = new ConcurrentHashMap<>();
    private final LoggingStrategy debugStrategy;
    private final LoggingStrategy infoStrategy;
    private final LoggingStrategy warnStrategy;
    private final LoggingStrategy errorStrategy;
    private final LoggingStrategy fatalStrategy;
    private final LoggingStrategy stackTraceStrategy;
    private final DispatchPipeline pipeline;
    private final RotationClock rotationClock;
    private final ShutdownCoordinator coordinator;

    public Lumina() {
        this(LuminaConfig.defaults());
    }

    public Lumina(LuminaConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.sinkCache = config.getSinkCache().orElseGet(() -> new SinkCache(config.getFileSystem()));

        this.debugStrategy = registerStrategy(DEBUG, Ansi.GREEN);
        this.infoStrategy = registerStrategy(INFO, Ansi.CYAN);
        this.warnStrategy = registerStrategy(WARN, Ansi.YELLOW);
        this.errorStrategy = registerStrategy(ERROR, Ansi.RED);
        this.fatalStrategy = registerStrategy(FATAL, Ansi.BOLD_RED);
        this.stackTraceStrategy = registerStrategy(STACKTRACE, Ansi.BOLD_RED, RenderStyle.STACK_TRACE);

        createCurrentDirectory();

        ExecutorService ownedExecutor = null;
        Executor consumerExecutor;
        Optional<ExecutorService> supplied = config.getExecutor();
        if (supplied.isPresent()) {
            consumerExecutor = supplied.get();
        } else {
            String threadName = "lumina-consumer-" + config.getName();
            ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            });
            consumerExecutor = ownedExecutor;
        }

        this.pipeline = new DispatchPipeline(config.getName(), config.getQueueCapacity(),
            config.getOverflowPolicy(), this::deliver);
        this.rotationClock = new RotationClock(config, sinkCache);
        this.coordinator = new ShutdownCoordinator(config, pipeline, rotationClock, sinkCache, ownedExecutor);

        pipeline.start(consumerExecutor);
        rotationClock.start();
        logger.debug("[{}] Engine started with {}", config.getName(), config);
    }

    public LuminaConfig getConfig() {
        return config;
    }

    public String getName() {
        return config.getName();
    }

    public SinkCache getSinkCache() {
        return sinkCache;
    }

    //
    // Strategies
    //

    /**
     * Registers a severity that renders entries in the standard style.
     *
     * @param name the severity name; unique per engine, compared case-insensitively
     * @param color the control sequence for the severity label, see {@link Ansi}
     * @return the new strategy, to pass to {@link #submit(LoggingStrategy, boolean, Object...)}
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public LoggingStrategy registerStrategy(String name, String color) {
        return registerStrategy(name, color, RenderStyle.STANDARD);
    }

    public LoggingStrategy registerStrategy(String name, String color, RenderStyle style) {
        LoggingStrategy strategy = new LoggingStrategy(name, color, style, config, sinkCache);
        LoggingStrategy existing = strategies.putIfAbsent(keyOf(name), strategy);
        if (existing != null) {
            throw new IllegalArgumentException("A strategy named '" + existing.getName() + "' is already registered.");
        }
        return strategy;
    }

    public Optional<LoggingStrategy> strategy(String name) {
        return Optional.ofNullable(strategies.get(keyOf(name)));
    }

    public Collection<LoggingStrategy> strategies() {
        return List.copyOf(strategies.values());
    }

    public LoggingStrategy debugStrategy() {
        return debugStrategy;
    }

    public LoggingStrategy infoStrategy() {
        return infoStrategy;
    }

    public LoggingStrategy warnStrategy() {
        return warnStrategy;
    }

    public LoggingStrategy errorStrategy() {
        return errorStrategy;
    }

    public LoggingStrategy fatalStrategy() {
        return fatalStrategy;
    }

    public LoggingStrategy stackTraceStrategy() {
        return stackTraceStrategy;
    }

    //
    // Submission
    //

    /**
     * Queues a message for the consumer. Does not block unless the queue is bounded, full, and
     * configured to {@link io.lumina.config.OverflowPolicy#BLOCK}. Once shutdown has begun the
     * message is written on the calling thread instead.
     *
     * @param message the message
     * @throws IllegalArgumentException if the message's strategy is not registered with this engine
     */
    public void submit(Message message) {
        checkOwned(message.strategy());
        if (coordinator.isShuttingDown()) {
            writeSynchronously(message);
            return;
        }
        if (pipeline.enqueue(message) == DispatchPipeline.Enqueued.REJECTED) {
            writeSynchronously(message);
        }
    }

    public void submit(LoggingStrategy strategy, boolean echoToConsole, Object... content) {
        submit(Message.of(strategy, echoToConsole, config.getClock().instant(), content));
    }

    /**
     * Builds a message with a {@link MessageBuilder} and queues it.
     *
     * @param strategy the severity
     * @param body fills in the builder
     */
    public void log(LoggingStrategy strategy, Consumer<MessageBuilder> body) {
        MessageBuilder builder = new MessageBuilder(strategy);
        body.accept(builder);
        submit(builder.build(config.getClock().instant()));
    }

    /**
     * Writes a message on the calling thread right away, bypassing the queue. Meant for shutdown
     * hooks and fatal error handlers. No ordering is guaranteed relative to queued messages.
     *
     * @param message the message
     * @return true if the entry reached its file
     */
    public boolean logSync(Message message) {
        checkOwned(message.strategy());
        return writeSynchronously(message);
    }

    public boolean logSync(LoggingStrategy strategy, boolean echoToConsole, Object... content) {
        return logSync(Message.of(strategy, echoToConsole, config.getClock().instant(), content));
    }

    public boolean logSync(LoggingStrategy strategy, Consumer<MessageBuilder> body) {
        MessageBuilder builder = new MessageBuilder(strategy);
        body.accept(builder);
        return logSync(builder.build(config.getClock().instant()));
    }

    public void debug(Object... content) {
        submit(debugStrategy, true, content);
    }

    public void debugEcho(boolean echoToConsole, Object... content) {
        submit(debugStrategy, echoToConsole, content);
    }

    public void info(Object... content) {
        submit(infoStrategy, true, content);
    }

    public void infoEcho(boolean echoToConsole, Object... content) {
        submit(infoStrategy, echoToConsole, content);
    }

    public void warn(Object... content) {
        submit(warnStrategy, true, content);
    }

    public void warnEcho(boolean echoToConsole, Object... content) {
        submit(warnStrategy, echoToConsole, content);
    }

    public void error(Object... content) {
        submit(errorStrategy, true, content);
    }

    public void errorEcho(boolean echoToConsole, Object... content) {
        submit(errorStrategy, echoToConsole, content);
    }

    public void fatal(Object... content) {
        submit(fatalStrategy, true, content);
    }

    public void fatalEcho(boolean echoToConsole, Object... content) {
        submit(fatalStrategy, echoToConsole, content);
    }

    /**
     * Queues a stack trace summary of an exception and its causes.
     *
     * @param thrown the exception
     */
    public void exception(Throwable thrown) {
        exception(thrown, true);
    }

    public void exception(Throwable thrown, boolean echoToConsole) {
        submit(new Message(stackTraceStrategy, StackTraceLines.of(thrown), echoToConsole, config.getClock().instant()));
    }

    //
    // Shutdown
    //

    /**
     * Drains the queue and closes every file. Waits up to {@code timeout} for the consumer; if it
     * is still busy after that, the remaining messages are written on the calling thread and a
     * warning is printed to the console. Never throws. Only the first call has any effect.
     *
     * @param timeout soft deadline for the consumer to drain
     * @return true if this call shut the engine down and the consumer drained in time
     */
    public boolean shutdown(Duration timeout) {
        return coordinator.shutdown(timeout);
    }

    public boolean isShutdown() {
        return coordinator.isTerminated();
    }

    /**
     * Shuts down and then terminates the JVM, even if shutdown fails.
     *
     * @param status the exit status
     * @param timeout soft deadline for the consumer to drain
     */
    public void exitProcess(int status, Duration timeout) {
        try {
            shutdown(timeout);
        } finally {
            System.exit(status);
        }
    }

    @Override
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * @return the number of messages waiting in the dispatch queue
     */
    public int pendingMessages() {
        return pipeline.pending();
    }

    /**
     * @return the number of messages discarded under {@link io.lumina.config.OverflowPolicy#DROP}
     */
    public long droppedMessages() {
        return pipeline.droppedCount();
    }

    private void deliver(Message message) {
        message.strategy().write(message.createdAt(), message.echoToConsole(), message.lines());
        coordinator.releaseIfSinksClosed(message.strategy());
    }

    private boolean writeSynchronously(Message message) {
        boolean written = message.strategy().write(message.createdAt(), message.echoToConsole(), message.lines());
        if (coordinator.isShuttingDown()) {
            // keep no handle open past the engine's shutdown
            message.strategy().release();
        }
        return written;
    }

    private void checkOwned(LoggingStrategy strategy) {
        if (strategies.get(keyOf(strategy.getName())) != strategy) {
            throw new IllegalArgumentException("Strategy " + strategy.getName() + " is not registered with logger " + config.getName());
        }
    }

    private void createCurrentDirectory() {
        Path directory = config.directoryFor(config.periodKey(config.getClock().instant()));
        LogFileSystem fs = config.getFileSystem();
        try {
            if (!fs.exists(directory)) {
                fs.createDirectories(directory);
            }
        } catch (IOException e) {
            logger.warn("[{}] Cannot create log directory {}, will retry on first write: {}",
                config.getName(), directory, e.getMessage());
        }
    }

    private static String keyOf(String name) {
        return Objects.requireNonNull(name, "name").toUpperCase(Locale.ROOT);
    }
}
