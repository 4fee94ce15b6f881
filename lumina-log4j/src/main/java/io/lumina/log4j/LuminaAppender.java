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

package io.lumina.log4j;

import io.lumina.Lumina;
import io.lumina.Message;
import io.lumina.config.LuminaConfig;
import io.lumina.config.LuminaConfigLoader;
import io.lumina.strategy.LoggingStrategy;
import io.lumina.strategy.StackTraceLines;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginElement;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.spi.StandardLevel;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Log4j 2 appender that forwards events into a {@link Lumina} engine, so applications logging
 * through the Log4j 2 API get per-severity files with rotation.
 *
 * <h2>Level Mapping</h2>
 * <ul>
 *   <li>TRACE, DEBUG → DEBUG</li>
 *   <li>INFO → INFO</li>
 *   <li>WARN → WARN</li>
 *   <li>ERROR → ERROR</li>
 *   <li>FATAL → FATAL</li>
 * </ul>
 * <p>A thrown exception attached to an event is appended to the entry as stack trace lines.
 * Events from the engine's own loggers ({@code io.lumina.*}) are ignored so its diagnostics
 * cannot feed back into it.</p>
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * <Appenders>
 *   <Lumina name="Files" directory="logs" echoToConsole="false" shutdownTimeout="10s">
 *     <PatternLayout pattern="%c{1}: %msg"/>
 *   </Lumina>
 * </Appenders>
 * }</pre>
 * <p>{@code configFile} names a YAML file read by {@link LuminaConfigLoader}; {@code directory}
 * and {@code loggerName} override the corresponding values from it.</p>
 * <p>The appender adds a thrown exception itself, so a custom layout should not render it again:
 * end the pattern with {@code %throwable{none}} or set {@code alwaysWriteExceptions="false"}.
 * The default layout is {@code %msg} without exceptions.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>An appender created from configuration owns its engine and shuts it down in
 * {@link #stop(long, TimeUnit)}. An appender wrapping a caller-supplied engine leaves it
 * running.</p>
 *
 * @since 4.0.0
 */
@Plugin(name = "Lumina", category = "Core", elementType = "appender", printObject = true)
public class LuminaAppender extends AbstractAppender {

    static final String OWN_LOGGER_PREFIX = "io.lumina.";

    private final Lumina lumina;
    private final boolean echoToConsole;
    private final Duration shutdownTimeout;
    private final boolean ownsEngine;

    protected LuminaAppender(String name, Filter filter, Layout<? extends Serializable> layout, Lumina lumina,
                             boolean echoToConsole, Duration shutdownTimeout, boolean ownsEngine) {
        super(name,
                filter,
                Objects.requireNonNullElse(layout, defaultLayout()),
                true,
                null);
        this.lumina = Objects.requireNonNull(lumina, "lumina");
        this.echoToConsole = echoToConsole;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.ownsEngine = ownsEngine;
    }

    // the thrown exception is added as stack trace lines by append, not by the layout
    private static PatternLayout defaultLayout() {
        return PatternLayout.newBuilder()
                .withPattern("%msg")
                .withAlwaysWriteExceptions(false)
                .build();
    }

    /**
     * Log4j 2 plugin factory. Builds and owns a new engine.
     *
     * @param name the appender name
     * @param loggerName the logger name shown in entries; defaults to {@value LuminaConfig#DEFAULT_NAME}
     * @param directory the log root; defaults to {@code logs}
     * @param configFile optional YAML engine configuration
     * @param echoToConsole whether entries are also printed to standard output
     * @param shutdownTimeout how long {@code stop} waits for the queue to drain, e.g. {@code 5s}
     * @param layout renders the event message; defaults to {@code %msg} without the thrown exception
     * @param filter optional filter
     * @return a started appender
     */
    @PluginFactory
    public static LuminaAppender createAppender(@PluginAttribute("name") String name,
                                                @PluginAttribute("loggerName") String loggerName,
                                                @PluginAttribute("directory") String directory,
                                                @PluginAttribute("configFile") String configFile,
                                                @PluginAttribute(value = "echoToConsole", defaultBoolean = false) boolean echoToConsole,
                                                @PluginAttribute("shutdownTimeout") String shutdownTimeout,
                                                @PluginElement("Layout") Layout<? extends Serializable> layout,
                                                @PluginElement("Filter") Filter filter) {
        LuminaConfig.Builder builder = configFile != null
                ? LuminaConfigLoader.load(Path.of(configFile))
                : LuminaConfig.builder();
        if (loggerName != null) {
            builder.withName(loggerName);
        }
        if (directory != null) {
            builder.withRoot(Path.of(directory));
        }
        Duration timeout = shutdownTimeout != null
                ? LuminaConfigLoader.parseDuration(shutdownTimeout)
                : Lumina.DEFAULT_SHUTDOWN_TIMEOUT;
        LuminaAppender appender = new LuminaAppender(Objects.requireNonNullElse(name, "Lumina"), filter, layout,
                new Lumina(builder.build()), echoToConsole, timeout, true);
        appender.start();
        return appender;
    }

    /**
     * Wraps an existing engine. The appender does not shut it down.
     *
     * @param name the appender name
     * @param lumina the engine to forward to
     * @param echoToConsole whether entries are also printed to the engine's console
     * @return a started appender
     */
    public static LuminaAppender forEngine(String name, Lumina lumina, boolean echoToConsole) {
        LuminaAppender appender = new LuminaAppender(name, null, null, lumina, echoToConsole,
                Lumina.DEFAULT_SHUTDOWN_TIMEOUT, false);
        appender.start();
        return appender;
    }

    @Override
    public void append(LogEvent event) {
        String source = event.getLoggerName();
        if (source != null && source.startsWith(OWN_LOGGER_PREFIX)) {
            return;
        }
        List<String> lines = new ArrayList<>();
        lines.add(String.valueOf(getLayout().toSerializable(event)));
        if (event.getThrown() != null) {
            lines.addAll(StackTraceLines.of(event.getThrown()));
        }
        Instant createdAt = Instant.ofEpochSecond(event.getInstant().getEpochSecond(), event.getInstant().getNanoOfSecond());
        lumina.submit(new Message(strategyFor(event.getLevel().getStandardLevel()), lines, echoToConsole, createdAt));
    }

    /**
     * Maps a Log4j 2 level onto one of the engine's default severities.
     *
     * @param level the standard level of an event
     * @return the strategy for that level
     */
    LoggingStrategy strategyFor(StandardLevel level) {
        switch (level) {
            case FATAL:
                return lumina.fatalStrategy();
            case ERROR:
                return lumina.errorStrategy();
            case WARN:
                return lumina.warnStrategy();
            case INFO:
                return lumina.infoStrategy();
            default:
                return lumina.debugStrategy();
        }
    }

    public Lumina getLumina() {
        return lumina;
    }

    @Override
    public boolean stop(long timeout, TimeUnit timeUnit) {
        setStopping();
        boolean stopped = super.stop(timeout, timeUnit, false);
        if (ownsEngine) {
            lumina.shutdown(shutdownTimeout);
        }
        setStopped();
        return stopped;
    }
}
