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
import io.lumina.config.LuminaConfig;
import io.lumina.config.RotationPolicy;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.message.SimpleMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class LuminaAppenderTest {

    private static final Instant EVENT_TIME = Instant.parse("2026-10-19T08:00:00Z");

    @TempDir
    Path root;

    private Lumina lumina;

    @BeforeEach
    public void setUp() {
        lumina = new Lumina(LuminaConfig.builder()
            .withName("App")
            .withRoot(root)
            .withRotation(RotationPolicy.disabled())
            .withConsole(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8))
            .build());
    }

    private static LogEvent event(String loggerName, Level level, String message, Throwable thrown) {
        return Log4jLogEvent.newBuilder()
            .setLoggerName(loggerName)
            .setLevel(level)
            .setMessage(new SimpleMessage(message))
            .setThrown(thrown)
            .setTimeMillis(EVENT_TIME.toEpochMilli())
            .build();
    }

    private LuminaAppender owningAppender(PatternLayout layout) {
        LuminaAppender appender = new LuminaAppender("test", null, layout, lumina, false, Duration.ofSeconds(5), true);
        appender.start();
        return appender;
    }

    private List<String> lines(String file) throws IOException {
        Path path = root.resolve("19.10.2026").resolve(file);
        return Files.exists(path) ? Files.readAllLines(path) : List.of();
    }

    @Test
    public void levelsAreMappedToSeverityFiles() throws IOException {
        LuminaAppender appender = owningAppender(null);

        appender.append(event("com.example.Service", Level.TRACE, "t", null));
        appender.append(event("com.example.Service", Level.DEBUG, "d", null));
        appender.append(event("com.example.Service", Level.INFO, "i", null));
        appender.append(event("com.example.Service", Level.WARN, "w", null));
        appender.append(event("com.example.Service", Level.ERROR, "e", null));
        appender.append(event("com.example.Service", Level.FATAL, "f", null));
        appender.stop();

        assertThat(lines("debug.log")).containsExactly(
            "[08:00:00.000] - DEBUG - App - t",
            "[08:00:00.000] - DEBUG - App - d");
        assertThat(lines("info.log")).containsExactly("[08:00:00.000] - INFO - App - i");
        assertThat(lines("warn.log")).containsExactly("[08:00:00.000] - WARN - App - w");
        assertThat(lines("error.log")).containsExactly("[08:00:00.000] - ERROR - App - e");
        assertThat(lines("fatal.log")).containsExactly("[08:00:00.000] - FATAL - App - f");
    }

    @Test
    public void thrownExceptionIsAppendedToTheEntry() throws IOException {
        LuminaAppender appender = owningAppender(null);

        appender.append(event("com.example.Service", Level.ERROR, "request failed",
            new IllegalStateException("pool exhausted")));
        appender.stop();

        assertThat(lines("error.log"))
            .startsWith("[08:00:00.000] - ERROR - App - request failed",
                "[08:00:00.000] - ERROR - App - Exception: java.lang.IllegalStateException",
                "[08:00:00.000] - ERROR - App - Message: pool exhausted");
        assertThat(lines("error.log"))
            .filteredOn(line -> line.contains("pool exhausted"))
            .hasSize(1);
        assertThat(lines("error.log")).noneMatch(line -> line.contains("\tat "));
    }

    @Test
    public void layoutWithoutThrowableLeavesTheExceptionToTheAppender() throws IOException {
        PatternLayout layout = PatternLayout.newBuilder().withPattern("%c{1}: %msg%throwable{none}").build();
        LuminaAppender appender = owningAppender(layout);

        appender.append(event("com.example.Service", Level.WARN, "retrying", new IllegalStateException("timeout")));
        appender.stop();

        assertThat(lines("warn.log"))
            .startsWith("[08:00:00.000] - WARN - App - Service: retrying",
                "[08:00:00.000] - WARN - App - Exception: java.lang.IllegalStateException",
                "[08:00:00.000] - WARN - App - Message: timeout");
        assertThat(lines("warn.log")).noneMatch(line -> line.contains("\tat "));
    }

    @Test
    public void layoutRendersTheMessageText() throws IOException {
        PatternLayout layout = PatternLayout.newBuilder().withPattern("%c{1}: %msg").build();
        LuminaAppender appender = owningAppender(layout);

        appender.append(event("com.example.Service", Level.INFO, "ready", null));
        appender.stop();

        assertThat(lines("info.log")).containsExactly("[08:00:00.000] - INFO - App - Service: ready");
    }

    @Test
    public void engineDiagnosticsAreNotForwarded() throws IOException {
        LuminaAppender appender = owningAppender(null);

        appender.append(event("io.lumina.sinks.SinkCache", Level.ERROR, "loop", null));
        appender.stop();

        assertThat(lines("error.log")).isEmpty();
    }

    @Test
    public void stopShutsDownOwnedEngineOnly() {
        LuminaAppender owning = owningAppender(null);
        owning.stop();
        assertThat(owning.isStopped()).isTrue();
        assertThat(lumina.isShutdown()).isTrue();

        Lumina shared = new Lumina(LuminaConfig.builder()
            .withRoot(root)
            .withRotation(RotationPolicy.disabled())
            .build());
        try {
            LuminaAppender borrowing = LuminaAppender.forEngine("borrowing", shared, false);
            borrowing.stop();
            assertThat(shared.isShutdown()).isFalse();
        } finally {
            shared.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    public void pluginFactoryBuildsAndOwnsAnEngine() throws IOException {
        lumina.shutdown(Duration.ofSeconds(5));
        Path configFile = root.resolve("lumina.yaml");
        Files.writeString(configFile, "name: FromYaml\nrotation:\n  enabled: false\n");

        LuminaAppender appender = LuminaAppender.createAppender("files", null, root.resolve("factory").toString(),
            configFile.toString(), false, "2s", null, null);
        appender.append(event("com.example.Service", Level.WARN, "configured", null));
        appender.stop();

        Lumina engine = appender.getLumina();
        assertThat(engine.getName()).isEqualTo("FromYaml");
        assertThat(engine.isShutdown()).isTrue();
        Path file = root.resolve("factory").resolve("19.10.2026").resolve("warn.log");
        assertThat(Files.readAllLines(file)).containsExactly("[08:00:00.000] - WARN - FromYaml - configured");
    }
}
