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

import io.lumina.FaultyLogFileSystem;
import io.lumina.ansi.Ansi;
import io.lumina.config.LuminaConfig;
import io.lumina.config.RotationPolicy;
import io.lumina.sinks.SinkCache;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LoggingStrategyTest {

    private static final Instant DAY_ONE = Instant.parse("2026-10-19T10:15:30.123Z");
    private static final Instant DAY_TWO = DAY_ONE.plus(Duration.ofDays(1));

    @TempDir
    Path root;

    private FaultyLogFileSystem fs;
    private ByteArrayOutputStream consoleBytes;
    private LuminaConfig config;
    private SinkCache cache;

    @BeforeEach
    public void setUp() {
        fs = new FaultyLogFileSystem();
        consoleBytes = new ByteArrayOutputStream();
        config = LuminaConfig.builder()
            .withName("Test")
            .withRoot(root)
            .withRotation(RotationPolicy.disabled())
            .withFileSystem(fs)
            .withConsole(new PrintStream(consoleBytes, true, StandardCharsets.UTF_8))
            .build();
        cache = new SinkCache(fs);
    }

    @Test
    public void writesPlainEntryToSeverityFileOfThePeriod() throws IOException {
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, config, cache);

        assertThat(info.write(DAY_ONE, false, List.of("hello world"))).isTrue();

        Path file = root.resolve("19.10.2026").resolve("info.log");
        assertThat(Files.readAllLines(file)).containsExactly("[10:15:30.123] - INFO - Test - hello world");
        assertThat(consoleBytes.size()).isZero();
    }

    @Test
    public void ampersandsInContentReachTheFileUnchanged() throws IOException {
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, config, cache);

        info.write(DAY_ONE, true, List.of("GET /search?a=1&b=2&c=3"));
        info.write(DAY_ONE, true, List.of("Tom&Bob", "R&D"));

        assertThat(Files.readAllLines(root.resolve("19.10.2026/info.log"))).containsExactly(
            "[10:15:30.123] - INFO - Test - GET /search?a=1&b=2&c=3",
            "[10:15:30.123] - INFO - Test - Tom&Bob",
            "[10:15:30.123] - INFO - Test - R&D");
    }

    @Test
    public void colorMarkersAreTranslatedOnlyOnTheConsole() throws IOException {
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, config, cache);

        info.write(DAY_ONE, true, List.of("hello &2world"));

        assertThat(consoleBytes.toString(StandardCharsets.UTF_8)).contains("hello " + Ansi.GREEN + "world");
        assertThat(Files.readAllLines(root.resolve("19.10.2026/info.log")))
            .containsExactly("[10:15:30.123] - INFO - Test - hello &2world");
    }

    @Test
    public void echoPrintsColoredEntryToConsole() {
        LoggingStrategy warn = new LoggingStrategy("WARN", Ansi.YELLOW, RenderStyle.STANDARD, config, cache);

        warn.write(DAY_ONE, true, List.of("careful"));

        String console = consoleBytes.toString(StandardCharsets.UTF_8);
        assertThat(console).contains(Ansi.YELLOW + "WARN" + Ansi.RESET).contains("careful");
    }

    @Test
    public void rollsOverWhenThePeriodChanges() throws IOException {
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, config, cache);

        info.write(DAY_ONE, false, List.of("one"));
        info.write(DAY_TWO, false, List.of("two"));

        assertThat(Files.readAllLines(root.resolve("19.10.2026/info.log"))).hasSize(1);
        assertThat(Files.readAllLines(root.resolve("20.10.2026/info.log")))
            .singleElement().asString().endsWith("two");
        assertThat(cache.openPaths()).containsExactly(root.resolve("20.10.2026/info.log").toAbsolutePath().normalize());
    }

    @Test
    public void failedWriteIsReportedAndNextWriteRecovers() throws IOException {
        LoggingStrategy error = new LoggingStrategy("ERROR", Ansi.RED, RenderStyle.STANDARD, config, cache);
        error.write(DAY_ONE, false, List.of("before"));

        fs.failWrites(true);
        assertThat(error.write(DAY_ONE, false, List.of("lost"))).isFalse();

        fs.failWrites(false);
        assertThat(error.write(DAY_ONE, false, List.of("after"))).isTrue();

        assertThat(Files.readAllLines(root.resolve("19.10.2026/error.log")))
            .hasSize(2)
            .noneMatch(line -> line.endsWith("lost"));
    }

    @Test
    public void failedRolloverIsRetriedOnNextWrite() throws IOException {
        LoggingStrategy debug = new LoggingStrategy("DEBUG", Ansi.GREEN, RenderStyle.STANDARD, config, cache);

        fs.failOpen(true);
        assertThat(debug.write(DAY_ONE, false, List.of("nowhere"))).isFalse();

        fs.failOpen(false);
        assertThat(debug.write(DAY_ONE, false, List.of("somewhere"))).isTrue();
        assertThat(Files.readAllLines(root.resolve("19.10.2026/debug.log"))).singleElement()
            .asString().endsWith("somewhere");
    }

    @Test
    public void strategiesNamingTheSameFileShareOneSink() throws IOException {
        LuminaConfig shared = LuminaConfig.builder()
            .withName("Test")
            .withRoot(root)
            .withRotation(RotationPolicy.disabled())
            .withFileSystem(fs)
            .withFileNaming((dir, severity) -> dir.resolve("all.log"))
            .build();
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, shared, cache);
        LoggingStrategy warn = new LoggingStrategy("WARN", Ansi.YELLOW, RenderStyle.STANDARD, shared, cache);

        info.write(DAY_ONE, false, List.of("a"));
        warn.write(DAY_ONE, false, List.of("b"));
        info.write(DAY_ONE, false, List.of("c"));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(fs.openCount()).isEqualTo(1);
        assertThat(Files.readAllLines(root.resolve("19.10.2026/all.log")))
            .containsExactly(
                "[10:15:30.123] - INFO - Test - a",
                "[10:15:30.123] - WARN - Test - b",
                "[10:15:30.123] - INFO - Test - c");
    }

    @Test
    public void releasedSinkIsReopenedLazily() throws IOException {
        LoggingStrategy info = new LoggingStrategy("INFO", Ansi.CYAN, RenderStyle.STANDARD, config, cache);
        info.write(DAY_ONE, false, List.of("one"));

        info.release();
        assertThat(cache.size()).isZero();

        info.write(DAY_ONE, false, List.of("two"));
        assertThat(fs.openCount()).isEqualTo(2);
        assertThat(Files.readAllLines(root.resolve("19.10.2026/info.log"))).hasSize(2);
    }

    @Test
    public void blankNameIsRejected() {
        assertThatThrownBy(() -> new LoggingStrategy(" ", Ansi.CYAN, RenderStyle.STANDARD, config, cache))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
