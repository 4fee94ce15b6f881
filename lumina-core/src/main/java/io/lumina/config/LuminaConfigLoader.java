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

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reads the declarative part of a {@link LuminaConfig} from YAML.
///
/// The loader returns a pre-populated {@link LuminaConfig.Builder}, so code-only settings
/// (formatter, file system, clock, executor) can still be applied before {@code build()}.
/// Every key is optional; unknown keys are ignored.
///
/// ```yaml
/// name: ServiceA
/// directory: /var/log/service-a
/// timeFormat: HH:mm:ss.SSS
/// dateFormat: dd.MM.yyyy
/// zone: Europe/Berlin
/// rotation:
///   enabled: true
///   retention: 30d
///   interval: 12h
/// queue:
///   capacity: 10000
///   overflow: drop
/// ```
///
/// Durations are either ISO-8601 ({@code P30D}, {@code PT12H}) or a number with one of the
/// units {@code ms}, {@code s}, {@code m}, {@code h}, {@code d}.
public final class LuminaConfigLoader {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    private LuminaConfigLoader() {
    }

    /// Loads a configuration file.
    ///
    /// @param file
    ///     the YAML file
    /// @return a builder holding the file's settings
    /// @throws LuminaConfigException
    ///     if the file cannot be read or does not have the expected shape
    public static LuminaConfig.Builder load(Path file) {
        String yaml;
        try {
            yaml = Files.readString(file);
        } catch (IOException e) {
            throw new LuminaConfigException("Failed to read logger configuration: " + file, e);
        }
        try {
            return fromString(yaml);
        } catch (LuminaConfigException e) {
            throw new LuminaConfigException(e.getMessage() + " (in " + file + ")", e);
        }
    }

    /// Parses a configuration document.
    ///
    /// @param yaml
    ///     the document
    /// @return a builder holding the document's settings
    /// @throws LuminaConfigException
    ///     if the document does not have the expected shape
    public static LuminaConfig.Builder fromString(String yaml) {
        Object document;
        try {
            Load load = new Load(LoadSettings.builder().build());
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new LuminaConfigException("Invalid YAML in logger configuration: " + e.getMessage(), e);
        }

        LuminaConfig.Builder builder = LuminaConfig.builder();
        if (document == null) {
            return builder;
        }
        Map<?, ?> root = asMap(document, "configuration");

        String name = string(root, "name");
        if (name != null) {
            builder.withName(name);
        }
        String directory = string(root, "directory");
        if (directory != null) {
            builder.withRoot(Path.of(directory));
        }
        try {
            String timeFormat = string(root, "timeFormat");
            if (timeFormat != null) {
                builder.withTimeFormat(timeFormat);
            }
            String dateFormat = string(root, "dateFormat");
            if (dateFormat != null) {
                builder.withDateFormat(dateFormat);
            }
        } catch (IllegalArgumentException e) {
            throw new LuminaConfigException("Invalid time or date format: " + e.getMessage(), e);
        }
        String zone = string(root, "zone");
        if (zone != null) {
            try {
                builder.withZone(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new LuminaConfigException("Unknown zone '" + zone + "'", e);
            }
        }

        Object rotation = root.get("rotation");
        if (rotation != null) {
            Map<?, ?> section = asMap(rotation, "rotation");
            RotationPolicy defaults = RotationPolicy.DEFAULT;
            Object enabled = section.get("enabled");
            if (enabled != null && !(enabled instanceof Boolean)) {
                throw new LuminaConfigException("rotation.enabled must be true or false, got '" + enabled + "'");
            }
            String retention = string(section, "retention");
            String interval = string(section, "interval");
            builder.withRotation(new RotationPolicy(
                enabled == null ? defaults.enabled() : (Boolean) enabled,
                retention == null ? defaults.retention() : parseDuration(retention),
                interval == null ? defaults.sweepInterval() : parseDuration(interval)));
        }

        Object queue = root.get("queue");
        if (queue != null) {
            Map<?, ?> section = asMap(queue, "queue");
            Object capacity = section.get("capacity");
            if (capacity != null) {
                if (!(capacity instanceof Number)) {
                    throw new LuminaConfigException("queue.capacity must be a number, got '" + capacity + "'");
                }
                builder.withQueueCapacity(((Number) capacity).intValue());
            }
            String overflow = string(section, "overflow");
            if (overflow != null) {
                try {
                    builder.withOverflowPolicy(OverflowPolicy.valueOf(overflow.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new LuminaConfigException("queue.overflow must be 'block' or 'drop', got '" + overflow + "'", e);
                }
            }
        }
        return builder;
    }

    /// Parses a duration in ISO-8601 or short form.
    ///
    /// @param text
    ///     for example {@code P30D}, {@code 30d}, {@code 500ms}
    /// @return the duration
    /// @throws LuminaConfigException
    ///     if the text is neither form
    public static Duration parseDuration(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new LuminaConfigException("Invalid duration '" + text + "'", e);
            }
        }
        Matcher m = SHORT_DURATION.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new LuminaConfigException("Invalid duration '" + text + "', expected e.g. P30D, 30d, 12h, 5m, 10s, 500ms");
        }
        long amount = Long.parseLong(m.group(1));
        switch (m.group(2)) {
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            default:
                return Duration.ofDays(amount);
        }
    }

    private static Map<?, ?> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new LuminaConfigException(what + " must be a mapping, got '" + value + "'");
        }
        return (Map<?, ?>) value;
    }

    private static String string(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }
}
