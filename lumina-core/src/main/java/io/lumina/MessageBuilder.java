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

import io.lumina.strategy.LoggingStrategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Assembles a multi-line {@link Message}.
 *
 * <pre>{@code
 * lumina.log(lumina.infoStrategy(), b -> b
 *     .line("Connected to", host)
 *     .keyValue("Session", "id", sessionId)
 *     .emptyLine());
 * }</pre>
 *
 * @since 4.0.0
 */
public final class MessageBuilder {

    private final LoggingStrategy strategy;
    private final List<String> lines = new ArrayList<>();
    private boolean echoToConsole = true;

    public MessageBuilder(LoggingStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Adds one line made of the given parts joined by a single space.
     *
     * @param parts the parts of the line
     * @return this builder
     * @throws IllegalArgumentException if no parts are given
     */
    public MessageBuilder line(String... parts) {
        return joinedLine(" ", parts);
    }

    public MessageBuilder joinedLine(String delimiter, String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("Content cannot be empty!");
        }
        lines.add(String.join(delimiter, parts));
        return this;
    }

    public MessageBuilder emptyLine() {
        lines.add("");
        return this;
    }

    /**
     * Adds a line of the form {@code objectName(key=k, value=v1, v2)}.
     *
     * @param objectName the name shown before the parentheses
     * @param key the key
     * @param values one or more values
     * @return this builder
     */
    public MessageBuilder keyValue(String objectName, String key, Object... values) {
        return labeledKeyValue(objectName, "key", key, "value", values);
    }

    /**
     * Like {@link #keyValue(String, String, Object...)} with custom labels in place of
     * {@code key} and {@code value}.
     */
    public MessageBuilder labeledKeyValue(String objectName, String keyPrefix, String key, String valuePrefix, Object... values) {
        requireText(keyPrefix, "Key prefix cannot be empty or blank!");
        requireText(key, "Key cannot be null or blank!");
        requireText(valuePrefix, "Value prefix cannot be empty or blank!");
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Value cannot be null or empty!");
        }
        String joined = Arrays.stream(values).map(String::valueOf).collect(Collectors.joining(", "));
        lines.add(objectName + "(" + keyPrefix + "=" + key + ", " + valuePrefix + "=" + joined + ")");
        return this;
    }

    public MessageBuilder echoToConsole(boolean enabled) {
        this.echoToConsole = enabled;
        return this;
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public Message build(Instant createdAt) {
        return new Message(strategy, lines, echoToConsole, createdAt);
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
