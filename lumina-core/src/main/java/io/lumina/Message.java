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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// One log entry as submitted by a caller. Immutable; consumed exactly once by the engine.
///
/// @param strategy
///     the severity that formats and stores the entry
/// @param lines
///     the content, one element per logical line
/// @param echoToConsole
///     whether the entry is also printed to the console stream
/// @param createdAt
///     the creation time; selects the displayed time and the period the entry is filed under
public record Message(LoggingStrategy strategy, List<String> lines, boolean echoToConsole, Instant createdAt) {

    public Message {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(createdAt, "createdAt");
        lines = List.copyOf(lines);
    }

    /// Creates a message from arbitrary objects, one line per object.
    ///
    /// @param strategy the severity
    /// @param echoToConsole whether to echo to the console
    /// @param createdAt the creation time
    /// @param content the content objects; {@code null} elements become {@code "null"}
    /// @return the message
    public static Message of(LoggingStrategy strategy, boolean echoToConsole, Instant createdAt, Object... content) {
        List<String> lines = Arrays.stream(content).map(String::valueOf).collect(Collectors.toList());
        return new Message(strategy, lines, echoToConsole, createdAt);
    }

    @Override
    public String toString() {
        return "Message(" + String.join(", ", lines) + ", " + echoToConsole + ", " + createdAt + ", " + strategy.getName() + ")";
    }
}
