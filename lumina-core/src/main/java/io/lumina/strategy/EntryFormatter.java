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

import java.util.List;

/**
 * Turns the parts of one log entry into its text. The result may span several lines and may
 * contain ANSI sequences or color markers; the strategy derives the console and file variants.
 *
 * @since 4.0.0
 */
@FunctionalInterface
public interface EntryFormatter {

    /**
     * @param time the formatted timestamp
     * @param severityLabel the colorized severity name
     * @param loggerName the engine's name
     * @param lines the message content, one element per logical line
     * @return the entry text, lines separated by {@code '\n'}, without a trailing newline
     */
    String format(String time, String severityLabel, String loggerName, List<String> lines);

    /**
     * The default layout: {@code [time] - SEVERITY - name - line}. Every content line, and every
     * newline embedded in a content line, starts with the same prefix.
     *
     * @return the standard formatter
     */
    static EntryFormatter standard() {
        return (time, severityLabel, loggerName, lines) -> {
            String prefix = "[" + time + "] - " + severityLabel + " - " + loggerName + " - ";
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    sb.append('\n');
                }
                sb.append(prefix).append(lines.get(i).replace("\n", "\n" + prefix));
            }
            return sb.toString();
        };
    }
}
