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

import io.lumina.ansi.Ansi;

import java.util.List;

/**
 * The closed set of entry layouts a {@link LoggingStrategy} can use.
 *
 * @since 4.0.0
 */
public enum RenderStyle {

    /**
     * Entry text exactly as produced by the configured {@link EntryFormatter}.
     */
    STANDARD {
        @Override
        public String render(EntryFormatter formatter, String time, String severityLabel,
                             String loggerName, List<String> lines) {
            return formatter.format(time, severityLabel, loggerName, lines);
        }
    },

    /**
     * Entry text framed by begin and end banners, for exception reports.
     */
    STACK_TRACE {
        @Override
        public String render(EntryFormatter formatter, String time, String severityLabel,
                             String loggerName, List<String> lines) {
            return "[" + time + "] ----------- " + Ansi.colorize(Ansi.BOLD_RED, "STACKTRACE BEGIN") + " -----------\n"
                + formatter.format(time, severityLabel, loggerName, lines) + "\n"
                + "[" + time + "] -----------  " + Ansi.colorize(Ansi.BOLD_RED, "STACKTRACE END") + "  -----------";
        }
    };

    public abstract String render(EntryFormatter formatter, String time, String severityLabel,
                                  String loggerName, List<String> lines);
}
