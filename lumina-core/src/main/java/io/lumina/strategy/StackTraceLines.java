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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders a throwable and its cause chain as content lines for a {@link RenderStyle#STACK_TRACE}
 * entry.
 *
 * @since 4.0.0
 */
public final class StackTraceLines {

    private StackTraceLines() {
    }

    /**
     * @param thrown the throwable to describe
     * @return exception type, message and origin, then type and message of each cause
     */
    public static List<String> of(Throwable thrown) {
        List<String> lines = new ArrayList<>();
        lines.add("Exception: " + thrown.getClass().getName());
        lines.add("Message: " + messageOf(thrown));
        StackTraceElement[] frames = thrown.getStackTrace();
        if (frames.length > 0) {
            StackTraceElement top = frames[0];
            lines.add("At: " + top.getClassName() + " - " + top.getFileName() + ":" + top.getLineNumber());
        }

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(thrown);
        Throwable cause = thrown.getCause();
        while (cause != null && seen.add(cause)) {
            lines.add("Caused by: " + cause.getClass().getName());
            lines.add("Message: " + messageOf(cause));
            cause = cause.getCause();
        }
        return lines;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : "N/A";
    }
}
