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

package io.lumina.ansi;

import org.jline.utils.AttributedString;

/**
 * ANSI color constants and the two translations applied to every rendered log entry.
 *
 * <h2>Color Markers</h2>
 * <p>Message text may carry two-character color markers made of {@link #MARKER} followed by a
 * code letter, for example {@code "&cfailed&r"}. {@link #toDisplay(String)} replaces each
 * recognized marker with its control sequence; an escaped marker ({@code "\&"}) becomes a
 * literal {@code '&'}. Unknown code letters are left untouched.</p>
 *
 * <table>
 *   <caption>Marker codes</caption>
 *   <tr><th>code</th><th>sequence</th><th>code</th><th>sequence</th></tr>
 *   <tr><td>0</td><td>{@link #BLACK}</td><td>8</td><td>{@link #HIGH_INTENSITY_BLACK}</td></tr>
 *   <tr><td>1</td><td>{@link #BLUE}</td><td>9</td><td>{@link #HIGH_INTENSITY_BLUE}</td></tr>
 *   <tr><td>2</td><td>{@link #GREEN}</td><td>a</td><td>{@link #HIGH_INTENSITY_GREEN}</td></tr>
 *   <tr><td>3</td><td>{@link #CYAN}</td><td>b</td><td>{@link #HIGH_INTENSITY_CYAN}</td></tr>
 *   <tr><td>4</td><td>{@link #RED}</td><td>c</td><td>{@link #HIGH_INTENSITY_RED}</td></tr>
 *   <tr><td>5</td><td>{@link #PURPLE}</td><td>d</td><td>{@link #HIGH_INTENSITY_PURPLE}</td></tr>
 *   <tr><td>6</td><td>{@link #YELLOW}</td><td>e</td><td>{@link #HIGH_INTENSITY_YELLOW}</td></tr>
 *   <tr><td>7</td><td>{@link #WHITE}</td><td>f</td><td>{@link #HIGH_INTENSITY_WHITE}</td></tr>
 *   <tr><td>g</td><td>{@link #YELLOW}</td><td>r</td><td>{@link #RESET}</td></tr>
 * </table>
 *
 * <p>Code letters are case-insensitive. Both translations are total: text without markers or
 * control sequences is returned unchanged.</p>
 *
 * @since 4.0.0
 */
public final class Ansi {

    public static final char MARKER = '&';
    public static final char ESCAPE = '\\';

    public static final String BLACK = "\u001B[0;30m";
    public static final String RED = "\u001B[0;31m";
    public static final String GREEN = "\u001B[0;32m";
    public static final String YELLOW = "\u001B[0;33m";
    public static final String BLUE = "\u001B[0;34m";
    public static final String PURPLE = "\u001B[0;35m";
    public static final String CYAN = "\u001B[0;36m";
    public static final String WHITE = "\u001B[0;37m";

    public static final String BOLD_BLACK = "\u001B[1;30m";
    public static final String BOLD_RED = "\u001B[1;31m";
    public static final String BOLD_GREEN = "\u001B[1;32m";
    public static final String BOLD_YELLOW = "\u001B[1;33m";
    public static final String BOLD_BLUE = "\u001B[1;34m";
    public static final String BOLD_PURPLE = "\u001B[1;35m";
    public static final String BOLD_CYAN = "\u001B[1;36m";
    public static final String BOLD_WHITE = "\u001B[1;37m";

    public static final String HIGH_INTENSITY_BLACK = "\u001B[0;90m";
    public static final String HIGH_INTENSITY_RED = "\u001B[0;91m";
    public static final String HIGH_INTENSITY_GREEN = "\u001B[0;92m";
    public static final String HIGH_INTENSITY_YELLOW = "\u001B[0;93m";
    public static final String HIGH_INTENSITY_BLUE = "\u001B[0;94m";
    public static final String HIGH_INTENSITY_PURPLE = "\u001B[0;95m";
    public static final String HIGH_INTENSITY_CYAN = "\u001B[0;96m";
    public static final String HIGH_INTENSITY_WHITE = "\u001B[0;97m";

    public static final String RESET = "\u001B[0m";
    public static final String BOLD = "\u001B[1m";
    public static final String ITALIC = "\u001B[3m";
    public static final String UNDERLINE = "\u001B[4m";

    private Ansi() {
    }

    /**
     * Returns the control sequence for a marker code letter, or null when the letter is not a code.
     *
     * @param code the character following {@link #MARKER}
     * @return the control sequence, or null
     */
    public static String sequenceFor(char code) {
        char c = Character.toLowerCase(code);
        return switch (c) {
            case '0' -> BLACK;
            case '1' -> BLUE;
            case '2' -> GREEN;
            case '3' -> CYAN;
            case '4' -> RED;
            case '5' -> PURPLE;
            case '6' -> YELLOW;
            case '7' -> WHITE;
            case '8' -> HIGH_INTENSITY_BLACK;
            case '9' -> HIGH_INTENSITY_BLUE;
            case 'a' -> HIGH_INTENSITY_GREEN;
            case 'b' -> HIGH_INTENSITY_CYAN;
            case 'c' -> HIGH_INTENSITY_RED;
            case 'd' -> HIGH_INTENSITY_PURPLE;
            case 'e' -> HIGH_INTENSITY_YELLOW;
            case 'f' -> HIGH_INTENSITY_WHITE;
            case 'g' -> YELLOW;
            case 'r' -> RESET;
            default -> null;
        };
    }

    /**
     * Replaces color markers with their control sequences.
     *
     * @param text the text to translate
     * @return the translated text, or the same instance when it contains no marker
     */
    public static String toDisplay(String text) {
        if (text.indexOf(MARKER) < 0) {
            return text;
        }
        int length = text.length();
        StringBuilder result = new StringBuilder(length + 32);
        int i = 0;
        int lastPos = 0;

        while (i < length) {
            char ch = text.charAt(i);
            if (ch == ESCAPE && i + 1 < length && text.charAt(i + 1) == MARKER) {
                result.append(text, lastPos, i).append(MARKER);
                i += 2;
                lastPos = i;
                continue;
            }
            if (ch == MARKER && i + 1 < length) {
                String sequence = sequenceFor(text.charAt(i + 1));
                if (sequence != null) {
                    result.append(text, lastPos, i).append(sequence);
                    i += 2;
                    lastPos = i;
                    continue;
                }
            }
            i++;
        }
        result.append(text, lastPos, length);
        return result.toString();
    }

    /**
     * Removes ANSI control sequences.
     *
     * @param text the text to strip
     * @return the text without control sequences
     */
    public static String toPlain(String text) {
        if (text.indexOf('\u001B') < 0) {
            return text;
        }
        return AttributedString.stripAnsi(text);
    }

    /**
     * Wraps a label in a color and a trailing reset.
     *
     * @param color the control sequence to open with
     * @param label the label text
     * @return the colored label
     */
    public static String colorize(String color, String label) {
        return color + label + RESET;
    }
}
