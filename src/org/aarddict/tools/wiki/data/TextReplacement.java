/**
 *  Copyright 2026 The Aard Dictionary contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */
package org.aarddict.tools.wiki.data;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A regular expression substitution applied to the rendered text of every
 * article.
 */
public class TextReplacement {
    private final Pattern pattern;
    private final String replacement;

    /**
     * Creates a new text replacement.
     * 
     * @param pattern
     *            the compiled pattern
     * @param replacement
     *            the replacement in {@link Matcher#replaceAll(String)} syntax
     */
    public TextReplacement(Pattern pattern, String replacement) {
        this.pattern = pattern;
        this.replacement = replacement;
    }

    /**
     * Replaces every match of the pattern in the given text.
     * 
     * @param text
     *            the text to process
     * 
     * @return the text with all matches replaced
     */
    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }

    /**
     * Converts a replacement string using <tt>\1</tt>, <tt>\12</tt> or
     * <tt>\g&lt;1&gt;</tt> style group references into the syntax of
     * {@link Matcher#replaceAll(String)}. Numeric references take up to two
     * digits, a digit following a reference stays literal. Literal
     * <tt>$</tt> signs are escaped.
     * 
     * @param sub
     *            the replacement as written in the filter file
     * 
     * @return the replacement for {@link Matcher}
     */
    public static String toMatcherReplacement(String sub) {
        StringBuilder sb = new StringBuilder(sub.length() + 8);
        // Matcher extends "$1" by any following digit while such a group exists
        boolean afterGroup = false;
        for (int i = 0; i < sub.length(); ++i) {
            char c = sub.charAt(i);
            boolean group = false;
            if (c == '$') {
                sb.append("\\$");
            } else if (c == '\\' && i + 1 < sub.length()) {
                char next = sub.charAt(i + 1);
                if (next >= '1' && next <= '9') {
                    int end = i + 2;
                    if (end < sub.length() && Character.isDigit(sub.charAt(end))) {
                        ++end;
                    }
                    sb.append('$').append(sub, i + 1, end);
                    group = true;
                    i = end - 1;
                } else if (next == 'g' && i + 2 < sub.length() && sub.charAt(i + 2) == '<') {
                    int end = sub.indexOf('>', i + 3);
                    if (end < 0) {
                        sb.append("\\\\");
                        continue;
                    }
                    String name = sub.substring(i + 3, end);
                    if (name.matches("\\d+")) {
                        sb.append('$').append(Integer.parseInt(name));
                        group = true;
                    } else {
                        sb.append("${").append(name).append('}');
                    }
                    i = end;
                } else if (next == 'n') {
                    sb.append('\n');
                    ++i;
                } else if (next == 't') {
                    sb.append('\t');
                    ++i;
                } else {
                    appendLiteral(sb, next, afterGroup);
                    ++i;
                }
            } else if (c == '\\') {
                sb.append("\\\\");
            } else {
                appendLiteral(sb, c, afterGroup);
            }
            afterGroup = group;
        }
        return sb.toString();
    }

    private static void appendLiteral(StringBuilder sb, char c, boolean afterGroup) {
        if (afterGroup && Character.isDigit(c)) {
            sb.append('\\');
        }
        sb.append(Matcher.quoteReplacement(String.valueOf(c)));
    }

    /**
     * @return the compiled pattern
     */
    public Pattern getPattern() {
        return pattern;
    }

    /**
     * @return the replacement in {@link Matcher#replaceAll(String)} syntax
     */
    public String getReplacement() {
        return replacement;
    }
}
