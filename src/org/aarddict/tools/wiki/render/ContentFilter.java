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
package org.aarddict.tools.wiki.render;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.aarddict.tools.wiki.data.FilterConfig;
import org.aarddict.tools.wiki.data.TextReplacement;
import org.aarddict.tools.wiki.tree.WikiNode;

/**
 * Applies a {@link FilterConfig} during rendering.
 */
public class ContentFilter {
    /**
     * CSS classes whose elements are always dropped: navigation boxes and
     * collapsible elements make no sense in an offline dictionary.
     */
    public static final Set<String> BUILTIN_EXCLUDED_CLASSES;

    static {
        Set<String> classes = new HashSet<String>();
        classes.add("navbox");
        classes.add("collapsible");
        classes.add("autocollapse");
        classes.add("plainlinksneverexpand");
        classes.add("navbar");
        BUILTIN_EXCLUDED_CLASSES = Collections.unmodifiableSet(classes);
    }

    private final FilterConfig config;
    private final Set<String> excludedClasses;

    /**
     * Creates a filter for the given configuration.
     * 
     * @param config
     *            the filter configuration
     */
    public ContentFilter(FilterConfig config) {
        this.config = config;
        Set<String> classes = new HashSet<String>(BUILTIN_EXCLUDED_CLASSES);
        classes.addAll(config.getExcludedClasses());
        this.excludedClasses = Collections.unmodifiableSet(classes);
    }

    /**
     * Decides whether an element (and all its descendants) is dropped.
     * 
     * @param node
     *            a table or generic element
     * 
     * @return <tt>true</tt> if one of its classes or its id is excluded
     */
    public boolean isSuppressed(WikiNode node) {
        for (String cl : node.getClasses()) {
            if (excludedClasses.contains(cl)) {
                return true;
            }
        }
        String id = node.getAttribute("id", null);
        return id != null && config.getExcludedIds().contains(id);
    }

    /**
     * Checks whether a page must never be fetched.
     * 
     * @param fullTitle
     *            the full, normalised page title
     * 
     * @return <tt>true</tt> if the page is excluded
     */
    public boolean isExcludedPage(String fullTitle) {
        return config.getExcludedPages().contains(fullTitle);
    }

    /**
     * Applies all configured text replacements in order.
     * 
     * @param text
     *            the rendered article text
     * 
     * @return the text after all replacements
     */
    public String applyReplacements(String text) {
        String result = text;
        for (TextReplacement replacement : config.getTextReplacements()) {
            result = replacement.apply(result);
        }
        return result;
    }

    /**
     * @return the effective set of excluded classes (built-in and configured)
     */
    public Set<String> getExcludedClasses() {
        return excludedClasses;
    }
}
