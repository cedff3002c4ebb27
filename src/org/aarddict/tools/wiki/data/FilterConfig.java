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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.ArrayList;

/**
 * Content filters applied during conversion: pages that are never fetched,
 * CSS classes and element ids whose elements are dropped and text
 * replacements applied to the rendered articles.
 * 
 * Instances are immutable and can be shared by all workers.
 */
public class FilterConfig {
    /**
     * A configuration that filters nothing.
     */
    public static final FilterConfig EMPTY = new FilterConfig(
            Collections.<String>emptySet(), Collections.<String>emptySet(),
            Collections.<String>emptySet(), Collections.<TextReplacement>emptyList());

    private final Set<String> excludedPages;
    private final Set<String> excludedClasses;
    private final Set<String> excludedIds;
    private final List<TextReplacement> textReplacements;

    /**
     * Creates a new filter configuration.
     * 
     * @param excludedPages
     *            full titles of pages that are never fetched
     * @param excludedClasses
     *            CSS classes of elements to drop
     * @param excludedIds
     *            ids of elements to drop
     * @param textReplacements
     *            replacements applied to the rendered text, in this order
     */
    public FilterConfig(Set<String> excludedPages, Set<String> excludedClasses,
            Set<String> excludedIds, List<TextReplacement> textReplacements) {
        this.excludedPages = Collections.unmodifiableSet(new LinkedHashSet<String>(excludedPages));
        this.excludedClasses = Collections.unmodifiableSet(new LinkedHashSet<String>(excludedClasses));
        this.excludedIds = Collections.unmodifiableSet(new LinkedHashSet<String>(excludedIds));
        this.textReplacements = Collections.unmodifiableList(new ArrayList<TextReplacement>(textReplacements));
    }

    /**
     * @return the full titles of pages that are never fetched
     */
    public Set<String> getExcludedPages() {
        return excludedPages;
    }

    /**
     * @return the CSS classes of elements to drop
     */
    public Set<String> getExcludedClasses() {
        return excludedClasses;
    }

    /**
     * @return the ids of elements to drop
     */
    public Set<String> getExcludedIds() {
        return excludedIds;
    }

    /**
     * @return the replacements applied to the rendered text, in order
     */
    public List<TextReplacement> getTextReplacements() {
        return textReplacements;
    }
}
