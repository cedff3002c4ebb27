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

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.regex.Pattern;

import org.aarddict.tools.wiki.data.FilterConfig;
import org.aarddict.tools.wiki.data.TextReplacement;
import org.aarddict.tools.wiki.tree.NodeKind;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.junit.Test;

/**
 * Unit test for the {@link ContentFilter} class.
 */
public class ContentFilterTest {

    private static ContentFilter filter() {
        FilterConfig config = new FilterConfig(
                new HashSet<String>(Arrays.asList("Vorlage:Navi")),
                new HashSet<String>(Arrays.asList("metadata")),
                new HashSet<String>(Arrays.asList("coordinates")),
                Arrays.asList(new TextReplacement(Pattern.compile("foo(\\d)"), "bar$1")));
        return new ContentFilter(config);
    }

    /**
     * Test method for {@link ContentFilter#isSuppressed(WikiNode)}.
     */
    @Test
    public void testIsSuppressedByClass() {
        ContentFilter filter = filter();
        assertTrue(filter.isSuppressed(new WikiNode(NodeKind.DIV).setAttribute("class", "navbox other")));
        assertTrue(filter.isSuppressed(new WikiNode(NodeKind.TABLE).setAttribute("class", " metadata ")));
        assertFalse(filter.isSuppressed(new WikiNode(NodeKind.DIV).setAttribute("class", "navboxes")));
        assertFalse(filter.isSuppressed(new WikiNode(NodeKind.DIV)));
    }

    /**
     * Test method for {@link ContentFilter#isSuppressed(WikiNode)}.
     */
    @Test
    public void testIsSuppressedById() {
        ContentFilter filter = filter();
        assertTrue(filter.isSuppressed(new WikiNode(NodeKind.SPAN).setAttribute("id", "coordinates")));
        assertFalse(filter.isSuppressed(new WikiNode(NodeKind.SPAN).setAttribute("id", "other")));
    }

    /**
     * Test method for {@link ContentFilter#isExcludedPage(String)}.
     */
    @Test
    public void testIsExcludedPage() {
        assertTrue(filter().isExcludedPage("Vorlage:Navi"));
        assertFalse(filter().isExcludedPage("Vorlage:Info"));
    }

    /**
     * Test method for {@link ContentFilter#applyReplacements(String)}.
     */
    @Test
    public void testApplyReplacements() {
        assertEquals("bar1 and bar2", filter().applyReplacements("foo1 and foo2"));
        assertEquals("unchanged", new ContentFilter(FilterConfig.EMPTY).applyReplacements("unchanged"));
    }

    /**
     * Test method for {@link ContentFilter#getExcludedClasses()}.
     */
    @Test
    public void testBuiltinClasses() {
        ContentFilter filter = new ContentFilter(FilterConfig.EMPTY);
        assertEquals(ContentFilter.BUILTIN_EXCLUDED_CLASSES, filter.getExcludedClasses());
        assertFalse(Collections.disjoint(filter.getExcludedClasses(), Arrays.asList("navbox")));
    }
}
