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

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Unit test for the {@link Namespaces} class.
 */
public class NamespacesTest {
    private final Namespaces namespaces = TestData.namespaces();

    /**
     * Test method for {@link Namespaces#normaliseName(String)}.
     */
    @Test
    public void testNormaliseName() {
        assertEquals("Foo bar", Namespaces.normaliseName("foo_bar"));
        assertEquals("Foo bar", Namespaces.normaliseName("  foo   _bar "));
        assertEquals("Über", Namespaces.normaliseName("über"));
        assertEquals("", Namespaces.normaliseName(" _ "));
    }

    /**
     * Test method for {@link Namespaces#getFqName(String)}.
     */
    @Test
    public void testGetFqName() {
        assertEquals("Vorlage:Infobox Stadt", namespaces.getFqName("vorlage:infobox_Stadt"));
        assertEquals("Vorlage:Foo", namespaces.getFqName("Template:foo"));
        assertEquals("Datei:Bar.png", namespaces.getFqName("Bild:bar.png"));
        assertEquals("Berlin", namespaces.getFqName("berlin"));
        assertEquals("Nothing:here", namespaces.getFqName("nothing:here"));
    }

    /**
     * Test method for {@link Namespaces#getNamespaceKey(String)}.
     */
    @Test
    public void testGetNamespaceKey() {
        assertEquals(Namespaces.CATEGORY_NAMESPACE_KEY, namespaces.getNamespaceKey("Kategorie:Stadt"));
        assertEquals(Namespaces.CATEGORY_NAMESPACE_KEY, namespaces.getNamespaceKey(":Category:Stadt"));
        assertEquals(Namespaces.FILE_NAMESPACE_KEY, namespaces.getNamespaceKey("bild:Foo.jpg"));
        assertEquals(Namespaces.MAIN_NAMESPACE_KEY, namespaces.getNamespaceKey("Berlin"));
        assertEquals(-1, namespaces.getNamespaceKey("Spezial:Suche"));
    }

    /**
     * Test method for {@link Namespaces#isNamespace(String, int)}.
     */
    @Test
    public void testIsNamespace() {
        assertTrue(namespaces.isNamespace("Vorlage", Namespaces.TEMPLATE_NAMESPACE_KEY));
        assertTrue(namespaces.isNamespace("template", Namespaces.TEMPLATE_NAMESPACE_KEY));
        assertFalse(namespaces.isNamespace("Kategorie", Namespaces.TEMPLATE_NAMESPACE_KEY));
    }

    /**
     * Test method for {@link Namespaces#getPrefix(int)}.
     */
    @Test
    public void testGetPrefix() {
        assertEquals("Kategorie", namespaces.getPrefix(Namespaces.CATEGORY_NAMESPACE_KEY));
        assertEquals("", namespaces.getPrefix(Namespaces.MAIN_NAMESPACE_KEY));
        // not in the site info, canonical name
        assertEquals("Help", namespaces.getPrefix(12));
        assertEquals("", namespaces.getPrefix(4711));
    }
}
