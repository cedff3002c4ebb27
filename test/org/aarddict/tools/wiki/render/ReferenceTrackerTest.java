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

import org.aarddict.tools.wiki.render.ReferenceTracker.ReferenceMarker;
import org.aarddict.tools.wiki.tree.NodeKind;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.jsoup.nodes.Element;
import org.junit.Test;

/**
 * Unit test for the {@link ReferenceTracker} class.
 */
public class ReferenceTrackerTest {

    private static final ReferenceTracker.ChildWriter TEXT_WRITER = new ReferenceTracker.ChildWriter() {
        @Override
        public void writeChildren(WikiNode node, Element parent) {
            parent.appendText(node.getText());
        }
    };

    private static WikiNode ref(String name, String group, String text) {
        WikiNode ref = new WikiNode(NodeKind.REFERENCE);
        if (name != null) {
            ref.setAttribute("name", name);
        }
        if (group != null) {
            ref.setAttribute("group", group);
        }
        if (text != null) {
            ref.add(WikiNode.text(text));
        }
        return ref;
    }

    /**
     * Test method for {@link ReferenceTracker#register(WikiNode)}.
     */
    @Test
    public void testRegisterNumbering() {
        ReferenceTracker tracker = new ReferenceTracker();
        ReferenceMarker first = tracker.register(ref(null, null, "one"));
        ReferenceMarker named = tracker.register(ref("x", null, "two"));
        ReferenceMarker again = tracker.register(ref("x", null, null));

        assertEquals(1, first.getSequenceNumber());
        assertEquals("[1]", first.getText());
        assertEquals("_n_1", first.getNoteId());
        assertEquals("_r_n_1", first.getBacklinkId());

        assertEquals(2, named.getSequenceNumber());
        assertEquals(2, again.getSequenceNumber());
        assertEquals("[2]", again.getText());
        assertEquals("_r_n_2_0", named.getBacklinkId());
        assertEquals("_r_n_2_1", again.getBacklinkId());
        assertEquals(2, tracker.getOccurrenceCount("", "x"));
    }

    /**
     * Test method for {@link ReferenceTracker#register(WikiNode)}, names
     * with spaces and underscores denote the same note.
     */
    @Test
    public void testRegisterNormalisesNames() {
        ReferenceTracker tracker = new ReferenceTracker();
        ReferenceMarker a = tracker.register(ref("some name", null, "text"));
        ReferenceMarker b = tracker.register(ref("some_name", null, null));
        assertEquals(a.getSequenceNumber(), b.getSequenceNumber());
    }

    /**
     * Test method for {@link ReferenceTracker#register(WikiNode)} with
     * groups.
     */
    @Test
    public void testRegisterGroups() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.register(ref(null, null, "plain"));
        ReferenceMarker note = tracker.register(ref(null, "note", "grouped"));
        assertEquals(1, note.getSequenceNumber());
        assertEquals("[note 1]", note.getText());
        assertEquals("_nnote_1", note.getNoteId());

        Element anchor = note.toAnchor();
        assertEquals("a", anchor.tagName());
        assertEquals("_r_nnote_1", anchor.attr("id"));
        assertEquals("return s('_nnote_1')", anchor.attr("onClick"));
        assertEquals("[note 1]", anchor.text());
    }

    /**
     * Test method for {@link ReferenceTracker#renderList(String, ReferenceTracker.ChildWriter)}.
     */
    @Test
    public void testRenderList() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.register(ref(null, null, "one"));
        tracker.register(ref("x", null, "two"));
        tracker.register(ref("x", null, null));

        Element ol = tracker.renderList("", TEXT_WRITER);
        assertNotNull(ol);
        assertEquals("ol", ol.tagName());
        assertEquals(2, ol.children().size());

        Element firstItem = ol.child(0);
        assertEquals("_n_1", firstItem.attr("id"));
        assertTrue(firstItem.text().endsWith("one"));
        assertEquals("#_r_n_1", firstItem.select("b > a").first().attr("href"));

        Element secondItem = ol.child(1);
        assertEquals("_n_2", secondItem.attr("id"));
        assertTrue(secondItem.text().endsWith("two"));
        // one back-link per occurrence
        assertEquals(2, secondItem.select("b > sup > a").size());
        assertEquals("#_r_n_2_1", secondItem.select("b > sup > a").get(1).attr("href"));

        // consumed
        assertNull(tracker.renderList("", TEXT_WRITER));
    }

    /**
     * Test method for {@link ReferenceTracker#renderList(String, ReferenceTracker.ChildWriter)}.
     */
    @Test
    public void testRenderListUnknownGroup() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.register(ref(null, null, "one"));
        assertNull(tracker.renderList("note", TEXT_WRITER));
        assertNotNull(tracker.renderList("", TEXT_WRITER));
    }
}
