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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.aarddict.tools.wiki.tree.WikiNode;
import org.jsoup.nodes.Element;

/**
 * Collects the footnotes (<tt>&lt;ref&gt;</tt>) of an article, numbers them
 * per group and renders the note lists (<tt>&lt;references/&gt;</tt>).
 * 
 * A tracker is bound to the rendering of a single article.
 */
public class ReferenceTracker {
    /**
     * Text of a back-link from a note to its marker.
     */
    public static final String BACKLINK_TEXT = "↑";

    /**
     * Writes the children of a tree node into an element.
     */
    public static interface ChildWriter {
        /**
         * Writes all children of <tt>node</tt> into <tt>parent</tt>.
         * 
         * @param node
         *            the node whose children to write
         * @param parent
         *            the element to write into
         */
        void writeChildren(WikiNode node, Element parent);
    }

    /**
     * Position of the first occurrence of a named reference and the number of
     * occurrences so far.
     */
    private static class NamedReference {
        final int first;
        int count;

        NamedReference(int first) {
            this.first = first;
            this.count = 0;
        }
    }

    private final Map<String, List<WikiNode>> references = new HashMap<String, List<WikiNode>>();
    private final Map<String, Map<String, NamedReference>> namedRefs = new HashMap<String, Map<String, NamedReference>>();

    /**
     * Registers a reference and creates its inline marker.
     * 
     * @param ref
     *            a node of kind {@link org.aarddict.tools.wiki.tree.NodeKind#REFERENCE}
     * 
     * @return the marker
     */
    public ReferenceMarker register(WikiNode ref) {
        String group = ref.getAttribute("group", "");
        List<WikiNode> groupReferences = getReferences(group);
        String name = normaliseName(ref.getAttribute("name", null));
        if (name != null) {
            Map<String, NamedReference> groupNamedRefs = getNamedRefs(group);
            NamedReference named = groupNamedRefs.get(name);
            if (named == null) {
                groupReferences.add(ref);
                named = new NamedReference(groupReferences.size());
                groupNamedRefs.put(name, named);
            }
            int occurrence = named.count;
            ++named.count;
            return new ReferenceMarker(group, named.first, occurrence);
        } else {
            groupReferences.add(ref);
            return new ReferenceMarker(group, groupReferences.size(), -1);
        }
    }

    /**
     * Gets the number of times a named reference occurred so far.
     * 
     * @param group
     *            the reference group
     * @param name
     *            the reference name
     * 
     * @return the number of occurrences, <tt>0</tt> if unknown
     */
    public int getOccurrenceCount(String group, String name) {
        Map<String, NamedReference> groupNamedRefs = namedRefs.get(group);
        if (groupNamedRefs == null) {
            return 0;
        }
        NamedReference named = groupNamedRefs.get(normaliseName(name));
        return named == null ? 0 : named.count;
    }

    /**
     * Renders and consumes the notes collected for a group.
     * 
     * @param group
     *            the reference group
     * @param writer
     *            writes the content of each note
     * 
     * @return an ordered list of notes or <tt>null</tt> if the group has no
     *         (more) references
     */
    public Element renderList(String group, ChildWriter writer) {
        List<WikiNode> groupReferences = references.remove(group);
        if (groupReferences == null || groupReferences.isEmpty()) {
            return null;
        }
        Map<String, NamedReference> groupNamedRefs = getNamedRefs(group);
        Element ol = new Element("ol");
        for (int i = 0; i < groupReferences.size(); ++i) {
            WikiNode ref = groupReferences.get(i);
            String noteId = makeNoteId(group, i + 1);
            Element li = ol.appendElement("li").attr("id", noteId);
            Element b = li.appendElement("b");
            String name = normaliseName(ref.getAttribute("name", null));
            NamedReference named = name == null ? null : groupNamedRefs.get(name);
            if (named != null && named.count > 1) {
                b.appendText(BACKLINK_TEXT + " ");
                Element sup = b.appendElement("sup");
                for (int j = 0; j < named.count; ++j) {
                    appendBacklink(sup, "_r" + noteId + "_" + j, String.valueOf(j + 1));
                    sup.appendText(" ");
                }
            } else if (named != null) {
                appendBacklink(b, "_r" + noteId + "_0", BACKLINK_TEXT);
            } else {
                appendBacklink(b, "_r" + noteId, BACKLINK_TEXT);
            }
            li.appendText(" ");
            writer.writeChildren(ref, li);
        }
        return ol;
    }

    private static void appendBacklink(Element parent, String refId, String text) {
        parent.appendElement("a")
                .attr("href", "#" + refId)
                .attr("onClick", "return s('" + refId + "')")
                .text(text);
    }

    /**
     * Creates the id of a note in a reference list.
     * 
     * @param group
     *            the reference group
     * @param num
     *            the (1-based) number of the note
     * 
     * @return the note id
     */
    public static String makeNoteId(String group, int num) {
        return "_n" + group + "_" + num;
    }

    private static String normaliseName(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        return name.replace(' ', '_');
    }

    private List<WikiNode> getReferences(String group) {
        List<WikiNode> result = references.get(group);
        if (result == null) {
            result = new ArrayList<WikiNode>();
            references.put(group, result);
        }
        return result;
    }

    private Map<String, NamedReference> getNamedRefs(String group) {
        Map<String, NamedReference> result = namedRefs.get(group);
        if (result == null) {
            result = new HashMap<String, NamedReference>();
            namedRefs.put(group, result);
        }
        return result;
    }

    /**
     * The inline marker of a registered reference.
     */
    public static class ReferenceMarker {
        private final String group;
        private final int sequenceNumber;
        private final int occurrence;

        /**
         * @param group
         *            the reference group
         * @param sequenceNumber
         *            the (1-based) number of the note the marker points to
         * @param occurrence
         *            index of this occurrence of a named reference,
         *            <tt>-1</tt> for unnamed references
         */
        ReferenceMarker(String group, int sequenceNumber, int occurrence) {
            this.group = group;
            this.sequenceNumber = sequenceNumber;
            this.occurrence = occurrence;
        }

        /**
         * @return the reference group
         */
        public String getGroup() {
            return group;
        }

        /**
         * @return the (1-based) number of the note the marker points to
         */
        public int getSequenceNumber() {
            return sequenceNumber;
        }

        /**
         * @return index of this occurrence of a named reference, <tt>-1</tt>
         *         for unnamed references
         */
        public int getOccurrence() {
            return occurrence;
        }

        /**
         * @return the id of the note this marker points to
         */
        public String getNoteId() {
            return makeNoteId(group, sequenceNumber);
        }

        /**
         * @return the id of the marker itself, target of the note's back-link
         */
        public String getBacklinkId() {
            if (occurrence < 0) {
                return "_r" + getNoteId();
            }
            return "_r" + getNoteId() + "_" + occurrence;
        }

        /**
         * @return the marker text, e.g. <tt>[1]</tt> or <tt>[note 2]</tt>
         */
        public String getText() {
            return "[" + (group + " " + sequenceNumber).trim() + "]";
        }

        /**
         * Creates the anchor element shown in the article text.
         * 
         * @return the marker element
         */
        public Element toAnchor() {
            return new Element("a")
                    .attr("id", getBacklinkId())
                    .attr("href", "#")
                    .attr("onClick", "return s('" + getNoteId() + "')")
                    .text(getText());
        }
    }
}
