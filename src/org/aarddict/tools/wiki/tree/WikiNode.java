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
package org.aarddict.tools.wiki.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a parsed article.
 * 
 * Every node has a {@link NodeKind kind}, an optional caption (text of text
 * nodes, link targets, URLs, TeX source, ...), attributes and an ordered list
 * of children. Trees are built once per article by the parser and only read
 * by the renderer.
 */
public class WikiNode {
    private final NodeKind kind;
    private String caption;
    private int level = 0;
    private final Map<String, String> attributes = new LinkedHashMap<String, String>();
    private final List<WikiNode> children = new ArrayList<WikiNode>();

    /**
     * Creates a node without caption.
     * 
     * @param kind
     *            the node kind
     */
    public WikiNode(NodeKind kind) {
        this(kind, null);
    }

    /**
     * Creates a node.
     * 
     * @param kind
     *            the node kind
     * @param caption
     *            the caption (may be <tt>null</tt>)
     */
    public WikiNode(NodeKind kind, String caption) {
        this.kind = kind;
        this.caption = caption;
    }

    /**
     * Creates a text node.
     * 
     * @param text
     *            the text
     * 
     * @return a new node of kind {@link NodeKind#TEXT}
     */
    public static WikiNode text(String text) {
        return new WikiNode(NodeKind.TEXT, text);
    }

    /**
     * @return the node kind
     */
    public NodeKind getKind() {
        return kind;
    }

    /**
     * @return the caption or <tt>null</tt>
     */
    public String getCaption() {
        return caption;
    }

    /**
     * @param caption
     *            the caption to set
     */
    public void setCaption(String caption) {
        this.caption = caption;
    }

    /**
     * Gets the nesting level of a section, <tt>0</tt> for sections started
     * with <tt>==</tt>.
     * 
     * @return the section level
     */
    public int getLevel() {
        return level;
    }

    /**
     * @param level
     *            the section level to set
     */
    public void setLevel(int level) {
        this.level = level;
    }

    /**
     * Gets an attribute.
     * 
     * @param name
     *            the attribute name
     * @param defaultValue
     *            value to return if the attribute is not set
     * 
     * @return the attribute's value
     */
    public String getAttribute(String name, String defaultValue) {
        String value = attributes.get(name);
        return value == null ? defaultValue : value;
    }

    /**
     * Sets an attribute.
     * 
     * @param name
     *            the attribute name
     * @param value
     *            the value
     * 
     * @return this node
     */
    public WikiNode setAttribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    /**
     * @return the attributes in insertion order (read-only)
     */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Gets the space-separated entries of the <tt>class</tt> attribute.
     * 
     * @return the CSS classes (may be empty)
     */
    public List<String> getClasses() {
        String classes = getAttribute("class", "").trim();
        if (classes.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<String>();
        for (String cl : classes.split("\\s+")) {
            result.add(cl);
        }
        return result;
    }

    /**
     * @return the children (read-only)
     */
    public List<WikiNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return whether this node has children
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Appends a child.
     * 
     * @param child
     *            the new last child
     * 
     * @return the child
     */
    public WikiNode add(WikiNode child) {
        children.add(child);
        return child;
    }

    /**
     * Concatenates the captions of all text nodes below this node.
     * 
     * @return the plain text content
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        if (kind == NodeKind.TEXT && caption != null) {
            sb.append(caption);
        }
        for (WikiNode child : children) {
            child.appendText(sb);
        }
    }

    @Override
    public String toString() {
        return kind + (caption == null ? "" : "(" + caption + ")") + children;
    }
}
