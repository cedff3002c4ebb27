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
package org.aarddict.tools.wiki.bliki;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.tree.NodeKind;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Builds a document tree from the HTML the {@link MarkerConverter} produces.
 * 
 * Top-level headings open sections: everything following a heading up to the
 * next heading of the same or a higher rank becomes part of its section.
 */
public class HtmlTreeBuilder {
    private static final Map<String, NodeKind> TAGS = new HashMap<String, NodeKind>();

    static {
        for (NodeKind kind : NodeKind.values()) {
            if (kind.isGenericElement()) {
                TAGS.put(kind.getTag(), kind);
            }
        }
        TAGS.put("b", NodeKind.STRONG);
        TAGS.put("i", NodeKind.EMPHASIZED);
        TAGS.put("u", NodeKind.UNDERLINE);
        TAGS.put("s", NodeKind.STRIKE);
        TAGS.put("strike", NodeKind.STRIKE);
        TAGS.put("center", NodeKind.CENTER);
        TAGS.put("source", NodeKind.SOURCE);
        TAGS.put("syntaxhighlight", NodeKind.SOURCE);
        TAGS.put("blockquote", NodeKind.BLOCKQUOTE);
        TAGS.put("p", NodeKind.PARAGRAPH);
    }

    private final Namespaces namespaces;

    /**
     * @param namespaces
     *            the site's namespaces (to classify links)
     */
    public HtmlTreeBuilder(Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * Builds the tree of an article.
     * 
     * @param title
     *            the article title
     * @param html
     *            the converted article body
     * 
     * @return a node of kind {@link NodeKind#ARTICLE}
     */
    public WikiNode build(String title, String html) {
        Document doc = Jsoup.parseBodyFragment(html);
        WikiNode article = new WikiNode(NodeKind.ARTICLE, title);
        List<WikiNode> open = new ArrayList<WikiNode>();
        List<Integer> ranks = new ArrayList<Integer>();
        open.add(article);
        ranks.add(0);
        for (Node child : doc.body().childNodes()) {
            int rank = headingRank(child);
            if (rank > 0) {
                while (ranks.get(ranks.size() - 1) >= rank) {
                    open.remove(open.size() - 1);
                    ranks.remove(ranks.size() - 1);
                }
                WikiNode section = createSection((Element) child, rank);
                open.get(open.size() - 1).add(section);
                open.add(section);
                ranks.add(rank);
            } else {
                convert(child, open.get(open.size() - 1));
            }
        }
        return article;
    }

    private static int headingRank(Node node) {
        if (!(node instanceof Element)) {
            return 0;
        }
        String tag = ((Element) node).tagName();
        if (tag.length() == 2 && tag.charAt(0) == 'h' && tag.charAt(1) >= '1' && tag.charAt(1) <= '6') {
            return tag.charAt(1) - '0';
        }
        return 0;
    }

    private WikiNode createSection(Element heading, int rank) {
        WikiNode section;
        if (rank == 1) {
            section = new WikiNode(NodeKind.CHAPTER, heading.text());
        } else {
            section = new WikiNode(NodeKind.SECTION);
            section.setLevel(rank - 2);
        }
        WikiNode caption = new WikiNode(NodeKind.CAPTION);
        convertChildren(heading, caption);
        if (rank != 1) {
            section.add(caption);
        }
        return section;
    }

    private void convertChildren(Element element, WikiNode parent) {
        for (Node child : element.childNodes()) {
            convert(child, parent);
        }
    }

    /**
     * Converts a node and adds the result to the given parent.
     */
    private void convert(Node node, WikiNode parent) {
        if (node instanceof TextNode) {
            String text = ((TextNode) node).getWholeText();
            if (!text.isEmpty()) {
                parent.add(WikiNode.text(text));
            }
            return;
        }
        if (!(node instanceof Element)) {
            // comments, data
            return;
        }
        Element e = (Element) node;
        String tag = e.tagName();
        if ("toc".equals(e.id()) || "script".equals(tag) || "style".equals(tag)) {
            return;
        }

        if ("aard-ref".equals(tag)) {
            WikiNode ref = new WikiNode(NodeKind.REFERENCE);
            copyAttribute(e, ref, "name");
            copyAttribute(e, ref, "group");
            convertChildren(e, ref);
            parent.add(ref);
        } else if ("aard-references".equals(tag)) {
            WikiNode list = new WikiNode(NodeKind.REFERENCE_LIST);
            copyAttribute(e, list, "group");
            parent.add(list);
        } else if ("aard-math".equals(tag)) {
            parent.add(new WikiNode(NodeKind.MATH, e.wholeText()));
        } else if ("aard-timeline".equals(tag)) {
            parent.add(new WikiNode(NodeKind.TIMELINE, e.wholeText()));
        } else if ("aard-hiero".equals(tag)) {
            parent.add(new WikiNode(NodeKind.HIERO, e.wholeText()));
        } else if (AardWikiModel.LANGUAGE_LINK_TAG.equals(tag)) {
            parent.add(new WikiNode(NodeKind.LANGUAGE_LINK, e.attr("target"))
                    .setAttribute("namespace", e.attr("ns")));
        } else if ("a".equals(tag)) {
            convertLink(e, parent);
        } else if ("img".equals(tag) || (("div".equals(tag) || "span".equals(tag)) && e.hasClass("thumb"))) {
            parent.add(new WikiNode(NodeKind.IMAGE_LINK, e.attr("src")));
        } else if ("ul".equals(tag) && e.hasClass("gallery")) {
            parent.add(new WikiNode(NodeKind.GALLERY));
        } else if ("tbody".equals(tag) || "thead".equals(tag) || "tfoot".equals(tag)
                || ("span".equals(tag) && e.hasClass("mw-headline"))) {
            convertChildren(e, parent);
        } else if (headingRank(e) > 0) {
            // headings nested in other elements do not open sections
            WikiNode paragraph = parent.add(new WikiNode(NodeKind.PARAGRAPH));
            convertChildren(e, paragraph.add(new WikiNode(NodeKind.STRONG)));
        } else {
            NodeKind kind = TAGS.get(tag);
            if (kind == null) {
                convertChildren(e, parent);
                return;
            }
            WikiNode result = new WikiNode(kind);
            copyAttributes(e, result);
            convertChildren(e, result);
            parent.add(result);
        }
    }

    private void convertLink(Element a, WikiNode parent) {
        if (!a.hasAttr("href")) {
            convertChildren(a, parent);
            return;
        }
        String href = a.attr("href");
        WikiNode link;
        if (a.hasClass("image")) {
            parent.add(new WikiNode(NodeKind.IMAGE_LINK, href));
            return;
        } else if (a.hasClass("interwiki")) {
            link = new WikiNode(NodeKind.INTERWIKI_LINK, href);
        } else if (a.hasClass("externallink") || isExternal(href)) {
            String text = a.text().trim();
            if (text.isEmpty() || text.matches("\\[\\d+\\]")) {
                parent.add(new WikiNode(NodeKind.NAMED_URL, href));
                return;
            } else if (text.equals(href)) {
                parent.add(new WikiNode(NodeKind.URL, href));
                return;
            }
            link = new WikiNode(NodeKind.NAMED_URL, href);
        } else if (a.hasAttr("title")) {
            String title = a.attr("title");
            int ns = namespaces.getNamespaceKey(title);
            if (ns == Namespaces.CATEGORY_NAMESPACE_KEY) {
                parent.add(new WikiNode(NodeKind.CATEGORY_LINK, title));
                return;
            } else if (ns == Namespaces.FILE_NAMESPACE_KEY || ns == -2) {
                parent.add(new WikiNode(NodeKind.IMAGE_LINK, title));
                return;
            } else if (ns == -1) {
                link = new WikiNode(NodeKind.SPECIAL_LINK, title).setAttribute("href", href);
            } else if (ns != Namespaces.MAIN_NAMESPACE_KEY) {
                link = new WikiNode(NodeKind.NAMESPACE_LINK, title);
            } else {
                link = new WikiNode(NodeKind.ARTICLE_LINK, title);
            }
        } else {
            link = new WikiNode(NodeKind.SPECIAL_LINK, a.text()).setAttribute("href", href);
        }
        convertChildren(a, link);
        parent.add(link);
    }

    private static boolean isExternal(String href) {
        return href.startsWith("http://") || href.startsWith("https://")
                || href.startsWith("ftp://") || href.startsWith("mailto:")
                || href.startsWith("//");
    }

    private static void copyAttribute(Element e, WikiNode node, String name) {
        if (e.hasAttr(name)) {
            node.setAttribute(name, e.attr(name));
        }
    }

    private static void copyAttributes(Element e, WikiNode node) {
        for (Attribute attribute : e.attributes()) {
            node.setAttribute(attribute.getKey(), attribute.getValue());
        }
    }
}
