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
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Pattern;

import org.aarddict.tools.wiki.data.LanguageLink;
import org.aarddict.tools.wiki.tree.NodeKind;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.apache.commons.codec.binary.Base64;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a parsed article to the XHTML subset understood by Aard Dictionary.
 * 
 * Every node kind is mapped to a {@link NodeWriter}; kinds without an own
 * writer but with an HTML tag are written as plain elements. A renderer may be
 * reused for several articles but not concurrently: all per-article state is
 * reset by {@link #render(WikiNode)}.
 */
public class ArticleRenderer implements ReferenceTracker.ChildWriter {
    private static final Logger log = LoggerFactory.getLogger(ArticleRenderer.class);

    private static final Pattern VALID_ATTRIBUTE = Pattern.compile("[a-zA-Z_][-a-zA-Z0-9_.]*");

    /**
     * Writes a single kind of node.
     */
    protected static interface NodeWriter {
        /**
         * @param node
         *            the node to write
         * @return what was written
         */
        WriteResult write(WikiNode node);
    }

    private final ContentFilter filter;
    private final MathRenderer mathRenderer;
    private final boolean rtl;
    private final Map<NodeKind, NodeWriter> writers = new EnumMap<NodeKind, NodeWriter>(NodeKind.class);
    private final NodeWriter genericWriter;

    private ReferenceTracker references;
    private int namedLinkCount;
    private List<LanguageLink> languageLinks;

    /**
     * Creates a new renderer.
     * 
     * @param filter
     *            elements to drop
     * @param mathRenderer
     *            renderer for TeX formulas
     * @param rtl
     *            whether the article is written right-to-left
     */
    public ArticleRenderer(ContentFilter filter, MathRenderer mathRenderer, boolean rtl) {
        this.filter = filter;
        this.mathRenderer = mathRenderer;
        this.rtl = rtl;
        this.genericWriter = new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return writeGenericElement(node);
            }
        };
        registerWriters();
    }

    /**
     * Renders an article.
     * 
     * @param article
     *            the root of the parsed article
     * 
     * @return the serialised article and the language links found in it
     */
    public RenderedArticle render(WikiNode article) {
        references = new ReferenceTracker();
        namedLinkCount = 1;
        languageLinks = new ArrayList<LanguageLink>();

        Document document = new Document("");
        document.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset("UTF-8")
                .prettyPrint(false);
        write(article, document);
        Element root = document.children().first();
        if (root == null) {
            root = document.appendElement("div");
        }
        if (rtl) {
            root.attr("dir", "rtl");
        }
        RenderedArticle result = new RenderedArticle(root.outerHtml(),
                new ArrayList<String>(), languageLinks);
        references = null;
        languageLinks = null;
        return result;
    }

    /**
     * Writes a node and (depending on its writer's result) its children into
     * the given parent.
     * 
     * @param node
     *            the node to write
     * @param parent
     *            the element to write into
     */
    protected void write(WikiNode node, Element parent) {
        if (node.getKind() == NodeKind.TEXT) {
            if (node.getCaption() != null) {
                parent.appendText(node.getCaption());
            }
            return;
        }
        NodeWriter writer = writers.get(node.getKind());
        if (writer == null) {
            writer = genericWriter;
        }
        WriteResult result = writer.write(node);
        switch (result.getMode()) {
            case SUPPRESSED:
                break;
            case ELEMENT:
                parent.appendChild(result.getElement());
                writeChildren(node, result.getElement());
                break;
            case ELEMENT_WITHOUT_CHILDREN:
                parent.appendChild(result.getElement());
                break;
        }
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.render.ReferenceTracker.ChildWriter#writeChildren(org.aarddict.tools.wiki.tree.WikiNode, org.jsoup.nodes.Element)
     */
    @Override
    public void writeChildren(WikiNode node, Element parent) {
        for (WikiNode child : node.getChildren()) {
            write(child, parent);
        }
    }

    private void registerWriters() {
        writers.put(NodeKind.ARTICLE, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element e = new Element("div");
                e.appendElement("h1").text(nullToEmpty(node.getCaption()));
                return WriteResult.element(e);
            }
        });
        writers.put(NodeKind.CHAPTER, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element e = new Element("div");
                e.appendElement("h1").text(nullToEmpty(node.getCaption()));
                return WriteResult.element(e);
            }
        });
        writers.put(NodeKind.SECTION, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return writeSection(node);
            }
        });
        writers.put(NodeKind.CAPTION, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.element(new Element("span"));
            }
        });
        // avoids block elements nested in p
        writers.put(NodeKind.PARAGRAPH, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.element(new Element("div"));
            }
        });

        NodeWriter linkWriter = new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element a = new Element("a").attr("href", nullToEmpty(node.getCaption()));
                if (!node.hasChildren()) {
                    a.text(nullToEmpty(node.getCaption()));
                }
                return WriteResult.element(a);
            }
        };
        writers.put(NodeKind.ARTICLE_LINK, linkWriter);
        writers.put(NodeKind.INTERWIKI_LINK, linkWriter);
        writers.put(NodeKind.NAMESPACE_LINK, linkWriter);
        writers.put(NodeKind.SPECIAL_LINK, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element a = new Element("a").attr("href", node.getAttribute("href", "#"));
                if (!node.hasChildren()) {
                    a.text(nullToEmpty(node.getCaption()));
                }
                return WriteResult.element(a);
            }
        });
        writers.put(NodeKind.URL, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element a = new Element("a")
                        .attr("href", nullToEmpty(node.getCaption()))
                        .attr("class", "mwx.link.external");
                if (!node.hasChildren()) {
                    a.text(nullToEmpty(node.getCaption()));
                }
                return WriteResult.element(a);
            }
        });
        writers.put(NodeKind.NAMED_URL, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element a = new Element("a").attr("href", nullToEmpty(node.getCaption()));
                if (!node.hasChildren()) {
                    a.text("[" + namedLinkCount + "]");
                    ++namedLinkCount;
                }
                return WriteResult.element(a);
            }
        });
        writers.put(NodeKind.LANGUAGE_LINK, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                languageLinks.add(new LanguageLink(node.getAttribute("namespace", ""),
                        nullToEmpty(node.getCaption())));
                return WriteResult.suppressed();
            }
        });

        NodeWriter elided = new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.suppressed();
            }
        };
        writers.put(NodeKind.CATEGORY_LINK, elided);
        writers.put(NodeKind.IMAGE_LINK, elided);
        writers.put(NodeKind.IMAGE_MAP, elided);
        writers.put(NodeKind.GALLERY, elided);

        writers.put(NodeKind.MATH, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return writeMath(node);
            }
        });
        writers.put(NodeKind.TIMELINE, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.elementWithoutChildren(
                        placeholder("application/mediawiki-timeline", node.getCaption(), "Timeline"));
            }
        });
        writers.put(NodeKind.HIERO, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.elementWithoutChildren(
                        placeholder("application/mediawiki-hiero", node.getCaption(), "Hiero"));
            }
        });
        writers.put(NodeKind.REFERENCE, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                return WriteResult.elementWithoutChildren(references.register(node).toAnchor());
            }
        });
        writers.put(NodeKind.REFERENCE_LIST, new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element ol = references.renderList(node.getAttribute("group", ""), ArticleRenderer.this);
                if (ol == null) {
                    return WriteResult.suppressed();
                }
                return WriteResult.elementWithoutChildren(ol);
            }
        });

        writers.put(NodeKind.OVERLINE, styledSpan("o"));
        writers.put(NodeKind.UNDERLINE, styledSpan("u"));
        writers.put(NodeKind.CENTER, styledSpan("center"));
        writers.put(NodeKind.SOURCE, plainElement("code", null));
        writers.put(NodeKind.STRIKE, plainElement("del", null));
        writers.put(NodeKind.BLOCKQUOTE, plainElement("blockquote", null));
        writers.put(NodeKind.INDENTED, plainElement("blockquote", "indent"));
    }

    private static NodeWriter styledSpan(String cssClass) {
        return plainElement("span", cssClass);
    }

    private static NodeWriter plainElement(final String tag, final String cssClass) {
        return new NodeWriter() {
            @Override
            public WriteResult write(WikiNode node) {
                Element e = new Element(tag);
                if (cssClass != null) {
                    e.attr("class", cssClass);
                }
                return WriteResult.element(e);
            }
        };
    }

    private WriteResult writeSection(WikiNode node) {
        Element e = new Element("div");
        int level = Math.min(6, Math.max(2, node.getLevel() + 2));
        Element h = e.appendElement("h" + level);
        List<WikiNode> children = node.getChildren();
        int first = 0;
        if (!children.isEmpty() && children.get(0).getKind() == NodeKind.CAPTION) {
            writeChildren(children.get(0), h);
            first = 1;
        }
        for (int i = first; i < children.size(); ++i) {
            write(children.get(i), e);
        }
        return WriteResult.elementWithoutChildren(e);
    }

    private WriteResult writeMath(WikiNode node) {
        String tex = nullToEmpty(node.getCaption());
        Element e;
        try {
            byte[] png = mathRenderer.renderPng(tex);
            e = new Element("img")
                    .attr("src", "data:image/png;base64," + Base64.encodeBase64String(png))
                    .attr("class", "tex");
        } catch (Exception ex) {
            log.warn("Failed to render math \"" + tex + "\"", ex);
            e = new Element("span").attr("class", "tex").text(tex);
        }
        return WriteResult.elementWithoutChildren(e);
    }

    private static Element placeholder(String type, String source, String label) {
        Element object = new Element("object")
                .attr("type", type)
                .attr("src", "data:text/plain;charset=utf-8," + nullToEmpty(source));
        object.appendElement("em").text(label);
        return object;
    }

    private WriteResult writeGenericElement(WikiNode node) {
        String tag = node.getKind().getTag();
        if (tag == null) {
            tag = "span";
        }
        if (filter.isSuppressed(node)) {
            return WriteResult.suppressed();
        }
        Element e = new Element(tag);
        for (Entry<String, String> attribute : node.getAttributes().entrySet()) {
            String name = attribute.getKey();
            if (VALID_ATTRIBUTE.matcher(name).matches() && !name.toLowerCase(Locale.ROOT).startsWith("on")) {
                e.attr(name, attribute.getValue());
            }
        }
        return WriteResult.element(e);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
