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

/**
 * The closed set of node kinds a parsed article consists of.
 * 
 * Kinds with an {@link #getTag() HTML tag} are simple elements which are
 * rendered as that tag carrying the node's attributes.
 */
public enum NodeKind {
    /**
     * Root node of an article; its caption is the article title.
     */
    ARTICLE,
    /**
     * A top level heading (<tt>= Caption =</tt>) with its content.
     */
    CHAPTER,
    /**
     * A section; the first child holds the heading, the remaining children
     * the section content.
     */
    SECTION,
    /**
     * Holds the content of a section heading.
     */
    CAPTION,
    PARAGRAPH,
    /**
     * Plain text; the text is the node's caption.
     */
    TEXT,
    /**
     * Link to another article; the caption is the link target.
     */
    ARTICLE_LINK,
    INTERWIKI_LINK,
    NAMESPACE_LINK,
    /**
     * Link to a special page; the caption is the target, the <tt>href</tt>
     * attribute holds the URL if there is one.
     */
    SPECIAL_LINK,
    /**
     * Link to another language edition; the caption is the full target
     * including the language prefix, the <tt>namespace</tt> attribute the
     * language prefix.
     */
    LANGUAGE_LINK,
    CATEGORY_LINK,
    IMAGE_LINK,
    IMAGE_MAP,
    GALLERY,
    /**
     * A bare external link; the caption is the URL.
     */
    URL,
    /**
     * An external link with or without a description; the caption is the URL.
     */
    NAMED_URL,
    /**
     * A TeX formula; the caption is the TeX source.
     */
    MATH,
    /**
     * An EasyTimeline definition; the caption is its source.
     */
    TIMELINE,
    /**
     * A hieroglyph annotation; the caption is its source.
     */
    HIERO,
    /**
     * A footnote (<tt>&lt;ref&gt;</tt>); <tt>name</tt> and <tt>group</tt>
     * attributes as in the markup, the children are the note's content.
     */
    REFERENCE,
    /**
     * The place where the footnotes of a group are listed
     * (<tt>&lt;references/&gt;</tt>).
     */
    REFERENCE_LIST,
    TABLE("table"),
    TABLE_ROW("tr"),
    TABLE_CELL("td"),
    TABLE_HEADER_CELL("th"),
    TABLE_CAPTION("caption"),
    EMPHASIZED("em"),
    STRONG("strong"),
    SMALL("small"),
    BIG("big"),
    CITE("cite"),
    SUB("sub"),
    SUP("sup"),
    CODE("code"),
    BREAKING_RETURN("br"),
    HORIZONTAL_RULE("hr"),
    TELETYPED("tt"),
    DIV("div"),
    SPAN("span"),
    VAR("var"),
    RUBY("ruby"),
    RUBY_BASE("rb"),
    RUBY_PARENTHESES("rp"),
    RUBY_TEXT("rt"),
    DELETED("del"),
    INSERTED("ins"),
    DEFINITION_LIST("dl"),
    DEFINITION_TERM("dt"),
    DEFINITION_DESCRIPTION("dd"),
    FONT("font"),
    ITEM_LIST("ul"),
    ENUMERATION("ol"),
    ITEM("li"),
    PREFORMATTED("pre"),
    OVERLINE,
    UNDERLINE,
    SOURCE,
    CENTER,
    STRIKE,
    BLOCKQUOTE,
    INDENTED;

    private final String tag;

    private NodeKind() {
        this.tag = null;
    }

    private NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * Gets the HTML tag of a simple element kind.
     * 
     * @return the tag or <tt>null</tt> if this kind needs special treatment
     */
    public String getTag() {
        return tag;
    }

    /**
     * Checks whether this kind is rendered as a plain element with its tag.
     * 
     * @return <tt>true</tt> if {@link #getTag()} is not <tt>null</tt>
     */
    public boolean isGenericElement() {
        return tag != null;
    }
}
