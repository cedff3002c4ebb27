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

import info.bliki.htmlcleaner.ContentToken;
import info.bliki.htmlcleaner.TagNode;
import info.bliki.wiki.filter.HTMLConverter;
import info.bliki.wiki.model.IWikiModel;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringEscapeUtils;

/**
 * HTML converter writing marker elements for the parts of an article our own
 * renderer takes care of (references, formulae, timelines, hieroglyphs and
 * language links). All other nodes are converted to HTML as usual.
 * 
 * Markers:
 * <ul>
 * <li><tt>&lt;aard-ref name="..." group="..."&gt;content&lt;/aard-ref&gt;</tt></li>
 * <li><tt>&lt;aard-references group="..."&gt;&lt;/aard-references&gt;</tt></li>
 * <li><tt>&lt;aard-math&gt;source&lt;/aard-math&gt;</tt> (same for
 * <tt>timeline</tt> and <tt>hiero</tt>)</li>
 * <li><tt>&lt;aard-langlink ns="..." target="..."&gt;&lt;/aard-langlink&gt;</tt></li>
 * </ul>
 */
public class MarkerConverter extends HTMLConverter {

    /**
     * Creates a converter that renders links.
     */
    public MarkerConverter() {
        super(false);
    }

    /* (non-Javadoc)
     * @see info.bliki.wiki.filter.HTMLConverter#nodesToText(java.util.List, java.lang.Appendable, info.bliki.wiki.model.IWikiModel)
     */
    @Override
    public void nodesToText(List<? extends Object> nodes, Appendable resultBuffer,
            IWikiModel model) throws IOException {
        if (nodes == null) {
            return;
        }
        for (Object item : nodes) {
            if (item instanceof TagNode && writeMarker((TagNode) item, resultBuffer, model)) {
                continue;
            }
            super.nodesToText(Collections.singletonList(item), resultBuffer, model);
        }
    }

    private boolean writeMarker(TagNode tag, Appendable buf, IWikiModel model) throws IOException {
        String name = tag.getName();
        if ("ref".equals(name)) {
            buf.append("<aard-ref");
            appendAttribute(buf, tag, "name");
            appendAttribute(buf, tag, "group");
            buf.append('>');
            nodesToText(tag.getChildren(), buf, model);
            buf.append("</aard-ref>");
            return true;
        } else if ("references".equals(name)) {
            buf.append("<aard-references");
            appendAttribute(buf, tag, "group");
            buf.append("></aard-references>");
            return true;
        } else if ("math".equals(name) || "timeline".equals(name) || "hiero".equals(name)) {
            buf.append("<aard-").append(name).append('>');
            buf.append(StringEscapeUtils.escapeXml10(bodyText(tag)));
            buf.append("</aard-").append(name).append('>');
            return true;
        } else if (AardWikiModel.LANGUAGE_LINK_TAG.equals(name)) {
            buf.append('<').append(name);
            appendAttribute(buf, tag, "ns");
            appendAttribute(buf, tag, "target");
            buf.append("></").append(name).append('>');
            return true;
        }
        return false;
    }

    private static void appendAttribute(Appendable buf, TagNode tag, String name) throws IOException {
        String value = tag.getAttributes().get(name);
        if (value != null) {
            buf.append(' ').append(name).append("=\"")
                    .append(StringEscapeUtils.escapeXml10(value)).append('"');
        }
    }

    /**
     * Collects the raw text of a tag's body.
     */
    static String bodyText(TagNode tag) {
        StringBuilder sb = new StringBuilder();
        appendBodyText(tag.getChildren(), sb);
        return sb.toString();
    }

    private static void appendBodyText(List<? extends Object> children, StringBuilder sb) {
        for (Object child : children) {
            if (child instanceof ContentToken) {
                sb.append(((ContentToken) child).getContent());
            } else if (child instanceof TagNode) {
                appendBodyText(((TagNode) child).getChildren(), sb);
            }
        }
    }
}
