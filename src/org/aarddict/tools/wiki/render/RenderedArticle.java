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

import java.util.Collections;
import java.util.List;

import org.aarddict.tools.wiki.data.LanguageLink;

/**
 * The output of rendering one article.
 */
public class RenderedArticle {
    private final String text;
    private final List<String> tags;
    private final List<LanguageLink> languageLinks;

    /**
     * @param text
     *            the serialised XHTML
     * @param tags
     *            the article's tags
     * @param languageLinks
     *            language links found in the article
     */
    public RenderedArticle(String text, List<String> tags, List<LanguageLink> languageLinks) {
        this.text = text;
        this.tags = Collections.unmodifiableList(tags);
        this.languageLinks = Collections.unmodifiableList(languageLinks);
    }

    /**
     * @return the serialised XHTML
     */
    public String getText() {
        return text;
    }

    /**
     * @return the article's tags
     */
    public List<String> getTags() {
        return tags;
    }

    /**
     * @return the language links found in the article
     */
    public List<LanguageLink> getLanguageLinks() {
        return languageLinks;
    }
}
