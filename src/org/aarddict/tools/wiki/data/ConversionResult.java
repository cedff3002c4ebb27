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

import java.util.Collections;
import java.util.List;

/**
 * The outcome of converting a single article: its serialised payload and the
 * data the packager needs alongside it.
 */
public class ConversionResult {
    private final String title;
    private final String payload;
    private final boolean redirect;
    private final List<LanguageLink> languageLinks;
    private final long size;

    /**
     * Creates a new conversion result.
     * 
     * @param title
     *            the article title
     * @param payload
     *            the serialised payload (see {@link ArticlePayload})
     * @param redirect
     *            whether the article is a redirect
     * @param languageLinks
     *            language links found in the article (may be empty)
     * @param size
     *            size of the raw article text in bytes
     */
    public ConversionResult(String title, String payload, boolean redirect,
            List<LanguageLink> languageLinks, long size) {
        this.title = title;
        this.payload = payload;
        this.redirect = redirect;
        this.languageLinks = Collections.unmodifiableList(languageLinks);
        this.size = size;
    }

    /**
     * Creates a redirect result.
     * 
     * @param title
     *            the redirect's title
     * @param target
     *            the redirect target
     * @param size
     *            size of the raw article text in bytes
     * 
     * @return a redirect result without language links
     */
    public static ConversionResult redirect(String title, String target, long size) {
        return new ConversionResult(title, ArticlePayload.redirect(target),
                true, Collections.<LanguageLink>emptyList(), size);
    }

    /**
     * @return the article title
     */
    public String getTitle() {
        return title;
    }

    /**
     * @return the serialised payload
     */
    public String getPayload() {
        return payload;
    }

    /**
     * @return whether the article is a redirect
     */
    public boolean isRedirect() {
        return redirect;
    }

    /**
     * @return the language links found in the article
     */
    public List<LanguageLink> getLanguageLinks() {
        return languageLinks;
    }

    /**
     * @return size of the raw article text in bytes
     */
    public long getSize() {
        return size;
    }
}
