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
package org.aarddict.tools.wiki.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.aarddict.tools.wiki.render.ArticleRenderer;
import org.aarddict.tools.wiki.render.ContentFilter;

/**
 * Everything a worker needs to convert articles. A context is built once when
 * a worker starts and belongs to that worker alone; only the configuration it
 * was built from is shared (read-only).
 */
public class WorkerContext implements Closeable {
    private final ArticleDatabase db;
    private final WikiParser parser;
    private final ArticleRenderer renderer;
    private final ContentFilter filter;
    private final RedirectResolver redirects;
    private final String language;
    private final Map<String, List<String>> magicWords;

    /**
     * Creates a new worker context.
     * 
     * @param db
     *            the worker's own database connection
     * @param parser
     *            the markup parser
     * @param renderer
     *            the worker's renderer
     * @param filter
     *            content filters
     * @param redirects
     *            redirect detection
     * @param language
     *            the wiki's language code
     * @param magicWords
     *            the site's magic words
     */
    public WorkerContext(ArticleDatabase db, WikiParser parser,
            ArticleRenderer renderer, ContentFilter filter,
            RedirectResolver redirects, String language,
            Map<String, List<String>> magicWords) {
        this.db = db;
        this.parser = parser;
        this.renderer = renderer;
        this.filter = filter;
        this.redirects = redirects;
        this.language = language;
        this.magicWords = Collections.unmodifiableMap(magicWords);
    }

    /**
     * @return the worker's database connection
     */
    public ArticleDatabase getDb() {
        return db;
    }

    /**
     * @return the markup parser
     */
    public WikiParser getParser() {
        return parser;
    }

    /**
     * @return the worker's renderer
     */
    public ArticleRenderer getRenderer() {
        return renderer;
    }

    /**
     * @return the content filters
     */
    public ContentFilter getFilter() {
        return filter;
    }

    /**
     * @return the redirect detection
     */
    public RedirectResolver getRedirects() {
        return redirects;
    }

    /**
     * @return the wiki's language code
     */
    public String getLanguage() {
        return language;
    }

    /**
     * @return the site's magic words
     */
    public Map<String, List<String>> getMagicWords() {
        return magicWords;
    }

    /**
     * Closes the worker's database connection.
     * 
     * @throws IOException
     *             if closing the database fails
     */
    @Override
    public void close() throws IOException {
        db.close();
    }
}
