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

import java.io.IOException;
import java.util.Set;

import org.aarddict.tools.wiki.bliki.BlikiWikiParser;
import org.aarddict.tools.wiki.data.FilterConfig;
import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.data.SiteInfo;
import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.aarddict.tools.wiki.db.SQLiteArticleDatabase;
import org.aarddict.tools.wiki.render.ArticleRenderer;
import org.aarddict.tools.wiki.render.ContentFilter;
import org.aarddict.tools.wiki.render.MathRenderer;

/**
 * Creates one {@link ArticlePipeline} per worker. Each pipeline gets its own
 * database connection, parser and renderer; only the immutable settings
 * given here are shared.
 */
public class PipelineFactory implements ConverterFactory {
    private final String dbFileName;
    private final Long cacheSize;
    private final SiteInfo siteinfo;
    private final FilterConfig filterConfig;
    private final MathRenderer mathRenderer;
    private final boolean rtl;
    private final String language;

    /**
     * Creates a new factory.
     * 
     * @param dbFileName
     *            the compiled article database
     * @param cacheSize
     *            SQLite cache size in bytes per connection, <tt>null</tt>
     *            for the default
     * @param siteinfo
     *            the site's information
     * @param filterConfig
     *            content filters
     * @param mathRenderer
     *            renders TeX formulae (shared, must be thread-safe)
     * @param rtl
     *            whether articles are written right-to-left
     * @param language
     *            the wiki's language code
     */
    public PipelineFactory(String dbFileName, Long cacheSize, SiteInfo siteinfo,
            FilterConfig filterConfig, MathRenderer mathRenderer, boolean rtl,
            String language) {
        this.dbFileName = dbFileName;
        this.cacheSize = cacheSize;
        this.siteinfo = siteinfo;
        this.filterConfig = filterConfig;
        this.mathRenderer = mathRenderer;
        this.rtl = rtl;
        this.language = language;
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ConverterFactory#create()
     */
    @Override
    public ArticleConverter create() throws IOException {
        return new ArticlePipeline(createContext(new SQLiteArticleDatabase(dbFileName, cacheSize)));
    }

    /**
     * Wires up a worker context around the given database.
     * 
     * @param db
     *            the worker's database connection (owned by the context)
     * 
     * @return a new context
     */
    WorkerContext createContext(ArticleDatabase db) {
        Namespaces namespaces = new Namespaces(siteinfo);
        ContentFilter filter = new ContentFilter(filterConfig);
        RedirectResolver redirects = new RedirectResolver(siteinfo.getRedirectAliases(), namespaces);
        Set<String> languagePrefixes = siteinfo.getLanguagePrefixes();
        BlikiWikiParser parser = new BlikiWikiParser(namespaces, filter, redirects, languagePrefixes);
        ArticleRenderer renderer = new ArticleRenderer(filter, mathRenderer, rtl);
        return new WorkerContext(db, parser, renderer, filter, redirects,
                language, siteinfo.getMagicWords());
    }
}
