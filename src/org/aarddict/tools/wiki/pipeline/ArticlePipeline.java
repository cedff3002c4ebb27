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

import org.aarddict.tools.wiki.ConvertException;
import org.aarddict.tools.wiki.EmptyArticleException;
import org.aarddict.tools.wiki.data.ArticlePayload;
import org.aarddict.tools.wiki.data.ConversionResult;
import org.aarddict.tools.wiki.render.RenderedArticle;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a single article: fetches its text, detects redirects, parses and
 * renders it and applies the text replacements.
 * 
 * Every failure except an empty article is logged and reported as a plain
 * {@link ConvertException} carrying the title.
 */
public class ArticlePipeline implements ArticleConverter {
    private static final Logger log = LoggerFactory.getLogger(ArticlePipeline.class);

    private final WorkerContext context;

    /**
     * Creates a pipeline working on the given context.
     * 
     * @param context
     *            the worker's context
     */
    public ArticlePipeline(WorkerContext context) {
        this.context = context;
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConverter#convert(java.lang.String)
     */
    @Override
    public ConversionResult convert(String title) throws ConvertException {
        try {
            if (context.getFilter().isExcludedPage(title)) {
                throw new EmptyArticleException(title);
            }
            String text = context.getDb().get(title);
            if (text == null || text.isEmpty()) {
                throw new EmptyArticleException(title);
            }
            long size = context.getDb().getSize(title);

            String redirect = context.getRedirects().getRedirect(text);
            if (redirect != null) {
                return ConversionResult.redirect(title, redirect, size);
            }

            WikiNode tree = context.getParser().parse(title, text,
                    context.getDb(), context.getLanguage(), context.getMagicWords());
            RenderedArticle rendered = context.getRenderer().render(tree);
            String result = context.getFilter().applyReplacements(rendered.getText());
            return new ConversionResult(title,
                    ArticlePayload.article(stripTrailing(result), rendered.getTags()),
                    false, rendered.getLanguageLinks(), size);
        } catch (EmptyArticleException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to process article " + title, e);
            throw new ConvertException(title);
        } catch (StackOverflowError e) {
            log.error("Failed to process article " + title + " (markup nested too deeply)", e);
            throw new ConvertException(title);
        }
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            --end;
        }
        return s.substring(0, end);
    }

    /* (non-Javadoc)
     * @see java.io.Closeable#close()
     */
    @Override
    public void close() throws IOException {
        context.close();
    }
}
