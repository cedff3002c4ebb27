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

import java.util.List;
import java.util.Map;

import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.aarddict.tools.wiki.tree.WikiNode;

/**
 * Parses wiki markup into a document tree.
 */
public interface WikiParser {
    /**
     * Parses an article.
     * 
     * @param title
     *            the article title
     * @param rawText
     *            the article's wiki markup
     * @param db
     *            database to fetch templates from
     * @param language
     *            the wiki's language code
     * @param magicWords
     *            the site's magic words
     * 
     * @return the root node (of kind
     *         {@link org.aarddict.tools.wiki.tree.NodeKind#ARTICLE})
     * 
     * @throws WikiParseException
     *             if the markup cannot be parsed
     */
    WikiNode parse(String title, String rawText, ArticleDatabase db,
            String language, Map<String, List<String>> magicWords) throws WikiParseException;
}
