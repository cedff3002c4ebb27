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

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.regex.Pattern;

import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.aarddict.tools.wiki.pipeline.RedirectResolver;
import org.aarddict.tools.wiki.pipeline.WikiParseException;
import org.aarddict.tools.wiki.pipeline.WikiParser;
import org.aarddict.tools.wiki.render.ContentFilter;
import org.aarddict.tools.wiki.tree.WikiNode;

/**
 * {@link WikiParser} based on the bliki engine: the markup (with templates
 * expanded from the database) is converted to HTML by an
 * {@link AardWikiModel} and a {@link MarkerConverter} and the result is turned
 * into a document tree by a {@link HtmlTreeBuilder}.
 */
public class BlikiWikiParser implements WikiParser {
    /**
     * Magic words that only switch page behaviour and never produce output.
     */
    static final Set<String> BEHAVIOUR_SWITCHES = new HashSet<String>(Arrays.asList(
            "notoc", "forcetoc", "toc", "noeditsection", "newsectionlink",
            "nonewsectionlink", "nogallery", "hiddencat", "nocontentconvert",
            "nocc", "notitleconvert", "notc", "index", "noindex",
            "staticredirect"));

    private final Namespaces namespaces;
    private final ContentFilter filter;
    private final RedirectResolver redirects;
    private final Set<String> languagePrefixes;
    private final HtmlTreeBuilder treeBuilder;

    /**
     * Creates a new parser.
     * 
     * @param namespaces
     *            the site's namespaces
     * @param filter
     *            content filters (for excluded pages)
     * @param redirects
     *            redirect detection for template redirects
     * @param languagePrefixes
     *            interwiki prefixes denoting other language editions
     */
    public BlikiWikiParser(Namespaces namespaces, ContentFilter filter,
            RedirectResolver redirects, Set<String> languagePrefixes) {
        this.namespaces = namespaces;
        this.filter = filter;
        this.redirects = redirects;
        this.languagePrefixes = languagePrefixes;
        this.treeBuilder = new HtmlTreeBuilder(namespaces);
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.WikiParser#parse(java.lang.String, java.lang.String, org.aarddict.tools.wiki.db.ArticleDatabase, java.lang.String, java.util.Map)
     */
    @Override
    public WikiNode parse(String title, String rawText, ArticleDatabase db,
            String language, Map<String, List<String>> magicWords) throws WikiParseException {
        String text = stripBehaviourSwitches(rawText, magicWords);
        AardWikiModel model = new AardWikiModel(db, namespaces, filter,
                redirects, languagePrefixes);
        String html;
        try {
            model.setPageName(title);
            html = model.render(new MarkerConverter(), text, false);
        } catch (Exception e) {
            throw new WikiParseException("cannot parse " + title, e);
        }
        if (html == null) {
            throw new WikiParseException("cannot parse " + title, null);
        }
        return treeBuilder.build(title, html);
    }

    /**
     * Removes behaviour switches (e.g. <tt>__NOTOC__</tt>) in all their
     * localised forms.
     * 
     * @param text
     *            raw wiki markup
     * @param magicWords
     *            magic word ids mapped to their aliases
     * 
     * @return the markup without behaviour switches
     */
    static String stripBehaviourSwitches(String text, Map<String, List<String>> magicWords) {
        if (text.indexOf("__") < 0) {
            return text;
        }
        String result = text;
        for (Entry<String, List<String>> word : magicWords.entrySet()) {
            if (!BEHAVIOUR_SWITCHES.contains(word.getKey())) {
                continue;
            }
            for (String alias : word.getValue()) {
                if (alias.startsWith("__") && alias.endsWith("__") && alias.length() > 4) {
                    result = Pattern.compile(Pattern.quote(alias), Pattern.CASE_INSENSITIVE
                            | Pattern.UNICODE_CASE).matcher(result).replaceAll("");
                }
            }
        }
        return result;
    }
}
