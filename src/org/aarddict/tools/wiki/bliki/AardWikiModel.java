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

import info.bliki.htmlcleaner.TagNode;
import info.bliki.wiki.model.Configuration;
import info.bliki.wiki.model.WikiModel;
import info.bliki.wiki.tags.HTMLTag;
import info.bliki.wiki.tags.IgnoreTag;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

import org.aarddict.tools.wiki.BadRedirectException;
import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.aarddict.tools.wiki.db.DatabaseException;
import org.aarddict.tools.wiki.pipeline.RedirectResolver;
import org.aarddict.tools.wiki.render.ContentFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wiki model fetching templates from the article database and turning links
 * to other language editions into language link markers.
 */
public class AardWikiModel extends WikiModel {
    private static final Logger log = LoggerFactory.getLogger(AardWikiModel.class);

    /**
     * Name of the element marking a language link in the converter output.
     */
    public static final String LANGUAGE_LINK_TAG = "aard-langlink";

    static {
        // BEWARE: fields in Configuration are static -> this changes all configurations!

        // not rendered anyway
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("inputbox", new IgnoreTag("inputbox"));
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("imagemap", new IgnoreTag("imagemap"));
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("gallery", new IgnoreTag("gallery"));

        // references are numbered by our renderer, keep them as plain elements
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("ref", new HTMLTag("ref"));
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("references", new HTMLTag("references"));

        // keep the bodies of these as they are
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("math", new RawBodyTag("math"));
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("timeline", new RawBodyTag("timeline"));
        Configuration.DEFAULT_CONFIGURATION.addTokenTag("hiero", new RawBodyTag("hiero"));

        TagNode.addAllowedAttribute("name");
        TagNode.addAllowedAttribute("group");
    }

    private final ArticleDatabase db;
    private final Namespaces namespaces;
    private final ContentFilter filter;
    private final RedirectResolver redirects;
    private final Set<String> languagePrefixes;

    /**
     * Creates a new wiki model for a single article.
     * 
     * @param db
     *            database to fetch templates from
     * @param namespaces
     *            the site's namespaces
     * @param filter
     *            content filters (for excluded pages)
     * @param redirects
     *            redirect detection for template redirects
     * @param languagePrefixes
     *            interwiki prefixes denoting other language editions
     */
    public AardWikiModel(ArticleDatabase db, Namespaces namespaces,
            ContentFilter filter, RedirectResolver redirects,
            Set<String> languagePrefixes) {
        super("${image}", "${title}");
        this.db = db;
        this.namespaces = namespaces;
        this.filter = filter;
        this.redirects = redirects;
        this.languagePrefixes = languagePrefixes;
        registerLanguagePrefixes(languagePrefixes);
    }

    /**
     * Makes sure bliki recognises all language prefixes of the site as
     * interwiki links.
     */
    private static synchronized void registerLanguagePrefixes(Set<String> languagePrefixes) {
        Map<String, String> interWikiMap = Configuration.DEFAULT_CONFIGURATION.getInterwikiMap();
        for (String lang : languagePrefixes) {
            if (!interWikiMap.containsKey(lang)) {
                Configuration.DEFAULT_CONFIGURATION.addInterwikiLink(lang,
                        "http://" + lang + ".wikipedia.org/wiki/${title}");
            }
        }
    }

    /* (non-Javadoc)
     * @see info.bliki.wiki.model.AbstractWikiModel#getRawWikiContent(java.lang.String, java.lang.String, java.util.Map)
     */
    @Override
    public String getRawWikiContent(String namespace, String articleName,
            Map<String, String> templateParameters) {
        // magic words
        String result = super.getRawWikiContent(namespace, articleName, templateParameters);
        if (result != null) {
            return result;
        }
        String fullName;
        if (namespace == null || namespace.isEmpty()) {
            fullName = namespaces.getFqName(articleName);
        } else {
            fullName = namespaces.getFqName(namespace + ":" + articleName);
        }
        return fetchPage(fullName, true);
    }

    private String fetchPage(String fullName, boolean followRedirect) {
        if (filter.isExcludedPage(fullName)) {
            log.debug("Not fetching excluded page \"{}\"", fullName);
            return "";
        }
        String text;
        try {
            text = db.get(fullName);
        } catch (IOException e) {
            throw new DatabaseException("cannot fetch " + fullName, e);
        }
        if (text == null || !followRedirect) {
            return text;
        }
        try {
            String target = redirects.getRedirect(text);
            if (target != null) {
                return fetchPage(target, false);
            }
        } catch (BadRedirectException e) {
            log.warn("Bad redirect in \"{}\"", fullName);
        }
        return text;
    }

    /* (non-Javadoc)
     * @see info.bliki.wiki.model.AbstractWikiModel#appendInterWikiLink(java.lang.String, java.lang.String, java.lang.String)
     */
    @Override
    public void appendInterWikiLink(String namespace, String title, String linkText) {
        if (languagePrefixes.contains(namespace)) {
            TagNode link = new TagNode(LANGUAGE_LINK_TAG);
            link.addAttribute("ns", namespace, false);
            link.addAttribute("target", title, false);
            append(link);
        } else {
            super.appendInterWikiLink(namespace, title, linkText);
        }
    }
}
