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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.aarddict.tools.wiki.data.ConversionResult;
import org.aarddict.tools.wiki.data.LanguageLink;
import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.db.ArticleDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns language links into redirects: a lookup of the title an article has
 * in one of the configured other languages leads to the article, unless the
 * wiki has an own article of that name.
 */
public class LanguageLinkResolver {
    private static final Logger log = LoggerFactory.getLogger(LanguageLinkResolver.class);

    private final Set<String> languages;
    private final ArticleDatabase db;
    private final Namespaces namespaces;

    /**
     * Creates a resolver.
     * 
     * @param languages
     *            language prefixes to create redirects for
     * @param db
     *            the database, used to check whether a target exists (must
     *            belong to the scheduler's thread)
     * @param namespaces
     *            used to normalise the redirect titles
     */
    public LanguageLinkResolver(Set<String> languages, ArticleDatabase db, Namespaces namespaces) {
        this.languages = Collections.unmodifiableSet(new LinkedHashSet<String>(languages));
        this.db = db;
        this.namespaces = namespaces;
    }

    /**
     * Creates a resolver that never creates any redirect.
     * 
     * @return a resolver for an empty language set
     */
    public static LanguageLinkResolver disabled() {
        return new LanguageLinkResolver(Collections.<String>emptySet(), null, null);
    }

    /**
     * Parses a comma-separated list of language codes. Codes are trimmed and
     * lower-cased; the site's own language and empty entries are dropped.
     * 
     * @param option
     *            the list, e.g. <tt>"de, fr,ru"</tt> (may be <tt>null</tt>)
     * @param siteLanguage
     *            the wiki's own language
     * 
     * @return the language set
     */
    public static Set<String> parseLanguages(String option, String siteLanguage) {
        Set<String> result = new LinkedHashSet<String>();
        if (option == null) {
            return result;
        }
        for (String lang : option.split(",")) {
            String code = lang.trim().toLowerCase(Locale.ROOT);
            if (!code.isEmpty() && !code.equals(siteLanguage)) {
                result.add(code);
            }
        }
        return result;
    }

    /**
     * @return the configured language prefixes
     */
    public Set<String> getLanguages() {
        return languages;
    }

    /**
     * Creates the redirects for the language links of an article.
     * 
     * @param title
     *            the article the links were found in
     * @param links
     *            the article's language links
     * 
     * @return redirects from the unqualified link targets to <tt>title</tt>
     *         for all targets without an own article
     * 
     * @throws IOException
     *             if the database cannot be read
     */
    public List<ConversionResult> resolve(String title, List<LanguageLink> links) throws IOException {
        if (links == null || links.isEmpty() || languages.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> targets = new LinkedHashSet<String>();
        for (LanguageLink link : links) {
            String namespace = link.getNamespace();
            if (!languages.contains(namespace)) {
                continue;
            }
            log.debug("Language link for {}: {} ({})", title, link.getTarget(), namespace);
            String prefix = namespace + ":";
            if (!link.getTarget().startsWith(prefix)) {
                log.warn("Invalid language link \"{}\"", link.getTarget());
                continue;
            }
            String unqualified = link.getTarget().substring(prefix.length());
            if (unqualified.trim().isEmpty()) {
                log.warn("Invalid language link \"{}\"", link.getTarget());
                continue;
            }
            String fqName = namespaces.getFqName(unqualified);
            if (!db.contains(fqName)) {
                targets.add(fqName);
            }
        }
        List<ConversionResult> result = new ArrayList<ConversionResult>(targets.size());
        for (String target : targets) {
            result.add(ConversionResult.redirect(target, title, 0));
        }
        return result;
    }
}
