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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents the site information of the wiki a database was compiled from.
 */
public class SiteInfo implements Serializable {
    /**
     * Version for serialisation.
     */
    private static final long serialVersionUID = 1L;

    protected String base;
    protected String sitename;
    protected String generator;
    protected String caseStr;
    protected String lang;
    protected String server;
    protected String rights;
    /**
     * Maps namespace keys to a map with the following two entries:
     * <ul>
     * <li><tt>{@link #NAMESPACE_PREFIX}</tt>: prefix of the namespace</li>
     * <li><tt>{@link #NAMESPACE_CASE}</tt>: case of the namespace, e.g. "first-letter"</li>
     * </ul>
     */
    protected Map<String, Map<String, String>> namespaces;
    /**
     * Maps namespace aliases to namespace keys.
     */
    protected Map<String, String> namespaceAliases;
    /**
     * Maps magic word names to their aliases.
     */
    protected Map<String, List<String>> magicWords;
    /**
     * Interwiki prefixes that denote other language editions.
     */
    protected Set<String> languagePrefixes;
    /**
     * The original JSON document this object was created from.
     */
    protected String json;

    /**
     * Key for getting the namespace prefix in the maps contained in
     * {@link #namespaces}.
     * 
     * @see #getNamespaces()
     */
    public final static String NAMESPACE_PREFIX = "prefix";

    /**
     * Key for getting the namespace case in the maps contained in
     * {@link #namespaces}.
     * 
     * @see #getNamespaces()
     */
    public final static String NAMESPACE_CASE = "case";

    /**
     * Name of the magic word holding the redirect aliases.
     */
    public final static String MAGIC_WORD_REDIRECT = "redirect";

    protected static final Pattern MATCH_WIKI_SITE_LANG = Pattern.compile("^http[s]?://([^.]+).*$");

    /**
     * Creates an empty site info object.
     */
    public SiteInfo() {
        this.base = "";
        this.sitename = "";
        this.generator = "";
        this.caseStr = "";
        this.lang = "";
        this.server = "";
        this.rights = "";
        this.namespaces = new HashMap<String, Map<String, String>>();
        this.namespaceAliases = new HashMap<String, String>();
        this.magicWords = new HashMap<String, List<String>>();
        this.languagePrefixes = new HashSet<String>();
        this.json = "{}";
    }

    /**
     * Gets the base URL of the site.
     * 
     * @return the base URL
     */
    public String getBase() {
        return base;
    }

    /**
     * Sets the base URL of the site.
     * 
     * @param base the base URL to set
     */
    public void setBase(String base) {
        this.base = base;
    }

    /**
     * Gets the language of the site. Falls back to the language extracted from
     * {@link #base} if the site info did not contain a language.
     * 
     * @return Wikipedia language code
     */
    public String getLang() {
        if (lang == null || lang.isEmpty()) {
            return extractLang();
        }
        return lang;
    }

    /**
     * Sets the language of the site.
     * 
     * @param lang the language code to set
     */
    public void setLang(String lang) {
        this.lang = lang;
    }

    /**
     * Extract the language string from {@link #base}. Assumes <tt>en</tt> if no
     * match is found.
     * 
     * @return Wikipedia language code
     * @see #getBase()
     */
    public String extractLang() {
        String result = "en";
        Matcher matcher = MATCH_WIKI_SITE_LANG.matcher(base);
        if (matcher.matches()) {
            result = matcher.group(1);
        }
        return result;
    }

    /**
     * Gets the site's name.
     * 
     * @return the sitename
     */
    public String getSitename() {
        return sitename;
    }

    /**
     * Sets the site's name.
     * 
     * @param sitename the sitename to set
     */
    public void setSitename(String sitename) {
        this.sitename = sitename;
    }

    /**
     * Gets the site's generator (MediaWiki version string).
     * 
     * @return the generator
     */
    public String getGenerator() {
        return generator;
    }

    /**
     * Sets the site's generator (MediaWiki version string).
     * 
     * @param generator the generator to set
     */
    public void setGenerator(String generator) {
        this.generator = generator;
    }

    /**
     * Gets the server URL of the site, e.g. <tt>http://en.wikipedia.org</tt>.
     * 
     * @return the server
     */
    public String getServer() {
        return server;
    }

    /**
     * Sets the server URL of the site.
     * 
     * @param server the server to set
     */
    public void setServer(String server) {
        this.server = server;
    }

    /**
     * Gets the name of the licence the site's content is published under.
     * 
     * @return the rights string
     */
    public String getRights() {
        return rights;
    }

    /**
     * Sets the name of the licence the site's content is published under.
     * 
     * @param rights the rights string to set
     */
    public void setRights(String rights) {
        this.rights = rights;
    }

    /**
     * Gets the namespace mapping.
     * 
     * @return the namespaces
     */
    public Map<String, Map<String, String>> getNamespaces() {
        return namespaces;
    }

    /**
     * Sets the namespace mapping.
     * 
     * @param namespaces the namespaces to set
     */
    public void setNamespaces(Map<String, Map<String, String>> namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * Gets the namespace alias mapping (alias to namespace key).
     * 
     * @return the namespace aliases
     */
    public Map<String, String> getNamespaceAliases() {
        return namespaceAliases;
    }

    /**
     * Sets the namespace alias mapping (alias to namespace key).
     * 
     * @param namespaceAliases the namespace aliases to set
     */
    public void setNamespaceAliases(Map<String, String> namespaceAliases) {
        this.namespaceAliases = namespaceAliases;
    }

    /**
     * Gets the magic words of the site.
     * 
     * @return a mapping of magic word names to their aliases
     */
    public Map<String, List<String>> getMagicWords() {
        return magicWords;
    }

    /**
     * Sets the magic words of the site.
     * 
     * @param magicWords a mapping of magic word names to their aliases
     */
    public void setMagicWords(Map<String, List<String>> magicWords) {
        this.magicWords = magicWords;
    }

    /**
     * Gets the aliases of the redirect magic word together with their lower
     * and upper case variants, in a stable order.
     * 
     * @return the redirect aliases (may be empty)
     */
    public List<String> getRedirectAliases() {
        List<String> aliases = magicWords.get(MAGIC_WORD_REDIRECT);
        if (aliases == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<String>(aliases.size() * 3);
        for (String alias : aliases) {
            addIfMissing(result, alias);
            addIfMissing(result, alias.toLowerCase(Locale.ROOT));
            addIfMissing(result, alias.toUpperCase(Locale.ROOT));
        }
        return result;
    }

    private static void addIfMissing(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }

    /**
     * Gets the interwiki prefixes denoting other language editions.
     * 
     * @return the language prefixes
     */
    public Set<String> getLanguagePrefixes() {
        return languagePrefixes;
    }

    /**
     * Sets the interwiki prefixes denoting other language editions.
     * 
     * @param languagePrefixes the language prefixes to set
     */
    public void setLanguagePrefixes(Set<String> languagePrefixes) {
        this.languagePrefixes = languagePrefixes;
    }

    /**
     * Gets the case option of the site.
     * 
     * @return the case
     */
    public String getCase() {
        return caseStr;
    }

    /**
     * Sets the case option of the site.
     * 
     * @param caseStr the case to set
     */
    public void setCase(String caseStr) {
        this.caseStr = caseStr;
    }

    /**
     * Gets the JSON document this site info was read from.
     * 
     * @return the JSON text
     */
    public String getJson() {
        return json;
    }

    /**
     * Sets the JSON document this site info was read from.
     * 
     * @param json the JSON text
     */
    public void setJson(String json) {
        this.json = json;
    }
}
