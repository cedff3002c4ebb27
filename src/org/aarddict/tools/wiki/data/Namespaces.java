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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Namespace handling using a {@link SiteInfo} backend: splits titles into
 * namespace and page name and normalises them the way MediaWiki does.
 */
public class Namespaces {
    /**
     * "Real" content; articles. Has no prefix.
     */
    public static final int MAIN_NAMESPACE_KEY = 0;
    /**
     * Template pages.
     */
    public static final int TEMPLATE_NAMESPACE_KEY = 10;
    /**
     * Category description pages.
     */
    public static final int CATEGORY_NAMESPACE_KEY = 14;
    /**
     * Media description pages.
     */
    public static final int FILE_NAMESPACE_KEY = 6;

    private static final String[] CANONICAL_NAMES = { "Media", "Special",
            "", "Talk", "User", "User talk", "Project", "Project talk", "File",
            "File talk", "MediaWiki", "MediaWiki talk", "Template",
            "Template talk", "Help", "Help talk", "Category", "Category talk" };

    private final Map<Integer, String> prefixes = new HashMap<Integer, String>();
    private final Map<Integer, Boolean> firstLetterCase = new HashMap<Integer, Boolean>();
    /**
     * Lower-cased prefixes, canonical names and aliases mapped to namespace
     * keys.
     */
    private final Map<String, Integer> lookup = new HashMap<String, Integer>();

    /**
     * Creates the namespace mapping of the given site.
     * 
     * @param siteinfo
     *            the site information
     */
    public Namespaces(SiteInfo siteinfo) {
        for (int i = 0; i < CANONICAL_NAMES.length; ++i) {
            int key = i - 2;
            prefixes.put(key, CANONICAL_NAMES[i]);
            lookup.put(CANONICAL_NAMES[i].toLowerCase(Locale.ROOT), key);
        }
        for (Entry<String, Map<String, String>> ns : siteinfo.getNamespaces().entrySet()) {
            Integer key = Integer.valueOf(ns.getKey());
            String prefix = ns.getValue().get(SiteInfo.NAMESPACE_PREFIX);
            if (prefix != null) {
                prefixes.put(key, prefix);
                lookup.put(prefix.toLowerCase(Locale.ROOT), key);
            }
            String canonical = ns.getValue().get("canonical");
            if (canonical != null) {
                lookup.put(canonical.toLowerCase(Locale.ROOT), key);
            }
            firstLetterCase.put(key, !"case-sensitive".equals(ns.getValue().get(SiteInfo.NAMESPACE_CASE)));
        }
        for (Entry<String, String> alias : siteinfo.getNamespaceAliases().entrySet()) {
            lookup.put(alias.getKey().toLowerCase(Locale.ROOT), Integer.valueOf(alias.getValue()));
        }
        lookup.remove("");
    }

    /**
     * Normalises the given string, i.e. replaces underscores with spaces,
     * collapses and trims whitespace and capitalises the first letter.
     * 
     * @param value
     *            the string to normalise
     * 
     * @return a normalised string
     */
    public static String normaliseName(final String value) {
        String result = collapseWhitespace(value);
        if (result.isEmpty()) {
            return result;
        }
        int first = result.codePointAt(0);
        return new StringBuilder(result.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(result.substring(Character.charCount(first)))
                .toString();
    }

    private static String collapseWhitespace(final String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean space = false;
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            if (c == '_' || Character.isWhitespace(c)) {
                space = true;
            } else {
                if (space && sb.length() > 0) {
                    sb.append(' ');
                }
                space = false;
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Splits the given title into its namespace key and the page name inside
     * that namespace. The page name is not normalised.
     * 
     * @param title
     *            the (full) title
     * 
     * @return the namespace key and the remaining page name
     */
    public NamespacedTitle split(String title) {
        String name = title.trim();
        if (name.startsWith(":")) {
            name = name.substring(1);
        }
        int colon = name.indexOf(':');
        if (colon > 0) {
            String prefix = collapseWhitespace(name.substring(0, colon)).toLowerCase(Locale.ROOT);
            Integer key = lookup.get(prefix);
            if (key != null) {
                return new NamespacedTitle(key, name.substring(colon + 1));
            }
        }
        return new NamespacedTitle(MAIN_NAMESPACE_KEY, name);
    }

    /**
     * Gets the fully qualified, normalised name of the given title, e.g.
     * <tt>template:foo_bar</tt> becomes <tt>Template:Foo bar</tt>.
     * 
     * @param title
     *            the title to normalise
     * 
     * @return the full title
     */
    public String getFqName(String title) {
        NamespacedTitle split = split(title);
        return createFullPageName(split.getNamespace(), split.getName());
    }

    /**
     * Gets the namespace key of the given title.
     * 
     * @param title
     *            the title
     * 
     * @return a namespace key, {@link #MAIN_NAMESPACE_KEY} for articles
     */
    public int getNamespaceKey(String title) {
        return split(title).getNamespace();
    }

    /**
     * Creates the full, normalised page name of a page in a namespace.
     * 
     * @param namespace
     *            the namespace key
     * @param name
     *            the page name inside the namespace
     * 
     * @return the full title
     */
    public String createFullPageName(int namespace, String name) {
        String pageName;
        Boolean firstLetter = firstLetterCase.get(namespace);
        if (firstLetter == null || firstLetter.booleanValue()) {
            pageName = normaliseName(name);
        } else {
            pageName = collapseWhitespace(name);
        }
        String prefix = getPrefix(namespace);
        if (prefix.isEmpty()) {
            return pageName;
        }
        return prefix + ":" + pageName;
    }

    /**
     * Gets the (localised) prefix of a namespace.
     * 
     * @param namespace
     *            the namespace key
     * 
     * @return the prefix, empty for the main namespace or unknown keys
     */
    public String getPrefix(int namespace) {
        String prefix = prefixes.get(namespace);
        return prefix == null ? "" : prefix;
    }

    /**
     * Checks whether the given prefix denotes the given namespace, using the
     * localised name, the canonical name and all aliases.
     * 
     * @param prefix
     *            the prefix to check (case-insensitive)
     * @param namespace
     *            the namespace key
     * 
     * @return whether the prefix belongs to the namespace
     */
    public boolean isNamespace(String prefix, int namespace) {
        Integer key = lookup.get(collapseWhitespace(prefix).toLowerCase(Locale.ROOT));
        return key != null && key.intValue() == namespace;
    }

    /**
     * A title split into namespace key and page name.
     */
    public static class NamespacedTitle {
        private final int namespace;
        private final String name;

        /**
         * Creates a new split title.
         * 
         * @param namespace
         *            the namespace key
         * @param name
         *            the page name inside the namespace
         */
        public NamespacedTitle(int namespace, String name) {
            this.namespace = namespace;
            this.name = name;
        }

        /**
         * @return the namespace key
         */
        public int getNamespace() {
            return namespace;
        }

        /**
         * @return the page name inside the namespace
         */
        public String getName() {
            return name;
        }
    }
}
