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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.aarddict.tools.wiki.BadRedirectException;
import org.aarddict.tools.wiki.data.Namespaces;

/**
 * Detects redirect directives like <tt>#REDIRECT [[Target]]</tt> using the
 * (localised) aliases of the site's redirect magic word.
 */
public class RedirectResolver {
    private final List<String> aliases;
    private final Namespaces namespaces;

    /**
     * Creates a resolver.
     * 
     * @param aliases
     *            redirect aliases including their case variants, tried in
     *            this order
     * @param namespaces
     *            used to normalise redirect targets, may be <tt>null</tt> to
     *            return targets as written
     */
    public RedirectResolver(Collection<String> aliases, Namespaces namespaces) {
        this.aliases = Collections.unmodifiableList(new ArrayList<String>(aliases));
        this.namespaces = namespaces;
    }

    /**
     * Extracts the normalised target of a redirect.
     * 
     * @param text
     *            the raw article text
     * 
     * @return the full target title or <tt>null</tt> if the text is no
     *         redirect
     * 
     * @throws BadRedirectException
     *             if the text starts with a redirect alias but no link follows
     */
    public String getRedirect(String text) throws BadRedirectException {
        String target = parseRedirect(text, aliases);
        if (target == null || target.isEmpty()) {
            return null;
        }
        if (namespaces != null) {
            return namespaces.getFqName(target);
        }
        return target;
    }

    /**
     * Extracts the target of a redirect as written in the text. The first
     * alias the text starts with (exactly or after upper-casing the text)
     * wins.
     * 
     * @param text
     *            the raw article text
     * @param aliases
     *            redirect aliases
     * 
     * @return the text between <tt>[[</tt> and <tt>]]</tt> or <tt>null</tt>
     *         if the text does not start with any alias
     * 
     * @throws BadRedirectException
     *             if the text starts with an alias but <tt>[[</tt> or
     *             <tt>]]</tt> is missing
     */
    public static String parseRedirect(String text, Collection<String> aliases) throws BadRedirectException {
        String upper = null;
        for (String alias : aliases) {
            boolean matches = text.startsWith(alias);
            if (!matches) {
                if (upper == null) {
                    upper = text.toUpperCase(Locale.ROOT);
                }
                matches = upper.startsWith(alias);
            }
            if (matches) {
                String rest = stripLeading(text.substring(Math.min(alias.length(), text.length())));
                int begin = rest.indexOf("[[");
                if (begin < 0) {
                    throw new BadRedirectException(rest);
                }
                int end = rest.indexOf("]]");
                if (end < 0) {
                    throw new BadRedirectException(rest);
                }
                if (end < begin + 2) {
                    return "";
                }
                return rest.substring(begin + 2, end);
            }
        }
        return null;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            ++i;
        }
        return s.substring(i);
    }
}
