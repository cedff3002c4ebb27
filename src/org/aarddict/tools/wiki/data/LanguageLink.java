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

/**
 * A link from an article to the equivalent article in another language
 * edition, e.g. <tt>[[de:Berlin]]</tt> with namespace <tt>de</tt> and target
 * <tt>de:Berlin</tt>.
 */
public class LanguageLink {
    private final String namespace;
    private final String target;

    /**
     * Creates a new language link.
     * 
     * @param namespace
     *            the language prefix, e.g. <tt>de</tt>
     * @param target
     *            the full link target including the language prefix
     */
    public LanguageLink(String namespace, String target) {
        this.namespace = namespace;
        this.target = target;
    }

    /**
     * @return the language prefix
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * @return the full link target including the language prefix
     */
    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LanguageLink)) {
            return false;
        }
        LanguageLink other = (LanguageLink) obj;
        return namespace.equals(other.namespace) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return 31 * namespace.hashCode() + target.hashCode();
    }

    @Override
    public String toString() {
        return "(" + namespace + ", " + target + ")";
    }
}
