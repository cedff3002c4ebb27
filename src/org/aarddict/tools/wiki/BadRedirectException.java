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
package org.aarddict.tools.wiki;

/**
 * Thrown if a text starts with a redirect directive but the link that should
 * follow it is malformed, i.e. <tt>[[</tt> or <tt>]]</tt> is missing.
 */
public class BadRedirectException extends ConvertException {
    /**
     * class version for serialisation
     */
    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception for the text following the redirect directive.
     * 
     * @param remainder
     *            the text after the redirect alias (leading whitespace
     *            removed)
     */
    public BadRedirectException(String remainder) {
        super(remainder, "BadRedirectException: " + remainder);
    }

    /**
     * Gets the text that followed the redirect directive.
     * 
     * @return the malformed remainder
     */
    public String getRemainder() {
        return getTitle();
    }
}
