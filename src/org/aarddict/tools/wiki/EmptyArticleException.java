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
 * Thrown if an article has no content at all. This is reported separately from
 * real conversion failures.
 */
public class EmptyArticleException extends ConvertException {
    /**
     * class version for serialisation
     */
    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception for the given (empty) article.
     * 
     * @param title
     *            title of the empty article
     */
    public EmptyArticleException(String title) {
        super(title, "EmptyArticleException: " + title);
    }
}
