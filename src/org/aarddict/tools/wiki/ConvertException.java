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
 * Signals that an article could not be converted. Always carries the title of
 * the affected article; the low-level cause is logged where it occurs and not
 * handed on to the consumer.
 */
public class ConvertException extends Exception {
    /**
     * class version for serialisation
     */
    private static final long serialVersionUID = 1L;

    private final String title;

    /**
     * Creates the exception for the given article.
     * 
     * @param title
     *            title of the article that failed
     */
    public ConvertException(String title) {
        super("ConvertException: " + title);
        this.title = title;
    }

    /**
     * Creates the exception for the given article with a custom message.
     * 
     * @param title
     *            title of the article that failed
     * @param msg
     *            message of the exception
     */
    protected ConvertException(String title, String msg) {
        super(msg);
        this.title = title;
    }

    /**
     * Gets the title of the article that failed.
     * 
     * @return the article title
     */
    public String getTitle() {
        return title;
    }
}
