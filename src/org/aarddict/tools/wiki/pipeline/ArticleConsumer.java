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

/**
 * Receives the outcome of every article of a conversion run, e.g. to write
 * them into a dictionary.
 * 
 * Methods are only called from the thread running the {@link BatchScheduler}.
 */
public interface ArticleConsumer {
    /**
     * Adds a metadata entry.
     * 
     * @param key
     *            the metadata key
     * @param value
     *            the value (a string, number, collection or JSON object)
     * 
     * @throws IOException
     *             if the entry cannot be stored
     */
    void addMetadata(String key, Object value) throws IOException;

    /**
     * Adds a converted article or a redirect.
     * 
     * @param title
     *            the article title
     * @param payload
     *            the serialised article
     * @param redirect
     *            whether the article is a redirect
     * @param counted
     *            <tt>false</tt> for redirects synthesised from language links
     *            which do not correspond to an article of the wiki
     * @param size
     *            size of the raw article text in bytes
     * 
     * @throws IOException
     *             if the article cannot be stored
     */
    void addArticle(String title, String payload, boolean redirect,
            boolean counted, long size) throws IOException;

    /**
     * Reports an article without content.
     * 
     * @param title
     *            the article title
     * 
     * @throws IOException
     *             if the report cannot be stored
     */
    void emptyArticle(String title) throws IOException;

    /**
     * Reports an article that could not be converted.
     * 
     * @param title
     *            the article title
     * 
     * @throws IOException
     *             if the report cannot be stored
     */
    void failArticle(String title) throws IOException;

    /**
     * Reports that the worker pool did not deliver a result in time and is
     * being replaced.
     * 
     * @param activeWorkers
     *            number of workers that were busy at that time
     * 
     * @throws IOException
     *             if the report cannot be stored
     */
    void timedOut(int activeWorkers) throws IOException;
}
