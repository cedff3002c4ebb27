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

import org.aarddict.tools.wiki.ConvertException;
import org.aarddict.tools.wiki.EmptyArticleException;
import org.aarddict.tools.wiki.data.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What happened to a single dispatched title: converted, empty or failed.
 */
public class ConversionOutcome {
    private static final Logger log = LoggerFactory.getLogger(ConversionOutcome.class);

    /**
     * Outcome classes.
     */
    public static enum Status {
        /**
         * The article (or redirect) was converted.
         */
        CONVERTED,
        /**
         * The article has no content.
         */
        EMPTY,
        /**
         * The conversion failed.
         */
        FAILED
    }

    private final String title;
    private final Status status;
    private final ConversionResult result;

    private ConversionOutcome(String title, Status status, ConversionResult result) {
        this.title = title;
        this.status = status;
        this.result = result;
    }

    /**
     * Runs a converter on a title and classifies the result.
     * 
     * @param converter
     *            the converter to use
     * @param title
     *            the title to convert
     * 
     * @return the outcome
     */
    public static ConversionOutcome convert(ArticleConverter converter, String title) {
        try {
            return new ConversionOutcome(title, Status.CONVERTED, converter.convert(title));
        } catch (EmptyArticleException e) {
            return empty(title);
        } catch (ConvertException e) {
            return failed(title);
        } catch (RuntimeException e) {
            log.error("Converter failed on " + title, e);
            return failed(title);
        }
    }

    /**
     * @param title
     *            the article title
     * @return an outcome for an empty article
     */
    public static ConversionOutcome empty(String title) {
        return new ConversionOutcome(title, Status.EMPTY, null);
    }

    /**
     * @param title
     *            the article title
     * @return an outcome for a failed article
     */
    public static ConversionOutcome failed(String title) {
        return new ConversionOutcome(title, Status.FAILED, null);
    }

    /**
     * @return the dispatched title
     */
    public String getTitle() {
        return title;
    }

    /**
     * @return the outcome class
     */
    public Status getStatus() {
        return status;
    }

    /**
     * @return the conversion result, <tt>null</tt> unless
     *         {@link Status#CONVERTED}
     */
    public ConversionResult getResult() {
        return result;
    }
}
