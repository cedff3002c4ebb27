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
package org.aarddict.tools.wiki.output;

import java.io.IOException;
import java.io.PrintStream;
import java.text.NumberFormat;
import java.util.Locale;

import org.aarddict.tools.wiki.pipeline.ArticleConsumer;

/**
 * Forwards everything to another consumer and counts the outcomes, printing
 * progress to a message stream.
 */
public class StatisticsConsumer implements ArticleConsumer {
    private final ArticleConsumer delegate;
    private final PrintStream msgOut;
    private final int reportInterval;
    private final long total;

    private long timeAtStart = 0;
    private long timeAtEnd = 0;
    private int articles = 0;
    private int redirects = 0;
    private int languageLinkRedirects = 0;
    private int empty = 0;
    private int failed = 0;
    private int timeouts = 0;

    /**
     * Creates a new statistics consumer.
     * 
     * @param delegate
     *            consumer to forward everything to
     * @param msgOut
     *            stream to print progress to
     * @param reportInterval
     *            print progress every this many reported titles, <tt>0</tt>
     *            to disable progress lines
     * @param total
     *            the expected number of titles, <tt>-1</tt> if unknown
     */
    public StatisticsConsumer(ArticleConsumer delegate, PrintStream msgOut,
            int reportInterval, long total) {
        this.delegate = delegate;
        this.msgOut = msgOut;
        this.reportInterval = reportInterval;
        this.total = total;
    }

    /**
     * Sets the time the conversion started.
     */
    public void start() {
        timeAtStart = System.currentTimeMillis();
    }

    /**
     * Sets the time the conversion finished.
     */
    public void end() {
        timeAtEnd = System.currentTimeMillis();
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#addMetadata(java.lang.String, java.lang.Object)
     */
    @Override
    public void addMetadata(String key, Object value) throws IOException {
        delegate.addMetadata(key, value);
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#addArticle(java.lang.String, java.lang.String, boolean, boolean, long)
     */
    @Override
    public void addArticle(String title, String payload, boolean redirect,
            boolean counted, long size) throws IOException {
        delegate.addArticle(title, payload, redirect, counted, size);
        if (!counted) {
            ++languageLinkRedirects;
            return;
        }
        if (redirect) {
            ++redirects;
        } else {
            ++articles;
        }
        progress();
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#emptyArticle(java.lang.String)
     */
    @Override
    public void emptyArticle(String title) throws IOException {
        delegate.emptyArticle(title);
        ++empty;
        progress();
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#failArticle(java.lang.String)
     */
    @Override
    public void failArticle(String title) throws IOException {
        delegate.failArticle(title);
        ++failed;
        progress();
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#timedOut(int)
     */
    @Override
    public void timedOut(int activeWorkers) throws IOException {
        delegate.timedOut(activeWorkers);
        ++timeouts;
        msgOut.println("worker pool timed out (" + activeWorkers + " active workers)");
    }

    private void progress() {
        if (reportInterval > 0 && getProcessed() % reportInterval == 0) {
            msgOut.println(getStatus());
        }
    }

    /**
     * @return the number of titles reported so far (without language link
     *         redirects)
     */
    public int getProcessed() {
        return articles + redirects + empty + failed;
    }

    /**
     * @return the number of converted articles
     */
    public int getArticles() {
        return articles;
    }

    /**
     * @return the number of redirects of the wiki
     */
    public int getRedirects() {
        return redirects;
    }

    /**
     * @return the number of redirects created from language links
     */
    public int getLanguageLinkRedirects() {
        return languageLinkRedirects;
    }

    /**
     * @return the number of empty articles
     */
    public int getEmpty() {
        return empty;
    }

    /**
     * @return the number of failed articles
     */
    public int getFailed() {
        return failed;
    }

    /**
     * @return the number of worker pool timeouts
     */
    public int getTimeouts() {
        return timeouts;
    }

    /**
     * Creates a one-line status of the conversion.
     * 
     * @return the status line
     */
    public String getStatus() {
        StringBuilder sb = new StringBuilder();
        sb.append("processed ").append(getProcessed());
        if (total >= 0) {
            sb.append('/').append(total);
        }
        sb.append(": ").append(articles).append(" articles, ")
                .append(redirects).append(" redirects, ")
                .append(languageLinkRedirects).append(" language links, ")
                .append(empty).append(" empty, ")
                .append(failed).append(" failed, ")
                .append(timeouts).append(" timeouts");
        return sb.toString();
    }

    /**
     * Prints the final status and the conversion speed.
     */
    public void printSummary() {
        if (timeAtEnd == 0) {
            end();
        }
        final long timeTaken = Math.max(1, timeAtEnd - timeAtStart);
        final double speed = (((double) getProcessed()) * 1000) / timeTaken;
        NumberFormat nf = NumberFormat.getNumberInstance(Locale.ENGLISH);
        nf.setGroupingUsed(true);
        msgOut.println(getStatus());
        msgOut.println("Finished conversion (" + nf.format(speed) + " pages/s)");
    }
}
