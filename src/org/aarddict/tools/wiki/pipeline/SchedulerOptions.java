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

/**
 * Settings of a {@link BatchScheduler} run.
 */
public class SchedulerOptions {
    /**
     * Number of worker threads.
     */
    private int processes = Runtime.getRuntime().availableProcessors();
    /**
     * Time to wait for the next result before the pool is replaced (in
     * milliseconds).
     */
    private long timeoutMillis = 600 * 1000;
    /**
     * How often a title that was being converted when the pool timed out is
     * dispatched again before it is reported as failed.
     */
    private int timeoutRetries = 0;
    /**
     * Number of titles dispatched to one pool.
     */
    private int chunkSize = 10000;
    /**
     * Index of the first title to convert.
     */
    private long start = 0;
    /**
     * Index after the last title to convert, negative for all titles.
     */
    private long end = -1;
    /**
     * Stop after this many articles (not counting redirects), <tt>0</tt> for
     * no limit.
     */
    private int articleCount = 0;
    /**
     * Convert everything on the calling thread.
     */
    private boolean sequential = false;

    /**
     * @return the number of worker threads
     */
    public int getProcesses() {
        return processes;
    }

    /**
     * @param processes
     *            the number of worker threads (at least 1)
     */
    public void setProcesses(int processes) {
        if (processes < 1) {
            throw new IllegalArgumentException("need at least one worker, got " + processes);
        }
        this.processes = processes;
    }

    /**
     * @return the time to wait for the next result (in milliseconds)
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * @param timeoutMillis
     *            the time to wait for the next result (in milliseconds)
     */
    public void setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * @return how often a title in progress during a timeout is retried
     */
    public int getTimeoutRetries() {
        return timeoutRetries;
    }

    /**
     * @param timeoutRetries
     *            how often a title in progress during a timeout is retried
     */
    public void setTimeoutRetries(int timeoutRetries) {
        if (timeoutRetries < 0) {
            throw new IllegalArgumentException("timeout retries must not be negative, got " + timeoutRetries);
        }
        this.timeoutRetries = timeoutRetries;
    }

    /**
     * @return the number of titles dispatched to one pool
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * @param chunkSize
     *            the number of titles dispatched to one pool
     */
    public void setChunkSize(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be positive, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * @return the index of the first title to convert
     */
    public long getStart() {
        return start;
    }

    /**
     * @param start
     *            the index of the first title to convert
     */
    public void setStart(long start) {
        this.start = Math.max(0, start);
    }

    /**
     * @return the index after the last title to convert, negative for all
     */
    public long getEnd() {
        return end;
    }

    /**
     * @param end
     *            the index after the last title to convert, negative for all
     */
    public void setEnd(long end) {
        this.end = end;
    }

    /**
     * @return the number of articles after which to stop, <tt>0</tt> for no
     *         limit
     */
    public int getArticleCount() {
        return articleCount;
    }

    /**
     * @param articleCount
     *            the number of articles after which to stop, <tt>0</tt> for
     *            no limit
     */
    public void setArticleCount(int articleCount) {
        this.articleCount = Math.max(0, articleCount);
    }

    /**
     * @return whether to convert on the calling thread
     */
    public boolean isSequential() {
        return sequential;
    }

    /**
     * @param sequential
     *            whether to convert on the calling thread
     */
    public void setSequential(boolean sequential) {
        this.sequential = sequential;
    }
}
