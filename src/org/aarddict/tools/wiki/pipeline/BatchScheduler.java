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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.aarddict.tools.wiki.data.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@link ArticleConverter} over a stream of titles and reports every
 * outcome to an {@link ArticleConsumer}.
 * 
 * In pooled mode the titles are dispatched in chunks to a fixed-size pool of
 * worker threads, each owning a converter created by the
 * {@link ConverterFactory}. Results of a chunk are reported in completion
 * order. If no result arrives within the timeout, the whole pool is discarded
 * and the not yet reported titles of the chunk are dispatched to a new pool.
 * After each chunk the pool is closed and a fresh one is created for the next
 * chunk.
 * 
 * Every title of the requested slice is reported exactly once (added, empty
 * or failed) unless the run stops early because the requested number of
 * articles was reached.
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final ConverterFactory factory;
    private final ArticleConsumer consumer;
    private final LanguageLinkResolver languageLinks;
    private final SchedulerOptions options;

    private ThreadPoolExecutor pool = null;
    private CompletionService<ConversionOutcome> completion = null;
    private Map<Future<ConversionOutcome>, String> dispatched = null;
    /**
     * Titles the workers of the current pool are working on.
     */
    private Set<String> inFlight = null;
    private int poolGeneration = 0;
    private int realArticleCount = 0;

    /**
     * Creates a new scheduler.
     * 
     * @param factory
     *            creates one converter per worker
     * @param consumer
     *            receives all outcomes
     * @param languageLinks
     *            creates redirects from language links
     * @param options
     *            run settings
     */
    public BatchScheduler(ConverterFactory factory, ArticleConsumer consumer,
            LanguageLinkResolver languageLinks, SchedulerOptions options) {
        this.factory = factory;
        this.consumer = consumer;
        this.languageLinks = languageLinks;
        this.options = options;
    }

    /**
     * Converts the titles <tt>start</tt> to <tt>end</tt> of the given
     * sequence.
     * 
     * @param titles
     *            all article titles
     * 
     * @throws InterruptedException
     *             if the calling thread was interrupted; the worker pool is
     *             terminated immediately
     * @throws IOException
     *             if the consumer or the database fails
     */
    public void run(Iterator<String> titles) throws InterruptedException, IOException {
        if (options.getStart() > 0) {
            log.info("Skipping to article {}", options.getStart());
        }
        Iterator<String> slice = new TitleSlice<String>(titles, options.getStart(), options.getEnd());
        consumer.addMetadata("article_format", "html");
        realArticleCount = 0;
        poolGeneration = 0;
        if (options.isSequential()) {
            log.info("Disabling multiprocessing");
            runSequential(slice);
        } else {
            runPooled(slice);
        }
    }

    /**
     * Gets the number of articles (without redirects) added so far.
     * 
     * @return the article count of the current or last run
     */
    public int getRealArticleCount() {
        return realArticleCount;
    }

    /**
     * Gets the number of worker pools created so far.
     * 
     * @return the pool generation of the current or last run
     */
    public int getPoolGeneration() {
        return poolGeneration;
    }

    private void runSequential(Iterator<String> titles) throws InterruptedException, IOException {
        ArticleConverter converter = factory.create();
        try {
            while (titles.hasNext()) {
                if (Thread.interrupted()) {
                    throw new InterruptedException();
                }
                String title = titles.next();
                log.debug("Converting \"{}\"", title);
                if (report(ConversionOutcome.convert(converter, title))) {
                    log.info("Requested article count {} reached", options.getArticleCount());
                    return;
                }
            }
        } finally {
            converter.close();
        }
    }

    private void runPooled(Iterator<String> titles) throws InterruptedException, IOException {
        boolean graceful = false;
        try {
            List<String> chunk = nextChunk(titles);
            while (!chunk.isEmpty()) {
                if (processChunk(chunk)) {
                    log.info("Requested article count {} reached: terminating worker pool",
                            options.getArticleCount());
                    terminatePool();
                    return;
                }
                chunk = nextChunk(titles);
            }
            graceful = true;
        } catch (InterruptedException e) {
            log.error("Interrupted: terminating worker pool");
            terminatePool();
            throw e;
        } finally {
            if (graceful) {
                closePool();
            } else {
                terminatePool();
            }
        }
    }

    private List<String> nextChunk(Iterator<String> titles) {
        List<String> chunk = new ArrayList<String>(Math.min(options.getChunkSize(), 1024));
        while (chunk.size() < options.getChunkSize() && titles.hasNext()) {
            chunk.add(titles.next());
        }
        return chunk;
    }

    /**
     * Converts all titles of a chunk.
     * 
     * @return <tt>true</tt> if the requested article count was reached
     */
    private boolean processChunk(List<String> chunk) throws InterruptedException, IOException {
        Set<String> pending = new LinkedHashSet<String>(chunk);
        Map<String, Integer> strikes = new HashMap<String, Integer>();
        if (pool == null) {
            createPool();
        }
        dispatch(pending);
        while (!pending.isEmpty()) {
            Future<ConversionOutcome> future = completion.poll(options.getTimeoutMillis(), TimeUnit.MILLISECONDS);
            if (future == null) {
                recoverFromTimeout(pending, strikes);
                continue;
            }
            ConversionOutcome outcome = getOutcome(future);
            if (outcome == null || !pending.remove(outcome.getTitle())) {
                continue;
            }
            if (report(outcome)) {
                return true;
            }
        }
        closePool();
        return false;
    }

    private ConversionOutcome getOutcome(Future<ConversionOutcome> future) throws InterruptedException {
        String title = dispatched.remove(future);
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Worker failed on " + title, e.getCause());
            return title == null ? null : ConversionOutcome.failed(title);
        } catch (CancellationException e) {
            log.error("Conversion of " + title + " was cancelled", e);
            return title == null ? null : ConversionOutcome.failed(title);
        }
    }

    /**
     * Discards the current pool, fails titles that got stuck too often and
     * dispatches the remaining titles of the chunk to a new pool.
     */
    private void recoverFromTimeout(Set<String> pending, Map<String, Integer> strikes) throws IOException {
        log.warn("Worker pool timed out");
        consumer.timedOut(pool.getActiveCount());
        Set<String> stuck = new HashSet<String>(inFlight);
        stuck.retainAll(pending);
        terminatePool();
        for (String title : stuck) {
            Integer count = strikes.get(title);
            int newCount = count == null ? 1 : count + 1;
            strikes.put(title, newCount);
            if (newCount > options.getTimeoutRetries()) {
                log.error("Giving up on \"{}\" after {} timeout(s)", title, newCount);
                pending.remove(title);
                consumer.failArticle(title);
            }
        }
        if (!pending.isEmpty()) {
            createPool();
            dispatch(pending);
        }
    }

    private void dispatch(Set<String> titles) {
        log.debug("Dispatching {} titles to worker pool {}", titles.size(), poolGeneration);
        final Set<String> generationInFlight = inFlight;
        for (final String title : titles) {
            Future<ConversionOutcome> future = completion.submit(new Callable<ConversionOutcome>() {
                @Override
                public ConversionOutcome call() {
                    generationInFlight.add(title);
                    try {
                        ArticleConverter converter = ConversionWorker.currentConverter();
                        if (converter == null) {
                            return ConversionOutcome.failed(title);
                        }
                        return ConversionOutcome.convert(converter, title);
                    } finally {
                        generationInFlight.remove(title);
                    }
                }
            });
            dispatched.put(future, title);
        }
    }

    /**
     * Reports an outcome and resolves the language links of converted
     * articles.
     * 
     * @return <tt>true</tt> if the requested article count was reached
     */
    private boolean report(ConversionOutcome outcome) throws IOException {
        switch (outcome.getStatus()) {
            case EMPTY:
                consumer.emptyArticle(outcome.getTitle());
                return false;
            case FAILED:
                consumer.failArticle(outcome.getTitle());
                return false;
            default:
                break;
        }
        ConversionResult result = outcome.getResult();
        consumer.addArticle(result.getTitle(), result.getPayload(),
                result.isRedirect(), true, result.getSize());
        for (ConversionResult link : languageLinks.resolve(result.getTitle(), result.getLanguageLinks())) {
            consumer.addArticle(link.getTitle(), link.getPayload(), true, false, link.getSize());
        }
        if (!result.isRedirect()) {
            ++realArticleCount;
        }
        return options.getArticleCount() > 0 && realArticleCount >= options.getArticleCount();
    }

    private void createPool() {
        ++poolGeneration;
        log.info("Creating new worker pool ({} workers, generation {})", options.getProcesses(), poolGeneration);
        pool = new ThreadPoolExecutor(options.getProcesses(), options.getProcesses(),
                0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<Runnable>(),
                new WorkerThreadFactory(poolGeneration));
        completion = new ExecutorCompletionService<ConversionOutcome>(pool);
        dispatched = new HashMap<Future<ConversionOutcome>, String>();
        inFlight = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    }

    /**
     * Closes the current pool and waits for its workers to finish.
     */
    private void closePool() throws InterruptedException {
        if (pool == null) {
            return;
        }
        ThreadPoolExecutor closing = pool;
        pool = null;
        closing.shutdown();
        boolean shutdown = false;
        while (!shutdown) {
            shutdown = closing.awaitTermination(1, TimeUnit.MINUTES);
        }
    }

    /**
     * Terminates the current pool without waiting for its workers.
     */
    private void terminatePool() {
        if (pool == null) {
            return;
        }
        log.info("Terminating current worker pool");
        pool.shutdownNow();
        pool = null;
    }

    /**
     * Creates the (daemon) worker threads of one pool generation.
     */
    private class WorkerThreadFactory implements ThreadFactory {
        private final int generation;
        private int count = 0;

        WorkerThreadFactory(int generation) {
            this.generation = generation;
        }

        @Override
        public Thread newThread(Runnable r) {
            ++count;
            ConversionWorker worker = new ConversionWorker(r,
                    "converter-" + generation + "-" + count, factory);
            worker.setDaemon(true);
            return worker;
        }
    }
}
