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

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.aarddict.tools.wiki.ConvertException;
import org.aarddict.tools.wiki.EmptyArticleException;
import org.aarddict.tools.wiki.data.ArticlePayload;
import org.aarddict.tools.wiki.data.ConversionResult;
import org.aarddict.tools.wiki.data.LanguageLink;
import org.aarddict.tools.wiki.data.TestData;
import org.aarddict.tools.wiki.db.MapArticleDatabase;
import org.junit.Test;

/**
 * Unit test for the {@link BatchScheduler} class.
 */
public class BatchSchedulerTest {

    /**
     * Creates converters which decide by the title's prefix what happens:
     * <tt>Empty</tt>, <tt>Fail</tt>, <tt>Redirect</tt> and <tt>Hang</tt>
     * (blocks the first time until interrupted).
     */
    private static class StubFactory implements ConverterFactory {
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final AtomicBoolean hung = new AtomicBoolean(false);

        @Override
        public ArticleConverter create() {
            created.incrementAndGet();
            return new ArticleConverter() {
                @Override
                public ConversionResult convert(String title) throws ConvertException {
                    if (title.startsWith("Empty")) {
                        throw new EmptyArticleException(title);
                    } else if (title.startsWith("Fail")) {
                        throw new ConvertException(title);
                    } else if (title.startsWith("Redirect")) {
                        return ConversionResult.redirect(title, "Target", 10);
                    } else if (title.startsWith("Hang") && hung.compareAndSet(false, true)) {
                        try {
                            Thread.sleep(60000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        throw new ConvertException(title);
                    }
                    List<LanguageLink> links = Collections.emptyList();
                    if (title.equals("Paris")) {
                        links = Arrays.asList(new LanguageLink("en", "en:Paris, France"),
                                new LanguageLink("fr", "fr:Paris"));
                    }
                    return new ConversionResult(title,
                            ArticlePayload.article("<div>" + title + "</div>", Collections.<String>emptyList()),
                            false, links, title.length());
                }

                @Override
                public void close() throws IOException {
                    closed.incrementAndGet();
                }
            };
        }
    }

    /**
     * Creates converters which block on every title until their thread is
     * interrupted.
     */
    private static class BlockingFactory implements ConverterFactory {
        final CountDownLatch started;
        final CountDownLatch interrupted;

        BlockingFactory(int workers) {
            started = new CountDownLatch(workers);
            interrupted = new CountDownLatch(workers);
        }

        @Override
        public ArticleConverter create() {
            return new ArticleConverter() {
                @Override
                public ConversionResult convert(String title) throws ConvertException {
                    started.countDown();
                    try {
                        Thread.sleep(60000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    throw new ConvertException(title);
                }

                @Override
                public void close() throws IOException {
                }
            };
        }
    }

    private static List<String> titles(String prefix, int count) {
        List<String> result = new ArrayList<String>(count);
        for (int i = 0; i < count; ++i) {
            result.add(prefix + i);
        }
        return result;
    }

    private static SchedulerOptions pooled(int processes) {
        SchedulerOptions options = new SchedulerOptions();
        options.setProcesses(processes);
        options.setTimeoutMillis(30000);
        return options;
    }

    private static SchedulerOptions sequential() {
        SchedulerOptions options = new SchedulerOptions();
        options.setSequential(true);
        return options;
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)} without
     * worker pool.
     */
    @Test
    public void testRunSequential() throws Exception {
        StubFactory factory = new StubFactory();
        RecordingConsumer consumer = new RecordingConsumer();
        BatchScheduler scheduler = new BatchScheduler(factory, consumer,
                LanguageLinkResolver.disabled(), sequential());
        scheduler.run(Arrays.asList("Alpha", "Empty1", "Fail1", "Redirect1", "Beta").iterator());

        assertEquals("html", consumer.metadata.get("article_format"));
        assertEquals(Arrays.asList("Alpha", "Redirect1", "Beta"), consumer.countedTitles());
        assertEquals(Arrays.asList("Alpha", "Beta"), consumer.articleTitles());
        assertEquals(Arrays.asList("Empty1"), consumer.empty);
        assertEquals(Arrays.asList("Fail1"), consumer.failed);
        assertEquals(2, scheduler.getRealArticleCount());
        assertEquals(0, scheduler.getPoolGeneration());
        assertEquals(1, factory.created.get());
        assertEquals(1, factory.closed.get());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, start
     * and end select a slice of the titles.
     */
    @Test
    public void testRunSlice() throws Exception {
        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = sequential();
        options.setStart(2);
        options.setEnd(5);
        new BatchScheduler(new StubFactory(), consumer, LanguageLinkResolver.disabled(), options)
                .run(titles("T", 10).iterator());
        assertEquals(Arrays.asList("T2", "T3", "T4"), consumer.countedTitles());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, every
     * title is reported exactly once.
     */
    @Test
    public void testRunPooled() throws Exception {
        List<String> titles = titles("Article", 80);
        titles.addAll(titles("Empty", 10));
        titles.addAll(titles("Fail", 5));
        titles.addAll(titles("Redirect", 5));

        StubFactory factory = new StubFactory();
        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = pooled(4);
        options.setChunkSize(7);
        BatchScheduler scheduler = new BatchScheduler(factory, consumer,
                LanguageLinkResolver.disabled(), options);
        scheduler.run(titles.iterator());

        List<String> reported = consumer.allReported();
        assertEquals(titles.size(), reported.size());
        assertEquals(new HashSet<String>(titles), new HashSet<String>(reported));
        assertEquals(80, scheduler.getRealArticleCount());
        assertEquals(10, consumer.empty.size());
        assertEquals(5, consumer.failed.size());
        assertTrue(consumer.timeouts.isEmpty());
        assertTrue(factory.created.get() >= 1);
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, a hung
     * worker is replaced and its title retried.
     */
    @Test(timeout = 30000)
    public void testRunTimeoutRetry() throws Exception {
        List<String> titles = titles("Article", 5);
        titles.add(2, "Hang");

        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = pooled(2);
        options.setTimeoutMillis(500);
        options.setTimeoutRetries(1);
        BatchScheduler scheduler = new BatchScheduler(new StubFactory(), consumer,
                LanguageLinkResolver.disabled(), options);
        scheduler.run(titles.iterator());

        assertEquals(1, consumer.timeouts.size());
        assertEquals(2, scheduler.getPoolGeneration());
        assertEquals(new HashSet<String>(titles), new HashSet<String>(consumer.articleTitles()));
        assertEquals(titles.size(), consumer.articleTitles().size());
        assertTrue(consumer.failed.isEmpty());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, a title
     * timing out more often than allowed is failed.
     */
    @Test(timeout = 30000)
    public void testRunTimeoutGiveUp() throws Exception {
        List<String> titles = titles("Article", 5);
        titles.add("Hang");

        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = pooled(2);
        options.setTimeoutMillis(500);
        BatchScheduler scheduler = new BatchScheduler(new StubFactory(), consumer,
                LanguageLinkResolver.disabled(), options);
        scheduler.run(titles.iterator());

        assertEquals(1, consumer.timeouts.size());
        assertEquals(Arrays.asList("Hang"), consumer.failed);
        assertEquals(5, consumer.articleTitles().size());
        assertFalse(consumer.articleTitles().contains("Hang"));
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, the run
     * ends once the requested number of articles was added.
     */
    @Test
    public void testRunArticleCount() throws Exception {
        List<String> titles = new ArrayList<String>();
        for (int i = 0; i < 20; ++i) {
            titles.add("Redirect" + i);
            titles.add("Article" + i);
        }
        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = pooled(3);
        options.setChunkSize(10);
        options.setArticleCount(5);
        BatchScheduler scheduler = new BatchScheduler(new StubFactory(), consumer,
                LanguageLinkResolver.disabled(), options);
        scheduler.run(titles.iterator());

        assertEquals(5, scheduler.getRealArticleCount());
        assertEquals(5, consumer.articleTitles().size());
        assertTrue(consumer.allReported().size() < titles.size());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)} without
     * worker pool and an article count.
     */
    @Test
    public void testRunSequentialArticleCount() throws Exception {
        RecordingConsumer consumer = new RecordingConsumer();
        SchedulerOptions options = sequential();
        options.setArticleCount(3);
        BatchScheduler scheduler = new BatchScheduler(new StubFactory(), consumer,
                LanguageLinkResolver.disabled(), options);
        scheduler.run(titles("Article", 10).iterator());
        assertEquals(Arrays.asList("Article0", "Article1", "Article2"), consumer.articleTitles());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)}, language
     * links become uncounted redirects.
     */
    @Test
    public void testRunLanguageLinks() throws Exception {
        MapArticleDatabase db = new MapArticleDatabase().put("Paris", "'''Paris'''");
        LanguageLinkResolver resolver = new LanguageLinkResolver(
                new HashSet<String>(Arrays.asList("en")), db, TestData.namespaces());
        RecordingConsumer consumer = new RecordingConsumer();
        BatchScheduler scheduler = new BatchScheduler(new StubFactory(), consumer,
                resolver, sequential());
        scheduler.run(Arrays.asList("Paris").iterator());

        assertEquals(2, consumer.added.size());
        RecordingConsumer.Added link = consumer.added.get(1);
        assertEquals("Paris, France", link.title);
        assertTrue(link.redirect);
        assertFalse(link.counted);
        assertEquals("Paris", ArticlePayload.parse(link.payload).getRedirectTarget());
        assertEquals(1, scheduler.getRealArticleCount());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)},
     * interrupting the calling thread terminates the worker pool and
     * propagates the interruption.
     */
    @Test
    public void testRunInterrupted() throws Exception {
        final BlockingFactory factory = new BlockingFactory(2);
        final RecordingConsumer consumer = new RecordingConsumer();
        final BatchScheduler scheduler = new BatchScheduler(factory, consumer,
                LanguageLinkResolver.disabled(), pooled(2));
        final AtomicReference<Throwable> thrown = new AtomicReference<Throwable>();
        Thread runner = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    scheduler.run(titles("Article", 10).iterator());
                } catch (Throwable e) {
                    thrown.set(e);
                }
            }
        });
        runner.start();
        assertTrue(factory.started.await(10, TimeUnit.SECONDS));
        runner.interrupt();
        runner.join(10000);

        assertFalse(runner.isAlive());
        assertTrue(String.valueOf(thrown.get()), thrown.get() instanceof InterruptedException);
        assertTrue(factory.interrupted.await(10, TimeUnit.SECONDS));
        assertTrue(consumer.articleTitles().isEmpty());
        assertEquals(1, scheduler.getPoolGeneration());
    }

    /**
     * Test method for {@link BatchScheduler#run(java.util.Iterator)} without
     * worker pool, an interruption stops before the next title.
     */
    @Test
    public void testRunSequentialInterrupted() throws Exception {
        final AtomicInteger closed = new AtomicInteger();
        ConverterFactory factory = new ConverterFactory() {
            @Override
            public ArticleConverter create() {
                return new ArticleConverter() {
                    @Override
                    public ConversionResult convert(String title) throws ConvertException {
                        if (title.equals("Stop")) {
                            Thread.currentThread().interrupt();
                        }
                        return new ConversionResult(title,
                                ArticlePayload.article("<div>" + title + "</div>", Collections.<String>emptyList()),
                                false, Collections.<LanguageLink>emptyList(), title.length());
                    }

                    @Override
                    public void close() throws IOException {
                        closed.incrementAndGet();
                    }
                };
            }
        };
        RecordingConsumer consumer = new RecordingConsumer();
        BatchScheduler scheduler = new BatchScheduler(factory, consumer,
                LanguageLinkResolver.disabled(), sequential());
        try {
            scheduler.run(Arrays.asList("Alpha", "Stop", "Beta").iterator());
            fail("InterruptedException expected");
        } catch (InterruptedException e) {
            assertEquals(Arrays.asList("Alpha", "Stop"), consumer.articleTitles());
            assertEquals(1, closed.get());
        } finally {
            Thread.interrupted();
        }
    }
}
