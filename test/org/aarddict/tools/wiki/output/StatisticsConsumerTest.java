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

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;

import org.aarddict.tools.wiki.pipeline.RecordingConsumer;
import org.junit.Test;

/**
 * Unit test for the {@link StatisticsConsumer} class.
 */
public class StatisticsConsumerTest {

    /**
     * Test method for {@link StatisticsConsumer#getStatus()}.
     */
    @Test
    public void testCounters() throws IOException {
        RecordingConsumer delegate = new RecordingConsumer();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        StatisticsConsumer stats = new StatisticsConsumer(delegate, new PrintStream(bytes, true, "UTF-8"), 0, 10);
        stats.start();
        stats.addMetadata("title", "Wikipedia");
        stats.addArticle("A", "[]", false, true, 1);
        stats.addArticle("B", "[]", false, true, 1);
        stats.addArticle("R", "[]", true, true, 1);
        stats.addArticle("L", "[]", true, false, 0);
        stats.emptyArticle("E");
        stats.failArticle("F");
        stats.timedOut(3);

        assertEquals(5, stats.getProcessed());
        assertEquals(2, stats.getArticles());
        assertEquals(1, stats.getRedirects());
        assertEquals(1, stats.getLanguageLinkRedirects());
        assertEquals(1, stats.getEmpty());
        assertEquals(1, stats.getFailed());
        assertEquals(1, stats.getTimeouts());
        assertEquals("processed 5/10: 2 articles, 1 redirects, 1 language links, 1 empty, 1 failed, 1 timeouts",
                stats.getStatus());

        // everything is passed on
        assertEquals("Wikipedia", delegate.metadata.get("title"));
        assertEquals(4, delegate.added.size());
        assertEquals(1, delegate.empty.size());
        assertEquals(1, delegate.failed.size());
        assertEquals(Integer.valueOf(3), delegate.timeouts.get(0));

        String out = bytes.toString("UTF-8");
        assertTrue(out, out.contains("worker pool timed out (3 active workers)"));
    }

    /**
     * Test method for {@link StatisticsConsumer#printSummary()}.
     */
    @Test
    public void testProgressAndSummary() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        StatisticsConsumer stats = new StatisticsConsumer(new RecordingConsumer(),
                new PrintStream(bytes, true, "UTF-8"), 2, -1);
        stats.start();
        stats.addArticle("A", "[]", false, true, 1);
        stats.addArticle("B", "[]", false, true, 1);
        stats.addArticle("C", "[]", false, true, 1);
        stats.end();
        stats.printSummary();

        String out = bytes.toString("UTF-8");
        assertTrue(out, out.startsWith("processed 2: 2 articles"));
        assertTrue(out, out.contains("processed 3: 3 articles"));
        assertTrue(out, out.contains("Finished conversion ("));
        assertTrue(out, out.contains(" pages/s)"));
    }
}
