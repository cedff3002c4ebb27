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

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.zip.GZIPOutputStream;

import org.aarddict.tools.wiki.pipeline.ArticleConsumer;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every added article as one JSON object per line
 * (<tt>title</tt>, <tt>payload</tt>, <tt>redirect</tt>, <tt>counted</tt>,
 * <tt>size</tt>). The output is compressed if the file name ends with
 * <tt>.gz</tt> or <tt>.bz2</tt>. Metadata is collected and written to
 * <tt>&lt;output&gt;.metadata.json</tt> when the writer is closed.
 */
public class JsonLinesArticleWriter implements ArticleConsumer, Closeable {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesArticleWriter.class);

    private final File output;
    private final Writer out;
    private final JSONObject metadata = new JSONObject();

    /**
     * Opens the output file (overwriting it).
     * 
     * @param output
     *            the file to write
     * 
     * @throws IOException
     *             if the file cannot be created
     */
    public JsonLinesArticleWriter(File output) throws IOException {
        this.output = output;
        this.out = new BufferedWriter(new OutputStreamWriter(openStream(output), "UTF-8"));
    }

    private static OutputStream openStream(File file) throws IOException {
        OutputStream os = new BufferedOutputStream(new FileOutputStream(file));
        String name = file.getName();
        if (name.endsWith(".gz")) {
            return new GZIPOutputStream(os);
        } else if (name.endsWith(".bz2")) {
            return new BZip2CompressorOutputStream(os);
        } else {
            return os;
        }
    }

    /**
     * @return the file the collected metadata is written to
     */
    public File getMetadataFile() {
        return new File(output.getPath() + ".metadata.json");
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#addMetadata(java.lang.String, java.lang.Object)
     */
    @Override
    public void addMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#addArticle(java.lang.String, java.lang.String, boolean, boolean, long)
     */
    @Override
    public void addArticle(String title, String payload, boolean redirect,
            boolean counted, long size) throws IOException {
        JSONObject record = new JSONObject();
        record.put("title", title);
        record.put("payload", payload);
        record.put("redirect", redirect);
        record.put("counted", counted);
        record.put("size", size);
        out.write(record.toString());
        out.write('\n');
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#emptyArticle(java.lang.String)
     */
    @Override
    public void emptyArticle(String title) {
        log.debug("Empty article: {}", title);
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#failArticle(java.lang.String)
     */
    @Override
    public void failArticle(String title) {
        log.debug("Failed article: {}", title);
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.pipeline.ArticleConsumer#timedOut(int)
     */
    @Override
    public void timedOut(int activeWorkers) {
        log.debug("Timeout with {} active workers", activeWorkers);
    }

    /**
     * Finishes the article file and writes the metadata file.
     * 
     * @throws IOException
     *             if writing fails
     */
    @Override
    public void close() throws IOException {
        out.close();
        Writer metaOut = new OutputStreamWriter(new FileOutputStream(getMetadataFile()), "UTF-8");
        try {
            metaOut.write(metadata.toString(2));
            metaOut.write('\n');
        } finally {
            metaOut.close();
        }
    }
}
