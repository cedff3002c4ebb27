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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A worker thread of the {@link BatchScheduler}'s pool. Each worker creates
 * its own converter when it starts and closes it when it ends.
 */
class ConversionWorker extends Thread {
    private static final Logger log = LoggerFactory.getLogger(ConversionWorker.class);

    private final ConverterFactory factory;
    private ArticleConverter converter = null;

    /**
     * @param target
     *            the pool's worker loop
     * @param name
     *            the thread name
     * @param factory
     *            creates the worker's converter
     */
    ConversionWorker(Runnable target, String name, ConverterFactory factory) {
        super(target, name);
        this.factory = factory;
    }

    @Override
    public void run() {
        try {
            converter = factory.create();
        } catch (IOException e) {
            log.error("Cannot initialise worker " + getName(), e);
        } catch (RuntimeException e) {
            log.error("Cannot initialise worker " + getName(), e);
        }
        try {
            super.run();
        } finally {
            if (converter != null) {
                try {
                    converter.close();
                } catch (IOException e) {
                    log.warn("Cannot close converter of worker " + getName(), e);
                }
            }
        }
    }

    /**
     * Gets the converter of the calling worker thread.
     * 
     * @return the converter or <tt>null</tt> if the worker could not create
     *         one
     * 
     * @throws IllegalStateException
     *             if not called from a worker thread
     */
    static ArticleConverter currentConverter() {
        Thread current = Thread.currentThread();
        if (!(current instanceof ConversionWorker)) {
            throw new IllegalStateException("not a conversion worker: " + current.getName());
        }
        return ((ConversionWorker) current).converter;
    }
}
