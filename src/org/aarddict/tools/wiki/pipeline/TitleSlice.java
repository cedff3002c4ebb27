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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A lazy view of the titles <tt>start</tt> (inclusive) to <tt>end</tt>
 * (exclusive) of another iterator.
 * 
 * @param <T>
 *            element type
 */
public class TitleSlice<T> implements Iterator<T> {
    private final Iterator<T> source;
    private final long end;
    private long position = 0;

    /**
     * Creates a slice.
     * 
     * @param source
     *            the complete sequence
     * @param start
     *            index of the first element to return
     * @param end
     *            index after the last element to return, negative for no limit
     */
    public TitleSlice(Iterator<T> source, long start, long end) {
        this.source = source;
        this.end = end;
        while (position < start && source.hasNext()) {
            source.next();
            ++position;
        }
    }

    @Override
    public boolean hasNext() {
        return (end < 0 || position < end) && source.hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ++position;
        return source.next();
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }
}
