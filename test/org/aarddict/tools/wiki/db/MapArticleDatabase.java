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
package org.aarddict.tools.wiki.db;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * In-memory article database. Titles without a namespace prefix (no colon)
 * count as articles.
 */
public class MapArticleDatabase implements ArticleDatabase {
    private final Map<String, String> pages = new LinkedHashMap<String, String>();
    private boolean closed = false;

    /**
     * Adds a page.
     * 
     * @param title
     *            full page title
     * @param text
     *            raw wiki text
     * 
     * @return this database
     */
    public MapArticleDatabase put(String title, String text) {
        pages.put(title, text);
        return this;
    }

    @Override
    public String get(String title) throws IOException {
        return pages.get(title);
    }

    @Override
    public long getSize(String title) throws IOException {
        String text = pages.get(title);
        return text == null ? -1 : text.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public boolean contains(String title) throws IOException {
        return pages.containsKey(title);
    }

    @Override
    public Iterator<String> titles() throws IOException {
        List<String> result = new ArrayList<String>();
        for (String title : pages.keySet()) {
            if (title.indexOf(':') < 0) {
                result.add(title);
            }
        }
        return result.iterator();
    }

    @Override
    public Iterator<TitleSize> titlesWithSize() throws IOException {
        List<TitleSize> result = new ArrayList<TitleSize>();
        for (Entry<String, String> page : pages.entrySet()) {
            if (page.getKey().indexOf(':') < 0) {
                result.add(new TitleSize(page.getKey(), getSize(page.getKey())));
            }
        }
        return result.iterator();
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * @return whether {@link #close()} was called
     */
    public boolean isClosed() {
        return closed;
    }
}
