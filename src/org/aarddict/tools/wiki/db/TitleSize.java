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

/**
 * An article title together with the size of its raw text.
 */
public class TitleSize {
    private final String title;
    private final long size;

    /**
     * @param title
     *            the article title
     * @param size
     *            size of the raw text in bytes
     */
    public TitleSize(String title, long size) {
        this.title = title;
        this.size = size;
    }

    /**
     * @return the article title
     */
    public String getTitle() {
        return title;
    }

    /**
     * @return size of the raw text in bytes
     */
    public long getSize() {
        return size;
    }
}
