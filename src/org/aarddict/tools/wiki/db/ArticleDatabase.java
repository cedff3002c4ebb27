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

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;

/**
 * Read access to a compiled wiki database.
 * 
 * Implementations need not be thread-safe: every worker opens its own
 * instance.
 */
public interface ArticleDatabase extends Closeable {
    /**
     * Gets the raw wiki text of a page.
     * 
     * @param title
     *            the full, normalised page title
     * 
     * @return the wiki text or <tt>null</tt> if there is no such page
     * 
     * @throws IOException
     *             if reading from the database fails
     */
    String get(String title) throws IOException;

    /**
     * Gets the size of a page's raw text in bytes.
     * 
     * @param title
     *            the full, normalised page title
     * 
     * @return the size or <tt>-1</tt> if there is no such page
     * 
     * @throws IOException
     *             if reading from the database fails
     */
    long getSize(String title) throws IOException;

    /**
     * Checks whether a page exists.
     * 
     * @param title
     *            the full, normalised page title
     * 
     * @return whether the page exists
     * 
     * @throws IOException
     *             if reading from the database fails
     */
    boolean contains(String title) throws IOException;

    /**
     * Iterates over the titles of all articles, i.e. pages in the main
     * namespace, in database order.
     * 
     * The iterator may throw a {@link DatabaseException} if reading fails
     * while iterating.
     * 
     * @return the article titles
     * 
     * @throws IOException
     *             if the query cannot be started
     */
    Iterator<String> titles() throws IOException;

    /**
     * Iterates over the titles and sizes of all articles, i.e. pages in the
     * main namespace, in database order.
     * 
     * The iterator may throw a {@link DatabaseException} if reading fails
     * while iterating.
     * 
     * @return the article titles with their sizes
     * 
     * @throws IOException
     *             if the query cannot be started
     */
    Iterator<TitleSize> titlesWithSize() throws IOException;
}
