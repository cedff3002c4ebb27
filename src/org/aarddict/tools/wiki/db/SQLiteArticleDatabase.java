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

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.almworks.sqlite4java.SQLiteConnection;
import com.almworks.sqlite4java.SQLiteException;
import com.almworks.sqlite4java.SQLiteStatement;

/**
 * Article database backed by an SQLite file with the following table:
 * 
 * <pre>
 * <code>
 * CREATE TABLE page (
 *   page_id INTEGER PRIMARY KEY,
 *   page_namespace INTEGER NOT NULL,
 *   page_title TEXT NOT NULL UNIQUE,
 *   page_len INTEGER NOT NULL,
 *   page_text TEXT
 * );
 * </code>
 * </pre>
 * 
 * <tt>page_title</tt> holds the full, normalised title including the
 * namespace prefix. An SQLite connection may only be used by the thread that
 * opened it, so every worker needs its own instance.
 */
public class SQLiteArticleDatabase implements ArticleDatabase {
    private static final Logger log = LoggerFactory.getLogger(SQLiteArticleDatabase.class);

    private final String fileName;
    private final SQLiteConnection db;
    private final SQLiteStatement stmtGetText;
    private final SQLiteStatement stmtGetSize;

    /**
     * Opens the given database file read-only.
     * 
     * @param fileName
     *            the name of the DB file
     * @param cacheSize
     *            cache size in bytes, <tt>null</tt> for the SQLite default
     * 
     * @throws IOException
     *             if the connection fails or a pragma could not be set
     */
    public SQLiteArticleDatabase(String fileName, Long cacheSize) throws IOException {
        this.fileName = fileName;
        try {
            this.db = openDB(fileName, cacheSize);
            this.stmtGetText = db.prepare("SELECT page_text FROM page WHERE page_title == ?;");
            this.stmtGetSize = db.prepare("SELECT page_len FROM page WHERE page_title == ?;");
        } catch (SQLiteException e) {
            throw new IOException("cannot open article database " + fileName, e);
        }
    }

    /**
     * Opens a read-only connection to a database and sets some default
     * PRAGMAs for better performance in our case.
     * 
     * @param fileName
     *            the name of the DB file
     * @param cacheSize
     *            cache size in bytes, <tt>null</tt> for the SQLite default
     * 
     * @return the DB connection
     * 
     * @throws SQLiteException
     *             if the connection fails or a pragma could not be set
     */
    static SQLiteConnection openDB(String fileName, Long cacheSize) throws SQLiteException {
        SQLiteConnection db = new SQLiteConnection(new File(fileName));
        db.openReadonly();
        // set cache_size:
        if (cacheSize != null) {
            final SQLiteStatement stmt = db.prepare("PRAGMA page_size;");
            try {
                if (stmt.step()) {
                    long pageSize = stmt.columnLong(0);
                    db.exec("PRAGMA cache_size = " + (cacheSize / pageSize) + ";");
                }
            } finally {
                stmt.dispose();
            }
        }
        db.exec("PRAGMA case_sensitive_like = true;");
        db.exec("PRAGMA temp_store = MEMORY;");
        return db;
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.db.ArticleDatabase#get(java.lang.String)
     */
    @Override
    public String get(String title) throws IOException {
        try {
            stmtGetText.reset();
            stmtGetText.bind(1, title);
            if (stmtGetText.step() && !stmtGetText.columnNull(0)) {
                return stmtGetText.columnString(0);
            }
            return null;
        } catch (SQLiteException e) {
            throw new IOException("cannot read page " + title + " from " + fileName, e);
        } finally {
            resetQuietly(stmtGetText);
        }
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.db.ArticleDatabase#getSize(java.lang.String)
     */
    @Override
    public long getSize(String title) throws IOException {
        try {
            stmtGetSize.reset();
            stmtGetSize.bind(1, title);
            if (stmtGetSize.step()) {
                return stmtGetSize.columnLong(0);
            }
            return -1;
        } catch (SQLiteException e) {
            throw new IOException("cannot read size of page " + title + " from " + fileName, e);
        } finally {
            resetQuietly(stmtGetSize);
        }
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.db.ArticleDatabase#contains(java.lang.String)
     */
    @Override
    public boolean contains(String title) throws IOException {
        return getSize(title) >= 0;
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.db.ArticleDatabase#titles()
     */
    @Override
    public Iterator<String> titles() throws IOException {
        final Iterator<TitleSize> it = titlesWithSize();
        return new Iterator<String>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public String next() {
                return it.next().getTitle();
            }

            @Override
            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.db.ArticleDatabase#titlesWithSize()
     */
    @Override
    public Iterator<TitleSize> titlesWithSize() throws IOException {
        try {
            return new TitleIterator(db.prepare(
                    "SELECT page_title, page_len FROM page WHERE page_namespace == 0 ORDER BY page_id;"));
        } catch (SQLiteException e) {
            throw new IOException("cannot list articles of " + fileName, e);
        }
    }

    /* (non-Javadoc)
     * @see java.io.Closeable#close()
     */
    @Override
    public void close() {
        stmtGetText.dispose();
        stmtGetSize.dispose();
        db.dispose();
    }

    private void resetQuietly(SQLiteStatement stmt) {
        try {
            stmt.reset();
        } catch (SQLiteException e) {
            log.warn("cannot reset statement on " + fileName, e);
        }
    }

    /**
     * Steps lazily through the rows of a title query and disposes the
     * statement once all rows have been read.
     */
    private class TitleIterator implements Iterator<TitleSize> {
        private final SQLiteStatement stmt;
        private TitleSize nextRow = null;
        private boolean done = false;

        TitleIterator(SQLiteStatement stmt) {
            this.stmt = stmt;
        }

        @Override
        public boolean hasNext() {
            if (nextRow == null && !done) {
                try {
                    if (stmt.step()) {
                        nextRow = new TitleSize(stmt.columnString(0), stmt.columnLong(1));
                    } else {
                        done = true;
                        stmt.dispose();
                    }
                } catch (SQLiteException e) {
                    done = true;
                    stmt.dispose();
                    throw new DatabaseException("cannot list articles of " + fileName, e);
                }
            }
            return nextRow != null;
        }

        @Override
        public TitleSize next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TitleSize result = nextRow;
            nextRow = null;
            return result;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException();
        }
    }
}
