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

import java.io.Closeable;

import org.aarddict.tools.wiki.ConvertException;
import org.aarddict.tools.wiki.EmptyArticleException;
import org.aarddict.tools.wiki.data.ConversionResult;

/**
 * Converts articles one at a time. Instances are confined to one thread.
 */
public interface ArticleConverter extends Closeable {
    /**
     * Converts a single article.
     * 
     * @param title
     *            the article title
     * 
     * @return the conversion result
     * 
     * @throws EmptyArticleException
     *             if the article has no content
     * @throws ConvertException
     *             if the conversion fails for any other reason
     */
    ConversionResult convert(String title) throws ConvertException;
}
