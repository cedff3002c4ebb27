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

/**
 * Creates an {@link ArticleConverter} for each worker thread.
 */
public interface ConverterFactory {
    /**
     * Creates a new converter owned by the calling thread.
     * 
     * @return a converter
     * 
     * @throws IOException
     *             if the converter's resources (e.g. the database) cannot be
     *             opened
     */
    ArticleConverter create() throws IOException;
}
