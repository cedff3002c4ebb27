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
package org.aarddict.tools.wiki.bliki;

import info.bliki.wiki.tags.HTMLTag;
import info.bliki.wiki.tags.util.INoBodyParsingTag;

/**
 * A tag whose body is not parsed as wiki markup, e.g. <tt>&lt;math&gt;</tt>.
 */
public class RawBodyTag extends HTMLTag implements INoBodyParsingTag {
    /**
     * @param name
     *            the tag name
     */
    public RawBodyTag(String name) {
        super(name);
    }

    /* (non-Javadoc)
     * @see info.bliki.htmlcleaner.TagNode#clone()
     */
    @Override
    public Object clone() {
        return new RawBodyTag(getName());
    }
}
