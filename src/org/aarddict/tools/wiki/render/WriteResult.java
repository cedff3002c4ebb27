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
package org.aarddict.tools.wiki.render;

import org.jsoup.nodes.Element;

/**
 * What writing a single tree node produced.
 */
public final class WriteResult {
    /**
     * How the caller continues after a node was written.
     */
    public static enum Mode {
        /**
         * Append the element and write the node's children into it.
         */
        ELEMENT,
        /**
         * Append the element; the node's children were already taken care
         * of (or are deliberately left out).
         */
        ELEMENT_WITHOUT_CHILDREN,
        /**
         * Neither the node nor its children produce output.
         */
        SUPPRESSED
    }

    private static final WriteResult SUPPRESSED = new WriteResult(Mode.SUPPRESSED, null);

    private final Mode mode;
    private final Element element;

    private WriteResult(Mode mode, Element element) {
        this.mode = mode;
        this.element = element;
    }

    /**
     * @param element
     *            the element to append
     * @return a result whose children are written into the element
     */
    public static WriteResult element(Element element) {
        return new WriteResult(Mode.ELEMENT, element);
    }

    /**
     * @param element
     *            the element to append
     * @return a result whose children are not written
     */
    public static WriteResult elementWithoutChildren(Element element) {
        return new WriteResult(Mode.ELEMENT_WITHOUT_CHILDREN, element);
    }

    /**
     * @return a result producing no output at all
     */
    public static WriteResult suppressed() {
        return SUPPRESSED;
    }

    /**
     * @return the mode
     */
    public Mode getMode() {
        return mode;
    }

    /**
     * @return the element, <tt>null</tt> if {@link Mode#SUPPRESSED}
     */
    public Element getElement() {
        return element;
    }
}
