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

/**
 * Renders TeX formulas to images.
 */
public interface MathRenderer {
    /**
     * Renders the given formula.
     * 
     * @param tex
     *            the TeX source of the formula (without <tt>$</tt> delimiters)
     * 
     * @return the formula as a PNG image
     * 
     * @throws MathRenderException
     *             if the formula cannot be rendered
     */
    byte[] renderPng(String tex) throws MathRenderException;
}
