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

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Unit test for the {@link LatexMathRenderer} class.
 */
public class LatexMathRendererTest {

    /**
     * Test method for {@link LatexMathRenderer#renderPng(String)}.
     */
    @Test(expected = MathRenderException.class)
    public void testRenderEmptyFormula() throws MathRenderException {
        new LatexMathRenderer("latex", "dvipng", 1000).renderPng("  ");
    }

    /**
     * Test method for {@link LatexMathRenderer#renderPng(String)}.
     */
    @Test
    public void testRenderMissingExecutable() {
        LatexMathRenderer renderer = new LatexMathRenderer(
                "no-such-latex-executable-4711", "no-such-dvipng-executable-4711", 5000);
        try {
            renderer.renderPng("x^2");
            fail("MathRenderException expected");
        } catch (MathRenderException e) {
            assertNotNull(e.getMessage());
        }
    }
}
