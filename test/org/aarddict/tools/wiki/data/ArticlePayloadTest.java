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
package org.aarddict.tools.wiki.data;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

/**
 * Unit test for the {@link ArticlePayload} class.
 */
public class ArticlePayloadTest {

    /**
     * Test method for {@link ArticlePayload#redirect(String)}.
     */
    @Test
    public void testRedirectShape() {
        assertEquals("[\"\",[],{\"r\":\"Berlin\"}]", ArticlePayload.redirect("Berlin"));
    }

    /**
     * Test method for {@link ArticlePayload#parse(String)}, a redirect to a
     * non-ASCII title survives serialisation unchanged.
     */
    @Test
    public void testParseRedirect() {
        ArticlePayload payload = ArticlePayload.parse(ArticlePayload.redirect("Köln (Begriffsklärung)"));
        assertEquals("Köln (Begriffsklärung)", payload.getRedirectTarget());
        assertEquals("", payload.getText());
        assertTrue(payload.getTags().isEmpty());
    }

    /**
     * Test method for {@link ArticlePayload#parse(String)}.
     */
    @Test
    public void testParseArticle() {
        String text = "<div><h1>Zürich</h1><div>\"quoted\" — text</div></div>";
        ArticlePayload payload = ArticlePayload.parse(ArticlePayload.article(text, Arrays.asList("a", "b")));
        assertEquals(text, payload.getText());
        assertEquals(Arrays.asList("a", "b"), payload.getTags());
        assertNull(payload.getRedirectTarget());
    }

    /**
     * Test method for {@link ArticlePayload#article(String, java.util.List)}.
     */
    @Test
    public void testArticleShape() {
        assertEquals("[\"x\",[]]", ArticlePayload.article("x", Collections.<String>emptyList()));
    }
}
