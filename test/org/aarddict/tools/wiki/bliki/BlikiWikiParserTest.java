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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.aarddict.tools.wiki.data.FilterConfig;
import org.aarddict.tools.wiki.data.SiteInfo;
import org.aarddict.tools.wiki.data.TestData;
import org.aarddict.tools.wiki.db.MapArticleDatabase;
import org.aarddict.tools.wiki.pipeline.RedirectResolver;
import org.aarddict.tools.wiki.pipeline.WikiParseException;
import org.aarddict.tools.wiki.render.ContentFilter;
import org.aarddict.tools.wiki.tree.NodeKind;
import org.aarddict.tools.wiki.tree.WikiNode;
import org.junit.Test;

/**
 * Unit test for the {@link BlikiWikiParser} class.
 */
public class BlikiWikiParserTest {

    private static BlikiWikiParser parser(SiteInfo siteinfo) {
        return new BlikiWikiParser(TestData.namespaces(), new ContentFilter(FilterConfig.EMPTY),
                new RedirectResolver(siteinfo.getRedirectAliases(), TestData.namespaces()),
                siteinfo.getLanguagePrefixes());
    }

    private static List<WikiNode> find(WikiNode root, NodeKind kind) {
        List<WikiNode> result = new ArrayList<WikiNode>();
        if (root.getKind() == kind) {
            result.add(root);
        }
        for (WikiNode child : root.getChildren()) {
            result.addAll(find(child, kind));
        }
        return result;
    }

    /**
     * Test method for {@link BlikiWikiParser#stripBehaviourSwitches(String, Map)}.
     */
    @Test
    public void testStripBehaviourSwitches() {
        Map<String, List<String>> magicWords = TestData.siteinfo().getMagicWords();
        assertEquals("Text  mehr", BlikiWikiParser.stripBehaviourSwitches(
                "Text __KEININHALTSVERZEICHNIS__ mehr", magicWords));
        assertEquals("Text", BlikiWikiParser.stripBehaviourSwitches("Text__notoc__", magicWords));
        // not a behaviour switch
        assertEquals("__SEITENNAME__", BlikiWikiParser.stripBehaviourSwitches("__SEITENNAME__", magicWords));
        assertEquals("no switches", BlikiWikiParser.stripBehaviourSwitches("no switches", magicWords));
    }

    /**
     * Test method for {@link BlikiWikiParser#stripBehaviourSwitches(String, Map)}.
     */
    @Test
    public void testStripBehaviourSwitchesWithoutMagicWords() {
        Map<String, List<String>> magicWords = new HashMap<String, List<String>>();
        magicWords.put("toc", Arrays.asList("__TOC__"));
        assertEquals("a b", BlikiWikiParser.stripBehaviourSwitches("a __TOC__b", magicWords));
    }

    /**
     * Test method for {@link BlikiWikiParser#parse(String, String, org.aarddict.tools.wiki.db.ArticleDatabase, String, Map)}.
     */
    @Test
    public void testParseSimpleArticle() throws WikiParseException {
        SiteInfo siteinfo = TestData.siteinfo();
        MapArticleDatabase db = new MapArticleDatabase();
        WikiNode article = parser(siteinfo).parse("Berlin",
                "'''Berlin''' ist die Hauptstadt Deutschlands.\n",
                db, "de", siteinfo.getMagicWords());

        assertEquals(NodeKind.ARTICLE, article.getKind());
        assertEquals("Berlin", article.getCaption());
        List<WikiNode> strong = find(article, NodeKind.STRONG);
        assertEquals(1, strong.size());
        assertEquals("Berlin", strong.get(0).getText());
        assertTrue(article.getText(), article.getText().contains("ist die Hauptstadt Deutschlands."));
    }
}
