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

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import org.aarddict.tools.wiki.ConfigurationException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Unit test for the {@link FilterConfigReader} and {@link TextReplacement}
 * classes.
 */
public class FilterConfigReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static final String FILTERS = "{"
            + "\"EXCLUDE_PAGES\": [\"Vorlage:Navigationsleiste\"],"
            + "\"EXCLUDE_CLASSES\": [\"metadata\", \"noprint\"],"
            + "\"EXCLUDE_IDS\": [\"coordinates\"],"
            + "\"TEXT_REPLACE\": [{\"re\": \"\\\\{\\\\{Lang\\\\|(\\\\w+)\\\\}\\\\}\", \"sub\": \"(\\\\1)\"},"
            + "                   {\"re\": \"<!--.*?-->\"}]"
            + "}";

    /**
     * Test method for {@link FilterConfigReader#load(File)}.
     */
    @Test
    public void testLoad() throws ConfigurationException, IOException {
        File file = folder.newFile("filters.json");
        Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);
        try {
            writer.write(FILTERS);
        } finally {
            writer.close();
        }
        FilterConfig config = FilterConfigReader.load(file);
        assertTrue(config.getExcludedPages().contains("Vorlage:Navigationsleiste"));
        assertEquals(2, config.getExcludedClasses().size());
        assertTrue(config.getExcludedIds().contains("coordinates"));
        assertEquals(2, config.getTextReplacements().size());

        TextReplacement lang = config.getTextReplacements().get(0);
        assertEquals("Paris (fr)", lang.apply("Paris {{Lang|fr}}"));
        TextReplacement comment = config.getTextReplacements().get(1);
        assertEquals("ab", comment.apply("a<!-- hidden -->b"));
    }

    /**
     * Test method for {@link FilterConfigReader#parse(String)}.
     */
    @Test
    public void testParseEmpty() throws ConfigurationException {
        FilterConfig config = FilterConfigReader.parse("{}");
        assertTrue(config.getExcludedPages().isEmpty());
        assertTrue(config.getExcludedClasses().isEmpty());
        assertTrue(config.getExcludedIds().isEmpty());
        assertTrue(config.getTextReplacements().isEmpty());
    }

    /**
     * Test method for {@link FilterConfigReader#parse(String)}.
     */
    @Test(expected = ConfigurationException.class)
    public void testParseInvalidPattern() throws ConfigurationException {
        FilterConfigReader.parse("{\"TEXT_REPLACE\": [{\"re\": \"(unclosed\", \"sub\": \"\"}]}");
    }

    /**
     * Test method for {@link FilterConfigReader#load(File)}.
     */
    @Test(expected = ConfigurationException.class)
    public void testLoadMissing() throws ConfigurationException {
        FilterConfigReader.load(new File(folder.getRoot(), "missing.json"));
    }

    /**
     * Test method for {@link TextReplacement#toMatcherReplacement(String)}.
     */
    @Test
    public void testToMatcherReplacement() {
        assertEquals("$1", TextReplacement.toMatcherReplacement("\\1"));
        assertEquals("${name}", TextReplacement.toMatcherReplacement("\\g<name>"));
        assertEquals("$2", TextReplacement.toMatcherReplacement("\\g<2>"));
        assertEquals("costs \\$5", TextReplacement.toMatcherReplacement("costs $5"));
        assertEquals("a\nb", TextReplacement.toMatcherReplacement("a\\nb"));
    }

    /**
     * Test method for {@link TextReplacement#toMatcherReplacement(String)},
     * two digit group references and digits following a group reference.
     */
    @Test
    public void testToMatcherReplacementMultiDigit() {
        assertEquals("$10", TextReplacement.toMatcherReplacement("\\10"));
        assertEquals("$1\\0", TextReplacement.toMatcherReplacement("\\g<1>0"));

        Pattern ten = Pattern.compile("(a)(b)(c)(d)(e)(f)(g)(h)(i)(j)");
        assertEquals("j", new TextReplacement(ten, TextReplacement.toMatcherReplacement("\\10")).apply("abcdefghij"));
        assertEquals("a0", new TextReplacement(ten, TextReplacement.toMatcherReplacement("\\g<1>0")).apply("abcdefghij"));
        Pattern one = Pattern.compile("(x)");
        assertEquals("x0", new TextReplacement(one, TextReplacement.toMatcherReplacement("\\g<1>0")).apply("x"));
    }
}
