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
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.aarddict.tools.wiki.ConfigurationException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Unit test for the {@link SiteInfoReader} class.
 */
public class SiteInfoReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    /**
     * Test method for {@link SiteInfoReader#parse(String)}.
     */
    @Test
    public void testParseGeneral() throws ConfigurationException {
        SiteInfo siteinfo = TestData.siteinfo();
        assertEquals("de", siteinfo.getLang());
        assertEquals("Wikipedia", siteinfo.getSitename());
        assertEquals("http://de.wikipedia.org", siteinfo.getServer());
        assertEquals("Creative Commons Attribution-Share Alike 3.0 Unported", siteinfo.getRights());
        assertEquals("first-letter", siteinfo.getCase());
        assertEquals(TestData.siteinfoJson(), siteinfo.getJson());
    }

    /**
     * Test method for {@link SiteInfoReader#parse(String)}.
     */
    @Test
    public void testParseNamespaces() throws ConfigurationException {
        SiteInfo siteinfo = TestData.siteinfo();
        assertEquals("Vorlage", siteinfo.getNamespaces().get("10").get(SiteInfo.NAMESPACE_PREFIX));
        assertEquals("", siteinfo.getNamespaces().get("0").get(SiteInfo.NAMESPACE_PREFIX));
        assertEquals("6", siteinfo.getNamespaceAliases().get("Bild"));
    }

    /**
     * Test method for {@link SiteInfoReader#parse(String)}.
     */
    @Test
    public void testParseLanguagePrefixes() throws ConfigurationException {
        SiteInfo siteinfo = TestData.siteinfo();
        assertTrue(siteinfo.getLanguagePrefixes().contains("en"));
        assertTrue(siteinfo.getLanguagePrefixes().contains("fr"));
        assertTrue(siteinfo.getLanguagePrefixes().contains("ru"));
        assertFalse(siteinfo.getLanguagePrefixes().contains("wikt"));
    }

    /**
     * Test method for {@link SiteInfo#getRedirectAliases()}.
     */
    @Test
    public void testRedirectAliases() {
        List<String> aliases = TestData.siteinfo().getRedirectAliases();
        assertEquals(Arrays.asList("#WEITERLEITUNG", "#weiterleitung", "#REDIRECT", "#redirect"), aliases);
    }

    /**
     * Test method for {@link SiteInfoReader#parse(String)} with the
     * <tt>query</tt> wrapper of a raw API response.
     */
    @Test
    public void testParseApiResponse() throws ConfigurationException {
        SiteInfo siteinfo = SiteInfoReader.parse("{\"query\": {\"general\": {\"lang\": \"fr\"}}}");
        assertEquals("fr", siteinfo.getLang());
        assertTrue(siteinfo.getNamespaces().isEmpty());
        assertTrue(siteinfo.getRedirectAliases().isEmpty());
    }

    /**
     * Test method for {@link SiteInfoReader#parse(String)}.
     */
    @Test(expected = ConfigurationException.class)
    public void testParseMissingGeneral() throws ConfigurationException {
        SiteInfoReader.parse("{\"namespaces\": {}}");
    }

    /**
     * Test method for {@link SiteInfoReader#parse(String)}.
     */
    @Test(expected = ConfigurationException.class)
    public void testParseInvalidJson() throws ConfigurationException {
        SiteInfoReader.parse("{\"general\": ");
    }

    /**
     * Test method for {@link SiteInfoReader#load(File)}.
     */
    @Test(expected = ConfigurationException.class)
    public void testLoadMissingFile() throws ConfigurationException, IOException {
        SiteInfoReader.load(new File(folder.getRoot(), "nonexistent.json"));
    }
}
