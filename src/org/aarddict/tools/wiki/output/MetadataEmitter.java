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
package org.aarddict.tools.wiki.output;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.aarddict.tools.wiki.ConfigurationException;
import org.aarddict.tools.wiki.data.SiteInfo;
import org.aarddict.tools.wiki.data.TextFiles;
import org.aarddict.tools.wiki.pipeline.ArticleConsumer;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the dictionary's metadata (site information, licence, copyright,
 * titles and languages) to a consumer before any article is converted.
 */
public class MetadataEmitter {
    private static final Logger log = LoggerFactory.getLogger(MetadataEmitter.class);

    /**
     * Licence notices shipped with the converter, by the <tt>rights</tt>
     * string of the site information.
     */
    public static final Map<String, String> KNOWN_LICENSES;

    static {
        Map<String, String> licenses = new HashMap<String, String>();
        licenses.put("Creative Commons Attribution-Share Alike 3.0 Unported", "licenses/ccasau-3.0.txt");
        licenses.put("GNU Free Documentation License 1.2", "licenses/gfdl-1.2.txt");
        KNOWN_LICENSES = Collections.unmodifiableMap(licenses);
    }

    static final String DESCRIPTION_TEMPLATE = " %1$s for Aard Dictionary is a collection of text "
            + "documents from %2$s (articles only). Some documents or portions of documents may "
            + "have been omitted or could not be converted to Aard Dictionary format. All "
            + "documents can be found online at %2$s under the same title as displayed in "
            + "Aard Dictionary.\n";

    private final SiteInfo siteinfo;
    private final String wikiLang;
    private File metadataFile = null;
    private File licenseFile = null;
    private File copyrightFile = null;
    private String dictVersion = null;
    private String dictUpdate = null;
    private Set<String> languageLinks = null;

    /**
     * @param siteinfo
     *            the site's information
     * @param wikiLang
     *            the wiki language given on the command line
     */
    public MetadataEmitter(SiteInfo siteinfo, String wikiLang) {
        this.siteinfo = siteinfo;
        this.wikiLang = wikiLang;
    }

    /**
     * @param metadataFile
     *            properties file whose entries are all added, may be
     *            <tt>null</tt>
     */
    public void setMetadataFile(File metadataFile) {
        this.metadataFile = metadataFile;
    }

    /**
     * @param licenseFile
     *            file with the licence text, <tt>null</tt> to derive it from
     *            the site's rights
     */
    public void setLicenseFile(File licenseFile) {
        this.licenseFile = licenseFile;
    }

    /**
     * @param copyrightFile
     *            file with the copyright text, may be <tt>null</tt>
     */
    public void setCopyrightFile(File copyrightFile) {
        this.copyrightFile = copyrightFile;
    }

    /**
     * @param dictVersion
     *            dictionary version, may be <tt>null</tt>
     * @param dictUpdate
     *            update counter of the version, may be <tt>null</tt>
     */
    public void setVersion(String dictVersion, String dictUpdate) {
        this.dictVersion = dictVersion;
        this.dictUpdate = dictUpdate;
    }

    /**
     * @param languageLinks
     *            languages whose language links become redirects, may be
     *            <tt>null</tt>
     */
    public void setLanguageLinks(Set<String> languageLinks) {
        this.languageLinks = languageLinks;
    }

    /**
     * Adds all metadata entries to the consumer.
     * 
     * @param consumer
     *            the consumer to report to
     * 
     * @throws ConfigurationException
     *             if the licence or copyright file cannot be read
     * @throws IOException
     *             if the consumer fails
     */
    public void emit(ArticleConsumer consumer) throws ConfigurationException, IOException {
        if (siteinfo.getJson() != null) {
            consumer.addMetadata("siteinfo", new JSONObject(siteinfo.getJson()));
        }
        String sitelang = siteinfo.getLang();

        if (metadataFile != null) {
            Properties metadata = readMetadata(metadataFile);
            if (metadata != null) {
                log.info("Using metadata from {}", metadataFile);
                List<String> keys = new ArrayList<String>(metadata.stringPropertyNames());
                Collections.sort(keys);
                for (String key : keys) {
                    consumer.addMetadata(key, metadata.getProperty(key));
                }
            }
        } else {
            log.warn("No metadata file specified");
        }

        emitLicense(consumer);

        if (copyrightFile != null) {
            log.info("Using copyright text from {}", copyrightFile);
            consumer.addMetadata("copyright", TextFiles.read(copyrightFile, "copyright"));
        }

        consumer.addMetadata("title", siteinfo.getSitename());
        if (dictVersion != null) {
            consumer.addMetadata("version", dictUpdate == null ? dictVersion : dictVersion + "-" + dictUpdate);
        }
        String server = siteinfo.getServer();
        consumer.addMetadata("source", server);
        consumer.addMetadata("description", String.format(DESCRIPTION_TEMPLATE, siteinfo.getSitename(), server));

        consumer.addMetadata("lang", wikiLang);
        consumer.addMetadata("sitelang", sitelang);
        consumer.addMetadata("index_language", sitelang);
        consumer.addMetadata("article_language", sitelang);
        log.info("Language: {} ({})", wikiLang, sitelang);

        if (languageLinks != null && !languageLinks.isEmpty()) {
            consumer.addMetadata("language_links", new ArrayList<String>(languageLinks));
        }
    }

    private void emitLicense(ArticleConsumer consumer) throws ConfigurationException, IOException {
        if (licenseFile != null) {
            log.info("Using license text from {}", licenseFile);
            consumer.addMetadata("license", TextFiles.read(licenseFile, "license"));
            return;
        }
        String rights = siteinfo.getRights();
        String resource = rights == null ? null : KNOWN_LICENSES.get(rights);
        if (resource == null) {
            consumer.addMetadata("license", rights == null ? "" : rights);
            return;
        }
        InputStream is = MetadataEmitter.class.getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("license text " + resource + " is missing");
        }
        log.info("Using license text from {}", resource);
        consumer.addMetadata("license", TextFiles.read(is));
    }

    /**
     * Reads a metadata file.
     * 
     * @return the entries or <tt>null</tt> if the file cannot be read
     */
    private static Properties readMetadata(File file) {
        Properties result = new Properties();
        InputStream is = null;
        try {
            is = new FileInputStream(file);
            result.load(new InputStreamReader(is, "UTF-8"));
            return result;
        } catch (IOException e) {
            log.warn("Metadata file could not be read " + file, e);
            return null;
        } finally {
            if (is != null) {
                try {
                    is.close();
                } catch (IOException e) {
                    log.warn("Cannot close " + file, e);
                }
            }
        }
    }
}
