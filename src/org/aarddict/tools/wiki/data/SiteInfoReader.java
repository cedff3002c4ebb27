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

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.aarddict.tools.wiki.ConfigurationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads a MediaWiki <tt>siteinfo</tt> JSON document (as returned by
 * <tt>api.php?action=query&amp;meta=siteinfo</tt>) into a {@link SiteInfo}
 * object.
 */
public class SiteInfoReader {
    private SiteInfoReader() {
    }

    /**
     * Loads the site info from the given file.
     * 
     * @param file
     *            the JSON file
     * 
     * @return the site info
     * 
     * @throws ConfigurationException
     *             if the file is missing, unreadable or no valid site info
     */
    public static SiteInfo load(File file) throws ConfigurationException {
        String json = TextFiles.read(file, "site info");
        try {
            return parse(json);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(e.getMessage() + " in " + file, e);
        }
    }

    /**
     * Parses a site info JSON document.
     * 
     * @param json
     *            the JSON text
     * 
     * @return the site info
     * 
     * @throws ConfigurationException
     *             if the document is no valid site info
     */
    public static SiteInfo parse(String json) throws ConfigurationException {
        SiteInfo siteinfo = new SiteInfo();
        try {
            JSONObject root = new JSONObject(json);
            if (root.has("query")) {
                // raw API response
                root = root.getJSONObject("query");
            }
            JSONObject general = root.optJSONObject("general");
            if (general == null) {
                throw new ConfigurationException("site info has no \"general\" section");
            }
            siteinfo.setBase(general.optString("base", ""));
            siteinfo.setSitename(general.optString("sitename", ""));
            siteinfo.setGenerator(general.optString("generator", ""));
            siteinfo.setCase(general.optString("case", "first-letter"));
            siteinfo.setLang(general.optString("lang", ""));
            siteinfo.setServer(general.optString("server", ""));
            siteinfo.setRights(general.optString("rights", ""));

            siteinfo.setNamespaces(readNamespaces(root.optJSONObject("namespaces")));
            siteinfo.setNamespaceAliases(readNamespaceAliases(root.optJSONArray("namespacealiases")));
            siteinfo.setMagicWords(readMagicWords(root.optJSONArray("magicwords")));
            siteinfo.setLanguagePrefixes(readLanguagePrefixes(root.optJSONArray("interwikimap")));
            siteinfo.setJson(json);
        } catch (JSONException e) {
            throw new ConfigurationException("invalid site info: " + e.getMessage(), e);
        }
        return siteinfo;
    }

    private static Map<String, Map<String, String>> readNamespaces(JSONObject namespaces) {
        Map<String, Map<String, String>> result = new HashMap<String, Map<String, String>>();
        if (namespaces == null) {
            return result;
        }
        Iterator<String> keys = namespaces.keys();
        while (keys.hasNext()) {
            String key = keys.next();
            JSONObject ns = namespaces.getJSONObject(key);
            Map<String, String> nsMap = new HashMap<String, String>();
            nsMap.put(SiteInfo.NAMESPACE_PREFIX, ns.optString("*", ""));
            nsMap.put(SiteInfo.NAMESPACE_CASE, ns.optString("case", "first-letter"));
            String canonical = ns.optString("canonical", "");
            if (!canonical.isEmpty()) {
                nsMap.put("canonical", canonical);
            }
            result.put(key, nsMap);
        }
        return result;
    }

    private static Map<String, String> readNamespaceAliases(JSONArray aliases) {
        Map<String, String> result = new HashMap<String, String>();
        if (aliases == null) {
            return result;
        }
        for (int i = 0; i < aliases.length(); ++i) {
            JSONObject alias = aliases.getJSONObject(i);
            result.put(alias.getString("*"), String.valueOf(alias.getInt("id")));
        }
        return result;
    }

    private static Map<String, List<String>> readMagicWords(JSONArray magicWords) {
        Map<String, List<String>> result = new HashMap<String, List<String>>();
        if (magicWords == null) {
            return result;
        }
        for (int i = 0; i < magicWords.length(); ++i) {
            JSONObject word = magicWords.getJSONObject(i);
            JSONArray aliasesJson = word.optJSONArray("aliases");
            List<String> aliases = new ArrayList<String>();
            if (aliasesJson != null) {
                for (int j = 0; j < aliasesJson.length(); ++j) {
                    aliases.add(aliasesJson.getString(j));
                }
            }
            result.put(word.getString("name"), aliases);
        }
        return result;
    }

    private static Set<String> readLanguagePrefixes(JSONArray interwikimap) {
        Set<String> result = new HashSet<String>();
        if (interwikimap == null) {
            return result;
        }
        for (int i = 0; i < interwikimap.length(); ++i) {
            JSONObject entry = interwikimap.getJSONObject(i);
            if (entry.has("language")) {
                result.add(entry.getString("prefix").toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
