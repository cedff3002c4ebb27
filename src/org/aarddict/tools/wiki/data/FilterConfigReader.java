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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.aarddict.tools.wiki.ConfigurationException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Reads a filter description. The document is a JSON object with the
 * (optional) sections <tt>EXCLUDE_PAGES</tt>, <tt>EXCLUDE_CLASSES</tt>,
 * <tt>EXCLUDE_IDS</tt> and <tt>TEXT_REPLACE</tt>:
 * 
 * <pre>
 * <code>
 * {
 *   "EXCLUDE_PAGES": ["Template:Navbox"],
 *   "EXCLUDE_CLASSES": ["metadata"],
 *   "EXCLUDE_IDS": ["coordinates"],
 *   "TEXT_REPLACE": [{"re": "\\(\\s*\\)", "sub": ""}]
 * }
 * </code>
 * </pre>
 */
public class FilterConfigReader {
    /**
     * Section with full titles of pages that are never fetched.
     */
    public static final String EXCLUDE_PAGES = "EXCLUDE_PAGES";
    /**
     * Section with CSS classes of elements to drop.
     */
    public static final String EXCLUDE_CLASSES = "EXCLUDE_CLASSES";
    /**
     * Section with ids of elements to drop.
     */
    public static final String EXCLUDE_IDS = "EXCLUDE_IDS";
    /**
     * Section with <tt>{"re": ..., "sub": ...}</tt> replacements.
     */
    public static final String TEXT_REPLACE = "TEXT_REPLACE";

    private FilterConfigReader() {
    }

    /**
     * Loads the filter configuration from the given file.
     * 
     * @param file
     *            the filter file
     * 
     * @return the filter configuration
     * 
     * @throws ConfigurationException
     *             if the file is missing, unreadable or invalid
     */
    public static FilterConfig load(File file) throws ConfigurationException {
        String json = TextFiles.read(file, "site filter");
        try {
            return parse(json);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(e.getMessage() + " in " + file, e);
        }
    }

    /**
     * Parses a filter description.
     * 
     * @param json
     *            the JSON text
     * 
     * @return the filter configuration
     * 
     * @throws ConfigurationException
     *             if the document or one of its patterns is invalid
     */
    public static FilterConfig parse(String json) throws ConfigurationException {
        try {
            JSONObject root = new JSONObject(json);
            List<TextReplacement> replacements = new ArrayList<TextReplacement>();
            JSONArray replace = root.optJSONArray(TEXT_REPLACE);
            if (replace != null) {
                for (int i = 0; i < replace.length(); ++i) {
                    JSONObject item = replace.getJSONObject(i);
                    String re = item.getString("re");
                    String sub = item.optString("sub", "");
                    try {
                        replacements.add(new TextReplacement(Pattern.compile(re),
                                TextReplacement.toMatcherReplacement(sub)));
                    } catch (PatternSyntaxException e) {
                        throw new ConfigurationException("invalid text replacement pattern \"" + re + "\"", e);
                    }
                }
            }
            return new FilterConfig(readSet(root, EXCLUDE_PAGES),
                    readSet(root, EXCLUDE_CLASSES), readSet(root, EXCLUDE_IDS),
                    replacements);
        } catch (JSONException e) {
            throw new ConfigurationException("invalid filter description: " + e.getMessage(), e);
        }
    }

    private static Set<String> readSet(JSONObject root, String section) {
        Set<String> result = new LinkedHashSet<String>();
        JSONArray values = root.optJSONArray(section);
        if (values != null) {
            for (int i = 0; i < values.length(); ++i) {
                result.add(values.getString(i));
            }
        }
        return result;
    }
}
