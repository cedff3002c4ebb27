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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * The serialised body of an article record. Articles are stored as the JSON
 * array <tt>[text, tags]</tt>, redirects as
 * <tt>["", [], {"r": target}]</tt>.
 */
public class ArticlePayload {
    /**
     * Key of the redirect target in the meta object of a redirect payload.
     */
    public static final String REDIRECT_KEY = "r";

    private final String text;
    private final List<String> tags;
    private final String redirectTarget;

    private ArticlePayload(String text, List<String> tags, String redirectTarget) {
        this.text = text;
        this.tags = tags;
        this.redirectTarget = redirectTarget;
    }

    /**
     * Serialises a rendered article.
     * 
     * @param text
     *            the rendered article text
     * @param tags
     *            the article's tags
     * 
     * @return the payload
     */
    public static String article(String text, List<String> tags) {
        JSONArray result = new JSONArray();
        result.put(text);
        result.put(new JSONArray(tags));
        return result.toString();
    }

    /**
     * Serialises a redirect.
     * 
     * @param target
     *            the redirect target
     * 
     * @return the payload
     */
    public static String redirect(String target) {
        JSONObject meta = new JSONObject();
        meta.put(REDIRECT_KEY, target);
        JSONArray result = new JSONArray();
        result.put("");
        result.put(new JSONArray());
        result.put(meta);
        return result.toString();
    }

    /**
     * Reads a serialised payload.
     * 
     * @param payload
     *            the payload created by {@link #article(String, List)} or
     *            {@link #redirect(String)}
     * 
     * @return the deserialised payload
     * 
     * @throws JSONException
     *             if the payload is malformed
     */
    public static ArticlePayload parse(String payload) throws JSONException {
        JSONArray array = new JSONArray(payload);
        String text = array.getString(0);
        JSONArray tagsJson = array.getJSONArray(1);
        List<String> tags = new ArrayList<String>(tagsJson.length());
        for (int i = 0; i < tagsJson.length(); ++i) {
            tags.add(tagsJson.getString(i));
        }
        String redirectTarget = null;
        if (array.length() > 2) {
            redirectTarget = array.getJSONObject(2).optString(REDIRECT_KEY, null);
        }
        return new ArticlePayload(text, Collections.unmodifiableList(tags), redirectTarget);
    }

    /**
     * @return the rendered text (empty for redirects)
     */
    public String getText() {
        return text;
    }

    /**
     * @return the tags
     */
    public List<String> getTags() {
        return tags;
    }

    /**
     * @return the redirect target or <tt>null</tt> if this is no redirect
     */
    public String getRedirectTarget() {
        return redirectTarget;
    }
}
