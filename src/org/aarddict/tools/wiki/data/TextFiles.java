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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;

import org.aarddict.tools.wiki.ConfigurationException;

/**
 * Helpers for reading the (small) text files the converter is configured
 * with.
 */
public class TextFiles {
    private TextFiles() {
    }

    /**
     * Reads the whole content of a UTF-8 encoded text file.
     * 
     * @param file
     *            the file to read
     * @param what
     *            description of the file for error messages, e.g.
     *            "site info"
     * 
     * @return the file's content
     * 
     * @throws ConfigurationException
     *             if the file does not exist or cannot be read
     */
    public static String read(File file, String what) throws ConfigurationException {
        if (file == null) {
            throw new ConfigurationException(what + " not specified");
        }
        if (!file.isFile()) {
            throw new ConfigurationException("File " + file + " not found (" + what + ")");
        }
        try {
            return read(new FileInputStream(file));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + what + " from " + file, e);
        }
    }

    /**
     * Reads the whole content of a UTF-8 encoded stream and closes it.
     * 
     * @param is
     *            the stream to read
     * 
     * @return the stream's content
     * 
     * @throws IOException
     *             if reading fails
     */
    public static String read(InputStream is) throws IOException {
        BufferedReader br = new BufferedReader(new InputStreamReader(is, "UTF-8"));
        try {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[8192];
            int read;
            while ((read = br.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
            return sb.toString();
        } finally {
            br.close();
        }
    }
}
