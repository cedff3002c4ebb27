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
package org.aarddict.tools.wiki;

import static org.junit.Assert.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

/**
 * Checks the licence header of all source files.
 */
public class SourceHeaderTest {
    private static final String COPYRIGHT = " *  Copyright 2026 The Aard Dictionary contributors";

    private static void collectSources(File dir, List<File> result) {
        File[] files = dir.listFiles();
        if (files == null) {
            return;
        }
        for (File file : files) {
            if (file.isDirectory()) {
                collectSources(file, result);
            } else if (file.getName().endsWith(".java")) {
                result.add(file);
            }
        }
    }

    private static String secondLine(File file) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(
                new FileInputStream(file), StandardCharsets.UTF_8));
        try {
            reader.readLine();
            return reader.readLine();
        } finally {
            reader.close();
        }
    }

    /**
     * Every file under <tt>src</tt> and <tt>test</tt> names the project's
     * copyright holder.
     */
    @Test
    public void testCopyrightHolder() throws IOException {
        List<File> sources = new ArrayList<File>();
        collectSources(new File("src"), sources);
        collectSources(new File("test"), sources);
        assertFalse(sources.isEmpty());
        for (File source : sources) {
            assertEquals(source.getPath(), COPYRIGHT, secondLine(source));
        }
    }
}
