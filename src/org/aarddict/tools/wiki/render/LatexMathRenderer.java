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
package org.aarddict.tools.wiki.render;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;

import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;

/**
 * Renders TeX formulas by running <tt>latex</tt> and <tt>dvipng</tt> in a
 * scratch directory.
 */
public class LatexMathRenderer implements MathRenderer {
    private static final String DOCUMENT_START = "\\documentclass[12pt]{article}\n"
            + "\\usepackage[utf8]{inputenc}\n"
            + "\\usepackage{amsmath}\n"
            + "\\usepackage{amsfonts}\n"
            + "\\usepackage{amssymb}\n"
            + "\\pagestyle{empty}\n"
            + "\\begin{document}\n"
            + "$";
    private static final String DOCUMENT_END = "$\n\\end{document}\n";

    private final String latexCommand;
    private final String dvipngCommand;
    private final long timeoutMillis;

    /**
     * Creates a renderer using the given executables.
     * 
     * @param latexCommand
     *            the <tt>latex</tt> executable
     * @param dvipngCommand
     *            the <tt>dvipng</tt> executable
     * @param timeoutMillis
     *            time after which a single tool run is killed
     */
    public LatexMathRenderer(String latexCommand, String dvipngCommand, long timeoutMillis) {
        this.latexCommand = latexCommand;
        this.dvipngCommand = dvipngCommand;
        this.timeoutMillis = timeoutMillis;
    }

    /* (non-Javadoc)
     * @see org.aarddict.tools.wiki.render.MathRenderer#renderPng(java.lang.String)
     */
    @Override
    public byte[] renderPng(String tex) throws MathRenderException {
        if (tex == null || tex.trim().isEmpty()) {
            throw new MathRenderException("empty formula");
        }
        File dir = null;
        try {
            dir = File.createTempFile("aardmath", "");
            if (!dir.delete() || !dir.mkdir()) {
                throw new MathRenderException("cannot create scratch directory " + dir);
            }
            File texFile = new File(dir, "formula.tex");
            Writer writer = new OutputStreamWriter(new FileOutputStream(texFile), "UTF-8");
            try {
                writer.write(DOCUMENT_START);
                writer.write(tex.trim());
                writer.write(DOCUMENT_END);
            } finally {
                writer.close();
            }

            CommandLine latex = new CommandLine(latexCommand);
            latex.addArgument("-interaction=nonstopmode");
            latex.addArgument("-halt-on-error");
            latex.addArgument(texFile.getName());
            run(latex, dir);

            CommandLine dvipng = new CommandLine(dvipngCommand);
            dvipng.addArgument("-q");
            dvipng.addArgument("-T");
            dvipng.addArgument("tight");
            dvipng.addArgument("-bg");
            dvipng.addArgument("Transparent");
            dvipng.addArgument("-D");
            dvipng.addArgument("100");
            dvipng.addArgument("-o");
            dvipng.addArgument("formula.png");
            dvipng.addArgument("formula.dvi");
            run(dvipng, dir);

            return readAll(new File(dir, "formula.png"));
        } catch (IOException e) {
            throw new MathRenderException("cannot render formula: " + e.getMessage(), e);
        } finally {
            if (dir != null) {
                deleteDirectory(dir);
            }
        }
    }

    private void run(CommandLine command, File dir) throws IOException, MathRenderException {
        DefaultExecutor executor = new DefaultExecutor();
        executor.setWorkingDirectory(dir);
        ExecuteWatchdog watchdog = new ExecuteWatchdog(timeoutMillis);
        executor.setWatchdog(watchdog);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(output));
        try {
            executor.execute(command);
        } catch (ExecuteException e) {
            if (watchdog.killedProcess()) {
                throw new MathRenderException(command.getExecutable() + " timed out", e);
            }
            throw new MathRenderException(command.getExecutable() + " failed: "
                    + lastLines(output.toString("UTF-8")), e);
        }
    }

    private static String lastLines(String output) {
        String trimmed = output.trim();
        int start = Math.max(0, trimmed.length() - 300);
        return trimmed.substring(start);
    }

    private static byte[] readAll(File file) throws IOException {
        InputStream is = new FileInputStream(file);
        try {
            ByteArrayOutputStream result = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = is.read(buffer)) != -1) {
                result.write(buffer, 0, read);
            }
            return result.toByteArray();
        } finally {
            is.close();
        }
    }

    private static void deleteDirectory(File dir) {
        File[] files = dir.listFiles();
        if (files != null) {
            for (File file : files) {
                file.delete();
            }
        }
        dir.delete();
    }
}
