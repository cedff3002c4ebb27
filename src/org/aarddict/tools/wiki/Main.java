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

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.Set;

import org.aarddict.tools.wiki.data.FilterConfig;
import org.aarddict.tools.wiki.data.FilterConfigReader;
import org.aarddict.tools.wiki.data.Namespaces;
import org.aarddict.tools.wiki.data.SiteInfo;
import org.aarddict.tools.wiki.data.SiteInfoReader;
import org.aarddict.tools.wiki.db.SQLiteArticleDatabase;
import org.aarddict.tools.wiki.db.TitleSize;
import org.aarddict.tools.wiki.output.JsonLinesArticleWriter;
import org.aarddict.tools.wiki.output.MetadataEmitter;
import org.aarddict.tools.wiki.output.StatisticsConsumer;
import org.aarddict.tools.wiki.pipeline.BatchScheduler;
import org.aarddict.tools.wiki.pipeline.LanguageLinkResolver;
import org.aarddict.tools.wiki.pipeline.PipelineFactory;
import org.aarddict.tools.wiki.pipeline.SchedulerOptions;
import org.aarddict.tools.wiki.pipeline.TitleSlice;
import org.aarddict.tools.wiki.render.LatexMathRenderer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command line front end converting a compiled wiki database into article
 * records.
 */
public class Main {
    /**
     * Number of reported titles between two progress lines.
     */
    private static final int PROGRESS_INTERVAL = 10000;
    /**
     * Time after which a single <tt>latex</tt> or <tt>dvipng</tt> run is
     * killed (in milliseconds).
     */
    private static final long MATH_TIMEOUT = 30 * 1000;

    /**
     * Converts the articles of a compiled wiki database.
     * 
     * <pre>
     * <code>
     * > java -jar aardtools-wiki.jar --siteinfo siteinfo.json [Options] articles.db
     * </code>
     * </pre>
     * 
     * @param args
     *            command line arguments
     */
    public static void main(final String[] args) {
        final CommandLineParser parser = new GnuParser();
        CommandLine line = null;
        final Options options = getOptions();
        try {
            line = parser.parse(options, args);
        } catch (final ParseException e) {
            printException("Parsing failed", e, false, 1);
            return; // will not be reached since printException exits
        }

        if (line.hasOption("help") || line.getArgs().length != 1) {
            final HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("aardtools-wiki [Options] <articles.db>", options);
            if (!line.hasOption("help")) {
                System.exit(1);
            }
            return;
        }

        final String dbFileName = line.getArgs()[0];
        try {
            if (line.hasOption("total")) {
                total(dbFileName, line);
            } else {
                convert(dbFileName, line);
            }
        } catch (final ConfigurationException e) {
            printException("Invalid configuration", e, false, 2);
        } catch (final IOException e) {
            printException("Conversion failed", e, true, 3);
        } catch (final InterruptedException e) {
            printException("Conversion interrupted", e, false, 4);
        }
    }

    /**
     * Prints the number of articles in the requested slice and their total
     * size.
     */
    static void total(final String dbFileName, final CommandLine line)
            throws ConfigurationException, IOException {
        final SchedulerOptions schedulerOptions = getSchedulerOptions(line);
        final SQLiteArticleDatabase db = new SQLiteArticleDatabase(dbFileName, null);
        try {
            long articles = 0;
            long totalBytes = 0;
            final Iterator<TitleSize> it = new TitleSlice<TitleSize>(db.titlesWithSize(),
                    schedulerOptions.getStart(), schedulerOptions.getEnd());
            while (it.hasNext()) {
                ++articles;
                totalBytes += it.next().getSize();
                if (articles % PROGRESS_INTERVAL == 0) {
                    System.out.println("Calculating total number of articles...(" + articles + ", " + totalBytes + ")");
                }
            }
            System.out.println(articles + " " + totalBytes);
        } finally {
            db.close();
        }
    }

    /**
     * Converts all articles in the requested slice.
     */
    static void convert(final String dbFileName, final CommandLine line)
            throws ConfigurationException, IOException, InterruptedException {
        if (!line.hasOption("siteinfo")) {
            throw new ConfigurationException("Site info not specified (use --siteinfo)");
        }
        final SiteInfo siteinfo = SiteInfoReader.load(new File(line.getOptionValue("siteinfo")));
        final FilterConfig filters = line.hasOption("filters")
                ? FilterConfigReader.load(new File(line.getOptionValue("filters")))
                : FilterConfig.EMPTY;
        final String wikiLang = line.getOptionValue("lang", siteinfo.getLang());
        final SchedulerOptions schedulerOptions = getSchedulerOptions(line);
        final Set<String> languages = LanguageLinkResolver.parseLanguages(
                line.getOptionValue("lang-links"), siteinfo.getLang());

        final MetadataEmitter metadata = new MetadataEmitter(siteinfo, wikiLang);
        if (line.hasOption("metadata")) {
            metadata.setMetadataFile(new File(line.getOptionValue("metadata")));
        }
        if (line.hasOption("license")) {
            metadata.setLicenseFile(new File(line.getOptionValue("license")));
        }
        if (line.hasOption("copyright")) {
            metadata.setCopyrightFile(new File(line.getOptionValue("copyright")));
        }
        metadata.setVersion(line.getOptionValue("dict-ver"), line.getOptionValue("dict-update"));
        metadata.setLanguageLinks(languages);

        final File output = new File(line.getOptionValue("output", dbFileName + ".jsonl"));
        final PipelineFactory factory = new PipelineFactory(dbFileName, null, siteinfo, filters,
                new LatexMathRenderer(line.getOptionValue("latex", "latex"),
                        line.getOptionValue("dvipng", "dvipng"), MATH_TIMEOUT),
                line.hasOption("rtl"), wikiLang);

        final SQLiteArticleDatabase db = new SQLiteArticleDatabase(dbFileName, null);
        final JsonLinesArticleWriter writer = new JsonLinesArticleWriter(output);
        final StatisticsConsumer stats = new StatisticsConsumer(writer, System.out, PROGRESS_INTERVAL, -1);
        final ReportAtShutDown shutdownHook = new ReportAtShutDown(stats);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            metadata.emit(stats);
            final LanguageLinkResolver languageLinks = languages.isEmpty()
                    ? LanguageLinkResolver.disabled()
                    : new LanguageLinkResolver(languages, db, new Namespaces(siteinfo));
            final BatchScheduler scheduler = new BatchScheduler(factory, stats, languageLinks, schedulerOptions);
            stats.start();
            scheduler.run(db.titles());
            stats.end();
        } finally {
            try {
                writer.close();
            } finally {
                db.close();
            }
        }
        shutdownHook.run();
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
        System.out.println("Wrote " + output + " and " + writer.getMetadataFile());
    }

    /**
     * Prints the statistics when the JVM is shut down, e.g. if the conversion
     * is interrupted.
     */
    static class ReportAtShutDown extends Thread {
        private final StatisticsConsumer stats;
        private boolean reported = false;

        ReportAtShutDown(final StatisticsConsumer stats) {
            this.stats = stats;
        }

        @Override
        public synchronized void run() {
            if (!reported) {
                reported = true;
                stats.printSummary();
            }
        }
    }

    /**
     * Reads the scheduler settings from the command line.
     * 
     * @throws ConfigurationException
     *             if an option value is not a valid number
     */
    static SchedulerOptions getSchedulerOptions(final CommandLine line) throws ConfigurationException {
        final SchedulerOptions result = new SchedulerOptions();
        try {
            if (line.hasOption("processes")) {
                result.setProcesses(getInt(line, "processes"));
            }
            if (line.hasOption("timeout")) {
                result.setTimeoutMillis(getInt(line, "timeout") * 1000L);
            }
            if (line.hasOption("timeout-retries")) {
                result.setTimeoutRetries(getInt(line, "timeout-retries"));
            }
            if (line.hasOption("mp-chunk-size")) {
                result.setChunkSize(getInt(line, "mp-chunk-size"));
            }
            if (line.hasOption("start")) {
                result.setStart(getInt(line, "start"));
            }
            if (line.hasOption("end")) {
                result.setEnd(getInt(line, "end"));
            }
            if (line.hasOption("article-count")) {
                result.setArticleCount(getInt(line, "article-count"));
            }
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        result.setSequential(line.hasOption("nomp"));
        return result;
    }

    private static int getInt(final CommandLine line, final String option) throws ConfigurationException {
        final String value = line.getOptionValue(option);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("invalid value for --" + option + ": " + value, e);
        }
    }

    /**
     * Creates the options the command line should understand.
     * 
     * @return the options the program understands
     */
    static Options getOptions() {
        final Options options = new Options();
        options.addOption(new Option("h", "help", false, "print this message"));
        addValueOption(options, "s", "siteinfo", "file", "site information (JSON) of the wiki");
        addValueOption(options, "f", "filters", "file", "content filters (JSON)");
        addValueOption(options, null, "metadata", "file", "metadata (properties) to add to the dictionary");
        addValueOption(options, null, "license", "file", "licence text (default: derived from the site's rights)");
        addValueOption(options, null, "copyright", "file", "copyright text");
        addValueOption(options, null, "dict-ver", "version", "dictionary version");
        addValueOption(options, null, "dict-update", "update", "dictionary update counter");
        addValueOption(options, "l", "lang", "code", "wiki language (default: the site's language)");
        options.addOption(new Option(null, "rtl", false, "write articles right-to-left"));
        addValueOption(options, "p", "processes", "n", "number of worker threads (default: number of processors)");
        addValueOption(options, "t", "timeout", "seconds", "time to wait for a result before the workers are replaced (default: 600)");
        addValueOption(options, null, "timeout-retries", "n", "how often a title is retried after a timeout (default: 0)");
        addValueOption(options, null, "start", "n", "index of the first article to convert (default: 0)");
        addValueOption(options, null, "end", "n", "index after the last article to convert (default: all)");
        options.addOption(new Option(null, "nomp", false, "convert everything in a single thread"));
        addValueOption(options, null, "mp-chunk-size", "n", "number of titles dispatched at once (default: 10000)");
        addValueOption(options, null, "lang-links", "langs", "comma separated languages whose language links become redirects");
        addValueOption(options, null, "article-count", "n", "stop after this many articles (default: no limit)");
        addValueOption(options, "o", "output", "file", "output file, may end with .gz or .bz2 (default: <articles.db>.jsonl)");
        options.addOption(new Option(null, "total", false, "only count the articles and their size"));
        addValueOption(options, null, "latex", "cmd", "latex executable (default: latex)");
        addValueOption(options, null, "dvipng", "cmd", "dvipng executable (default: dvipng)");
        return options;
    }

    private static void addValueOption(final Options options, final String opt,
            final String longOpt, final String argName, final String description) {
        final Option option = new Option(opt, longOpt, true, description);
        option.setArgName(argName);
        options.addOption(option);
    }

    /**
     * Prints the given exception with the given description and terminates the
     * JVM.
     * 
     * @param description  will be prepended to the error message
     * @param e            the exception to print
     * @param verbose      specifies whether to include the stack trace or not
     * @param exitStatus   the status code the JVM exits with
     */
    static void printException(final String description, final Exception e,
            final boolean verbose, final int exitStatus) {
        System.err.print(description + ": ");
        if (verbose) {
            System.err.println();
            e.printStackTrace();
        } else {
            System.err.println(e.getMessage());
        }
        System.exit(exitStatus);
    }
}
