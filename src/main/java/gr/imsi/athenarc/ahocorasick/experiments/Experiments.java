package gr.imsi.athenarc.ahocorasick.experiments;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.ahocorasick.config.MatcherConfiguration;
import gr.imsi.athenarc.ahocorasick.experiments.util.DictionaryLoader;
import gr.imsi.athenarc.ahocorasick.experiments.util.SearchMode;
import gr.imsi.athenarc.ahocorasick.experiments.util.SearchModeConverter;
import gr.imsi.athenarc.ahocorasick.experiments.util.SearchReport;
import gr.imsi.athenarc.ahocorasick.matcher.FirstMatch;
import gr.imsi.athenarc.ahocorasick.matcher.Matcher;
import gr.imsi.athenarc.ahocorasick.matcher.PatternOccurrence;
import gr.imsi.athenarc.ahocorasick.util.TextDecoding;

public class Experiments {

    private static final Logger LOG = LoggerFactory.getLogger(Experiments.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Parameter(names = "-dictionary", description = "Path of the dictionary file, one pattern per line", required = true)
    public String dictionary;

    @Parameter(names = "-text", description = "Path of the UTF-8 text to search", required = true)
    public String text;

    @Parameter(names = "-mode", converter = SearchModeConverter.class,
            description = "Operation: match, threadsafe, contains, first or locate")
    public SearchMode mode = SearchMode.MATCH;

    @Parameter(names = "-runs", description = "Times to repeat the search")
    public Integer runs = 1;

    @Parameter(names = "-threads", description = "Concurrent callers per run in threadsafe mode")
    public Integer threads = 1;

    @Parameter(names = "-out", description = "The output folder")
    public String outFolder = "output";

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public Experiments() {

    }

    public static void main(String... args) throws IOException, InterruptedException {
        Experiments experiments = new Experiments();
        JCommander jCommander = new JCommander(experiments);
        jCommander.setProgramName("ahocorasick");
        jCommander.parse(args);
        if (experiments.help) {
            jCommander.usage();
        } else {
            experiments.run();
        }
    }

    public SearchReport run() throws IOException, InterruptedException {
        Preconditions.checkNotNull(dictionary, "No dictionary file specified.");
        Preconditions.checkNotNull(text, "No text file specified.");
        Preconditions.checkNotNull(outFolder, "No out folder specified.");
        Preconditions.checkArgument(runs != null && runs > 0, "Runs must be positive.");
        Preconditions.checkArgument(threads != null && threads > 0, "Threads must be positive.");

        List<String> patterns = DictionaryLoader.load(Paths.get(dictionary));
        String input = TextDecoding.decode(Files.readAllBytes(Paths.get(text)));

        Stopwatch stopwatch = Stopwatch.createStarted();
        Matcher matcher = Matcher.fromStrings(patterns, MatcherConfiguration.load());
        LOG.info("Built automaton with {} states for {} patterns in {} ms",
                matcher.getAutomaton().getStateCount(), matcher.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));

        Path outPath = Paths.get(outFolder);
        Files.createDirectories(outPath);
        File resultsFile = outPath.resolve("results.csv").toFile();

        SearchReport report = null;
        try (FileWriter fileWriter = new FileWriter(resultsFile, false)) {
            CsvWriter csvWriter = new CsvWriter(fileWriter, new CsvWriterSettings());
            csvWriter.writeHeaders("run", "mode", "threads", "hits", "time");
            stopwatch = Stopwatch.createUnstarted();
            for (int run = 0; run < runs; run++) {
                stopwatch.reset();
                stopwatch.start();
                report = execute(matcher, input);
                stopwatch.stop();
                int hits = report.getMatches().size() + report.getOccurrences().size();
                LOG.info("Run {} ({}): {} hits in {} ms", run, mode.label(), hits,
                        stopwatch.elapsed(TimeUnit.MILLISECONDS));
                csvWriter.writeRow(run, mode.label(), mode == SearchMode.THREADSAFE ? threads : 1, hits,
                        stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1_000_000.0);
            }
            csvWriter.close();
        }

        File reportFile = outPath.resolve("matches.json").toFile();
        MAPPER.writeValue(reportFile, report);
        LOG.info("Wrote results to {}", outPath.toAbsolutePath());
        return report;
    }

    private SearchReport execute(Matcher matcher, String input) throws InterruptedException {
        int length = TextDecoding.codePointLength(input);
        switch (mode) {
            case MATCH:
                return reportOf(matcher, matcher.match(input), length);
            case THREADSAFE:
                return reportOf(matcher, matchConcurrently(matcher, input), length);
            case CONTAINS: {
                boolean found = matcher.contains(input);
                return new SearchReport(mode, matcher.size(), length, found);
            }
            case FIRST: {
                FirstMatch first = matcher.matchFirst(input);
                SearchReport report = new SearchReport(mode, matcher.size(), length, first.isFound());
                if (first.isFound()) {
                    report.addMatch(first.getIndex(), matcher.getPattern(first.getIndex()));
                }
                return report;
            }
            case LOCATE: {
                List<PatternOccurrence> occurrences = matcher.findAll(input);
                SearchReport report = new SearchReport(mode, matcher.size(), length, !occurrences.isEmpty());
                report.addOccurrences(occurrences);
                return report;
            }
            default:
                throw new UnsupportedOperationException("Unsupported mode: " + mode);
        }
    }

    private SearchReport reportOf(Matcher matcher, List<Integer> hits, int length) {
        SearchReport report = new SearchReport(mode, matcher.size(), length, !hits.isEmpty());
        for (int index : hits) {
            report.addMatch(index, matcher.getPattern(index));
        }
        return report;
    }

    /**
     * Runs {@code threads} thread-safe searches over the same text at once and checks that
     * they all agree.
     */
    private List<Integer> matchConcurrently(Matcher matcher, String input) throws InterruptedException {
        if (threads == 1) {
            return matcher.matchThreadSafe(input);
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<Integer>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> matcher.matchThreadSafe(input)));
            }
            List<Integer> expected = null;
            for (Future<List<Integer>> future : futures) {
                List<Integer> hits = future.get();
                if (expected == null) {
                    expected = hits;
                } else if (!new LinkedHashSet<>(expected).equals(new LinkedHashSet<>(hits))) {
                    LOG.error("Concurrent searches disagree: {} vs {}", expected, hits);
                    throw new IllegalStateException("Concurrent searches returned different matches");
                }
            }
            return expected;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Concurrent search failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
