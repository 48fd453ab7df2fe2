package gr.imsi.athenarc.ahocorasick.experiments.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.ahocorasick.util.TextDecoding;

/**
 * Reads a dictionary file with one pattern per line. Blank lines are kept as empty
 * patterns so dictionary indices stay equal to zero-based line numbers.
 */
public class DictionaryLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DictionaryLoader.class);

    public static List<String> load(Path path) throws IOException {
        String content = TextDecoding.decode(Files.readAllBytes(path));
        List<String> patterns = new ArrayList<>();
        int lineStart = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                patterns.add(stripCarriageReturn(content.substring(lineStart, i)));
                lineStart = i + 1;
            }
        }
        if (lineStart < content.length()) {
            patterns.add(stripCarriageReturn(content.substring(lineStart)));
        }
        LOG.info("Loaded {} patterns from {}", patterns.size(), path);
        return patterns;
    }

    public static void write(Path path, List<String> patterns) throws IOException {
        Files.write(path, patterns, StandardCharsets.UTF_8);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
