package gr.imsi.athenarc.ahocorasick.experiments.util;

import java.util.ArrayList;
import java.util.List;

import gr.imsi.athenarc.ahocorasick.matcher.PatternOccurrence;

/**
 * JSON summary of the last experiment run, serialized through its getters.
 */
public class SearchReport {

    private final String mode;
    private final int patternCount;
    private final int textLength;
    private final boolean found;
    private final List<MatchedPattern> matches = new ArrayList<>();
    private final List<PatternOccurrence> occurrences = new ArrayList<>();

    public SearchReport(SearchMode mode, int patternCount, int textLength, boolean found) {
        this.mode = mode.label();
        this.patternCount = patternCount;
        this.textLength = textLength;
        this.found = found;
    }

    public void addMatch(int index, String pattern) {
        matches.add(new MatchedPattern(index, pattern));
    }

    public void addOccurrences(List<PatternOccurrence> found) {
        occurrences.addAll(found);
    }

    public String getMode() {
        return mode;
    }

    public int getPatternCount() {
        return patternCount;
    }

    public int getTextLength() {
        return textLength;
    }

    public boolean isFound() {
        return found;
    }

    public List<MatchedPattern> getMatches() {
        return matches;
    }

    public List<PatternOccurrence> getOccurrences() {
        return occurrences;
    }

    public static class MatchedPattern {
        private final int index;
        private final String pattern;

        MatchedPattern(int index, String pattern) {
            this.index = index;
            this.pattern = pattern;
        }

        public int getIndex() {
            return index;
        }

        public String getPattern() {
            return pattern;
        }
    }
}
