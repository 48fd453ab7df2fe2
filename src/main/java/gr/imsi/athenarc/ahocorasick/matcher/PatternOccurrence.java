package gr.imsi.athenarc.ahocorasick.matcher;

import java.util.Objects;

/**
 * One occurrence of a dictionary pattern in a text.
 * Offsets are UTF-16 indices into the searched (decoded) text, start inclusive and end exclusive.
 */
public class PatternOccurrence {
    private final int patternIndex;
    private final String pattern;
    private final int start;
    private final int end;

    public PatternOccurrence(int patternIndex, String pattern, int start, int end) {
        this.patternIndex = patternIndex;
        this.pattern = pattern;
        this.start = start;
        this.end = end;
    }

    public int getPatternIndex() {
        return patternIndex;
    }

    public String getPattern() {
        return pattern;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatternOccurrence)) return false;
        PatternOccurrence that = (PatternOccurrence) o;
        return patternIndex == that.patternIndex && start == that.start && end == that.end
            && Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternIndex, pattern, start, end);
    }

    @Override
    public String toString() {
        return "PatternOccurrence{index=" + patternIndex + ", pattern='" + pattern + "', start=" + start
            + ", end=" + end + "}";
    }
}
