package gr.imsi.athenarc.ahocorasick.matcher;

import java.util.Objects;

/**
 * Result of {@link Matcher#matchFirst(String)}: the dictionary index of the first pattern
 * found in the text, or -1 when nothing matched.
 */
public class FirstMatch {
    public static final int NOT_FOUND = -1;

    private static final FirstMatch NONE = new FirstMatch(NOT_FOUND, false);

    private final int index;
    private final boolean found;

    private FirstMatch(int index, boolean found) {
        this.index = index;
        this.found = found;
    }

    static FirstMatch of(int index) {
        return new FirstMatch(index, true);
    }

    static FirstMatch none() {
        return NONE;
    }

    public int getIndex() {
        return index;
    }

    public boolean isFound() {
        return found;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FirstMatch)) return false;
        FirstMatch that = (FirstMatch) o;
        return index == that.index && found == that.found;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, found);
    }

    @Override
    public String toString() {
        return found ? "FirstMatch{index=" + index + "}" : "FirstMatch{none}";
    }
}
