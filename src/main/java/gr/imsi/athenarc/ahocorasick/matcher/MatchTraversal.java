package gr.imsi.athenarc.ahocorasick.matcher;

import java.util.ArrayList;
import java.util.List;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.automaton.State;

/**
 * The state-machine walk shared by every matching operation. None of these methods
 * mutate the automaton themselves; dedup state lives behind the supplied {@link HitFilter}.
 */
final class MatchTraversal {

    private MatchTraversal() {
    }

    /**
     * Advances from {@code current} on one code point, following failure links on a miss.
     * Stays at the root when nothing matches.
     */
    static State step(State current, int codePoint) {
        State next = current.getChild(codePoint);
        while (next == null && !current.isRoot()) {
            current = current.getFailure();
            next = current.getChild(codePoint);
        }
        return next != null ? next : current;
    }

    /**
     * Collects the dictionary index of every output state reached, reporting each state
     * at most once as decided by the filter.
     */
    static List<Integer> collect(Automaton automaton, String text, HitFilter filter, int initialCapacity) {
        List<Integer> hits = new ArrayList<>(initialCapacity);
        State current = automaton.getRoot();

        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            current = step(current, codePoint);

            if (current.isOutput() && filter.firstSighting(current)) {
                hits.add(current.getPatternIndex());
            }

            // Everything past an already reported suffix was reported with it.
            State suffix = current.getSuffix();
            while (suffix != null && !suffix.isRoot()) {
                if (!filter.firstSighting(suffix)) {
                    break;
                }
                hits.add(suffix.getPatternIndex());
                suffix = suffix.getSuffix();
            }
        }
        return hits;
    }

    static boolean contains(Automaton automaton, String text) {
        State current = automaton.getRoot();
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            current = step(current, codePoint);

            if (current.isOutput() || current.hasSuffixOutput()) {
                return true;
            }
        }
        return false;
    }

    static FirstMatch first(Automaton automaton, String text) {
        State current = automaton.getRoot();
        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            current = step(current, codePoint);

            if (current.isOutput()) {
                return FirstMatch.of(current.getPatternIndex());
            }
            if (current.hasSuffixOutput()) {
                return FirstMatch.of(current.getSuffix().getPatternIndex());
            }
        }
        return FirstMatch.none();
    }

    /**
     * Reports every occurrence without dedup. At one end position the longest pattern
     * comes first, followed by the rest of its suffix chain.
     */
    static List<PatternOccurrence> occurrences(Automaton automaton, String text, int initialCapacity) {
        List<PatternOccurrence> occurrences = new ArrayList<>(initialCapacity);
        State current = automaton.getRoot();

        int offset = 0;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            current = step(current, codePoint);

            if (current.isOutput()) {
                occurrences.add(occurrenceOf(automaton, text, current, offset));
            }
            State suffix = current.getSuffix();
            while (suffix != null && !suffix.isRoot()) {
                occurrences.add(occurrenceOf(automaton, text, suffix, offset));
                suffix = suffix.getSuffix();
            }
        }
        return occurrences;
    }

    private static PatternOccurrence occurrenceOf(Automaton automaton, String text, State state, int end) {
        int start = text.offsetByCodePoints(end, -state.getDepth());
        int index = state.getPatternIndex();
        return new PatternOccurrence(index, automaton.getPatterns().get(index), start, end);
    }
}
