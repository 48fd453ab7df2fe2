package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

/**
 * Builds an {@link Automaton} from a dictionary of patterns.
 * Patterns are inserted code point by code point, so characters outside the BMP
 * occupy a single transition.
 */
public class AutomatonBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final ImmutableList<String> patterns;
    private State[] states;
    private int extent;

    private AutomatonBuilder(ImmutableList<String> patterns) {
        this.patterns = patterns;
    }

    /**
     * Builds the automaton for the given dictionary. Duplicates are allowed (the last
     * index wins), empty patterns are accepted and never match.
     *
     * @param dictionary the patterns, in index order
     * @return the finished automaton
     * @throws NullPointerException if the dictionary or one of its entries is null
     */
    public static Automaton build(List<String> dictionary) {
        Preconditions.checkNotNull(dictionary, "Dictionary must not be null.");
        for (int i = 0; i < dictionary.size(); i++) {
            Preconditions.checkNotNull(dictionary.get(i), "Pattern at index %s is null.", i);
        }
        return new AutomatonBuilder(ImmutableList.copyOf(dictionary)).build();
    }

    private Automaton build() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        allocate();
        State root = newState(0);
        root.setRoot(true);

        insertPatterns(root);
        linkFailures(root);
        root.setSuffix(root);

        // Shared prefixes leave slots unused.
        State[] finished = extent == states.length ? states : Arrays.copyOf(states, extent);
        states = null;

        LOG.debug("Built automaton with {} states for {} patterns in {} us",
            finished.length, patterns.size(), stopwatch.elapsed(TimeUnit.MICROSECONDS));
        return new Automaton(finished, patterns);
    }

    /**
     * Sizes the state array to one slot per pattern code point plus the root.
     */
    private void allocate() {
        int size = 1;
        for (String pattern : patterns) {
            size += pattern.codePointCount(0, pattern.length());
        }
        states = new State[size];
        extent = 0;
    }

    private State newState(int depth) {
        State state = new State(extent, depth);
        states[extent++] = state;
        return state;
    }

    private void insertPatterns(State root) {
        for (int index = 0; index < patterns.size(); index++) {
            String pattern = patterns.get(index);
            if (pattern.isEmpty()) {
                continue;
            }
            State current = root;
            int offset = 0;
            while (offset < pattern.length()) {
                int codePoint = pattern.codePointAt(offset);
                State child = current.getChild(codePoint);
                if (child == null) {
                    child = newState(current.getDepth() + 1);
                    current.addChild(codePoint, child);
                }
                current = child;
                offset += Character.charCount(codePoint);
            }
            current.markOutput(index);
        }
    }

    /**
     * Resolves failure and suffix links breadth first, so every state's failure link
     * is known before any of its children are visited.
     */
    private void linkFailures(State root) {
        Queue<State> queue = new ArrayDeque<>();
        for (State child : root.getChildren().values()) {
            child.setFailure(root);
            child.setSuffix(null);
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            State state = queue.remove();
            for (Map.Entry<Integer, State> entry : state.getChildren().entrySet()) {
                int codePoint = entry.getKey();
                State child = entry.getValue();
                queue.add(child);

                State fallback = state.getFailure();
                while (true) {
                    State target = fallback.getChild(codePoint);
                    if (target != null) {
                        child.setFailure(target);
                        break;
                    }
                    if (fallback.isRoot()) {
                        child.setFailure(root);
                        break;
                    }
                    fallback = fallback.getFailure();
                }

                State failure = child.getFailure();
                child.setSuffix(failure.isOutput() ? failure : failure.getSuffix());
            }
        }
    }
}
