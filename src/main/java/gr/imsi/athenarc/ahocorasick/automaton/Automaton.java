package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Immutable Aho-Corasick automaton: the trie states in one array, indexed by
 * {@link State#getId()}, with the root in slot 0.
 * Built once by {@link AutomatonBuilder} and safe for any number of concurrent readers.
 */
public class Automaton {
    private final State[] states;
    private final State root;
    private final ImmutableList<String> patterns;

    Automaton(State[] states, ImmutableList<String> patterns) {
        this.states = states;
        this.root = states[0];
        this.patterns = patterns;
    }

    public State getRoot() {
        return root;
    }

    public State getState(int id) {
        return states[id];
    }

    public int getStateCount() {
        return states.length;
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(Arrays.asList(states));
    }

    /**
     * The dictionary this automaton was built from, in construction order.
     */
    public ImmutableList<String> getPatterns() {
        return patterns;
    }

    public int getPatternCount() {
        return patterns.size();
    }

    /**
     * Renders the trie in Graphviz DOT. Child transitions are solid edges labelled with
     * the code point, failure links to non-root states are dashed.
     */
    public String toDotFormat() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph Automaton {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape = circle];\n");

        for (State state : states) {
            if (state.isOutput()) {
                sb.append(String.format("  %d [shape=doublecircle, label=\"%d:%d\"];\n",
                    state.getId(), state.getId(), state.getPatternIndex()));
            } else {
                sb.append(String.format("  %d [label=\"%d\"];\n", state.getId(), state.getId()));
            }
        }

        for (State state : states) {
            for (Map.Entry<Integer, State> child : state.getChildren().entrySet()) {
                String label = new String(Character.toChars(child.getKey()))
                    .replace("\\", "\\\\")
                    .replace("\"", "\\\"");
                sb.append(String.format("  %d -> %d [label=\"%s\"];\n",
                    state.getId(), child.getValue().getId(), label));
            }
            State failure = state.getFailure();
            if (failure != null && !failure.isRoot()) {
                sb.append(String.format("  %d -> %d [style=dashed];\n", state.getId(), failure.getId()));
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Automaton (states=" + states.length + ", patterns=" + patterns.size() + ")";
    }
}
