package gr.imsi.athenarc.ahocorasick.automaton;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A trie node of the automaton. Structural fields are written only while the
 * {@link AutomatonBuilder} runs; afterwards the only mutable field is the
 * single-threaded dedup marker {@link #getGeneration()}.
 */
public class State {
    private final int id;
    private final int depth;
    private boolean root;
    private boolean output;
    private int patternIndex = -1;

    // Allocated on first child insertion, most leaves never need one.
    private Map<Integer, State> children;

    private State failure;
    private State suffix;

    private long generation;

    State(int id, int depth) {
        this.id = id;
        this.depth = depth;
    }

    public int getId() {
        return id;
    }

    /**
     * Number of code points on the path from the root to this state.
     */
    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return root;
    }

    void setRoot(boolean root) {
        this.root = root;
    }

    public boolean isOutput() {
        return output;
    }

    /**
     * Dictionary index of the pattern ending here, or -1 when this is not an output state.
     */
    public int getPatternIndex() {
        return patternIndex;
    }

    void markOutput(int patternIndex) {
        this.output = true;
        this.patternIndex = patternIndex;
    }

    public State getChild(int codePoint) {
        if (children == null) {
            return null;
        }
        return children.get(codePoint);
    }

    public Map<Integer, State> getChildren() {
        if (children == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(children);
    }

    void addChild(int codePoint, State child) {
        if (children == null) {
            children = new HashMap<>(4);
        }
        children.put(codePoint, child);
    }

    public State getFailure() {
        return failure;
    }

    void setFailure(State failure) {
        this.failure = failure;
    }

    /**
     * Nearest output state on the failure chain, {@code null} when there is none.
     * The root links to itself and acts as the end-of-chain sentinel.
     */
    public State getSuffix() {
        return suffix;
    }

    void setSuffix(State suffix) {
        this.suffix = suffix;
    }

    /**
     * True when {@link #getSuffix()} points at a real output state.
     */
    public boolean hasSuffixOutput() {
        return suffix != null && !suffix.root;
    }

    public long getGeneration() {
        return generation;
    }

    public void setGeneration(long generation) {
        this.generation = generation;
    }

    @Override
    public String toString() {
        return "State@" + id + " (depth=" + depth + ", output=" + output
            + (output ? ", pattern=" + patternIndex : "")
            + ", children=" + (children == null ? 0 : children.size()) + ")";
    }
}
