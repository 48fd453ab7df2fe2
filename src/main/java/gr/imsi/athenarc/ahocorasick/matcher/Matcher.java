package gr.imsi.athenarc.ahocorasick.matcher;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.jetbrains.annotations.NotNull;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.ahocorasick.automaton.Automaton;
import gr.imsi.athenarc.ahocorasick.automaton.AutomatonBuilder;
import gr.imsi.athenarc.ahocorasick.config.MatcherConfiguration;
import gr.imsi.athenarc.ahocorasick.util.TextDecoding;

/**
 * Multi-pattern matcher over a fixed dictionary. Every search is a single pass over the
 * text's code points; results refer to patterns by their index in the dictionary.
 *
 * <p>Byte input is decoded as UTF-8 first, so {@code match(s.getBytes(UTF_8))} and
 * {@code match(s)} always agree.
 *
 * <p>Thread safety: {@link #matchThreadSafe}, {@link #contains}, {@link #matchFirst} and
 * {@link #findAll} may be called concurrently. {@link #match} keeps its dedup markers on
 * the shared states and must not run concurrently with another {@link #match} call on the
 * same matcher.
 */
public class Matcher {

    private final Automaton automaton;
    private final MatcherConfiguration configuration;
    private final AtomicLong generations = new AtomicLong();
    private final GenerationPool pool;

    private Matcher(Automaton automaton, MatcherConfiguration configuration) {
        this.automaton = automaton;
        this.configuration = configuration;
        this.pool = new GenerationPool(automaton.getPatternCount(), configuration.getPoolCapacity());
    }

    public static Matcher fromStrings(List<String> dictionary) {
        return fromStrings(dictionary, MatcherConfiguration.defaults());
    }

    public static Matcher fromStrings(String... dictionary) {
        Preconditions.checkNotNull(dictionary, "Dictionary must not be null.");
        return fromStrings(Arrays.asList(dictionary));
    }

    public static Matcher fromStrings(List<String> dictionary, MatcherConfiguration configuration) {
        Preconditions.checkNotNull(configuration, "Configuration must not be null.");
        return new Matcher(AutomatonBuilder.build(dictionary), configuration);
    }

    /**
     * Builds a matcher from UTF-8 encoded patterns.
     */
    public static Matcher fromBytes(List<byte[]> dictionary) {
        return fromBytes(dictionary, MatcherConfiguration.defaults());
    }

    public static Matcher fromBytes(List<byte[]> dictionary, MatcherConfiguration configuration) {
        return fromStrings(TextDecoding.decodeAll(dictionary), configuration);
    }

    /**
     * Returns the index of every pattern found in the text, each state reported at most
     * once per call. Not safe for concurrent use, see {@link #matchThreadSafe(String)}.
     */
    @NotNull
    public List<Integer> match(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        long generation = generations.incrementAndGet();
        return MatchTraversal.collect(automaton, text, state -> {
            if (state.getGeneration() != generation) {
                state.setGeneration(generation);
                return true;
            }
            return false;
        }, configuration.getInitialHitCapacity());
    }

    @NotNull
    public List<Integer> match(byte[] text) {
        return match(TextDecoding.decode(text));
    }

    /**
     * Same result as {@link #match(String)}, with dedup kept in a pooled per-call table
     * instead of on the shared states.
     */
    @NotNull
    public List<Integer> matchThreadSafe(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        long generation = generations.incrementAndGet();
        long[] seen = pool.acquire();
        try {
            return MatchTraversal.collect(automaton, text, state -> {
                int index = state.getPatternIndex();
                if (seen[index] != generation) {
                    seen[index] = generation;
                    return true;
                }
                return false;
            }, configuration.getInitialHitCapacity());
        } finally {
            pool.release(seen);
        }
    }

    @NotNull
    public List<Integer> matchThreadSafe(byte[] text) {
        return matchThreadSafe(TextDecoding.decode(text));
    }

    /**
     * Returns true as soon as any pattern is found.
     */
    public boolean contains(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        return MatchTraversal.contains(automaton, text);
    }

    public boolean contains(byte[] text) {
        return contains(TextDecoding.decode(text));
    }

    /**
     * Returns the first pattern found, preferring the longest pattern ending at the
     * earliest position.
     */
    @NotNull
    public FirstMatch matchFirst(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        return MatchTraversal.first(automaton, text);
    }

    @NotNull
    public FirstMatch matchFirst(byte[] text) {
        return matchFirst(TextDecoding.decode(text));
    }

    /**
     * Returns every occurrence of every pattern with its position, ordered by end offset.
     * Offsets of byte input refer to the decoded text.
     */
    @NotNull
    public List<PatternOccurrence> findAll(String text) {
        Preconditions.checkNotNull(text, "Text must not be null.");
        return MatchTraversal.occurrences(automaton, text, configuration.getInitialHitCapacity());
    }

    @NotNull
    public List<PatternOccurrence> findAll(byte[] text) {
        return findAll(TextDecoding.decode(text));
    }

    public String getPattern(int index) {
        return automaton.getPatterns().get(index);
    }

    public int size() {
        return automaton.getPatternCount();
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    public MatcherConfiguration getConfiguration() {
        return configuration;
    }

    GenerationPool getPool() {
        return pool;
    }
}
