package gr.imsi.athenarc.ahocorasick.matcher;

import gr.imsi.athenarc.ahocorasick.automaton.State;

@FunctionalInterface
public interface HitFilter {
    /**
     * Called for every output state reached during one match call.
     * Returns true the first time a state is seen in that call, false afterwards.
     */
    boolean firstSighting(State state);
}
