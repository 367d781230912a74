package com.candidateprep.coach.critique;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table of the critique loop. The only cycle is
 * GENERATE, CRITIQUE, ITERATE and back to GENERATE, and it is left as soon as
 * {@link #shouldIterate} turns false.
 */
public final class LoopTransitions {

    private static final Map<LoopState, Set<LoopState>> ALLOWED = new EnumMap<>(LoopState.class);

    static {
        ALLOWED.put(LoopState.ANALYZE, EnumSet.of(LoopState.RETRIEVE));
        ALLOWED.put(LoopState.RETRIEVE, EnumSet.of(LoopState.GENERATE));
        // REFINE covers a failed regeneration when an earlier draft exists
        ALLOWED.put(LoopState.GENERATE, EnumSet.of(LoopState.CRITIQUE, LoopState.REFINE, LoopState.ERROR));
        ALLOWED.put(LoopState.CRITIQUE, EnumSet.of(LoopState.ITERATE, LoopState.REFINE));
        ALLOWED.put(LoopState.ITERATE, EnumSet.of(LoopState.GENERATE));
        ALLOWED.put(LoopState.REFINE, EnumSet.of(LoopState.EXTRACT));
        ALLOWED.put(LoopState.EXTRACT, EnumSet.of(LoopState.PREDICT_FOLLOWUPS));
        ALLOWED.put(LoopState.PREDICT_FOLLOWUPS, EnumSet.of(LoopState.DONE));
        ALLOWED.put(LoopState.DONE, EnumSet.noneOf(LoopState.class));
        ALLOWED.put(LoopState.ERROR, EnumSet.noneOf(LoopState.class));
    }

    private LoopTransitions() {
    }

    public static Set<LoopState> allowedFrom(LoopState state) {
        return Collections.unmodifiableSet(ALLOWED.get(state));
    }

    public static boolean isAllowed(LoopState from, LoopState to) {
        return ALLOWED.get(from).contains(to);
    }

    public static void check(LoopState from, LoopState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("Illegal critique loop transition " + from + " -> " + to);
        }
    }

    /**
     * Iterate only while the score is strictly below the threshold and the bound
     * has not been reached. A score equal to the threshold stops the loop.
     */
    public static boolean shouldIterate(double overall, int iterations, double threshold, int maxIterations) {
        return overall < threshold && iterations < maxIterations;
    }
}
