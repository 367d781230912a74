package com.candidateprep.coach.critique;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LoopTransitionsTest {

    @Test
    void critiqueBranchesOnlyToIterateOrRefine() {
        assertThat(LoopTransitions.allowedFrom(LoopState.CRITIQUE))
            .containsExactlyInAnyOrder(LoopState.ITERATE, LoopState.REFINE);
        assertThat(LoopTransitions.allowedFrom(LoopState.ITERATE)).containsExactly(LoopState.GENERATE);
    }

    @Test
    void terminalStatesHaveNoExits() {
        assertThat(LoopTransitions.allowedFrom(LoopState.DONE)).isEmpty();
        assertThat(LoopTransitions.allowedFrom(LoopState.ERROR)).isEmpty();
    }

    @Test
    void illegalTransitionIsRejected() {
        assertThatThrownBy(() -> LoopTransitions.check(LoopState.ANALYZE, LoopState.GENERATE))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ANALYZE -> GENERATE");
        assertThatThrownBy(() -> LoopTransitions.check(LoopState.REFINE, LoopState.GENERATE))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void everyStateReachesATerminalState() {
        for (LoopState start : LoopState.values()) {
            Set<LoopState> seen = EnumSet.noneOf(LoopState.class);
            Deque<LoopState> queue = new ArrayDeque<>();
            queue.add(start);
            boolean terminal = false;
            while (!queue.isEmpty()) {
                LoopState state = queue.poll();
                if (!seen.add(state)) continue;
                if (state.isTerminal()) terminal = true;
                queue.addAll(LoopTransitions.allowedFrom(state));
            }
            assertThat(terminal).as("terminal reachable from %s", start).isTrue();
        }
    }

    @ParameterizedTest
    @CsvSource({
        "5.0, 1, true",
        "6.9, 2, true",
        "6.9, 3, false",
        "7.0, 1, false",
        "9.5, 1, false",
        "0.0, 3, false"
    })
    void iteratesOnlyBelowThresholdAndUnderBound(double overall, int iterations, boolean expected) {
        assertThat(LoopTransitions.shouldIterate(overall, iterations, 7.0, 3)).isEqualTo(expected);
    }
}
