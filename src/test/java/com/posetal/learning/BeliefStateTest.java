package com.posetal.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.posetal.model.Metric;
import com.posetal.model.PriorityOrder;
import com.posetal.order.OrderClass;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BeliefStateTest {

    private static final Metric X = Metric.of("x");
    private static final Metric Y = Metric.of("y");
    private static final PriorityOrder X_FIRST = PriorityOrder.chain(X, Y);
    private static final PriorityOrder Y_FIRST = PriorityOrder.chain(Y, X);
    private static final PriorityOrder PARETO = PriorityOrder.incomparable(List.of(X, Y));
    private static final PriorityOrder TIED = PriorityOrder.indifferent(List.of(X, Y));

    private static final CandidateOrderSet CANDIDATES = CandidateOrderSet.enumerate(List.of(X, Y), OrderClass.PREORDER);

    private static double total(BeliefState belief) {
        return belief.snapshot().asMap().values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Test
    void candidates_ofTwoMetrics() {
        assertThat(CANDIDATES.size()).isEqualTo(4);
        assertThat(CANDIDATES).containsExactlyInAnyOrder(X_FIRST, Y_FIRST, PARETO, TIED);
        assertThat(CANDIDATES.metrics()).containsExactlyInAnyOrder(X, Y);
    }

    @Test
    void candidates_areDeduplicatedAndConsistent() {
        assertThat(CandidateOrderSet.of(List.of(X_FIRST, X_FIRST, Y_FIRST)).size()).isEqualTo(2);
        assertThatThrownBy(() -> CandidateOrderSet.of(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CandidateOrderSet.of(List.of(X_FIRST, PriorityOrder.chain(X))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uniform_sumsToOne() {
        BeliefState belief = BeliefState.uniform(CANDIDATES);

        assertThat(belief.weight(X_FIRST)).isCloseTo(0.25, within(1e-12));
        assertThat(total(belief)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void of_normalisesPriorAndZeroesMissingCandidates() {
        BeliefState belief = BeliefState.of(CANDIDATES, Map.of(X_FIRST, 3.0, PARETO, 1.0));

        assertThat(belief.weight(X_FIRST)).isCloseTo(0.75, within(1e-12));
        assertThat(belief.weight(PARETO)).isCloseTo(0.25, within(1e-12));
        assertThat(belief.weight(Y_FIRST)).isZero();
    }

    @Test
    void of_rejectsInvalidPriors() {
        PriorityOrder foreign = PriorityOrder.chain(Metric.of("z"));

        assertThatThrownBy(() -> BeliefState.of(CANDIDATES, Map.of(foreign, 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BeliefState.of(CANDIDATES, Map.of(X_FIRST, -1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BeliefState.of(CANDIDATES, Map.of(X_FIRST, 0.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void multiply_reweightsAndRenormalises() {
        BeliefState belief = BeliefState.uniform(CANDIDATES);

        boolean updated = belief.multiply(candidate -> candidate.equals(X_FIRST) ? 1.0 : 0.5);

        assertThat(updated).isTrue();
        assertThat(belief.weight(X_FIRST)).isCloseTo(0.4, within(1e-12));
        assertThat(belief.weight(TIED)).isCloseTo(0.2, within(1e-12));
        assertThat(total(belief)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void multiply_withoutMass_leavesBeliefUnchanged() {
        BeliefState belief = BeliefState.of(CANDIDATES, Map.of(X_FIRST, 1.0, Y_FIRST, 1.0));

        boolean updated = belief.multiply(candidate -> 0.0);

        assertThat(updated).isFalse();
        assertThat(belief.weight(X_FIRST)).isCloseTo(0.5, within(1e-12));
        assertThat(belief.weight(Y_FIRST)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void concentrate_splitsMassAmongWinners() {
        BeliefState belief = BeliefState.uniform(CANDIDATES);

        boolean updated = belief.concentrate(candidate -> candidate.equals(Y_FIRST) ? 0.0 : 0.5);

        assertThat(updated).isTrue();
        assertThat(belief.weight(Y_FIRST)).isZero();
        assertThat(belief.weight(X_FIRST)).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(belief.weight(PARETO)).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(belief.snapshot().argMax()).containsExactlyInAnyOrder(X_FIRST, PARETO, TIED);
    }

    @Test
    void concentrate_withoutMass_leavesBeliefUnchanged() {
        BeliefState belief = BeliefState.uniform(CANDIDATES);

        assertThat(belief.concentrate(candidate -> 0.0)).isFalse();
        assertThat(belief.snapshot().argMax()).hasSize(4);
    }

    @Test
    void scores_mustBeNonNegative() {
        BeliefState belief = BeliefState.uniform(CANDIDATES);

        assertThatThrownBy(() -> belief.multiply(candidate -> -1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
