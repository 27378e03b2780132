package com.posetal.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.posetal.PosetalException;
import com.posetal.order.Comparison;
import com.posetal.order.PreOrder;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PosetalGameTest {

    private static final Metric X = Metric.of("x");
    private static final Metric Y = Metric.of("y");

    // one player, A is best in x, B is best in y, C is dominated
    private static PosetalGame singlePlayer(PriorityOrder priority) {
        Player player = Player.of("P1", priority, "A", "B", "C");
        return PosetalGame.of("single", List.of(player), List.of(X, Y), OutcomeFunction.shared(profile ->
                switch (profile.action(player).name()) {
                    case "A" -> MetricVector.of(X, 1, Y, 0);
                    case "B" -> MetricVector.of(X, 0, Y, 1);
                    default -> MetricVector.of(X, 0, Y, 0);
                }));
    }

    @Test
    void of_enumeratesAllProfiles() {
        Player p1 = Player.of("P1", PriorityOrder.chain(X), "A", "B");
        Player p2 = Player.of("P2", PriorityOrder.chain(X), "A", "B", "C");

        PosetalGame game = PosetalGame.of(List.of(p1, p2), List.of(X),
                OutcomeFunction.shared(profile -> MetricVector.of(X, 0)));

        assertThat(game.profiles()).hasSize(6);
        assertThat(game.profiles()).first().hasToString("[A,A]");
        assertThat(game.contains(game.profile("B", "C"))).isTrue();
    }

    @Test
    void player_withoutActions_isRejected() {
        assertThatThrownBy(() -> Player.of("P1", PriorityOrder.chain(X)))
                .isInstanceOf(EmptyActionSpaceException.class)
                .isInstanceOf(InvalidGameException.class)
                .hasMessageContaining("P1");
    }

    @Test
    void player_withDuplicateActions_isRejected() {
        assertThatThrownBy(() -> Player.of("P1", PriorityOrder.chain(X), "A", "A"))
                .isInstanceOf(InvalidGameException.class);
    }

    @Test
    void of_withoutPlayers_isRejected() {
        assertThatThrownBy(() -> PosetalGame.of(List.of(), List.of(X), (p, profile) -> MetricVector.of(X, 0)))
                .isInstanceOf(InvalidGameException.class);
    }

    @Test
    void of_withDuplicatePlayerNames_isRejected() {
        Player player = Player.of("P1", PriorityOrder.chain(X), "A");

        assertThatThrownBy(() -> PosetalGame.of(List.of(player, player), List.of(X),
                (p, profile) -> MetricVector.of(X, 0)))
                .isInstanceOf(InvalidGameException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void of_withUnknownPriorityMetrics_isRejected() {
        Player player = Player.of("P1", PriorityOrder.chain(X, Y), "A");

        assertThatThrownBy(() -> PosetalGame.of(List.of(player), List.of(X), (p, profile) -> MetricVector.of(X, 0)))
                .isInstanceOf(InvalidGameException.class)
                .hasMessageContaining("unknown metrics");
    }

    @Test
    void of_withPartialOutcomeFunction_isRejected() {
        Player player = Player.of("P1", PriorityOrder.chain(X, Y), "A", "B");

        assertThatThrownBy(() -> PosetalGame.of(List.of(player), List.of(X, Y), (p, profile) -> MetricVector.of(X, 0)))
                .isInstanceOf(InvalidGameException.class)
                .isInstanceOf(PosetalException.class);
    }

    @Test
    void of_withFailingOutcomeFunction_keepsCause() {
        Player player = Player.of("P1", PriorityOrder.chain(X), "A");
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> PosetalGame.of(List.of(player), List.of(X), (p, profile) -> {
            throw failure;
        })).isInstanceOf(InvalidGameException.class).hasCause(failure);
    }

    @Test
    void of_withNonFiniteOutcome_isRejected() {
        Player player = Player.of("P1", PriorityOrder.chain(X), "A");

        assertThatThrownBy(() -> PosetalGame.of(List.of(player), List.of(X),
                (p, profile) -> MetricVector.of(X, Double.NaN)))
                .isInstanceOf(InvalidGameException.class)
                .hasMessageContaining("Non-finite");
    }

    @Test
    void preference_followsPriorityOrder() {
        PosetalGame game = singlePlayer(PriorityOrder.chain(X, Y));
        Player player = game.player("P1");

        assertThat(game.preference(player, game.profile("A"), game.profile("B"))).isEqualTo(Comparison.GREATER);
        assertThat(game.preference(player, game.profile("C"), game.profile("B"))).isEqualTo(Comparison.LESS);
    }

    @Test
    void bestResponses_areMaximalDeviations() {
        PosetalGame lexicographic = singlePlayer(PriorityOrder.chain(X, Y));
        PosetalGame pareto = singlePlayer(PriorityOrder.incomparable(List.of(X, Y)));

        assertThat(lexicographic.bestResponses(lexicographic.player("P1"), lexicographic.profile("C")))
                .containsExactly(new Action("A"));
        assertThat(pareto.bestResponses(pareto.player("P1"), pareto.profile("C")))
                .containsExactlyInAnyOrder(new Action("A"), new Action("B"));
    }

    @Test
    void deviations_changeOnlyOnePlayer() {
        Player p1 = Player.of("P1", PriorityOrder.chain(X), "A", "B");
        Player p2 = Player.of("P2", PriorityOrder.chain(X), "A", "B", "C");
        PosetalGame game = PosetalGame.of(List.of(p1, p2), List.of(X),
                OutcomeFunction.shared(profile -> MetricVector.of(X, 0)));

        assertThat(game.deviations(p2, game.profile("A", "A")))
                .containsExactly(game.profile("A", "B"), game.profile("A", "C"));
    }

    @Test
    void inducedOrder_ranksAllProfiles() {
        PosetalGame game = singlePlayer(PriorityOrder.incomparable(List.of(X, Y)));
        PreOrder<ActionProfile> induced = game.inducedOrder(game.player("P1"));

        assertThat(induced.size()).isEqualTo(3);
        assertThat(induced.maximalElements()).containsExactlyInAnyOrder(game.profile("A"), game.profile("B"));
        assertThat(induced.minimalElements()).containsExactly(game.profile("C"));
    }

    @Test
    void withPriority_sharesOutcomesAndChangesPreference() {
        PosetalGame game = singlePlayer(PriorityOrder.chain(X, Y));
        Player player = game.player("P1");

        PosetalGame flipped = game.withPriority(player, PriorityOrder.chain(Y, X));

        assertThat(flipped.outcome(player, flipped.profile("A"))).isEqualTo(game.outcome(player, game.profile("A")));
        assertThat(flipped.preference(player, flipped.profile("A"), flipped.profile("B"))).isEqualTo(Comparison.LESS);
        assertThat(game.player("P1").priority()).isEqualTo(PriorityOrder.chain(X, Y));
    }

    @Test
    void withPriorities_rejectsUnknownPlayersAndMetrics() {
        PosetalGame game = singlePlayer(PriorityOrder.chain(X, Y));

        assertThatThrownBy(() -> game.withPriorities(Map.of("P9", PriorityOrder.chain(X))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> game.withPriorities(Map.of("P1", PriorityOrder.chain(Metric.of("z")))))
                .isInstanceOf(InvalidGameException.class);
    }

    @Test
    void profile_rejectsUnavailableActions() {
        PosetalGame game = singlePlayer(PriorityOrder.chain(X, Y));

        assertThatThrownBy(() -> game.profile("D")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> game.profile(Map.of("P2", "A"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void actionProfile_deviate() {
        PosetalGame game = singlePlayer(PriorityOrder.chain(X, Y));
        Player player = game.player("P1");

        ActionProfile deviated = game.profile("A").deviate(player, player.action("C"));

        assertThat(deviated).isEqualTo(game.profile("C"));
        assertThat(deviated.names()).containsExactly(Map.entry("P1", "C"));
    }
}
