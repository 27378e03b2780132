package com.posetal.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.posetal.model.Action;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.order.OrderClass;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RandomGamesTest {

    @Test
    void generate_buildsRequestedShape() {
        PosetalGame game = RandomGames.generate(2, 3, 2, OrderClass.PREORDER, new Random(1));

        assertThat(game.name()).isEqualTo("random-2x3x2");
        assertThat(game.players()).extracting(Player::name).containsExactly("P1", "P2");
        assertThat(game.metrics()).containsExactlyElementsOf(RandomGames.metrics(2));
        assertThat(game.profiles()).hasSize(9);
        assertThat(game.player("P2").actions()).extracting(Action::name).containsExactly("A1", "A2", "A3");
    }

    @Test
    void generate_drawsOrdersOfRequestedClass() {
        PosetalGame game = RandomGames.generate(3, 2, 3, OrderClass.TOTAL, new Random(2));

        assertThat(game.players()).allSatisfy(player -> assertThat(player.priority().relation().isLinear()).isTrue());
    }

    @Test
    void generate_sharesValuesAmongPlayers() {
        PosetalGame game = RandomGames.generate(2, 2, 2, OrderClass.WEAK, new Random(3));

        assertThat(game.profiles()).allSatisfy(profile -> assertThat(game.outcome(game.player("P1"), profile))
                .isEqualTo(game.outcome(game.player("P2"), profile)));
    }

    @Test
    void generate_isReproducibleWithSeed() {
        PosetalGame first = RandomGames.generate(2, 2, 3, OrderClass.PREORDER, new Random(4));
        PosetalGame second = RandomGames.generate(2, 2, 3, OrderClass.PREORDER, new Random(4));

        for (Player player : first.players()) {
            assertThat(second.player(player.name()).priority()).isEqualTo(player.priority());
        }
        assertThat(first.profiles()).allSatisfy(profile -> assertThat(first.outcome(first.player("P1"), profile))
                .isEqualTo(second.outcome(second.player("P1"), profile)));
    }

    @Test
    void generate_rejectsEmptyDimensions() {
        assertThatThrownBy(() -> RandomGames.generate(0, 2, 2, OrderClass.TOTAL, new Random(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
