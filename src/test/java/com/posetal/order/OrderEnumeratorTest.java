package com.posetal.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OrderEnumeratorTest {

    private static List<Integer> ground(int size) {
        return IntStream.range(0, size).boxed().collect(Collectors.toList());
    }

    @ParameterizedTest
    @CsvSource({
        "PREORDER, 0, 1", "PREORDER, 1, 1", "PREORDER, 2, 4", "PREORDER, 3, 29", "PREORDER, 4, 355",
        "PARTIAL, 1, 1", "PARTIAL, 2, 3", "PARTIAL, 3, 19", "PARTIAL, 4, 219",
        "WEAK, 1, 1", "WEAK, 2, 3", "WEAK, 3, 13", "WEAK, 4, 75",
        "TOTAL, 1, 1", "TOTAL, 2, 2", "TOTAL, 3, 6", "TOTAL, 4, 24"
    })
    void count_matchesKnownSequences(OrderClass orderClass, int size, long expected) {
        assertThat(OrderEnumerator.count(ground(size), orderClass)).isEqualTo(expected);
    }

    @Test
    void enumerate_twoElements_yieldsAllFourPreorders() {
        List<String> ground = List.of("M1", "M2");

        assertThat(OrderEnumerator.enumerate(ground)).containsExactlyInAnyOrder(
                PreOrder.chain("M1", "M2"),
                PreOrder.chain("M2", "M1"),
                PreOrder.indifferent(ground),
                PreOrder.discrete(ground));
    }

    @Test
    void enumerate_yieldsEachOrderOnce() {
        List<PreOrder<Integer>> orders = ImmutableList.copyOf(OrderEnumerator.enumerate(ground(4)));

        assertThat(ImmutableSet.copyOf(orders)).hasSameSizeAs(orders);
    }

    @Test
    void enumerate_isRestartable() {
        Iterable<PreOrder<Integer>> orders = OrderEnumerator.enumerate(ground(3), OrderClass.PARTIAL);

        assertThat(ImmutableList.copyOf(orders)).isEqualTo(ImmutableList.copyOf(orders));
    }

    @Test
    void enumerate_onlyYieldsOrdersOfRequestedClass() {
        for (OrderClass orderClass : OrderClass.values()) {
            assertThat(OrderEnumerator.enumerate(ground(3), orderClass)).allMatch(orderClass::admits);
        }
    }

    @Test
    void enumerate_totalOrdersAreLinearExtensionsOfDiscreteOrder() {
        assertThat(OrderEnumerator.enumerate(ground(3), OrderClass.TOTAL))
                .containsExactlyInAnyOrderElementsOf(PreOrder.discrete(ground(3)).linearExtensions());
    }

    @Test
    void enumerate_rejectsLargeGroundSets() {
        assertThatThrownBy(() -> OrderEnumerator.enumerate(ground(OrderEnumerator.MAXIMAL_SIZE + 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stream_matchesIterable() {
        assertThat(OrderEnumerator.stream(ground(3), OrderClass.WEAK).count()).isEqualTo(13);
    }
}
