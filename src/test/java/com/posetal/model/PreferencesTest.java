package com.posetal.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.posetal.order.Comparison;
import com.posetal.order.OrderedPair;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PreferencesTest {

    private static final Metric TIME = Metric.of("time");
    private static final Metric COST = Metric.of("cost");

    private static MetricVector vector(double time, double cost) {
        return MetricVector.of(TIME, time, COST, cost);
    }

    @Test
    void compare_strictRanking_isLexicographic() {
        PriorityOrder timeFirst = PriorityOrder.chain(TIME, COST);

        assertThat(Preferences.compare(timeFirst, vector(2, 0), vector(1, 5))).isEqualTo(Comparison.GREATER);
        assertThat(Preferences.compare(timeFirst, vector(1, 5), vector(2, 0))).isEqualTo(Comparison.LESS);
        assertThat(Preferences.compare(timeFirst, vector(1, 5), vector(1, 4))).isEqualTo(Comparison.GREATER);
    }

    @Test
    void compare_incomparableMetrics_isPareto() {
        PriorityOrder pareto = PriorityOrder.incomparable(List.of(TIME, COST));

        assertThat(Preferences.compare(pareto, vector(2, 0), vector(1, 5))).isEqualTo(Comparison.INCOMPARABLE);
        assertThat(Preferences.compare(pareto, vector(2, 5), vector(1, 5))).isEqualTo(Comparison.GREATER);
        assertThat(Preferences.compare(pareto, vector(1, 4), vector(1, 5))).isEqualTo(Comparison.LESS);
    }

    @Test
    void compare_equallyRankedMetricsDisagreeing_isIncomparable() {
        PriorityOrder tie = PriorityOrder.indifferent(List.of(TIME, COST));

        assertThat(Preferences.compare(tie, vector(2, 0), vector(1, 5))).isEqualTo(Comparison.INCOMPARABLE);
    }

    @Test
    void compare_identicalValues_isEqual() {
        PriorityOrder timeFirst = PriorityOrder.chain(TIME, COST);

        assertThat(Preferences.compare(timeFirst, vector(1, 1), vector(1, 1))).isEqualTo(Comparison.EQUAL);
    }

    @Test
    void compare_ignoresMetricsOutsideOfOrder() {
        PriorityOrder timeOnly = PriorityOrder.chain(TIME);

        assertThat(Preferences.compare(timeOnly, vector(1, 0), vector(1, 9))).isEqualTo(Comparison.EQUAL);
    }

    @Test
    void compare_respectsMinimisingMetrics() {
        Metric cost = Metric.minimizing("cost");
        PriorityOrder order = PriorityOrder.chain(cost);

        assertThat(Preferences.compare(order, MetricVector.of(cost, 1), MetricVector.of(cost, 3)))
                .isEqualTo(Comparison.GREATER);
    }

    @Test
    void compare_partialOrder_outweighsOnlyThroughHigherMetrics() {
        Metric speed = Metric.of("speed");
        // time above cost, speed unrelated
        PriorityOrder order = PriorityOrder.of(List.of(TIME, COST, speed), List.of(OrderedPair.of(TIME, COST)));
        MetricVector first = MetricVector.builder().put(TIME, 2).put(COST, 0).put(speed, 0).build();
        MetricVector second = MetricVector.builder().put(TIME, 1).put(COST, 5).put(speed, 1).build();

        assertThat(Preferences.compare(order, first, second)).isEqualTo(Comparison.INCOMPARABLE);
    }

    @Test
    void compare_rejectsMissingValues() {
        PriorityOrder timeFirst = PriorityOrder.chain(TIME, COST);

        assertThatThrownBy(() -> Preferences.compare(timeFirst, MetricVector.of(TIME, 1), vector(1, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void priorityOrder_tiers() {
        Metric speed = Metric.of("speed");
        PriorityOrder order = PriorityOrder.of(List.of(TIME, COST, speed),
                List.of(OrderedPair.of(TIME, COST), OrderedPair.of(TIME, speed)));

        assertThat(order.tiers()).containsExactly(Set.of(TIME), Set.of(COST, speed));
        assertThat(order.higher(TIME, COST)).isTrue();
        assertThat(order.compare(COST, speed)).isEqualTo(Comparison.INCOMPARABLE);
    }

    @Test
    void metricSense_parse() {
        assertThat(Metric.Sense.parse("min")).isEqualTo(Metric.Sense.MINIMIZE);
        assertThat(Metric.Sense.parse("Maximize")).isEqualTo(Metric.Sense.MAXIMIZE);
        assertThatThrownBy(() -> Metric.Sense.parse("median")).isInstanceOf(IllegalArgumentException.class);
    }
}
