package com.posetal.model;

import com.posetal.order.Comparison;
import java.util.ArrayList;
import java.util.List;

/** The preference a priority order induces on metric vectors. */
public final class Preferences {
    private Preferences() {}

    /**
     * Compares two outcomes. {@code first} is weakly preferred iff every metric on which it is worse
     * lies strictly below, in {@code priority}, some metric on which it is better. For a strict
     * ranking this is the lexicographic comparison, for pairwise incomparable metrics it is Pareto
     * dominance. Differences on incomparable or equally ranked metrics which point in opposite
     * directions leave the outcomes incomparable.
     */
    public static Comparison compare(PriorityOrder priority, MetricVector first, MetricVector second) {
        List<Metric> better = new ArrayList<>();
        List<Metric> worse = new ArrayList<>();
        for (Metric metric : priority.metrics()) {
            int comparison = metric.compareValues(first.value(metric), second.value(metric));
            if (comparison > 0) {
                better.add(metric);
            } else if (comparison < 0) {
                worse.add(metric);
            }
        }
        return Comparison.of(outweighed(priority, worse, better), outweighed(priority, better, worse));
    }

    private static boolean outweighed(PriorityOrder priority, List<Metric> losses, List<Metric> gains) {
        for (Metric loss : losses) {
            if (gains.stream().noneMatch(gain -> priority.higher(gain, loss))) {
                return false;
            }
        }
        return true;
    }
}
