package com.posetal.model;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.posetal.order.Comparison;
import com.posetal.order.OrderClass;
import com.posetal.order.OrderEnumerator;
import com.posetal.order.OrderedPair;
import com.posetal.order.PreOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks metrics by importance. {@code a} above {@code b} means that a difference in {@code a}
 * outweighs any difference in {@code b}.
 */
public final class PriorityOrder {
    private final PreOrder<Metric> relation;

    private PriorityOrder(PreOrder<Metric> relation) {
        this.relation = relation;
    }

    public static PriorityOrder of(PreOrder<Metric> relation) {
        return new PriorityOrder(relation);
    }

    /** Closes the relation given by pairs {@code (higher, lower)}. */
    public static PriorityOrder of(Collection<Metric> metrics, Collection<OrderedPair<Metric>> relation) {
        return new PriorityOrder(PreOrder.of(metrics, relation));
    }

    /** Strict ranking, the first metric being the most important. */
    public static PriorityOrder chain(Metric... metrics) {
        return new PriorityOrder(PreOrder.chain(Arrays.asList(metrics)));
    }

    public static PriorityOrder chain(List<Metric> metrics) {
        return new PriorityOrder(PreOrder.chain(metrics));
    }

    /** No metric outweighs another, outcomes are compared by Pareto dominance. */
    public static PriorityOrder incomparable(Collection<Metric> metrics) {
        return new PriorityOrder(PreOrder.discrete(metrics));
    }

    public static PriorityOrder indifferent(Collection<Metric> metrics) {
        return new PriorityOrder(PreOrder.indifferent(metrics));
    }

    public static Iterable<PriorityOrder> enumerate(Collection<Metric> metrics) {
        return enumerate(metrics, OrderClass.PREORDER);
    }

    public static Iterable<PriorityOrder> enumerate(Collection<Metric> metrics, OrderClass orderClass) {
        return Iterables.transform(OrderEnumerator.enumerate(metrics, orderClass), PriorityOrder::new);
    }

    public PreOrder<Metric> relation() {
        return relation;
    }

    public Set<Metric> metrics() {
        return relation.elements();
    }

    public Comparison compare(Metric a, Metric b) {
        return relation.compare(a, b);
    }

    /** Whether {@code a} has strictly higher priority than {@code b}. */
    public boolean higher(Metric a, Metric b) {
        return relation.greater(a, b);
    }

    public boolean isPartialOrder() {
        return relation.isPartialOrder();
    }

    /**
     * Splits the metrics into tiers, starting with the maximal metrics and proceeding with the
     * maximal metrics among the remaining ones.
     */
    public List<Set<Metric>> tiers() {
        Set<Metric> remaining = new LinkedHashSet<>(relation.elements());
        List<Set<Metric>> tiers = new ArrayList<>();
        while (!remaining.isEmpty()) {
            ImmutableSet<Metric> tier = relation.maximalElements(remaining);
            tiers.add(tier);
            remaining.removeAll(tier);
        }
        return tiers;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PriorityOrder that && relation.equals(that.relation));
    }

    @Override
    public int hashCode() {
        return relation.hashCode();
    }

    @Override
    public String toString() {
        return relation.toString();
    }
}
