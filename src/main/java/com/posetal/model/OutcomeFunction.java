package com.posetal.model;

import java.util.function.Function;

/** Assigns each player the metric values they observe under an action profile. */
@FunctionalInterface
public interface OutcomeFunction {
    MetricVector evaluate(Player player, ActionProfile profile);

    /** An outcome function under which all players observe the same values. */
    static OutcomeFunction shared(Function<ActionProfile, MetricVector> outcome) {
        return (player, profile) -> outcome.apply(profile);
    }
}
