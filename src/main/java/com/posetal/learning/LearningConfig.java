package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.posetal.algorithm.EquilibriumFinder.Concept;

/**
 * Settings of a {@link LearningSession}.
 *
 * @param mode how candidate scores change the belief
 * @param scoring how consistent a candidate order is with an observed profile
 * @param concept the equilibrium notion used by {@link Scoring#EQUILIBRIUM}
 * @param maxRounds the number of observations after which {@link LearningSession#run} stops
 * @param concentrationThreshold the weight at which a single candidate ends a run early
 */
public record LearningConfig(VotingMode mode, Scoring scoring, Concept concept, int maxRounds,
    double concentrationThreshold) {
  public enum VotingMode {
    /** Multiply weights by scores and renormalise. */
    PROBABILITY,
    /** Keep only the best candidates, splitting the mass equally. */
    MAX
  }

  public enum Scoring {
    /** The observed action must occur in an equilibrium of the game under the candidate. */
    EQUILIBRIUM,
    /** The observed action must be a best response to the other observed actions. */
    BEST_RESPONSE
  }

  public LearningConfig {
    requireNonNull(mode);
    requireNonNull(scoring);
    requireNonNull(concept);
    checkArgument(maxRounds > 0, "maxRounds must be positive, got %s", maxRounds);
    checkArgument(concentrationThreshold > 0.0 && concentrationThreshold <= 1.0,
        "concentrationThreshold must lie in (0, 1], got %s", concentrationThreshold);
  }

  public static LearningConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private VotingMode mode = VotingMode.PROBABILITY;
    private Scoring scoring = Scoring.EQUILIBRIUM;
    private Concept concept = Concept.NON_DOMINATED;
    private int maxRounds = 100;
    private double concentrationThreshold = 0.99;

    private Builder() {}

    public Builder mode(VotingMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder scoring(Scoring scoring) {
      this.scoring = scoring;
      return this;
    }

    public Builder concept(Concept concept) {
      this.concept = concept;
      return this;
    }

    public Builder maxRounds(int maxRounds) {
      this.maxRounds = maxRounds;
      return this;
    }

    public Builder concentrationThreshold(double concentrationThreshold) {
      this.concentrationThreshold = concentrationThreshold;
      return this;
    }

    public LearningConfig build() {
      return new LearningConfig(mode, scoring, concept, maxRounds, concentrationThreshold);
    }
  }
}
