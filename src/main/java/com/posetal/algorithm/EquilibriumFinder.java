package com.posetal.algorithm;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.order.Comparison;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exhaustive search for pure equilibria. Every action profile is checked against every unilateral
 * deviation, stopping at the first deviation which disqualifies it.
 */
public final class EquilibriumFinder {
  private static final Logger log = Logger.getLogger(EquilibriumFinder.class.getName());

  public enum Concept {
    /** Every deviation must be weakly worse for the deviating player. */
    PURE_NASH,
    /** No deviation may be strictly better, incomparable deviations are tolerated. */
    ADMISSIBLE,
    /** Admissible profiles which no other admissible profile dominates for all players. */
    NON_DOMINATED
  }

  private EquilibriumFinder() {}

  public static Set<ActionProfile> find(PosetalGame game, Concept concept) {
    Stopwatch timer = Stopwatch.createStarted();
    Set<ActionProfile> equilibria = switch (concept) {
      case PURE_NASH -> filter(game, profile -> isPureNash(game, profile));
      case ADMISSIBLE -> filter(game, profile -> isAdmissible(game, profile));
      case NON_DOMINATED -> nonDominated(game, filter(game, profile -> isAdmissible(game, profile)));
    };
    log.log(Level.FINE, () -> "Found %d %s profiles in %s (%s)"
        .formatted(equilibria.size(), concept, game.name(), timer));
    return equilibria;
  }

  public static Set<ActionProfile> findPureNash(PosetalGame game) {
    return find(game, Concept.PURE_NASH);
  }

  public static Set<ActionProfile> findAdmissible(PosetalGame game) {
    return find(game, Concept.ADMISSIBLE);
  }

  public static Set<ActionProfile> findNonDominated(PosetalGame game) {
    return find(game, Concept.NON_DOMINATED);
  }

  public static boolean isPureNash(PosetalGame game, ActionProfile profile) {
    return disqualifyingDeviation(game, profile, Concept.PURE_NASH).isEmpty();
  }

  public static boolean isAdmissible(PosetalGame game, ActionProfile profile) {
    return disqualifyingDeviation(game, profile, Concept.ADMISSIBLE).isEmpty();
  }

  /** The first deviation which prevents {@code profile} from being an equilibrium, if any. */
  public static Optional<Deviation> disqualifyingDeviation(PosetalGame game, ActionProfile profile,
      Concept concept) {
    checkArgument(concept != Concept.NON_DOMINATED, "%s is not decided by deviations", concept);
    checkArgument(game.contains(profile), "Profile %s is not part of game %s", profile, game.name());
    for (Player player : game.players()) {
      for (ActionProfile alternative : game.deviations(player, profile)) {
        Comparison comparison = game.preference(player, profile, alternative);
        boolean disqualifies = concept == Concept.PURE_NASH
            ? !comparison.isAtLeast()
            : comparison == Comparison.LESS;
        if (disqualifies) {
          return Optional.of(new Deviation(player, profile, alternative, comparison));
        }
      }
    }
    return Optional.empty();
  }

  /** Whether every player weakly prefers {@code first} to {@code second} and one strictly. */
  public static boolean dominates(PosetalGame game, ActionProfile first, ActionProfile second) {
    boolean strict = false;
    for (Player player : game.players()) {
      Comparison comparison = game.preference(player, first, second);
      if (!comparison.isAtLeast()) {
        return false;
      }
      strict |= comparison == Comparison.GREATER;
    }
    return strict;
  }

  private static Set<ActionProfile> filter(PosetalGame game, Predicate<ActionProfile> condition) {
    return game.profiles().stream().filter(condition).collect(ImmutableSet.toImmutableSet());
  }

  private static Set<ActionProfile> nonDominated(PosetalGame game, Set<ActionProfile> profiles) {
    return profiles.stream()
        .filter(profile -> profiles.stream().noneMatch(other -> dominates(game, other, profile)))
        .collect(ImmutableSet.toImmutableSet());
  }
}
