package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.posetal.algorithm.EquilibriumFinder;
import com.posetal.model.Action;
import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Infers the priority order of one player from observed play by weighted voting. Every candidate
 * order votes for itself according to how well it explains an observed profile; the belief is
 * updated after each observation.
 *
 * <p>A session owns its belief state. Nothing guarantees convergence: observations no single order
 * explains may leave the belief flat or make it oscillate.
 */
public final class LearningSession {
  private static final Logger log = Logger.getLogger(LearningSession.class.getName());

  private final PosetalGame game;
  private final Player target;
  private final CandidateOrderSet candidates;
  private final LearningConfig config;
  private final BeliefState belief;
  private final Map<PriorityOrder, PosetalGame> candidateGames = new HashMap<>();
  private final Map<PriorityOrder, Set<Action>> equilibriumActions = new HashMap<>();
  private final List<Distribution<PriorityOrder>> history = new ArrayList<>();
  private int rounds = 0;

  private LearningSession(PosetalGame game, Player target, CandidateOrderSet candidates,
      LearningConfig config, BeliefState belief) {
    this.game = game;
    this.target = game.player(target.name());
    this.candidates = candidates;
    this.config = config;
    this.belief = belief;
    history.add(belief.snapshot());
  }

  /** Starts a session with a uniform prior. */
  public static LearningSession start(PosetalGame game, Player target, CandidateOrderSet candidates,
      LearningConfig config) {
    checkCandidates(game, target, candidates);
    return new LearningSession(game, target, candidates, config, BeliefState.uniform(candidates));
  }

  public static LearningSession start(PosetalGame game, Player target, CandidateOrderSet candidates,
      LearningConfig config, Map<PriorityOrder, Double> prior) {
    checkCandidates(game, target, candidates);
    return new LearningSession(game, target, candidates, config, BeliefState.of(candidates, prior));
  }

  private static void checkCandidates(PosetalGame game, Player target, CandidateOrderSet candidates) {
    checkArgument(game.metrics().containsAll(candidates.metrics()),
        "Candidates rank metrics %s outside of the game", candidates.metrics());
    checkArgument(game.metricsDefined(game.player(target.name()), candidates.metrics()),
        "Outcomes of player %s do not define all candidate metrics %s", target.name(), candidates.metrics());
  }

  public Player target() {
    return target;
  }

  public LearningConfig config() {
    return config;
  }

  /** Updates the belief with one observed profile. */
  public void observe(ActionProfile profile) {
    checkArgument(game.contains(profile), "Profile %s is not part of game %s", profile, game.name());
    boolean updated = switch (config.mode()) {
      case PROBABILITY -> belief.multiply(candidate -> score(candidate, profile));
      case MAX -> belief.concentrate(candidate -> score(candidate, profile));
    };
    rounds++;
    if (!updated) {
      log.log(Level.WARNING, () -> "Round %d: no candidate explains %s, belief unchanged"
          .formatted(rounds, profile));
    }
    Distribution<PriorityOrder> snapshot = belief.snapshot();
    history.add(snapshot);
    log.log(Level.FINE, () -> "Round %d after %s: %s".formatted(rounds, profile, snapshot));
  }

  /**
   * Observes profiles until {@link LearningConfig#maxRounds()} observations have been made in this
   * session or the belief is concentrated.
   *
   * @return the number of observations consumed by this call
   */
  public int run(Iterable<ActionProfile> observations) {
    int consumed = 0;
    for (ActionProfile profile : observations) {
      if (rounds >= config.maxRounds() || isConcentrated()) {
        break;
      }
      observe(profile);
      consumed++;
    }
    int total = consumed;
    log.log(Level.INFO, () -> "Learning %s stopped after %d rounds, most likely %s"
        .formatted(target.name(), total, mostLikely()));
    return consumed;
  }

  /**
   * How well {@code candidate} explains the target's action in {@code observed}, as a probability
   * of that action.
   */
  public double score(PriorityOrder candidate, ActionProfile observed) {
    Action action = observed.action(target);
    Set<Action> plausible = switch (config.scoring()) {
      case EQUILIBRIUM -> equilibriumActions.computeIfAbsent(candidate, this::equilibriumActions);
      case BEST_RESPONSE -> candidateGame(candidate).bestResponses(target, observed);
    };
    if (plausible.isEmpty()) {
      return 1.0 / target.actions().size();
    }
    return plausible.contains(action) ? 1.0 / plausible.size() : 0.0;
  }

  private Set<Action> equilibriumActions(PriorityOrder candidate) {
    return EquilibriumFinder.find(candidateGame(candidate), config.concept()).stream()
        .map(profile -> profile.action(target))
        .collect(ImmutableSet.toImmutableSet());
  }

  private PosetalGame candidateGame(PriorityOrder candidate) {
    return candidateGames.computeIfAbsent(candidate, c -> game.withPriority(target, c));
  }

  /** An immutable snapshot of the current belief. */
  public Distribution<PriorityOrder> belief() {
    return belief.snapshot();
  }

  /** The candidates of maximal weight; before any observation under a uniform prior, all of them. */
  public Set<PriorityOrder> mostLikely() {
    return belief.snapshot().argMax();
  }

  public boolean isConcentrated() {
    return belief.snapshot().maxWeight() >= config.concentrationThreshold();
  }

  public int rounds() {
    return rounds;
  }

  /** The belief before the first observation followed by the belief after each observation. */
  public List<Distribution<PriorityOrder>> history() {
    return List.copyOf(history);
  }

  public CandidateOrderSet candidates() {
    return candidates;
  }
}
