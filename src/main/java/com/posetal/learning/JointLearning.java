package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.posetal.model.Action;
import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Repeated play in which all players learn about each other simultaneously. In every iteration each
 * player draws an action from the {@link WeightedVoting} distribution given their true order and
 * the current beliefs about the others; afterwards the belief about every player is updated by
 * Bayes' rule, using as likelihood of a candidate order the probability that a player with this
 * order would have chosen the observed action.
 */
public final class JointLearning {
  private static final Logger log = Logger.getLogger(JointLearning.class.getName());

  private final PosetalGame game;
  private final WeightedVoting voting;
  private final Random random;
  private final Map<Player, BeliefState> beliefs;
  private final List<Map<Player, Distribution<PriorityOrder>>> history = new ArrayList<>();
  private final List<ActionProfile> plays = new ArrayList<>();

  private JointLearning(PosetalGame game, WeightedVoting voting, Map<Player, BeliefState> beliefs, Random random) {
    this.game = game;
    this.voting = voting;
    this.beliefs = beliefs;
    this.random = random;
    history.add(snapshot());
  }

  /**
   * Starts with uniform beliefs over the given candidates.
   *
   * @param game the game with every player's true priority order
   */
  public static JointLearning start(PosetalGame game, Map<Player, CandidateOrderSet> candidates,
      WeightedVoting voting, Random random) {
    Map<Player, BeliefState> beliefs = new LinkedHashMap<>();
    for (Player player : game.players()) {
      CandidateOrderSet set = candidates.get(player);
      checkArgument(set != null, "No candidate orders for player %s", player.name());
      beliefs.put(player, BeliefState.uniform(set));
    }
    return new JointLearning(game, voting, beliefs, random);
  }

  /** Plays one round and updates all beliefs. */
  public ActionProfile step() {
    Map<Player, Distribution<PriorityOrder>> current = snapshot();
    Map<Player, Action> chosen = new LinkedHashMap<>();
    for (Player player : game.players()) {
      Distribution<Action> distribution =
          voting.actionDistribution(player, player.priority(), others(current, player));
      chosen.put(player, distribution.sample(random));
    }
    ActionProfile played = ActionProfile.of(chosen);

    for (Player player : game.players()) {
      Map<Player, Distribution<PriorityOrder>> others = others(current, player);
      Action action = played.action(player);
      boolean updated = beliefs.get(player).multiply(candidate ->
          voting.actionDistribution(player, candidate, others).weight(action));
      if (!updated) {
        log.log(Level.WARNING, () -> "No candidate order of %s explains action %s, belief unchanged"
            .formatted(player.name(), action));
      }
    }
    plays.add(played);
    history.add(snapshot());
    log.log(Level.FINE, () -> "Iteration %d played %s".formatted(plays.size(), played));
    return played;
  }

  public List<ActionProfile> simulate(int iterations) {
    checkArgument(iterations >= 0);
    List<ActionProfile> trajectory = new ArrayList<>(iterations);
    for (int i = 0; i < iterations; i++) {
      trajectory.add(step());
    }
    log.log(Level.INFO, () -> "Simulated %d iterations, most likely orders %s".formatted(iterations, mostLikely()));
    return trajectory;
  }

  public Distribution<PriorityOrder> belief(Player player) {
    BeliefState belief = beliefs.get(game.player(player.name()));
    return belief.snapshot();
  }

  public Map<Player, Set<PriorityOrder>> mostLikely() {
    ImmutableMap.Builder<Player, Set<PriorityOrder>> result = ImmutableMap.builder();
    beliefs.forEach((player, belief) -> result.put(player, belief.snapshot().argMax()));
    return result.buildOrThrow();
  }

  /** The beliefs before the first iteration followed by the beliefs after every iteration. */
  public List<Map<Player, Distribution<PriorityOrder>>> history() {
    return List.copyOf(history);
  }

  public List<ActionProfile> plays() {
    return List.copyOf(plays);
  }

  private Map<Player, Distribution<PriorityOrder>> snapshot() {
    ImmutableMap.Builder<Player, Distribution<PriorityOrder>> snapshot = ImmutableMap.builder();
    beliefs.forEach((player, belief) -> snapshot.put(player, belief.snapshot()));
    return snapshot.buildOrThrow();
  }

  private static Map<Player, Distribution<PriorityOrder>> others(
      Map<Player, Distribution<PriorityOrder>> beliefs, Player player) {
    Map<Player, Distribution<PriorityOrder>> others = new LinkedHashMap<>(beliefs);
    others.remove(player);
    return others;
  }
}
