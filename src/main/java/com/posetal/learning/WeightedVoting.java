package com.posetal.learning;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.posetal.algorithm.EquilibriumFinder;
import com.posetal.algorithm.EquilibriumFinder.Concept;
import com.posetal.model.Action;
import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Action distributions of a player who knows their own priority order and holds beliefs about the
 * orders of the others. An action receives the weight of every order profile of the other players
 * under which it occurs in an equilibrium, either summed or maximised over profiles.
 */
public final class WeightedVoting {
  private static final Logger log = Logger.getLogger(WeightedVoting.class.getName());

  public enum Aggregation {
    SUM,
    MAX
  }

  private final PosetalGame game;
  private final Aggregation aggregation;
  private final Concept concept;
  private final Map<Map<String, PriorityOrder>, Set<ActionProfile>> equilibria = new HashMap<>();

  public WeightedVoting(PosetalGame game, Aggregation aggregation, Concept concept) {
    this.game = game;
    this.aggregation = aggregation;
    this.concept = concept;
  }

  public Aggregation aggregation() {
    return aggregation;
  }

  /**
   * The distribution over the actions of {@code player}, assuming their order is {@code own} and
   * the orders of the others are distributed according to {@code beliefs}. Falls back to the uniform
   * distribution when the player acts alone or no order profile yields an equilibrium.
   */
  public Distribution<Action> actionDistribution(Player player, PriorityOrder own,
      Map<Player, Distribution<PriorityOrder>> beliefs) {
    Player self = game.player(player.name());
    List<Player> others = game.players().stream()
        .filter(p -> !p.equals(self) && beliefs.containsKey(p))
        .toList();
    Map<Action, Double> weights = new LinkedHashMap<>();
    self.actions().forEach(action -> weights.put(action, 0.0));
    if (others.isEmpty()) {
      return Distribution.uniform(weights.keySet());
    }

    List<List<PriorityOrder>> supports = new ArrayList<>(others.size());
    for (Player other : others) {
      supports.add(List.copyOf(beliefs.get(other).support()));
    }
    for (List<PriorityOrder> orders : Lists.cartesianProduct(supports)) {
      ImmutableMap.Builder<String, PriorityOrder> profile = ImmutableMap.builder();
      profile.put(self.name(), own);
      double probability = 1.0;
      for (int i = 0; i < others.size(); i++) {
        Player other = others.get(i);
        profile.put(other.name(), orders.get(i));
        probability *= beliefs.get(other).weight(orders.get(i));
      }
      double joint = probability;
      Set<Action> supported = equilibria(profile.buildOrThrow()).stream()
          .map(equilibrium -> equilibrium.action(self))
          .collect(Collectors.toSet());
      for (Action supportedAction : supported) {
        weights.compute(supportedAction, (action, weight) -> switch (aggregation) {
          case SUM -> weight + joint;
          case MAX -> Math.max(weight, joint);
        });
      }
    }

    double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
    if (total <= 0.0) {
      log.log(Level.WARNING, () -> "No equilibrium for %s under any believed order profile, playing uniformly"
          .formatted(self.name()));
      return Distribution.uniform(weights.keySet());
    }
    return Distribution.of(weights);
  }

  private Set<ActionProfile> equilibria(Map<String, PriorityOrder> orders) {
    return equilibria.computeIfAbsent(orders, o -> EquilibriumFinder.find(game.withPriorities(o), concept));
  }
}
