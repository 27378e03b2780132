package com.posetal.generator;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Lists;
import com.posetal.model.Action;
import com.posetal.model.ActionProfile;
import com.posetal.model.Metric;
import com.posetal.model.MetricVector;
import com.posetal.model.OutcomeFunction;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import com.posetal.order.OrderClass;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Random games for case studies: players {@code P1..Pn} with actions {@code A1..Ak}, metrics
 * {@code M1..Mm} whose values are drawn uniformly from {@code [0, 1)} for every profile and shared by
 * all players, and priority orders drawn uniformly from all orders of the given class.
 */
public final class RandomGames {
  private RandomGames() {}

  public static List<Metric> metrics(int count) {
    return IntStream.rangeClosed(1, count).mapToObj(i -> Metric.of("M" + i)).toList();
  }

  public static PosetalGame generate(int players, int actions, int metrics, OrderClass orderClass, Random random) {
    checkArgument(players > 0 && actions > 0 && metrics > 0, "Sizes must be positive");
    List<Metric> metricList = metrics(metrics);
    List<PriorityOrder> candidates = Lists.newArrayList(PriorityOrder.enumerate(metricList, orderClass));

    List<Player> playerList = new ArrayList<>(players);
    String[] actionNames = IntStream.rangeClosed(1, actions).mapToObj(i -> "A" + i).toArray(String[]::new);
    for (int i = 1; i <= players; i++) {
      playerList.add(Player.of("P" + i, candidates.get(random.nextInt(candidates.size())), actionNames));
    }

    Map<List<Action>, MetricVector> values = new HashMap<>();
    List<List<Action>> actionSets = playerList.stream().map(p -> List.copyOf(p.actions())).toList();
    for (List<Action> profile : Lists.cartesianProduct(actionSets)) {
      MetricVector.Builder vector = MetricVector.builder();
      metricList.forEach(metric -> vector.put(metric, random.nextDouble()));
      values.put(profile, vector.build());
    }
    OutcomeFunction outcome = OutcomeFunction.shared(profile -> values.get(actionsOf(playerList, profile)));
    return PosetalGame.of("random-%dx%dx%d".formatted(players, actions, metrics), playerList, metricList, outcome);
  }

  private static List<Action> actionsOf(List<Player> players, ActionProfile profile) {
    return players.stream().map(profile::action).toList();
  }
}
