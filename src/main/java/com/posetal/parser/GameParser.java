package com.posetal.parser;

import static com.posetal.parser.ParseUtil.array;
import static com.posetal.parser.ParseUtil.stream;
import static com.posetal.parser.ParseUtil.strings;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.posetal.model.ActionProfile;
import com.posetal.model.Metric;
import com.posetal.model.MetricVector;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.model.PriorityOrder;
import com.posetal.order.OrderedPair;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Reads games from JSON.
 *
 * <pre>
 * { "name": "...",
 *   "metrics": ["payoff", {"name": "cost", "sense": "minimize"}],
 *   "players": {"P1": {"actions": ["A", "B"], "priority": [["cost", "payoff"]]}},
 *   "outcomes": [{"profile": {"P1": "A"}, "shared": {"cost": 1, "payoff": 2}}],
 *   "expected": [{"P1": "A"}] }
 * </pre>
 *
 * Priority pairs are {@code [higher, lower]}. A player ranks the metrics listed under
 * {@code "metrics"}, otherwise those mentioned in the priority pairs, otherwise all metrics of the
 * game. Outcomes either give {@code "shared"} values or per player {@code "values"}.
 */
public final class GameParser {
  private GameParser() {}

  public static PosetalGame parse(JsonObject json) {
    String name = json.has("name") ? json.getAsJsonPrimitive("name").getAsString() : "game";
    Map<String, Metric> metrics = stream(array(json, "metrics", "game " + name))
        .map(ParseUtil::parseMetric)
        .collect(Collectors.toMap(Metric::name, Function.identity(), (a, b) -> {
          throw new IllegalArgumentException("Duplicate metric " + a.name());
        }, LinkedHashMap::new));

    JsonObject playerData = requireNonNull(json.getAsJsonObject("players"), "Missing players definition");
    List<Player> players = new ArrayList<>();
    for (var entry : playerData.entrySet()) {
      players.add(parsePlayer(entry.getKey(), entry.getValue().getAsJsonObject(), metrics));
    }

    Map<Map<String, String>, Map<String, MetricVector>> table = new HashMap<>();
    for (JsonElement element : array(json, "outcomes", "game " + name)) {
      JsonObject outcome = element.getAsJsonObject();
      Map<String, String> profile = parseProfile(requireNonNull(outcome.getAsJsonObject("profile"),
          "Missing profile of outcome"));
      Map<String, MetricVector> values = new HashMap<>();
      if (outcome.has("shared")) {
        MetricVector shared = parseVector(outcome.getAsJsonObject("shared"), metrics);
        players.forEach(p -> values.put(p.name(), shared));
      } else {
        JsonObject perPlayer = requireNonNull(outcome.getAsJsonObject("values"),
            () -> "Missing values of outcome %s".formatted(profile));
        for (var playerValues : perPlayer.entrySet()) {
          values.put(playerValues.getKey(), parseVector(playerValues.getValue().getAsJsonObject(), metrics));
        }
      }
      if (table.put(profile, values) != null) {
        throw new IllegalArgumentException("Duplicate outcome for %s".formatted(profile));
      }
    }

    return PosetalGame.of(name, players, metrics.values(), (player, profile) -> {
      Map<String, MetricVector> values = table.get(profile.names());
      if (values == null) {
        throw new IllegalArgumentException("No outcome given for " + profile.names());
      }
      return values.get(player.name());
    });
  }

  /** The profiles listed under {@code "expected"}, or {@code null} if there are none. */
  @Nullable
  public static Set<ActionProfile> parseExpected(JsonObject json, PosetalGame game) {
    JsonArray expected = json.getAsJsonArray("expected");
    if (expected == null) {
      return null;
    }
    return stream(expected)
        .map(element -> game.profile(parseProfile(element.getAsJsonObject())))
        .collect(ImmutableSet.toImmutableSet());
  }

  private static Player parsePlayer(String name, JsonObject data, Map<String, Metric> metrics) {
    List<String> actions = strings(array(data, "actions", "player " + name)).toList();
    List<OrderedPair<Metric>> pairs = new ArrayList<>();
    Set<Metric> ranked = new LinkedHashSet<>();
    if (data.has("priority")) {
      for (JsonElement pairElement : data.getAsJsonArray("priority")) {
        JsonArray pair = pairElement.getAsJsonArray();
        if (pair.size() != 2) {
          throw new IllegalArgumentException("Priority pair %s of player %s must have two entries"
              .formatted(pair, name));
        }
        Metric higher = metric(metrics, pair.get(0).getAsString());
        Metric lower = metric(metrics, pair.get(1).getAsString());
        pairs.add(OrderedPair.of(higher, lower));
        ranked.add(higher);
        ranked.add(lower);
      }
    }
    if (data.has("metrics")) {
      ranked = strings(data.getAsJsonArray("metrics"))
          .map(m -> metric(metrics, m))
          .collect(Collectors.toCollection(LinkedHashSet::new));
    } else if (ranked.isEmpty()) {
      ranked.addAll(metrics.values());
    }
    for (OrderedPair<Metric> pair : pairs) {
      if (!ranked.contains(pair.upper()) || !ranked.contains(pair.lower())) {
        throw new IllegalArgumentException("Priority pair %s of player %s ranks metrics outside of %s"
            .formatted(pair, name, ranked));
      }
    }
    return Player.of(name, PriorityOrder.of(ranked, pairs), actions.toArray(String[]::new));
  }

  private static Map<String, String> parseProfile(JsonObject profile) {
    Map<String, String> actions = new LinkedHashMap<>();
    profile.entrySet().forEach(e -> actions.put(e.getKey(), e.getValue().getAsString()));
    return actions;
  }

  private static MetricVector parseVector(JsonObject values, Map<String, Metric> metrics) {
    MetricVector.Builder builder = MetricVector.builder();
    values.entrySet().forEach(e -> builder.put(metric(metrics, e.getKey()), e.getValue().getAsDouble()));
    return builder.build();
  }

  private static Metric metric(Map<String, Metric> metrics, String name) {
    Metric metric = metrics.get(name);
    if (metric == null) {
      throw new IllegalArgumentException("Unknown metric " + name);
    }
    return metric;
  }
}
