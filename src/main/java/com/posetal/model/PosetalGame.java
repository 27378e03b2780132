package com.posetal.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.posetal.order.Comparison;
import com.posetal.order.OrderedPair;
import com.posetal.order.PreOrder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A finite game in which every player ranks outcomes through a priority order over metrics. The
 * outcome function is evaluated once for every action profile on construction.
 */
public final class PosetalGame {
    private static final Logger log = Logger.getLogger(PosetalGame.class.getName());

    private final String name;
    private final ImmutableList<Player> players;
    private final ImmutableMap<String, Player> playersByName;
    private final ImmutableSet<Metric> metrics;
    // profile x player name -> observed values
    private final ImmutableTable<ActionProfile, String, MetricVector> outcomes;

    private PosetalGame(String name, List<Player> players, Set<Metric> metrics,
            ImmutableTable<ActionProfile, String, MetricVector> outcomes) {
        this.name = name;
        this.players = ImmutableList.copyOf(players);
        this.playersByName = players.stream().collect(ImmutableMap.toImmutableMap(Player::name, p -> p));
        this.metrics = ImmutableSet.copyOf(metrics);
        this.outcomes = outcomes;
    }

    public static PosetalGame of(List<Player> players, Collection<Metric> metrics, OutcomeFunction outcome) {
        return of("game", players, metrics, outcome);
    }

    /**
     * Builds a game and evaluates {@code outcome} on every action profile.
     *
     * @throws InvalidGameException if there are no players, two players share a name, a priority
     *     order ranks unknown metrics or the outcome function is not total
     */
    public static PosetalGame of(String name, List<Player> players, Collection<Metric> metrics,
            OutcomeFunction outcome) {
        if (players.isEmpty()) {
            throw new InvalidGameException("Game %s has no players".formatted(name));
        }
        Set<String> names = players.stream().map(Player::name).collect(Collectors.toSet());
        if (names.size() != players.size()) {
            throw new InvalidGameException("Duplicate player names in game %s".formatted(name));
        }
        Set<Metric> metricSet = ImmutableSet.copyOf(metrics);
        for (Player player : players) {
            checkMetrics(player.name(), player.priority(), metricSet);
        }

        Stopwatch timer = Stopwatch.createStarted();
        ImmutableTable.Builder<ActionProfile, String, MetricVector> table = ImmutableTable.builder();
        List<List<Action>> actionSets = players.stream().map(p -> List.copyOf(p.actions())).toList();
        for (List<Action> actions : Lists.cartesianProduct(actionSets)) {
            Map<Player, Action> assignment = new LinkedHashMap<>();
            IntStream.range(0, players.size()).forEach(i -> assignment.put(players.get(i), actions.get(i)));
            ActionProfile profile = ActionProfile.of(assignment);
            for (Player player : players) {
                table.put(profile, player.name(), evaluate(outcome, player, profile));
            }
        }
        var game = new PosetalGame(name, players, metricSet, table.build());
        log.log(Level.FINE, () -> "Built game %s with %d profiles in %s"
                .formatted(name, game.profiles().size(), timer));
        return game;
    }

    private static void checkMetrics(String player, PriorityOrder priority, Set<Metric> metrics) {
        Set<Metric> unknown = Sets.difference(priority.metrics(), metrics);
        if (!unknown.isEmpty()) {
            throw new InvalidGameException("Priority order of player %s ranks unknown metrics %s"
                    .formatted(player, unknown));
        }
    }

    private static MetricVector evaluate(OutcomeFunction outcome, Player player, ActionProfile profile) {
        MetricVector vector;
        try {
            vector = outcome.evaluate(player, profile);
        } catch (RuntimeException e) {
            throw new InvalidGameException("Outcome function failed for player %s on %s"
                    .formatted(player.name(), profile), e);
        }
        if (vector == null || !vector.covers(player.metrics())) {
            throw new InvalidGameException("Outcome function does not define all metrics %s of player %s on %s"
                    .formatted(player.metrics(), player.name(), profile));
        }
        for (Metric metric : player.metrics()) {
            if (!Double.isFinite(vector.value(metric))) {
                throw new InvalidGameException("Non-finite value of %s for player %s on %s"
                        .formatted(metric, player.name(), profile));
            }
        }
        return vector;
    }

    public String name() {
        return name;
    }

    public List<Player> players() {
        return players;
    }

    public Player player(String name) {
        Player player = playersByName.get(name);
        checkArgument(player != null, "Unknown player %s", name);
        return player;
    }

    public Set<Metric> metrics() {
        return metrics;
    }

    /** All action profiles, in the order of the cartesian product of the players' actions. */
    public Set<ActionProfile> profiles() {
        return outcomes.rowKeySet();
    }

    public boolean contains(ActionProfile profile) {
        return outcomes.containsRow(profile);
    }

    /** The profile given by player names mapped to action names. */
    public ActionProfile profile(Map<String, String> actions) {
        checkArgument(actions.keySet().equals(playersByName.keySet()),
                "Profile %s does not assign exactly the players %s", actions, playersByName.keySet());
        Map<Player, Action> assignment = new LinkedHashMap<>();
        for (Player player : players) {
            assignment.put(player, player.action(actions.get(player.name())));
        }
        return ActionProfile.of(assignment);
    }

    /** The profile given by action names in player order. */
    public ActionProfile profile(String... actions) {
        checkArgument(actions.length == players.size(), "Expected %s actions", players.size());
        Map<String, String> assignment = new LinkedHashMap<>();
        for (int i = 0; i < actions.length; i++) {
            assignment.put(players.get(i).name(), actions[i]);
        }
        return profile(assignment);
    }

    public MetricVector outcome(Player player, ActionProfile profile) {
        MetricVector vector = outcomes.get(profile, player.name());
        checkArgument(vector != null, "Profile %s is not part of game %s", profile, name);
        return vector;
    }

    /** How {@code player} ranks {@code first} against {@code second}, according to this game's order. */
    public Comparison preference(Player player, ActionProfile first, ActionProfile second) {
        Player own = player(player.name());
        return Preferences.compare(own.priority(), outcome(own, first), outcome(own, second));
    }

    /** The profiles reachable from {@code profile} when only {@code player} changes their action. */
    public List<ActionProfile> deviations(Player player, ActionProfile profile) {
        Action current = profile.action(player);
        List<ActionProfile> deviations = new ArrayList<>(player.actions().size() - 1);
        for (Action action : player(player.name()).actions()) {
            if (!action.equals(current)) {
                deviations.add(profile.deviate(player, action));
            }
        }
        return deviations;
    }

    /**
     * The actions of {@code player} which are maximal with respect to their preference, the other
     * players' actions in {@code profile} being fixed.
     */
    public Set<Action> bestResponses(Player player, ActionProfile profile) {
        List<ActionProfile> alternatives = player(player.name()).actions().stream()
                .map(action -> profile.deviate(player, action))
                .toList();
        return inducedOrder(player, alternatives).maximalElements().stream()
                .map(p -> p.action(player))
                .collect(ImmutableSet.toImmutableSet());
    }

    /** The preorder {@code player} induces over all action profiles. */
    public PreOrder<ActionProfile> inducedOrder(Player player) {
        return inducedOrder(player, profiles());
    }

    private PreOrder<ActionProfile> inducedOrder(Player player, Collection<ActionProfile> profiles) {
        List<OrderedPair<ActionProfile>> relation = new ArrayList<>();
        for (ActionProfile first : profiles) {
            for (ActionProfile second : profiles) {
                if (!first.equals(second) && preference(player, first, second).isAtLeast()) {
                    relation.add(OrderedPair.of(first, second));
                }
            }
        }
        return PreOrder.of(profiles, relation);
    }

    public PosetalGame withPriority(Player player, PriorityOrder priority) {
        return withPriorities(Map.of(player.name(), priority));
    }

    /**
     * The same game with the priority orders of the given players replaced. The outcome table is
     * shared.
     */
    public PosetalGame withPriorities(Map<String, PriorityOrder> priorities) {
        checkArgument(playersByName.keySet().containsAll(priorities.keySet()),
                "Unknown players in %s", priorities.keySet());
        List<Player> updated = new ArrayList<>(players.size());
        for (Player player : players) {
            PriorityOrder priority = priorities.get(player.name());
            if (priority == null) {
                updated.add(player);
            } else {
                checkMetrics(player.name(), priority, metrics);
                if (!metricsDefined(player, priority.metrics())) {
                    throw new InvalidGameException("Outcomes of player %s do not define all metrics %s"
                            .formatted(player.name(), priority.metrics()));
                }
                updated.add(player.withPriority(priority));
            }
        }
        return new PosetalGame(name, updated, metrics, outcomes);
    }

    /** Whether every outcome of {@code player} assigns a value to each of {@code metrics}. */
    public boolean metricsDefined(Player player, Set<Metric> metrics) {
        return outcomes.column(player.name()).values().stream().allMatch(v -> v.covers(metrics));
    }

    @Override
    public String toString() {
        return "%s[%s; %s]".formatted(name, players, metrics);
    }
}
