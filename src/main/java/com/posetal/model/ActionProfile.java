package com.posetal.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** One action per player. */
public final class ActionProfile {
    private final ImmutableMap<Player, Action> actions;
    private final int hashCode;

    private ActionProfile(ImmutableMap<Player, Action> actions) {
        this.actions = actions;
        this.hashCode = actions.hashCode();
    }

    public static ActionProfile of(Map<Player, Action> actions) {
        actions.forEach((player, action) -> checkArgument(player.hasAction(action),
                "Action %s is not available to player %s", action, player.name()));
        return new ActionProfile(ImmutableMap.copyOf(actions));
    }

    public Action action(Player player) {
        Action action = actions.get(player);
        checkArgument(action != null, "Player %s does not act in %s", player.name(), this);
        return action;
    }

    public Set<Player> players() {
        return actions.keySet();
    }

    /** The profile in which {@code player} plays {@code action} and everybody else keeps their action. */
    public ActionProfile deviate(Player player, Action action) {
        checkArgument(actions.containsKey(player), "Player %s does not act in %s", player.name(), this);
        checkArgument(player.hasAction(action), "Action %s is not available to player %s", action, player.name());
        ImmutableMap.Builder<Player, Action> builder = ImmutableMap.builderWithExpectedSize(actions.size());
        actions.forEach((p, a) -> builder.put(p, p.equals(player) ? action : a));
        return new ActionProfile(builder.buildOrThrow());
    }

    /** Player names mapped to action names. */
    public Map<String, String> names() {
        return actions.entrySet().stream().collect(ImmutableMap.toImmutableMap(
                e -> e.getKey().name(), e -> e.getValue().name()));
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj
                || (obj instanceof ActionProfile that
                && hashCode == that.hashCode
                && actions.equals(that.actions));
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return actions.values().stream().map(Action::name).collect(Collectors.joining(",", "[", "]"));
    }
}
