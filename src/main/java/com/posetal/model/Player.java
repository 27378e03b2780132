package com.posetal.model;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

public final class Player implements Comparable<Player> {
    private final String name;
    private final PriorityOrder priority;
    private final ImmutableMap<String, Action> actions;

    public Player(String name, PriorityOrder priority, Collection<Action> actions) {
        this.name = requireNonNull(name);
        this.priority = requireNonNull(priority);
        if (actions.isEmpty()) {
            throw new EmptyActionSpaceException(name);
        }
        ImmutableMap.Builder<String, Action> builder = ImmutableMap.builder();
        actions.forEach(action -> builder.put(action.name(), action));
        try {
            this.actions = builder.buildOrThrow();
        } catch (IllegalArgumentException e) {
            throw new InvalidGameException("Duplicate actions for player %s".formatted(name), e);
        }
    }

    public static Player of(String name, PriorityOrder priority, String... actions) {
        return new Player(name, priority, Arrays.stream(actions).map(Action::new).toList());
    }

    public String name() {
        return name;
    }

    public PriorityOrder priority() {
        return priority;
    }

    /** The metrics this player cares about, i.e. those ranked by the priority order. */
    public Set<Metric> metrics() {
        return priority.metrics();
    }

    public Collection<Action> actions() {
        return actions.values();
    }

    public Action action(String name) {
        Action action = actions.get(name);
        if (action == null) {
            throw new IllegalArgumentException("Player %s has no action %s".formatted(this.name, name));
        }
        return action;
    }

    public boolean hasAction(Action action) {
        return action.equals(actions.get(action.name()));
    }

    public Player withPriority(PriorityOrder priority) {
        return new Player(name, priority, actions.values());
    }

    @Override
    public int compareTo(Player o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Player that && name.equals(that.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "%s@{%s}".formatted(name, String.join(",", actions.keySet()));
    }
}
