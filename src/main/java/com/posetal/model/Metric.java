package com.posetal.model;

import static java.util.Objects.requireNonNull;

import java.util.Locale;

/** A named dimension along which outcomes are measured. Identified by its name. */
public final class Metric implements Comparable<Metric> {
    public enum Sense {
        MAXIMIZE,
        MINIMIZE;

        public static Sense parse(String string) {
            return switch (string.toLowerCase(Locale.ROOT)) {
                case "max", "maximize" -> MAXIMIZE;
                case "min", "minimize" -> MINIMIZE;
                default -> throw new IllegalArgumentException("Unsupported metric sense " + string);
            };
        }
    }

    private final String name;
    private final Sense sense;

    public Metric(String name, Sense sense) {
        this.name = requireNonNull(name);
        this.sense = requireNonNull(sense);
    }

    public static Metric of(String name) {
        return new Metric(name, Sense.MAXIMIZE);
    }

    public static Metric minimizing(String name) {
        return new Metric(name, Sense.MINIMIZE);
    }

    public String name() {
        return name;
    }

    public Sense sense() {
        return sense;
    }

    /** Positive if {@code first} is the better value, negative if {@code second} is, zero on a tie. */
    public int compareValues(double first, double second) {
        int comparison = Double.compare(first, second);
        return sense == Sense.MAXIMIZE ? comparison : -comparison;
    }

    @Override
    public int compareTo(Metric o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        assert !(o instanceof Metric that) || !name.equals(that.name) || sense == that.sense;
        return this == o || (o instanceof Metric that && name.equals(that.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
