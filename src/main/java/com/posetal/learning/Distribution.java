package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/** An immutable probability distribution over finitely many values, in a fixed iteration order. */
public final class Distribution<T> {
  static final double TOLERANCE = 1.0e-9;

  private final ImmutableMap<T, Double> weights;

  private Distribution(ImmutableMap<T, Double> weights) {
    this.weights = weights;
  }

  /** Normalises the given non-negative weights. */
  public static <T> Distribution<T> of(Map<T, Double> weights) {
    checkArgument(!weights.isEmpty(), "Empty distribution");
    double total = 0.0;
    for (double weight : weights.values()) {
      checkArgument(weight >= 0.0 && Double.isFinite(weight), "Invalid weight %s", weight);
      total += weight;
    }
    checkArgument(total > 0.0, "Weights %s have no mass", weights);
    ImmutableMap.Builder<T, Double> builder = ImmutableMap.builderWithExpectedSize(weights.size());
    double sum = total;
    weights.forEach((value, weight) -> builder.put(value, weight / sum));
    return new Distribution<>(builder.buildOrThrow());
  }

  public static <T> Distribution<T> uniform(Set<T> values) {
    return of(values.stream().collect(ImmutableMap.toImmutableMap(v -> v, v -> 1.0)));
  }

  public double weight(T value) {
    return weights.getOrDefault(value, 0.0);
  }

  public Set<T> values() {
    return weights.keySet();
  }

  /** The values with positive weight. */
  public Set<T> support() {
    return weights.entrySet().stream()
        .filter(e -> e.getValue() > 0.0)
        .map(Map.Entry::getKey)
        .collect(ImmutableSet.toImmutableSet());
  }

  public double maxWeight() {
    return weights.values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
  }

  /** All values of maximal weight. Ties are kept, not broken. */
  public Set<T> argMax() {
    double max = maxWeight();
    return weights.entrySet().stream()
        .filter(e -> e.getValue() >= max - TOLERANCE)
        .map(Map.Entry::getKey)
        .collect(ImmutableSet.toImmutableSet());
  }

  /** Shannon entropy in bits. */
  public double entropy() {
    double entropy = 0.0;
    for (double weight : weights.values()) {
      if (weight > 0.0) {
        entropy -= weight * Math.log(weight) / Math.log(2.0);
      }
    }
    return entropy;
  }

  public T sample(Random random) {
    double threshold = random.nextDouble();
    double cumulative = 0.0;
    @Nullable
    T last = null;
    for (Map.Entry<T, Double> entry : weights.entrySet()) {
      if (entry.getValue() <= 0.0) {
        continue;
      }
      last = entry.getKey();
      cumulative += entry.getValue();
      if (threshold < cumulative) {
        return last;
      }
    }
    // rounding left a gap below 1.0
    assert last != null;
    return last;
  }

  public Map<T, Double> asMap() {
    return weights;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Distribution<?> that && weights.equals(that.weights));
  }

  @Override
  public int hashCode() {
    return weights.hashCode();
  }

  @Override
  public String toString() {
    return weights.entrySet().stream()
        .map(e -> "%s:%.4f".formatted(e.getKey(), e.getValue()))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
