package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;

import com.posetal.model.PriorityOrder;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Weights over a {@link CandidateOrderSet}, always summing to one. Only the learning engine
 * mutates it, callers receive {@link Distribution} snapshots.
 */
public final class BeliefState {
  private static final Logger log = Logger.getLogger(BeliefState.class.getName());

  private final CandidateOrderSet candidates;
  private final Object2DoubleMap<PriorityOrder> weights;

  private BeliefState(CandidateOrderSet candidates, Object2DoubleMap<PriorityOrder> weights) {
    this.candidates = candidates;
    this.weights = weights;
  }

  public static BeliefState uniform(CandidateOrderSet candidates) {
    Object2DoubleMap<PriorityOrder> weights = new Object2DoubleLinkedOpenHashMap<>(candidates.size());
    double weight = 1.0 / candidates.size();
    candidates.forEach(candidate -> weights.put(candidate, weight));
    return new BeliefState(candidates, weights);
  }

  /**
   * A belief starting from the given prior. Candidates missing from {@code prior} start with
   * weight zero; the weights are normalised if necessary.
   */
  public static BeliefState of(CandidateOrderSet candidates, Map<PriorityOrder, Double> prior) {
    double total = 0.0;
    for (var entry : prior.entrySet()) {
      checkArgument(candidates.contains(entry.getKey()), "Prior mentions non-candidate %s", entry.getKey());
      double weight = entry.getValue();
      checkArgument(weight >= 0.0 && Double.isFinite(weight), "Invalid prior weight %s", weight);
      total += weight;
    }
    checkArgument(total > 0.0, "Prior has no mass");
    if (Math.abs(total - 1.0) > Distribution.TOLERANCE) {
      double sum = total;
      log.log(Level.INFO, () -> "Normalising prior with total weight %s".formatted(sum));
    }

    Object2DoubleMap<PriorityOrder> weights = new Object2DoubleLinkedOpenHashMap<>(candidates.size());
    for (PriorityOrder candidate : candidates) {
      weights.put(candidate, prior.getOrDefault(candidate, 0.0) / total);
    }
    return new BeliefState(candidates, weights);
  }

  public CandidateOrderSet candidates() {
    return candidates;
  }

  public double weight(PriorityOrder candidate) {
    checkArgument(weights.containsKey(candidate), "%s is not a candidate", candidate);
    return weights.getDouble(candidate);
  }

  public Distribution<PriorityOrder> snapshot() {
    Map<PriorityOrder, Double> copy = new LinkedHashMap<>();
    for (Object2DoubleMap.Entry<PriorityOrder> entry : weights.object2DoubleEntrySet()) {
      copy.put(entry.getKey(), entry.getDoubleValue());
    }
    return Distribution.of(copy);
  }

  /**
   * Multiplies every weight with its score and renormalises. If no candidate keeps any mass the
   * belief is left as it is and {@code false} is returned.
   */
  boolean multiply(ToDoubleFunction<PriorityOrder> scores) {
    Object2DoubleMap<PriorityOrder> products = products(scores);
    double total = 0.0;
    for (double product : products.values()) {
      total += product;
    }
    if (total <= 0.0) {
      return false;
    }
    for (Object2DoubleMap.Entry<PriorityOrder> entry : products.object2DoubleEntrySet()) {
      weights.put(entry.getKey(), entry.getDoubleValue() / total);
    }
    return true;
  }

  /**
   * Moves all mass onto the candidates maximising weight times score, split equally. If no
   * candidate has a positive product the belief is left as it is and {@code false} is returned.
   */
  boolean concentrate(ToDoubleFunction<PriorityOrder> scores) {
    Object2DoubleMap<PriorityOrder> products = products(scores);
    double max = 0.0;
    for (double product : products.values()) {
      max = Math.max(max, product);
    }
    if (max <= 0.0) {
      return false;
    }
    double threshold = max * (1.0 - Distribution.TOLERANCE);
    int winners = 0;
    for (double product : products.values()) {
      if (product >= threshold) {
        winners++;
      }
    }
    for (Object2DoubleMap.Entry<PriorityOrder> entry : products.object2DoubleEntrySet()) {
      weights.put(entry.getKey(), entry.getDoubleValue() >= threshold ? 1.0 / winners : 0.0);
    }
    return true;
  }

  private Object2DoubleMap<PriorityOrder> products(ToDoubleFunction<PriorityOrder> scores) {
    Object2DoubleMap<PriorityOrder> products = new Object2DoubleLinkedOpenHashMap<>(weights.size());
    for (Object2DoubleMap.Entry<PriorityOrder> entry : weights.object2DoubleEntrySet()) {
      double weight = entry.getDoubleValue();
      if (weight > 0.0) {
        double score = scores.applyAsDouble(entry.getKey());
        checkArgument(score >= 0.0 && Double.isFinite(score), "Invalid score %s", score);
        products.put(entry.getKey(), weight * score);
      } else {
        products.put(entry.getKey(), 0.0);
      }
    }
    return products;
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
