package com.posetal.learning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.posetal.model.Metric;
import com.posetal.model.PriorityOrder;
import com.posetal.order.OrderClass;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** The hypothesis space of a learner: distinct priority orders over one metric set. */
public final class CandidateOrderSet implements Iterable<PriorityOrder> {
  private final ImmutableList<PriorityOrder> candidates;
  private final ImmutableSet<Metric> metrics;

  private CandidateOrderSet(ImmutableList<PriorityOrder> candidates) {
    checkArgument(!candidates.isEmpty(), "No candidate orders");
    this.candidates = candidates;
    this.metrics = ImmutableSet.copyOf(candidates.get(0).metrics());
    checkArgument(candidates.stream().allMatch(c -> c.metrics().equals(metrics)),
        "Candidate orders range over different metrics");
  }

  public static CandidateOrderSet of(Collection<PriorityOrder> candidates) {
    return new CandidateOrderSet(ImmutableSet.copyOf(candidates).asList());
  }

  public static CandidateOrderSet enumerate(Collection<Metric> metrics, OrderClass orderClass) {
    return new CandidateOrderSet(ImmutableList.copyOf(PriorityOrder.enumerate(metrics, orderClass)));
  }

  public Set<Metric> metrics() {
    return metrics;
  }

  public int size() {
    return candidates.size();
  }

  public boolean contains(PriorityOrder order) {
    return candidates.contains(order);
  }

  public List<PriorityOrder> asList() {
    return candidates;
  }

  @Override
  public Iterator<PriorityOrder> iterator() {
    return candidates.iterator();
  }

  @Override
  public String toString() {
    return candidates.toString();
  }
}
