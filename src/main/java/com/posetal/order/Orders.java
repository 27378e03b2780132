package com.posetal.order;

import java.util.Collection;
import java.util.Set;

/** Relation level entry points of the order engine. Each call closes the given relation first. */
public final class Orders {
  private Orders() {
    // static utility
  }

  /**
   * The reflexive-transitive closure of {@code relation} over {@code ground}.
   *
   * @throws InvalidRelationException if a pair mentions an element outside of {@code ground}
   */
  public static <E> PreOrder<E> close(Collection<E> ground, Collection<OrderedPair<E>> relation) {
    return PreOrder.of(ground, relation);
  }

  public static <E> boolean isPartialOrder(Collection<E> ground, Collection<OrderedPair<E>> relation) {
    return close(ground, relation).isPartialOrder();
  }

  public static <E> Set<OrderedPair<E>> coveringRelation(Collection<E> ground,
      Collection<OrderedPair<E>> relation) {
    return close(ground, relation).coveringRelation();
  }

  public static <E> Set<E> minimalElements(Collection<E> ground, Collection<OrderedPair<E>> relation,
      Collection<E> subset) {
    return close(ground, relation).minimalElements(subset);
  }

  public static <E> Set<E> maximalElements(Collection<E> ground, Collection<OrderedPair<E>> relation,
      Collection<E> subset) {
    return close(ground, relation).maximalElements(subset);
  }

  public static <E> Comparison compare(Collection<E> ground, Collection<OrderedPair<E>> relation, E a, E b) {
    return close(ground, relation).compare(a, b);
  }
}
