package com.posetal.order;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Streams;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Generates every relation of a given {@link OrderClass} over a small ground set, each exactly once.
 *
 * <p>Candidates are subsets of the off-diagonal pairs. Only subsets which already are transitively
 * closed are kept, so each preorder appears once, as its own closure. The number of candidates is
 * {@code 2^(n(n-1))}, which limits the ground set to {@value #MAXIMAL_SIZE} elements.
 */
public final class OrderEnumerator {
  public static final int MAXIMAL_SIZE = 5;

  private OrderEnumerator() {}

  public static <E> Iterable<PreOrder<E>> enumerate(Collection<E> elements) {
    return enumerate(elements, OrderClass.PREORDER);
  }

  /**
   * A lazy sequence of all relations of the given class. Every call to {@code iterator()} starts
   * the enumeration over, in the same order.
   */
  public static <E> Iterable<PreOrder<E>> enumerate(Collection<E> elements, OrderClass orderClass) {
    ImmutableList<E> ground = ImmutableSet.copyOf(elements).asList();
    checkArgument(ground.size() <= MAXIMAL_SIZE,
        "Enumerating orders is only feasible for at most %s elements, got %s", MAXIMAL_SIZE, ground.size());
    return () -> new RelationIterator<>(ground, orderClass);
  }

  public static <E> Stream<PreOrder<E>> stream(Collection<E> elements, OrderClass orderClass) {
    return Streams.stream(enumerate(elements, orderClass));
  }

  private static final class RelationIterator<E> extends AbstractIterator<PreOrder<E>> {
    private final ImmutableList<E> ground;
    private final OrderClass orderClass;
    private final int[] upper;
    private final int[] lower;
    private final long limit;
    private long mask = 0;

    RelationIterator(ImmutableList<E> ground, OrderClass orderClass) {
      this.ground = ground;
      this.orderClass = orderClass;
      int size = ground.size();
      int pairs = size * (size - 1);
      this.upper = new int[pairs];
      this.lower = new int[pairs];
      int p = 0;
      for (int i = 0; i < size; i++) {
        for (int j = 0; j < size; j++) {
          if (i != j) {
            upper[p] = i;
            lower[p] = j;
            p++;
          }
        }
      }
      this.limit = 1L << pairs;
    }

    @Override
    protected PreOrder<E> computeNext() {
      while (mask < limit) {
        long current = mask++;
        int[] below = rows(current);
        if (isClosed(below) && fitsClass(below)) {
          return toOrder(current);
        }
      }
      return endOfData();
    }

    // below[i] holds the bit of every j with i >= j
    private int[] rows(long current) {
      int[] below = new int[ground.size()];
      for (int i = 0; i < below.length; i++) {
        below[i] = 1 << i;
      }
      for (int p = 0; p < upper.length; p++) {
        if ((current & (1L << p)) != 0) {
          below[upper[p]] |= 1 << lower[p];
        }
      }
      return below;
    }

    private static boolean isClosed(int[] below) {
      for (int i = 0; i < below.length; i++) {
        for (int j = 0; j < below.length; j++) {
          if ((below[i] & (1 << j)) != 0 && (below[j] & ~below[i]) != 0) {
            return false;
          }
        }
      }
      return true;
    }

    private boolean fitsClass(int[] below) {
      for (int i = 0; i < below.length; i++) {
        for (int j = i + 1; j < below.length; j++) {
          boolean geq = (below[i] & (1 << j)) != 0;
          boolean leq = (below[j] & (1 << i)) != 0;
          if (orderClass.requiresAntisymmetry() && geq && leq) {
            return false;
          }
          if (orderClass.requiresTotality() && !geq && !leq) {
            return false;
          }
        }
      }
      return true;
    }

    private PreOrder<E> toOrder(long current) {
      List<OrderedPair<E>> relation = new ArrayList<>();
      for (int p = 0; p < upper.length; p++) {
        if ((current & (1L << p)) != 0) {
          relation.add(OrderedPair.of(ground.get(upper[p]), ground.get(lower[p])));
        }
      }
      return PreOrder.of(ground, relation);
    }
  }

  /** The number of relations of the given class, computed by enumerating them. */
  public static long count(Collection<?> elements, OrderClass orderClass) {
    long count = 0;
    for (Iterator<?> iterator = enumerate(elements, orderClass).iterator(); iterator.hasNext(); iterator.next()) {
      count++;
    }
    return count;
  }
}
