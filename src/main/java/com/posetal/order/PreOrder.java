package com.posetal.order;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A reflexive and transitive relation over a finite ground set. Instances always hold the
 * reflexive-transitive closure of the relation they were created from, so every query answers
 * according to the closure and never according to the raw pairs.
 *
 * <p>The pair {@code (a, b)} is read as {@code a >= b}.
 */
public final class PreOrder<E> {
  private final ImmutableList<E> elements;
  private final ImmutableSet<E> elementSet;
  private final Object2IntMap<E> index;
  // geq[i][j] iff elements[i] >= elements[j]
  private final boolean[][] geq;
  private final ImmutableSet<OrderedPair<E>> pairs;

  private PreOrder(ImmutableList<E> elements, Object2IntMap<E> index, boolean[][] geq) {
    this.elements = elements;
    this.elementSet = ImmutableSet.copyOf(elements);
    this.index = index;
    this.geq = geq;

    ImmutableSet.Builder<OrderedPair<E>> builder = ImmutableSet.builder();
    for (int i = 0; i < geq.length; i++) {
      for (int j = 0; j < geq.length; j++) {
        if (geq[i][j]) {
          builder.add(new OrderedPair<>(elements.get(i), elements.get(j)));
        }
      }
    }
    this.pairs = builder.build();
  }

  /**
   * Closes the given relation over {@code ground}.
   *
   * @throws InvalidRelationException if a pair mentions an element outside of {@code ground}
   */
  public static <E> PreOrder<E> of(Collection<E> ground, Collection<OrderedPair<E>> relation) {
    ImmutableList<E> elements = ImmutableSet.copyOf(ground).asList();
    Object2IntMap<E> index = new Object2IntOpenHashMap<>(elements.size());
    index.defaultReturnValue(-1);
    for (E element : elements) {
      index.put(element, index.size());
    }

    int size = elements.size();
    boolean[][] geq = new boolean[size][size];
    for (int i = 0; i < size; i++) {
      geq[i][i] = true;
    }
    for (OrderedPair<E> pair : relation) {
      int upper = index.getInt(pair.upper());
      int lower = index.getInt(pair.lower());
      if (upper < 0 || lower < 0) {
        throw new InvalidRelationException("Pair %s references an element outside of %s"
            .formatted(pair, elements));
      }
      geq[upper][lower] = true;
    }

    // Warshall
    for (int k = 0; k < size; k++) {
      for (int i = 0; i < size; i++) {
        if (geq[i][k]) {
          boolean[] row = geq[i];
          boolean[] via = geq[k];
          for (int j = 0; j < size; j++) {
            row[j] |= via[j];
          }
        }
      }
    }
    return new PreOrder<>(elements, index, geq);
  }

  /** The order in which no two distinct elements are comparable. */
  public static <E> PreOrder<E> discrete(Collection<E> ground) {
    return of(ground, List.of());
  }

  /** The order in which all elements are equivalent. */
  public static <E> PreOrder<E> indifferent(Collection<E> ground) {
    List<E> list = List.copyOf(ground);
    List<OrderedPair<E>> relation = new ArrayList<>();
    for (int i = 1; i < list.size(); i++) {
      relation.add(OrderedPair.of(list.get(i - 1), list.get(i)));
      relation.add(OrderedPair.of(list.get(i), list.get(i - 1)));
    }
    return of(list, relation);
  }

  /** A total order, the first element being the highest one. */
  @SafeVarargs
  public static <E> PreOrder<E> chain(E... elements) {
    return chain(Arrays.asList(elements));
  }

  /** A total order, the first element being the highest one. */
  public static <E> PreOrder<E> chain(List<E> elements) {
    checkArgument(Set.copyOf(elements).size() == elements.size(), "Duplicate elements in %s", elements);
    List<OrderedPair<E>> relation = new ArrayList<>(elements.size());
    for (int i = 1; i < elements.size(); i++) {
      relation.add(OrderedPair.of(elements.get(i - 1), elements.get(i)));
    }
    return of(elements, relation);
  }

  private int indexOf(E element) {
    int i = index.getInt(element);
    if (i < 0) {
      throw new InvalidRelationException("Element %s is not in the domain %s".formatted(element, elements));
    }
    return i;
  }

  public ImmutableSet<E> elements() {
    return elementSet;
  }

  public int size() {
    return elements.size();
  }

  public boolean contains(E element) {
    return index.containsKey(element);
  }

  public boolean geq(E a, E b) {
    return geq[indexOf(a)][indexOf(b)];
  }

  public boolean leq(E a, E b) {
    return geq(b, a);
  }

  public boolean greater(E a, E b) {
    int i = indexOf(a);
    int j = indexOf(b);
    return geq[i][j] && !geq[j][i];
  }

  public boolean less(E a, E b) {
    return greater(b, a);
  }

  public boolean equivalent(E a, E b) {
    int i = indexOf(a);
    int j = indexOf(b);
    return geq[i][j] && geq[j][i];
  }

  public boolean comparable(E a, E b) {
    int i = indexOf(a);
    int j = indexOf(b);
    return geq[i][j] || geq[j][i];
  }

  public Comparison compare(E a, E b) {
    int i = indexOf(a);
    int j = indexOf(b);
    return Comparison.of(geq[i][j], geq[j][i]);
  }

  /** All pairs of the closure, reflexive ones included. */
  public ImmutableSet<OrderedPair<E>> pairs() {
    return pairs;
  }

  /**
   * The Hasse edges: {@code (a, b)} with {@code a > b} strictly and no {@code c} such that
   * {@code a > c > b}.
   */
  public ImmutableSet<OrderedPair<E>> coveringRelation() {
    int size = elements.size();
    ImmutableSet.Builder<OrderedPair<E>> covering = ImmutableSet.builder();
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < size; j++) {
        if (!strict(i, j)) {
          continue;
        }
        boolean direct = true;
        for (int k = 0; k < size && direct; k++) {
          if (strict(i, k) && strict(k, j)) {
            direct = false;
          }
        }
        if (direct) {
          covering.add(new OrderedPair<>(elements.get(i), elements.get(j)));
        }
      }
    }
    return covering.build();
  }

  private boolean strict(int i, int j) {
    return geq[i][j] && !geq[j][i];
  }

  public ImmutableSet<E> minimalElements() {
    return minimalElements(elements);
  }

  /** Elements of {@code subset} with nothing of {@code subset} strictly below them. */
  public ImmutableSet<E> minimalElements(Collection<E> subset) {
    return extremal(subset, false);
  }

  public ImmutableSet<E> maximalElements() {
    return maximalElements(elements);
  }

  /** Elements of {@code subset} with nothing of {@code subset} strictly above them. */
  public ImmutableSet<E> maximalElements(Collection<E> subset) {
    return extremal(subset, true);
  }

  private ImmutableSet<E> extremal(Collection<E> subset, boolean maximal) {
    int[] indices = subset.stream().mapToInt(this::indexOf).distinct().toArray();
    ImmutableSet.Builder<E> result = ImmutableSet.builder();
    for (int candidate : indices) {
      boolean extremal = true;
      for (int other : indices) {
        if (maximal ? strict(other, candidate) : strict(candidate, other)) {
          extremal = false;
          break;
        }
      }
      if (extremal) {
        result.add(elements.get(candidate));
      }
    }
    return result.build();
  }

  /** Classes of mutually equivalent elements, in order of their first element. */
  public List<ImmutableSet<E>> equivalenceClasses() {
    int size = elements.size();
    boolean[] assigned = new boolean[size];
    List<ImmutableSet<E>> classes = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      if (assigned[i]) {
        continue;
      }
      ImmutableSet.Builder<E> equivalenceClass = ImmutableSet.builder();
      for (int j = i; j < size; j++) {
        if (geq[i][j] && geq[j][i]) {
          assigned[j] = true;
          equivalenceClass.add(elements.get(j));
        }
      }
      classes.add(equivalenceClass.build());
    }
    return classes;
  }

  public boolean isPartialOrder() {
    int size = elements.size();
    for (int i = 0; i < size; i++) {
      for (int j = i + 1; j < size; j++) {
        if (geq[i][j] && geq[j][i]) {
          return false;
        }
      }
    }
    return true;
  }

  /** Whether any two elements are comparable, i.e. this is a weak order. */
  public boolean isTotal() {
    int size = elements.size();
    for (int i = 0; i < size; i++) {
      for (int j = i + 1; j < size; j++) {
        if (!geq[i][j] && !geq[j][i]) {
          return false;
        }
      }
    }
    return true;
  }

  public boolean isLinear() {
    return isTotal() && isPartialOrder();
  }

  public PreOrder<E> requirePartialOrder() {
    if (!isPartialOrder()) {
      throw new NotAPartialOrderException("Relation is not antisymmetric: %s".formatted(this));
    }
    return this;
  }

  /** The order induced on {@code subset}. */
  public PreOrder<E> restrict(Collection<E> subset) {
    Set<E> retained = ImmutableSet.copyOf(subset);
    retained.forEach(this::indexOf);
    List<OrderedPair<E>> relation = pairs.stream()
        .filter(p -> retained.contains(p.upper()) && retained.contains(p.lower()))
        .toList();
    return of(elements.stream().filter(retained::contains).toList(), relation);
  }

  /**
   * Lazily enumerates all total orders extending this partial order, each exactly once.
   *
   * @throws NotAPartialOrderException if this relation is not antisymmetric
   */
  public Iterable<PreOrder<E>> linearExtensions() {
    requirePartialOrder();
    return Iterables.transform(
        Iterables.filter(Collections2.permutations(elements), this::isRespectedBy),
        PreOrder::chain);
  }

  private boolean isRespectedBy(List<E> sequence) {
    for (int i = 0; i < sequence.size(); i++) {
      for (int j = i + 1; j < sequence.size(); j++) {
        if (greater(sequence.get(j), sequence.get(i))) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof PreOrder<?> that
        && elementSet.equals(that.elementSet)
        && pairs.equals(that.pairs));
  }

  @Override
  public int hashCode() {
    return pairs.hashCode();
  }

  @Override
  public String toString() {
    List<ImmutableSet<E>> classes = equivalenceClasses();
    var edges = coveringRelation().stream()
        .map(edge -> format(classOf(classes, edge.upper())) + ">" + format(classOf(classes, edge.lower())))
        .distinct()
        .collect(Collectors.joining(", "));
    var isolated = classes.stream()
        .filter(c -> c.stream().noneMatch(e -> coveringRelation().stream()
            .anyMatch(edge -> edge.upper().equals(e) || edge.lower().equals(e))))
        .map(PreOrder::format)
        .collect(Collectors.joining(", "));
    if (edges.isEmpty()) {
      return "[" + isolated + "]";
    }
    return isolated.isEmpty() ? "[" + edges + "]" : "[" + edges + "; " + isolated + "]";
  }

  private static <E> ImmutableSet<E> classOf(List<ImmutableSet<E>> classes, E element) {
    return classes.stream().filter(c -> c.contains(element)).findFirst().orElseThrow();
  }

  private static <E> String format(Set<E> equivalenceClass) {
    return equivalenceClass.size() == 1
        ? String.valueOf(equivalenceClass.iterator().next())
        : equivalenceClass.stream().map(String::valueOf).collect(Collectors.joining("=", "{", "}"));
  }
}
