package com.posetal.order;

import static java.util.Objects.requireNonNull;

/** States that {@code upper} is at least as high as {@code lower}. */
public record OrderedPair<E>(E upper, E lower) {
  public OrderedPair {
    requireNonNull(upper);
    requireNonNull(lower);
  }

  public static <E> OrderedPair<E> of(E upper, E lower) {
    return new OrderedPair<>(upper, lower);
  }

  public boolean isReflexive() {
    return upper.equals(lower);
  }

  public OrderedPair<E> inverse() {
    return new OrderedPair<>(lower, upper);
  }

  @Override
  public String toString() {
    return upper + ">=" + lower;
  }
}
