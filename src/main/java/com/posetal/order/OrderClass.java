package com.posetal.order;

/** The kinds of relation the {@link OrderEnumerator} can generate. */
public enum OrderClass {
  /** Strict rankings without ties. */
  TOTAL,
  /** Rankings into tiers, elements of one tier being equally important. */
  WEAK,
  /** Antisymmetric orders, possibly with incomparable elements. */
  PARTIAL,
  /** Any reflexive and transitive relation. */
  PREORDER;

  public boolean admits(PreOrder<?> order) {
    return switch (this) {
      case TOTAL -> order.isLinear();
      case WEAK -> order.isTotal();
      case PARTIAL -> order.isPartialOrder();
      case PREORDER -> true;
    };
  }

  boolean requiresAntisymmetry() {
    return this == TOTAL || this == PARTIAL;
  }

  boolean requiresTotality() {
    return this == TOTAL || this == WEAK;
  }
}
