package com.posetal.order;

/**
 * Outcome of comparing two elements of a preorder. Incomparability is a regular result and never
 * collapsed into equality.
 */
public enum Comparison {
  GREATER,
  LESS,
  EQUAL,
  INCOMPARABLE;

  public Comparison inverse() {
    return switch (this) {
      case GREATER -> LESS;
      case LESS -> GREATER;
      case EQUAL, INCOMPARABLE -> this;
    };
  }

  public boolean isStrict() {
    return this == GREATER || this == LESS;
  }

  public boolean isAtLeast() {
    return this == GREATER || this == EQUAL;
  }

  public static Comparison of(boolean geq, boolean leq) {
    if (geq) {
      return leq ? EQUAL : GREATER;
    }
    return leq ? LESS : INCOMPARABLE;
  }

  @Override
  public String toString() {
    return switch (this) {
      case GREATER -> "≻";
      case LESS -> "≺";
      case EQUAL -> "=";
      case INCOMPARABLE -> "‖";
    };
  }
}
