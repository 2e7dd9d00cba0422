package hypersum.algebra.expr;

public enum SKind {
  NUMBER(0),
  SYMBOL(1),
  POWER(2),
  MULTIPLY(3),
  ADD(4),
  FUNC(5);

  // Position of the kind in the canonical order of terms.
  private final int rank;

  SKind(int rank) {
    this.rank = rank;
  }

  int rank() {
    return rank;
  }
}
