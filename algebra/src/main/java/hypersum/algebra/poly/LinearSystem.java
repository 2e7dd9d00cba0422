package hypersum.algebra.poly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A system of linear equations over rational functions, solved by Gauss-Jordan elimination. */
public class LinearSystem {
  private final int unknowns;
  private final List<RationalFunction[]> rows;

  public LinearSystem(int unknowns) {
    if (unknowns <= 0) throw new IllegalArgumentException("a system needs at least one unknown");
    this.unknowns = unknowns;
    this.rows = new ArrayList<>();
  }

  /** Adds {@code sum(coefficients[i] * x_i) = rhs}. */
  public void addEquation(List<RationalFunction> coefficients, RationalFunction rhs) {
    if (coefficients.size() != unknowns)
      throw new IllegalArgumentException(
          "expected " + unknowns + " coefficients, got " + coefficients.size());
    final RationalFunction[] row = new RationalFunction[unknowns + 1];
    for (int i = 0; i < unknowns; ++i) row[i] = coefficients.get(i);
    row[unknowns] = rhs;
    rows.add(row);
  }

  public int unknowns() {
    return unknowns;
  }

  public int equations() {
    return rows.size();
  }

  /**
   * Solution of the system. Unknowns left undetermined are set to zero and reported as free.
   */
  public record Solution(boolean consistent, List<RationalFunction> values, List<Integer> free) {
    static Solution inconsistent() {
      return new Solution(false, Collections.emptyList(), Collections.emptyList());
    }
  }

  public Solution solve() {
    final RationalFunction[][] m = new RationalFunction[rows.size()][];
    for (int i = 0; i < m.length; ++i) m[i] = rows.get(i).clone();

    final int[] pivotRowOf = new int[unknowns];
    int row = 0;
    for (int col = 0; col < unknowns; ++col) {
      pivotRowOf[col] = -1;
      int pivot = row;
      while (pivot < m.length && m[pivot][col].isZero()) ++pivot;
      if (pivot == m.length) continue;

      final RationalFunction[] tmp = m[row];
      m[row] = m[pivot];
      m[pivot] = tmp;

      final RationalFunction inverse = m[row][col].reciprocal();
      for (int j = col; j <= unknowns; ++j) m[row][j] = m[row][j].multiply(inverse);
      for (int i = 0; i < m.length; ++i) {
        if (i == row || m[i][col].isZero()) continue;
        final RationalFunction factor = m[i][col];
        for (int j = col; j <= unknowns; ++j)
          m[i][j] = m[i][j].subtract(factor.multiply(m[row][j]));
      }
      pivotRowOf[col] = row++;
    }

    for (int i = row; i < m.length; ++i) if (!m[i][unknowns].isZero()) return Solution.inconsistent();

    final List<RationalFunction> values = new ArrayList<>(unknowns);
    final List<Integer> free = new ArrayList<>();
    for (int col = 0; col < unknowns; ++col) {
      if (pivotRowOf[col] < 0) {
        values.add(RationalFunction.ZERO);
        free.add(col);
      } else {
        values.add(m[pivotRowOf[col]][unknowns]);
      }
    }
    return new Solution(true, values, free);
  }
}
