package hypersum.algebra.expr;

import java.util.Comparator;
import java.util.List;

/**
 * Total order over terms: first by kind, then structurally. Consistent with {@code equals}, so
 * terms can key sorted maps.
 */
public final class STermOrder implements Comparator<STerm> {
  public static final STermOrder INSTANCE = new STermOrder();

  private STermOrder() {}

  @Override
  public int compare(STerm x, STerm y) {
    if (x == y) return 0;
    final int byKind = Integer.compare(x.kind().rank(), y.kind().rank());
    if (byKind != 0) return byKind;

    switch (x.kind()) {
      case NUMBER: {
        final SNum a = (SNum) x, b = (SNum) y;
        return a.numerator()
            .multiply(b.denominator())
            .compareTo(b.numerator().multiply(a.denominator()));
      }
      case SYMBOL: {
        final SSymbol a = (SSymbol) x, b = (SSymbol) y;
        final int byName = a.name().compareTo(b.name());
        if (byName != 0) return byName;
        return Boolean.compare(a.isFresh(), b.isFresh());
      }
      case POWER: {
        final SPow a = (SPow) x, b = (SPow) y;
        final int byBase = compare(a.base(), b.base());
        if (byBase != 0) return byBase;
        return compare(a.exponent(), b.exponent());
      }
      case MULTIPLY: {
        final SMul a = (SMul) x, b = (SMul) y;
        final int byFactors = compareLists(a.factors(), b.factors());
        if (byFactors != 0) return byFactors;
        return compare(a.coefficient(), b.coefficient());
      }
      case ADD: {
        final SAdd a = (SAdd) x, b = (SAdd) y;
        final int byTerms = compareLists(a.terms(), b.terms());
        if (byTerms != 0) return byTerms;
        return compare(a.constant(), b.constant());
      }
      case FUNC: {
        final SFunc a = (SFunc) x, b = (SFunc) y;
        final int byName = a.name().compareTo(b.name());
        if (byName != 0) return byName;
        return compareLists(a.args(), b.args());
      }
      default:
        throw new IllegalStateException("unknown kind " + x.kind());
    }
  }

  private int compareLists(List<STerm> xs, List<STerm> ys) {
    final int common = Math.min(xs.size(), ys.size());
    for (int i = 0; i < common; ++i) {
      final int cmp = compare(xs.get(i), ys.get(i));
      if (cmp != 0) return cmp;
    }
    return Integer.compare(xs.size(), ys.size());
  }
}
