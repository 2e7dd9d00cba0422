package hypersum.algebra.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

final class SPowImpl implements SPow {
  private final STerm base;
  private final STerm exponent;

  SPowImpl(STerm base, STerm exponent) {
    this.base = base;
    this.exponent = exponent;
  }

  @Override
  public STerm base() {
    return base;
  }

  @Override
  public STerm exponent() {
    return exponent;
  }

  @Override
  public List<STerm> subTerms() {
    return ImmutableList.of(base, exponent);
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    assert subTerms.size() == 2;
    return SPow.mk(subTerms.get(0), subTerms.get(1));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SPow)) return false;
    final SPow that = (SPow) o;
    return base.equals(that.base()) && exponent.equals(that.exponent());
  }

  @Override
  public int hashCode() {
    return Objects.hash(base, exponent);
  }

  @Override
  public String toString() {
    final String b = base.toString();
    final String e = exponent.toString();
    final boolean plainBase =
        base.kind() == SKind.SYMBOL
            || base.kind() == SKind.FUNC
            || (base.isInteger() && ((SNum) base).signum() >= 0);
    final boolean plainExponent =
        exponent.kind() == SKind.SYMBOL
            || (exponent.isInteger() && ((SNum) exponent).signum() >= 0);
    return (plainBase ? b : "(" + b + ")") + "^" + (plainExponent ? e : "(" + e + ")");
  }
}
