package hypersum.algebra.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

final class SMulImpl implements SMul {
  private final ImmutableList<STerm> factors;
  private final SNum coefficient;
  private final int hash;

  SMulImpl(List<STerm> factors, SNum coefficient) {
    assert !factors.isEmpty() && coefficient.signum() != 0;
    this.factors = ImmutableList.copyOf(factors);
    this.coefficient = coefficient;
    this.hash = 37 * this.factors.hashCode() + coefficient.hashCode();
  }

  @Override
  public List<STerm> factors() {
    return factors;
  }

  @Override
  public SNum coefficient() {
    return coefficient;
  }

  @Override
  public List<STerm> subTerms() {
    if (coefficient.isOne()) return factors;
    return ImmutableList.<STerm>builder().addAll(factors).add(coefficient).build();
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    return SMul.mk(subTerms);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SMul)) return false;
    final SMul that = (SMul) o;
    return coefficient.equals(that.coefficient()) && factors.equals(that.factors());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    if (coefficient.equals(SNum.MINUS_ONE)) builder.append('-');
    else if (!coefficient.isOne()) {
      if (coefficient.isInteger()) builder.append(coefficient).append('*');
      else builder.append('(').append(coefficient).append(")*");
    }
    boolean first = true;
    for (STerm factor : factors) {
      if (!first) builder.append('*');
      first = false;
      if (factor.kind() == SKind.ADD) builder.append('(').append(factor).append(')');
      else builder.append(factor);
    }
    return builder.toString();
  }
}
