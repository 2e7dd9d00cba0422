package hypersum.algebra.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

final class SAddImpl implements SAdd {
  private final ImmutableList<STerm> terms;
  private final SNum constant;
  private final int hash;

  SAddImpl(List<STerm> terms, SNum constant) {
    assert terms.size() >= 2 || constant.signum() != 0;
    this.terms = ImmutableList.copyOf(terms);
    this.constant = constant;
    this.hash = 31 * this.terms.hashCode() + constant.hashCode();
  }

  @Override
  public List<STerm> terms() {
    return terms;
  }

  @Override
  public SNum constant() {
    return constant;
  }

  @Override
  public List<STerm> subTerms() {
    if (constant.signum() == 0) return terms;
    return ImmutableList.<STerm>builder().addAll(terms).add(constant).build();
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    return SAdd.mk(subTerms);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SAdd)) return false;
    final SAdd that = (SAdd) o;
    return constant.equals(that.constant()) && terms.equals(that.terms());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (STerm term : terms) append(builder, term.toString());
    if (constant.signum() != 0) append(builder, constant.toString());
    return builder.toString();
  }

  private static void append(StringBuilder builder, String addend) {
    if (builder.length() == 0) builder.append(addend);
    else if (addend.startsWith("-")) builder.append(" - ").append(addend, 1, addend.length());
    else builder.append(" + ").append(addend);
  }
}
