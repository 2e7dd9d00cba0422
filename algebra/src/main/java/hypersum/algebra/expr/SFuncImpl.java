package hypersum.algebra.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.stream.Collectors.joining;

final class SFuncImpl implements SFunc {
  private final String name;
  private final SpecialFunction special;
  private final ImmutableList<STerm> args;
  private final int hash;

  SFuncImpl(String name, SpecialFunction special, List<STerm> args) {
    this.name = name;
    this.special = special;
    this.args = ImmutableList.copyOf(args);
    this.hash = 41 * name.hashCode() + this.args.hashCode();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public SpecialFunction special() {
    return special;
  }

  @Override
  public List<STerm> subTerms() {
    return args;
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    if (special != null) return SFunc.mk(special, subTerms);
    return SFunc.mk(name, subTerms);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SFunc)) return false;
    final SFunc that = (SFunc) o;
    return name.equals(that.name()) && args.equals(that.args());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return args.stream().map(Object::toString).collect(joining(", ", name + "(", ")"));
  }
}
