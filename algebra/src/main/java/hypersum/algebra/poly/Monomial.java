package hypersum.algebra.poly;

import com.google.common.collect.ImmutableSortedMap;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A power product of kernels. Monomials are ordered lexicographically with the greatest kernel
 * deciding first.
 */
public final class Monomial implements Comparable<Monomial> {
  public static final Monomial ONE = new Monomial(ImmutableSortedMap.of());

  private final ImmutableSortedMap<STerm, Integer> powers;

  private Monomial(ImmutableSortedMap<STerm, Integer> powers) {
    this.powers = powers;
  }

  public static Monomial of(STerm var, int degree) {
    if (degree < 0) throw new IllegalArgumentException("negative degree " + degree);
    if (degree == 0) return ONE;
    return new Monomial(ImmutableSortedMap.of(var, degree));
  }

  static Monomial of(Map<STerm, Integer> powers) {
    final Map<STerm, Integer> nonZero = new TreeMap<>();
    for (Map.Entry<STerm, Integer> e : powers.entrySet()) {
      assert e.getValue() >= 0;
      if (e.getValue() > 0) nonZero.put(e.getKey(), e.getValue());
    }
    if (nonZero.isEmpty()) return ONE;
    return new Monomial(ImmutableSortedMap.copyOf(nonZero));
  }

  public Map<STerm, Integer> powers() {
    return powers;
  }

  public Set<STerm> variables() {
    return powers.keySet();
  }

  public int degree(STerm var) {
    return powers.getOrDefault(var, 0);
  }

  public boolean isOne() {
    return powers.isEmpty();
  }

  public Monomial multiply(Monomial that) {
    if (this.isOne()) return that;
    if (that.isOne()) return this;
    final Map<STerm, Integer> product = new TreeMap<>(powers);
    for (Map.Entry<STerm, Integer> e : that.powers.entrySet())
      product.merge(e.getKey(), e.getValue(), Integer::sum);
    return new Monomial(ImmutableSortedMap.copyOf(product));
  }

  /** The quotient {@code this / that}, or null if {@code that} does not divide this monomial. */
  public Monomial divide(Monomial that) {
    if (that.isOne()) return this;
    final Map<STerm, Integer> quotient = new TreeMap<>(powers);
    for (Map.Entry<STerm, Integer> e : that.powers.entrySet()) {
      final int remaining = degree(e.getKey()) - e.getValue();
      if (remaining < 0) return null;
      quotient.put(e.getKey(), remaining);
    }
    return of(quotient);
  }

  public Monomial without(STerm var) {
    if (!powers.containsKey(var)) return this;
    final Map<STerm, Integer> rest = new TreeMap<>(powers);
    rest.remove(var);
    return of(rest);
  }

  public STerm toTerm() {
    final List<STerm> factors = new ArrayList<>(powers.size());
    for (Map.Entry<STerm, Integer> e : powers.entrySet())
      factors.add(SPow.mk(e.getKey(), SNum.mk(e.getValue())));
    return SMul.mk(factors);
  }

  @Override
  public int compareTo(Monomial that) {
    final Iterator<Map.Entry<STerm, Integer>> xs = powers.descendingMap().entrySet().iterator();
    final Iterator<Map.Entry<STerm, Integer>> ys = that.powers.descendingMap().entrySet().iterator();
    while (true) {
      if (!xs.hasNext()) return ys.hasNext() ? -1 : 0;
      if (!ys.hasNext()) return 1;
      final Map.Entry<STerm, Integer> x = xs.next(), y = ys.next();
      final int byVar = x.getKey().compareTo(y.getKey());
      if (byVar != 0) return byVar;
      final int byDegree = Integer.compare(x.getValue(), y.getValue());
      if (byDegree != 0) return byDegree;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Monomial)) return false;
    return powers.equals(((Monomial) o).powers);
  }

  @Override
  public int hashCode() {
    return powers.hashCode();
  }

  @Override
  public String toString() {
    return toTerm().toString();
  }
}
