package hypersum.algebra.poly;

import com.google.common.collect.ImmutableSortedMap;
import hypersum.algebra.expr.SAdd;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.STerm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A sparse multivariate polynomial with rational coefficients. The variables are kernels: symbols,
 * function calls and powers with a non-integer exponent.
 */
public final class Polynomial {
  private static final Comparator<Monomial> LEADING_FIRST = Comparator.reverseOrder();

  public static final Polynomial ZERO = new Polynomial(new TreeMap<>(LEADING_FIRST));
  public static final Polynomial ONE = constant(SNum.ONE);

  private final ImmutableSortedMap<Monomial, SNum> terms;

  private Polynomial(SortedMap<Monomial, SNum> terms) {
    this.terms = ImmutableSortedMap.copyOfSorted(terms);
  }

  static Polynomial of(Map<Monomial, SNum> terms) {
    final SortedMap<Monomial, SNum> nonZero = new TreeMap<>(LEADING_FIRST);
    for (Map.Entry<Monomial, SNum> e : terms.entrySet())
      if (e.getValue().signum() != 0) nonZero.put(e.getKey(), e.getValue());
    return new Polynomial(nonZero);
  }

  public static Polynomial constant(SNum value) {
    return monomial(value, Monomial.ONE);
  }

  public static Polynomial constant(long value) {
    return constant(SNum.mk(value));
  }

  public static Polynomial variable(STerm var) {
    assert !var.isNumber();
    return monomial(SNum.ONE, Monomial.of(var, 1));
  }

  public static Polynomial monomial(SNum coefficient, Monomial monomial) {
    final SortedMap<Monomial, SNum> terms = new TreeMap<>(LEADING_FIRST);
    if (coefficient.signum() != 0) terms.put(monomial, coefficient);
    return new Polynomial(terms);
  }

  public Map<Monomial, SNum> terms() {
    return terms;
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  public boolean isOne() {
    return this.equals(ONE);
  }

  public boolean isConstant() {
    return terms.isEmpty() || (terms.size() == 1 && terms.firstKey().isOne());
  }

  /** The coefficient of the unit monomial. */
  public SNum constantTerm() {
    return terms.getOrDefault(Monomial.ONE, SNum.ZERO);
  }

  public Monomial leadingMonomial() {
    if (isZero()) throw new ArithmeticException("zero polynomial has no leading term");
    return terms.firstKey();
  }

  public SNum leadingTermCoefficient() {
    if (isZero()) throw new ArithmeticException("zero polynomial has no leading term");
    return terms.get(terms.firstKey());
  }

  public Set<STerm> variables() {
    final Set<STerm> vars = new TreeSet<>();
    for (Monomial monomial : terms.keySet()) vars.addAll(monomial.variables());
    return vars;
  }

  public boolean has(STerm var) {
    for (Monomial monomial : terms.keySet()) if (monomial.degree(var) > 0) return true;
    return false;
  }

  /** Degree in {@code var}; -1 for the zero polynomial. */
  public int degree(STerm var) {
    int degree = -1;
    for (Monomial monomial : terms.keySet()) degree = Math.max(degree, monomial.degree(var));
    return degree;
  }

  /** Lowest power of {@code var} with a non-zero coefficient; -1 for the zero polynomial. */
  public int lowestDegree(STerm var) {
    int degree = -1;
    for (Monomial monomial : terms.keySet()) {
      final int d = monomial.degree(var);
      if (degree < 0 || d < degree) degree = d;
    }
    return degree;
  }

  /** Coefficient of {@code var^degree}, a polynomial in the other variables. */
  public Polynomial coefficient(STerm var, int degree) {
    final Map<Monomial, SNum> coefficient = new TreeMap<>();
    for (Map.Entry<Monomial, SNum> e : terms.entrySet()) {
      if (e.getKey().degree(var) == degree) coefficient.put(e.getKey().without(var), e.getValue());
    }
    return of(coefficient);
  }

  public Polynomial leadingCoefficient(STerm var) {
    return coefficient(var, degree(var));
  }

  /** Coefficients of {@code var^0 .. var^degree}. */
  public List<Polynomial> coefficients(STerm var) {
    final int degree = degree(var);
    final List<Polynomial> coefficients = new ArrayList<>(Math.max(degree + 1, 0));
    for (int i = 0; i <= degree; ++i) coefficients.add(coefficient(var, i));
    return coefficients;
  }

  public Polynomial add(Polynomial that) {
    if (this.isZero()) return that;
    if (that.isZero()) return this;
    final Map<Monomial, SNum> sum = new TreeMap<>(terms);
    for (Map.Entry<Monomial, SNum> e : that.terms.entrySet())
      sum.merge(e.getKey(), e.getValue(), SNum::add);
    return of(sum);
  }

  public Polynomial subtract(Polynomial that) {
    return add(that.negate());
  }

  public Polynomial negate() {
    return scale(SNum.MINUS_ONE);
  }

  public Polynomial scale(SNum factor) {
    if (factor.isOne()) return this;
    if (factor.signum() == 0) return ZERO;
    final SortedMap<Monomial, SNum> scaled = new TreeMap<>(LEADING_FIRST);
    for (Map.Entry<Monomial, SNum> e : terms.entrySet())
      scaled.put(e.getKey(), e.getValue().multiply(factor));
    return new Polynomial(scaled);
  }

  public Polynomial multiply(Polynomial that) {
    if (this.isZero() || that.isZero()) return ZERO;
    if (this.isOne()) return that;
    if (that.isOne()) return this;
    final Map<Monomial, SNum> product = new TreeMap<>();
    for (Map.Entry<Monomial, SNum> x : terms.entrySet())
      for (Map.Entry<Monomial, SNum> y : that.terms.entrySet())
        product.merge(
            x.getKey().multiply(y.getKey()), x.getValue().multiply(y.getValue()), SNum::add);
    return of(product);
  }

  public Polynomial multiply(Monomial monomial) {
    if (monomial.isOne()) return this;
    final SortedMap<Monomial, SNum> product = new TreeMap<>(LEADING_FIRST);
    for (Map.Entry<Monomial, SNum> e : terms.entrySet())
      product.put(e.getKey().multiply(monomial), e.getValue());
    return new Polynomial(product);
  }

  public Polynomial pow(int exponent) {
    if (exponent < 0) throw new IllegalArgumentException("negative exponent " + exponent);
    Polynomial result = ONE, base = this;
    for (int e = exponent; e > 0; e >>= 1) {
      if ((e & 1) != 0) result = result.multiply(base);
      if (e > 1) base = base.multiply(base);
    }
    return result;
  }

  /** Scales this polynomial so that its leading term has coefficient 1. */
  public Polynomial monic() {
    if (isZero()) return this;
    return scale(leadingTermCoefficient().reciprocal());
  }

  /** Replaces {@code var} by {@code value}. */
  public Polynomial substitute(STerm var, Polynomial value) {
    if (!has(var)) return this;
    return horner(coefficients(var), value);
  }

  private static Polynomial horner(List<Polynomial> coefficients, Polynomial value) {
    Polynomial result = ZERO;
    for (int i = coefficients.size() - 1; i >= 0; --i)
      result = result.multiply(value).add(coefficients.get(i));
    return result;
  }

  public Polynomial evaluate(STerm var, SNum value) {
    return substitute(var, constant(value));
  }

  /** The polynomial {@code p(var + delta)}. */
  public Polynomial shift(STerm var, Polynomial delta) {
    return substitute(var, variable(var).add(delta));
  }

  public Polynomial shift(STerm var, long delta) {
    return shift(var, constant(delta));
  }

  /**
   * The exact quotient {@code this / divisor}. Throws ArithmeticException if the division leaves
   * a remainder.
   */
  public Polynomial divideExact(Polynomial divisor) {
    final Polynomial quotient = divide(divisor);
    if (quotient == null)
      throw new ArithmeticException("inexact division of " + this + " by " + divisor);
    return quotient;
  }

  /** The exact quotient {@code this / divisor}, or null if {@code divisor} does not divide this. */
  public Polynomial divide(Polynomial divisor) {
    if (divisor.isZero()) throw new ArithmeticException("division by zero polynomial");
    if (divisor.isConstant()) return scale(divisor.constantTerm().reciprocal());

    final Monomial leading = divisor.leadingMonomial();
    final SNum leadingCoefficient = divisor.leadingTermCoefficient();
    final Map<Monomial, SNum> quotient = new TreeMap<>();
    Polynomial remainder = this;
    while (!remainder.isZero()) {
      final Monomial m = remainder.leadingMonomial().divide(leading);
      if (m == null) return null;
      final SNum c = remainder.leadingTermCoefficient().divide(leadingCoefficient);
      quotient.put(m, c);
      remainder = remainder.subtract(divisor.multiply(m).scale(c));
    }
    return of(quotient);
  }

  public STerm toTerm() {
    final List<STerm> addends = new ArrayList<>(terms.size());
    for (Map.Entry<Monomial, SNum> e : terms.entrySet())
      addends.add(SMul.mk(e.getValue(), e.getKey().toTerm()));
    return SAdd.mk(addends);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Polynomial)) return false;
    return terms.equals(((Polynomial) o).terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public String toString() {
    return toTerm().toString();
  }
}
