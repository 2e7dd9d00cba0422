package hypersum.algebra.poly;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.STerm;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public abstract class PolynomialSupport {
  private PolynomialSupport() {}

  /**
   * Greatest common divisor, normalized so that its leading term has coefficient 1. Works
   * recursively on the greatest variable: the gcd of the contents times the gcd of the primitive
   * parts, the latter from a primitive pseudo-remainder sequence.
   */
  public static Polynomial gcd(Polynomial a, Polynomial b) {
    if (a.isZero()) return b.monic();
    if (b.isZero()) return a.monic();
    if (a.isConstant() || b.isConstant()) return Polynomial.ONE;
    if (a.equals(b)) return a.monic();

    final STerm x = mainVariable(a, b);
    final Polynomial contentA = content(a, x), contentB = content(b, x);
    final Polynomial contentGcd = gcd(contentA, contentB);

    Polynomial p = a.divideExact(contentA).monic();
    Polynomial q = b.divideExact(contentB).monic();
    if (p.degree(x) < q.degree(x)) {
      final Polynomial tmp = p;
      p = q;
      q = tmp;
    }
    while (!q.isZero()) {
      if (q.degree(x) <= 0) {
        // a primitive polynomial of degree 0 is a unit
        p = Polynomial.ONE;
        break;
      }
      final Polynomial r = pseudoRemainder(p, q, x);
      p = q;
      q = r.isZero() ? r : primitivePart(r, x).monic();
    }
    return contentGcd.multiply(p).monic();
  }

  /** The gcd of the coefficients of {@code p} with respect to {@code x}. */
  public static Polynomial content(Polynomial p, STerm x) {
    Polynomial content = Polynomial.ZERO;
    for (Polynomial coefficient : p.coefficients(x)) {
      if (coefficient.isZero()) continue;
      content = gcd(content, coefficient);
      if (content.isConstant()) return Polynomial.ONE;
    }
    return content;
  }

  public static Polynomial primitivePart(Polynomial p, STerm x) {
    if (p.isZero()) return p;
    return p.divideExact(content(p, x));
  }

  /**
   * Pseudo-remainder of {@code a} by {@code b} in {@code x}: the remainder of {@code lc(b)^k * a}
   * by {@code b}, computed without division.
   */
  public static Polynomial pseudoRemainder(Polynomial a, Polynomial b, STerm x) {
    final int degreeB = b.degree(x);
    if (degreeB < 0) throw new ArithmeticException("pseudo-division by zero polynomial");
    final Polynomial leadingB = b.leadingCoefficient(x);
    Polynomial r = a;
    while (!r.isZero() && r.degree(x) >= degreeB) {
      final int degreeR = r.degree(x);
      final Polynomial leadingR = r.leadingCoefficient(x);
      r =
          r.multiply(leadingB)
              .subtract(b.multiply(leadingR).multiply(Monomial.of(x, degreeR - degreeB)));
    }
    return r;
  }

  private static STerm mainVariable(Polynomial a, Polynomial b) {
    final TreeSet<STerm> vars = new TreeSet<>(a.variables());
    vars.addAll(b.variables());
    return vars.last();
  }

  /** Resultant of {@code a} and {@code b} with respect to {@code x}. */
  public static Polynomial resultant(Polynomial a, Polynomial b, STerm x) {
    if (a.isZero() || b.isZero()) return Polynomial.ZERO;
    final int m = a.degree(x), n = b.degree(x);
    if (m == 0) return a.pow(n);
    if (n == 0) return b.pow(m);
    return determinant(sylvester(a, b, x));
  }

  static Polynomial[][] sylvester(Polynomial a, Polynomial b, STerm x) {
    final int m = a.degree(x), n = b.degree(x), size = m + n;
    final List<Polynomial> ca = a.coefficients(x), cb = b.coefficients(x);
    final Polynomial[][] matrix = new Polynomial[size][size];
    for (int i = 0; i < size; ++i)
      for (int j = 0; j < size; ++j) matrix[i][j] = Polynomial.ZERO;
    for (int i = 0; i < n; ++i)
      for (int k = 0; k <= m; ++k) matrix[i][i + k] = ca.get(m - k);
    for (int i = 0; i < m; ++i)
      for (int k = 0; k <= n; ++k) matrix[n + i][i + k] = cb.get(n - k);
    return matrix;
  }

  /** Fraction-free (Bareiss) determinant. The matrix is overwritten. */
  static Polynomial determinant(Polynomial[][] matrix) {
    final int size = matrix.length;
    if (size == 0) return Polynomial.ONE;
    boolean negated = false;
    Polynomial previousPivot = Polynomial.ONE;
    for (int k = 0; k < size - 1; ++k) {
      if (matrix[k][k].isZero()) {
        int swap = k + 1;
        while (swap < size && matrix[swap][k].isZero()) ++swap;
        if (swap == size) return Polynomial.ZERO;
        final Polynomial[] tmp = matrix[k];
        matrix[k] = matrix[swap];
        matrix[swap] = tmp;
        negated = !negated;
      }
      final Polynomial pivot = matrix[k][k];
      for (int i = k + 1; i < size; ++i) {
        for (int j = k + 1; j < size; ++j) {
          matrix[i][j] =
              matrix[i][j]
                  .multiply(pivot)
                  .subtract(matrix[i][k].multiply(matrix[k][j]))
                  .divideExact(previousPivot);
        }
        matrix[i][k] = Polynomial.ZERO;
      }
      previousPivot = pivot;
    }
    final Polynomial det = matrix[size - 1][size - 1];
    return negated ? det.negate() : det;
  }

  /** Positive divisors of {@code value} in ascending order. */
  public static List<BigInteger> divisors(BigInteger value) {
    final BigInteger n = value.abs();
    if (n.signum() == 0) throw new ArithmeticException("divisors of zero");
    final List<BigInteger> small = new ArrayList<>(), large = new ArrayList<>();
    for (BigInteger d = BigInteger.ONE; d.multiply(d).compareTo(n) <= 0; d = d.add(BigInteger.ONE)) {
      final BigInteger[] qr = n.divideAndRemainder(d);
      if (qr[1].signum() != 0) continue;
      small.add(d);
      if (!qr[0].equals(d)) large.add(0, qr[0]);
    }
    small.addAll(large);
    return small;
  }

  /**
   * Non-negative integer roots of a polynomial in {@code var} that do not exceed {@code limit}.
   * Other variables may occur: a root must then annihilate the polynomial identically. Candidates
   * are the divisors of the lowest non-vanishing coefficient of one univariate component up to the
   * limit, checked exactly. Use {@link #mayHaveRootAbove} to learn whether larger roots can exist.
   */
  public static Set<Integer> nonNegativeIntegerRoots(Polynomial p, STerm var, int limit) {
    if (p.isZero()) throw new ArithmeticException("every integer is a root of zero");
    if (limit < 0) throw new IllegalArgumentException("negative root limit " + limit);
    final Set<Integer> roots = new TreeSet<>();
    if (!p.has(var)) return roots;

    final Polynomial integral = clearDenominators(univariateComponent(p, var));
    final int lowest = integral.lowestDegree(var);
    if (lowest > 0 && p.evaluate(var, SNum.ZERO).isZero()) roots.add(0);

    final BigInteger trailing = integral.coefficient(var, lowest).constantTerm().numerator().abs();
    for (int d = 1; d <= limit; ++d) {
      final BigInteger candidate = BigInteger.valueOf(d);
      if (candidate.compareTo(trailing) > 0) break;
      if (trailing.mod(candidate).signum() != 0) continue;
      if (p.evaluate(var, SNum.mk(d)).isZero()) roots.add(d);
    }
    return roots;
  }

  /**
   * Whether a root of {@code p} in {@code var} may exceed {@code limit}. A false answer is exact:
   * with a positive leading coefficient, {@code a_n L^n >= sum |a_i| L^i} over the negative
   * coefficients rules out every real root above L.
   */
  public static boolean mayHaveRootAbove(Polynomial p, STerm var, int limit) {
    if (limit < 1) throw new IllegalArgumentException("root limit must be positive: " + limit);
    if (!p.has(var)) return false;

    final Polynomial integral = clearDenominators(univariateComponent(p, var));
    final int degree = integral.degree(var);
    final BigInteger bound = BigInteger.valueOf(limit);
    final BigInteger leading = integral.coefficient(var, degree).constantTerm().numerator();
    BigInteger negative = BigInteger.ZERO;
    for (int i = 0; i < degree; ++i) {
      final BigInteger a = integral.coefficient(var, i).constantTerm().numerator();
      if (a.signum() * leading.signum() < 0) negative = negative.add(a.abs().multiply(bound.pow(i)));
    }
    return leading.abs().multiply(bound.pow(degree)).compareTo(negative) < 0;
  }

  /**
   * Groups the terms of {@code p} by their monomial in the other variables and returns the
   * sparsest group that involves {@code var}, as a polynomial in {@code var} alone. Any common
   * root of p is a root of every group.
   */
  static Polynomial univariateComponent(Polynomial p, STerm var) {
    final Map<Monomial, Map<Monomial, SNum>> components = new TreeMap<>();
    for (Map.Entry<Monomial, SNum> e : p.terms().entrySet()) {
      final Monomial rest = e.getKey().without(var);
      components
          .computeIfAbsent(rest, ignored -> new TreeMap<>())
          .put(Monomial.of(var, e.getKey().degree(var)), e.getValue());
    }
    Polynomial best = null;
    for (Map<Monomial, SNum> component : components.values()) {
      final Polynomial candidate = Polynomial.of(component);
      if (!candidate.has(var)) continue;
      if (best == null || candidate.terms().size() < best.terms().size()) best = candidate;
    }
    return best == null ? p : best;
  }

  /** Scales a polynomial with rational coefficients to a primitive integral one. */
  public static Polynomial clearDenominators(Polynomial p) {
    BigInteger lcm = BigInteger.ONE, gcd = BigInteger.ZERO;
    for (SNum c : p.terms().values()) {
      lcm = lcm.divide(lcm.gcd(c.denominator())).multiply(c.denominator());
      gcd = gcd.gcd(c.numerator());
    }
    if (gcd.signum() == 0) return p;
    return p.scale(SNum.mk(lcm, gcd));
  }
}
