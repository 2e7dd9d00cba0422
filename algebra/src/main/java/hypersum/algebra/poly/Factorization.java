package hypersum.algebra.poly;

import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static hypersum.algebra.poly.PolynomialSupport.clearDenominators;
import static hypersum.algebra.poly.PolynomialSupport.content;
import static hypersum.algebra.poly.PolynomialSupport.divisors;

/**
 * Best-effort factorization over the rationals: monomial factors, contents with respect to each
 * variable, and linear factors of univariate polynomials (rational roots). Irreducibility of the
 * remaining factors is not guaranteed.
 */
public abstract class Factorization {
  private Factorization() {}

  /** A factored term. {@code success} is false if nothing could be split off. */
  public record Factored(STerm term, boolean success) {}

  public static Factored factor(STerm term) {
    return factor(RationalFunction.of(term));
  }

  public static Factored factor(RationalFunction f) {
    if (f.isZero()) return new Factored(SNum.ZERO, false);

    final Map<Polynomial, Integer> numerator = factors(f.numerator());
    final Map<Polynomial, Integer> denominator = factors(f.denominator());
    final int count = multiplicity(numerator) + multiplicity(denominator);

    final List<STerm> factors = new ArrayList<>(numerator.size() + denominator.size() + 1);
    factors.add(scalar(f.numerator(), numerator).divide(scalar(f.denominator(), denominator)));
    for (Map.Entry<Polynomial, Integer> e : numerator.entrySet())
      factors.add(SPow.mk(e.getKey().toTerm(), SNum.mk(e.getValue())));
    for (Map.Entry<Polynomial, Integer> e : denominator.entrySet())
      factors.add(SPow.mk(e.getKey().toTerm(), SNum.mk(-e.getValue())));
    return new Factored(SMul.mk(factors), count > 1);
  }

  /**
   * Non-constant factors of {@code p} with multiplicities. Each factor is integral, primitive
   * and has a positive leading coefficient.
   */
  public static Map<Polynomial, Integer> factors(Polynomial p) {
    final Map<Polynomial, Integer> factors = new LinkedHashMap<>();
    if (p.isConstant()) return factors;

    Polynomial rest = p;
    for (STerm var : p.variables()) {
      final int lowest = rest.lowestDegree(var);
      if (lowest > 0) {
        factors.merge(Polynomial.variable(var), lowest, Integer::sum);
        rest = rest.divideExact(Polynomial.monomial(SNum.ONE, Monomial.of(var, lowest)));
      }
    }
    splitInto(rest, factors);
    return factors;
  }

  private static void splitInto(Polynomial p, Map<Polynomial, Integer> factors) {
    if (p.isConstant()) return;
    for (STerm var : p.variables()) {
      final Polynomial c = content(p, var);
      if (!c.isConstant()) {
        splitInto(c, factors);
        splitInto(p.divideExact(c), factors);
        return;
      }
    }

    Polynomial rest = p;
    if (p.variables().size() == 1) {
      final STerm var = p.variables().iterator().next();
      for (Polynomial linear : linearFactors(clearDenominators(p), var)) {
        Polynomial quotient;
        while (!rest.isConstant() && (quotient = rest.divide(linear)) != null) {
          factors.merge(linear, 1, Integer::sum);
          rest = quotient;
        }
      }
    }
    if (!rest.isConstant()) factors.merge(normalized(rest), 1, Integer::sum);
  }

  /** Factors {@code b*var - a} for the rational roots a/b of an integral univariate polynomial. */
  private static List<Polynomial> linearFactors(Polynomial p, STerm var) {
    final List<Polynomial> linears = new ArrayList<>();
    final int degree = p.degree(var), lowest = p.lowestDegree(var);
    if (degree - lowest < 1) return linears;
    final BigInteger leading = p.coefficient(var, degree).constantTerm().numerator();
    final BigInteger trailing = p.coefficient(var, lowest).constantTerm().numerator();
    for (BigInteger a : divisors(trailing))
      for (BigInteger b : divisors(leading)) {
        if (!a.gcd(b).equals(BigInteger.ONE)) continue;
        for (SNum root : List.of(SNum.mk(a, b), SNum.mk(a.negate(), b))) {
          if (!p.evaluate(var, root).isZero()) continue;
          linears.add(
              Polynomial.variable(var)
                  .scale(SNum.mk(root.denominator()))
                  .subtract(Polynomial.constant(SNum.mk(root.numerator()))));
        }
      }
    return linears;
  }

  private static Polynomial normalized(Polynomial p) {
    final Polynomial integral = clearDenominators(p);
    return integral.leadingTermCoefficient().signum() < 0 ? integral.negate() : integral;
  }

  private static SNum scalar(Polynomial p, Map<Polynomial, Integer> factors) {
    Polynomial product = Polynomial.ONE;
    for (Map.Entry<Polynomial, Integer> e : factors.entrySet())
      product = product.multiply(e.getKey().pow(e.getValue()));
    return p.leadingTermCoefficient().divide(product.leadingTermCoefficient());
  }

  private static int multiplicity(Map<Polynomial, Integer> factors) {
    int count = 0;
    for (int m : factors.values()) count += m;
    return count;
  }
}
