package hypersum.summation.gosper;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.expr.SymbolGenerator;
import hypersum.algebra.poly.LinearSystem;
import hypersum.algebra.poly.Polynomial;
import hypersum.algebra.poly.RationalFunction;
import hypersum.summation.GosperOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static hypersum.algebra.expr.STermSupport.expand;
import static hypersum.algebra.expr.STermSupport.has;
import static hypersum.algebra.poly.PolynomialSupport.gcd;
import static hypersum.algebra.poly.PolynomialSupport.mayHaveRootAbove;
import static hypersum.algebra.poly.PolynomialSupport.nonNegativeIntegerRoots;
import static hypersum.algebra.poly.PolynomialSupport.resultant;
import static hypersum.common.utils.IterableSupport.any;
import static hypersum.common.utils.ListSupport.map;
import static hypersum.summation.SummationSupport.SUM_DEFAULT_FLAGS;
import static hypersum.summation.SummationSupport.SUM_FLAG_SINGLE_ROOT_FALLBACK;
import static hypersum.summation.SummationSupport.isFlagSet;
import static hypersum.summation.SummationSupport.maxCertificateDegree;

/**
 * Gosper's algorithm. With the term ratio written as {@code z(n) = a(n) / b(n) * c(n+1) / c(n)},
 * where no root of a and root of b differ by a non-negative integer shift, a polynomial x(n) is
 * sought with {@code a(n) x(n+1) - b(n-1) x(n) = c(n)}. The certificate is then {@code b(n-1) x(n) /
 * c(n)}.
 *
 * <p>a and b are the numerator and denominator of the ratio, not made monic. Scaling both by the
 * same constant scales the solution x inversely and leaves the certificate unchanged.
 */
public class GosperSolver {
  private static final Logger LOG = LoggerFactory.getLogger(GosperSolver.class);

  private final SSymbol n;
  private final int flags;
  private final SymbolGenerator symbols;
  private final Polynomial variable;

  private Polynomial a, b, c;

  private GosperSolver(SSymbol n, int flags) {
    this.n = n;
    this.flags = flags;
    this.symbols = new SymbolGenerator("g");
    this.variable = Polynomial.variable(n);
  }

  public static GosperOutcome<GosperCertificate> certificate(STerm term, SSymbol n) {
    return certificate(term, n, SUM_DEFAULT_FLAGS);
  }

  public static GosperOutcome<GosperCertificate> certificate(STerm term, SSymbol n, int flags) {
    final GosperOutcome<STerm> ratio = HypergeometricRatio.hypersimp(term, n);
    if (!ratio.isSuccess()) return ratio.failure();

    final RationalFunction z = RationalFunction.of(expand(ratio.value()));
    if (z.isZero()) return GosperOutcome.notSummable("term vanishes from some index on");

    for (Polynomial p : List.of(z.numerator(), z.denominator()))
      for (STerm kernel : p.variables())
        if (!kernel.equals(n) && has(kernel, n)) {
          LOG.debug("ratio {} is not rational in {}: kernel {}", z, n, kernel);
          return GosperOutcome.notSummable("ratio is not rational in " + n + ": " + kernel);
        }

    return new GosperSolver(n, flags).solve(z.numerator(), z.denominator());
  }

  private GosperOutcome<GosperCertificate> solve(Polynomial numerator, Polynomial denominator) {
    a = numerator;
    b = denominator;
    c = Polynomial.ONE;

    final GosperOutcome<Set<Integer>> shifts = shifts();
    if (!shifts.isSuccess()) return shifts.failure();
    for (int j : shifts.value()) removeShift(j);

    final Polynomial bPrev = b.shift(n, -1);
    final GosperOutcome<Integer> bound = degreeBound(bPrev);
    if (!bound.isSuccess()) return bound.failure();

    return solveFor(bound.value(), bPrev);
  }

  /** Non-negative integers j for which a(n) and b(n+j) may share a factor. */
  private GosperOutcome<Set<Integer>> shifts() {
    final int maxDegree = maxCertificateDegree();
    if (a.degree(n) + b.degree(n) > maxDegree)
      return GosperOutcome.unsupported("ratio degree exceeds " + maxDegree);

    final SSymbol h = symbols.fresh("h");
    final Polynomial res = resultant(a, b.shift(n, Polynomial.variable(h)), n);
    if (res.isZero())
      throw new IllegalStateException("vanishing resultant of coprime " + a + " and " + b);

    final Set<Integer> roots;
    if (isFlagSet(flags, SUM_FLAG_SINGLE_ROOT_FALLBACK) && any(res.variables(), v -> !v.equals(h))) {
      roots = new TreeSet<>(List.of(1));
    } else {
      // shifts are only searched up to the limit
      final int limit = Math.max(maxDegree, 1);
      if (mayHaveRootAbove(res, h, limit)) {
        LOG.debug("resultant {} may have a shift above {}", res, limit);
        return GosperOutcome.unsupported("shift search range exceeds " + maxDegree);
      }
      roots = nonNegativeIntegerRoots(res, h, limit);
    }

    LOG.debug("resultant {}, shifts {}", res, roots);
    if (!roots.isEmpty() && Collections.max(roots) > maxDegree)
      return GosperOutcome.unsupported("shift " + Collections.max(roots) + " exceeds " + maxDegree);
    return GosperOutcome.of(roots);
  }

  private void removeShift(int j) {
    final Polynomial d = gcd(a, b.shift(n, j));
    if (d.degree(n) <= 0) return;

    a = quotient(a, d);
    b = quotient(b, d.shift(n, -j));
    for (int i = 1; i <= j; ++i) c = c.multiply(d.shift(n, -i));
  }

  private static Polynomial quotient(Polynomial p, Polynomial d) {
    final Polynomial q = p.divide(d);
    if (q == null) throw new IllegalStateException(d + " does not divide " + p);
    return q;
  }

  private GosperOutcome<Integer> degreeBound(Polynomial bPrev) {
    final int degA = a.degree(n), degB = bPrev.degree(n), degC = c.degree(n);
    final Polynomial lcA = a.leadingCoefficient(n);
    final TreeSet<Integer> candidates = new TreeSet<>();

    if (degA != degB || !lcA.equals(bPrev.leadingCoefficient(n))) {
      candidates.add(degC - Math.max(degA, degB));
    } else if (degA == 0) {
      candidates.add(degC - degA + 1);
      candidates.add(0);
    } else {
      candidates.add(degC - degA + 1);
      final Polynomial diff = bPrev.coefficient(n, degA - 1).subtract(a.coefficient(n, degA - 1));
      final RationalFunction t = RationalFunction.of(diff, lcA);
      if (t.isConstant() && t.constantValue().isInteger() && t.constantValue().signum() >= 0) {
        final BigInteger value = t.constantValue().numerator();
        if (value.bitLength() >= Integer.SIZE - 1)
          return GosperOutcome.unsupported("degree candidate " + value + " out of range");
        candidates.add(value.intValueExact());
      }
    }
    candidates.removeIf(it -> it < 0);

    LOG.debug("a = {}, b(n-1) = {}, c = {}, degree candidates {}", a, bPrev, c, candidates);
    if (candidates.isEmpty())
      return GosperOutcome.notSummable("no admissible degree for the polynomial solution");

    final int bound = candidates.last();
    final int maxDegree = maxCertificateDegree();
    if (bound > maxDegree)
      return GosperOutcome.unsupported("degree bound " + bound + " exceeds " + maxDegree);
    return GosperOutcome.of(bound);
  }

  private GosperOutcome<GosperCertificate> solveFor(int bound, Polynomial bPrev) {
    final List<SSymbol> unknowns = symbols.fresh(bound + 1);
    // x(n) = sum c_i n^i, x(n+1) = sum c_i sum_r binomial(i, r) n^r
    Polynomial x = Polynomial.ZERO, xNext = Polynomial.ZERO;
    for (int i = 0; i <= bound; ++i) {
      final Polynomial coefficient = Polynomial.variable(unknowns.get(i));
      x = x.add(coefficient.multiply(variable.pow(i)));
      BigInteger binomial = BigInteger.ONE;
      for (int r = 0; r <= i; ++r) {
        xNext = xNext.add(coefficient.multiply(variable.pow(r)).scale(SNum.mk(binomial)));
        binomial = binomial.multiply(BigInteger.valueOf(i - r)).divide(BigInteger.valueOf(r + 1));
      }
    }

    final Polynomial equation = a.multiply(xNext).subtract(bPrev.multiply(x)).subtract(c);
    final LinearSystem system = new LinearSystem(unknowns.size());
    for (int e = 0; e <= equation.degree(n); ++e) {
      final Polynomial row = equation.coefficient(n, e);
      if (row.isZero()) continue;
      Polynomial constant = row;
      for (SSymbol unknown : unknowns) constant = constant.evaluate(unknown, SNum.ZERO);
      system.addEquation(
          map(unknowns, it -> RationalFunction.of(row.coefficient(it, 1))),
          RationalFunction.of(constant.negate()));
    }
    LOG.trace("{} equations in {} unknowns", system.equations(), system.unknowns());

    final LinearSystem.Solution solution = system.solve();
    if (!solution.consistent()) {
      LOG.debug("no polynomial solution of degree {}", bound);
      return GosperOutcome.notSummable("no polynomial solution of degree " + bound);
    }

    RationalFunction solved = RationalFunction.ZERO;
    int solutionDegree = -1;
    final List<RationalFunction> values = new ArrayList<>(solution.values());
    for (int i = 0; i < values.size(); ++i) {
      if (values.get(i).isZero()) continue;
      solved = solved.add(values.get(i).multiply(RationalFunction.of(variable.pow(i))));
      solutionDegree = i;
    }
    if (solved.isZero()) throw new IllegalStateException("zero solution for " + equation);

    final RationalFunction certificate =
        RationalFunction.of(bPrev).multiply(solved).divide(RationalFunction.of(c));
    return GosperOutcome.of(new GosperCertificate(certificate, bound, solutionDegree));
  }
}
