package hypersum.summation.gosper;

import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.poly.RationalFunction;
import hypersum.summation.GosperOutcome;
import hypersum.summation.OutcomeKind;
import hypersum.summation.SummationSupport;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static hypersum.algebra.expr.STerm.*;
import static hypersum.algebra.expr.SpecialFunction.*;
import static hypersum.summation.SummationSupport.SUM_FLAG_SINGLE_ROOT_FALLBACK;
import static hypersum.summation.gosper.GosperSolver.certificate;
import static org.junit.jupiter.api.Assertions.*;

@Tag("gosper")
@Tag("fast")
public class GosperSolverTest {
  private final SSymbol n = sym("n");
  private final SSymbol k = sym("k");
  private final SSymbol x = sym("x");

  private static GosperCertificate assertCertificate(
      STerm expected, GosperOutcome<GosperCertificate> outcome) {
    assertTrue(outcome.isSuccess(), outcome::toString);
    assertEquals(RationalFunction.of(expected), outcome.value().rational());
    return outcome.value();
  }

  @Test
  public void testPolynomialTerms() {
    final GosperCertificate linear = assertCertificate(div(sub(n, 1), 2), certificate(n, n));
    assertEquals(2, linear.degreeBound());
    assertEquals(2, linear.solutionDegree());

    final GosperCertificate constant = assertCertificate(n, certificate(num(7), n));
    assertEquals(1, constant.solutionDegree());

    // sum of squares: n (n - 1) (2n - 1) / 6
    final STerm squares = div(add(mul(num(2), pow(n, 2)), mul(num(-3), n), 1), mul(num(6), n));
    assertEquals(3, assertCertificate(squares, certificate(pow(n, 2), n)).degreeBound());
  }

  @Test
  public void testGeometricTerm() {
    final GosperCertificate c = assertCertificate(pow(sub(x, 1), -1), certificate(pow(x, n), n));
    assertEquals(0, c.degreeBound());
    assertEquals(pow(sub(x, 1), -1), c.toTerm());
  }

  @Test
  public void testFactorialTerm() {
    assertCertificate(pow(n, -1), certificate(mul(n, func(FACTORIAL, n)), n));
  }

  @Test
  public void testAlternatingBinomial() {
    final STerm term = mul(pow(num(-1), k), func(BINOMIAL, n, k));
    final STerm expected = div(neg(k), n);
    assertCertificate(expected, certificate(term, k));
    assertCertificate(expected, certificate(term, k, SUM_FLAG_SINGLE_ROOT_FALLBACK));
  }

  @Test
  public void testNotSummable() {
    final List<STerm> terms =
        List.of(
            pow(n, -1),
            pow(func(FACTORIAL, n), -1),
            mul(add(n, 2), func(FACTORIAL, n)),
            func(BINOMIAL, x, n),
            pow(num(2), pow(n, 2)),
            func("sin", n));
    for (STerm term : terms) {
      final GosperOutcome<GosperCertificate> outcome = certificate(term, n);
      assertEquals(OutcomeKind.NOT_SUMMABLE, outcome.kind(), term::toString);
    }
    assertTrue(certificate(pow(func(FACTORIAL, n), -1), n).reason().contains("admissible degree"));
  }

  @Test
  public void testDegreeBoundRespected() {
    final List<STerm> terms =
        List.of(
            n,
            pow(n, 3),
            mul(n, pow(num(2), n)),
            mul(add(n, 2), pow(x, n)),
            mul(pow(num(-1), n), func(BINOMIAL, num(4), n)));
    for (STerm term : terms) {
      final GosperOutcome<GosperCertificate> outcome = certificate(term, n);
      assertTrue(outcome.isSuccess(), term::toString);
      assertTrue(outcome.value().solutionDegree() <= outcome.value().degreeBound());
      assertTrue(outcome.value().solutionDegree() >= 0);
    }
  }

  @Test
  public void testSwappedAddendsGiveSameCertificate() {
    final STerm left = mul(add(n, 2), pow(x, n));
    final STerm right = mul(pow(x, n), add(num(2), n));
    assertEquals(certificate(left, n).value().rational(), certificate(right, n).value().rational());
  }

  @Test
  public void testLargeShiftIsUnsupported() {
    for (long offset : List.of(600L, 10_000_000_000L)) {
      final STerm term = mul(pow(x, k), add(k, 1), pow(add(k, offset), -1));
      final GosperOutcome<GosperCertificate> outcome = certificate(term, k);
      assertEquals(OutcomeKind.UNSUPPORTED, outcome.kind(), term::toString);
      assertTrue(outcome.reason().contains("shift"), outcome::reason);
    }
    final STerm small = mul(pow(x, k), add(k, 1), pow(add(k, 3), -1));
    assertNotEquals(OutcomeKind.UNSUPPORTED, certificate(small, k).kind());
  }

  @Test
  public void testMaxCertificateDegree() {
    System.setProperty(SummationSupport.MAX_CERTIFICATE_DEGREE_PROPERTY, "1");
    try {
      assertEquals(OutcomeKind.UNSUPPORTED, certificate(n, n).kind());
      assertTrue(certificate(pow(x, n), n).isSuccess());
    } finally {
      System.clearProperty(SummationSupport.MAX_CERTIFICATE_DEGREE_PROPERTY);
    }
  }
}
