package hypersum.algebra.poly;

import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.expr.STermSupport;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static hypersum.algebra.expr.STerm.*;
import static hypersum.algebra.poly.PolynomialSupport.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("poly")
@Tag("fast")
public class PolynomialSupportTest {
  private static final SSymbol n = sym("n");
  private static final SSymbol x = sym("x");
  private static final SSymbol h = sym("h");

  private static Polynomial poly(STerm term) {
    final RationalFunction f = RationalFunction.of(STermSupport.expand(term));
    assertTrue(f.isPolynomial());
    return f.numerator();
  }

  @Test
  public void testUnivariateGcd() {
    final Polynomial a = poly(mul(add(n, num(1)), add(n, num(2))));
    final Polynomial b = poly(mul(add(n, num(1)), add(n, num(3))));
    assertEquals(poly(add(n, num(1))), gcd(a, b));
    assertEquals(Polynomial.ONE, gcd(poly(add(n, num(2))), poly(add(n, num(3)))));
    assertEquals(poly(add(n, num(1))), gcd(Polynomial.ZERO, poly(mul(num(3), add(n, num(1))))));
  }

  @Test
  public void testMultivariateGcd() {
    final Polynomial a = poly(mul(add(x, n), add(x, num(-1))));
    final Polynomial b = poly(mul(add(x, n), add(n, num(2))));
    assertEquals(poly(add(x, n)), gcd(a, b));
    assertEquals(poly(add(x, num(1))), content(poly(mul(add(x, num(1)), add(n, num(5)))), n));
  }

  @Test
  public void testExactDivision() {
    final Polynomial a = poly(sub(pow(n, 2), num(1)));
    assertEquals(poly(add(n, num(1))), a.divideExact(poly(sub(n, num(1)))));
    assertNull(poly(add(pow(n, 2), num(1))).divide(poly(sub(n, num(1)))));
    assertThrows(
        ArithmeticException.class,
        () -> poly(add(pow(n, 2), num(1))).divideExact(poly(sub(n, num(1)))));
  }

  @Test
  public void testShiftAndCoefficients() {
    final Polynomial square = poly(pow(n, 2));
    assertEquals(poly(add(pow(n, 2), mul(num(2), n), num(1))), square.shift(n, 1));
    final Polynomial p = poly(add(mul(x, pow(n, 2)), mul(num(3), n), x));
    assertEquals(2, p.degree(n));
    assertEquals(0, p.lowestDegree(n));
    assertEquals(poly(x), p.leadingCoefficient(n));
    assertEquals(Polynomial.constant(3), p.coefficient(n, 1));
    assertEquals(-1, Polynomial.ZERO.degree(n));
  }

  @Test
  public void testResultant() {
    assertEquals(poly(add(h, num(1))), resultant(poly(n), poly(add(n, h, num(1))), n));
    assertEquals(
        Polynomial.constant(3), resultant(poly(sub(pow(n, 2), num(1))), poly(sub(n, num(2))), n));
    assertTrue(
        resultant(poly(mul(n, add(n, num(1)))), poly(mul(add(n, num(1)), add(n, num(4)))), n)
            .isZero());
    assertEquals(Polynomial.constant(8), resultant(Polynomial.constant(2), poly(pow(n, 3)), n));
  }

  @Test
  public void testDivisors() {
    assertEquals(
        List.of(1, 2, 3, 4, 6, 12),
        divisors(BigInteger.valueOf(-12)).stream().map(BigInteger::intValue).toList());
    assertEquals(List.of(BigInteger.ONE), divisors(BigInteger.ONE));
  }

  @Test
  public void testNonNegativeIntegerRoots() {
    final Polynomial p = poly(mul(sub(h, num(2)), sub(h, num(5)), add(h, num(3))));
    assertEquals(Set.of(2, 5), nonNegativeIntegerRoots(p, h, 16));
    assertEquals(Set.of(0, 1), nonNegativeIntegerRoots(poly(mul(h, sub(h, num(1)))), h, 16));
    assertEquals(Set.of(), nonNegativeIntegerRoots(poly(add(h, num(1))), h, 16));
    assertEquals(Set.of(), nonNegativeIntegerRoots(poly(sub(mul(num(2), h), num(1))), h, 16));
  }

  @Test
  public void testRootSearchStopsAtLimit() {
    final Polynomial p = poly(mul(sub(h, num(3)), sub(h, num(40)), sub(h, num(10_000_000_000L))));
    assertEquals(Set.of(3), nonNegativeIntegerRoots(p, h, 16));
    assertEquals(Set.of(3, 40), nonNegativeIntegerRoots(p, h, 40));
    assertEquals(Set.of(0), nonNegativeIntegerRoots(poly(h), h, 0));
    assertThrows(IllegalArgumentException.class, () -> nonNegativeIntegerRoots(p, h, -1));
  }

  @Test
  public void testRootsAboveLimit() {
    assertTrue(mayHaveRootAbove(poly(sub(h, num(17))), h, 16));
    assertFalse(mayHaveRootAbove(poly(sub(h, num(16))), h, 16));
    assertFalse(mayHaveRootAbove(poly(add(h, num(1000))), h, 16));
    assertFalse(mayHaveRootAbove(poly(mul(sub(h, num(1)), add(h, num(1000)))), h, 512));
    assertTrue(mayHaveRootAbove(poly(mul(sub(h, num(1)), sub(h, num(1000)))), h, 512));
    assertFalse(mayHaveRootAbove(poly(mul(x, sub(h, num(2)))), h, 16));
    assertFalse(mayHaveRootAbove(poly(x), h, 16));
    assertThrows(IllegalArgumentException.class, () -> mayHaveRootAbove(poly(h), h, 0));
  }

  @Test
  public void testRootsWithParameters() {
    final Polynomial p = poly(mul(sub(h, num(2)), add(x, h)));
    assertEquals(Set.of(2), nonNegativeIntegerRoots(p, h, 16));
    final Polynomial q = poly(add(mul(x, sub(h, num(1))), h));
    assertEquals(Set.of(), nonNegativeIntegerRoots(q, h, 16));
  }
}
