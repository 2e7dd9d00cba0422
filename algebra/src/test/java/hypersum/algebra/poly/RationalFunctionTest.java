package hypersum.algebra.poly;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.expr.SpecialFunction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static hypersum.algebra.expr.STerm.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("poly")
@Tag("fast")
public class RationalFunctionTest {
  private static final SSymbol n = sym("n");
  private static final SSymbol x = sym("x");

  @Test
  public void testCancellation() {
    final STerm quotient = div(sub(pow(n, 2), num(1)), sub(n, num(1)));
    assertEquals(RationalFunction.of(add(n, num(1))), RationalFunction.of(quotient));
    assertEquals(
        RationalFunction.constant(SNum.mk(1, 2)),
        RationalFunction.of(div(add(n, num(1)), add(mul(num(2), n), num(2)))));
  }

  @Test
  public void testSumOfFractions() {
    // 1/n - 1/(n + 1) = 1/(n^2 + n)
    final STerm diff = sub(pow(n, -1), pow(add(n, num(1)), -1));
    final RationalFunction f = RationalFunction.of(diff);
    assertEquals(Polynomial.ONE, f.numerator());
    assertEquals(RationalFunction.of(add(pow(n, 2), n)).numerator(), f.denominator());
  }

  @Test
  public void testPowerKernels() {
    final STerm ratio = div(add(pow(num(2), add(n, num(1))), num(2)), add(pow(num(2), n), num(1)));
    assertEquals(RationalFunction.constant(SNum.mk(2)), RationalFunction.of(ratio));

    final RationalFunction up = RationalFunction.of(pow(x, n));
    final RationalFunction down = RationalFunction.of(pow(x, neg(n)));
    assertEquals(RationalFunction.ONE, up.multiply(down));
    assertEquals(
        RationalFunction.of(pow(x, n)).pow(2), RationalFunction.of(pow(x, mul(num(2), n))));
  }

  @Test
  public void testFunctionKernels() {
    final STerm g = func(SpecialFunction.GAMMA, add(n, num(1)));
    final STerm sameG = func(SpecialFunction.GAMMA, add(num(1), n));
    assertEquals(RationalFunction.ONE, RationalFunction.of(div(g, sameG)));
    assertFalse(RationalFunction.of(g).isConstant());
    assertTrue(RationalFunction.of(g).has(g));
  }

  @Test
  public void testNormalizeIsIdempotent() {
    final STerm term =
        add(div(n, add(n, num(1))), pow(num(3), add(n, num(2))), func(SpecialFunction.GAMMA, n));
    final STerm once = RationalFunction.normalize(term);
    assertEquals(once, RationalFunction.normalize(once));
  }

  @Test
  public void testSubstitute() {
    final RationalFunction f = RationalFunction.of(div(add(n, x), sub(n, num(1))));
    final RationalFunction g = f.substitute(n, RationalFunction.of(add(n, num(1))));
    assertEquals(RationalFunction.of(div(add(n, x, num(1)), n)), g);
    assertThrows(ArithmeticException.class, () -> RationalFunction.ZERO.reciprocal());
  }
}
