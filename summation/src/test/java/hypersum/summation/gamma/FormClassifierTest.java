package hypersum.summation.gamma;

import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static hypersum.algebra.expr.STerm.*;
import static hypersum.algebra.expr.SpecialFunction.*;
import static hypersum.summation.gamma.FormClassifier.hasSuitableForm;
import static hypersum.summation.gamma.FormClassifier.isRationalLinear;
import static org.junit.jupiter.api.Assertions.*;

@Tag("gamma")
@Tag("fast")
public class FormClassifierTest {
  private final SSymbol n = sym("n");
  private final SSymbol m = sym("m");

  @Test
  public void testRationalLinear() {
    assertTrue(isRationalLinear(n));
    assertTrue(isRationalLinear(num(3, 4)));
    assertTrue(isRationalLinear(add(mul(num(1, 2), n), m, num(7))));
    assertTrue(isRationalLinear(mul(n, m)));
    assertFalse(isRationalLinear(pow(n, 2)));
    assertFalse(isRationalLinear(func(FACTORIAL, n)));
    assertFalse(isRationalLinear(add(n, pow(m, -1))));
  }

  @Test
  public void testSuitableForm() {
    assertTrue(hasSuitableForm(div(add(n, 1), add(n, 2))));
    assertTrue(hasSuitableForm(pow(num(2), n)));
    assertTrue(hasSuitableForm(pow(m, add(n, 1))));
    assertTrue(hasSuitableForm(mul(num(3), func(BINOMIAL, m, n), pow(func(GAMMA, add(n, 1)), -1))));
    assertTrue(hasSuitableForm(add(func(FACTORIAL, n), 1)));
  }

  @Test
  public void testRejectedForms() {
    assertFalse(hasSuitableForm(func("sin", n)));
    assertFalse(hasSuitableForm(func(FACTORIAL, pow(n, 2))));
    assertFalse(hasSuitableForm(pow(num(2), pow(n, 2))));
    assertFalse(hasSuitableForm(mul(n, func("sin", n))));
    final STerm nested = func(GAMMA, func(FACTORIAL, n));
    assertFalse(hasSuitableForm(nested));
  }
}
