package hypersum.summation.gamma;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static hypersum.algebra.expr.STerm.*;
import static hypersum.algebra.expr.SpecialFunction.GAMMA;
import static hypersum.summation.gamma.PowerCombiner.baseAndExponent;
import static hypersum.summation.gamma.PowerCombiner.combine;
import static org.junit.jupiter.api.Assertions.*;

@Tag("gamma")
@Tag("fast")
public class PowerCombinerTest {
  private final SSymbol n = sym("n");
  private final SSymbol x = sym("x");

  @Test
  public void testNonProductUnchanged() {
    assertEquals(add(n, 1), combine(add(n, 1)));
    assertEquals(pow(x, n), combine(pow(x, n)));
  }

  @Test
  public void testProduct() {
    final STerm term = mul(num(3), func(GAMMA, n), pow(x, n), pow(add(n, 1), -2), n);
    assertEquals(term, combine(term));
    assertEquals(combine(mul(pow(x, n), n)), combine(mul(n, pow(x, n))));
  }

  @Test
  public void testBaseAndExponent() {
    assertEquals(Pair.of(x, n), baseAndExponent(pow(x, n)));
    assertEquals(Pair.of(add(n, 1), (STerm) num(-2)), baseAndExponent(pow(add(n, 1), -2)));
    assertEquals(Pair.of(n, (STerm) SNum.ONE), baseAndExponent(n));
  }
}
