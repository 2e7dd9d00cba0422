package hypersum.summation.gamma;

import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static hypersum.algebra.expr.STerm.*;
import static hypersum.algebra.expr.SpecialFunction.GAMMA;
import static hypersum.summation.gamma.GammaNormalizer.normalize;
import static hypersum.summation.gamma.GammaNormalizer.splitOffset;
import static org.junit.jupiter.api.Assertions.*;

@Tag("gamma")
@Tag("fast")
public class GammaNormalizerTest {
  private final SSymbol n = sym("n");
  private final SSymbol k = sym("k");

  private static STerm gamma(STerm arg) {
    return func(GAMMA, arg);
  }

  @Test
  public void testShiftedGammasCancel() {
    assertEquals(mul(add(n, 1), add(n, 2)), normalize(div(gamma(add(n, 3)), gamma(add(n, 1)))));
    assertEquals(pow(n, -1), normalize(div(gamma(n), gamma(add(n, 1)))));
    assertEquals(add(n, num(1, 2)), normalize(div(gamma(add(n, num(3, 2))), gamma(add(n, num(1, 2))))));
  }

  @Test
  public void testSplitOffset() {
    assertEquals(Pair.of(n, 0), splitOffset(n));
    assertEquals(Pair.of(n, 4), splitOffset(add(n, 4)));
    assertEquals(Pair.of(add(n, num(1, 2)), -2), splitOffset(sub(n, num(3, 2))));
    assertNull(splitOffset(num(3)));
  }

  @Test
  public void testUnrelatedGammasStay() {
    final STerm term = div(gamma(add(n, 1)), gamma(add(k, 1)));
    assertEquals(term, normalize(term));
  }

  @Test
  public void testIdempotent() {
    final STerm term =
        add(div(gamma(add(n, 2)), gamma(n)), mul(k, gamma(add(n, 1))));
    final STerm once = normalize(term);
    assertEquals(once, normalize(once));

    final STerm other = add(div(gamma(add(n, 1)), gamma(n)), 1);
    assertEquals(add(n, 1), normalize(other));
    assertEquals(normalize(other), normalize(normalize(other)));
  }
}
