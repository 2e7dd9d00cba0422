package hypersum.algebra.poly;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static hypersum.algebra.expr.STerm.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("poly")
@Tag("fast")
public class LinearSystemTest {
  private static RationalFunction c(long value) {
    return RationalFunction.constant(SNum.mk(value));
  }

  @Test
  public void testUniqueSolution() {
    final LinearSystem system = new LinearSystem(2);
    system.addEquation(List.of(c(1), c(1)), c(3));
    system.addEquation(List.of(c(1), c(-1)), c(1));
    final LinearSystem.Solution solution = system.solve();
    assertTrue(solution.consistent());
    assertEquals(List.of(c(2), c(1)), solution.values());
    assertTrue(solution.free().isEmpty());
  }

  @Test
  public void testUnderdetermined() {
    final LinearSystem system = new LinearSystem(2);
    system.addEquation(List.of(c(1), c(1)), c(2));
    system.addEquation(List.of(c(2), c(2)), c(4));
    final LinearSystem.Solution solution = system.solve();
    assertTrue(solution.consistent());
    assertEquals(List.of(c(2), c(0)), solution.values());
    assertEquals(List.of(1), solution.free());
  }

  @Test
  public void testInconsistent() {
    final LinearSystem system = new LinearSystem(1);
    system.addEquation(List.of(c(1)), c(1));
    system.addEquation(List.of(c(1)), c(2));
    assertFalse(system.solve().consistent());
  }

  @Test
  public void testSymbolicCoefficients() {
    // x * c0 = x + 1
    final SSymbol x = sym("x");
    final LinearSystem system = new LinearSystem(1);
    system.addEquation(List.of(RationalFunction.of(x)), RationalFunction.of(add(x, num(1))));
    final LinearSystem.Solution solution = system.solve();
    assertTrue(solution.consistent());
    assertEquals(RationalFunction.of(div(add(x, num(1)), x)), solution.values().get(0));
    assertThrows(IllegalArgumentException.class, () -> system.addEquation(List.of(), c(0)));
  }
}
