package hypersum.summation.gamma;

import hypersum.algebra.expr.SAdd;
import hypersum.algebra.expr.SKind;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the powers of equal bases in a product, so that each base appears once with the sum of
 * its exponents. Function calls are kept as they are.
 */
public abstract class PowerCombiner {
  private PowerCombiner() {}

  public static STerm combine(STerm term) {
    if (term.kind() != SKind.MULTIPLY) return term;

    final SMul mul = (SMul) term;
    final List<STerm> factors = new ArrayList<>(mul.factors().size() + 1);
    final Map<STerm, STerm> exponents = new TreeMap<>();
    factors.add(mul.coefficient());
    for (STerm factor : mul.factors()) {
      if (factor.kind() == SKind.FUNC) {
        factors.add(factor);
        continue;
      }
      final Pair<STerm, STerm> power = baseAndExponent(factor);
      exponents.merge(power.getLeft(), power.getRight(), (x, y) -> SAdd.mk(x, y));
    }
    for (Map.Entry<STerm, STerm> e : exponents.entrySet())
      factors.add(SPow.mk(e.getKey(), e.getValue()));

    return SMul.mk(factors);
  }

  static Pair<STerm, STerm> baseAndExponent(STerm factor) {
    if (factor.kind() != SKind.POWER) return Pair.of(factor, SNum.ONE);

    final SPow pow = (SPow) factor;
    // (b^e)^-1 -> b^-e
    if (pow.exponent().equals(SNum.MINUS_ONE) && pow.base().kind() == SKind.POWER) {
      final SPow inner = (SPow) pow.base();
      return Pair.of(inner.base(), SMul.mk(SNum.MINUS_ONE, inner.exponent()));
    }
    return Pair.of(pow.base(), pow.exponent());
  }
}
