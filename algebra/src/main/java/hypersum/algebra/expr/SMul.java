package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public interface SMul extends STerm {
  @Override
  default SKind kind() {
    return SKind.MULTIPLY;
  }

  /** Non-numeral factors in canonical order. */
  List<STerm> factors();

  SNum coefficient();

  /** This product with its coefficient dropped. */
  default STerm withoutCoefficient() {
    final List<STerm> factors = factors();
    if (factors.size() == 1) return factors.get(0);
    return new SMulImpl(factors, SNum.ONE);
  }

  static STerm mk(STerm... factors) {
    return mk(Arrays.asList(factors));
  }

  static STerm mk(List<STerm> factors) {
    SNum coefficient = SNum.ONE;
    // base -> accumulated exponent
    final Map<STerm, STerm> exponents = new TreeMap<>();
    for (STerm factor : factors) {
      switch (factor.kind()) {
        case NUMBER -> coefficient = coefficient.multiply((SNum) factor);
        case MULTIPLY -> {
          final SMul mul = (SMul) factor;
          coefficient = coefficient.multiply(mul.coefficient());
          for (STerm f : mul.factors()) collect(exponents, f);
        }
        default -> collect(exponents, factor);
      }
    }
    if (coefficient.signum() == 0) return SNum.ZERO;

    final List<STerm> combined = new ArrayList<>(exponents.size());
    for (Map.Entry<STerm, STerm> e : exponents.entrySet()) {
      final STerm power = SPow.mk(e.getKey(), e.getValue());
      switch (power.kind()) {
        case NUMBER -> coefficient = coefficient.multiply((SNum) power);
        case MULTIPLY -> {
          final SMul mul = (SMul) power;
          coefficient = coefficient.multiply(mul.coefficient());
          combined.addAll(mul.factors());
        }
        default -> combined.add(power);
      }
    }
    if (coefficient.signum() == 0) return SNum.ZERO;

    Collections.sort(combined);
    if (combined.isEmpty()) return coefficient;
    if (combined.size() == 1) {
      final STerm single = combined.get(0);
      if (coefficient.isOne()) return single;
      if (single.kind() == SKind.ADD) return distribute((SAdd) single, coefficient);
    }
    return new SMulImpl(combined, coefficient);
  }

  /** Multiplies a term that carries no numeral coefficient by {@code coefficient}. */
  static STerm scale(STerm term, SNum coefficient) {
    if (coefficient.isOne()) return term;
    if (coefficient.signum() == 0) return SNum.ZERO;
    switch (term.kind()) {
      case NUMBER:
        return ((SNum) term).multiply(coefficient);
      case MULTIPLY:
        final SMul mul = (SMul) term;
        return new SMulImpl(mul.factors(), mul.coefficient().multiply(coefficient));
      case ADD:
        return distribute((SAdd) term, coefficient);
      default:
        return new SMulImpl(Collections.singletonList(term), coefficient);
    }
  }

  private static STerm distribute(SAdd add, SNum coefficient) {
    final List<STerm> addends = new ArrayList<>(add.terms().size() + 1);
    for (STerm term : add.terms()) addends.add(SMul.mk(coefficient, term));
    addends.add(add.constant().multiply(coefficient));
    return SAdd.mk(addends);
  }

  private static void collect(Map<STerm, STerm> exponents, STerm factor) {
    if (factor.kind() == SKind.POWER) {
      final SPow pow = (SPow) factor;
      exponents.merge(pow.base(), pow.exponent(), (x, y) -> SAdd.mk(x, y));
    } else {
      exponents.merge(factor, SNum.ONE, (x, y) -> SAdd.mk(x, y));
    }
  }
}
