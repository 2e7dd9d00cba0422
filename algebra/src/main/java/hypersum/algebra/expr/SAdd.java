package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public interface SAdd extends STerm {
  @Override
  default SKind kind() {
    return SKind.ADD;
  }

  /** Non-numeral addends in canonical order. */
  List<STerm> terms();

  SNum constant();

  static STerm mk(STerm... addends) {
    return mk(Arrays.asList(addends));
  }

  static STerm mk(List<STerm> addends) {
    SNum constant = SNum.ZERO;
    final Map<STerm, SNum> coefficients = new TreeMap<>();
    for (STerm addend : addends) {
      switch (addend.kind()) {
        case NUMBER -> constant = constant.add((SNum) addend);
        case ADD -> {
          final SAdd add = (SAdd) addend;
          constant = constant.add(add.constant());
          for (STerm term : add.terms()) collect(coefficients, term);
        }
        default -> collect(coefficients, addend);
      }
    }

    final List<STerm> terms = new ArrayList<>(coefficients.size());
    for (Map.Entry<STerm, SNum> e : coefficients.entrySet()) {
      if (e.getValue().signum() != 0) terms.add(SMul.scale(e.getKey(), e.getValue()));
    }

    if (terms.isEmpty()) return constant;
    if (terms.size() == 1 && constant.signum() == 0) return terms.get(0);
    return new SAddImpl(terms, constant);
  }

  private static void collect(Map<STerm, SNum> coefficients, STerm term) {
    if (term.kind() == SKind.MULTIPLY) {
      final SMul mul = (SMul) term;
      coefficients.merge(mul.withoutCoefficient(), mul.coefficient(), SNum::add);
    } else {
      coefficients.merge(term, SNum.ONE, SNum::add);
    }
  }
}
