package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.List;

public interface SPow extends STerm {
  @Override
  default SKind kind() {
    return SKind.POWER;
  }

  STerm base();

  STerm exponent();

  static STerm mk(STerm base, STerm exponent) {
    if (exponent.kind() == SKind.NUMBER) {
      final SNum e = (SNum) exponent;
      if (e.signum() == 0) return SNum.ONE;
      if (e.isOne()) return base;
      if (e.isInteger()) {
        switch (base.kind()) {
          case NUMBER:
            return ((SNum) base).pow(e.intValueExact());
          case POWER:
            final SPow inner = (SPow) base;
            return mk(inner.base(), SMul.mk(inner.exponent(), e));
          case MULTIPLY:
            final SMul mul = (SMul) base;
            final List<STerm> factors = new ArrayList<>(mul.factors().size() + 1);
            factors.add(mul.coefficient().pow(e.intValueExact()));
            for (STerm factor : mul.factors()) factors.add(mk(factor, e));
            return SMul.mk(factors);
          default:
            break;
        }
      }
    }
    if (base.kind() == SKind.NUMBER && ((SNum) base).isOne()) return SNum.ONE;
    return new SPowImpl(base, exponent);
  }
}
