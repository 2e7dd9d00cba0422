package hypersum.algebra.expr;

import java.math.BigInteger;
import java.util.List;

/** The combinatorial functions understood by the engine. */
public enum SpecialFunction {
  FACTORIAL("factorial", 1),
  GAMMA("gamma", 1),
  BINOMIAL("binomial", 2),
  RISING_FACTORIAL("rising_factorial", 2),
  FALLING_FACTORIAL("falling_factorial", 2);

  private final String text;
  private final int arity;

  SpecialFunction(String text, int arity) {
    this.text = text;
    this.arity = arity;
  }

  public String text() {
    return text;
  }

  public int arity() {
    return arity;
  }

  public static SpecialFunction ofName(String name) {
    for (SpecialFunction function : values()) if (function.text.equals(name)) return function;
    return null;
  }

  /** Value at numeral arguments, or null if the call does not reduce to a numeral. */
  SNum evaluate(List<SNum> args) {
    assert args.size() == arity;
    final SNum x = args.get(0);
    switch (this) {
      case FACTORIAL:
        if (x.isInteger() && x.signum() >= 0) return SNum.mk(factorial(x.intValueExact()));
        return null;
      case GAMMA:
        if (x.isInteger() && x.signum() > 0) return SNum.mk(factorial(x.intValueExact() - 1));
        return null;
      case BINOMIAL:
        final SNum k = args.get(1);
        if (!k.isInteger()) return null;
        if (k.signum() < 0) return SNum.ZERO;
        return falling(x, k.intValueExact()).divide(SNum.mk(factorial(k.intValueExact())));
      case RISING_FACTORIAL:
        if (!isNonNegativeInteger(args.get(1))) return null;
        return rising(x, args.get(1).intValueExact());
      case FALLING_FACTORIAL:
        if (!isNonNegativeInteger(args.get(1))) return null;
        return falling(x, args.get(1).intValueExact());
      default:
        throw new IllegalStateException("unknown function " + this);
    }
  }

  private static boolean isNonNegativeInteger(SNum x) {
    return x.isInteger() && x.signum() >= 0;
  }

  private static BigInteger factorial(int n) {
    BigInteger result = BigInteger.ONE;
    for (int i = 2; i <= n; ++i) result = result.multiply(BigInteger.valueOf(i));
    return result;
  }

  private static SNum rising(SNum a, int k) {
    SNum result = SNum.ONE;
    for (int i = 0; i < k; ++i) result = result.multiply(a.add(SNum.mk(i)));
    return result;
  }

  private static SNum falling(SNum a, int k) {
    SNum result = SNum.ONE;
    for (int i = 0; i < k; ++i) result = result.multiply(a.subtract(SNum.mk(i)));
    return result;
  }
}
