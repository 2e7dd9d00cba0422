package hypersum.summation.gamma;

import hypersum.algebra.expr.SFunc;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.expr.SpecialFunction;

import java.util.List;

import static hypersum.algebra.expr.STerm.add;
import static hypersum.algebra.expr.STerm.div;
import static hypersum.algebra.expr.STerm.func;
import static hypersum.algebra.expr.STerm.mul;
import static hypersum.algebra.expr.STerm.pow;
import static hypersum.algebra.expr.STerm.sub;
import static hypersum.algebra.expr.STermSupport.expand;
import static hypersum.algebra.expr.STermSupport.isNegativeInteger;
import static hypersum.algebra.expr.SpecialFunction.FACTORIAL;
import static hypersum.algebra.expr.SpecialFunction.GAMMA;
import static hypersum.common.utils.ListSupport.map;

/** Rewrites the special functions of a term into quotients of gamma functions. */
public abstract class GammaRewriter {
  private GammaRewriter() {}

  public static STerm toGamma(STerm term) {
    if (FormClassifier.isRationalLinear(term)) return term;
    switch (term.kind()) {
      case POWER: {
        final SPow pow = (SPow) term;
        if (pow.exponent().isInteger()) return SPow.mk(toGamma(pow.base()), pow.exponent());
        return term;
      }
      case FUNC: {
        final SFunc func = (SFunc) term;
        if (!func.isSpecial()) return term;
        return rewrite(func.special(), func.args());
      }
      case MULTIPLY, ADD:
        return term.rebuild(map(term.subTerms(), GammaRewriter::toGamma));
      default:
        throw new IllegalStateException("unexpected term in gamma rewriting: " + term);
    }
  }

  static STerm rewrite(SpecialFunction function, List<STerm> args) {
    final STerm a = args.get(0);
    switch (function) {
      case FACTORIAL:
        return gamma(add(a, SNum.ONE));
      case GAMMA:
        return gamma(a);
      case BINOMIAL:
        return binomialToGamma(a, args.get(1));
      case RISING_FACTORIAL:
        return div(gamma(add(a, args.get(1))), gamma(a));
      case FALLING_FACTORIAL:
        return div(gamma(add(a, SNum.ONE)), gamma(add(sub(a, args.get(1)), SNum.ONE)));
      default:
        throw new IllegalStateException("no gamma form for " + function);
    }
  }

  private static STerm binomialToGamma(STerm a, STerm k) {
    if (isNegativeInteger(a)) {
      // binomial(a, k) = (-1)^k * binomial(k - a - 1, k)
      final SNum reflected = ((SNum) a).negate().subtract(SNum.ONE);
      return mul(
          pow(SNum.MINUS_ONE, k),
          gamma(sub(k, a)),
          pow(gamma(add(k, SNum.ONE)), -1),
          pow(func(FACTORIAL, reflected), -1));
    }
    // vanishes when k exceeds a by a positive integer
    if (isNegativeInteger(expand(sub(a, k)))) return SNum.ZERO;

    return div(
        gamma(add(a, SNum.ONE)),
        mul(gamma(add(k, SNum.ONE)), gamma(add(sub(a, k), SNum.ONE))));
  }

  private static STerm gamma(STerm arg) {
    return func(GAMMA, arg);
  }
}
