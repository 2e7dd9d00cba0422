package hypersum.summation.gamma;

import hypersum.algebra.expr.SFunc;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;

import static hypersum.algebra.expr.SKind.SYMBOL;
import static hypersum.common.utils.IterableSupport.all;

/**
 * Syntactic classes of terms the summation engine accepts.
 *
 * <p>Rational-linear: a symbol, a numeral, a product of symbols with a numeric coefficient, or a
 * sum of rational-linear terms. Suitable: a rational-linear term, an integer power of a suitable
 * term, a power with rational-linear base and exponent, a special function applied to
 * rational-linear arguments, or a sum or product of suitable terms.
 */
public abstract class FormClassifier {
  private FormClassifier() {}

  public static boolean isRationalLinear(STerm term) {
    switch (term.kind()) {
      case NUMBER, SYMBOL:
        return true;
      case MULTIPLY:
        // the coefficient is kept apart from the factors, so only the factors need checking
        return all(((SMul) term).factors(), it -> it.kind() == SYMBOL);
      case ADD:
        return all(term.subTerms(), FormClassifier::isRationalLinear);
      default:
        return false;
    }
  }

  public static boolean hasSuitableForm(STerm term) {
    if (isRationalLinear(term)) return true;
    switch (term.kind()) {
      case POWER: {
        final SPow pow = (SPow) term;
        if (pow.exponent().isInteger()) return hasSuitableForm(pow.base());
        return isRationalLinear(pow.base()) && isRationalLinear(pow.exponent());
      }
      case FUNC: {
        final SFunc func = (SFunc) term;
        return func.isSpecial() && all(func.args(), FormClassifier::isRationalLinear);
      }
      case MULTIPLY, ADD:
        return all(term.subTerms(), FormClassifier::hasSuitableForm);
      default:
        return false;
    }
  }
}
