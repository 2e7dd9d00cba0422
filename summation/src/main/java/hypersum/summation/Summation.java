package hypersum.summation;

import hypersum.algebra.expr.SKind;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.poly.Factorization;
import hypersum.algebra.poly.RationalFunction;
import hypersum.summation.gosper.GosperCertificate;
import hypersum.summation.gosper.GosperSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static hypersum.algebra.expr.STerm.add;
import static hypersum.algebra.expr.STerm.mul;
import static hypersum.algebra.expr.STerm.sub;
import static hypersum.algebra.expr.STermSupport.substitute;
import static hypersum.summation.SummationSupport.SUM_DEFAULT_FLAGS;
import static hypersum.summation.SummationSupport.SUM_FLAG_FACTOR_RESULT;
import static hypersum.summation.SummationSupport.isFlagSet;

/**
 * Entry points of the summation engine. Neither method throws for a term that cannot be summed:
 * the failure is reported in the returned {@link SummationResult}.
 */
public abstract class Summation {
  private static final Logger LOG = LoggerFactory.getLogger(Summation.class);

  private Summation() {}

  public static SummationResult indefiniteSum(STerm term, SSymbol n) {
    return indefiniteSum(term, n, SUM_DEFAULT_FLAGS);
  }

  /** An antidifference S of the term: {@code S(n+1) - S(n) = term(n)}. */
  public static SummationResult indefiniteSum(STerm term, SSymbol n, int flags) {
    if (term.isZero()) return SummationResult.success(SNum.ZERO);

    final GosperOutcome<GosperCertificate> certificate = GosperSolver.certificate(term, n, flags);
    if (!certificate.isSuccess()) {
      LOG.debug("indefinite sum of {} over {} failed: {}", term, n, certificate);
      return SummationResult.failure(certificate);
    }
    return SummationResult.success(finish(mul(term, certificate.value().toTerm()), flags));
  }

  public static SummationResult definiteSum(STerm term, SSymbol n, STerm lower, STerm upper) {
    return definiteSum(term, n, lower, upper, SUM_DEFAULT_FLAGS);
  }

  /**
   * The sum of the term for n from {@code lower} to {@code upper} inclusive. With the certificate
   * g, this is {@code term(upper) * (g(upper) + 1) - term(lower) * g(lower)}.
   */
  public static SummationResult definiteSum(
      STerm term, SSymbol n, STerm lower, STerm upper, int flags) {
    checkBounds(lower, upper);
    if (term.isZero()) return SummationResult.success(SNum.ZERO);

    final GosperOutcome<GosperCertificate> certificate = GosperSolver.certificate(term, n, flags);
    if (!certificate.isSuccess()) {
      LOG.debug("sum of {} for {} from {} to {} failed: {}", term, n, lower, upper, certificate);
      return SummationResult.failure(certificate);
    }

    final STerm g = certificate.value().toTerm();
    final STerm upperPart = RationalFunction.normalize(mul(term, add(g, SNum.ONE)));
    final STerm lowerPart = RationalFunction.normalize(mul(term, g));
    final STerm value = sub(substitute(upperPart, n, upper), substitute(lowerPart, n, lower));
    return SummationResult.success(finish(RationalFunction.normalize(value), flags));
  }

  private static STerm finish(STerm result, int flags) {
    if (!isFlagSet(flags, SUM_FLAG_FACTOR_RESULT)) return result;
    final Factorization.Factored factored = Factorization.factor(result);
    return factored.success() ? factored.term() : result;
  }

  private static void checkBounds(STerm lower, STerm upper) {
    for (STerm bound : new STerm[] {lower, upper})
      if (bound.kind() == SKind.NUMBER && !bound.isInteger())
        throw new IllegalArgumentException("summation bound is not an integer: " + bound);
    if (lower.isInteger() && upper.isInteger()
        && ((SNum) lower).subtract((SNum) upper).signum() > 0)
      throw new IllegalArgumentException("empty range: " + lower + " > " + upper);
  }
}
