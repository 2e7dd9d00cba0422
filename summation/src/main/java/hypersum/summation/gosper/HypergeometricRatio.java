package hypersum.summation.gosper;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SSymbol;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.poly.Factorization;
import hypersum.summation.GosperOutcome;
import hypersum.summation.gamma.GammaNormalizer;
import hypersum.summation.gamma.GammaRewriter;
import hypersum.summation.gamma.PowerCombiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static hypersum.algebra.expr.STerm.add;
import static hypersum.algebra.expr.STerm.div;
import static hypersum.algebra.expr.STermSupport.expand;
import static hypersum.algebra.expr.STermSupport.substitute;
import static hypersum.summation.gamma.FormClassifier.hasSuitableForm;

/** The consecutive-term ratio {@code T(k+1) / T(k)} of a hypergeometric term, simplified. */
public abstract class HypergeometricRatio {
  private static final Logger LOG = LoggerFactory.getLogger(HypergeometricRatio.class);

  private HypergeometricRatio() {}

  /**
   * Computes the ratio, factors it when possible, rewrites special functions into gamma form and
   * cancels gamma quotients. A ratio outside the suitable form means the term is not recognized as
   * hypergeometric.
   */
  public static GosperOutcome<STerm> hypersimp(STerm term, SSymbol k) {
    if (term.isZero()) return GosperOutcome.notSummable("the zero term has no ratio");

    final STerm shifted = substitute(term, k, add(k, SNum.ONE));
    final STerm ratio = expand(div(shifted, term));
    final Factorization.Factored factored = Factorization.factor(ratio);
    final STerm simplified = factored.success() ? factored.term() : ratio;

    if (!hasSuitableForm(simplified)) {
      LOG.debug("ratio {} of {} is not gamma-representable", simplified, term);
      return GosperOutcome.notSummable("ratio " + simplified + " is not gamma-representable");
    }

    final STerm normalized = GammaNormalizer.normalize(GammaRewriter.toGamma(simplified));
    final STerm combined = PowerCombiner.combine(normalized);
    LOG.debug("ratio of {} in {}: {}", term, k, combined);
    return GosperOutcome.of(combined);
  }
}
