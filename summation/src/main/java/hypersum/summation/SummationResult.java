package hypersum.summation;

import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.STerm;

/**
 * Outcome of a public summation call. A failed result carries the zero term, with the kind and
 * reason of the failure kept for diagnostics.
 */
public record SummationResult(STerm term, OutcomeKind kind, String reason) {
  static SummationResult success(STerm term) {
    return new SummationResult(term, OutcomeKind.SUMMED, null);
  }

  static SummationResult failure(GosperOutcome<?> outcome) {
    assert !outcome.isSuccess();
    return new SummationResult(SNum.ZERO, outcome.kind(), outcome.reason());
  }

  public boolean isSuccess() {
    return kind == OutcomeKind.SUMMED;
  }
}
