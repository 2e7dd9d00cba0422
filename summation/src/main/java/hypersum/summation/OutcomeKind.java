package hypersum.summation;

public enum OutcomeKind {
  SUMMED,
  /** The term provably has no hypergeometric antidifference, or is not hypergeometric at all. */
  NOT_SUMMABLE,
  /** The input lies outside what the engine handles; nothing is claimed about summability. */
  UNSUPPORTED;

  public boolean isFailure() {
    return this != SUMMED;
  }
}
