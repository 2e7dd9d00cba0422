package hypersum.summation;

import java.util.Objects;

/**
 * Result of an internal summation step: either a value, or the kind of failure with a reason.
 * Rejections travel as outcomes and are collapsed into a {@link SummationResult} at the public
 * entry points.
 */
public final class GosperOutcome<T> {
  private final OutcomeKind kind;
  private final T value;
  private final String reason;

  private GosperOutcome(OutcomeKind kind, T value, String reason) {
    this.kind = kind;
    this.value = value;
    this.reason = reason;
  }

  public static <T> GosperOutcome<T> of(T value) {
    return new GosperOutcome<>(OutcomeKind.SUMMED, Objects.requireNonNull(value), null);
  }

  public static <T> GosperOutcome<T> notSummable(String reason) {
    return new GosperOutcome<>(OutcomeKind.NOT_SUMMABLE, null, reason);
  }

  public static <T> GosperOutcome<T> unsupported(String reason) {
    return new GosperOutcome<>(OutcomeKind.UNSUPPORTED, null, reason);
  }

  public OutcomeKind kind() {
    return kind;
  }

  public boolean isSuccess() {
    return kind == OutcomeKind.SUMMED;
  }

  public T value() {
    if (!isSuccess()) throw new IllegalStateException("no value in a failed outcome: " + reason);
    return value;
  }

  /** Why the step failed; null for a successful outcome. */
  public String reason() {
    return reason;
  }

  /** This failure, retyped for the caller's value type. */
  public <R> GosperOutcome<R> failure() {
    assert !isSuccess();
    return new GosperOutcome<>(kind, null, reason);
  }

  @Override
  public String toString() {
    return isSuccess() ? "Summed(" + value + ")" : kind + "(" + reason + ")";
  }
}
