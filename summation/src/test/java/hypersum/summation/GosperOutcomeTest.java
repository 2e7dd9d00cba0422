package hypersum.summation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("summation")
@Tag("fast")
public class GosperOutcomeTest {
  @Test
  public void testSuccess() {
    final GosperOutcome<Integer> outcome = GosperOutcome.of(3);
    assertTrue(outcome.isSuccess());
    assertEquals(OutcomeKind.SUMMED, outcome.kind());
    assertEquals(3, outcome.value());
    assertNull(outcome.reason());
    assertThrows(NullPointerException.class, () -> GosperOutcome.of(null));
  }

  @Test
  public void testFailureKeepsKindAndReason() {
    final GosperOutcome<Integer> notSummable = GosperOutcome.notSummable("no solution");
    final GosperOutcome<String> retyped = notSummable.failure();
    assertEquals(OutcomeKind.NOT_SUMMABLE, retyped.kind());
    assertEquals("no solution", retyped.reason());
    assertThrows(IllegalStateException.class, retyped::value);

    final GosperOutcome<String> unsupported =
        GosperOutcome.<Integer>unsupported("too large").failure();
    assertEquals(OutcomeKind.UNSUPPORTED, unsupported.kind());
    assertEquals("too large", unsupported.reason());
    assertTrue(unsupported.kind().isFailure());
  }
}
