package hypersum.summation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static hypersum.summation.SummationSupport.*;
import static org.junit.jupiter.api.Assertions.*;

@Tag("summation")
@Tag("fast")
public class SummationSupportTest {
  @Test
  public void testFlags() {
    assertTrue(isFlagSet(SUM_DEFAULT_FLAGS, SUM_FLAG_FACTOR_RESULT));
    assertFalse(isFlagSet(SUM_DEFAULT_FLAGS, SUM_FLAG_SINGLE_ROOT_FALLBACK));
    assertTrue(isFlagSet(SUM_FLAG_FACTOR_RESULT | SUM_FLAG_SINGLE_ROOT_FALLBACK, SUM_FLAG_SINGLE_ROOT_FALLBACK));
  }

  @Test
  public void testMaxCertificateDegree() {
    assertEquals(512, maxCertificateDegree());
    try {
      System.setProperty(MAX_CERTIFICATE_DEGREE_PROPERTY, " 16 ");
      assertEquals(16, maxCertificateDegree());
      System.setProperty(MAX_CERTIFICATE_DEGREE_PROPERTY, "many");
      assertThrows(IllegalArgumentException.class, SummationSupport::maxCertificateDegree);
      System.setProperty(MAX_CERTIFICATE_DEGREE_PROPERTY, "-1");
      assertThrows(IllegalArgumentException.class, SummationSupport::maxCertificateDegree);
    } finally {
      System.clearProperty(MAX_CERTIFICATE_DEGREE_PROPERTY);
    }
  }
}
