package hypersum.summation;

import static hypersum.common.utils.Commons.parseIntProperty;

public abstract class SummationSupport {

  // Used flag bits (the most significant bit is on the left):
  // (31-24) _ _ _ _ _ _ _ _
  // (23-16) _ _ _ _ _ _ _ _
  // (15-08) _ _ _ _ _ _ _ _
  // (07-01) _ _ _ _ _ _ x x
  // ("_" are unused, while "x" are used)

  // factor the antidifference when factorization makes progress
  public static final int SUM_FLAG_FACTOR_RESULT = 1;

  // take {1} as the root set of a resultant with symbols besides the shift variable
  public static final int SUM_FLAG_SINGLE_ROOT_FALLBACK = 1 << 1;

  public static final int SUM_DEFAULT_FLAGS = SUM_FLAG_FACTOR_RESULT;

  public static final String MAX_CERTIFICATE_DEGREE_PROPERTY = "hypersum.max_certificate_degree";
  private static final int DEFAULT_MAX_CERTIFICATE_DEGREE = 512;

  private SummationSupport() {}

  public static boolean isFlagSet(int flags, int flag) {
    return (flags & flag) != 0;
  }

  /**
   * Largest degree of the unknown certificate polynomial the solver builds a system for. Read on
   * each call so that tests can change the property.
   */
  public static int maxCertificateDegree() {
    final int value = parseIntProperty(MAX_CERTIFICATE_DEGREE_PROPERTY, DEFAULT_MAX_CERTIFICATE_DEGREE);
    if (value < 0)
      throw new IllegalArgumentException(MAX_CERTIFICATE_DEGREE_PROPERTY + " must not be negative");
    return value;
  }
}
