package hypersum.summation.gosper;

import hypersum.algebra.expr.STerm;
import hypersum.algebra.poly.Polynomial;
import hypersum.algebra.poly.RationalFunction;

/**
 * A rational function R(n) such that {@code S(n) = R(n) * T(n)} satisfies {@code S(n+1) - S(n) =
 * T(n)}. {@code degreeBound} is the degree the unknown polynomial was solved for and {@code
 * solutionDegree} the degree of the solution found.
 */
public record GosperCertificate(RationalFunction rational, int degreeBound, int solutionDegree) {
  public Polynomial numerator() {
    return rational.numerator();
  }

  public Polynomial denominator() {
    return rational.denominator();
  }

  public STerm toTerm() {
    return rational.toTerm();
  }
}
