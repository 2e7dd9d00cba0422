package hypersum.algebra.expr;

import org.apache.commons.numbers.fraction.BigFraction;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/** An exact rational numeral. Numerator and denominator are coprime, denominator positive. */
public final class SNum implements STerm {
  public static final SNum ZERO = new SNum(BigInteger.ZERO, BigInteger.ONE);
  public static final SNum ONE = new SNum(BigInteger.ONE, BigInteger.ONE);
  public static final SNum MINUS_ONE = new SNum(BigInteger.ONE.negate(), BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  private SNum(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static SNum mk(long value) {
    return mk(BigInteger.valueOf(value));
  }

  public static SNum mk(long numerator, long denominator) {
    return mk(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static SNum mk(BigInteger value) {
    if (value.signum() == 0) return ZERO;
    if (value.equals(BigInteger.ONE)) return ONE;
    return new SNum(value, BigInteger.ONE);
  }

  public static SNum mk(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) throw new ArithmeticException("division by zero");
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    if (denominator.equals(BigInteger.ONE)) return mk(numerator);
    return new SNum(numerator, denominator);
  }

  public static SNum mk(BigFraction value) {
    // The sign of a BigFraction may sit on either component.
    return mk(value.getNumerator(), value.getDenominator());
  }

  @Override
  public SKind kind() {
    return SKind.NUMBER;
  }

  @Override
  public List<STerm> subTerms() {
    return Collections.emptyList();
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    return this;
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public BigFraction value() {
    return BigFraction.of(numerator, denominator);
  }

  public int signum() {
    return numerator.signum();
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public boolean isOne() {
    return this.equals(ONE);
  }

  /** The value as an int. Throws ArithmeticException if it is not an integer in range. */
  public int intValueExact() {
    if (!isInteger()) throw new ArithmeticException("not an integer: " + this);
    return numerator.intValueExact();
  }

  public SNum add(SNum that) {
    if (this.signum() == 0) return that;
    if (that.signum() == 0) return this;
    return mk(value().add(that.value()));
  }

  public SNum subtract(SNum that) {
    return add(that.negate());
  }

  public SNum multiply(SNum that) {
    if (this.isOne()) return that;
    if (that.isOne()) return this;
    return mk(value().multiply(that.value()));
  }

  public SNum divide(SNum that) {
    if (that.signum() == 0) throw new ArithmeticException("division by zero");
    return mk(value().divide(that.value()));
  }

  public SNum negate() {
    return mk(numerator.negate(), denominator);
  }

  public SNum reciprocal() {
    if (signum() == 0) throw new ArithmeticException("division by zero");
    return mk(denominator, numerator);
  }

  public SNum pow(int exponent) {
    if (exponent < 0) return reciprocal().pow(-exponent);
    return mk(value().pow(exponent));
  }

  public SNum abs() {
    return signum() < 0 ? negate() : this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SNum)) return false;
    final SNum that = (SNum) o;
    return numerator.equals(that.numerator) && denominator.equals(that.denominator);
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    if (isInteger()) return numerator.toString();
    return numerator + "/" + denominator;
  }
}
