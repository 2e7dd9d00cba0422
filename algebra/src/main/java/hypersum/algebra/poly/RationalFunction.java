package hypersum.algebra.poly;

import hypersum.algebra.expr.SAdd;
import hypersum.algebra.expr.SKind;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.SPow;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.expr.STermSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static hypersum.algebra.expr.STermSupport.hasNegativeSign;
import static hypersum.common.utils.ListSupport.map;

/**
 * A quotient of coprime polynomials. The denominator is normalized to a leading coefficient of 1,
 * so equal rational functions have equal representations.
 */
public final class RationalFunction {
  public static final RationalFunction ZERO =
      new RationalFunction(Polynomial.ZERO, Polynomial.ONE);
  public static final RationalFunction ONE = new RationalFunction(Polynomial.ONE, Polynomial.ONE);

  private final Polynomial numerator;
  private final Polynomial denominator;

  private RationalFunction(Polynomial numerator, Polynomial denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static RationalFunction of(Polynomial numerator, Polynomial denominator) {
    if (denominator.isZero()) throw new ArithmeticException("division by zero");
    if (numerator.isZero()) return ZERO;
    if (!denominator.isConstant()) {
      final Polynomial gcd = PolynomialSupport.gcd(numerator, denominator);
      if (!gcd.isOne()) {
        numerator = numerator.divideExact(gcd);
        denominator = denominator.divideExact(gcd);
      }
    }
    final SNum leading = denominator.leadingTermCoefficient();
    if (!leading.isOne()) {
      numerator = numerator.scale(leading.reciprocal());
      denominator = denominator.scale(leading.reciprocal());
    }
    return new RationalFunction(numerator, denominator);
  }

  public static RationalFunction of(Polynomial polynomial) {
    return new RationalFunction(polynomial, Polynomial.ONE);
  }

  public static RationalFunction constant(SNum value) {
    return of(Polynomial.constant(value));
  }

  /**
   * Converts a term. Function calls and powers with a non-integer exponent become kernels; an
   * integer constant in an exponent is split off so that {@code a^(e + c)} and {@code a^e} share a
   * kernel.
   */
  public static RationalFunction of(STerm term) {
    switch (term.kind()) {
      case NUMBER:
        return constant((SNum) term);
      case SYMBOL:
        return of(Polynomial.variable(term));
      case ADD: {
        RationalFunction sum = ZERO;
        for (STerm addend : term.subTerms()) sum = sum.add(of(addend));
        return sum;
      }
      case MULTIPLY: {
        RationalFunction product = ONE;
        for (STerm factor : term.subTerms()) product = product.multiply(of(factor));
        return product;
      }
      case POWER:
        return ofPower((SPow) term);
      case FUNC:
        return ofKernel(term.rebuild(map(term.subTerms(), RationalFunction::normalize)));
      default:
        throw new IllegalStateException("unknown kind " + term.kind());
    }
  }

  private static RationalFunction ofPower(SPow pow) {
    final RationalFunction base = of(pow.base());
    final STerm exponent = STermSupport.expand(pow.exponent());
    if (exponent.isInteger()) return base.pow(((SNum) exponent).intValueExact());

    int offset = 0;
    STerm rest = exponent;
    if (exponent.kind() == SKind.ADD && ((SAdd) exponent).constant().isInteger()) {
      offset = ((SAdd) exponent).constant().intValueExact();
      rest = SAdd.mk(((SAdd) exponent).terms());
    }

    // rest = multiple * kernel exponent, with the sign folded into the multiple
    int multiple = 1;
    if (rest.kind() == SKind.MULTIPLY) {
      final SMul mul = (SMul) rest;
      final SNum coefficient = mul.coefficient();
      if (coefficient.isInteger()) {
        multiple = coefficient.intValueExact();
        rest = mul.withoutCoefficient();
      } else if (coefficient.signum() < 0) {
        multiple = -1;
        rest = SMul.scale(mul.withoutCoefficient(), coefficient.negate());
      }
    } else if (hasNegativeSign(rest)) {
      multiple = -1;
      rest = SMul.mk(SNum.MINUS_ONE, rest);
    }

    final RationalFunction kernel = ofKernel(SPow.mk(base.toTerm(), rest));
    return base.pow(offset).multiply(kernel.pow(multiple));
  }

  private static RationalFunction ofKernel(STerm kernel) {
    if (kernel.kind() == SKind.NUMBER) return constant((SNum) kernel);
    if (kernel.kind() == SKind.POWER || kernel.kind() == SKind.FUNC)
      return of(Polynomial.variable(kernel));
    return of(kernel);
  }

  /** Rational-function normal form of a term. */
  public static STerm normalize(STerm term) {
    return of(term).toTerm();
  }

  public Polynomial numerator() {
    return numerator;
  }

  public Polynomial denominator() {
    return denominator;
  }

  public boolean isZero() {
    return numerator.isZero();
  }

  public boolean isPolynomial() {
    return denominator.isOne();
  }

  public boolean isConstant() {
    return numerator.isConstant() && denominator.isOne();
  }

  public SNum constantValue() {
    if (!isConstant()) throw new IllegalStateException("not a constant: " + this);
    return numerator.constantTerm();
  }

  public boolean has(STerm var) {
    return numerator.has(var) || denominator.has(var);
  }

  public RationalFunction add(RationalFunction that) {
    if (this.isZero()) return that;
    if (that.isZero()) return this;
    if (denominator.equals(that.denominator))
      return of(numerator.add(that.numerator), denominator);
    return of(
        numerator.multiply(that.denominator).add(that.numerator.multiply(denominator)),
        denominator.multiply(that.denominator));
  }

  public RationalFunction subtract(RationalFunction that) {
    return add(that.negate());
  }

  public RationalFunction negate() {
    return new RationalFunction(numerator.negate(), denominator);
  }

  public RationalFunction multiply(RationalFunction that) {
    if (this.isZero() || that.isZero()) return ZERO;
    if (this.isPolynomial() && that.isPolynomial())
      return of(numerator.multiply(that.numerator));
    return of(numerator.multiply(that.numerator), denominator.multiply(that.denominator));
  }

  public RationalFunction divide(RationalFunction that) {
    return multiply(that.reciprocal());
  }

  public RationalFunction reciprocal() {
    if (isZero()) throw new ArithmeticException("division by zero");
    return of(denominator, numerator);
  }

  public RationalFunction pow(int exponent) {
    if (exponent < 0) return reciprocal().pow(-exponent);
    return new RationalFunction(numerator.pow(exponent), denominator.pow(exponent));
  }

  public RationalFunction substitute(STerm var, RationalFunction value) {
    if (!has(var)) return this;
    return substitute(numerator, var, value).divide(substitute(denominator, var, value));
  }

  private static RationalFunction substitute(Polynomial p, STerm var, RationalFunction value) {
    RationalFunction result = ZERO;
    for (Polynomial coefficient : reverse(p.coefficients(var)))
      result = result.multiply(value).add(of(coefficient));
    return result;
  }

  private static List<Polynomial> reverse(List<Polynomial> xs) {
    final List<Polynomial> reversed = new ArrayList<>(xs);
    Collections.reverse(reversed);
    return reversed;
  }

  public STerm toTerm() {
    if (denominator.isOne()) return numerator.toTerm();
    return SMul.mk(numerator.toTerm(), SPow.mk(denominator.toTerm(), SNum.MINUS_ONE));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RationalFunction)) return false;
    final RationalFunction that = (RationalFunction) o;
    return numerator.equals(that.numerator) && denominator.equals(that.denominator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numerator, denominator);
  }

  @Override
  public String toString() {
    return toTerm().toString();
  }
}
