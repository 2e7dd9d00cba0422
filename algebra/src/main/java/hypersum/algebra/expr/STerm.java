package hypersum.algebra.expr;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static hypersum.common.utils.ListSupport.map;

/**
 * A symbolic expression: a numeral, a symbol, a sum, a product, a power or a function call.
 *
 * <p>Terms are immutable and built through the {@code mk} factories, which keep them in a canonical
 * shape: nested sums and products are flattened, numerals folded, like addends and like factors
 * collected and operands sorted by {@link STermOrder}. Structurally equal terms are {@code equals}.
 */
public interface STerm extends Comparable<STerm> {

  SKind kind();

  List<STerm> subTerms();

  /** Builds a term of the same shape over {@code subTerms}, re-canonicalizing the result. */
  STerm rebuild(List<STerm> subTerms);

  default STerm transformPostOrder(Function<STerm, STerm> transformer) {
    final List<STerm> subTerms = subTerms();
    if (subTerms.isEmpty()) return transformer.apply(this);
    return transformer.apply(rebuild(map(subTerms, it -> it.transformPostOrder(transformer))));
  }

  default boolean isNumber() {
    return kind() == SKind.NUMBER;
  }

  default boolean isZero() {
    return kind() == SKind.NUMBER && ((SNum) this).signum() == 0;
  }

  default boolean isOne() {
    return kind() == SKind.NUMBER && ((SNum) this).isOne();
  }

  default boolean isInteger() {
    return kind() == SKind.NUMBER && ((SNum) this).isInteger();
  }

  @Override
  default int compareTo(STerm o) {
    return STermOrder.INSTANCE.compare(this, o);
  }

  static SSymbol sym(String name) {
    return SSymbol.mk(name);
  }

  static SNum num(long value) {
    return SNum.mk(value);
  }

  static SNum num(long numerator, long denominator) {
    return SNum.mk(numerator, denominator);
  }

  static STerm add(STerm... addends) {
    return SAdd.mk(Arrays.asList(addends));
  }

  static STerm add(STerm term, long constant) {
    return SAdd.mk(term, SNum.mk(constant));
  }

  static STerm add(STerm a, STerm b, long constant) {
    return SAdd.mk(Arrays.asList(a, b, SNum.mk(constant)));
  }

  static STerm sub(STerm minuend, STerm subtrahend) {
    return SAdd.mk(minuend, neg(subtrahend));
  }

  static STerm sub(STerm term, long constant) {
    return SAdd.mk(term, SNum.mk(-constant));
  }

  static STerm neg(STerm term) {
    return SMul.mk(SNum.MINUS_ONE, term);
  }

  static STerm mul(STerm... factors) {
    return SMul.mk(Arrays.asList(factors));
  }

  static STerm div(STerm dividend, STerm divisor) {
    return SMul.mk(dividend, SPow.mk(divisor, SNum.MINUS_ONE));
  }

  static STerm div(STerm dividend, long divisor) {
    if (divisor == 0) throw new ArithmeticException("division by zero");
    return SMul.mk(SNum.mk(1, divisor), dividend);
  }

  static STerm pow(STerm base, STerm exponent) {
    return SPow.mk(base, exponent);
  }

  static STerm pow(STerm base, long exponent) {
    return SPow.mk(base, SNum.mk(exponent));
  }

  static STerm func(SpecialFunction function, STerm... args) {
    return SFunc.mk(function, Arrays.asList(args));
  }

  static STerm func(String name, STerm... args) {
    return SFunc.mk(name, Arrays.asList(args));
  }
}
