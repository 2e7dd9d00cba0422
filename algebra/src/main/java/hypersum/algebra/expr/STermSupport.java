package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static hypersum.common.utils.IterableSupport.any;
import static hypersum.common.utils.ListSupport.map;

public abstract class STermSupport {
  private STermSupport() {}

  /** Replaces every occurrence of a key of {@code replacements}, outermost first. */
  public static STerm substitute(STerm term, Map<? extends STerm, ? extends STerm> replacements) {
    final STerm replaced = replacements.get(term);
    if (replaced != null) return replaced;
    final List<STerm> subTerms = term.subTerms();
    if (subTerms.isEmpty()) return term;
    return term.rebuild(map(subTerms, it -> substitute(it, replacements)));
  }

  public static STerm substitute(STerm term, STerm target, STerm replacement) {
    return substitute(term, Collections.singletonMap(target, replacement));
  }

  public static boolean has(STerm term, STerm target) {
    if (term.equals(target)) return true;
    return any(term.subTerms(), it -> has(it, target));
  }

  public static Set<SSymbol> freeSymbols(STerm term) {
    final Set<SSymbol> symbols = new TreeSet<>();
    collectSymbols(term, symbols);
    return symbols;
  }

  private static void collectSymbols(STerm term, Set<SSymbol> symbols) {
    if (term.kind() == SKind.SYMBOL) symbols.add((SSymbol) term);
    else for (STerm subTerm : term.subTerms()) collectSymbols(subTerm, symbols);
  }

  public static SNum numeral(STerm term) {
    return term.kind() == SKind.NUMBER ? (SNum) term : null;
  }

  public static boolean isNegativeInteger(STerm term) {
    return term.isInteger() && ((SNum) term).signum() < 0;
  }

  public static boolean isNonNegativeInteger(STerm term) {
    return term.isInteger() && ((SNum) term).signum() >= 0;
  }

  /**
   * Whether the leading addend of {@code term} carries a negative sign. Exactly one of {@code t}
   * and {@code -t} has a negative sign, for any non-zero t.
   */
  public static boolean hasNegativeSign(STerm term) {
    switch (term.kind()) {
      case NUMBER:
        return ((SNum) term).signum() < 0;
      case MULTIPLY:
        return ((SMul) term).coefficient().signum() < 0;
      case ADD:
        final SAdd add = (SAdd) term;
        return hasNegativeSign(add.terms().get(0));
      default:
        return false;
    }
  }

  /** Addends of a term: the terms and the constant of a sum, or the term itself. */
  public static List<STerm> addendsOf(STerm term) {
    if (term.kind() != SKind.ADD) return Collections.singletonList(term);
    return term.subTerms();
  }

  /**
   * Distributes products over sums and expands positive integer powers of sums. A power whose
   * exponent has an integer constant part is split as {@code a^(e + c) = a^c * a^e}.
   */
  public static STerm expand(STerm term) {
    switch (term.kind()) {
      case NUMBER:
      case SYMBOL:
        return term;
      case FUNC:
        return term.rebuild(map(term.subTerms(), STermSupport::expand));
      case ADD:
        return SAdd.mk(map(term.subTerms(), STermSupport::expand));
      case MULTIPLY:
        return expandProduct(map(term.subTerms(), STermSupport::expand));
      case POWER:
        final SPow pow = (SPow) term;
        return expandPower(expand(pow.base()), expand(pow.exponent()));
      default:
        throw new IllegalStateException("unknown kind " + term.kind());
    }
  }

  private static STerm expandPower(STerm base, STerm exponent) {
    if (exponent.kind() == SKind.ADD) {
      final SAdd sum = (SAdd) exponent;
      if (sum.constant().isInteger()) {
        final STerm constPart = expandPower(base, sum.constant());
        final STerm restPart = SPow.mk(base, SAdd.mk(sum.terms()));
        return expandProduct(List.of(constPart, restPart));
      }
    }
    if (exponent.isInteger()) {
      final int e = ((SNum) exponent).intValueExact();
      if (e > 1 && base.kind() == SKind.ADD) {
        STerm result = base;
        for (int i = 1; i < e; ++i) result = expandProduct(List.of(result, base));
        return result;
      }
      if (base.kind() == SKind.MULTIPLY) return expand(SPow.mk(base, exponent));
    }
    return SPow.mk(base, exponent);
  }

  private static STerm expandProduct(List<STerm> factors) {
    List<STerm> addends = List.of(SNum.ONE);
    for (STerm factor : factors) {
      final List<STerm> factorAddends = addendsOf(factor);
      final List<STerm> product = new ArrayList<>(addends.size() * factorAddends.size());
      for (STerm x : addends) for (STerm y : factorAddends) product.add(SMul.mk(x, y));
      addends = product;
    }
    return SAdd.mk(addends);
  }
}
