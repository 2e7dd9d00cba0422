package hypersum.summation.gamma;

import hypersum.algebra.expr.SAdd;
import hypersum.algebra.expr.SFunc;
import hypersum.algebra.expr.SKind;
import hypersum.algebra.expr.SMul;
import hypersum.algebra.expr.SNum;
import hypersum.algebra.expr.STerm;
import hypersum.algebra.poly.Factorization;
import hypersum.algebra.poly.RationalFunction;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static hypersum.algebra.expr.STerm.add;
import static hypersum.algebra.expr.STerm.func;
import static hypersum.algebra.expr.STermSupport.expand;
import static hypersum.algebra.expr.STermSupport.substitute;
import static hypersum.algebra.expr.SpecialFunction.GAMMA;

/**
 * Brings gamma functions whose arguments differ by integers to a common argument, then normalizes
 * the result as a rational function.
 *
 * <p>Every argument is split into a base and an integer offset. Within a group of equal bases, each
 * {@code gamma(base + j)} is replaced by {@code gamma(base + m) * (base + m) * ... * (base + j - 1)}
 * where m is the smallest offset in the group. The quotient then cancels as a rational function in
 * the remaining gamma kernels. The factored form is returned when factorization makes progress.
 */
public abstract class GammaNormalizer {
  private GammaNormalizer() {}

  public static STerm normalize(STerm term) {
    final Map<STerm, STerm> replacements = shiftReplacements(term);
    final STerm shifted = replacements.isEmpty() ? term : substitute(term, replacements);
    final RationalFunction normal = RationalFunction.of(shifted);
    final Factorization.Factored factored = Factorization.factor(normal);
    return factored.success() ? factored.term() : normal.toTerm();
  }

  static Map<STerm, STerm> shiftReplacements(STerm term) {
    // base -> offset -> gamma calls seen with that offset
    final Map<STerm, TreeMap<Integer, Set<STerm>>> groups = new TreeMap<>();
    collectGammaArgs(term, groups);

    final Map<STerm, STerm> replacements = new HashMap<>();
    for (Map.Entry<STerm, TreeMap<Integer, Set<STerm>>> group : groups.entrySet()) {
      final TreeMap<Integer, Set<STerm>> offsets = group.getValue();
      if (offsets.size() < 2) continue;

      final STerm base = group.getKey();
      final int lowest = offsets.firstKey();
      final STerm lowestGamma = func(GAMMA, add(base, SNum.mk(lowest)));
      for (Map.Entry<Integer, Set<STerm>> offset : offsets.tailMap(lowest, false).entrySet()) {
        final List<STerm> factors = new ArrayList<>();
        factors.add(lowestGamma);
        for (int i = lowest; i < offset.getKey(); ++i) factors.add(add(base, SNum.mk(i)));
        final STerm rewritten = SMul.mk(factors);
        for (STerm call : offset.getValue()) replacements.put(call, rewritten);
      }
    }
    return replacements;
  }

  private static void collectGammaArgs(
      STerm term, Map<STerm, TreeMap<Integer, Set<STerm>>> groups) {
    if (term instanceof SFunc func && func.isSpecial(GAMMA)) {
      final Pair<STerm, Integer> split = splitOffset(expand(func.arg(0)));
      if (split != null)
        groups
            .computeIfAbsent(split.getLeft(), ignored -> new TreeMap<>())
            .computeIfAbsent(split.getRight(), ignored -> new TreeSet<>())
            .add(term);
    }
    for (STerm subTerm : term.subTerms()) collectGammaArgs(subTerm, groups);
  }

  /**
   * Splits an argument into a base whose constant lies in [0, 1) and an integer offset. Returns
   * null for numerals and for offsets out of int range.
   */
  static Pair<STerm, Integer> splitOffset(STerm arg) {
    if (arg.kind() == SKind.NUMBER) return null;
    if (arg.kind() != SKind.ADD) return Pair.of(arg, 0);

    final SAdd sum = (SAdd) arg;
    final SNum constant = sum.constant();
    final BigInteger[] qr = constant.numerator().divideAndRemainder(constant.denominator());
    final BigInteger floor = qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
    if (floor.bitLength() >= Integer.SIZE - 1) return null;

    final List<STerm> addends = new ArrayList<>(sum.terms());
    addends.add(constant.subtract(SNum.mk(floor)));
    return Pair.of(SAdd.mk(addends), floor.intValueExact());
  }
}
