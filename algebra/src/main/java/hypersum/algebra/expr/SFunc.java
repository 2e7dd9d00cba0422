package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A function call. Calls of a {@link SpecialFunction} carry its tag; any other name is kept as an
 * uninterpreted function, which the summation engine rejects.
 */
public interface SFunc extends STerm {
  @Override
  default SKind kind() {
    return SKind.FUNC;
  }

  String name();

  /** The special function called, or null for an uninterpreted function. */
  SpecialFunction special();

  default boolean isSpecial() {
    return special() != null;
  }

  default boolean isSpecial(SpecialFunction function) {
    return special() == function;
  }

  default List<STerm> args() {
    return subTerms();
  }

  default STerm arg(int i) {
    return subTerms().get(i);
  }

  static STerm mk(SpecialFunction function, List<STerm> args) {
    if (args.size() != function.arity())
      throw new IllegalArgumentException(
          function.text() + " expects " + function.arity() + " argument(s), got " + args.size());

    final List<SNum> values = new ArrayList<>(args.size());
    for (STerm arg : args) {
      if (arg.kind() != SKind.NUMBER) break;
      values.add((SNum) arg);
    }
    if (values.size() == args.size()) {
      final SNum value = function.evaluate(values);
      if (value != null) return value;
    }
    return new SFuncImpl(function.text(), function, args);
  }

  static STerm mk(String name, List<STerm> args) {
    final SpecialFunction function = SpecialFunction.ofName(name);
    if (function != null) return mk(function, args);
    return new SFuncImpl(name, null, args);
  }
}
