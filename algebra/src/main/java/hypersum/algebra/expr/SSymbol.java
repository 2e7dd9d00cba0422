package hypersum.algebra.expr;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named indeterminate. Fresh symbols are allocated by a {@link SymbolGenerator} and never equal
 * a user symbol of the same name.
 */
public final class SSymbol implements STerm {
  private final String name;
  private final boolean fresh;

  private SSymbol(String name, boolean fresh) {
    this.name = name;
    this.fresh = fresh;
  }

  public static SSymbol mk(String name) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("symbol name should be non-empty");
    return new SSymbol(name, false);
  }

  static SSymbol mkFresh(String name) {
    return new SSymbol(name, true);
  }

  @Override
  public SKind kind() {
    return SKind.SYMBOL;
  }

  @Override
  public List<STerm> subTerms() {
    return Collections.emptyList();
  }

  @Override
  public STerm rebuild(List<STerm> subTerms) {
    return this;
  }

  public String name() {
    return name;
  }

  public boolean isFresh() {
    return fresh;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SSymbol)) return false;
    final SSymbol that = (SSymbol) o;
    return fresh == that.fresh && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fresh);
  }

  @Override
  public String toString() {
    return name;
  }
}
