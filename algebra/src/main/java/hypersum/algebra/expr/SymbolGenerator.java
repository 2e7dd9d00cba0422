package hypersum.algebra.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Allocates fresh symbols. Symbols from one generator are pairwise distinct; a generator is meant
 * to live for a single computation and is passed along explicitly.
 */
public class SymbolGenerator {
  private final String prefix;
  private int nextId;

  public SymbolGenerator(String prefix) {
    this.prefix = prefix;
    this.nextId = 0;
  }

  public SSymbol fresh() {
    return SSymbol.mkFresh(prefix + nextId++);
  }

  public SSymbol fresh(String hint) {
    return SSymbol.mkFresh(hint + "_" + prefix + nextId++);
  }

  public List<SSymbol> fresh(int count) {
    final List<SSymbol> symbols = new ArrayList<>(count);
    for (int i = 0; i < count; ++i) symbols.add(fresh());
    return symbols;
  }

  public int allocated() {
    return nextId;
  }
}
