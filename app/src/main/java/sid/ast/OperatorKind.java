package sid.ast;

import java.util.Optional;

/** Closed set of diagram operators, with their textual symbol and argument bounds. */
public enum OperatorKind {
  /** Projection of a single degree of freedom. */
  P("P", 1, 1),
  /** Positive superposition. */
  S_PLUS("S+", 1, Integer.MAX_VALUE),
  /** Negative superposition. */
  S_MINUS("S-", 1, Integer.MAX_VALUE),
  /** Irreversible collapse. */
  O("O", 1, 1),
  /** Coupling of two regions. */
  C("C", 2, 2),
  /** Transport into another compartment. */
  T("T", 1, 1),
  /** Atom leaf carrying its name as a degree-of-freedom reference. */
  ATOM("A", 0, 0);

  private final String symbol;
  private final int minArgs;
  private final int maxArgs;

  OperatorKind(String symbol, int minArgs, int maxArgs) {
    this.symbol = symbol;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
  }

  public String symbol() {
    return symbol;
  }

  public int minArgs() {
    return minArgs;
  }

  public int maxArgs() {
    return maxArgs;
  }

  public boolean accepts(int argCount) {
    return argCount >= minArgs && argCount <= maxArgs;
  }

  public boolean isIrreversible() {
    return this == O;
  }

  /** Human readable arity, used in parse and validation messages. */
  public String arityDescription() {
    if (minArgs == maxArgs) {
      return "exactly " + minArgs + (minArgs == 1 ? " argument" : " arguments");
    }
    return "at least " + minArgs + (minArgs == 1 ? " argument" : " arguments");
  }

  public static Optional<OperatorKind> fromSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    for (OperatorKind kind : values()) {
      if (kind.symbol.equals(symbol)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /** Operators that may appear applied to arguments in expression text. */
  public static Optional<OperatorKind> applicable(String symbol) {
    return fromSymbol(symbol).filter(kind -> kind != ATOM);
  }

  public static OperatorKind parse(String symbol) {
    return fromSymbol(symbol)
        .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
  }

  @Override
  public String toString() {
    return symbol;
  }
}
