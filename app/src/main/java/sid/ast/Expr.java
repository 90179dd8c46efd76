package sid.ast;

import java.util.List;

/** Immutable expression tree: either an {@link Atom} or an operator application {@link Op}. */
public interface Expr {

  /** Sigil marking an atom as a pattern variable. */
  String VARIABLE_SIGIL = "$";

  /** Renders this expression in the textual grammar accepted by {@link ExprParser}. */
  String render();

  static Atom atom(String name) {
    return new Atom(name);
  }

  static Op op(String name, Expr... args) {
    return new Op(OperatorKind.parse(name), List.of(args));
  }
}
