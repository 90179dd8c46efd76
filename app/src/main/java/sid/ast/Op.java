package sid.ast;

import java.util.List;
import java.util.Objects;

/** Operator application with an ordered, non-empty argument list. */
public record Op(OperatorKind kind, List<Expr> args) implements Expr {

  public Op {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(args, "args");
    if (kind == OperatorKind.ATOM) {
      throw new IllegalArgumentException("atoms cannot be applied to arguments");
    }
    if (args.isEmpty()) {
      throw new IllegalArgumentException("operator " + kind + " requires at least one argument");
    }
    args = List.copyOf(args);
  }

  /** Textual symbol of the operator, for example {@code S+}. */
  public String name() {
    return kind.symbol();
  }

  public int arity() {
    return args.size();
  }

  @Override
  public String render() {
    StringBuilder sb = new StringBuilder(name()).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(args.get(i).render());
    }
    return sb.append(')').toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
