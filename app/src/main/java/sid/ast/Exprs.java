package sid.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Helpers over expression trees. */
public final class Exprs {
  private Exprs() {}

  /** Textual form; the exact left inverse of {@link ExprParser#parse(String)}. */
  public static String toString(Expr expr) {
    return expr.render();
  }

  /** Pattern variable names in first-occurrence order. */
  public static Set<String> variables(Expr expr) {
    Set<String> vars = new LinkedHashSet<>();
    Deque<Expr> stack = new ArrayDeque<>();
    stack.push(expr);
    while (!stack.isEmpty()) {
      Expr current = stack.pop();
      if (current instanceof Atom atom) {
        if (atom.isVariable()) {
          vars.add(atom.name());
        }
      } else if (current instanceof Op op) {
        List<Expr> args = op.args();
        for (int i = args.size() - 1; i >= 0; i--) {
          stack.push(args.get(i));
        }
      }
    }
    return vars;
  }

  /** True when the expression contains no pattern variables. */
  public static boolean isGround(Expr expr) {
    return variables(expr).isEmpty();
  }

  public static int size(Expr expr) {
    int count = 0;
    Deque<Expr> stack = new ArrayDeque<>();
    stack.push(expr);
    while (!stack.isEmpty()) {
      Expr current = stack.pop();
      count++;
      if (current instanceof Op op) {
        op.args().forEach(stack::push);
      }
    }
    return count;
  }
}
