package sid.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import sid.ast.Atom;
import sid.ast.Expr;
import sid.ast.Op;
import sid.ast.OperatorKind;

/** Converts diagram subgraphs back into expressions without recursion. */
public final class DiagramExprs {
  private DiagramExprs() {}

  /** Nodes that feed no other node, in insertion order. */
  public static List<String> roots(Diagram diagram) {
    Set<String> consumed = new HashSet<>();
    for (Edge edge : diagram.edges()) {
      consumed.add(edge.from());
    }
    for (Node node : diagram.nodes()) {
      consumed.addAll(node.inputs());
    }
    List<String> roots = new ArrayList<>();
    for (Node node : diagram.nodes()) {
      if (!consumed.contains(node.id())) {
        roots.add(node.id());
      }
    }
    return roots;
  }

  /** Rendered expressions for every root. */
  public static List<String> render(Diagram diagram) {
    List<String> rendered = new ArrayList<>();
    for (String root : roots(diagram)) {
      rendered.add(toExpr(diagram, root).render());
    }
    return rendered;
  }

  /**
   * Expression rooted at {@code rootId}. Shared subgraphs are expanded at every use.
   *
   * @throws StructuralException if the subgraph is cyclic or a node has no arguments
   */
  public static Expr toExpr(Diagram diagram, String rootId) {
    diagram.requireNode(rootId);
    Map<String, Expr> built = new HashMap<>();
    Set<String> onPath = new HashSet<>();
    Deque<String> stack = new ArrayDeque<>();
    stack.push(rootId);
    while (!stack.isEmpty()) {
      String current = stack.peek();
      if (built.containsKey(current)) {
        stack.pop();
        continue;
      }
      Node node = diagram.requireNode(current);
      List<String> inputs = diagram.inputsOf(current);
      if (onPath.add(current)) {
        boolean pushed = false;
        for (int i = inputs.size() - 1; i >= 0; i--) {
          String input = inputs.get(i);
          if (onPath.contains(input)) {
            throw new StructuralException("Cycle through node " + input);
          }
          if (!built.containsKey(input)) {
            stack.push(input);
            pushed = true;
          }
        }
        if (pushed) {
          continue;
        }
      }
      stack.pop();
      onPath.remove(current);
      built.put(current, assemble(node, inputs, built));
    }
    return built.get(rootId);
  }

  private static Expr assemble(Node node, List<String> inputs, Map<String, Expr> built) {
    if (node.op() == OperatorKind.ATOM) {
      return new Atom(node.dofRefs().isEmpty() ? node.id() : node.dofRefs().get(0));
    }
    List<Expr> args = new ArrayList<>();
    if (inputs.isEmpty()) {
      for (String dof : node.dofRefs()) {
        args.add(new Atom(dof));
      }
    } else {
      for (String input : inputs) {
        args.add(built.get(input));
      }
    }
    if (args.isEmpty()) {
      throw new StructuralException("Node " + node.id() + " has no arguments");
    }
    return new Op(node.op(), args);
  }
}
