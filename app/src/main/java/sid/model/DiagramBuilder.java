package sid.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import sid.ast.Atom;
import sid.ast.Expr;
import sid.ast.ExprParser;
import sid.ast.Op;
import sid.ast.OperatorKind;
import sid.ast.ParseException;

/** Builds diagrams from expressions, one node per subtree and one {@code arg} edge per argument. */
public final class DiagramBuilder {
  private DiagramBuilder() {}

  public static Diagram fromText(String text, String diagramId) throws ParseException {
    return fromExpr(ExprParser.parse(text), diagramId, "");
  }

  /**
   * Instantiates {@code expr} into a fresh diagram. Atoms become {@link OperatorKind#ATOM} leaves
   * carrying the atom name as their only dof reference. The result is validated before it is
   * returned.
   */
  public static Diagram fromExpr(Expr expr, String diagramId, String scope) {
    Objects.requireNonNull(expr, "expr");
    Diagram diagram = new Diagram(diagramId);
    instantiate(diagram, expr, IdGenerator.scopedTo(diagram, scope), Map.of());
    DiagramValidator.requireValid(diagram);
    return diagram;
  }

  /**
   * Adds the nodes and edges for {@code expr} to {@code target} and returns the root node id.
   * Variables listed in {@code boundNodes} reuse the existing node instead of creating a leaf.
   */
  public static String instantiate(
      Diagram target, Expr expr, IdGenerator ids, Map<String, String> boundNodes) {
    if (expr instanceof Atom atom) {
      String bound = boundNodes.get(atom.name());
      if (bound != null) {
        target.requireNode(bound);
        return bound;
      }
      String nodeId = ids.nextNodeId();
      target.addNode(Node.atom(nodeId, atom.name()));
      return nodeId;
    }
    Op op = (Op) expr;
    OperatorKind kind = op.kind();
    if (!kind.accepts(op.arity())) {
      throw new StructuralException(
          kind.symbol() + " requires " + kind.arityDescription() + ", got " + op.arity());
    }
    String nodeId = ids.nextNodeId();
    target.addNode(Node.operator(nodeId, kind));
    List<Expr> args = op.args();
    for (int port = 0; port < args.size(); port++) {
      String childId = instantiate(target, args.get(port), ids, boundNodes);
      target.connect(ids.nextEdgeId(), childId, nodeId, port);
    }
    return nodeId;
  }
}
