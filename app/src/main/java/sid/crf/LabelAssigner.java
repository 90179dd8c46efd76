package sid.crf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import sid.model.Diagram;
import sid.model.Edge;
import sid.model.Node;

/**
 * Labels every node and edge of a diagram.
 *
 * <ul>
 *   <li>any failed hard constraint: every element is {@code N};
 *   <li>an element outside the CSI (a dof not allowed, or an edge dof pair not allowed) is {@code
 *       N};
 *   <li>otherwise {@code U} when some soft constraint failed, {@code I} when none did.
 * </ul>
 */
public final class LabelAssigner {
  private final ConstraintEvaluator evaluator;

  public LabelAssigner(ConstraintEvaluator evaluator) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
  }

  public Map<String, Label> assign(
      Diagram diagram, List<Constraint> constraints, SidState state, Csi csi) {
    ConstraintEvaluation evaluation = evaluator.evaluate(constraints, state, diagram, csi);
    Map<String, Label> labels = new LinkedHashMap<>();
    if (evaluation.hasHardFailure()) {
      diagram.nodes().forEach(node -> labels.put(node.id(), Label.N));
      diagram.edges().forEach(edge -> labels.put(edge.id(), Label.N));
      return labels;
    }
    Label inside = evaluation.hasSoftFailure() ? Label.U : Label.I;
    for (Node node : diagram.nodes()) {
      labels.put(node.id(), nodeWithinCsi(node, csi) ? inside : Label.N);
    }
    for (Edge edge : diagram.edges()) {
      labels.put(edge.id(), edgeWithinCsi(diagram, edge, csi) ? inside : Label.N);
    }
    return labels;
  }

  static boolean nodeWithinCsi(Node node, Csi csi) {
    for (String dof : node.dofRefs()) {
      if (!csi.allowsDof(dof)) {
        return false;
      }
    }
    return true;
  }

  static boolean edgeWithinCsi(Diagram diagram, Edge edge, Csi csi) {
    if (!csi.restrictsPairs()) {
      return true;
    }
    Optional<Node> from = diagram.node(edge.from());
    Optional<Node> to = diagram.node(edge.to());
    if (from.isEmpty() || to.isEmpty()) {
      return true;
    }
    for (String fromDof : from.get().dofRefs()) {
      for (String toDof : to.get().dofRefs()) {
        if (!csi.allowsPair(fromDof, toDof)) {
          return false;
        }
      }
    }
    return true;
  }
}
