package sid.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Structural checks over a {@link Diagram}. */
public final class DiagramValidator {
  private DiagramValidator() {}

  public static ValidationReport validate(Diagram diagram) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    for (Edge edge : diagram.edges()) {
      if (!diagram.hasNode(edge.from())) {
        errors.add("Edge " + edge.id() + " references missing source node " + edge.from());
      }
      if (!diagram.hasNode(edge.to())) {
        errors.add("Edge " + edge.id() + " references missing target node " + edge.to());
      }
    }
    for (Node node : diagram.nodes()) {
      for (String input : node.inputs()) {
        if (!diagram.hasNode(input)) {
          errors.add("Node " + node.id() + " references missing input " + input);
        }
      }
      checkInputsAgainstEdges(diagram, node, warnings);
      int argCount = node.isFolded() ? node.dofRefs().size() : diagram.inputsOf(node.id()).size();
      if (!node.op().accepts(argCount)) {
        warnings.add(
            "Node "
                + node.id()
                + " ("
                + node.op().symbol()
                + ") has "
                + argCount
                + " arguments, expected "
                + node.op().arityDescription());
      }
    }
    return new ValidationReport(errors, warnings, !diagram.hasCycle());
  }

  /** Throws {@link StructuralException} listing every error. Cycles are reported separately. */
  public static void requireValid(Diagram diagram) {
    ValidationReport report = validate(diagram);
    if (!report.isValid()) {
      throw new StructuralException(report.errors());
    }
  }

  public static void requireAcyclic(Diagram diagram) {
    if (diagram.hasCycle()) {
      throw new StructuralException("Diagram " + diagram.id() + " contains a directed cycle");
    }
  }

  private static void checkInputsAgainstEdges(Diagram diagram, Node node, List<String> warnings) {
    List<Edge> incoming = diagram.incoming(node.id());
    if (incoming.isEmpty() || node.inputs().isEmpty()) {
      return;
    }
    Map<String, Integer> fromEdges = new HashMap<>();
    for (Edge edge : incoming) {
      fromEdges.merge(edge.from(), 1, Integer::sum);
    }
    Map<String, Integer> fromInputs = new HashMap<>();
    for (String input : node.inputs()) {
      fromInputs.merge(input, 1, Integer::sum);
    }
    if (!fromEdges.equals(fromInputs)) {
      warnings.add(
          "Node " + node.id() + " inputs " + node.inputs() + " disagree with incoming edges");
    }
  }
}
