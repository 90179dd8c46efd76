package sid.pkg;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.ExprParser;
import sid.ast.OperatorKind;
import sid.ast.ParseException;
import sid.crf.Constraint;
import sid.crf.ConstraintEvaluation;
import sid.crf.ConstraintEvaluator;
import sid.crf.Csi;
import sid.crf.LabelAssigner;
import sid.crf.PredicateRegistry;
import sid.crf.SidState;
import sid.io.CrfJson;
import sid.io.DiagramJson;
import sid.io.JsonFields;
import sid.model.Diagram;
import sid.model.StructuralException;

/**
 * Checks a raw package document: ids, references, collapse irreversibility, CSI boundaries, rule
 * well-formedness and, per state, the package constraints.
 *
 * <p>Works on the JSON tree so that documents {@link PackageLoader} would refuse can still be
 * reported on in full.
 */
public final class PackageValidator {
  private static final Logger LOG = LoggerFactory.getLogger(PackageValidator.class);

  private final ConstraintEvaluator evaluator;

  public PackageValidator() {
    this(new ConstraintEvaluator(PredicateRegistry.defaults()));
  }

  public PackageValidator(ConstraintEvaluator evaluator) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
  }

  public ValidationOutcome validate(JsonObject pkg) {
    Objects.requireNonNull(pkg, "pkg");
    Issues issues = new Issues();
    Map<String, JsonObject> diagrams = index(pkg, "diagrams", "diagram", issues);
    Map<String, JsonObject> csis = index(pkg, "csis", "CSI", issues);
    Map<String, JsonObject> dofs = index(pkg, "dofs", "DOF", issues);
    Map<String, JsonObject> compartments = index(pkg, "compartments", "compartment", issues);
    Map<String, JsonObject> states = index(pkg, "states", "state", issues);

    checkDiagrams(diagrams, dofs, compartments, issues);
    checkStates(states, diagrams, csis, compartments, issues);
    checkAcyclic(diagrams, issues);
    checkCollapseIrreversibility(diagrams, issues);
    checkCsiBoundaries(states, diagrams, csis, dofs, issues);
    checkRules(JsonFields.objects(pkg, "rewrite_rules"), issues);
    checkConstraints(pkg, states, diagrams, csis, issues);

    LOG.info(
        "Validation complete: {} errors, {} warnings",
        issues.errors.size(),
        issues.warnings.size());
    return new ValidationOutcome(issues.errors, issues.warnings);
  }

  private static Map<String, JsonObject> index(
      JsonObject pkg, String section, String itemType, Issues issues) {
    Map<String, JsonObject> index = new LinkedHashMap<>();
    for (JsonObject item : JsonFields.objects(pkg, section)) {
      String id = JsonFields.string(item, "id");
      if (id == null || id.isEmpty()) {
        issues.error(
            IssueCategory.MISSING_ID, itemType + " missing id", Map.of("item_type", itemType));
        continue;
      }
      if (index.containsKey(id)) {
        issues.error(
            IssueCategory.DUPLICATE_ID,
            "Duplicate " + itemType + " id: " + id,
            Map.of("item_type", itemType, "id", id));
        continue;
      }
      index.put(id, item);
    }
    return index;
  }

  private static void checkDiagrams(
      Map<String, JsonObject> diagrams,
      Map<String, JsonObject> dofs,
      Map<String, JsonObject> compartments,
      Issues issues) {
    for (Map.Entry<String, JsonObject> entry : diagrams.entrySet()) {
      String diagramId = entry.getKey();
      JsonObject diagram = entry.getValue();
      Set<String> nodeIds = new HashSet<>();
      for (JsonObject node : JsonFields.objects(diagram, "nodes")) {
        String nodeId = JsonFields.string(node, "id");
        if (nodeId == null || nodeId.isEmpty()) {
          issues.error(
              IssueCategory.MISSING_ID,
              "Diagram " + diagramId + " has node missing id",
              Map.of("diagram_id", diagramId));
          continue;
        }
        if (!nodeIds.add(nodeId)) {
          issues.error(
              IssueCategory.DUPLICATE_ID,
              "Diagram " + diagramId + " has duplicate node id " + nodeId,
              Map.of("diagram_id", diagramId, "node_id", nodeId));
        }
        String op = JsonFields.string(node, "op");
        if (OperatorKind.fromSymbol(op).isEmpty()) {
          issues.error(
              IssueCategory.UNKNOWN_OPERATOR,
              "Diagram " + diagramId + " node " + nodeId + " has unknown op " + op,
              Map.of("diagram_id", diagramId, "node_id", nodeId));
        }
        for (String dof : JsonFields.strings(node, "dof_refs")) {
          if (!dofs.containsKey(dof)) {
            issues.error(
                IssueCategory.MISSING_REFERENCE,
                "Diagram " + diagramId + " node " + nodeId + " references unknown DOF " + dof,
                Map.of("diagram_id", diagramId, "node_id", nodeId, "dof", dof));
          }
        }
      }

      Set<String> edgeIds = new HashSet<>();
      for (JsonObject edge : JsonFields.objects(diagram, "edges")) {
        String edgeId = JsonFields.string(edge, "id");
        if (edgeId == null || edgeId.isEmpty()) {
          issues.error(
              IssueCategory.MISSING_ID,
              "Diagram " + diagramId + " has edge missing id",
              Map.of("diagram_id", diagramId));
          continue;
        }
        if (!edgeIds.add(edgeId)) {
          issues.error(
              IssueCategory.DUPLICATE_ID,
              "Diagram " + diagramId + " has duplicate edge id " + edgeId,
              Map.of("diagram_id", diagramId, "edge_id", edgeId));
        }
        String from = JsonFields.string(edge, "from");
        String to = JsonFields.string(edge, "to");
        if (!nodeIds.contains(from) || !nodeIds.contains(to)) {
          issues.error(
              IssueCategory.MISSING_REFERENCE,
              "Diagram " + diagramId + " edge " + edgeId + " references missing node",
              Map.of("diagram_id", diagramId, "edge_id", edgeId));
        }
      }

      for (JsonObject node : JsonFields.objects(diagram, "nodes")) {
        for (String input : JsonFields.strings(node, "inputs")) {
          if (!nodeIds.contains(input)) {
            String nodeId = String.valueOf(JsonFields.string(node, "id"));
            issues.error(
                IssueCategory.MISSING_REFERENCE,
                "Diagram " + diagramId + " node " + nodeId + " references missing input " + input,
                Map.of("diagram_id", diagramId, "node_id", nodeId, "input_id", input));
          }
        }
      }

      String compartmentId = JsonFields.string(diagram, "compartment_id");
      if (compartmentId != null && !compartmentId.isEmpty()
          && !compartments.containsKey(compartmentId)) {
        issues.error(
            IssueCategory.MISSING_REFERENCE,
            "Diagram " + diagramId + " references missing compartment " + compartmentId,
            Map.of("diagram_id", diagramId, "compartment_id", compartmentId));
      }
    }
  }

  private static void checkStates(
      Map<String, JsonObject> states,
      Map<String, JsonObject> diagrams,
      Map<String, JsonObject> csis,
      Map<String, JsonObject> compartments,
      Issues issues) {
    for (Map.Entry<String, JsonObject> entry : states.entrySet()) {
      String stateId = entry.getKey();
      JsonObject state = entry.getValue();
      String diagramId = JsonFields.string(state, "diagram_id");
      if (diagramId == null || !diagrams.containsKey(diagramId)) {
        issues.error(
            IssueCategory.MISSING_REFERENCE,
            "State " + stateId + " references missing diagram " + diagramId,
            Map.of("state_id", stateId));
      }
      String csiId = JsonFields.string(state, "csi_id");
      if (csiId == null || !csis.containsKey(csiId)) {
        issues.error(
            IssueCategory.MISSING_REFERENCE,
            "State " + stateId + " references missing CSI " + csiId,
            Map.of("state_id", stateId));
      }
      String compartmentId = JsonFields.string(state, "compartment_id");
      if (compartmentId != null && !compartmentId.isEmpty()
          && !compartments.containsKey(compartmentId)) {
        issues.error(
            IssueCategory.MISSING_REFERENCE,
            "State " + stateId + " references missing compartment " + compartmentId,
            Map.of("state_id", stateId, "compartment_id", compartmentId));
      }
    }
  }

  private static void checkAcyclic(Map<String, JsonObject> diagrams, Issues issues) {
    for (Map.Entry<String, JsonObject> entry : diagrams.entrySet()) {
      Diagram diagram;
      try {
        diagram = DiagramJson.read(entry.getValue());
      } catch (StructuralException ex) {
        LOG.debug("Cycle check skipped for diagram {}: {}", entry.getKey(), ex.getMessage());
        continue;
      }
      if (diagram.hasCycle()) {
        issues.error(
            IssueCategory.CYCLIC_DIAGRAM,
            "Diagram " + entry.getKey() + " contains a cycle",
            Map.of("diagram_id", entry.getKey()));
      }
    }
  }

  private static void checkCollapseIrreversibility(
      Map<String, JsonObject> diagrams, Issues issues) {
    for (Map.Entry<String, JsonObject> entry : diagrams.entrySet()) {
      for (JsonObject node : JsonFields.objects(entry.getValue(), "nodes")) {
        if (OperatorKind.O.symbol().equals(JsonFields.string(node, "op"))
            && !JsonFields.bool(node, "irreversible", false)) {
          String nodeId = String.valueOf(JsonFields.string(node, "id"));
          issues.error(
              IssueCategory.COLLAPSE_NOT_IRREVERSIBLE,
              "Collapse node "
                  + nodeId
                  + " in diagram "
                  + entry.getKey()
                  + " must set irreversible=true",
              Map.of("diagram_id", entry.getKey(), "node_id", nodeId));
        }
      }
    }
  }

  private static void checkCsiBoundaries(
      Map<String, JsonObject> states,
      Map<String, JsonObject> diagrams,
      Map<String, JsonObject> csis,
      Map<String, JsonObject> dofs,
      Issues issues) {
    Set<String> checkedCsis = new HashSet<>();
    for (JsonObject state : states.values()) {
      String diagramId = JsonFields.string(state, "diagram_id");
      String csiId = JsonFields.string(state, "csi_id");
      JsonObject diagram = diagramId == null ? null : diagrams.get(diagramId);
      JsonObject csi = csiId == null ? null : csis.get(csiId);
      if (diagram == null || csi == null) {
        continue;
      }
      Set<List<String>> allowedPairs = csiPairs(csiId, csi, dofs, issues, checkedCsis.add(csiId));
      Set<String> allowedDofs = new HashSet<>(JsonFields.strings(csi, "allowed_dofs"));

      Map<String, List<String>> nodeDofs = new LinkedHashMap<>();
      for (JsonObject node : JsonFields.objects(diagram, "nodes")) {
        String nodeId = JsonFields.string(node, "id");
        List<String> refs = JsonFields.strings(node, "dof_refs");
        if (nodeId != null) {
          nodeDofs.put(nodeId, refs);
        }
        for (String dof : refs) {
          if (!allowedDofs.contains(dof)) {
            issues.error(
                IssueCategory.DOF_OUTSIDE_CSI,
                "Diagram "
                    + diagramId
                    + " node "
                    + nodeId
                    + " uses DOF "
                    + dof
                    + " outside CSI "
                    + csiId,
                Map.of("diagram_id", diagramId, "node_id", String.valueOf(nodeId), "dof", dof));
          }
        }
      }

      if (allowedPairs.isEmpty()) {
        continue;
      }
      for (JsonObject edge : JsonFields.objects(diagram, "edges")) {
        List<String> fromDofs = nodeDofs.get(JsonFields.string(edge, "from"));
        List<String> toDofs = nodeDofs.get(JsonFields.string(edge, "to"));
        if (fromDofs == null || toDofs == null) {
          continue;
        }
        String edgeId = String.valueOf(JsonFields.string(edge, "id"));
        for (String fromDof : fromDofs) {
          for (String toDof : toDofs) {
            if (!allowedPairs.contains(List.of(fromDof, toDof))) {
              issues.error(
                  IssueCategory.CSI_PAIR_VIOLATION,
                  "Diagram "
                      + diagramId
                      + " edge "
                      + edgeId
                      + " violates CSI "
                      + csiId
                      + " pair ("
                      + fromDof
                      + ", "
                      + toDof
                      + ")",
                  Map.of("diagram_id", diagramId, "edge_id", edgeId, "csi_id", csiId));
            }
          }
        }
      }
    }
  }

  /** Well-formed pairs of a CSI; malformed ones are reported once per CSI. */
  private static Set<List<String>> csiPairs(
      String csiId,
      JsonObject csi,
      Map<String, JsonObject> dofs,
      Issues issues,
      boolean report) {
    Set<List<String>> pairs = new HashSet<>();
    JsonElement raw = csi.get("allowed_pairs");
    if (raw == null || !raw.isJsonArray()) {
      return pairs;
    }
    for (JsonElement element : raw.getAsJsonArray()) {
      if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
        int size = element.isJsonArray() ? element.getAsJsonArray().size() : 1;
        if (report) {
          issues.error(
              IssueCategory.INVALID_CSI_PAIR,
              "CSI " + csiId + " allowed_pair must have exactly 2 elements, got " + size,
              Map.of("csi_id", csiId));
        }
        continue;
      }
      JsonArray pair = element.getAsJsonArray();
      String from = pair.get(0).getAsString();
      String to = pair.get(1).getAsString();
      if (report) {
        for (String dof : List.of(from, to)) {
          if (!dofs.containsKey(dof)) {
            issues.error(
                IssueCategory.INVALID_CSI_PAIR_DOF,
                "CSI " + csiId + " allowed_pair references unknown DOF: " + dof,
                Map.of("csi_id", csiId, "unknown_dof", dof));
          }
        }
      }
      pairs.add(List.of(from, to));
    }
    return pairs;
  }

  private static void checkRules(List<JsonObject> rules, Issues issues) {
    for (JsonObject rule : rules) {
      String ruleId = String.valueOf(JsonFields.string(rule, "id"));
      String pattern = JsonFields.firstString(rule, "pattern", "pattern_expr");
      String replacement = JsonFields.firstString(rule, "replacement", "replacement_expr");
      if (pattern == null || replacement == null) {
        issues.error(
            IssueCategory.INVALID_REWRITE_RULE,
            "Rewrite "
                + ruleId
                + " must define pattern+replacement or pattern_expr+replacement_expr",
            Map.of("rule_id", ruleId));
        continue;
      }
      try {
        ExprParser.parse(pattern);
        ExprParser.parse(replacement);
      } catch (ParseException ex) {
        issues.error(
            IssueCategory.INVALID_REWRITE_EXPR,
            "Rewrite " + ruleId + " has invalid expr: " + ex.getMessage(),
            Map.of("rule_id", ruleId, "error", ex.getMessage()));
      }
    }
  }

  private void checkConstraints(
      JsonObject pkg,
      Map<String, JsonObject> states,
      Map<String, JsonObject> diagrams,
      Map<String, JsonObject> csis,
      Issues issues) {
    List<Constraint> constraints = new ArrayList<>();
    for (JsonObject obj : JsonFields.objects(pkg, "constraints")) {
      try {
        constraints.add(CrfJson.readConstraint(obj));
      } catch (IllegalArgumentException ex) {
        issues.error(IssueCategory.MISSING_ID, ex.getMessage(), Map.of("item_type", "constraint"));
      }
    }
    LabelAssigner labels = new LabelAssigner(evaluator);
    for (Map.Entry<String, JsonObject> entry : states.entrySet()) {
      String stateId = entry.getKey();
      JsonObject diagramObj = diagrams.get(JsonFields.string(entry.getValue(), "diagram_id"));
      JsonObject csiObj = csis.get(JsonFields.string(entry.getValue(), "csi_id"));
      if (diagramObj == null || csiObj == null) {
        continue;
      }
      Diagram diagram;
      SidState state;
      Csi csi;
      try {
        diagram = DiagramJson.read(diagramObj);
        state = CrfJson.readState(entry.getValue());
        csi = CrfJson.readCsi(csiObj);
      } catch (StructuralException | IllegalArgumentException ex) {
        issues.warning(
            IssueCategory.CONSTRAINT_WARNING,
            "State " + stateId + " skipped for constraint evaluation: " + ex.getMessage(),
            Map.of("state_id", stateId));
        continue;
      }
      if (!state.hasLabels()) {
        state.setLabels(labels.assign(diagram, constraints, state, csi));
      }
      ConstraintEvaluation evaluation = evaluator.evaluate(constraints, state, diagram, csi);
      for (String message : evaluation.errors()) {
        issues.error(IssueCategory.CONSTRAINT_VIOLATION, message, Map.of("state_id", stateId));
      }
      for (String message : evaluation.warnings()) {
        issues.warning(IssueCategory.CONSTRAINT_WARNING, message, Map.of("state_id", stateId));
      }
    }
  }

  private static final class Issues {
    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    void error(IssueCategory category, String message, Map<String, String> context) {
      errors.add(ValidationIssue.error(category, message, context));
    }

    void warning(IssueCategory category, String message, Map<String, String> context) {
      warnings.add(ValidationIssue.warning(category, message, context));
    }
  }
}
