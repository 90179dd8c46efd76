package sid.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import sid.model.Diagram;
import sid.model.DiagramExprs;
import sid.pkg.ValidationIssue;
import sid.pkg.ValidationOutcome;
import sid.rewrite.FixpointResult;
import sid.rewrite.RewriteResult;
import sid.stability.StabilityMetrics;
import sid.stability.StabilityVerdict;

/** Pretty-printed JSON reports for the command outputs. */
final class JsonReportBuilder {
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String validation(ValidationOutcome outcome) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("valid", outcome.isValid());
    root.put("errors", issues(outcome.errors()));
    root.put("warnings", issues(outcome.warnings()));
    return gson.toJson(root);
  }

  String rewrite(RewriteResult result, Diagram diagram) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("applied", result.applied());
    root.put("outcome", result.outcome().name().toLowerCase(Locale.ROOT));
    root.put("messages", result.messages());
    root.put("expressions", DiagramExprs.render(diagram));
    root.put("node_count", diagram.nodeCount());
    root.put("edge_count", diagram.edgeCount());
    return gson.toJson(root);
  }

  String fixpoint(FixpointResult result, Diagram diagram) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("converged", result.converged());
    root.put("iterations", result.iterations());
    root.put("expressions", DiagramExprs.render(diagram));
    root.put("node_count", diagram.nodeCount());
    root.put("edge_count", diagram.edgeCount());
    return gson.toJson(root);
  }

  String stability(StabilityVerdict verdict, StabilityMetrics metrics) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("stable", verdict.stable());
    root.put("message", verdict.message());
    root.put("satisfied", verdict.satisfied());
    if (metrics != null) {
      root.put("metrics", metrics(metrics));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> metrics(StabilityMetrics metrics) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("admissible_volume", metrics.admissibleVolume());
    map.put("admissible_ratio", metrics.admissibleRatio());
    map.put("collapse_count", metrics.collapseCount());
    map.put("collapse_ratio", metrics.collapseRatio());
    map.put("coupling_count", metrics.couplingCount());
    map.put("gradient_coherence", metrics.gradientCoherence());
    map.put("transport_count", metrics.transportCount());
    map.put(
        "transport_fidelity",
        metrics.transportFidelity().isPresent() ? metrics.transportFidelity().getAsDouble() : null);
    map.put(
        "loop_gain", metrics.loopGain().isPresent() ? metrics.loopGain().getAsDouble() : null);
    return map;
  }

  private List<Map<String, Object>> issues(List<ValidationIssue> issues) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (ValidationIssue issue : issues) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("category", issue.category().wireName());
      entry.put("message", issue.message());
      if (!issue.context().isEmpty()) {
        entry.put("context", new LinkedHashMap<>(issue.context()));
      }
      list.add(entry);
    }
    return list;
  }
}
