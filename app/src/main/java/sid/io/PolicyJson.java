package sid.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.util.Optional;
import sid.ast.ParseException;
import sid.engine.EngineMetrics;
import sid.engine.PolicyRunResult;
import sid.model.Diagram;
import sid.model.DiagramBuilder;
import sid.policy.Policy;
import sid.policy.PolicyRequest;
import sid.policy.PolicyRun;

/**
 * Policy run request and response shapes.
 *
 * <pre>
 * in:  { rules, policy, horizon_cap, seed, diagram_expr? | diagram? }
 * out: { steps, rules_applied, termination, applied_trace,
 *        metrics: { I_mass, N_mass, U_mass, active_nodes, total_mass } }
 * </pre>
 */
public final class PolicyJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
  private static final String REQUEST_DIAGRAM_ID = "policy_diagram";

  private PolicyJson() {}

  public static PolicyRequest readRequest(JsonObject obj) {
    return new PolicyRequest(
        RuleJson.readAll(JsonFields.objects(obj, "rules")),
        Policy.parse(JsonFields.string(obj, "policy")),
        JsonFields.integer(obj, "horizon_cap", PolicyRequest.DEFAULT_HORIZON_CAP),
        JsonFields.longValue(obj, "seed", 0L));
  }

  /** Diagram carried by the request; {@code diagram_expr} text wins over a {@code diagram}. */
  public static Optional<Diagram> readDiagram(JsonObject obj) throws ParseException {
    String expr = JsonFields.string(obj, "diagram_expr");
    if (expr != null && !expr.isBlank()) {
      return Optional.of(DiagramBuilder.fromText(expr, REQUEST_DIAGRAM_ID));
    }
    JsonObject diagram = JsonFields.object(obj, "diagram");
    if (diagram == null) {
      return Optional.empty();
    }
    return Optional.of(DiagramJson.parse(diagram.toString()));
  }

  public static JsonObject toJsonObject(PolicyRunResult result) {
    PolicyRun run = result.run();
    JsonObject obj = new JsonObject();
    obj.addProperty("steps", run.steps());
    obj.addProperty("rules_applied", run.rulesApplied());
    obj.addProperty("termination", run.termination().wireName());
    obj.add("applied_trace", JsonFields.array(run.appliedTrace()));
    obj.add("metrics", metrics(result.metrics()));
    return obj;
  }

  public static JsonObject metrics(EngineMetrics metrics) {
    JsonObject obj = new JsonObject();
    obj.addProperty("I_mass", metrics.informedMass());
    obj.addProperty("N_mass", metrics.neutralMass());
    obj.addProperty("U_mass", metrics.undecidedMass());
    obj.addProperty("active_nodes", metrics.activeNodes());
    obj.addProperty("total_mass", metrics.totalMass());
    return obj;
  }

  public static String toJson(PolicyRunResult result) {
    return GSON.toJson(toJsonObject(result));
  }
}
