package sid.engine;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.ParseException;
import sid.field.Mixer;
import sid.field.MixerMetrics;
import sid.field.Role;
import sid.field.SemanticProcessor;
import sid.io.DiagramJson;
import sid.model.Diagram;
import sid.model.DiagramBuilder;
import sid.policy.PolicyRequest;
import sid.policy.PolicyRun;
import sid.policy.PolicyScheduler;
import sid.policy.RuleGate;
import sid.rewrite.CompiledRule;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteResult;
import sid.rewrite.RewriteRule;

/**
 * One rewriting session: a diagram plus an I/N/U field triple evolved by a {@link Mixer}.
 *
 * <p>Rewrites and field steps are independent; both are observable through {@link #metrics()}.
 * Not thread-safe; callers serialize access per engine.
 */
public final class SidEngine {
  private static final Logger LOG = LoggerFactory.getLogger(SidEngine.class);

  public static final String DIAGRAM_ID = "sid_engine_diagram";

  private final EngineConfig config;
  private final SemanticProcessor informed;
  private final SemanticProcessor neutral;
  private final SemanticProcessor undecided;
  private final Mixer mixer;
  private final RewriteEngine rewriter = new RewriteEngine();
  private final PolicyScheduler scheduler;
  private Diagram diagram = new Diagram(DIAGRAM_ID);
  private long stepCount;

  public SidEngine() {
    this(EngineConfig.defaults());
  }

  public SidEngine(EngineConfig config) {
    this(config, RuleGate.OPEN);
  }

  public SidEngine(EngineConfig config, RuleGate gate) {
    this.config = EngineConfig.normalize(config);
    double share = this.config.totalMass() / 3.0;
    int cells = this.config.numNodes();
    this.informed = new SemanticProcessor(Role.I, cells, share, this.config.totalMass());
    this.neutral = new SemanticProcessor(Role.N, cells, share, this.config.totalMass());
    this.undecided = new SemanticProcessor(Role.U, cells, share, this.config.totalMass());
    this.mixer = new Mixer(this.config.totalMass(), this.config.mixer());
    this.scheduler = new PolicyScheduler(rewriter, gate);
  }

  public EngineConfig config() {
    return config;
  }

  public Diagram diagram() {
    return diagram;
  }

  public SemanticProcessor informed() {
    return informed;
  }

  public SemanticProcessor neutral() {
    return neutral;
  }

  public SemanticProcessor undecided() {
    return undecided;
  }

  public long stepCount() {
    return stepCount;
  }

  /** One mixer pass over the fields. */
  public MixerMetrics step() {
    MixerMetrics metrics = mixer.step(informed, neutral, undecided);
    informed.commitStep();
    neutral.commitStep();
    undecided.commitStep();
    stepCount++;
    return metrics;
  }

  /** Collapses {@code alpha} (clamped to [0, 1]) of the current U mass on the next step. */
  public MixerMetrics collapse(double alpha) {
    double clamped = Double.isNaN(alpha) ? 0.0 : Math.max(0.0, Math.min(1.0, alpha));
    mixer.requestCollapse(clamped * undecided.totalMass());
    return step();
  }

  public RewriteResult applyRewrite(String pattern, String replacement, String ruleId) {
    return applyRewrite(RewriteRule.of(ruleId, pattern, replacement));
  }

  /** Parse failures come back as a rejected result; the diagram is untouched. */
  public RewriteResult applyRewrite(RewriteRule rule) {
    CompiledRule compiled;
    try {
      compiled = rule.compile();
    } catch (ParseException ex) {
      LOG.warn("Rewrite {} rejected: {}", rule.id(), ex.getMessage());
      return RewriteResult.rejected(
          "Rewrite " + rule.id() + " rejected: parse error: " + ex.getMessage());
    }
    return rewriter.apply(diagram, compiled);
  }

  /** Replaces the diagram with one built from {@code expr}. */
  public void setDiagramExpr(String expr) throws ParseException {
    diagram = DiagramBuilder.fromText(expr, DIAGRAM_ID);
  }

  /**
   * Replaces the diagram with a validated JSON diagram. On failure the current diagram is kept.
   *
   * @throws sid.model.StructuralException for malformed, dangling or cyclic input
   */
  public void setDiagramJson(String json) {
    diagram = DiagramJson.parse(json);
  }

  public void setDiagram(Diagram replacement) {
    diagram = Objects.requireNonNull(replacement, "replacement");
  }

  public String diagramJson() {
    return DiagramJson.toJson(diagram);
  }

  public boolean isConserved(double tolerance) {
    return conservationError() <= tolerance;
  }

  public double conservationError() {
    double total = informed.totalMass() + neutral.totalMass() + undecided.totalMass();
    return Math.abs(total - config.totalMass());
  }

  public EngineMetrics metrics() {
    double error = conservationError();
    return new EngineMetrics(
        informed.totalMass(),
        neutral.totalMass(),
        undecided.totalMass(),
        diagram.nodeCount(),
        config.totalMass(),
        error,
        error <= mixer.conservationTolerance(),
        mixer.metrics().loopGain(),
        stepCount);
  }

  public PolicyRunResult runPolicy(PolicyRequest request) {
    PolicyRun run = scheduler.run(diagram, request);
    return new PolicyRunResult(run, metrics());
  }
}
