package sid.stability;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.OperatorKind;
import sid.ast.ParseException;
import sid.crf.Authorization;
import sid.crf.Authorizer;
import sid.crf.Constraint;
import sid.crf.Csi;
import sid.crf.Label;
import sid.crf.OperatorRules;
import sid.crf.SidState;
import sid.model.Diagram;
import sid.model.Node;
import sid.pkg.SidPackage;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteRule;

/**
 * Termination checks and metrics for a state under rewriting.
 *
 * <p>A process is structurally stable when no admissible rewrite remains, the admissible region
 * is invariant under transport, only identity rewrites are authorized, or the label loop has
 * converged. By default any one condition suffices.
 */
public final class StabilityAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(StabilityAnalyzer.class);

  public static final double DEFAULT_TOLERANCE = 1e-6;
  private static final int CONDITION_COUNT = 4;
  private static final String MISSING_INPUTS = "Missing state, diagram, or CSI";

  private final Authorizer authorizer;
  private final RewriteEngine engine;

  public StabilityAnalyzer() {
    this(new Authorizer(), new RewriteEngine());
  }

  public StabilityAnalyzer(Authorizer authorizer, RewriteEngine engine) {
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /** Metrics for the named state and diagram; empty when either is absent. */
  public Optional<StabilityMetrics> computeMetrics(
      SidPackage pkg, String stateId, String diagramId) {
    Optional<SidState> state = pkg.state(stateId);
    Optional<Diagram> diagram = pkg.diagram(diagramId);
    if (state.isEmpty() || diagram.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(computeMetrics(state.get(), diagram.get()));
  }

  public StabilityMetrics computeMetrics(SidState state, Diagram diagram) {
    Map<String, Label> labels = state.labels();
    int admissible = (int) labels.values().stream().filter(label -> label == Label.I).count();
    int nodes = diagram.nodeCount();
    int collapses = (int) diagram.countOp(OperatorKind.O);
    int couplings = (int) diagram.countOp(OperatorKind.C);
    int transports = 0;
    int targeted = 0;
    for (Node node : diagram.nodes()) {
      if (node.op() == OperatorKind.T) {
        transports++;
        if (OperatorRules.hasTransportTarget(node)) {
          targeted++;
        }
      }
    }
    List<Map<String, Label>> history = state.loopHistory();
    OptionalDouble loopGain =
        history.size() < 2
            ? OptionalDouble.empty()
            : OptionalDouble.of(
                changeRatio(history.get(history.size() - 2), history.get(history.size() - 1)));
    return new StabilityMetrics(
        admissible,
        ratio(admissible, labels.size()),
        collapses,
        ratio(collapses, nodes),
        couplings,
        ratio(couplings, nodes),
        transports,
        transports == 0 ? OptionalDouble.empty() : OptionalDouble.of(ratio(targeted, transports)),
        loopGain);
  }

  /** Compares the last two history entries; fewer than two never converge. */
  public ConditionResult checkLoopConvergence(SidState state, double tolerance) {
    List<Map<String, Label>> history = state.loopHistory();
    if (history.size() < 2) {
      return ConditionResult.unmet("Insufficient loop history for convergence check");
    }
    Map<String, Label> previous = history.get(history.size() - 2);
    Map<String, Label> current = history.get(history.size() - 1);
    if (previous.equals(current)) {
      return ConditionResult.met("Loop has fully converged (no changes)");
    }
    double ratio = changeRatio(previous, current);
    if (ratio <= tolerance) {
      return ConditionResult.met(
          String.format(Locale.ROOT, "Loop gain converged (change ratio: %.6f)", ratio));
    }
    return ConditionResult.unmet(
        String.format(Locale.ROOT, "Loop not converged (change ratio: %.6f)", ratio));
  }

  /** True when no rule is both authorized and applicable to the diagram. */
  public ConditionResult checkNoAdmissibleRewrites(
      SidPackage pkg, String stateId, String diagramId) {
    Optional<SidState> state = pkg.state(stateId);
    Optional<Diagram> diagram = pkg.diagram(diagramId);
    Optional<Csi> csi = state.flatMap(s -> pkg.csi(s.csiId()));
    if (state.isEmpty() || diagram.isEmpty() || csi.isEmpty()) {
      return ConditionResult.unmet(MISSING_INPUTS);
    }
    for (RewriteRule rule : pkg.rules()) {
      Authorization authorization =
          authorizer.authorize(pkg.constraints(), state.get(), diagram.get(), csi.get(), rule);
      if (authorization.allowed() && applicable(diagram.get(), rule)) {
        return ConditionResult.unmet("Rewrite " + rule.id() + " is still admissible");
      }
    }
    return ConditionResult.met("No admissible rewrites remain");
  }

  /**
   * Transport nodes must themselves be admissible, and every element the state held as {@code I}
   * must still be labelled {@code I}. New elements may appear freely.
   */
  public ConditionResult checkInvariantUnderTransport(
      Diagram diagram, SidState state, Csi csi, List<Constraint> constraints) {
    Map<String, Label> computed =
        authorizer.labelAssigner().assign(diagram, constraints, state, csi);
    boolean anyTransport = false;
    for (Node node : diagram.nodes()) {
      if (node.op() != OperatorKind.T) {
        continue;
      }
      anyTransport = true;
      if (computed.get(node.id()) != Label.I) {
        return ConditionResult.unmet(
            "Transport node " + node.id() + " is not in admissible region");
      }
    }
    if (!anyTransport) {
      return ConditionResult.met("No transport operations present");
    }
    for (Map.Entry<String, Label> entry : state.labels().entrySet()) {
      if (entry.getValue() == Label.I && computed.get(entry.getKey()) != Label.I) {
        return ConditionResult.unmet(
            "Previously admissible element " + entry.getKey() + " is no longer admissible");
      }
    }
    return ConditionResult.met("Admissible region invariant under transport");
  }

  /** Identity rewrites have a replacement text equal to their pattern text. */
  public ConditionResult checkOnlyIdentityRewrites(List<RewriteRule> rules) {
    for (RewriteRule rule : rules) {
      if (!Objects.equals(rule.pattern(), rule.replacement())) {
        return ConditionResult.unmet("Non-identity rewrite " + rule.id() + " present");
      }
    }
    return ConditionResult.met("Only identity rewrites authorized");
  }

  public StabilityVerdict isStructurallyStable(SidPackage pkg, String stateId, String diagramId) {
    return isStructurallyStable(pkg, stateId, diagramId, DEFAULT_TOLERANCE, false);
  }

  /**
   * Evaluates all four termination conditions.
   *
   * @param requireAll when true every condition must hold; otherwise any one suffices
   */
  public StabilityVerdict isStructurallyStable(
      SidPackage pkg, String stateId, String diagramId, double tolerance, boolean requireAll) {
    Optional<SidState> state = pkg.state(stateId);
    Optional<Diagram> diagram = pkg.diagram(diagramId);
    Optional<Csi> csi = state.flatMap(s -> pkg.csi(s.csiId()));
    if (state.isEmpty() || diagram.isEmpty() || csi.isEmpty()) {
      return new StabilityVerdict(false, List.of(), MISSING_INPUTS);
    }

    List<ConditionResult> results =
        List.of(
            checkNoAdmissibleRewrites(pkg, stateId, diagramId),
            checkInvariantUnderTransport(diagram.get(), state.get(), csi.get(), pkg.constraints()),
            checkOnlyIdentityRewrites(pkg.rules()),
            checkLoopConvergence(state.get(), tolerance));
    List<String> satisfied = new ArrayList<>();
    for (ConditionResult result : results) {
      if (result.satisfied()) {
        satisfied.add("[OK] " + result.message());
      }
    }

    boolean stable;
    String message;
    if (requireAll) {
      stable = satisfied.size() == CONDITION_COUNT;
      message =
          stable
              ? "System is STABLE (all " + CONDITION_COUNT + " conditions met)"
              : "System is NOT STABLE ("
                  + satisfied.size()
                  + "/"
                  + CONDITION_COUNT
                  + " conditions met, need all)";
    } else {
      stable = !satisfied.isEmpty();
      message =
          stable
              ? "System is STABLE (" + satisfied.size() + " condition(s) met)"
              : "System is NOT STABLE (no termination conditions met)";
    }
    LOG.info("Stability check for {}: {}", stateId, message);
    return new StabilityVerdict(stable, satisfied, message);
  }

  /** Share of keys, over the union of both maps, whose labels differ. */
  static double changeRatio(Map<String, Label> previous, Map<String, Label> current) {
    Set<String> keys = new HashSet<>(previous.keySet());
    keys.addAll(current.keySet());
    if (keys.isEmpty()) {
      return 0.0;
    }
    int changes = 0;
    for (String key : keys) {
      if (previous.get(key) != current.get(key)) {
        changes++;
      }
    }
    return (double) changes / keys.size();
  }

  private boolean applicable(Diagram diagram, RewriteRule rule) {
    try {
      return engine.isApplicable(diagram, rule.compile());
    } catch (ParseException ex) {
      LOG.debug("Rule {} does not parse: {}", rule.id(), ex.getMessage());
      return false;
    }
  }

  private static double ratio(int part, int whole) {
    return whole == 0 ? 0.0 : (double) part / whole;
  }
}
