package sid.crf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.model.Diagram;
import sid.rewrite.RewriteRule;

/**
 * Decides whether a rewrite may run. Failed hard constraints deny; failed soft constraints are
 * resolved as {@code soft_violation} conflicts; rule preconditions are checked last.
 */
public final class Authorizer {
  private static final Logger LOG = LoggerFactory.getLogger(Authorizer.class);

  public static final String PRECONDITION_ADMISSIBLE = "admissible";
  public static final String PRECONDITION_NO_HARD_CONFLICT = "no_hard_conflict";

  private final ConstraintEvaluator evaluator;
  private final LabelAssigner labelAssigner;
  private final ConflictResolver resolver;

  public Authorizer() {
    this(new ConstraintEvaluator(PredicateRegistry.defaults()), new ConflictResolver());
  }

  public Authorizer(ConstraintEvaluator evaluator, ConflictResolver resolver) {
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    this.labelAssigner = new LabelAssigner(evaluator);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public LabelAssigner labelAssigner() {
    return labelAssigner;
  }

  public Authorization authorize(
      List<Constraint> constraints, SidState state, Diagram diagram, Csi csi, RewriteRule rule) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(csi, "csi");
    Objects.requireNonNull(rule, "rule");
    if (!state.hasLabels()) {
      state.setLabels(labelAssigner.assign(diagram, constraints, state, csi));
    }

    ConstraintEvaluation evaluation = evaluator.evaluate(constraints, state, diagram, csi);
    List<String> warnings = new ArrayList<>(evaluation.warnings());
    if (evaluation.hasHardFailure()) {
      LOG.info("Rewrite {} denied by {}", rule.id(), evaluation.failedHard());
      return new Authorization(false, evaluation.failedHard(), evaluation.errors(), warnings);
    }
    for (String softId : evaluation.failedSoft()) {
      ConflictResolution resolution =
          resolver.resolve(
              ConflictType.SOFT_VIOLATION.wireName(),
              Conflict.softViolation(softId),
              state,
              diagram);
      warnings.add(resolution.message());
    }

    for (String precondition : rule.preconditions()) {
      if (PRECONDITION_ADMISSIBLE.equals(precondition)) {
        PredicateResult admissible = Admissibility.check(state);
        if (!admissible.ok()) {
          String message = rule.id() + " precondition failed: " + admissible.detail();
          return new Authorization(false, List.of(precondition), List.of(message), warnings);
        }
      } else if (!PRECONDITION_NO_HARD_CONFLICT.equals(precondition)) {
        warnings.add("Rewrite " + rule.id() + " has unknown precondition " + precondition);
      }
    }
    return new Authorization(true, List.of(), List.of(), warnings);
  }
}
