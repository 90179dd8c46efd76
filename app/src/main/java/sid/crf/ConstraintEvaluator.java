package sid.crf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import sid.model.Diagram;

/** Evaluates constraints against a state through a {@link PredicateRegistry}. */
public final class ConstraintEvaluator {
  private final PredicateRegistry registry;

  public ConstraintEvaluator(PredicateRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public PredicateRegistry registry() {
    return registry;
  }

  public ConstraintEvaluation evaluate(
      List<Constraint> constraints, SidState state, Diagram diagram, Csi csi) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    List<String> failedHard = new ArrayList<>();
    List<String> failedSoft = new ArrayList<>();
    for (Constraint constraint : constraints) {
      String name = constraint.predicate();
      if (name == null || name.isBlank()) {
        continue;
      }
      Optional<ConstraintPredicate> predicate = registry.find(name);
      if (predicate.isEmpty()) {
        warnings.add("Unknown predicate " + name);
        continue;
      }
      PredicateResult result = predicate.get().test(state, diagram, csi);
      if (result.ok()) {
        continue;
      }
      String message = constraint.id() + " failed: " + result.detail();
      if (constraint.isHard()) {
        errors.add(message);
        failedHard.add(constraint.id());
      } else {
        warnings.add(message);
        failedSoft.add(constraint.id());
      }
    }
    return new ConstraintEvaluation(errors, warnings, failedHard, failedSoft);
  }
}
