package sid.crf;

import java.util.List;

/**
 * Failed constraints split by severity. Unknown predicates only produce warnings.
 *
 * @param errors messages for failed hard constraints
 * @param warnings messages for failed soft constraints and unknown predicates
 * @param failedHard ids of failed hard constraints
 * @param failedSoft ids of failed soft constraints
 */
public record ConstraintEvaluation(
    List<String> errors, List<String> warnings, List<String> failedHard, List<String> failedSoft) {

  public ConstraintEvaluation {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    failedHard = List.copyOf(failedHard);
    failedSoft = List.copyOf(failedSoft);
  }

  public boolean hasHardFailure() {
    return !failedHard.isEmpty();
  }

  public boolean hasSoftFailure() {
    return !failedSoft.isEmpty();
  }
}
