package sid.crf;

import java.util.List;

/** Decision for one rewrite against a state's constraints. */
public record Authorization(
    boolean allowed,
    List<String> violatedConstraintIds,
    List<String> errors,
    List<String> warnings) {

  public Authorization {
    violatedConstraintIds = List.copyOf(violatedConstraintIds);
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  /** Returns this authorization when allowed, otherwise throws. */
  public Authorization orThrow() {
    if (!allowed) {
      throw new AuthorizationDeniedException(String.join("; ", errors), violatedConstraintIds);
    }
    return this;
  }
}
