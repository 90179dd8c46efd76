package sid.crf;

import java.util.List;

/** A rewrite was denied by failed hard constraints or preconditions. */
public final class AuthorizationDeniedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<String> violatedConstraintIds;

  public AuthorizationDeniedException(String message, List<String> violatedConstraintIds) {
    super(message);
    this.violatedConstraintIds = List.copyOf(violatedConstraintIds);
  }

  public List<String> violatedConstraintIds() {
    return violatedConstraintIds;
  }
}
