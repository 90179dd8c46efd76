package sid.crf;

import java.util.List;

/**
 * Details handed to a resolution strategy. Fields not relevant to a given conflict are null or
 * empty.
 */
public record Conflict(
    String type,
    String constraintId,
    List<String> elements,
    String scope,
    List<String> choices,
    String reason) {

  public Conflict {
    elements = elements == null ? List.of() : List.copyOf(elements);
    choices = choices == null ? List.of() : List.copyOf(choices);
  }

  public static Conflict softViolation(String constraintId) {
    return new Conflict("soft_violation", constraintId, List.of(), null, List.of(), null);
  }

  public static Conflict hardViolation(String reason) {
    return new Conflict("hard_violation", null, List.of(), null, List.of(), reason);
  }

  public static Conflict dofInterference(List<String> elements) {
    return new Conflict("dof_interference", null, elements, null, List.of(), null);
  }

  public static Conflict scopeOverflow(String scope) {
    return new Conflict("scope_overflow", null, List.of(), scope, List.of(), null);
  }

  public static Conflict ambiguousChoice(List<String> choices) {
    return new Conflict("ambiguous_choice", null, List.of(), null, choices, null);
  }

  public static Conflict temporalMismatch() {
    return new Conflict("temporal_mismatch", null, List.of(), null, List.of(), null);
  }
}
