package sid.model;

import java.util.List;

/**
 * Outcome of a structural check. Errors make a diagram unusable; warnings flag inconsistencies a
 * loader tolerates.
 */
public record ValidationReport(List<String> errors, List<String> warnings, boolean acyclic) {

  public ValidationReport {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
