package sid.pkg;

import java.util.Map;
import java.util.Objects;

/** One validation finding with the ids it concerns. */
public record ValidationIssue(
    IssueCategory category, Severity severity, String message, Map<String, String> context) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public ValidationIssue {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    context = (context == null || context.isEmpty()) ? Map.of() : Map.copyOf(context);
  }

  public static ValidationIssue error(
      IssueCategory category, String message, Map<String, String> context) {
    return new ValidationIssue(category, Severity.ERROR, message, context);
  }

  public static ValidationIssue warning(
      IssueCategory category, String message, Map<String, String> context) {
    return new ValidationIssue(category, Severity.WARNING, message, context);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return message;
  }
}
