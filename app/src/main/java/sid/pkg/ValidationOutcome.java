package sid.pkg;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Errors and warnings collected by {@link PackageValidator}. */
public record ValidationOutcome(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

  public ValidationOutcome {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public Set<IssueCategory> errorCategories() {
    Set<IssueCategory> categories = EnumSet.noneOf(IssueCategory.class);
    errors.forEach(issue -> categories.add(issue.category()));
    return categories;
  }

  public boolean hasError(IssueCategory category) {
    return errors.stream().anyMatch(issue -> issue.category() == category);
  }
}
