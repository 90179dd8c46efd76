package sid.pkg;

import java.util.Locale;

/** Structured reasons a package fails validation. */
public enum IssueCategory {
  MISSING_ID,
  DUPLICATE_ID,
  MISSING_REFERENCE,
  UNKNOWN_OPERATOR,
  CYCLIC_DIAGRAM,
  COLLAPSE_NOT_IRREVERSIBLE,
  DOF_OUTSIDE_CSI,
  CSI_PAIR_VIOLATION,
  INVALID_CSI_PAIR,
  INVALID_CSI_PAIR_DOF,
  INVALID_REWRITE_RULE,
  INVALID_REWRITE_EXPR,
  CONSTRAINT_VIOLATION,
  CONSTRAINT_WARNING;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
