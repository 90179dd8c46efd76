package sid.crf;

import java.util.Objects;

/** Named predicate with a severity. */
public record Constraint(String id, String predicate, ConstraintType type) {

  public Constraint {
    Objects.requireNonNull(id, "id");
    type = type == null ? ConstraintType.HARD : type;
  }

  public static Constraint hard(String id, String predicate) {
    return new Constraint(id, predicate, ConstraintType.HARD);
  }

  public static Constraint soft(String id, String predicate) {
    return new Constraint(id, predicate, ConstraintType.SOFT);
  }

  public boolean isHard() {
    return type == ConstraintType.HARD;
  }
}
