package sid.crf;

import java.util.Optional;

/** Conflict categories, most severe first, each with the strategy that handles it. */
public enum ConflictType {
  HARD_VIOLATION("hard_violation", ResolutionStrategy.HALT),
  AMBIGUOUS_CHOICE("ambiguous_choice", ResolutionStrategy.BIFURCATE),
  SCOPE_OVERFLOW("scope_overflow", ResolutionStrategy.ESCALATE),
  DOF_INTERFERENCE("dof_interference", ResolutionStrategy.PARTITION),
  TEMPORAL_MISMATCH("temporal_mismatch", ResolutionStrategy.DEFER),
  SOFT_VIOLATION("soft_violation", ResolutionStrategy.ATTENUATE);

  private final String wireName;
  private final ResolutionStrategy strategy;

  ConflictType(String wireName, ResolutionStrategy strategy) {
    this.wireName = wireName;
    this.strategy = strategy;
  }

  public String wireName() {
    return wireName;
  }

  public ResolutionStrategy strategy() {
    return strategy;
  }

  public static Optional<ConflictType> fromName(String raw) {
    for (ConflictType type : values()) {
      if (type.wireName.equals(raw)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
