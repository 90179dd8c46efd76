package sid.crf;

import java.util.Locale;
import java.util.Optional;

/** Ways a conflict can be resolved. */
public enum ResolutionStrategy {
  /** Relax a soft constraint. */
  ATTENUATE,
  /** Postpone to a later compartment. */
  DEFER,
  /** Split conflicting elements apart. */
  PARTITION,
  /** Hand the conflict to a wider scope. */
  ESCALATE,
  /** Explore every admissible choice. */
  BIFURCATE,
  /** Stop; the only strategy that reports failure. */
  HALT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ResolutionStrategy> fromName(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    for (ResolutionStrategy strategy : values()) {
      if (strategy.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(strategy);
      }
    }
    return Optional.empty();
  }
}
