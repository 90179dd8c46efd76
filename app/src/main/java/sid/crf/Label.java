package sid.crf;

import java.util.Locale;
import java.util.Optional;

/** Role label assigned to a diagram element. */
public enum Label {
  /** Admissible. */
  I,
  /** Excluded. */
  N,
  /** Unresolved. */
  U;

  public static Optional<Label> fromName(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "I" -> Optional.of(I);
      case "N" -> Optional.of(N);
      case "U" -> Optional.of(U);
      default -> Optional.empty();
    };
  }
}
