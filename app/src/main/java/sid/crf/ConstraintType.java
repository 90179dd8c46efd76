package sid.crf;

import java.util.Locale;

/** Hard constraints deny a rewrite; soft constraints are resolved as conflicts. */
public enum ConstraintType {
  HARD,
  SOFT;

  /** Anything other than {@code soft} is treated as hard. */
  public static ConstraintType parse(String raw) {
    if (raw != null && "soft".equals(raw.trim().toLowerCase(Locale.ROOT))) {
      return SOFT;
    }
    return HARD;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
