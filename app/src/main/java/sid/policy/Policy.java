package sid.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/** Per-pass rule ordering. */
public enum Policy {
  /** Rules in input order. */
  P1,
  /** Rules in reverse input order. */
  P2,
  /** Seeded permutation; the same seed yields the same sequence of passes. */
  P3,
  /** Reserved; currently input order. */
  P4,
  /** Reserved; currently input order. */
  P5;

  /** Orders one pass; {@code random} is only consulted by {@link #P3}. */
  public <T> List<T> order(List<T> rules, Random random) {
    List<T> ordered = new ArrayList<>(rules);
    switch (this) {
      case P2 -> Collections.reverse(ordered);
      case P3 -> Collections.shuffle(ordered, random);
      case P1, P4, P5 -> {}
    }
    return ordered;
  }

  public static Policy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return P1;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown policy: " + raw);
    }
  }
}
