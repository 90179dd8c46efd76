package sid.crf;

import java.util.Map;

/** Admissibility of a labelled state: any {@code N} label makes it inadmissible. */
public final class Admissibility {
  private Admissibility() {}

  public static PredicateResult check(SidState state) {
    return check(state.labels());
  }

  public static PredicateResult check(Map<String, Label> labels) {
    int unresolved = 0;
    for (Map.Entry<String, Label> entry : labels.entrySet()) {
      if (entry.getValue() == Label.N) {
        return PredicateResult.fail("Element " + entry.getKey() + " is N (forbidden)");
      }
      if (entry.getValue() == Label.U) {
        unresolved++;
      }
    }
    if (unresolved > 0) {
      return PredicateResult.pass("Admissible with " + unresolved + " unresolved (U) elements");
    }
    return PredicateResult.pass("All elements admissible (I)");
  }
}
