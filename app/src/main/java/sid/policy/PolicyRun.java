package sid.policy;

import java.util.List;
import java.util.Objects;

/** Outcome of one scheduler run. */
public record PolicyRun(
    int steps, int rulesApplied, Termination termination, List<String> appliedTrace) {

  public PolicyRun {
    Objects.requireNonNull(termination, "termination");
    appliedTrace = List.copyOf(appliedTrace);
  }

  public boolean reachedFixedPoint() {
    return termination == Termination.FIXED_POINT;
  }
}
