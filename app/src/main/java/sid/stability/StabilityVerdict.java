package sid.stability;

import java.util.List;

/** Overall stability decision with the conditions that held. */
public record StabilityVerdict(boolean stable, List<String> satisfied, String message) {

  public StabilityVerdict {
    satisfied = List.copyOf(satisfied);
  }
}
