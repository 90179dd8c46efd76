package sid.crf;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Named set of allowed degrees of freedom and allowed interaction pairs. */
public record Csi(String id, Set<String> allowedDofs, List<DofPair> allowedPairs) {

  public Csi {
    Objects.requireNonNull(id, "id");
    allowedDofs = allowedDofs == null ? Set.of() : new LinkedHashSet<>(allowedDofs);
    allowedPairs = allowedPairs == null ? List.of() : List.copyOf(allowedPairs);
  }

  public boolean allowsDof(String dof) {
    return allowedDofs.contains(dof);
  }

  /** With no declared pairs every pair is allowed. */
  public boolean allowsPair(String from, String to) {
    return allowedPairs.isEmpty() || allowedPairs.contains(new DofPair(from, to));
  }

  public boolean restrictsPairs() {
    return !allowedPairs.isEmpty();
  }
}
