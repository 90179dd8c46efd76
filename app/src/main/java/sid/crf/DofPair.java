package sid.crf;

import java.util.Objects;

/** Ordered pair of degrees of freedom that may interact across an edge. */
public record DofPair(String from, String to) {

  public DofPair {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
