package sid.pkg;

import java.util.Objects;

/** Named region that diagrams and states may be placed in. */
public record Compartment(String id, String name) {

  public Compartment {
    Objects.requireNonNull(id, "id");
  }
}
