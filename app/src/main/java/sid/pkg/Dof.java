package sid.pkg;

import java.util.Objects;

/** Declared degree of freedom. */
public record Dof(String id, String description) {

  public Dof {
    Objects.requireNonNull(id, "id");
  }
}
