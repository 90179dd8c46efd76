package sid.model;

import java.util.List;

/** Raised when a diagram would be exposed with dangling references or duplicate ids. */
public final class StructuralException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  public StructuralException(String message) {
    this(List.of(message));
  }

  public StructuralException(List<String> problems) {
    super(String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }
}
