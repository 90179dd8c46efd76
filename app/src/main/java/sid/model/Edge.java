package sid.model;

import java.util.Objects;

/**
 * Directed edge {@code from -> to}. The source node is an argument of the target; {@code port}
 * orders the arguments of a target.
 *
 * <p>{@code port} and {@code toPort} are nullable so that loaded diagrams keep exactly the fields
 * they were written with.
 */
public record Edge(String id, String from, String to, String label, Integer port, Integer toPort) {

  public static final String DEFAULT_LABEL = "arg";

  public Edge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    label = label == null ? DEFAULT_LABEL : label;
  }

  public static Edge arg(String id, String from, String to, int port) {
    return new Edge(id, from, to, DEFAULT_LABEL, port, null);
  }

  public int portOrZero() {
    return port == null ? 0 : port;
  }

  Edge withFrom(String newFrom) {
    return new Edge(id, newFrom, to, label, port, toPort);
  }
}
