package sid.model;

import java.util.Objects;

/**
 * Mints node and edge ids of the form {@code <scope>_n<k>} and {@code <scope>_e<k>} (or {@code
 * n<k>}/{@code e<k>} without a scope). Counters are monotonic and skip ids already present in the
 * target diagram.
 */
public final class IdGenerator {
  private final Diagram target;
  private final String nodePrefix;
  private final String edgePrefix;
  private int nextNode;
  private int nextEdge;

  private IdGenerator(Diagram target, String scope) {
    this.target = Objects.requireNonNull(target, "target");
    String base = scope == null || scope.isEmpty() ? "" : scope + "_";
    this.nodePrefix = base + "n";
    this.edgePrefix = base + "e";
  }

  public static IdGenerator scopedTo(Diagram target, String scope) {
    return new IdGenerator(target, scope);
  }

  public String nextNodeId() {
    String id;
    do {
      id = nodePrefix + nextNode++;
    } while (target.hasNode(id));
    return id;
  }

  public String nextEdgeId() {
    String id;
    do {
      id = edgePrefix + nextEdge++;
    } while (target.hasEdge(id));
    return id;
  }
}
