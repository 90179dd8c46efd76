package sid.rewrite;

/**
 * What a pattern variable matched: a diagram node, or a dof name folded into an input-less
 * operator node.
 */
public record BoundTerm(String nodeId, String dof) {

  public BoundTerm {
    if ((nodeId == null) == (dof == null)) {
      throw new IllegalArgumentException("exactly one of nodeId and dof must be set");
    }
  }

  public static BoundTerm node(String nodeId) {
    return new BoundTerm(nodeId, null);
  }

  public static BoundTerm dof(String dof) {
    return new BoundTerm(null, dof);
  }

  public boolean isNode() {
    return nodeId != null;
  }
}
