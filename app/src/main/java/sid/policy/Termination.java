package sid.policy;

/** Why a policy run stopped. */
public enum Termination {
  /** A full pass applied no rule. */
  FIXED_POINT("fixed_point"),
  /** The step horizon was reached; the diagram may still be reducible. */
  HORIZON("horizon");

  private final String wireName;

  Termination(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
