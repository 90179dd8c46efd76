package sid.rewrite;

import java.util.List;

/** Result of a single rewrite attempt; replaces any global "last message" state. */
public record RewriteResult(Outcome outcome, List<String> messages) {

  public RewriteResult {
    messages = List.copyOf(messages);
  }

  public enum Outcome {
    /** The diagram was rewritten. */
    APPLIED,
    /** The pattern matched nowhere. */
    NOT_APPLICABLE,
    /** A match was found but the rewrite was refused; the diagram is unchanged. */
    REJECTED
  }

  public static RewriteResult applied(String message) {
    return new RewriteResult(Outcome.APPLIED, List.of(message));
  }

  public static RewriteResult notApplicable(String message) {
    return new RewriteResult(Outcome.NOT_APPLICABLE, List.of(message));
  }

  public static RewriteResult rejected(String message) {
    return new RewriteResult(Outcome.REJECTED, List.of(message));
  }

  public boolean applied() {
    return outcome == Outcome.APPLIED;
  }

  public String message() {
    return messages.isEmpty() ? "" : messages.get(0);
  }
}
