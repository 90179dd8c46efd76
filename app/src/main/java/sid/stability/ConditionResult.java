package sid.stability;

/** Outcome of one termination condition. */
public record ConditionResult(boolean satisfied, String message) {

  static ConditionResult met(String message) {
    return new ConditionResult(true, message);
  }

  static ConditionResult unmet(String message) {
    return new ConditionResult(false, message);
  }
}
