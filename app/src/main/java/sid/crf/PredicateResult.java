package sid.crf;

/** Verdict of a {@link ConstraintPredicate} with a readable detail. */
public record PredicateResult(boolean ok, String detail) {

  public static PredicateResult pass(String detail) {
    return new PredicateResult(true, detail);
  }

  public static PredicateResult fail(String detail) {
    return new PredicateResult(false, detail);
  }
}
