package sid.field;

/** The I/N/U total left its budget, or restoring it would need an unbounded scale factor. */
public final class ConservationViolationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ConservationViolationException(String message) {
    super(message);
  }
}
