package sid.ast;

/** Malformed expression text. Parsing never touches engine state, so callers may simply retry. */
public final class ParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int position;

  public ParseException(String message, int position) {
    super(message);
    this.position = position;
  }

  public int position() {
    return position;
  }
}
