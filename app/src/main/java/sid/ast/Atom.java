package sid.ast;

import java.util.Objects;

/** Leaf expression. Names starting with {@code $} are pattern variables, all others literals. */
public record Atom(String name) implements Expr {

  public Atom {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("atom name must not be empty");
    }
  }

  /** Purely lexical test; literal atoms are case-sensitive and never variables. */
  public boolean isVariable() {
    return name.startsWith(VARIABLE_SIGIL) && name.length() > VARIABLE_SIGIL.length();
  }

  @Override
  public String render() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
