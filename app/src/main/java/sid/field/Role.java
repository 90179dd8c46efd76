package sid.field;

/** Ternary role of a semantic field. */
public enum Role {
  /** Informed: admitted mass. */
  I,
  /** Neutral: excluded mass. */
  N,
  /** Unresolved: mass still undecided. */
  U
}
