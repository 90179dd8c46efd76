package sid.rewrite;

/** Outcome of repeated application; {@code converged} is false on rejection or iteration cap. */
public record FixpointResult(boolean converged, int iterations) {}
