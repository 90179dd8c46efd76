package sid.engine;

/** Snapshot of a session's field masses and diagram size. */
public record EngineMetrics(
    double informedMass,
    double neutralMass,
    double undecidedMass,
    int activeNodes,
    double totalMass,
    double conservationError,
    boolean conserved,
    double loopGain,
    long stepCount) {

  /** Sum of the three field masses. */
  public double currentTotal() {
    return informedMass + neutralMass + undecidedMass;
  }
}
