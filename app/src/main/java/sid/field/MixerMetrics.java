package sid.field;

/**
 * Observables emitted by each {@link Mixer#step}.
 *
 * @param loopGain smoothed I gain per unit of U depletion
 * @param admissibleVolume mass in I
 * @param excludedVolume mass in N
 * @param undecidedVolume mass in U
 * @param collapseRatio {@code (U0 - U) / U0} against the first observed U
 * @param conservationError {@code |I + N + U - C|}
 * @param transportReady stable for the configured number of consecutive steps
 * @param collapseRefused the pending collapse asked for more than U held
 * @param collapsedMass mass moved out of U by the last step's collapse
 */
public record MixerMetrics(
    double loopGain,
    double admissibleVolume,
    double excludedVolume,
    double undecidedVolume,
    double collapseRatio,
    double conservationError,
    boolean transportReady,
    boolean collapseRefused,
    double collapsedMass) {

  public static MixerMetrics initial() {
    return new MixerMetrics(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, false, false, 0.0);
  }

  public double total() {
    return admissibleVolume + excludedVolume + undecidedVolume;
  }
}
