package sid.field;

/**
 * Mixer tuning. Tolerances are relative: the mixer multiplies them by {@code max(C, 1)} for a
 * budget {@code C}.
 *
 * @param epsConservation allowed {@code |I + N + U - C|} after a step
 * @param epsDelta per-step change in I and U below which a step counts as stable
 * @param stableSteps consecutive stable steps before transport is ready
 * @param emaAlpha smoothing factor of the loop gain, in [0, 1]
 * @param diffusionRate neighbour flux rate within each field, in [0, 0.5]
 * @param admissibleShare share of collapsed U mass that goes to I; the rest goes to N
 * @param maxScaleFactor largest factor U may be scaled by to restore the budget
 */
public record MixerConfig(
    double epsConservation,
    double epsDelta,
    int stableSteps,
    double emaAlpha,
    double diffusionRate,
    double admissibleShare,
    double maxScaleFactor) {

  public static MixerConfig defaults() {
    return new MixerConfig(1e-6, 1e-6, 5, 0.1, 0.0, 0.5, 10.0);
  }

  public static MixerConfig normalize(MixerConfig config) {
    if (config == null) {
      return defaults();
    }
    MixerConfig defaults = defaults();
    double eps =
        config.epsConservation() > 0.0 ? config.epsConservation() : defaults.epsConservation();
    double epsDelta = config.epsDelta() > 0.0 ? config.epsDelta() : defaults.epsDelta();
    int stableSteps = config.stableSteps() > 0 ? config.stableSteps() : defaults.stableSteps();
    double emaAlpha = clamp(config.emaAlpha(), 0.0, 1.0);
    double diffusionRate = clamp(config.diffusionRate(), 0.0, 0.5);
    double admissibleShare = clamp(config.admissibleShare(), 0.0, 1.0);
    double maxScale =
        config.maxScaleFactor() >= 1.0 ? config.maxScaleFactor() : defaults.maxScaleFactor();
    return new MixerConfig(
        eps, epsDelta, stableSteps, emaAlpha, diffusionRate, admissibleShare, maxScale);
  }

  public MixerConfig withDiffusionRate(double rate) {
    return new MixerConfig(
        epsConservation, epsDelta, stableSteps, emaAlpha, rate, admissibleShare, maxScaleFactor);
  }

  private static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) {
      return min;
    }
    return Math.max(min, Math.min(max, value));
  }
}
