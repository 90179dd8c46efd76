package sid.field;

/**
 * Per-field diagnostics recomputed on {@link SemanticProcessor#commitStep()}.
 *
 * @param stability headroom {@code 1 - clamp(mass / capacity)}, in [0, 1]
 * @param coherence uniformity {@code 1 / (1 + variance)}, in (0, 1]
 * @param divergence mean absolute difference between neighbouring entries
 */
public record SemanticMetrics(double stability, double coherence, double divergence) {

  public static SemanticMetrics empty() {
    return new SemanticMetrics(0.0, 0.0, 0.0);
  }
}
