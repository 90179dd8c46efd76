package sid.field;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evolves an I/N/U processor triple under a fixed mass budget {@code C}. The mixer references
 * the processors it is handed but does not own them.
 */
public final class Mixer {
  private static final Logger LOG = LoggerFactory.getLogger(Mixer.class);
  private static final double GAIN_DENOMINATOR_FLOOR = 1e-12;

  private final double budget;
  private final MixerConfig config;
  private final double conservationTolerance;
  private final double deltaTolerance;

  private Double pendingCollapse;
  private boolean initialized;
  private double initialUndecided;
  private double previousI;
  private double previousU;
  private int stableCount;
  private MixerMetrics metrics = MixerMetrics.initial();

  public Mixer(double budget) {
    this(budget, MixerConfig.defaults());
  }

  public Mixer(double budget, MixerConfig config) {
    if (!(budget > 0.0)) {
      throw new IllegalArgumentException("Mixer budget must be positive: " + budget);
    }
    this.budget = budget;
    this.config = MixerConfig.normalize(config);
    double scale = Math.max(budget, 1.0);
    this.conservationTolerance = this.config.epsConservation() * scale;
    this.deltaTolerance = this.config.epsDelta() * scale;
  }

  public double budget() {
    return budget;
  }

  public MixerConfig config() {
    return config;
  }

  public double conservationTolerance() {
    return conservationTolerance;
  }

  public MixerMetrics metrics() {
    return metrics;
  }

  /** Asks the next {@link #step} to move {@code epsilon} of U mass into I and N. */
  public void requestCollapse(double epsilon) {
    if (!(epsilon >= 0.0)) {
      throw new IllegalArgumentException("collapse epsilon must be non-negative: " + epsilon);
    }
    pendingCollapse = epsilon;
  }

  public boolean hasPendingCollapse() {
    return pendingCollapse != null;
  }

  /**
   * One redistribution pass: pending collapse, intra-field diffusion, then budget correction.
   *
   * @throws ConservationViolationException if the total drifts beyond tolerance or restoring it
   *     would scale U beyond {@link MixerConfig#maxScaleFactor()}
   */
  public MixerMetrics step(
      SemanticProcessor informed, SemanticProcessor neutral, SemanticProcessor undecided) {
    requireRoles(informed, neutral, undecided);
    int length = undecided.length();
    if (informed.length() != length || neutral.length() != length) {
      throw new IllegalArgumentException(
          "Mixer field length mismatch: I=" + informed.length() + " N=" + neutral.length()
              + " U=" + length);
    }
    if (length == 0) {
      throw new IllegalArgumentException("Mixer requires non-empty fields");
    }

    boolean refused = false;
    double collapsed = 0.0;
    if (pendingCollapse != null) {
      double epsilon = pendingCollapse;
      pendingCollapse = null;
      double available = undecided.totalMass();
      if (available >= epsilon) {
        collapsed = collapse(informed, neutral, undecided, epsilon);
      } else {
        refused = true;
        LOG.warn("Collapse of {} refused: only {} undecided mass available", epsilon, available);
      }
    }

    if (config.diffusionRate() > 0.0) {
      informed.diffuse(config.diffusionRate());
      neutral.diffuse(config.diffusionRate());
      undecided.diffuse(config.diffusionRate());
    }

    double i = informed.totalMass();
    double n = neutral.totalMass();
    double totalBefore = i + n + undecided.totalMass();
    correctDrift(undecided, totalBefore);

    double u = undecided.totalMass();
    double total = i + n + u;
    double error = Math.abs(total - budget);
    if (error > conservationTolerance) {
      throw new ConservationViolationException(
          "Conservation violation: before_total=" + totalBefore + " after_total=" + total
              + " target=" + budget);
    }
    metrics = observe(i, n, u, error, refused, collapsed);
    return metrics;
  }

  private double collapse(
      SemanticProcessor informed,
      SemanticProcessor neutral,
      SemanticProcessor undecided,
      double epsilon) {
    double[] withdrawn = undecided.withdrawProportionally(epsilon);
    double share = config.admissibleShare();
    double moved = 0.0;
    for (int idx = 0; idx < withdrawn.length; idx++) {
      double toInformed = withdrawn[idx] * share;
      informed.deposit(idx, toInformed);
      neutral.deposit(idx, withdrawn[idx] - toInformed);
      moved += withdrawn[idx];
    }
    LOG.debug("Collapsed {} undecided mass (share to I: {})", moved, share);
    return moved;
  }

  private void correctDrift(SemanticProcessor undecided, double totalBefore) {
    double u = undecided.totalMass();
    if (totalBefore > budget && u > 0.0) {
      undecided.withdrawProportionally(Math.min(totalBefore - budget, u));
    } else if (totalBefore < budget) {
      double deficit = budget - totalBefore;
      if (u > 0.0) {
        double scale = 1.0 + deficit / u;
        if (scale > config.maxScaleFactor()) {
          throw new ConservationViolationException(
              "Mixer scale factor exceeded cap: scale="
                  + scale
                  + " cap="
                  + config.maxScaleFactor());
        }
        undecided.scaleAll(scale);
      } else {
        undecided.addUniform(deficit / undecided.length());
      }
    }
  }

  private MixerMetrics observe(
      double i, double n, double u, double error, boolean refused, double collapsed) {
    if (!initialized) {
      initialized = true;
      initialUndecided = u;
      previousI = i;
      previousU = u;
      stableCount = 0;
      return new MixerMetrics(0.0, i, n, u, 0.0, error, false, refused, collapsed);
    }
    double collapseRatio =
        initialUndecided > 0.0 ? Math.max(initialUndecided - u, 0.0) / initialUndecided : 0.0;
    double deltaI = i - previousI;
    double deltaU = previousU - u;
    double instantGain = deltaI / Math.max(Math.abs(deltaU), GAIN_DENOMINATOR_FLOOR);
    double loopGain =
        (1.0 - config.emaAlpha()) * metrics.loopGain() + config.emaAlpha() * instantGain;
    boolean stable =
        error <= conservationTolerance
            && Math.abs(deltaI) <= deltaTolerance
            && Math.abs(u - previousU) <= deltaTolerance;
    stableCount = stable ? stableCount + 1 : 0;
    previousI = i;
    previousU = u;
    return new MixerMetrics(
        loopGain,
        i,
        n,
        u,
        collapseRatio,
        error,
        stableCount >= config.stableSteps(),
        refused,
        collapsed);
  }

  private static void requireRoles(
      SemanticProcessor informed, SemanticProcessor neutral, SemanticProcessor undecided) {
    Objects.requireNonNull(informed, "informed");
    Objects.requireNonNull(neutral, "neutral");
    Objects.requireNonNull(undecided, "undecided");
    if (informed.role() != Role.I || neutral.role() != Role.N || undecided.role() != Role.U) {
      throw new IllegalArgumentException(
          "Mixer role mismatch: expected I/N/U, got " + informed.role() + "/" + neutral.role()
              + "/" + undecided.role());
    }
  }
}
