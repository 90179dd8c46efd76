package sid.stability;

import java.util.OptionalDouble;

/**
 * Aggregate observables of one state and diagram.
 *
 * @param admissibleVolume elements labelled {@code I}
 * @param admissibleRatio {@code admissibleVolume} over all labelled elements, 0 when unlabelled
 * @param collapseCount {@code O} nodes
 * @param collapseRatio {@code O} nodes over all nodes
 * @param couplingCount {@code C} nodes
 * @param gradientCoherence {@code C} nodes over all nodes
 * @param transportCount {@code T} nodes
 * @param transportFidelity share of {@code T} nodes naming a target compartment; empty without
 *     transports
 * @param loopGain changed-label share between the last two history entries; empty with fewer
 *     than two
 */
public record StabilityMetrics(
    int admissibleVolume,
    double admissibleRatio,
    int collapseCount,
    double collapseRatio,
    int couplingCount,
    double gradientCoherence,
    int transportCount,
    OptionalDouble transportFidelity,
    OptionalDouble loopGain) {}
