package sid.crf;

import sid.model.Diagram;

/** Named check over a state, its diagram and its CSI. */
@FunctionalInterface
public interface ConstraintPredicate {
  PredicateResult test(SidState state, Diagram diagram, Csi csi);
}
