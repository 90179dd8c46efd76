package sid.field;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class SemanticProcessorTest {
  private static final double EPS = 1e-9;

  @Test
  void massIsSpreadUniformly() {
    SemanticProcessor processor = new SemanticProcessor(Role.I, 4, 100.0);

    assertEquals(4, processor.length(), "Length");
    assertEquals(25.0, processor.get(2), EPS, "Uniform entry");
    assertEquals(100.0, processor.totalMass(), EPS, "Total mass");
  }

  @Test
  void nonFiniteOrNegativeBudgetIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SemanticProcessor(Role.I, 4, Double.NaN),
        "NaN budget");
    assertThrows(
        IllegalArgumentException.class,
        () -> new SemanticProcessor(Role.I, 4, Double.POSITIVE_INFINITY),
        "Unbounded budget");
    assertThrows(
        IllegalArgumentException.class, () -> new SemanticProcessor(Role.I, 4, -1.0), "Negative");
  }

  @Test
  void addUniformGrowsTotalByAmountPerEntry() {
    SemanticProcessor processor = new SemanticProcessor(Role.N, 5, 10.0);

    processor.addUniform(1.5);

    assertEquals(3.5, processor.get(0), EPS, "Each entry raised");
    assertEquals(17.5, processor.totalMass(), EPS, "Grew by 1.5 * 5");
    assertThrows(IllegalArgumentException.class, () -> processor.addUniform(-0.1), "Negative");
    assertThrows(IllegalArgumentException.class, () -> processor.addUniform(Double.NaN), "NaN");
    assertEquals(17.5, processor.totalMass(), EPS, "Rejected calls change nothing");
  }

  @Test
  void scaleAllMultipliesEveryEntry() {
    SemanticProcessor informed = new SemanticProcessor(Role.I, 3, 30.0);
    SemanticProcessor undecided = new SemanticProcessor(Role.U, 3, 12.0);

    informed.scaleAll(0.5);
    undecided.scaleAll(2.0);

    assertEquals(5.0, informed.get(1), EPS, "Entry halved");
    assertEquals(15.0, informed.totalMass(), EPS, "Total halved");
    assertEquals(24.0, undecided.totalMass(), EPS, "Total doubled");
    assertThrows(IllegalArgumentException.class, () -> informed.scaleAll(-2.0), "Negative");
    assertEquals(15.0, informed.totalMass(), EPS, "Rejected call changes nothing");
  }

  @Test
  void routeToClampsMaskAndConservesMass() {
    SemanticProcessor source = new SemanticProcessor(Role.U, 2, 20.0);
    SemanticProcessor target = new SemanticProcessor(Role.I, 2, 0.0);

    double moved = source.routeTo(target, new double[] {2.0, -1.0}, 0.5);

    assertEquals(5.0, moved, EPS, "Mask above 1 acts as 1, negative as 0");
    assertEquals(5.0, source.get(0), EPS, "Half of the first entry left");
    assertEquals(10.0, source.get(1), EPS, "Second entry untouched");
    assertEquals(5.0, target.get(0), EPS, "Target received the routed mass");
    assertEquals(20.0, source.totalMass() + target.totalMass(), EPS, "Pairwise total kept");
  }

  @Test
  void routeToRejectsBadArguments() {
    SemanticProcessor source = new SemanticProcessor(Role.U, 2, 20.0);
    SemanticProcessor target = new SemanticProcessor(Role.I, 2, 0.0);

    assertThrows(
        IllegalArgumentException.class,
        () -> source.routeTo(target, new double[] {1.0}, 0.5),
        "Mask length mismatch");
    assertThrows(
        IllegalArgumentException.class,
        () -> source.routeTo(target, new double[] {1.0, 1.0}, 1.5),
        "Rate above 1");
    assertThrows(
        IllegalArgumentException.class,
        () -> source.routeTo(source, new double[] {1.0, 1.0}, 0.5),
        "Routing into itself");
  }

  @Test
  void collapseMaskRemovesWeightedUndecidedMass() {
    SemanticProcessor undecided = new SemanticProcessor(Role.U, 2, 20.0);
    CollapseMask mask = new CollapseMask(2);
    mask.set(0, 0.5, 0.25);

    double removed = undecided.applyCollapseMask(mask, 1.0);

    assertEquals(7.5, removed, EPS, "Three quarters of the first entry");
    assertEquals(2.5, undecided.get(0), EPS, "First entry remainder");
    assertEquals(10.0, undecided.get(1), EPS, "Unmasked entry untouched");
  }

  @Test
  void collapseMaskRequiresValidMaskAndUndecidedRole() {
    CollapseMask invalid = new CollapseMask(new double[] {0.8}, new double[] {0.5});
    SemanticProcessor undecided = new SemanticProcessor(Role.U, 1, 1.0);
    SemanticProcessor informed = new SemanticProcessor(Role.I, 1, 1.0);

    assertTrue(!invalid.isValid(), "Inclusion plus exclusion above 1");
    assertThrows(
        IllegalArgumentException.class,
        () -> undecided.applyCollapseMask(invalid, 0.5),
        "Invalid mask");
    assertThrows(
        IllegalStateException.class,
        () -> informed.applyCollapse(new double[] {1.0}, 0.5),
        "Collapse is only defined on U");
  }

  @Test
  void commitStepRecomputesMetrics() {
    SemanticProcessor processor = new SemanticProcessor(Role.N, 4, 50.0, 100.0);

    processor.commitStep();

    assertEquals(1, processor.step(), "Step counter advanced");
    assertEquals(0.5, processor.metrics().stability(), EPS, "Half the capacity is free");
    assertEquals(1.0, processor.metrics().coherence(), EPS, "Uniform field has no variance");
    assertEquals(0.0, processor.metrics().divergence(), EPS, "No neighbour differences");
  }
}
