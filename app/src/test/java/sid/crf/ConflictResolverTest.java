package sid.crf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import sid.model.Diagram;

final class ConflictResolverTest {
  private final ConflictResolver resolver = new ConflictResolver();
  private final Diagram diagram = new Diagram("d1");

  @Test
  void eachConflictTypeMapsToItsStrategy() {
    assertEquals(ResolutionStrategy.HALT, ConflictType.HARD_VIOLATION.strategy(), "hard");
    assertEquals(ResolutionStrategy.BIFURCATE, ConflictType.AMBIGUOUS_CHOICE.strategy(), "choice");
    assertEquals(ResolutionStrategy.ESCALATE, ConflictType.SCOPE_OVERFLOW.strategy(), "scope");
    assertEquals(ResolutionStrategy.PARTITION, ConflictType.DOF_INTERFERENCE.strategy(), "dof");
    assertEquals(ResolutionStrategy.DEFER, ConflictType.TEMPORAL_MISMATCH.strategy(), "time");
    assertEquals(ResolutionStrategy.ATTENUATE, ConflictType.SOFT_VIOLATION.strategy(), "soft");
  }

  @Test
  void partitionRecordsElements() {
    SidState state = new SidState("s1", null, null, null);

    ConflictResolution resolution =
        resolver.resolve(
            "dof_interference", Conflict.dofInterference(List.of("n1", "n2")), state, diagram);

    assertTrue(resolution.success(), "Partition succeeds");
    assertEquals("partition", resolution.actionName(), "Action");
    assertEquals(List.of("n1", "n2"), state.partitionedElements(), "Elements recorded");
    assertEquals(
        "Partitioned 2 conflicting elements into separate compartments",
        resolution.message(),
        "Message");
  }

  @Test
  void bifurcateRecordsChoices() {
    SidState state = new SidState("s1", null, null, null);

    ConflictResolution resolution =
        resolver.resolve(
            "ambiguous_choice", Conflict.ambiguousChoice(List.of("left", "right")), state, diagram);

    assertTrue(state.bifurcated(), "State bifurcated");
    assertEquals(List.of("left", "right"), state.bifurcationChoices(), "Choices");
    assertEquals("Bifurcated state into 2 parallel branches", resolution.message(), "Message");
  }

  @Test
  void escalateAndDeferKeepTheConflict() {
    SidState state = new SidState("s1", null, null, null);

    ConflictResolution escalated =
        resolver.resolve("scope_overflow", Conflict.scopeOverflow("regional"), state, diagram);
    ConflictResolution deferred =
        resolver.resolve("temporal_mismatch", Conflict.temporalMismatch(), state, diagram);

    assertEquals("Escalated regional conflict to global scope", escalated.message(), "Escalate");
    assertEquals(1, state.escalatedConflicts().size(), "Escalated conflict kept");
    assertEquals(
        "Deferred conflict of type temporal_mismatch to next compartment",
        deferred.message(),
        "Defer");
    assertEquals(1, state.deferredConflicts().size(), "Deferred conflict kept");
  }

  @Test
  void hardViolationHalts() {
    SidState state = new SidState("s1", null, null, null);

    ConflictResolution resolution =
        resolver.resolve("hard_violation", Conflict.hardViolation("broken"), state, diagram);

    assertFalse(resolution.success(), "Halt reports failure");
    assertTrue(state.halted(), "State halted");
    assertEquals("broken", state.haltReason().orElse(""), "Reason");
  }

  @Test
  void unknownTypeOrStrategyHalts() {
    SidState byType = new SidState("s1", null, null, null);
    SidState byStrategy = new SidState("s2", null, null, null);

    ConflictResolution first =
        resolver.resolve("cosmic_ray", Conflict.temporalMismatch(), byType, diagram);
    ConflictResolution second =
        resolver.resolveWith("pray", Conflict.temporalMismatch(), byStrategy, diagram);

    assertFalse(first.success(), "Unknown type halts");
    assertEquals("Halted execution: Unknown conflict type: cosmic_ray", first.message(), "Type");
    assertFalse(second.success(), "Unknown strategy halts");
    assertTrue(byStrategy.halted(), "State halted");
  }

  @Test
  void explicitStrategyOverridesTheTypeDefault() {
    SidState state = new SidState("s1", null, null, null);

    ConflictResolution resolution =
        resolver.resolveWith(" ATTENUATE ", Conflict.softViolation("c9"), state, diagram);

    assertTrue(resolution.success(), "Attenuate succeeds");
    assertEquals(List.of("c9"), state.attenuatedConstraints(), "Attenuated id");
  }
}
