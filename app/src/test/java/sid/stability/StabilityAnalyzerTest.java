package sid.stability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sid.ast.OperatorKind;
import sid.crf.Csi;
import sid.crf.Label;
import sid.crf.OperatorRules;
import sid.crf.SidState;
import sid.model.Diagram;
import sid.model.Node;
import sid.pkg.PackageLoader;
import sid.pkg.SidPackage;
import sid.rewrite.RewriteRule;
import sid.testing.Fixtures;

final class StabilityAnalyzerTest {
  private static final double EPS = 1e-12;

  private final StabilityAnalyzer analyzer = new StabilityAnalyzer();

  @Test
  void identityRulesOnlyWhenPatternEqualsReplacement() {
    SidPackage identity =
        PackageLoader.parse(
            """
            {"rewrite_rules": [
              {"id": "r1", "pattern": "P(x)", "replacement": "P(x)"},
              {"id": "r2", "pattern_expr": "O(y)", "replacement_expr": "O(y)"}
            ]}
            """);
    List<RewriteRule> mixed =
        List.of(RewriteRule.of("r1", "P(x)", "P(x)"), RewriteRule.of("r2", "P(x)", "O(x)"));

    assertTrue(analyzer.checkOnlyIdentityRewrites(identity.rules()).satisfied(), "All identity");
    ConditionResult result = analyzer.checkOnlyIdentityRewrites(mixed);
    assertFalse(result.satisfied(), "r2 changes the diagram");
    assertTrue(result.message().contains("r2"), result.message());
  }

  @Test
  void loopConvergenceNeedsTwoSnapshots() {
    SidState state = new SidState("s", null, null, null);

    ConditionResult result =
        analyzer.checkLoopConvergence(state, StabilityAnalyzer.DEFAULT_TOLERANCE);

    assertFalse(result.satisfied(), "Empty history");
    assertEquals(
        "Insufficient loop history for convergence check", result.message(), "Message");
  }

  @Test
  void identicalSnapshotsHaveFullyConverged() {
    SidState state =
        stateWithHistory(
            Map.of("n1", Label.I, "n2", Label.I), Map.of("n1", Label.I, "n2", Label.I));

    ConditionResult result =
        analyzer.checkLoopConvergence(state, StabilityAnalyzer.DEFAULT_TOLERANCE);

    assertTrue(result.satisfied(), "No change between snapshots");
    assertTrue(result.message().contains("fully converged"), result.message());
  }

  @Test
  void changeRatioIsComparedAgainstTolerance() {
    SidState diverging =
        stateWithHistory(
            Map.of("n1", Label.I, "n2", Label.I, "n3", Label.I),
            Map.of("n1", Label.I, "n2", Label.N, "n3", Label.U));
    SidState settling =
        stateWithHistory(
            Map.of("n1", Label.I, "n2", Label.I, "n3", Label.I, "n4", Label.I, "n5", Label.I),
            Map.of("n1", Label.I, "n2", Label.I, "n3", Label.I, "n4", Label.I, "n5", Label.U));

    assertFalse(analyzer.checkLoopConvergence(diverging, 0.1).satisfied(), "2/3 changed");
    ConditionResult settled = analyzer.checkLoopConvergence(settling, 0.3);
    assertTrue(settled.satisfied(), "1/5 changed");
    assertEquals("Loop gain converged (change ratio: 0.200000)", settled.message(), "Message");
  }

  @Test
  void metricsCountOperatorsAndHistoryChanges() {
    SidPackage pkg =
        PackageLoader.parse(
            """
            {
              "states": [{
                "id": "s1",
                "inu_labels": {"n1": "I", "n2": "I", "n3": "U", "e1": "I"},
                "loop_history": [
                  {"inu_labels": {"n1": "I", "n2": "I", "n3": "U", "e1": "I"}},
                  {"inu_labels": {"n1": "I", "n2": "I", "n3": "I", "e1": "I"}}
                ]
              }],
              "diagrams": [{
                "id": "d1",
                "nodes": [
                  {"id": "n1", "op": "P"}, {"id": "n2", "op": "O"}, {"id": "n3", "op": "C"}],
                "edges": [{"id": "e1", "from": "n1", "to": "n2"}]
              }]
            }
            """);

    StabilityMetrics metrics = analyzer.computeMetrics(pkg, "s1", "d1").orElseThrow();

    assertEquals(3, metrics.admissibleVolume(), "Three I labels");
    assertEquals(0.75, metrics.admissibleRatio(), EPS, "Three of four labels");
    assertEquals(1, metrics.collapseCount(), "One O node");
    assertEquals(1, metrics.couplingCount(), "One C node");
    assertEquals(1.0 / 3, metrics.collapseRatio(), EPS, "One of three nodes");
    assertEquals(1.0 / 3, metrics.gradientCoherence(), EPS, "One coupling of three nodes");
    assertTrue(metrics.transportFidelity().isEmpty(), "No transport nodes");
    assertEquals(0.25, metrics.loopGain().orElseThrow(), EPS, "One of four labels changed");
  }

  @Test
  void collapseRatioAndTransportFidelity() {
    SidPackage pkg =
        PackageLoader.parse(
            """
            {
              "states": [{"id": "s1", "inu_labels": {}}],
              "diagrams": [
                {"id": "collapses", "nodes": [
                  {"id": "n1", "op": "P"}, {"id": "n2", "op": "O"},
                  {"id": "n3", "op": "O"}, {"id": "n4", "op": "C"}]},
                {"id": "transports", "nodes": [
                  {"id": "n1", "op": "T", "meta": {"target_compartment": "c2"}},
                  {"id": "n2", "op": "T", "meta": {"target_compartment": "c3"}},
                  {"id": "n3", "op": "T", "meta": {}},
                  {"id": "n4", "op": "P"}]}
              ]
            }
            """);

    StabilityMetrics collapses = analyzer.computeMetrics(pkg, "s1", "collapses").orElseThrow();
    StabilityMetrics transports = analyzer.computeMetrics(pkg, "s1", "transports").orElseThrow();

    assertEquals(2, collapses.collapseCount(), "Two O nodes");
    assertEquals(0.5, collapses.collapseRatio(), EPS, "Two of four nodes");
    assertEquals(0.0, collapses.admissibleRatio(), EPS, "No labels");
    assertTrue(collapses.loopGain().isEmpty(), "No history");
    assertEquals(3, transports.transportCount(), "Three T nodes");
    assertEquals(2.0 / 3, transports.transportFidelity().orElseThrow(), EPS, "Two have targets");
    assertTrue(analyzer.computeMetrics(pkg, "s1", "absent").isEmpty(), "Unknown diagram");
  }

  @Test
  void minimalPackageIsStable() {
    SidPackage pkg =
        PackageLoader.parse(
            """
            {
              "states": [{
                "id": "s1", "diagram_id": "d1", "csi_id": "csi1",
                "inu_labels": {"n1": "I"},
                "loop_history": [{"inu_labels": {"n1": "I"}}, {"inu_labels": {"n1": "I"}}]
              }],
              "diagrams": [{"id": "d1", "nodes": [{"id": "n1", "op": "P"}], "edges": []}],
              "csis": [{"id": "csi1", "allowed_dofs": ["Freedom"], "allowed_pairs": []}],
              "constraints": [],
              "rewrite_rules": []
            }
            """);

    StabilityVerdict anyOf = analyzer.isStructurallyStable(pkg, "s1", "d1");
    StabilityVerdict allOf =
        analyzer.isStructurallyStable(pkg, "s1", "d1", StabilityAnalyzer.DEFAULT_TOLERANCE, true);

    assertTrue(anyOf.stable(), anyOf.message());
    assertFalse(anyOf.satisfied().isEmpty(), "Some condition satisfied");
    assertTrue(anyOf.message().contains("STABLE"), anyOf.message());
    assertTrue(anyOf.satisfied().get(0).startsWith("[OK] "), "Satisfied entries are tagged");
    assertTrue(allOf.stable(), allOf.message());
    assertEquals("System is STABLE (all 4 conditions met)", allOf.message(), "All four hold");
  }

  @Test
  void applicableAuthorizedRuleBlocksStability() {
    SidPackage pkg = PackageLoader.load(Fixtures.validPackage());

    ConditionResult rewrites = analyzer.checkNoAdmissibleRewrites(pkg, "s1", "d1");
    StabilityVerdict strict =
        analyzer.isStructurallyStable(pkg, "s1", "d1", StabilityAnalyzer.DEFAULT_TOLERANCE, true);

    assertFalse(rewrites.satisfied(), "r1 still matches the projection");
    assertEquals("Rewrite r1 is still admissible", rewrites.message(), "Message");
    assertFalse(strict.stable(), strict.message());
    assertTrue(strict.message().endsWith("conditions met, need all)"), strict.message());
  }

  @Test
  void missingReferencesAreNeverStable() {
    SidPackage pkg = PackageLoader.load(Fixtures.validPackage());

    StabilityVerdict verdict = analyzer.isStructurallyStable(pkg, "ghost", "d1");

    assertFalse(verdict.stable(), "Unknown state");
    assertEquals("Missing state, diagram, or CSI", verdict.message(), "Message");
  }

  @Test
  void transportMustStayInsideAdmissibleRegion() {
    Csi csi = new Csi("csi1", Set.of("Freedom"), List.of());
    Diagram inside = new Diagram("inside");
    inside.addNode(transport("t", "Freedom"));
    Diagram outside = new Diagram("outside");
    outside.addNode(transport("t", "Elsewhere"));
    SidState state = new SidState("s1", null, "csi1", null);

    ConditionResult kept = analyzer.checkInvariantUnderTransport(inside, state, csi, List.of());
    ConditionResult lost = analyzer.checkInvariantUnderTransport(outside, state, csi, List.of());

    assertTrue(kept.satisfied(), kept.message());
    assertEquals("Admissible region invariant under transport", kept.message(), "Kept");
    assertFalse(lost.satisfied(), "Transport dof outside the CSI");
    assertEquals("Transport node t is not in admissible region", lost.message(), "Lost");
  }

  @Test
  void previouslyAdmissibleElementMustStayAdmissible() {
    Csi csi = new Csi("csi1", Set.of("Freedom"), List.of());
    Diagram diagram = new Diagram("d");
    diagram.addNode(transport("t", "Freedom"));
    diagram.addNode(Node.atom("x", "Elsewhere"));
    SidState state = new SidState("s1", null, "csi1", null);
    state.setLabels(Map.of("x", Label.I));

    ConditionResult result = analyzer.checkInvariantUnderTransport(diagram, state, csi, List.of());

    assertFalse(result.satisfied(), "x would become N");
    assertEquals(
        "Previously admissible element x is no longer admissible", result.message(), "Message");
  }

  private static SidState stateWithHistory(Map<String, Label> previous, Map<String, Label> last) {
    SidState state = new SidState("s", null, null, null);
    state.recordHistory(previous);
    state.recordHistory(last);
    return state;
  }

  private static Node transport(String id, String dof) {
    Node node = new Node(id, OperatorKind.T, List.of(dof), List.of(), false, null);
    node.meta().addProperty(OperatorRules.TARGET_COMPARTMENT, "c2");
    return node;
  }
}
