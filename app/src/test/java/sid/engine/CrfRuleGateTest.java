package sid.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sid.crf.Authorizer;
import sid.crf.Csi;
import sid.crf.Label;
import sid.crf.SidState;
import sid.model.DiagramExprs;
import sid.policy.Policy;
import sid.policy.PolicyRequest;
import sid.rewrite.RewriteRule;

final class CrfRuleGateTest {
  private static final Csi CSI = new Csi("csi1", Set.of("a"), List.of());

  @Test
  void forbiddenStateBlocksRulesRequiringAdmissibility() throws Exception {
    SidState state = new SidState("s1", null, "csi1", null);
    state.setLabels(Map.of("elsewhere", Label.N));
    RewriteRule guarded =
        new RewriteRule("guarded", "P($x)", "O($x)", null, List.of("admissible"));
    SidEngine engine =
        new SidEngine(
            EngineConfig.defaults(), new CrfRuleGate(new Authorizer(), List.of(), state, CSI));
    engine.setDiagramExpr("P(a)");

    PolicyRunResult result = engine.runPolicy(PolicyRequest.of(List.of(guarded), Policy.P1));

    assertEquals(0, result.run().steps(), "Denied every pass");
    assertEquals(List.of("P(a)"), DiagramExprs.render(engine.diagram()), "Diagram untouched");
  }

  @Test
  void cleanStateAdmitsRule() throws Exception {
    SidState state = new SidState("s1", null, "csi1", null);
    CrfRuleGate gate = new CrfRuleGate(new Authorizer(), List.of(), state, CSI);
    SidEngine engine = new SidEngine(EngineConfig.defaults(), gate);
    engine.setDiagramExpr("P(a)");

    PolicyRunResult result =
        engine.runPolicy(
            PolicyRequest.of(
                List.of(new RewriteRule("r", "P($x)", "O($x)", null, List.of("admissible"))),
                Policy.P1));

    assertEquals(1, result.run().steps(), "Applied once");
    assertEquals(List.of("O(a)"), DiagramExprs.render(engine.diagram()), "Collapsed");
    assertTrue(state.hasLabels(), "Labels assigned on first authorization");
    assertFalse(state.labels().containsValue(Label.N), "Every element inside the CSI");
  }
}
