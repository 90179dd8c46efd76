package sid.rewrite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import sid.ast.ExprParser;
import sid.ast.OperatorKind;
import sid.ast.ParseException;
import sid.model.Diagram;
import sid.model.DiagramBuilder;
import sid.model.DiagramExprs;
import sid.model.Edge;
import sid.model.Node;

final class RewriteEngineTest {
  private final RewriteEngine engine = new RewriteEngine();

  @Test
  void projectionCollapsesToIrreversibleNode() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("P(Freedom)", "d");
    CompiledRule rule = RewriteRule.of("collapse", "P($x)", "O($x)").compile();

    RewriteResult result = engine.apply(diagram, rule);

    assertTrue(result.applied(), "Rule should apply: " + result.messages());
    assertEquals("Rewrite collapse applied", result.message(), "Applied message");
    assertEquals(List.of("O(Freedom)"), DiagramExprs.render(diagram), "Rewritten diagram");
    assertEquals(0, diagram.countOp(OperatorKind.P), "Projection removed");
    Node collapse =
        diagram.nodes().stream().filter(node -> node.op() == OperatorKind.O).findFirst().get();
    assertTrue(collapse.irreversible(), "Collapse node must be irreversible");
    String argument = diagram.inputsOf(collapse.id()).get(0);
    assertEquals(
        "Freedom",
        diagram.requireNode(argument).atomName().orElse(""),
        "Bound argument is reused");
  }

  @Test
  void operatorMustMatchExactly() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("S+(a, b)", "d");

    RewriteResult negative =
        engine.apply(diagram, RewriteRule.of("neg", "S-($x, $y)", "C($x, $y)").compile());
    RewriteResult positive =
        engine.apply(diagram, RewriteRule.of("pos", "S+($x, $y)", "C($x, $y)").compile());

    assertFalse(negative.applied(), "S- never matches S+");
    assertTrue(positive.applied(), positive.message());
    assertEquals(List.of("C(a, b)"), DiagramExprs.render(diagram), "Rewritten by the S+ rule");
  }

  @Test
  void rewriteBelowTheRootRedirectsConsumers() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("T(P(a))", "d");

    RewriteResult result =
        engine.apply(diagram, RewriteRule.of("r", "P($x)", "O($x)").compile());

    assertTrue(result.applied(), "Inner projection should match");
    assertEquals(List.of("T(O(a))"), DiagramExprs.render(diagram), "Consumer follows new node");
  }

  @Test
  void unmatchedPatternLeavesDiagramUntouched() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("C(a, b)", "d");

    RewriteResult result =
        engine.apply(diagram, RewriteRule.of("r", "P($x)", "O($x)").compile());

    assertEquals(RewriteResult.Outcome.NOT_APPLICABLE, result.outcome(), "No projection present");
    assertEquals("Rewrite r not applicable", result.message(), "Not applicable message");
    assertEquals(List.of("C(a, b)"), DiagramExprs.render(diagram), "Diagram unchanged");
  }

  @Test
  void rewriteIntroducingCycleIsRejectedAndDiagramUnchanged() throws ParseException {
    Diagram diagram = new Diagram("d");
    diagram.addNode(Node.operator("p", OperatorKind.P));
    diagram.addNode(Node.atom("a", "a"));
    diagram.connect("in", "a", "p", 0);
    diagram.addEdge(Edge.arg("back", "p", "a", 0));

    RewriteResult result =
        engine.apply(diagram, ExprParser.parse("P($x)"), ExprParser.parse("O($x)"), "loop");

    assertEquals(RewriteResult.Outcome.REJECTED, result.outcome(), "Cycle must be rejected");
    assertEquals("Rewrite loop would introduce cycle", result.message(), "Rejection message");
    assertEquals(2, diagram.nodeCount(), "Nodes unchanged");
    assertEquals(2, diagram.edgeCount(), "Edges unchanged");
    assertEquals(OperatorKind.P, diagram.requireNode("p").op(), "Projection still present");
  }

  @Test
  void unboundReplacementVariableIsRejected() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("P(a)", "d");

    RewriteResult result =
        engine.apply(diagram, RewriteRule.of("r", "P($x)", "C($x, $y)").compile());

    assertEquals(RewriteResult.Outcome.REJECTED, result.outcome(), "Unbound $y");
    assertTrue(result.message().contains("unbound variable $y"), result.message());
    assertEquals(List.of("P(a)"), DiagramExprs.render(diagram), "Diagram unchanged");
  }

  @Test
  void fixpointRewritesEveryOccurrenceAndIsIdempotent() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("S+(P(a), P(b))", "d");
    CompiledRule rule = RewriteRule.of("r", "P($x)", "O($x)").compile();

    FixpointResult first = engine.applyUntilFixpoint(diagram, rule);
    List<String> afterFirst = DiagramExprs.render(diagram);
    FixpointResult second = engine.applyUntilFixpoint(diagram, rule);

    assertTrue(first.converged(), "Fixpoint reached");
    assertEquals(2, first.iterations(), "Both projections rewritten");
    assertEquals(List.of("S+(O(a), O(b))"), afterFirst, "Rewritten diagram");
    assertTrue(second.converged(), "Still at fixpoint");
    assertEquals(0, second.iterations(), "Second run changes nothing");
    assertEquals(afterFirst, DiagramExprs.render(diagram), "Idempotent");
  }

  @Test
  void fixpointStopsAtIterationCap() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("P(a)", "d");

    FixpointResult result =
        engine.applyUntilFixpoint(
            diagram, ExprParser.parse("P($x)"), ExprParser.parse("P(P($x))"), "grow", 5);

    assertFalse(result.converged(), "Growing rule never converges");
    assertEquals(5, result.iterations(), "Capped at five");
  }

  @Test
  void matchesFoldedOperatorArguments() throws ParseException {
    Diagram diagram = new Diagram("d");
    diagram.addNode(new Node("p", OperatorKind.P, List.of("Freedom"), List.of(), false, null));
    CompiledRule rule = RewriteRule.of("r", "P($x)", "O($x)").compile();

    assertTrue(engine.isApplicable(diagram, rule), "Folded dof binds $x");
    RewriteResult result = engine.apply(diagram, rule);

    assertTrue(result.applied(), "Folded node rewritten");
    assertEquals(List.of("O(Freedom)"), DiagramExprs.render(diagram), "Dof becomes a leaf");
  }

  @Test
  void repeatedVariableRequiresSameBinding() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("C(a, b)", "d");
    CompiledRule rule = RewriteRule.of("r", "C($x, $x)", "P($x)").compile();

    assertFalse(engine.isApplicable(diagram, rule), "Distinct arguments must not unify");
  }

  @Test
  void literalAtomsMatchByName() throws ParseException {
    Diagram diagram = DiagramBuilder.fromText("P(a)", "d");

    assertFalse(
        engine.isApplicable(diagram, RewriteRule.of("r", "P(b)", "O(b)").compile()),
        "Different literal");
    assertTrue(
        engine.isApplicable(diagram, RewriteRule.of("r", "P(a)", "O(a)").compile()),
        "Same literal");
  }

  @Test
  void compileRejectsMissingParts() {
    assertThrows(
        ParseException.class, () -> RewriteRule.of("r", null, "O($x)").compile(), "No pattern");
    assertThrows(
        ParseException.class, () -> RewriteRule.of("r", "P($x)", " ").compile(), "No replacement");
  }
}
