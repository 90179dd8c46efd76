package sid.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ExprParserTest {

  @Test
  void parsesNestedOperatorsAndRendersCanonically() throws ParseException {
    Expr expr = ExprParser.parse("S+( P(a) ,C($x,b))");

    assertTrue(expr instanceof Op, "Root should be an operator application");
    Op root = (Op) expr;
    assertEquals("S+", root.name(), "Root operator symbol");
    assertEquals(OperatorKind.S_PLUS, root.kind(), "Operator kind");
    assertEquals(2, root.arity(), "S+ should carry both arguments");
    assertEquals("S+(P(a), C($x, b))", Exprs.toString(expr), "Canonical rendering");
  }

  @Test
  void renderedTextParsesBackToEqualTree() throws ParseException {
    List<String> samples =
        List.of("P(Freedom)", "S-(O(a), T(b), c)", "C(S+(a, $y), O(P($z)))", "lonely");
    for (String sample : samples) {
      Expr first = ExprParser.parse(sample);
      Expr second = ExprParser.parse(first.render());
      assertEquals(first, second, "Round trip should preserve " + sample);
    }
  }

  @Test
  void distinguishesVariablesFromLiterals() throws ParseException {
    Op expr = (Op) ExprParser.parse("C($x, x)");

    Atom variable = (Atom) expr.args().get(0);
    Atom literal = (Atom) expr.args().get(1);
    assertTrue(variable.isVariable(), "$x should be a pattern variable");
    assertFalse(literal.isVariable(), "x should be a literal atom");
    assertEquals(Set.of("$x"), Exprs.variables(expr), "Only $x is a variable");
    assertFalse(Exprs.isGround(expr), "Expression with a variable is not ground");
    assertEquals(3, Exprs.size(expr), "C plus two atoms");
  }

  @Test
  void rejectsEmptyInput() {
    ParseException error = assertThrows(ParseException.class, () -> ExprParser.parse("   "));
    assertEquals("Empty expression", error.getMessage(), "Blank text is empty");
  }

  @Test
  void rejectsMissingClosingParenthesis() {
    ParseException error = assertThrows(ParseException.class, () -> ExprParser.parse("P(a"));
    assertTrue(
        error.getMessage().contains("Unbalanced parentheses"),
        "Unexpected message: " + error.getMessage());
  }

  @Test
  void rejectsTrailingInput() {
    ParseException error = assertThrows(ParseException.class, () -> ExprParser.parse("P(a) b"));
    assertTrue(
        error.getMessage().startsWith("Unexpected trailing input"),
        "Unexpected message: " + error.getMessage());
    assertEquals(5, error.position(), "Trailing token position");
  }

  @Test
  void rejectsWrongArity() {
    ParseException bare = assertThrows(ParseException.class, () -> ExprParser.parse("P"));
    assertEquals("P requires exactly 1 argument, got 0", bare.getMessage(), "Bare operator");

    ParseException coupling = assertThrows(ParseException.class, () -> ExprParser.parse("C(a)"));
    assertEquals(
        "C requires exactly 2 arguments, got 1", coupling.getMessage(), "Coupling arity");
  }

  @Test
  void positionIsKeptOutOfTheMessage() {
    ParseException error = assertThrows(ParseException.class, () -> ExprParser.parse("P(a, b)"));

    assertEquals("P requires exactly 1 argument, got 2", error.getMessage(), "Plain message");
    assertEquals(0, error.position(), "Arity errors point at the operator");
  }

  @Test
  void nestingBeyondTheLimitIsRejected() throws ParseException {
    int levels = ExprParser.MAX_DEPTH;
    String atLimit = "P(".repeat(levels) + "a" + ")".repeat(levels);
    String tooDeep = "P(".repeat(10_000) + "a" + ")".repeat(10_000);

    assertEquals(levels + 1, Exprs.size(ExprParser.parse(atLimit)), "Limit itself is accepted");
    ParseException error = assertThrows(ParseException.class, () -> ExprParser.parse(tooDeep));
    assertTrue(error.getMessage().startsWith("Expression nested deeper than"), error.getMessage());
    assertEquals(2 * levels, error.position(), "Points at the first operator past the limit");
  }

  @Test
  void rejectsUnknownOperatorAndStrayCharacters() {
    ParseException unknown = assertThrows(ParseException.class, () -> ExprParser.parse("Q(a)"));
    assertEquals("Unknown operator 'Q'", unknown.getMessage(), "Unknown operator");

    ParseException stray = assertThrows(ParseException.class, () -> ExprParser.parse("P(a#)"));
    assertTrue(
        stray.getMessage().startsWith("Unexpected character"),
        "Unexpected message: " + stray.getMessage());

    assertThrows(ParseException.class, () -> ExprParser.parse("P($)"), "Dangling sigil");
  }

  @Test
  void operatorKindLookup() {
    assertEquals(OperatorKind.S_MINUS, OperatorKind.parse("S-"), "S- symbol");
    assertTrue(OperatorKind.fromSymbol("X").isEmpty(), "Unknown symbol");
    assertTrue(OperatorKind.applicable("A").isEmpty(), "Atoms are never applied");
    assertTrue(OperatorKind.O.isIrreversible(), "Collapse is irreversible");
    assertFalse(OperatorKind.C.accepts(3), "Coupling takes two arguments");
  }
}
