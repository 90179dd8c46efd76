package sid.pkg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import sid.testing.Fixtures;

final class PackageValidatorTest {
  private final PackageValidator validator = new PackageValidator();

  @Test
  void wellFormedPackageIsValid() {
    ValidationOutcome outcome = validator.validate(Fixtures.validPackage());

    assertTrue(outcome.isValid(), "Unexpected errors: " + outcome.errors());
    assertTrue(outcome.warnings().isEmpty(), "Unexpected warnings: " + outcome.warnings());
  }

  @Test
  void collapseWithoutIrreversibleFlagIsReported() {
    JsonObject pkg = Fixtures.validPackage();
    node(pkg, 1).addProperty("irreversible", false);

    ValidationOutcome outcome = validator.validate(pkg);

    assertEquals(
        EnumSet.of(IssueCategory.COLLAPSE_NOT_IRREVERSIBLE, IssueCategory.CONSTRAINT_VIOLATION),
        outcome.errorCategories(),
        "Errors: " + outcome.errors());
    assertTrue(
        messages(outcome).contains("Collapse node n2 in diagram d1 must set irreversible=true"),
        "Errors: " + outcome.errors());
  }

  @Test
  void unknownDofIsBothMissingAndOutsideCsi() {
    JsonObject pkg = Fixtures.validPackage();
    JsonArray refs = new JsonArray();
    refs.add("Chaos");
    node(pkg, 0).add("dof_refs", refs);

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(outcome.hasError(IssueCategory.MISSING_REFERENCE), "Errors: " + outcome.errors());
    assertTrue(outcome.hasError(IssueCategory.DOF_OUTSIDE_CSI), "Errors: " + outcome.errors());
    assertTrue(outcome.hasError(IssueCategory.CSI_PAIR_VIOLATION), "Errors: " + outcome.errors());
    assertTrue(
        messages(outcome).contains("Diagram d1 node n1 uses DOF Chaos outside CSI csi1"),
        "Errors: " + outcome.errors());
  }

  @Test
  void malformedCsiPairsAreReported() {
    JsonObject pkg = Fixtures.validPackage();
    JsonArray pairs = csi(pkg).getAsJsonArray("allowed_pairs");
    pairs.add(JsonParser.parseString("[\"Freedom\"]"));
    pairs.add(JsonParser.parseString("[\"Freedom\", \"Ghost\"]"));

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(
        messages(outcome).contains("CSI csi1 allowed_pair must have exactly 2 elements, got 1"),
        "Errors: " + outcome.errors());
    assertTrue(
        messages(outcome).contains("CSI csi1 allowed_pair references unknown DOF: Ghost"),
        "Errors: " + outcome.errors());
  }

  @Test
  void cyclicDiagramIsReported() {
    JsonObject pkg = Fixtures.validPackage();
    JsonObject back = new JsonObject();
    back.addProperty("id", "e2");
    back.addProperty("from", "n2");
    back.addProperty("to", "n1");
    diagram(pkg).getAsJsonArray("edges").add(back);

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(outcome.hasError(IssueCategory.CYCLIC_DIAGRAM), "Errors: " + outcome.errors());
    assertTrue(messages(outcome).contains("Diagram d1 contains a cycle"), "Cycle message");
  }

  @Test
  void brokenRewriteRulesAreReported() {
    JsonObject pkg = Fixtures.validPackage();
    JsonArray rules = pkg.getAsJsonArray("rewrite_rules");
    rules.add(
        JsonParser.parseString("{\"id\":\"r2\",\"pattern\":\"P($x\",\"replacement\":\"O($x)\"}"));
    rules.add(JsonParser.parseString("{\"id\":\"r3\",\"pattern\":\"P($x)\"}"));

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(outcome.hasError(IssueCategory.INVALID_REWRITE_EXPR), "Errors: " + outcome.errors());
    assertTrue(outcome.hasError(IssueCategory.INVALID_REWRITE_RULE), "Errors: " + outcome.errors());
  }

  @Test
  void missingAndDuplicateIdsAreReported() {
    JsonObject pkg = Fixtures.validPackage();
    pkg.getAsJsonArray("diagrams").add(diagram(pkg).deepCopy());
    pkg.getAsJsonArray("states").add(new JsonObject());

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(messages(outcome).contains("Duplicate diagram id: d1"), "Duplicate diagram");
    assertTrue(messages(outcome).contains("state missing id"), "State without id");
  }

  @Test
  void danglingStateReferencesAreReported() {
    JsonObject pkg = Fixtures.validPackage();
    JsonObject state = pkg.getAsJsonArray("states").get(0).getAsJsonObject();
    state.addProperty("csi_id", "nowhere");
    state.addProperty("compartment_id", "lost");

    ValidationOutcome outcome = validator.validate(pkg);

    assertEquals(
        EnumSet.of(IssueCategory.MISSING_REFERENCE),
        outcome.errorCategories(),
        "Errors: " + outcome.errors());
    assertEquals(2, outcome.errors().size(), "CSI and compartment: " + outcome.errors());
  }

  @Test
  void unknownOperatorIsReported() {
    JsonObject pkg = Fixtures.validPackage();
    node(pkg, 0).addProperty("op", "Z");

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(outcome.hasError(IssueCategory.UNKNOWN_OPERATOR), "Errors: " + outcome.errors());
  }

  @Test
  void unknownPredicateOnlyWarns() {
    JsonObject pkg = Fixtures.validPackage();
    pkg.getAsJsonArray("constraints")
        .add(JsonParser.parseString("{\"id\":\"k3\",\"predicate\":\"feels_right\"}"));

    ValidationOutcome outcome = validator.validate(pkg);

    assertTrue(outcome.isValid(), "Errors: " + outcome.errors());
    assertEquals(1, outcome.warnings().size(), "Warnings: " + outcome.warnings());
    assertEquals(
        IssueCategory.CONSTRAINT_WARNING, outcome.warnings().get(0).category(), "Category");
    assertFalse(outcome.warnings().get(0).isError(), "Warning severity");
  }

  private static JsonObject diagram(JsonObject pkg) {
    return pkg.getAsJsonArray("diagrams").get(0).getAsJsonObject();
  }

  private static JsonObject node(JsonObject pkg, int index) {
    return diagram(pkg).getAsJsonArray("nodes").get(index).getAsJsonObject();
  }

  private static JsonObject csi(JsonObject pkg) {
    return pkg.getAsJsonArray("csis").get(0).getAsJsonObject();
  }

  private static List<String> messages(ValidationOutcome outcome) {
    return outcome.errors().stream().map(ValidationIssue::message).toList();
  }
}
