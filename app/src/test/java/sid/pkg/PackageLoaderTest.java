package sid.pkg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sid.crf.Label;
import sid.testing.Fixtures;

final class PackageLoaderTest {

  @Test
  void loadsEverySection(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("package.json");
    Files.writeString(file, Fixtures.validPackageText());

    SidPackage pkg = PackageLoader.load(file);

    assertEquals(1, pkg.diagrams().size(), "Diagrams");
    assertEquals(2, pkg.diagram("d1").orElseThrow().nodeCount(), "Diagram nodes");
    assertEquals("csi1", pkg.state("s1").orElseThrow().csiId(), "State CSI");
    assertTrue(pkg.csi("csi1").orElseThrow().allowsPair("Freedom", "Order"), "CSI pair");
    assertEquals("Main", pkg.compartments().get("c1").name(), "Compartment name");
    assertEquals(2, pkg.dofs().size(), "Dofs");
    assertEquals(2, pkg.constraints().size(), "Constraints");
    assertEquals("r1", pkg.rules().get(0).id(), "Rule");
    assertTrue(pkg.diagram(null).isEmpty(), "Null id lookup");
  }

  @Test
  void stateLabelsAreTyped() {
    JsonObject doc = Fixtures.validPackage();
    JsonObject labels = new JsonObject();
    labels.addProperty("n1", "I");
    doc.getAsJsonArray("states").get(0).getAsJsonObject().add("inu_labels", labels);

    SidPackage pkg = PackageLoader.load(doc);

    assertEquals(Label.I, pkg.state("s1").orElseThrow().labels().get("n1"), "Label read");
  }

  @Test
  void duplicateIdsAbortLoad() {
    JsonObject doc = Fixtures.validPackage();
    doc.getAsJsonArray("csis").add(doc.getAsJsonArray("csis").get(0).deepCopy());

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> PackageLoader.load(doc), "Duplicate");
    assertEquals("Duplicate CSI id: csi1", error.getMessage(), "Message");
  }

  @Test
  void rejectsMissingFilesAndMalformedDocuments(@TempDir Path dir) {
    assertThrows(
        IllegalArgumentException.class,
        () -> PackageLoader.load(dir.resolve("absent.json")),
        "Missing file");
    assertThrows(IllegalArgumentException.class, () -> PackageLoader.parse("[]"), "Array root");
    assertThrows(IllegalArgumentException.class, () -> PackageLoader.parse("{"), "Broken JSON");
  }
}
