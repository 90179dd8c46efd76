package sid.pkg;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import sid.crf.Constraint;
import sid.crf.Csi;
import sid.crf.SidState;
import sid.io.CrfJson;
import sid.io.DiagramJson;
import sid.io.JsonFields;
import sid.io.RuleJson;
import sid.model.Diagram;

/**
 * Reads a package document into a {@link SidPackage}.
 *
 * <p>Sections: {@code diagrams}, {@code states}, {@code csis}, {@code dofs}, {@code
 * compartments}, {@code constraints}, {@code rewrite_rules}. Loading rejects missing and
 * duplicate ids; reference checks belong to {@link PackageValidator}.
 */
public final class PackageLoader {
  private PackageLoader() {}

  public static SidPackage load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Package file not found: " + path);
    }
    return parse(Files.readString(path));
  }

  public static SidPackage parse(String json) {
    return load(parseDocument(json));
  }

  public static SidPackage load(JsonObject root) {
    return new SidPackage(
        index(root, "diagrams", "diagram", DiagramJson::read, Diagram::id),
        index(root, "states", "state", CrfJson::readState, SidState::id),
        index(root, "csis", "CSI", CrfJson::readCsi, Csi::id),
        index(root, "dofs", "DOF", PackageLoader::readDof, Dof::id),
        index(root, "compartments", "compartment", PackageLoader::readCompartment, Compartment::id),
        readConstraints(root),
        RuleJson.readAll(JsonFields.objects(root, "rewrite_rules")));
  }

  /** Parses the top-level document, which must be a JSON object. */
  public static JsonObject parseDocument(String json) {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Invalid package JSON: " + ex.getMessage(), ex);
    }
    if (root == null || !root.isJsonObject()) {
      throw new IllegalArgumentException("Package JSON must be an object");
    }
    return root.getAsJsonObject();
  }

  private static <T> Map<String, T> index(
      JsonObject root,
      String section,
      String itemType,
      Function<JsonObject, T> reader,
      Function<T, String> idOf) {
    Map<String, T> index = new LinkedHashMap<>();
    for (JsonObject obj : JsonFields.objects(root, section)) {
      String id = JsonFields.string(obj, "id");
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException(itemType + " missing id");
      }
      T item = reader.apply(obj);
      if (index.putIfAbsent(idOf.apply(item), item) != null) {
        throw new IllegalArgumentException("Duplicate " + itemType + " id: " + id);
      }
    }
    return index;
  }

  private static List<Constraint> readConstraints(JsonObject root) {
    List<Constraint> constraints = new ArrayList<>();
    for (JsonObject obj : JsonFields.objects(root, "constraints")) {
      constraints.add(CrfJson.readConstraint(obj));
    }
    return constraints;
  }

  private static Dof readDof(JsonObject obj) {
    return new Dof(JsonFields.string(obj, "id"), JsonFields.string(obj, "description"));
  }

  private static Compartment readCompartment(JsonObject obj) {
    return new Compartment(JsonFields.string(obj, "id"), JsonFields.string(obj, "name"));
  }
}
