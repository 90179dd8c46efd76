package sid.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import sid.crf.Constraint;
import sid.crf.ConstraintType;
import sid.crf.Csi;
import sid.crf.DofPair;
import sid.crf.Label;
import sid.crf.SidState;

/** Readers for the CRF entries of a package: states, CSIs and constraints. */
public final class CrfJson {
  private CrfJson() {}

  /**
   * {@code {id, diagram_id, csi_id, compartment_id?, inu_labels?, loop_history?: [{inu_labels}]}}.
   */
  public static SidState readState(JsonObject obj) {
    String id = JsonFields.requireString(obj, "id", "State");
    SidState state =
        new SidState(
            id,
            JsonFields.string(obj, "diagram_id"),
            JsonFields.string(obj, "csi_id"),
            JsonFields.string(obj, "compartment_id"));
    JsonObject labels = JsonFields.object(obj, "inu_labels");
    if (labels != null) {
      state.setLabels(readLabels(labels, id));
    }
    for (JsonObject entry : JsonFields.objects(obj, "loop_history")) {
      JsonObject snapshot = JsonFields.object(entry, "inu_labels");
      state.recordHistory(snapshot == null ? Map.of() : readLabels(snapshot, id));
    }
    return state;
  }

  /** {@code {id, allowed_dofs?, allowed_pairs?: [[from, to]]}}; malformed pairs are dropped. */
  public static Csi readCsi(JsonObject obj) {
    String id = JsonFields.requireString(obj, "id", "CSI");
    List<DofPair> pairs = new ArrayList<>();
    JsonElement raw = obj.get("allowed_pairs");
    if (raw != null && raw.isJsonArray()) {
      for (JsonElement element : raw.getAsJsonArray()) {
        if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
          continue;
        }
        JsonArray pair = element.getAsJsonArray();
        pairs.add(new DofPair(pair.get(0).getAsString(), pair.get(1).getAsString()));
      }
    }
    return new Csi(id, new LinkedHashSet<>(JsonFields.strings(obj, "allowed_dofs")), pairs);
  }

  /** {@code {id, predicate, type?: "hard" | "soft"}}; the type defaults to hard. */
  public static Constraint readConstraint(JsonObject obj) {
    return new Constraint(
        JsonFields.requireString(obj, "id", "Constraint"),
        JsonFields.string(obj, "predicate"),
        ConstraintType.parse(JsonFields.string(obj, "type")));
  }

  public static JsonObject labelsToJson(Map<String, Label> labels) {
    JsonObject obj = new JsonObject();
    labels.forEach((key, label) -> obj.addProperty(key, label.name()));
    return obj;
  }

  private static Map<String, Label> readLabels(JsonObject obj, String stateId) {
    Map<String, Label> labels = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
      String raw = entry.getValue().isJsonPrimitive() ? entry.getValue().getAsString() : null;
      Label label =
          Label.fromName(raw)
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "State "
                              + stateId
                              + " has unknown label "
                              + raw
                              + " for "
                              + entry.getKey()));
      labels.put(entry.getKey(), label);
    }
    return labels;
  }
}
