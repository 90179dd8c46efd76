package sid.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.OperatorKind;
import sid.model.Diagram;
import sid.model.DiagramValidator;
import sid.model.Edge;
import sid.model.Node;
import sid.model.StructuralException;

/**
 * Diagram JSON codec.
 *
 * <pre>
 * { "id", "compartment_id"?,
 *   "nodes": [ { "id", "op", "dof_refs"?, "inputs"?, "irreversible"?, "meta"? } ],
 *   "edges": [ { "id", "from", "to", "label"?, "port"?, "to_port"? } ] }
 * </pre>
 *
 * <p>Nodes with an empty id are skipped on read.
 */
public final class DiagramJson {
  private static final Logger LOG = LoggerFactory.getLogger(DiagramJson.class);
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
  private static final String DEFAULT_ID = "diagram";

  private DiagramJson() {}

  /** Reads and validates; dangling references and cycles abort the load. */
  public static Diagram parse(String json) {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new StructuralException("Invalid diagram JSON: " + ex.getMessage());
    }
    if (root == null || !root.isJsonObject()) {
      throw new StructuralException("Diagram JSON must be an object");
    }
    Diagram diagram = read(root.getAsJsonObject());
    DiagramValidator.requireValid(diagram);
    DiagramValidator.requireAcyclic(diagram);
    return diagram;
  }

  /** Reads without reference checks; duplicate ids and unknown operators still throw. */
  public static Diagram read(JsonObject obj) {
    String id = JsonFields.string(obj, "id");
    Diagram diagram = new Diagram(id == null || id.isEmpty() ? DEFAULT_ID : id);
    diagram.setCompartmentId(JsonFields.string(obj, "compartment_id"));
    for (JsonObject nodeObj : JsonFields.objects(obj, "nodes")) {
      readNode(nodeObj).ifPresent(diagram::addNode);
    }
    for (JsonObject edgeObj : JsonFields.objects(obj, "edges")) {
      diagram.addEdge(readEdge(edgeObj, diagram.id()));
    }
    return diagram;
  }

  public static JsonObject toJsonObject(Diagram diagram) {
    JsonObject obj = new JsonObject();
    obj.addProperty("id", diagram.id());
    diagram.compartmentId().ifPresent(value -> obj.addProperty("compartment_id", value));
    JsonArray nodes = new JsonArray();
    for (Node node : diagram.nodes()) {
      JsonObject nodeObj = new JsonObject();
      nodeObj.addProperty("id", node.id());
      nodeObj.addProperty("op", node.op().symbol());
      nodeObj.add("dof_refs", JsonFields.array(node.dofRefs()));
      nodeObj.add("inputs", JsonFields.array(node.inputs()));
      nodeObj.addProperty("irreversible", node.irreversible());
      if (node.meta().size() > 0) {
        nodeObj.add("meta", node.meta().deepCopy());
      }
      nodes.add(nodeObj);
    }
    obj.add("nodes", nodes);
    JsonArray edges = new JsonArray();
    for (Edge edge : diagram.edges()) {
      JsonObject edgeObj = new JsonObject();
      edgeObj.addProperty("id", edge.id());
      edgeObj.addProperty("from", edge.from());
      edgeObj.addProperty("to", edge.to());
      edgeObj.addProperty("label", edge.label());
      if (edge.port() != null) {
        edgeObj.addProperty("port", edge.port());
      }
      if (edge.toPort() != null) {
        edgeObj.addProperty("to_port", edge.toPort());
      }
      edges.add(edgeObj);
    }
    obj.add("edges", edges);
    return obj;
  }

  public static String toJson(Diagram diagram) {
    return GSON.toJson(toJsonObject(diagram));
  }

  private static Optional<Node> readNode(JsonObject obj) {
    String id = JsonFields.string(obj, "id");
    if (id == null || id.isEmpty()) {
      LOG.warn("Skipping diagram node without id: {}", obj);
      return Optional.empty();
    }
    String symbol = JsonFields.string(obj, "op");
    OperatorKind op =
        OperatorKind.fromSymbol(symbol)
            .orElseThrow(() -> new StructuralException("Node " + id + " has unknown op " + symbol));
    return Optional.of(
        new Node(
            id,
            op,
            JsonFields.strings(obj, "dof_refs"),
            JsonFields.strings(obj, "inputs"),
            JsonFields.bool(obj, "irreversible", false),
            JsonFields.object(obj, "meta")));
  }

  private static Edge readEdge(JsonObject obj, String diagramId) {
    String id = JsonFields.string(obj, "id");
    String from = JsonFields.string(obj, "from");
    String to = JsonFields.string(obj, "to");
    if (id == null || id.isEmpty()) {
      throw new StructuralException("Diagram " + diagramId + " has edge missing id");
    }
    if (from == null || to == null) {
      throw new StructuralException("Edge " + id + " is missing 'from' or 'to'");
    }
    return new Edge(
        id,
        from,
        to,
        JsonFields.string(obj, "label"),
        JsonFields.integer(obj, "port"),
        JsonFields.integer(obj, "to_port"));
  }
}
