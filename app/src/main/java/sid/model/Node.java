package sid.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import sid.ast.OperatorKind;

/**
 * Diagram vertex. The {@code inputs} list names argument nodes in port order and is kept in step
 * with incoming edges by {@link Diagram}.
 */
public final class Node {
  private final String id;
  private final OperatorKind op;
  private final List<String> dofRefs;
  private final List<String> inputs;
  private final boolean irreversible;
  private final JsonObject meta;

  public Node(
      String id,
      OperatorKind op,
      List<String> dofRefs,
      List<String> inputs,
      boolean irreversible,
      JsonObject meta) {
    this.id = Objects.requireNonNull(id, "id");
    this.op = Objects.requireNonNull(op, "op");
    this.dofRefs = dofRefs == null ? List.of() : List.copyOf(dofRefs);
    this.inputs = inputs == null ? new ArrayList<>() : new ArrayList<>(inputs);
    this.irreversible = irreversible;
    this.meta = meta == null ? new JsonObject() : meta.deepCopy();
  }

  public static Node operator(String id, OperatorKind op) {
    return new Node(id, op, List.of(), List.of(), op.isIrreversible(), null);
  }

  public static Node atom(String id, String dof) {
    return new Node(id, OperatorKind.ATOM, List.of(dof), List.of(), false, null);
  }

  public String id() {
    return id;
  }

  public OperatorKind op() {
    return op;
  }

  public List<String> dofRefs() {
    return dofRefs;
  }

  public List<String> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  public boolean irreversible() {
    return irreversible;
  }

  /** Free-form metadata; callers may mutate the returned object. */
  public JsonObject meta() {
    return meta;
  }

  public Optional<String> metaString(String key) {
    JsonElement value = meta.get(key);
    if (value == null || !value.isJsonPrimitive()) {
      return Optional.empty();
    }
    String text = value.getAsString();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /** Input-less operator node whose arguments are folded into its dof references. */
  public boolean isFolded() {
    return op != OperatorKind.ATOM && inputs.isEmpty() && !dofRefs.isEmpty();
  }

  /** The degree of freedom an atom leaf stands for, if this is one. */
  public Optional<String> atomName() {
    if (op == OperatorKind.ATOM && dofRefs.size() == 1) {
      return Optional.of(dofRefs.get(0));
    }
    return Optional.empty();
  }

  void insertInput(int index, String inputId) {
    inputs.add(Math.min(Math.max(index, 0), inputs.size()), inputId);
  }

  boolean removeInput(String inputId) {
    return inputs.remove(inputId);
  }

  void removeAllInputs(String inputId) {
    inputs.removeIf(inputId::equals);
  }

  void replaceInput(String oldId, String newId) {
    inputs.replaceAll(existing -> existing.equals(oldId) ? newId : existing);
  }

  Node copy() {
    return new Node(id, op, dofRefs, inputs, irreversible, meta);
  }

  @Override
  public String toString() {
    return id + ":" + op.symbol() + (dofRefs.isEmpty() ? "" : dofRefs) + "<-" + inputs;
  }
}
