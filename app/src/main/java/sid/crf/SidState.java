package sid.crf;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable semantic state attached to one diagram and one CSI: current labels, a bounded history
 * of label snapshots and the record left by conflict resolution.
 */
public final class SidState {
  public static final int MAX_LOOP_HISTORY = 100;

  private final String id;
  private final String diagramId;
  private final String csiId;
  private final String compartmentId;
  private final Map<String, Label> labels = new LinkedHashMap<>();
  private final Deque<Map<String, Label>> loopHistory = new ArrayDeque<>();
  private final List<String> attenuatedConstraints = new ArrayList<>();
  private final List<Conflict> deferredConflicts = new ArrayList<>();
  private final List<String> partitionedElements = new ArrayList<>();
  private final List<Conflict> escalatedConflicts = new ArrayList<>();
  private List<String> bifurcationChoices = List.of();
  private boolean bifurcated;
  private boolean halted;
  private String haltReason;

  public SidState(String id, String diagramId, String csiId, String compartmentId) {
    this.id = Objects.requireNonNull(id, "id");
    this.diagramId = diagramId;
    this.csiId = csiId;
    this.compartmentId = compartmentId;
  }

  public String id() {
    return id;
  }

  public String diagramId() {
    return diagramId;
  }

  public String csiId() {
    return csiId;
  }

  public Optional<String> compartmentId() {
    return Optional.ofNullable(compartmentId);
  }

  public Map<String, Label> labels() {
    return Collections.unmodifiableMap(labels);
  }

  public boolean hasLabels() {
    return !labels.isEmpty();
  }

  public void setLabels(Map<String, Label> newLabels) {
    labels.clear();
    labels.putAll(newLabels);
  }

  /** Appends a label snapshot, dropping the oldest beyond {@link #MAX_LOOP_HISTORY}. */
  public void recordHistory(Map<String, Label> snapshot) {
    loopHistory.addLast(new LinkedHashMap<>(snapshot));
    while (loopHistory.size() > MAX_LOOP_HISTORY) {
      loopHistory.removeFirst();
    }
  }

  /** Snapshots of past labels, oldest first. */
  public List<Map<String, Label>> loopHistory() {
    return List.copyOf(loopHistory);
  }

  public List<String> attenuatedConstraints() {
    return Collections.unmodifiableList(attenuatedConstraints);
  }

  public List<Conflict> deferredConflicts() {
    return Collections.unmodifiableList(deferredConflicts);
  }

  public List<String> partitionedElements() {
    return Collections.unmodifiableList(partitionedElements);
  }

  public List<Conflict> escalatedConflicts() {
    return Collections.unmodifiableList(escalatedConflicts);
  }

  public List<String> bifurcationChoices() {
    return bifurcationChoices;
  }

  public boolean bifurcated() {
    return bifurcated;
  }

  public boolean halted() {
    return halted;
  }

  public Optional<String> haltReason() {
    return Optional.ofNullable(haltReason);
  }

  void attenuate(String constraintId) {
    attenuatedConstraints.add(constraintId);
  }

  void defer(Conflict conflict) {
    deferredConflicts.add(conflict);
  }

  void partition(List<String> elements) {
    partitionedElements.addAll(elements);
  }

  void escalate(Conflict conflict) {
    escalatedConflicts.add(conflict);
  }

  void bifurcate(List<String> choices) {
    bifurcated = true;
    bifurcationChoices = List.copyOf(choices);
  }

  void halt(String reason) {
    halted = true;
    haltReason = reason;
  }
}
