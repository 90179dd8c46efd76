package sid.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import sid.ast.OperatorKind;

/**
 * Mutable directed graph of {@link Node}s and {@link Edge}s. Nodes and edges keep insertion order.
 * The adjacency index is rebuilt lazily after any mutation.
 */
public final class Diagram {
  private static final int VISITING = 1;
  private static final int DONE = 2;

  private final String id;
  private String compartmentId;
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<String, Edge> edges = new LinkedHashMap<>();

  private Map<String, List<Edge>> incomingIndex = Map.of();
  private Map<String, List<Edge>> outgoingIndex = Map.of();
  private boolean dirty = true;

  public Diagram(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public String id() {
    return id;
  }

  public Optional<String> compartmentId() {
    return Optional.ofNullable(compartmentId);
  }

  public void setCompartmentId(String compartmentId) {
    this.compartmentId = compartmentId;
  }

  public Collection<Node> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public Collection<Edge> edges() {
    return Collections.unmodifiableCollection(edges.values());
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  public boolean hasNode(String nodeId) {
    return nodes.containsKey(nodeId);
  }

  public boolean hasEdge(String edgeId) {
    return edges.containsKey(edgeId);
  }

  public Optional<Node> node(String nodeId) {
    return Optional.ofNullable(nodes.get(nodeId));
  }

  public Node requireNode(String nodeId) {
    Node node = nodes.get(nodeId);
    if (node == null) {
      throw new StructuralException("Unknown node: " + nodeId);
    }
    return node;
  }

  public Optional<Edge> edge(String edgeId) {
    return Optional.ofNullable(edges.get(edgeId));
  }

  public long countOp(OperatorKind op) {
    return nodes.values().stream().filter(node -> node.op() == op).count();
  }

  /** Adds a node as-is. */
  public void addNode(Node node) {
    Objects.requireNonNull(node, "node");
    if (nodes.containsKey(node.id())) {
      throw new StructuralException("Duplicate node id: " + node.id());
    }
    nodes.put(node.id(), node);
    dirty = true;
  }

  /** Adds an edge as-is without touching the target's {@code inputs}; used by loaders. */
  public void addEdge(Edge edge) {
    Objects.requireNonNull(edge, "edge");
    if (edges.containsKey(edge.id())) {
      throw new StructuralException("Duplicate edge id: " + edge.id());
    }
    edges.put(edge.id(), edge);
    dirty = true;
  }

  /**
   * Adds an {@code arg} edge and records {@code from} in the target's {@code inputs} at the
   * position implied by {@code port}.
   */
  public Edge connect(String edgeId, String from, String to, int port) {
    Node target = requireNode(to);
    requireNode(from);
    int position = 0;
    for (Edge existing : incoming(to)) {
      if (existing.portOrZero() <= port) {
        position++;
      }
    }
    Edge edge = Edge.arg(edgeId, from, to, port);
    addEdge(edge);
    target.insertInput(position, from);
    return edge;
  }

  /** Removes an edge and its entry in the target's {@code inputs}. */
  public boolean removeEdge(String edgeId) {
    Edge removed = edges.remove(edgeId);
    if (removed == null) {
      return false;
    }
    Node target = nodes.get(removed.to());
    if (target != null) {
      target.removeInput(removed.from());
    }
    dirty = true;
    return true;
  }

  /** Removes a node, every incident edge and every {@code inputs} reference to it. */
  public boolean removeNode(String nodeId) {
    Node removed = nodes.remove(nodeId);
    if (removed == null) {
      return false;
    }
    edges.values().removeIf(edge -> edge.from().equals(nodeId) || edge.to().equals(nodeId));
    for (Node node : nodes.values()) {
      node.removeAllInputs(nodeId);
    }
    dirty = true;
    return true;
  }

  /** Re-points every consumer of {@code oldId} (edges and {@code inputs}) to {@code newId}. */
  public void redirectConsumers(String oldId, String newId) {
    requireNode(newId);
    List<Edge> consumers = new ArrayList<>(outgoing(oldId));
    for (Edge edge : consumers) {
      edges.put(edge.id(), edge.withFrom(newId));
    }
    for (Node node : nodes.values()) {
      if (!node.id().equals(newId)) {
        node.replaceInput(oldId, newId);
      }
    }
    dirty = true;
  }

  /** Incoming edges of a node, ordered by port. */
  public List<Edge> incoming(String nodeId) {
    reindex();
    return incomingIndex.getOrDefault(nodeId, List.of());
  }

  public List<Edge> outgoing(String nodeId) {
    reindex();
    return outgoingIndex.getOrDefault(nodeId, List.of());
  }

  /**
   * Argument node ids in port order: taken from incoming edges, or from {@code inputs} for nodes
   * that were loaded without edges.
   */
  public List<String> inputsOf(String nodeId) {
    List<Edge> in = incoming(nodeId);
    if (!in.isEmpty()) {
      List<String> ids = new ArrayList<>(in.size());
      for (Edge edge : in) {
        ids.add(edge.from());
      }
      return ids;
    }
    Node node = nodes.get(nodeId);
    return node == null ? List.of() : node.inputs();
  }

  /** True when some node is consumed by another node through an edge or an input reference. */
  public boolean hasConsumers(String nodeId) {
    if (!outgoing(nodeId).isEmpty()) {
      return true;
    }
    for (Node node : nodes.values()) {
      if (node.inputs().contains(nodeId)) {
        return true;
      }
    }
    return false;
  }

  /** Iterative depth-first search for a directed cycle; O(nodes + edges) time and space. */
  public boolean hasCycle() {
    reindex();
    Map<String, Integer> state = new HashMap<>();
    Deque<String> path = new ArrayDeque<>();
    Deque<Iterator<Edge>> pending = new ArrayDeque<>();
    for (String start : nodes.keySet()) {
      if (state.containsKey(start)) {
        continue;
      }
      state.put(start, VISITING);
      path.push(start);
      pending.push(outgoing(start).iterator());
      while (!pending.isEmpty()) {
        Iterator<Edge> it = pending.peek();
        if (it.hasNext()) {
          String next = it.next().to();
          if (!nodes.containsKey(next)) {
            continue;
          }
          Integer seen = state.get(next);
          if (seen == null) {
            state.put(next, VISITING);
            path.push(next);
            pending.push(outgoing(next).iterator());
          } else if (seen == VISITING) {
            return true;
          }
        } else {
          pending.pop();
          state.put(path.pop(), DONE);
        }
      }
    }
    return false;
  }

  /** Deep copy; nodes are cloned, edges are immutable and shared. */
  public Diagram copy() {
    Diagram copy = new Diagram(id);
    copy.compartmentId = compartmentId;
    for (Node node : nodes.values()) {
      copy.nodes.put(node.id(), node.copy());
    }
    copy.edges.putAll(edges);
    return copy;
  }

  /** Replaces this diagram's contents with a copy of {@code other}'s. */
  public void replaceWith(Diagram other) {
    Objects.requireNonNull(other, "other");
    if (other == this) {
      return;
    }
    nodes.clear();
    edges.clear();
    for (Node node : other.nodes.values()) {
      nodes.put(node.id(), node.copy());
    }
    edges.putAll(other.edges);
    compartmentId = other.compartmentId;
    dirty = true;
  }

  private void reindex() {
    if (!dirty) {
      return;
    }
    Map<String, List<Edge>> incoming = new HashMap<>();
    Map<String, List<Edge>> outgoing = new HashMap<>();
    for (Edge edge : edges.values()) {
      incoming.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
      outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
    }
    for (List<Edge> list : incoming.values()) {
      list.sort(Comparator.comparingInt(Edge::portOrZero));
    }
    incomingIndex = incoming;
    outgoingIndex = outgoing;
    dirty = false;
  }

  @Override
  public String toString() {
    return "Diagram[" + id + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
  }
}
