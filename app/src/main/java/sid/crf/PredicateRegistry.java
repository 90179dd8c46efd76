package sid.crf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.model.Diagram;
import sid.model.Edge;
import sid.model.Node;

/** Named constraint predicates. {@link #defaults()} carries the four built-in ones. */
public final class PredicateRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(PredicateRegistry.class);

  public static final String NO_CROSS_CSI_INTERACTION = "no_cross_csi_interaction";
  public static final String COLLAPSE_IRREVERSIBLE = "collapse_irreversible";
  public static final String NO_CYCLES = "no_cycles";
  public static final String VALID_COMPARTMENT_TRANSITIONS = "valid_compartment_transitions";

  private final Map<String, ConstraintPredicate> predicates = new LinkedHashMap<>();

  public static PredicateRegistry defaults() {
    PredicateRegistry registry = new PredicateRegistry();
    registry.register(NO_CROSS_CSI_INTERACTION, PredicateRegistry::noCrossCsiInteraction);
    registry.register(COLLAPSE_IRREVERSIBLE, PredicateRegistry::collapseIrreversible);
    registry.register(NO_CYCLES, PredicateRegistry::noCycles);
    registry.register(
        VALID_COMPARTMENT_TRANSITIONS, PredicateRegistry::validCompartmentTransitions);
    return registry;
  }

  public PredicateRegistry register(String name, ConstraintPredicate predicate) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(predicate, "predicate");
    predicates.put(name, predicate);
    LOG.debug("Registered predicate {}", name);
    return this;
  }

  public Optional<ConstraintPredicate> find(String name) {
    return Optional.ofNullable(predicates.get(name));
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(predicates.keySet());
  }

  static PredicateResult noCrossCsiInteraction(SidState state, Diagram diagram, Csi csi) {
    if (!csi.restrictsPairs()) {
      return PredicateResult.pass("No allowed pairs defined; pair check skipped");
    }
    for (Edge edge : diagram.edges()) {
      Optional<Node> from = diagram.node(edge.from());
      Optional<Node> to = diagram.node(edge.to());
      if (from.isEmpty() || to.isEmpty()) {
        continue;
      }
      for (String fromDof : from.get().dofRefs()) {
        for (String toDof : to.get().dofRefs()) {
          if (!csi.allowsPair(fromDof, toDof)) {
            return PredicateResult.fail(
                "Edge " + edge.id() + " violates CSI pair (" + fromDof + ", " + toDof + ")");
          }
        }
      }
    }
    return PredicateResult.pass("All edges within CSI pairs");
  }

  static PredicateResult collapseIrreversible(SidState state, Diagram diagram, Csi csi) {
    for (Node node : diagram.nodes()) {
      if (OperatorRules.collapseMissingIrreversible(node)) {
        return PredicateResult.fail("Collapse node " + node.id() + " must be marked irreversible");
      }
    }
    return PredicateResult.pass("All collapse nodes properly marked");
  }

  static PredicateResult noCycles(SidState state, Diagram diagram, Csi csi) {
    return diagram.hasCycle()
        ? PredicateResult.fail("Cycle detected in diagram " + diagram.id())
        : PredicateResult.pass("No cycles detected");
  }

  static PredicateResult validCompartmentTransitions(SidState state, Diagram diagram, Csi csi) {
    for (Node node : diagram.nodes()) {
      if (OperatorRules.transportMissingTarget(node)) {
        return PredicateResult.fail(
            "Transport node " + node.id() + " missing target_compartment in meta");
      }
    }
    return PredicateResult.pass("All transport nodes valid");
  }
}
