package sid.rewrite;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.Atom;
import sid.ast.Expr;
import sid.ast.Exprs;
import sid.ast.Op;
import sid.model.Diagram;
import sid.model.DiagramBuilder;
import sid.model.IdGenerator;
import sid.model.Node;
import sid.model.StructuralException;

/**
 * Matches expression patterns against diagrams and splices in instantiated replacements.
 *
 * <p>Rewrites are all-or-nothing: they are performed on a copy that replaces the live diagram only
 * when the result is acyclic.
 */
public final class RewriteEngine {
  private static final Logger LOG = LoggerFactory.getLogger(RewriteEngine.class);

  public static final int MAX_REWRITE_ITERATIONS = 1000;

  /** First match in node insertion order. */
  public Optional<Match> findMatch(Diagram diagram, Expr pattern) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(pattern, "pattern");
    for (Node node : diagram.nodes()) {
      MatchState state = new MatchState();
      if (matchNode(diagram, pattern, node.id(), state)) {
        return Optional.of(new Match(node.id(), state.bindings, state.matched));
      }
    }
    return Optional.empty();
  }

  public boolean isApplicable(Diagram diagram, CompiledRule rule) {
    return !isBareVariable(rule.pattern()) && findMatch(diagram, rule.pattern()).isPresent();
  }

  public RewriteResult apply(Diagram diagram, CompiledRule rule) {
    return apply(diagram, rule.pattern(), rule.replacement(), rule.id());
  }

  public RewriteResult apply(Diagram diagram, Expr pattern, Expr replacement, String ruleId) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(replacement, "replacement");
    Objects.requireNonNull(ruleId, "ruleId");
    if (isBareVariable(pattern)) {
      return RewriteResult.rejected("Rewrite " + ruleId + " rejected: pattern is a bare variable");
    }
    Set<String> unbound = new LinkedHashSet<>(Exprs.variables(replacement));
    unbound.removeAll(Exprs.variables(pattern));
    if (!unbound.isEmpty()) {
      return RewriteResult.rejected(
          "Rewrite " + ruleId + " rejected: unbound variable " + String.join(", ", unbound));
    }

    Optional<Match> found = findMatch(diagram, pattern);
    if (found.isEmpty()) {
      return RewriteResult.notApplicable("Rewrite " + ruleId + " not applicable");
    }
    Match match = found.get();

    Diagram work = diagram.copy();
    try {
      splice(work, match, replacement, ruleId);
    } catch (StructuralException ex) {
      LOG.warn("Rewrite {} rejected: {}", ruleId, ex.getMessage());
      return RewriteResult.rejected("Rewrite " + ruleId + " rejected: " + ex.getMessage());
    }
    if (work.hasCycle()) {
      LOG.warn("Rewrite {} would introduce cycle; diagram left unchanged", ruleId);
      return RewriteResult.rejected("Rewrite " + ruleId + " would introduce cycle");
    }
    diagram.replaceWith(work);
    LOG.debug("Rewrite {} applied at {}", ruleId, match.rootId());
    return RewriteResult.applied("Rewrite " + ruleId + " applied");
  }

  public FixpointResult applyUntilFixpoint(Diagram diagram, CompiledRule rule) {
    return applyUntilFixpoint(
        diagram, rule.pattern(), rule.replacement(), rule.id(), MAX_REWRITE_ITERATIONS);
  }

  /** Applies the rewrite until it no longer matches, is rejected, or the cap is reached. */
  public FixpointResult applyUntilFixpoint(
      Diagram diagram, Expr pattern, Expr replacement, String ruleId, int maxIterations) {
    int iterations = 0;
    while (iterations < maxIterations) {
      RewriteResult result = apply(diagram, pattern, replacement, ruleId);
      switch (result.outcome()) {
        case APPLIED -> iterations++;
        case NOT_APPLICABLE -> {
          return new FixpointResult(true, iterations);
        }
        case REJECTED -> {
          return new FixpointResult(false, iterations);
        }
      }
    }
    boolean converged = findMatch(diagram, pattern).isEmpty();
    if (!converged) {
      LOG.warn("Rewrite {} still applicable after {} iterations", ruleId, maxIterations);
    }
    return new FixpointResult(converged, iterations);
  }

  private void splice(Diagram work, Match match, Expr replacement, String ruleId) {
    IdGenerator ids = IdGenerator.scopedTo(work, ruleId);
    Set<String> used = Exprs.variables(replacement);
    Map<String, String> boundNodes = new LinkedHashMap<>();
    for (Map.Entry<String, BoundTerm> entry : match.bindings().entrySet()) {
      BoundTerm term = entry.getValue();
      if (term.isNode()) {
        boundNodes.put(entry.getKey(), term.nodeId());
      } else if (used.contains(entry.getKey())) {
        String leafId = ids.nextNodeId();
        work.addNode(Node.atom(leafId, term.dof()));
        boundNodes.put(entry.getKey(), leafId);
      }
    }

    String newRoot = DiagramBuilder.instantiate(work, replacement, ids, boundNodes);
    String oldRoot = match.rootId();
    work.redirectConsumers(oldRoot, newRoot);

    Set<String> keep = match.boundNodes();
    keep.add(newRoot);
    for (String nodeId : match.matchedNodes()) {
      if (keep.contains(nodeId)) {
        continue;
      }
      if (nodeId.equals(oldRoot) || !work.hasConsumers(nodeId)) {
        work.removeNode(nodeId);
      }
    }
  }

  private boolean matchNode(Diagram diagram, Expr pattern, String nodeId, MatchState state) {
    Node node = diagram.requireNode(nodeId);
    if (pattern instanceof Atom atom) {
      if (atom.isVariable()) {
        return state.bind(atom.name(), BoundTerm.node(nodeId));
      }
      if (node.atomName().filter(atom.name()::equals).isEmpty()) {
        return false;
      }
      state.matched.add(nodeId);
      return true;
    }
    Op op = (Op) pattern;
    if (node.op() != op.kind()) {
      return false;
    }
    List<Expr> args = op.args();
    List<String> inputs = diagram.inputsOf(nodeId);
    if (!inputs.isEmpty()) {
      if (inputs.size() != args.size()) {
        return false;
      }
      state.matched.add(nodeId);
      for (int i = 0; i < args.size(); i++) {
        if (!matchNode(diagram, args.get(i), inputs.get(i), state)) {
          return false;
        }
      }
      return true;
    }
    if (!node.isFolded() || node.dofRefs().size() != args.size()) {
      return false;
    }
    state.matched.add(nodeId);
    for (int i = 0; i < args.size(); i++) {
      if (!matchFoldedDof(args.get(i), node.dofRefs().get(i), state)) {
        return false;
      }
    }
    return true;
  }

  private static boolean matchFoldedDof(Expr pattern, String dof, MatchState state) {
    if (!(pattern instanceof Atom atom)) {
      return false;
    }
    if (atom.isVariable()) {
      return state.bind(atom.name(), BoundTerm.dof(dof));
    }
    return atom.name().equals(dof);
  }

  private static boolean isBareVariable(Expr pattern) {
    return pattern instanceof Atom atom && atom.isVariable();
  }

  private static final class MatchState {
    private final Map<String, BoundTerm> bindings = new LinkedHashMap<>();
    private final Set<String> matched = new LinkedHashSet<>();

    boolean bind(String variable, BoundTerm term) {
      BoundTerm existing = bindings.putIfAbsent(variable, term);
      return existing == null || existing.equals(term);
    }
  }
}
