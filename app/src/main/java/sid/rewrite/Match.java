package sid.rewrite;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One successful match. {@code matchedNodes} lists the nodes consumed by the pattern's structure
 * in pre-order, root first; variable-bound nodes are not part of it.
 */
public record Match(String rootId, Map<String, BoundTerm> bindings, Set<String> matchedNodes) {

  public Match {
    bindings = new LinkedHashMap<>(bindings);
    matchedNodes = new LinkedHashSet<>(matchedNodes);
  }

  public Set<String> boundNodes() {
    Set<String> bound = new LinkedHashSet<>();
    for (BoundTerm term : bindings.values()) {
      if (term.isNode()) {
        bound.add(term.nodeId());
      }
    }
    return bound;
  }
}
