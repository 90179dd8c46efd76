package sid.pkg;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import sid.crf.Constraint;
import sid.crf.Csi;
import sid.crf.SidState;
import sid.model.Diagram;
import sid.rewrite.RewriteRule;

/** Typed contents of a package document, each section indexed by id in document order. */
public final class SidPackage {
  private final Map<String, Diagram> diagrams;
  private final Map<String, SidState> states;
  private final Map<String, Csi> csis;
  private final Map<String, Dof> dofs;
  private final Map<String, Compartment> compartments;
  private final List<Constraint> constraints;
  private final List<RewriteRule> rules;

  public SidPackage(
      Map<String, Diagram> diagrams,
      Map<String, SidState> states,
      Map<String, Csi> csis,
      Map<String, Dof> dofs,
      Map<String, Compartment> compartments,
      List<Constraint> constraints,
      List<RewriteRule> rules) {
    this.diagrams = new LinkedHashMap<>(diagrams);
    this.states = new LinkedHashMap<>(states);
    this.csis = new LinkedHashMap<>(csis);
    this.dofs = new LinkedHashMap<>(dofs);
    this.compartments = new LinkedHashMap<>(compartments);
    this.constraints = List.copyOf(constraints);
    this.rules = List.copyOf(rules);
  }

  public Optional<Diagram> diagram(String id) {
    return Optional.ofNullable(id == null ? null : diagrams.get(id));
  }

  public Optional<SidState> state(String id) {
    return Optional.ofNullable(id == null ? null : states.get(id));
  }

  public Optional<Csi> csi(String id) {
    return Optional.ofNullable(id == null ? null : csis.get(id));
  }

  public Collection<Diagram> diagrams() {
    return Collections.unmodifiableCollection(diagrams.values());
  }

  public Collection<SidState> states() {
    return Collections.unmodifiableCollection(states.values());
  }

  public Collection<Csi> csis() {
    return Collections.unmodifiableCollection(csis.values());
  }

  public Map<String, Dof> dofs() {
    return Collections.unmodifiableMap(dofs);
  }

  public Map<String, Compartment> compartments() {
    return Collections.unmodifiableMap(compartments);
  }

  public List<Constraint> constraints() {
    return constraints;
  }

  public List<RewriteRule> rules() {
    return rules;
  }
}
