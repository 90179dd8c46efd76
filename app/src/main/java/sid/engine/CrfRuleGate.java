package sid.engine;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.crf.Authorization;
import sid.crf.Authorizer;
import sid.crf.Constraint;
import sid.crf.Csi;
import sid.crf.SidState;
import sid.model.Diagram;
import sid.policy.RuleGate;
import sid.rewrite.RewriteRule;

/** Admits a rule only when the {@link Authorizer} allows it for one state and CSI. */
public final class CrfRuleGate implements RuleGate {
  private static final Logger LOG = LoggerFactory.getLogger(CrfRuleGate.class);

  private final Authorizer authorizer;
  private final List<Constraint> constraints;
  private final SidState state;
  private final Csi csi;

  public CrfRuleGate(Authorizer authorizer, List<Constraint> constraints, SidState state, Csi csi) {
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    this.constraints = List.copyOf(constraints);
    this.state = Objects.requireNonNull(state, "state");
    this.csi = Objects.requireNonNull(csi, "csi");
  }

  @Override
  public boolean permits(RewriteRule rule, Diagram diagram) {
    Authorization authorization = authorizer.authorize(constraints, state, diagram, csi, rule);
    if (!authorization.allowed()) {
      LOG.debug("Rule {} denied: {}", rule.id(), authorization.violatedConstraintIds());
    }
    return authorization.allowed();
  }
}
