package sid.policy;

import sid.model.Diagram;
import sid.rewrite.RewriteRule;

/** Hook consulted before each rule attempt; a closed gate skips the rule for that pass. */
@FunctionalInterface
public interface RuleGate {
  RuleGate OPEN = (rule, diagram) -> true;

  boolean permits(RewriteRule rule, Diagram diagram);
}
