package sid.policy;

import java.util.List;
import java.util.Objects;
import sid.rewrite.RewriteRule;

/** Rules to schedule, the ordering policy, the step horizon and the permutation seed. */
public record PolicyRequest(List<RewriteRule> rules, Policy policy, int horizonCap, long seed) {
  public static final int DEFAULT_HORIZON_CAP = 100;

  public PolicyRequest {
    rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    policy = policy == null ? Policy.P1 : policy;
  }

  public static PolicyRequest of(List<RewriteRule> rules, Policy policy) {
    return new PolicyRequest(rules, policy, DEFAULT_HORIZON_CAP, 0L);
  }
}
