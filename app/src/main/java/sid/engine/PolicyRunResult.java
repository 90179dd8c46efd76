package sid.engine;

import java.util.Objects;
import sid.policy.PolicyRun;

/** A scheduler run paired with the session metrics observed after it. */
public record PolicyRunResult(PolicyRun run, EngineMetrics metrics) {

  public PolicyRunResult {
    Objects.requireNonNull(run, "run");
    Objects.requireNonNull(metrics, "metrics");
  }
}
