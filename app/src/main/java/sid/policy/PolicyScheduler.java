package sid.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.ParseException;
import sid.model.Diagram;
import sid.rewrite.CompiledRule;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteResult;
import sid.rewrite.RewriteRule;

/**
 * Applies a rule set pass by pass until a pass changes nothing or the step horizon is hit.
 *
 * <p>Non-confluent rule sets may reach different normal forms under different policies.
 */
public final class PolicyScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(PolicyScheduler.class);

  private final RewriteEngine engine;
  private final RuleGate gate;

  public PolicyScheduler(RewriteEngine engine) {
    this(engine, RuleGate.OPEN);
  }

  public PolicyScheduler(RewriteEngine engine, RuleGate gate) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.gate = Objects.requireNonNull(gate, "gate");
  }

  /**
   * Runs the request against {@code diagram} in place.
   *
   * @throws IllegalArgumentException if a rule does not parse; nothing is applied in that case
   */
  public PolicyRun run(Diagram diagram, PolicyRequest request) {
    Objects.requireNonNull(diagram, "diagram");
    Objects.requireNonNull(request, "request");
    List<CompiledRule> compiled = compile(request.rules());
    Random random = new Random(request.seed());
    List<String> trace = new ArrayList<>();
    int steps = 0;

    LOG.info(
        "Running policy {} with {} rule(s), horizon {}",
        request.policy(),
        compiled.size(),
        request.horizonCap());
    if (request.horizonCap() <= 0) {
      return finish(request, steps, trace, Termination.HORIZON);
    }
    while (true) {
      boolean progressed = false;
      for (CompiledRule rule : request.policy().order(compiled, random)) {
        if (!gate.permits(rule.rule(), diagram)) {
          LOG.debug("Rule {} not authorized in this pass", rule.id());
          continue;
        }
        RewriteResult result = engine.apply(diagram, rule);
        if (!result.applied()) {
          continue;
        }
        steps++;
        trace.add(rule.id());
        progressed = true;
        if (steps >= request.horizonCap()) {
          return finish(request, steps, trace, Termination.HORIZON);
        }
      }
      if (!progressed) {
        return finish(request, steps, trace, Termination.FIXED_POINT);
      }
    }
  }

  private static PolicyRun finish(
      PolicyRequest request, int steps, List<String> trace, Termination termination) {
    LOG.info(
        "Policy {} finished after {} step(s): {}",
        request.policy(),
        steps,
        termination.wireName());
    return new PolicyRun(steps, trace.size(), termination, trace);
  }

  private static List<CompiledRule> compile(List<RewriteRule> rules) {
    List<CompiledRule> compiled = new ArrayList<>(rules.size());
    for (RewriteRule rule : rules) {
      try {
        compiled.add(rule.compile());
      } catch (ParseException ex) {
        throw new IllegalArgumentException(
            "Rule " + rule.id() + " failed to parse: " + ex.getMessage(), ex);
      }
    }
    return compiled;
  }
}
