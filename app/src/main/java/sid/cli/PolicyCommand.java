package sid.cli;

import com.google.gson.JsonObject;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.ParseException;
import sid.crf.Authorizer;
import sid.crf.Csi;
import sid.crf.SidState;
import sid.engine.CrfRuleGate;
import sid.engine.EngineConfig;
import sid.engine.PolicyRunResult;
import sid.engine.SidEngine;
import sid.io.PolicyJson;
import sid.model.Diagram;
import sid.pkg.PackageLoader;
import sid.pkg.SidPackage;
import sid.policy.PolicyRequest;
import sid.policy.RuleGate;
import sid.policy.Termination;
import sid.rewrite.RewriteRule;
import sid.util.Timing;

/**
 * Handles {@code policy --request <file>} with optional {@code --policy}, {@code --horizon},
 * {@code --seed} and {@code --rules r1,r2} overrides. With {@code --package <file> --state <id>}
 * every rule attempt is authorized against that state. Exits 3 when the horizon was reached.
 */
final class PolicyCommand {
  private static final Logger LOG = LoggerFactory.getLogger(PolicyCommand.class);

  int execute(String[] args, PrintStream out) throws IOException, ParseException {
    CliOptions options = OptionTable.parse(args, "policy");
    if (options.requestPath() == null) {
      throw new IllegalArgumentException("--request is required");
    }
    JsonObject requestJson = CliParsers.readJsonObject(options.requestPath());
    PolicyRequest request = withOverrides(PolicyJson.readRequest(requestJson), options);

    SidEngine engine = new SidEngine(EngineConfig.defaults(), gate(options));
    Optional<Diagram> diagram = PolicyJson.readDiagram(requestJson);
    if (diagram.isPresent()) {
      engine.setDiagram(diagram.get());
    } else if (options.hasExpr()) {
      engine.setDiagramExpr(options.expr());
    } else {
      throw new IllegalArgumentException("Request has no diagram_expr or diagram and no --expr");
    }

    Timing timer = Timing.start();
    PolicyRunResult result = engine.runPolicy(request);
    LOG.info("Policy run took {} ms", timer.elapsedMillis());
    out.println(PolicyJson.toJson(result));
    return result.run().termination() == Termination.HORIZON ? 3 : 0;
  }

  private static RuleGate gate(CliOptions options) throws IOException {
    if (options.packagePath() == null) {
      return RuleGate.OPEN;
    }
    if (options.stateId() == null) {
      throw new IllegalArgumentException("--state is required with --package");
    }
    SidPackage pkg = PackageLoader.parse(CliParsers.readFile(options.packagePath()));
    SidState state =
        pkg.state(options.stateId())
            .orElseThrow(
                () -> new IllegalArgumentException("Unknown state: " + options.stateId()));
    Csi csi =
        pkg.csi(state.csiId())
            .orElseThrow(
                () -> new IllegalArgumentException("State " + state.id() + " has no known CSI"));
    LOG.info("Authorizing rules against state {} and CSI {}", state.id(), csi.id());
    return new CrfRuleGate(new Authorizer(), pkg.constraints(), state, csi);
  }

  private static PolicyRequest withOverrides(PolicyRequest request, CliOptions options) {
    List<RewriteRule> rules = request.rules();
    if (!options.ruleIds().isEmpty()) {
      rules = rules.stream().filter(rule -> options.ruleIds().contains(rule.id())).toList();
    }
    return new PolicyRequest(
        rules,
        options.policy() != null ? options.policy() : request.policy(),
        options.horizonCap() != null ? options.horizonCap() : request.horizonCap(),
        options.seed() != null ? options.seed() : request.seed());
  }
}
