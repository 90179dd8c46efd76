package sid.cli;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import sid.cli.CliArguments.OptionSpec;
import sid.policy.Policy;
import sid.stability.StabilityAnalyzer;

/** Every option the commands understand, keyed by flag. */
final class OptionTable {
  private OptionTable() {}

  static Map<String, OptionSpec<CliOptions.Builder>> specs() {
    Map<String, OptionSpec<CliOptions.Builder>> specs = new LinkedHashMap<>();
    specs.put("--package", OptionSpec.withValue((b, raw) -> b.packagePath(Path.of(raw))));
    specs.put("--state", OptionSpec.withValue((b, raw) -> b.stateId(raw)));
    specs.put("--diagram-id", OptionSpec.withValue((b, raw) -> b.diagramId(raw)));
    specs.put(
        "--tolerance",
        OptionSpec.withValue(
            (b, raw) ->
                b.tolerance(
                    CliParsers.parseDouble(
                        raw, StabilityAnalyzer.DEFAULT_TOLERANCE, "--tolerance"))));
    specs.put("--require-all", OptionSpec.flag(b -> b.requireAll(true)));
    specs.put("--expr", OptionSpec.withValue((b, raw) -> b.expr(raw)));
    specs.put("--diagram", OptionSpec.withValue((b, raw) -> b.diagramPath(Path.of(raw))));
    specs.put("--pattern", OptionSpec.withValue((b, raw) -> b.pattern(raw)));
    specs.put("--replacement", OptionSpec.withValue((b, raw) -> b.replacement(raw)));
    specs.put("--rule-id", OptionSpec.withValue((b, raw) -> b.ruleId(raw)));
    specs.put("--fixpoint", OptionSpec.flag(b -> b.fixpoint(true)));
    specs.put("--request", OptionSpec.withValue((b, raw) -> b.requestPath(Path.of(raw))));
    specs.put("--policy", OptionSpec.withValue((b, raw) -> b.policy(Policy.parse(raw))));
    specs.put(
        "--horizon",
        OptionSpec.withValue((b, raw) -> b.horizonCap(CliParsers.parseInt(raw, 0, "--horizon"))));
    specs.put(
        "--seed",
        OptionSpec.withValue((b, raw) -> b.seed(CliParsers.parseLong(raw, 0L, "--seed"))));
    specs.put("--rules", OptionSpec.withValue((b, raw) -> b.ruleIds(CliParsers.parseList(raw))));
    return specs;
  }

  static CliOptions parse(String[] args, String command) {
    CliOptions.Builder builder = CliOptions.builder();
    CliArguments.parse(CliArguments.stripCommand(args, command), specs(), builder);
    return builder.build();
  }
}
