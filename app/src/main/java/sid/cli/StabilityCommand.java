package sid.cli;

import java.io.IOException;
import java.io.PrintStream;
import sid.crf.SidState;
import sid.pkg.PackageLoader;
import sid.pkg.SidPackage;
import sid.stability.StabilityAnalyzer;
import sid.stability.StabilityVerdict;

/**
 * Handles {@code stability --package <file> --state <id> [--diagram-id <id>] [--tolerance t]
 * [--require-all]}. The diagram defaults to the one the state references.
 */
final class StabilityCommand {

  int execute(String[] args, PrintStream out) throws IOException {
    CliOptions options = OptionTable.parse(args, "stability");
    if (options.stateId() == null) {
      throw new IllegalArgumentException("--state is required");
    }
    SidPackage pkg = PackageLoader.parse(CliParsers.readFile(options.requirePackage()));
    String diagramId =
        options.diagramId() != null
            ? options.diagramId()
            : pkg.state(options.stateId())
                .map(SidState::diagramId)
                .orElseThrow(
                    () -> new IllegalArgumentException("Unknown state: " + options.stateId()));

    StabilityAnalyzer analyzer = new StabilityAnalyzer();
    StabilityVerdict verdict =
        analyzer.isStructurallyStable(
            pkg, options.stateId(), diagramId, options.tolerance(), options.requireAll());
    out.println(
        new JsonReportBuilder()
            .stability(
                verdict,
                analyzer.computeMetrics(pkg, options.stateId(), diagramId).orElse(null)));
    return verdict.stable() ? 0 : 1;
  }
}
