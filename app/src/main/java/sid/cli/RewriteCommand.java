package sid.cli;

import java.io.IOException;
import java.io.PrintStream;
import sid.ast.ParseException;
import sid.io.DiagramJson;
import sid.model.Diagram;
import sid.model.DiagramBuilder;
import sid.rewrite.CompiledRule;
import sid.rewrite.FixpointResult;
import sid.rewrite.RewriteEngine;
import sid.rewrite.RewriteResult;
import sid.rewrite.RewriteRule;

/**
 * Handles {@code rewrite (--expr <text> | --diagram <file>) --pattern <p> --replacement <r>}.
 * Exits 0 when the rewrite applied (or, with {@code --fixpoint}, converged), 1 otherwise.
 */
final class RewriteCommand {
  private static final String DIAGRAM_ID = "cli_diagram";

  int execute(String[] args, PrintStream out) throws IOException, ParseException {
    CliOptions options = OptionTable.parse(args, "rewrite");
    Diagram diagram = loadDiagram(options);
    CompiledRule rule =
        RewriteRule.of(options.ruleId(), options.pattern(), options.replacement()).compile();
    RewriteEngine engine = new RewriteEngine();
    JsonReportBuilder reports = new JsonReportBuilder();
    if (options.fixpoint()) {
      FixpointResult result = engine.applyUntilFixpoint(diagram, rule);
      out.println(reports.fixpoint(result, diagram));
      return result.converged() ? 0 : 1;
    }
    RewriteResult result = engine.apply(diagram, rule);
    out.println(reports.rewrite(result, diagram));
    return result.applied() ? 0 : 1;
  }

  private Diagram loadDiagram(CliOptions options) throws IOException, ParseException {
    if (options.hasExpr()) {
      return DiagramBuilder.fromText(options.expr(), DIAGRAM_ID);
    }
    if (options.hasDiagramPath()) {
      return DiagramJson.parse(CliParsers.readFile(options.diagramPath()));
    }
    throw new IllegalArgumentException("Either --expr or --diagram is required");
  }
}
