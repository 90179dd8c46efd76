package sid.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.ast.ParseException;
import sid.field.ConservationViolationException;
import sid.model.StructuralException;

/**
 * Command-line entrypoint.
 *
 * <ul>
 *   <li>{@code validate --package pkg.json}
 *   <li>{@code rewrite --expr "P(Freedom)" --pattern "P($x)" --replacement "O($x)"}
 *   <li>{@code policy --request request.json [--policy P3 --seed 7]}
 *   <li>{@code stability --package pkg.json --state s1}
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 negative result, 2 usage or input error, 3 horizon reached.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    int code = run(args, System.out);
    if (code != 0) {
      System.exit(code);
    }
  }

  static int run(String[] args, PrintStream out) {
    if (args == null || args.length == 0) {
      printUsage(out);
      return 2;
    }
    try {
      return switch (args[0].toLowerCase(Locale.ROOT)) {
        case "validate" -> new ValidateCommand().execute(args, out);
        case "rewrite" -> new RewriteCommand().execute(args, out);
        case "policy" -> new PolicyCommand().execute(args, out);
        case "stability" -> new StabilityCommand().execute(args, out);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield 0;
        }
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (ParseException ex) {
      LOG.error("Parse error: {}", ex.getMessage());
      return 2;
    } catch (StructuralException | IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return 2;
    } catch (ConservationViolationException ex) {
      LOG.error("Conservation violated: {}", ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return 1;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: sid <command> [options]");
    out.println("  validate  --package <file>");
    out.println("  rewrite   (--expr <text> | --diagram <file>) --pattern <p> --replacement <r>");
    out.println("            [--rule-id <id>] [--fixpoint]");
    out.println("  policy    --request <file> [--expr <text>] [--policy P1..P5]");
    out.println("            [--horizon <n>] [--seed <n>] [--rules r1,r2]");
    out.println("            [--package <file> --state <id>]");
    out.println("  stability --package <file> --state <id> [--diagram-id <id>]");
    out.println("            [--tolerance <t>] [--require-all]");
  }
}
