package sid.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sid.pkg.PackageValidator;
import sid.pkg.ValidationOutcome;
import sid.util.Timing;

/** Handles {@code validate --package <file>}; exits 1 when the package has errors. */
final class ValidateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

  int execute(String[] args, PrintStream out) throws IOException {
    CliOptions options = OptionTable.parse(args, "validate");
    Path path = options.requirePackage();
    Timing timer = Timing.start();
    ValidationOutcome outcome =
        new PackageValidator().validate(CliParsers.readJsonObject(path));
    LOG.info("Validated {} in {} ms", path, timer.elapsedMillis());
    out.println(new JsonReportBuilder().validation(outcome));
    return outcome.isValid() ? 0 : 1;
  }
}
