package sid.testing;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Package documents shared by the tests, loaded from {@code src/test/resources/packages}. */
public final class Fixtures {
  private static final String VALID_PACKAGE = "/packages/valid_package.json";

  private Fixtures() {}

  /** Text of a well-formed package: one diagram, state, CSI, two constraints and one rule. */
  public static String validPackageText() {
    try (InputStream in = Fixtures.class.getResourceAsStream(VALID_PACKAGE)) {
      if (in == null) {
        throw new IllegalStateException("Missing test resource " + VALID_PACKAGE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  /** Fresh, mutable copy of the valid package. */
  public static JsonObject validPackage() {
    return JsonParser.parseString(validPackageText()).getAsJsonObject();
  }
}
