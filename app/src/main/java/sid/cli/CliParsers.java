package sid.cli;

import com.google.common.base.Splitter;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import sid.pkg.PackageLoader;

/** Shared helpers for CLI argument parsing and JSON input loading. */
final class CliParsers {
  private CliParsers() {}

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, double defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /** Comma-separated values, trimmed, empties dropped. */
  static List<String> parseList(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(raw);
  }

  static String readFile(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("File not found: " + path);
    }
    return Files.readString(path);
  }

  static JsonObject readJsonObject(Path path) throws IOException {
    return PackageLoader.parseDocument(readFile(path));
  }
}
