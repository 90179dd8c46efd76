package sid.cli;

import java.util.Arrays;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** {@code --option value}, {@code --option=value} and flag parsing shared by the commands. */
final class CliArguments {
  private CliArguments() {}

  static <B> void parse(String[] args, Map<String, OptionSpec<B>> specs, B builder) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<B> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        value = CliParsers.nextValue(args, ++i, parsed.option());
      }
      spec.apply(builder, value);
    }
  }

  /** Drops the leading command word when present. */
  static String[] stripCommand(String[] args, String command) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (command.equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec<B>(boolean requiresValue, BiConsumer<B, String> apply) {
    static <B> OptionSpec<B> withValue(BiConsumer<B, String> consumer) {
      return new OptionSpec<>(true, consumer);
    }

    static <B> OptionSpec<B> flag(Consumer<B> consumer) {
      return new OptionSpec<>(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(B builder, String value) {
      apply.accept(builder, value);
    }
  }
}
