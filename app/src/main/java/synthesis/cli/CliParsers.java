package synthesis.cli;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import synthesis.pipeline.Example;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter EXAMPLES = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter ARROW = Splitter.on("->").trimResults().limit(2);
  private static final Splitter BINDING = Splitter.on('=').trimResults().limit(2);

  private CliParsers() {}

  /** Applies {@code --option value} / {@code --option=value} arguments through {@code specs}. */
  static void parseOptions(
      String[] args, Map<String, OptionSpec> specs, CliOptions.Builder builder) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
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

  static List<String> parseVariables(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return COMMA.splitToList(raw);
  }

  /** Parses {@code x=0,y=1->-1;x=4,y=1->3} into examples with integer values. */
  static List<Example> parseExamples(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("--examples needs at least one example");
    }
    List<Example> examples = new ArrayList<>();
    for (String entry : EXAMPLES.split(raw)) {
      List<String> sides = ARROW.splitToList(entry);
      if (sides.size() != 2 || sides.get(1).isEmpty()) {
        throw new IllegalArgumentException("Example must look like x=1,y=2->3: " + entry);
      }
      Map<String, Object> inputs = new LinkedHashMap<>();
      for (String binding : COMMA.split(sides.get(0))) {
        List<String> parts = BINDING.splitToList(binding);
        if (parts.size() != 2 || parts.get(0).isEmpty()) {
          throw new IllegalArgumentException("Binding must look like x=1: " + binding);
        }
        if (inputs.put(parts.get(0), parseLong(parts.get(1), 0L, "--examples")) != null) {
          throw new IllegalArgumentException("Variable bound twice in example: " + entry);
        }
      }
      examples.add(new Example(inputs, parseLong(sides.get(1), 0L, "--examples")));
    }
    return examples;
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
