package synthesis.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import synthesis.pipeline.Example;

final class CliParsersTest {

  @Test
  void parsesExampleList() {
    List<Example> examples = CliParsers.parseExamples(" x=0, y=1 -> -1 ; x=4,y=1->3;");

    assertEquals(
        List.of(
            new Example(Map.of("x", 0L, "y", 1L), -1L), new Example(Map.of("x", 4L, "y", 1L), 3L)),
        examples);
  }

  @Test
  void rejectsMalformedExamples() {
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseExamples(""));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseExamples("x=1"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseExamples("x=1,x=2->3"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseExamples("x->3"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseExamples("x=a->3"));
  }

  @Test
  void parsesOptionsInBothSpellings() {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, CliParsers.OptionSpec> specs =
        Map.of(
            "--depth",
            CliParsers.OptionSpec.withValue(
                (b, raw) -> b.depth(CliParsers.parseInt(raw, 2, "--depth"))),
            "--vars",
            CliParsers.OptionSpec.withValue(
                (b, raw) -> b.variables(CliParsers.parseVariables(raw))),
            "--json",
            CliParsers.OptionSpec.flag(b -> b.json(true)));

    CliParsers.parseOptions(
        new String[] {"--depth=4", "--vars", "a, b,", "--json"}, specs, builder);
    CliOptions options = builder.examples(List.of()).build();

    assertEquals(4, options.depth());
    assertEquals(List.of("a", "b"), options.variables());
    assertTrue(options.json());
  }

  @Test
  void rejectsUnknownOrIncompleteOptions() {
    Map<String, CliParsers.OptionSpec> specs =
        Map.of(
            "--depth",
            CliParsers.OptionSpec.withValue(
                (b, raw) -> b.depth(CliParsers.parseInt(raw, 2, "--depth"))));

    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--bogus"}, specs, CliOptions.builder()));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--depth"}, specs, CliOptions.builder()));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"--depth=x"}, specs, CliOptions.builder()));
  }

  @Test
  void examplesMustUseDeclaredVariables() {
    CliOptions.Builder builder =
        CliOptions.builder()
            .variables(List.of("x"))
            .examples(List.of(new Example(Map.of("x", 1L, "z", 2L), 3L)));

    assertThrows(IllegalArgumentException.class, builder::build);
  }
}
