package synthesis.cli;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.ast.Tree;
import synthesis.cli.CliParsers.OptionSpec;
import synthesis.enumerate.EquivalenceScreen;
import synthesis.eval.TreeEvaluator;
import synthesis.examples.ArithmeticGrammar;
import synthesis.examples.ArithmeticOperators;
import synthesis.grammar.Grammar;

/** Prints the screened programs of the built-in grammar, shallowest first. */
final class EnumerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerateCommand.class);

  private final PrintStream out;

  EnumerateCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions.Builder builder = CliOptions.builder().examples(List.of());
    CliParsers.parseOptions(args, optionSpecs(), builder);
    CliOptions options = builder.build();

    TreeEvaluator evaluator = new TreeEvaluator(ArithmeticOperators.standard());
    Grammar grammar = ArithmeticGrammar.build(evaluator, options.variables());
    EquivalenceScreen screen = new EquivalenceScreen();
    Iterator<Tree> programs = grammar.enumerateUpTo(options.depth(), screen);

    int printed = 0;
    while (programs.hasNext() && (options.limit() == 0 || printed < options.limit())) {
      out.println(programs.next().render());
      printed++;
    }
    LOG.info(
        "Printed {} program(s) up to depth {} ({} duplicates screened out)",
        printed,
        options.depth(),
        screen.duplicatesRejected());
    return 0;
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--depth",
        OptionSpec.withValue(
            (b, raw) ->
                b.depth(
                    CliParsers.parseInt(raw, CliOptions.DEFAULT_ENUMERATION_DEPTH, "--depth"))));
    specs.put(
        "--limit",
        OptionSpec.withValue((b, raw) -> b.limit(CliParsers.parseInt(raw, 0, "--limit"))));
    specs.put(
        "--vars", OptionSpec.withValue((b, raw) -> b.variables(CliParsers.parseVariables(raw))));
    return specs;
  }
}
