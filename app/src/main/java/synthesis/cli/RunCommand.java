package synthesis.cli;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.cli.CliParsers.OptionSpec;
import synthesis.eval.TreeEvaluator;
import synthesis.examples.ArithmeticGrammar;
import synthesis.examples.ArithmeticOperators;
import synthesis.grammar.Grammar;
import synthesis.pipeline.EnumerativeGuesser;
import synthesis.pipeline.Example;
import synthesis.pipeline.InOutExampleOracle;
import synthesis.pipeline.Synthesis;
import synthesis.pipeline.SynthesisContext;
import synthesis.pipeline.SynthesisOptions;
import synthesis.pipeline.SynthesisResult;

/** Handles the primary `run` command: synthesises a program for the in/out examples. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);
  static final int EXIT_UNSOLVED = 3;

  int execute(String[] args) {
    CliOptions options = parseRunArgs(args);

    TreeEvaluator evaluator = new TreeEvaluator(ArithmeticOperators.standard());
    Grammar grammar = ArithmeticGrammar.build(evaluator, options.variables());
    SynthesisContext ctx = new SynthesisContext(grammar, evaluator, options.variables());

    LOG.info("Running synthesis on grammar:\n{}", grammar);
    LOG.info("Operators: {}", new TreeSet<>(evaluator.operatorNames()));
    LOG.info("With in-out examples:");
    for (Example example : options.examples()) {
      LOG.info("  {}", example);
    }

    SynthesisOptions synthesisOptions =
        SynthesisOptions.defaults()
            .withTimeBudget(Duration.ofMillis(options.timeoutMs()))
            .withMaxDepth(options.maxDepth());
    EnumerativeGuesser<Example> guesser = new EnumerativeGuesser<>(ctx, options.maxDepth());
    InOutExampleOracle oracle = new InOutExampleOracle(options.examples(), ctx);
    SynthesisResult result = new Synthesis<>(guesser, oracle, synthesisOptions).run();

    logSummary(result, guesser);
    if (options.json()) {
      System.out.println(new JsonReportBuilder().build(result, options, guesser.screen()));
    }
    return result.solved() ? 0 : EXIT_UNSOLVED;
  }

  private CliOptions parseRunArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    CliParsers.parseOptions(args, optionSpecs(), builder);
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put(
        "--timeout-ms",
        OptionSpec.withValue(
            (b, raw) ->
                b.timeoutMs(
                    CliParsers.parseLong(
                        raw,
                        SynthesisOptions.defaults().timeBudget().toMillis(),
                        "--timeout-ms"))));
    specs.put(
        "--max-depth",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxDepth(
                    CliParsers.parseInt(
                        raw, SynthesisOptions.defaults().maxDepth(), "--max-depth"))));
    specs.put(
        "--vars", OptionSpec.withValue((b, raw) -> b.variables(CliParsers.parseVariables(raw))));
    specs.put(
        "--examples", OptionSpec.withValue((b, raw) -> b.examples(CliParsers.parseExamples(raw))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return specs;
  }

  private void logSummary(SynthesisResult result, EnumerativeGuesser<Example> guesser) {
    LOG.info("Synthesis took {} ms", result.elapsedMillis());
    LOG.info("Candidates tried: {}", result.candidatesTried());
    LOG.info(
        "Distinct programs enumerated: {} ({} duplicates screened out)",
        guesser.screen().size(),
        guesser.screen().duplicatesRejected());
    if (result.solved()) {
      LOG.info("Correct guess: {}", result.solution());
    } else {
      LOG.warn("No program found: {}", result.terminationReason());
    }
  }
}
