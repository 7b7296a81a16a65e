package synthesis.pipeline;

import java.util.List;
import java.util.Objects;
import synthesis.eval.TreeEvaluator;
import synthesis.grammar.Grammar;

/** What a synthesis run searches over and how candidates are interpreted. */
public record SynthesisContext(Grammar grammar, TreeEvaluator evaluator, List<String> variables) {

  public SynthesisContext {
    Objects.requireNonNull(grammar, "grammar");
    Objects.requireNonNull(evaluator, "evaluator");
    variables = List.copyOf(Objects.requireNonNull(variables, "variables"));
  }
}
