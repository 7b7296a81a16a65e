package synthesis.pipeline;

import java.util.List;
import java.util.Objects;
import synthesis.ast.Tree;
import synthesis.eval.TreeEvaluator;

/**
 * Accepts a candidate iff it evaluates to the expected output on every example. The feedback for a
 * wrong candidate is the first example it fails. Evaluation failures are not caught here.
 */
public final class InOutExampleOracle implements Oracle<Example> {
  private final SynthesisContext ctx;
  private final List<Example> examples;

  public InOutExampleOracle(List<Example> examples, SynthesisContext ctx) {
    this.examples = List.copyOf(Objects.requireNonNull(examples, "examples"));
    this.ctx = Objects.requireNonNull(ctx, "ctx");
  }

  public List<Example> examples() {
    return examples;
  }

  @Override
  public Assessment<Example> assess(Tree candidate) {
    for (Example example : examples) {
      Object actual = ctx.evaluator().eval(candidate, example.inputs());
      if (!TreeEvaluator.sameValue(actual, example.output())) {
        return Assessment.rejected(example);
      }
    }
    return Assessment.accepted();
  }
}
