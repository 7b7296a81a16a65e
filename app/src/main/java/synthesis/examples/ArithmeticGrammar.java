package synthesis.examples;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import synthesis.ast.IntValue;
import synthesis.ast.Node;
import synthesis.ast.SymmetricNode;
import synthesis.ast.Variable;
import synthesis.constraint.DistinctChildren;
import synthesis.constraint.DoesNotEvaluateTo;
import synthesis.constraint.Dynamic;
import synthesis.eval.TreeEvaluator;
import synthesis.grammar.Grammar;
import synthesis.grammar.Symbol;
import synthesis.pipeline.Example;

/**
 * Built-in integer arithmetic grammar.
 *
 * <pre>
 *   val := x | y | ... | 0 | 1 | -1
 *   A   := val
 *        | add(A != 0, A != 0)            symmetric; DistinctChildren, Dynamic
 *        | mul(A != 1 != 0, A != 1 != 0)  symmetric; Dynamic
 *        | sub(A, A != 0)                 DistinctChildren, Dynamic
 *        | ite(A, A, A)                   Dynamic
 * </pre>
 *
 * {@code != c} rejects constant subtrees evaluating to {@code c}.
 */
public final class ArithmeticGrammar {
  public static final Symbol START = Symbol.of("A");
  public static final Symbol VALUE = Symbol.of("val");
  public static final List<String> DEFAULT_VARIABLES = List.of("x", "y");
  private static final long[] CONSTANTS = {0L, 1L, -1L};

  private ArithmeticGrammar() {}

  public static Grammar build(TreeEvaluator evaluator, List<String> variables) {
    Objects.requireNonNull(evaluator, "evaluator");
    Objects.requireNonNull(variables, "variables");
    DoesNotEvaluateTo nonZero = DoesNotEvaluateTo.constant(0L, evaluator);
    DoesNotEvaluateTo notOne = DoesNotEvaluateTo.constant(1L, evaluator);

    Grammar.Builder builder = Grammar.builder(START);
    for (String name : variables) {
      builder.add(VALUE, Variable.of(name));
    }
    for (long constant : CONSTANTS) {
      builder.add(VALUE, IntValue.of(constant));
    }

    Symbol self = Symbol.self();
    builder.add(START, VALUE);
    builder.add(
        START,
        SymmetricNode.of("add", self.with(nonZero), self.with(nonZero)),
        new DistinctChildren(),
        new Dynamic());
    builder.add(
        START,
        SymmetricNode.of("mul", self.with(notOne, nonZero), self.with(notOne, nonZero)),
        new Dynamic());
    builder.add(
        START, Node.of("sub", self, self.with(nonZero)), new DistinctChildren(), new Dynamic());
    builder.add(START, Node.of("ite", self, self, self), new Dynamic());
    return builder.build();
  }

  public static Grammar build(TreeEvaluator evaluator) {
    return build(evaluator, DEFAULT_VARIABLES);
  }

  /** Examples satisfied by e.g. {@code sub(mul(x, y), 1)}. */
  public static List<Example> defaultExamples() {
    return List.of(
        new Example(Map.of("x", 0L, "y", 1L), -1L),
        new Example(Map.of("x", 4L, "y", 1L), 3L),
        new Example(Map.of("x", 1L, "y", 4L), 3L),
        new Example(Map.of("x", 2L, "y", 2L), 3L));
  }
}
