package synthesis.constraint;

import java.util.Map;
import java.util.Objects;
import synthesis.ast.Tree;
import synthesis.eval.TreeEvaluator;
import synthesis.eval.UnboundVariableException;

/**
 * Rejects trees that evaluate to {@code forbidden} under a fixed binding.
 *
 * <p>A tree that reads a variable missing from the binding cannot be judged and is accepted. With
 * an empty binding this rejects exactly the constant subtrees equal to {@code forbidden}. Any other
 * evaluation failure propagates.
 */
public record DoesNotEvaluateTo(
    Object forbidden, TreeEvaluator evaluator, Map<String, Object> bindings)
    implements Constraint {

  public DoesNotEvaluateTo {
    Objects.requireNonNull(forbidden, "forbidden");
    Objects.requireNonNull(evaluator, "evaluator");
    bindings = Map.copyOf(Objects.requireNonNull(bindings, "bindings"));
  }

  /** Forbids constant subtrees equal to {@code forbidden}. */
  public static DoesNotEvaluateTo constant(Object forbidden, TreeEvaluator evaluator) {
    return new DoesNotEvaluateTo(forbidden, evaluator, Map.of());
  }

  @Override
  public boolean accepts(Tree tree) {
    Object value;
    try {
      value = evaluator.eval(tree, bindings);
    } catch (UnboundVariableException e) {
      return true;
    }
    return !TreeEvaluator.sameValue(value, forbidden);
  }

  @Override
  public String toString() {
    return bindings.isEmpty()
        ? "DoesNotEvaluateTo(" + forbidden + ")"
        : "DoesNotEvaluateTo(" + forbidden + ", " + bindings + ")";
  }
}
