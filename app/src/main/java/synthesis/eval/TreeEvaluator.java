package synthesis.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import synthesis.ast.IntValue;
import synthesis.ast.Node;
import synthesis.ast.StringValue;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.ast.Variable;

/**
 * Interprets complete syntax trees against a variable binding using a fixed operator table.
 *
 * <p>Stateless apart from the table; nothing is cached between calls.
 */
public final class TreeEvaluator {
  private final Map<String, Operator> operators;

  public TreeEvaluator(Map<String, Operator> operators) {
    this.operators = Map.copyOf(Objects.requireNonNull(operators, "operators"));
  }

  public Set<String> operatorNames() {
    return operators.keySet();
  }

  /**
   * Evaluates {@code tree} under {@code bindings}.
   *
   * @throws UnboundVariableException if a variable has no binding
   * @throws UnknownOperatorException if a node's operator is not in the table
   * @throws IllegalArgumentException if the tree still contains placeholders
   */
  public Object eval(Tree tree, Map<String, ?> bindings) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(bindings, "bindings");
    return evalTerm(tree, bindings);
  }

  private Object evalTerm(Term term, Map<String, ?> bindings) {
    if (term instanceof Variable variable) {
      if (!bindings.containsKey(variable.name())) {
        throw new UnboundVariableException(variable.name());
      }
      return bindings.get(variable.name());
    }
    if (term instanceof IntValue intValue) {
      return intValue.value();
    }
    if (term instanceof StringValue stringValue) {
      return stringValue.value();
    }
    if (term instanceof Node node) {
      Operator operator = operators.get(node.name());
      if (operator == null) {
        throw new UnknownOperatorException(node.name());
      }
      List<Object> args = new ArrayList<>(node.children().size());
      for (Term child : node.children()) {
        args.add(evalTerm(child, bindings));
      }
      return operator.apply(node, args);
    }
    throw new IllegalArgumentException("Cannot evaluate incomplete tree: " + term.render());
  }

  /**
   * Compares two evaluation results. Numbers compare by value across boxed types (so {@code 0L}
   * equals {@code 0}); everything else uses {@link Objects#equals}.
   */
  public static boolean sameValue(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      if (isIntegral(x) && isIntegral(y)) {
        return x.longValue() == y.longValue();
      }
      return x.doubleValue() == y.doubleValue();
    }
    return Objects.equals(a, b);
  }

  /** True for the boxed integer types; their values compare and compute as {@code long}. */
  public static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }
}
