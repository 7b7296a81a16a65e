package synthesis.eval;

import java.util.Objects;

/** A node names an operator the evaluator has no implementation for. */
public final class UnknownOperatorException extends EvaluationException {
  private final String operator;

  public UnknownOperatorException(String operator) {
    super("Unknown operator: " + operator);
    this.operator = Objects.requireNonNull(operator, "operator");
  }

  public String operator() {
    return operator;
  }
}
