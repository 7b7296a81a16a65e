package synthesis.eval;

import java.util.Objects;

/** A variable leaf has no entry in the supplied bindings. */
public final class UnboundVariableException extends EvaluationException {
  private final String variable;

  public UnboundVariableException(String variable) {
    super("Unbound variable: " + variable);
    this.variable = Objects.requireNonNull(variable, "variable");
  }

  public String variable() {
    return variable;
  }
}
