package synthesis.ast;

import java.util.Objects;

/** Reference to an input variable, resolved against the bindings at evaluation time. */
public record Variable(String name) implements Value {

  public Variable {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("variable name must not be blank");
    }
  }

  public static Variable of(String name) {
    return new Variable(name);
  }

  @Override
  public String keyText() {
    return name;
  }

  @Override
  public String render() {
    return name;
  }

  @Override
  public String toString() {
    return render();
  }
}
