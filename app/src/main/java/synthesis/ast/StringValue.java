package synthesis.ast;

import java.util.Objects;

/** String constant, rendered single-quoted. */
public record StringValue(String value) implements Value {

  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  public static StringValue of(String value) {
    return new StringValue(value);
  }

  @Override
  public String keyText() {
    return value;
  }

  @Override
  public String render() {
    return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  @Override
  public String toString() {
    return render();
  }
}
