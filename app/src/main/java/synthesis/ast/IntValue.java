package synthesis.ast;

/** Integer constant. */
public record IntValue(long value) implements Value {

  public static IntValue of(long value) {
    return new IntValue(value);
  }

  @Override
  public String keyText() {
    return Long.toString(value);
  }

  @Override
  public String render() {
    return Long.toString(value);
  }

  @Override
  public String toString() {
    return render();
  }
}
