package synthesis.ast;

/** Atomic leaf of a syntax tree. */
public sealed interface Value extends Tree permits IntValue, StringValue, Variable {

  @Override
  default boolean isComplete() {
    return true;
  }

  @Override
  default TreeKey key() {
    return TreeKey.leaf(keyText());
  }

  /** Text the leaf is ordered by. */
  String keyText();
}
