package synthesis.ast;

/** A grammar category standing in for a subtree that has not been expanded yet. */
public interface Placeholder extends Term {

  String name();

  @Override
  default boolean isComplete() {
    return false;
  }
}
