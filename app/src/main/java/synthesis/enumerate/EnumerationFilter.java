package synthesis.enumerate;

import synthesis.ast.Tree;

/** Decides which enumerated programs are worth emitting. */
public interface EnumerationFilter {

  /** Membership query; does not change the filter's state. */
  boolean isUsefulProgram(Tree tree);

  void registerProgram(Tree tree);

  /** Called by the enumerator for each candidate it dropped after {@link #isUsefulProgram}. */
  default void programRejected(Tree tree) {}
}
