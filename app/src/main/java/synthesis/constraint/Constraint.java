package synthesis.constraint;

import java.util.List;
import synthesis.ast.Tree;

/**
 * Accept-or-reject predicate over generated trees. Attached to grammar symbols (checked at every
 * usage site) or to production rules (checked against the rule's fully substituted result).
 */
public sealed interface Constraint permits DoesNotEvaluateTo, DistinctChildren, Dynamic {

  boolean accepts(Tree tree);

  /** Conjunction of {@code constraints}; true for an empty list. */
  static boolean allAccept(List<? extends Constraint> constraints, Tree tree) {
    for (Constraint constraint : constraints) {
      if (!constraint.accepts(tree)) {
        return false;
      }
    }
    return true;
  }
}
