package synthesis.constraint;

import synthesis.ast.Node;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.ast.Variable;

/** Requires the tree to read at least one variable, i.e. not be a compile-time constant. */
public record Dynamic() implements Constraint {

  @Override
  public boolean accepts(Tree tree) {
    return readsVariable(tree);
  }

  // Placeholders never count: this only runs on fully substituted results.
  private static boolean readsVariable(Term term) {
    if (term instanceof Variable) {
      return true;
    }
    if (term instanceof Node node) {
      for (Term child : node.children()) {
        if (readsVariable(child)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Dynamic";
  }
}
