package synthesis.constraint;

import java.util.List;
import synthesis.ast.Node;
import synthesis.ast.Term;
import synthesis.ast.Tree;

/** Rejects a node with two equal children at different positions. Leaves always pass. */
public record DistinctChildren() implements Constraint {

  @Override
  public boolean accepts(Tree tree) {
    if (!(tree instanceof Node node)) {
      return true;
    }
    List<Term> children = node.children();
    for (int i = 0; i < children.size(); i++) {
      for (int j = 0; j < children.size(); j++) {
        if (i != j && children.get(i).equals(children.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "DistinctChildren";
  }
}
