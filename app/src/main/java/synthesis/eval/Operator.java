package synthesis.eval;

import java.util.List;
import synthesis.ast.Node;

/** Implementation of a named operator. Receives the node and its already evaluated children. */
@FunctionalInterface
public interface Operator {
  Object apply(Node node, List<Object> args);
}
