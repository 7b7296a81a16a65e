package synthesis.enumerate;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import synthesis.ast.Tree;

/**
 * Drops programs equal to one already emitted in this session. Equality is tree equality, so
 * commutative operands are identified through {@link synthesis.ast.SymmetricNode}; programs that
 * are only mathematically equivalent (e.g. {@code mul(x, 2)} and {@code add(x, x)}) are both kept.
 *
 * <p>Not thread-safe; one screen belongs to one enumeration session.
 */
public final class EquivalenceScreen implements EnumerationFilter {
  private final Set<Tree> generatedPrograms = new HashSet<>();
  private long duplicatesRejected;

  @Override
  public boolean isUsefulProgram(Tree tree) {
    Objects.requireNonNull(tree, "tree");
    if (!tree.isComplete()) {
      throw new IllegalArgumentException(
          "Only complete programs can be screened: " + tree.render());
    }
    return !generatedPrograms.contains(tree);
  }

  @Override
  public void registerProgram(Tree tree) {
    generatedPrograms.add(Objects.requireNonNull(tree, "tree"));
  }

  @Override
  public void programRejected(Tree tree) {
    duplicatesRejected++;
  }

  public int size() {
    return generatedPrograms.size();
  }

  public long duplicatesRejected() {
    return duplicatesRejected;
  }
}
