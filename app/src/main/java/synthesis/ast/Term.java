package synthesis.ast;

/**
 * Anything that may appear as a child of a {@link Node}: a finished {@link Tree} or, while a
 * grammar template is being expanded, a {@link Placeholder}.
 *
 * <p>Terms are ordered by their {@link #key()}, which gives complete trees a sort order that does
 * not depend on hashing.
 */
public interface Term extends Comparable<Term> {

  /** Canonical, side-effect-free textual rendering. */
  String render();

  /** Comparison key derived from the term's name and children. */
  TreeKey key();

  /** True iff no reachable descendant is a placeholder. */
  boolean isComplete();

  @Override
  default int compareTo(Term other) {
    return key().compareTo(other.key());
  }
}
