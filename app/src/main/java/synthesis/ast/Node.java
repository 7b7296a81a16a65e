package synthesis.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Operator applied to an ordered list of children. While a grammar template is being expanded some
 * children may be {@link Placeholder}s ("holes"); a finished program has none.
 *
 * <p>Nodes are immutable. {@link #replaceChildren} returns a new node.
 */
public sealed class Node implements Tree permits SymmetricNode {
  private final String name;
  private final List<Term> children;

  public Node(String name, List<? extends Term> children) {
    this.name = Objects.requireNonNull(name, "name");
    this.children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public static Node of(String name, Term... children) {
    return new Node(name, Arrays.asList(children));
  }

  public String name() {
    return name;
  }

  public List<Term> children() {
    return children;
  }

  /** Positions of the children that are placeholders, in ascending order. */
  public List<Integer> holeIndices() {
    List<Integer> indices = new ArrayList<>();
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) instanceof Placeholder) {
        indices.add(i);
      }
    }
    return List.copyOf(indices);
  }

  /** The placeholder children, in child order. */
  public List<Placeholder> holes() {
    List<Placeholder> holes = new ArrayList<>();
    for (Term child : children) {
      if (child instanceof Placeholder placeholder) {
        holes.add(placeholder);
      }
    }
    return List.copyOf(holes);
  }

  @Override
  public boolean isComplete() {
    for (Term child : children) {
      if (!child.isComplete()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a copy of this node in which the child at {@code ids.get(i)} is replaced by {@code
   * replacements.get(i)}.
   *
   * @throws IllegalArgumentException if the two lists differ in length or an index is out of range
   */
  public Node replaceChildren(List<Integer> ids, List<? extends Term> replacements) {
    Objects.requireNonNull(ids, "ids");
    Objects.requireNonNull(replacements, "replacements");
    if (ids.size() != replacements.size()) {
      throw new IllegalArgumentException(
          "Expected "
              + ids.size()
              + " replacements for positions "
              + ids
              + " but got "
              + replacements.size());
    }
    Set<Integer> seen = new HashSet<>();
    List<Term> updated = new ArrayList<>(children);
    Iterator<? extends Term> repl = replacements.iterator();
    for (int id : ids) {
      if (id < 0 || id >= children.size()) {
        throw new IllegalArgumentException(
            "Child position " + id + " out of range for " + name + "/" + children.size());
      }
      if (!seen.add(id)) {
        throw new IllegalArgumentException("Child position " + id + " replaced twice");
      }
      updated.set(id, Objects.requireNonNull(repl.next(), "replacement"));
    }
    return withChildren(updated);
  }

  /** Same operator over new children; subclasses keep their own kind. */
  protected Node withChildren(List<Term> newChildren) {
    return new Node(name, newChildren);
  }

  @Override
  public TreeKey key() {
    List<TreeKey> keys = new ArrayList<>(children.size());
    for (Term child : children) {
      keys.add(child.key());
    }
    return new TreeKey(name, keys);
  }

  @Override
  public String render() {
    StringBuilder sb = new StringBuilder(name).append('(');
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(children.get(i).render());
    }
    return sb.append(')').toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Node other = (Node) o;
    return name.equals(other.name) && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), name, children);
  }

  @Override
  public String toString() {
    return render();
  }
}
