package synthesis.ast;

import com.google.common.collect.ImmutableMultiset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Node of a commutative operator. Once both sides are complete, equality and hash treat the
 * children as an unordered collection, so {@code add(a, b)} equals {@code add(b, a)}. While
 * placeholders remain the comparison is positional.
 */
public final class SymmetricNode extends Node {

  public SymmetricNode(String name, List<? extends Term> children) {
    super(name, children);
  }

  public static SymmetricNode of(String name, Term... children) {
    return new SymmetricNode(name, Arrays.asList(children));
  }

  @Override
  protected Node withChildren(List<Term> newChildren) {
    return new SymmetricNode(name(), newChildren);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SymmetricNode other)) {
      return false;
    }
    if (isComplete() && other.isComplete()) {
      return name().equals(other.name())
          && ImmutableMultiset.copyOf(children())
              .equals(ImmutableMultiset.copyOf(other.children()));
    }
    return super.equals(o);
  }

  @Override
  public int hashCode() {
    if (!isComplete()) {
      return super.hashCode();
    }
    return Objects.hash(SymmetricNode.class, name(), ImmutableMultiset.copyOf(children()));
  }
}
