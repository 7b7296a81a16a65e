package synthesis.ast;

import java.util.List;
import java.util.Objects;

/**
 * Totally ordered key of a term: the head text followed by the keys of the children. Keys compare
 * head first, then children lexicographically, a shorter child list ordering before a longer one
 * with the same prefix.
 */
public record TreeKey(String head, List<TreeKey> children) implements Comparable<TreeKey> {

  public TreeKey {
    Objects.requireNonNull(head, "head");
    children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public static TreeKey leaf(String head) {
    return new TreeKey(head, List.of());
  }

  @Override
  public int compareTo(TreeKey other) {
    int cmp = head.compareTo(other.head);
    if (cmp != 0) {
      return cmp;
    }
    int shared = Math.min(children.size(), other.children.size());
    for (int i = 0; i < shared; i++) {
      cmp = children.get(i).compareTo(other.children.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(children.size(), other.children.size());
  }

  @Override
  public String toString() {
    if (children.isEmpty()) {
      return "(" + head + ")";
    }
    StringBuilder sb = new StringBuilder("(").append(head);
    for (TreeKey child : children) {
      sb.append(", ").append(child);
    }
    return sb.append(')').toString();
  }
}
