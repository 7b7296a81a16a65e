package synthesis.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import synthesis.ast.Placeholder;
import synthesis.ast.Tree;
import synthesis.ast.TreeKey;
import synthesis.constraint.Constraint;

/**
 * Nonterminal of a grammar, as used at one site. The constraints attached here filter every tree
 * produced for this placeholder; symbols with the same name share one rule set whatever their
 * constraints.
 *
 * <p>{@code isSelf} marks the placeholder returned by {@link #self()}; no symbol built from a name
 * is ever a self reference, whatever the name.
 */
public record Symbol(String name, List<Constraint> constraints, boolean isSelf)
    implements Placeholder {
  private static final String SELF_NAME = "<self>";

  public Symbol {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("symbol name must not be blank");
    }
    constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints"));
  }

  public Symbol(String name, List<Constraint> constraints) {
    this(name, constraints, false);
  }

  public static Symbol of(String name) {
    return new Symbol(name, List.of());
  }

  /**
   * Stands for the left-hand symbol of the rule it is used in. {@link Rule} resolves it at
   * construction, keeping any constraints attached to the placeholder.
   */
  public static Symbol self() {
    return new Symbol(SELF_NAME, List.of(), true);
  }

  /** New symbol with the same name and {@code constraint} appended. */
  public Symbol with(Constraint constraint) {
    Objects.requireNonNull(constraint, "constraint");
    List<Constraint> extended = new ArrayList<>(constraints);
    extended.add(constraint);
    return new Symbol(name, extended, isSelf);
  }

  public Symbol with(Constraint... more) {
    Symbol result = this;
    for (Constraint constraint : more) {
      result = result.with(constraint);
    }
    return result;
  }

  /** Same name, the given constraints instead of this symbol's. */
  Symbol withConstraints(List<Constraint> replacement) {
    return new Symbol(name, replacement, isSelf);
  }

  public boolean accepts(Tree tree) {
    return Constraint.allAccept(constraints, tree);
  }

  @Override
  public TreeKey key() {
    return TreeKey.leaf(name);
  }

  @Override
  public String render() {
    if (constraints.isEmpty()) {
      return name;
    }
    return name
        + ": "
        + constraints.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return render();
  }

  static List<Constraint> listOf(Constraint... constraints) {
    return List.copyOf(Arrays.asList(constraints));
  }
}
