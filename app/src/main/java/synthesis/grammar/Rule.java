package synthesis.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import synthesis.ast.Node;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.ast.Value;
import synthesis.constraint.Constraint;

/**
 * Production rule {@code lhs := rhs}. The right-hand side is a leaf {@link Value}, a {@link Node}
 * template whose direct children may be {@link Symbol}s, or a single {@link Symbol} (an alias).
 *
 * <p>The rule's constraints are checked against each fully substituted result of the rule. {@link
 * Symbol#self()} placeholders in the template are replaced by {@code lhs} here, once.
 */
public record Rule(Symbol lhs, Term rhs, List<Constraint> constraints) {

  public Rule {
    Objects.requireNonNull(lhs, "lhs");
    Objects.requireNonNull(rhs, "rhs");
    constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints"));
    if (lhs.isSelf()) {
      throw new IllegalArgumentException("left-hand side cannot be the self placeholder");
    }
    if (!lhs.constraints().isEmpty()) {
      throw new IllegalArgumentException(
          "left-hand side must be a bare symbol, got " + lhs.render());
    }
    rhs = resolve(lhs, rhs);
  }

  public static Rule of(Symbol lhs, Term rhs, Constraint... constraints) {
    return new Rule(lhs, rhs, Symbol.listOf(constraints));
  }

  public boolean accepts(Tree tree) {
    return Constraint.allAccept(constraints, tree);
  }

  private static Term resolve(Symbol lhs, Term rhs) {
    if (rhs instanceof Symbol symbol) {
      if (symbol.isSelf()) {
        throw new IllegalArgumentException("rule " + lhs.name() + " aliases itself");
      }
      return symbol;
    }
    if (rhs instanceof Value) {
      return rhs;
    }
    if (rhs instanceof Node template) {
      List<Integer> ids = new ArrayList<>();
      List<Term> replacements = new ArrayList<>();
      List<Term> children = template.children();
      for (int i = 0; i < children.size(); i++) {
        Term child = children.get(i);
        if (child instanceof Symbol symbol) {
          if (symbol.isSelf()) {
            ids.add(i);
            replacements.add(lhs.withConstraints(symbol.constraints()));
          }
        } else if (!child.isComplete()) {
          throw new IllegalArgumentException(
              "placeholders must be direct children of the template: " + template.render());
        }
      }
      return ids.isEmpty() ? template : template.replaceChildren(ids, replacements);
    }
    throw new IllegalArgumentException("Unsupported right-hand side: " + rhs.render());
  }

  @Override
  public String toString() {
    String constr =
        constraints.isEmpty()
            ? ""
            : ": " + constraints.stream().map(String::valueOf).collect(Collectors.joining(", "));
    return lhs + " \t:= " + rhs.render() + constr;
  }
}
