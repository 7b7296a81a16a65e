package synthesis.enumerate;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import synthesis.ast.Node;
import synthesis.ast.Placeholder;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.ast.Value;
import synthesis.grammar.Grammar;
import synthesis.grammar.Rule;
import synthesis.grammar.Symbol;

/**
 * Expands grammar symbols into every complete tree they produce within a depth bound.
 *
 * <p>Depth is consumed once per level of {@link Node} nesting. Resolving a symbol to its rules, or
 * following an alias rule, is free, and leaf values are produced at any positive depth. Results
 * come out in a fixed order: rules in grammar order, template placeholders combined as a Cartesian
 * product with the leftmost placeholder varying slowest.
 */
public final class SubstitutionEngine {
  private final Grammar grammar;

  public SubstitutionEngine(Grammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
  }

  /** Trees produced by any rule of {@code symbol}, filtered by the symbol's site constraints. */
  public Iterator<Tree> expand(Symbol symbol, int depth) {
    Objects.requireNonNull(symbol, "symbol");
    if (depth <= 0) {
      return Collections.emptyIterator();
    }
    Iterator<Tree> produced =
        Iterators.concat(
            Iterators.transform(grammar.rulesFor(symbol).iterator(), rule -> expand(rule, depth)));
    if (symbol.constraints().isEmpty()) {
      return produced;
    }
    return Iterators.filter(produced, symbol::accepts);
  }

  /** Fully substituted results of {@code rule}, filtered by the rule's constraints. */
  public Iterator<Tree> expand(Rule rule, int depth) {
    Objects.requireNonNull(rule, "rule");
    if (depth <= 0) {
      return Collections.emptyIterator();
    }
    Term rhs = rule.rhs();
    Iterator<Tree> produced;
    if (rhs instanceof Symbol alias) {
      produced = expand(alias, depth);
    } else if (rhs instanceof Node template) {
      produced = substitute(template, depth);
    } else if (rhs instanceof Value value) {
      produced = Iterators.singletonIterator(value);
    } else {
      throw new IllegalStateException("Unsupported right-hand side: " + rhs.render());
    }
    if (rule.constraints().isEmpty()) {
      return produced;
    }
    return Iterators.filter(produced, rule::accepts);
  }

  private Iterator<Tree> substitute(Node template, int depth) {
    List<Integer> holeIds = template.holeIndices();
    if (holeIds.isEmpty()) {
      return Iterators.singletonIterator(template);
    }
    return new Combinations(template, holeIds, template.holes(), depth - 1);
  }

  /**
   * Walks the Cartesian product of the placeholders' expansions with an odometer over indices. The
   * expansions themselves are computed on the first pull.
   */
  private final class Combinations extends AbstractIterator<Tree> {
    private final Node template;
    private final List<Integer> holeIds;
    private final List<Placeholder> holes;
    private final int childDepth;
    private List<List<Tree>> options;
    private int[] idx;

    Combinations(Node template, List<Integer> holeIds, List<Placeholder> holes, int childDepth) {
      this.template = template;
      this.holeIds = holeIds;
      this.holes = holes;
      this.childDepth = childDepth;
    }

    @Override
    protected Tree computeNext() {
      if (options == null) {
        options = expandHoles();
        for (List<Tree> option : options) {
          if (option.isEmpty()) {
            return endOfData();
          }
        }
        idx = new int[options.size()];
      } else if (!advance()) {
        return endOfData();
      }
      List<Tree> fill = new ArrayList<>(idx.length);
      for (int i = 0; i < idx.length; i++) {
        fill.add(options.get(i).get(idx[i]));
      }
      return template.replaceChildren(holeIds, fill);
    }

    private boolean advance() {
      int p = idx.length - 1;
      while (p >= 0) {
        idx[p]++;
        if (idx[p] < options.get(p).size()) {
          return true;
        }
        idx[p] = 0;
        p--;
      }
      return false;
    }

    private List<List<Tree>> expandHoles() {
      // Equal symbols at the same depth expand to the same sequence.
      Map<Symbol, List<Tree>> memo = new HashMap<>();
      List<List<Tree>> expanded = new ArrayList<>(holes.size());
      for (Placeholder hole : holes) {
        if (!(hole instanceof Symbol symbol)) {
          throw new IllegalStateException("Unsupported placeholder: " + hole.render());
        }
        List<Tree> trees = memo.get(symbol);
        if (trees == null) {
          trees = ImmutableList.copyOf(expand(symbol, childDepth));
          memo.put(symbol, trees);
        }
        expanded.add(trees);
      }
      return expanded;
    }
  }
}
