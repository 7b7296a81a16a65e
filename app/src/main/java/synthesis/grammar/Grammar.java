package synthesis.grammar;

import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.ast.Node;
import synthesis.ast.Placeholder;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.constraint.Constraint;
import synthesis.enumerate.BottomUpEnumerator;
import synthesis.enumerate.EnumerationFilter;
import synthesis.enumerate.EquivalenceScreen;

/**
 * Context-free grammar over syntax trees: rules grouped by left-hand symbol name, in insertion
 * order, plus a start symbol. Built through {@link Builder} and read-only afterwards.
 */
public final class Grammar {
  private static final Logger LOG = LoggerFactory.getLogger(Grammar.class);

  private final Symbol start;
  private final ImmutableListMultimap<String, Rule> rules;

  private Grammar(Symbol start, ImmutableListMultimap<String, Rule> rules) {
    this.start = start;
    this.rules = rules;
  }

  public static Builder builder(Symbol start) {
    return new Builder(start);
  }

  public Symbol start() {
    return start;
  }

  /** Rules for the symbol's name; site constraints on {@code symbol} are not considered. */
  public List<Rule> rulesFor(Symbol symbol) {
    return rules.get(symbol.name());
  }

  public List<Rule> rules() {
    return rules.values().asList();
  }

  public Set<String> symbolNames() {
    return rules.keySet();
  }

  /** Screened programs of exactly the given depth bound. */
  public Iterator<Tree> enumerateBottomUp(int depth, EnumerationFilter screen) {
    return new BottomUpEnumerator(this).enumerateBottomUp(depth, screen);
  }

  /** Screened programs for depth 0, 1, 2, ... up to and including {@code maxDepth}. */
  public Iterator<Tree> enumerateUpTo(int maxDepth, EnumerationFilter screen) {
    return new BottomUpEnumerator(this).enumerateUpTo(maxDepth, screen);
  }

  /** Bounded enumeration that also ends once {@code stopRequested} holds. */
  public Iterator<Tree> enumerateUpTo(
      int maxDepth, EnumerationFilter screen, BooleanSupplier stopRequested) {
    return new BottomUpEnumerator(this).enumerateUpTo(maxDepth, screen, stopRequested);
  }

  /** Unbounded, lazily computed stream of ever deeper programs sharing one screen. */
  public Iterator<Tree> enumerateForever(EnumerationFilter screen) {
    return new BottomUpEnumerator(this).enumerateForever(screen);
  }

  public Iterator<Tree> enumerateForever(EnumerationFilter screen, BooleanSupplier stopRequested) {
    return new BottomUpEnumerator(this).enumerateForever(screen, stopRequested);
  }

  public Iterator<Tree> enumerateForever() {
    return enumerateForever(new EquivalenceScreen());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Grammar:");
    for (Rule rule : rules.values()) {
      sb.append("\n  ").append(rule);
    }
    return sb.toString();
  }

  /** Collects rules; {@link #build()} freezes them. */
  public static final class Builder {
    private final Symbol start;
    private final List<Rule> rules = new ArrayList<>();

    private Builder(Symbol start) {
      this.start = Objects.requireNonNull(start, "start");
    }

    public Builder add(Rule rule) {
      rules.add(Objects.requireNonNull(rule, "rule"));
      return this;
    }

    public Builder add(Symbol lhs, Term rhs, Constraint... constraints) {
      return add(Rule.of(lhs, rhs, constraints));
    }

    /**
     * @throws IllegalArgumentException if alias rules form a cycle, which would recurse without
     *     ever consuming depth
     */
    public Grammar build() {
      ImmutableListMultimap.Builder<String, Rule> byName = ImmutableListMultimap.builder();
      for (Rule rule : rules) {
        byName.put(rule.lhs().name(), rule);
      }
      ImmutableListMultimap<String, Rule> frozen = byName.build();
      checkAliasCycles(frozen);
      warnUndefined(frozen);
      return new Grammar(start, frozen);
    }

    private void warnUndefined(ImmutableListMultimap<String, Rule> byName) {
      Set<String> missing = new LinkedHashSet<>();
      if (!byName.containsKey(start.name())) {
        missing.add(start.name());
      }
      for (Rule rule : byName.values()) {
        for (String ref : referencedNames(rule)) {
          if (!byName.containsKey(ref)) {
            missing.add(ref);
          }
        }
      }
      if (!missing.isEmpty()) {
        LOG.warn("Grammar references symbols without rules (they produce nothing): {}", missing);
      }
    }

    private static void checkAliasCycles(ImmutableListMultimap<String, Rule> byName) {
      Map<String, Set<String>> aliases = new HashMap<>();
      for (Rule rule : byName.values()) {
        if (rule.rhs() instanceof Symbol target) {
          aliases.computeIfAbsent(rule.lhs().name(), k -> new LinkedHashSet<>()).add(target.name());
        }
      }
      Set<String> done = new HashSet<>();
      for (String name : aliases.keySet()) {
        visit(name, aliases, new LinkedHashSet<>(), done);
      }
    }

    private static void visit(
        String name, Map<String, Set<String>> aliases, Set<String> path, Set<String> done) {
      if (done.contains(name)) {
        return;
      }
      if (!path.add(name)) {
        throw new IllegalArgumentException("Alias cycle through symbols " + path + " -> " + name);
      }
      for (String next : aliases.getOrDefault(name, Set.of())) {
        visit(next, aliases, path, done);
      }
      path.remove(name);
      done.add(name);
    }

    private static List<String> referencedNames(Rule rule) {
      List<String> names = new ArrayList<>();
      if (rule.rhs() instanceof Symbol symbol) {
        names.add(symbol.name());
      } else if (rule.rhs() instanceof Node node) {
        for (Placeholder hole : node.holes()) {
          names.add(hole.name());
        }
      }
      return names;
    }
  }
}
