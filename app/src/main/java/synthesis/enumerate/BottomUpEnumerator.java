package synthesis.enumerate;

import com.google.common.collect.AbstractIterator;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.ast.Tree;
import synthesis.grammar.Grammar;

/**
 * Bottom-up enumeration of a grammar's language: candidates from the {@link SubstitutionEngine}
 * pass through an {@link EnumerationFilter} and only novel programs are yielded. All sequences are
 * pull-driven; a caller cancels by no longer advancing the iterator, or by a stop condition that
 * ends the sequence even while no novel program turns up.
 */
public final class BottomUpEnumerator {
  private static final Logger LOG = LoggerFactory.getLogger(BottomUpEnumerator.class);

  private final Grammar grammar;
  private final SubstitutionEngine engine;

  public BottomUpEnumerator(Grammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.engine = new SubstitutionEngine(grammar);
  }

  public Iterator<Tree> enumerateBottomUp(int depth, EnumerationFilter screen) {
    return enumerateBottomUp(depth, screen, () -> false);
  }

  private Iterator<Tree> enumerateBottomUp(
      int depth, EnumerationFilter screen, BooleanSupplier stopRequested) {
    Objects.requireNonNull(screen, "screen");
    Iterator<Tree> candidates = engine.expand(grammar.start(), depth);
    return new AbstractIterator<>() {
      @Override
      protected Tree computeNext() {
        while (candidates.hasNext()) {
          Tree candidate = candidates.next();
          if (screen.isUsefulProgram(candidate)) {
            screen.registerProgram(candidate);
            return candidate;
          }
          screen.programRejected(candidate);
          if (stopRequested.getAsBoolean()) {
            break;
          }
        }
        return endOfData();
      }
    };
  }

  /** Depths 0 through {@code maxDepth}, one screen shared across all of them. */
  public Iterator<Tree> enumerateUpTo(int maxDepth, EnumerationFilter screen) {
    return enumerateUpTo(maxDepth, screen, () -> false);
  }

  /**
   * Like {@link #enumerateUpTo(int, EnumerationFilter)}, but ends early once {@code stopRequested}
   * holds. It is checked before each new depth and after each screened-out candidate.
   */
  public Iterator<Tree> enumerateUpTo(
      int maxDepth, EnumerationFilter screen, BooleanSupplier stopRequested) {
    Objects.requireNonNull(screen, "screen");
    Objects.requireNonNull(stopRequested, "stopRequested");
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
    }
    return new AbstractIterator<>() {
      private int depth = -1;
      private long emittedAtDepth;
      private Iterator<Tree> current = Collections.emptyIterator();

      @Override
      protected Tree computeNext() {
        while (!current.hasNext()) {
          if (depth >= 0) {
            LOG.debug("Depth {} yielded {} new program(s)", depth, emittedAtDepth);
          }
          if (depth >= maxDepth) {
            return endOfData();
          }
          if (stopRequested.getAsBoolean()) {
            LOG.debug("Enumeration stopped before depth {}", depth + 1);
            return endOfData();
          }
          depth++;
          emittedAtDepth = 0;
          LOG.debug("Enumerating programs at depth {}", depth);
          current = enumerateBottomUp(depth, screen, stopRequested);
        }
        emittedAtDepth++;
        return current.next();
      }
    };
  }

  /** Effectively unbounded: depth only stops growing at {@link Integer#MAX_VALUE}. */
  public Iterator<Tree> enumerateForever(EnumerationFilter screen) {
    return enumerateUpTo(Integer.MAX_VALUE, screen);
  }

  public Iterator<Tree> enumerateForever(EnumerationFilter screen, BooleanSupplier stopRequested) {
    return enumerateUpTo(Integer.MAX_VALUE, screen, stopRequested);
  }
}
