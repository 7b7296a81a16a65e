package synthesis.pipeline;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import synthesis.ast.Tree;
import synthesis.enumerate.EquivalenceScreen;

/**
 * Guesses programs in bottom-up enumeration order, ignoring feedback. Each guesser owns a fresh
 * {@link EquivalenceScreen}, so constructing a new one restarts the search.
 *
 * <p>Once a deadline passed to {@link #nextGuess(BooleanSupplier)} fires, the enumeration ends and
 * no further guesses are produced.
 *
 * @param <F> feedback type, unused
 */
public final class EnumerativeGuesser<F> implements Guesser<F> {
  private final EquivalenceScreen screen = new EquivalenceScreen();
  private final Iterator<Tree> programs;
  private BooleanSupplier outOfTime = () -> false;

  /** @param maxDepth depth bound, or {@code 0} for an unbounded search */
  public EnumerativeGuesser(SynthesisContext ctx, int maxDepth) {
    Objects.requireNonNull(ctx, "ctx");
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
    }
    BooleanSupplier stop = () -> outOfTime.getAsBoolean();
    this.programs =
        maxDepth == 0
            ? ctx.grammar().enumerateForever(screen, stop)
            : ctx.grammar().enumerateUpTo(maxDepth, screen, stop);
  }

  public EnumerativeGuesser(SynthesisContext ctx) {
    this(ctx, 0);
  }

  @Override
  public Optional<Tree> nextGuess() {
    return programs.hasNext() ? Optional.of(programs.next()) : Optional.empty();
  }

  @Override
  public Optional<Tree> nextGuess(BooleanSupplier outOfTime) {
    this.outOfTime = Objects.requireNonNull(outOfTime, "outOfTime");
    try {
      return nextGuess();
    } finally {
      this.outOfTime = () -> false;
    }
  }

  @Override
  public void feedback(Tree guess, F feedback) {}

  public EquivalenceScreen screen() {
    return screen;
  }
}
