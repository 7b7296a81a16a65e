package synthesis.pipeline;

import java.util.Optional;
import java.util.function.BooleanSupplier;
import synthesis.ast.Tree;

/**
 * Proposes candidate programs.
 *
 * @param <F> feedback the oracle reports for a wrong guess
 */
public interface Guesser<F> {

  /** Next candidate, or empty once the search space is exhausted. */
  Optional<Tree> nextGuess();

  /**
   * Next candidate, giving up with an empty result once {@code outOfTime} holds. Guessers that can
   * spend long stretches without producing a candidate should override this.
   */
  default Optional<Tree> nextGuess(BooleanSupplier outOfTime) {
    return nextGuess();
  }

  void feedback(Tree guess, F feedback);
}
