package synthesis.pipeline;

import com.google.common.base.Stopwatch;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import synthesis.ast.Tree;
import synthesis.pipeline.Oracle.Assessment;

/**
 * Guess-and-check loop: pulls candidates from a {@link Guesser}, asks the {@link Oracle} about
 * each, and stops at the first correct one, when the time budget is spent, or when the guesser runs
 * dry. The guesser is handed the deadline too, so a search that stops producing candidates still
 * ends on time.
 *
 * <p>An {@link ArithmeticException} raised by an operator (overflow, division by zero) marks that
 * candidate as wrong. Other evaluation failures end the run.
 */
public final class Synthesis<F> {
  private static final Logger LOG = LoggerFactory.getLogger(Synthesis.class);

  private final Guesser<F> guesser;
  private final Oracle<F> oracle;
  private final SynthesisOptions options;

  public Synthesis(Guesser<F> guesser, Oracle<F> oracle, SynthesisOptions options) {
    this.guesser = Objects.requireNonNull(guesser, "guesser");
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.options = SynthesisOptions.normalize(options);
  }

  public SynthesisResult run() {
    Stopwatch timer = Stopwatch.createStarted();
    long budgetMs = options.timeBudget().toMillis();
    long tried = 0;
    BooleanSupplier outOfTime = () -> elapsedMillis(timer) >= budgetMs;

    while (!outOfTime.getAsBoolean()) {
      Optional<Tree> next = guesser.nextGuess(outOfTime);
      if (next.isEmpty()) {
        if (outOfTime.getAsBoolean()) {
          break;
        }
        LOG.info("Search space exhausted after {} candidate(s)", tried);
        return new SynthesisResult(
            null, tried, elapsedMillis(timer), SynthesisResult.SEARCH_SPACE_EXHAUSTED);
      }
      Tree guess = next.get();
      tried++;
      if (options.progressInterval() > 0 && tried % options.progressInterval() == 0) {
        LOG.info("{} candidates tried ({} ms), current: {}", tried, elapsedMillis(timer), guess);
      }

      Assessment<F> assessment;
      try {
        assessment = oracle.assess(guess);
      } catch (ArithmeticException ex) {
        LOG.debug("Candidate {} failed to evaluate: {}", guess, ex.getMessage());
        continue;
      }
      if (assessment.correct()) {
        LOG.info("Correct guess after {} candidate(s): {}", tried, guess);
        return new SynthesisResult(guess, tried, elapsedMillis(timer), SynthesisResult.SOLVED);
      }
      guesser.feedback(guess, assessment.feedback());
    }

    LOG.warn("Synthesis terminated early: time budget of {} ms exceeded", budgetMs);
    return new SynthesisResult(
        null, tried, elapsedMillis(timer), SynthesisResult.TIME_BUDGET_EXCEEDED);
  }

  private static long elapsedMillis(Stopwatch timer) {
    return timer.elapsed(TimeUnit.MILLISECONDS);
  }
}
