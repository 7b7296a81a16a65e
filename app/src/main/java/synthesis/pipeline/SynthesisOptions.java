package synthesis.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Knobs of a synthesis run.
 *
 * @param timeBudget wall-clock budget for the guess/check loop
 * @param maxDepth enumeration depth bound; {@code 0} means unbounded
 * @param progressInterval log progress every this many candidates; {@code 0} disables it
 */
public record SynthesisOptions(Duration timeBudget, int maxDepth, int progressInterval) {
  private static final SynthesisOptions DEFAULTS =
      new SynthesisOptions(Duration.ofMillis(500), 0, 10_000);

  public SynthesisOptions {
    Objects.requireNonNull(timeBudget, "timeBudget");
    if (timeBudget.isNegative() || timeBudget.isZero()) {
      throw new IllegalArgumentException("timeBudget must be positive: " + timeBudget);
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
    }
    if (progressInterval < 0) {
      throw new IllegalArgumentException("progressInterval must be non-negative");
    }
  }

  public static SynthesisOptions defaults() {
    return DEFAULTS;
  }

  public static SynthesisOptions normalize(SynthesisOptions options) {
    return options == null ? DEFAULTS : options;
  }

  public SynthesisOptions withTimeBudget(Duration timeBudget) {
    return new SynthesisOptions(timeBudget, maxDepth, progressInterval);
  }

  public SynthesisOptions withMaxDepth(int maxDepth) {
    return new SynthesisOptions(timeBudget, maxDepth, progressInterval);
  }

  public SynthesisOptions withProgressInterval(int progressInterval) {
    return new SynthesisOptions(timeBudget, maxDepth, progressInterval);
  }
}
