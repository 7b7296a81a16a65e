package synthesis.pipeline;

import java.util.Objects;
import java.util.Optional;
import synthesis.ast.Tree;

/** Outcome of a synthesis run. */
public record SynthesisResult(
    Tree solution, long candidatesTried, long elapsedMillis, String terminationReason) {

  public static final String SOLVED = "solved";
  public static final String TIME_BUDGET_EXCEEDED = "time_budget_exceeded";
  public static final String SEARCH_SPACE_EXHAUSTED = "search_space_exhausted";

  public SynthesisResult {
    Objects.requireNonNull(terminationReason, "terminationReason");
    if (SOLVED.equals(terminationReason) != (solution != null)) {
      throw new IllegalArgumentException(
          "solution must be present exactly when the run is solved: " + terminationReason);
    }
  }

  public boolean solved() {
    return solution != null;
  }

  public Optional<Tree> solutionIfAny() {
    return Optional.ofNullable(solution);
  }
}
