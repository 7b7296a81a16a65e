package synthesis.pipeline;

import java.util.Objects;
import synthesis.ast.Tree;

/**
 * Judges candidate programs.
 *
 * @param <F> feedback produced for a wrong candidate
 */
public interface Oracle<F> {

  Assessment<F> assess(Tree candidate);

  /** Verdict on one candidate; {@code feedback} is null for a correct one. */
  record Assessment<F>(boolean correct, F feedback) {

    public static <F> Assessment<F> accepted() {
      return new Assessment<>(true, null);
    }

    public static <F> Assessment<F> rejected(F feedback) {
      return new Assessment<>(false, Objects.requireNonNull(feedback, "feedback"));
    }
  }
}
