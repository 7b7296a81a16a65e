package synthesis.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import synthesis.ast.IntValue;
import synthesis.ast.Node;
import synthesis.ast.Tree;
import synthesis.ast.Variable;
import synthesis.eval.TreeEvaluator;
import synthesis.eval.UnboundVariableException;
import synthesis.eval.UnknownOperatorException;
import synthesis.examples.ArithmeticGrammar;
import synthesis.examples.ArithmeticOperators;
import synthesis.grammar.Grammar;
import synthesis.grammar.Symbol;

final class SynthesisTest {

  private static final TreeEvaluator EVALUATOR = new TreeEvaluator(ArithmeticOperators.standard());
  private static final SynthesisOptions GENEROUS =
      SynthesisOptions.defaults().withTimeBudget(Duration.ofSeconds(60)).withProgressInterval(0);

  /** Guesser over a fixed list that records the feedback it receives. */
  private static final class ListGuesser implements Guesser<Example> {
    private final Iterator<Tree> guesses;
    private final List<Example> feedback = new ArrayList<>();

    ListGuesser(Tree... guesses) {
      this.guesses = List.of(guesses).iterator();
    }

    @Override
    public Optional<Tree> nextGuess() {
      return guesses.hasNext() ? Optional.of(guesses.next()) : Optional.empty();
    }

    @Override
    public void feedback(Tree guess, Example example) {
      feedback.add(example);
    }
  }

  private static SynthesisContext arithmeticContext() {
    return new SynthesisContext(
        ArithmeticGrammar.build(EVALUATOR), EVALUATOR, ArithmeticGrammar.DEFAULT_VARIABLES);
  }

  @Test
  void findsProgramForDefaultExamples() {
    SynthesisContext ctx = arithmeticContext();
    InOutExampleOracle oracle = new InOutExampleOracle(ArithmeticGrammar.defaultExamples(), ctx);
    EnumerativeGuesser<Example> guesser = new EnumerativeGuesser<>(ctx, 3);

    SynthesisResult result = new Synthesis<>(guesser, oracle, GENEROUS.withMaxDepth(3)).run();

    assertTrue(result.solved(), result.terminationReason());
    assertEquals(SynthesisResult.SOLVED, result.terminationReason());
    assertTrue(oracle.assess(result.solution()).correct());
    assertTrue(result.candidatesTried() > 0);
    assertEquals(result.candidatesTried(), guesser.screen().size());
  }

  @Test
  void oracleReportsFirstFailingExample() {
    SynthesisContext ctx = arithmeticContext();
    List<Example> examples = ArithmeticGrammar.defaultExamples();
    InOutExampleOracle oracle = new InOutExampleOracle(examples, ctx);

    Oracle.Assessment<Example> wrong =
        oracle.assess(Node.of("sub", Variable.of("x"), Variable.of("y")));
    Oracle.Assessment<Example> right =
        oracle.assess(
            Node.of("sub", Node.of("mul", Variable.of("x"), Variable.of("y")), IntValue.of(1)));

    assertFalse(wrong.correct());
    assertEquals(examples.get(2), wrong.feedback());
    assertTrue(right.correct());
    assertNull(right.feedback());
  }

  @Test
  void reportsExhaustedSearchSpace() {
    SynthesisContext ctx = arithmeticContext();
    InOutExampleOracle oracle =
        new InOutExampleOracle(List.of(new Example(Map.of("x", 1L, "y", 1L), 1_000_003L)), ctx);

    SynthesisResult result =
        new Synthesis<>(new EnumerativeGuesser<Example>(ctx, 1), oracle, GENEROUS).run();

    assertFalse(result.solved());
    assertEquals(SynthesisResult.SEARCH_SPACE_EXHAUSTED, result.terminationReason());
    assertEquals(5, result.candidatesTried());
    assertTrue(result.solutionIfAny().isEmpty());
  }

  @Test
  void stopsWhenTimeBudgetIsSpent() {
    SynthesisContext ctx = arithmeticContext();
    InOutExampleOracle oracle =
        new InOutExampleOracle(List.of(new Example(Map.of("x", 1L, "y", 1L), 0.5)), ctx);
    SynthesisOptions tight = GENEROUS.withTimeBudget(Duration.ofMillis(50));

    SynthesisResult result =
        new Synthesis<>(new EnumerativeGuesser<Example>(ctx), oracle, tight).run();

    assertEquals(SynthesisResult.TIME_BUDGET_EXCEEDED, result.terminationReason());
    assertFalse(result.solved());
  }

  @Test
  void feedsWrongGuessesBackAndSkipsArithmeticFailures() {
    SynthesisContext ctx = arithmeticContext();
    Example example = new Example(Map.of("x", 3L, "y", 0L), 3L);
    ListGuesser guesser =
        new ListGuesser(
            Node.of("floordiv", Variable.of("x"), Variable.of("y")),
            Variable.of("y"),
            Variable.of("x"));

    SynthesisResult result =
        new Synthesis<>(guesser, new InOutExampleOracle(List.of(example), ctx), GENEROUS).run();

    assertEquals(Variable.of("x"), result.solution());
    assertEquals(3, result.candidatesTried());
    assertEquals(List.of(example), guesser.feedback);
  }

  @Test
  void otherEvaluationFailuresEndTheRun() {
    SynthesisContext ctx = arithmeticContext();
    ListGuesser guesser = new ListGuesser(Node.of("nope", Variable.of("x")));
    InOutExampleOracle oracle =
        new InOutExampleOracle(List.of(new Example(Map.of("x", 1L), 1L)), ctx);

    assertThrows(
        UnknownOperatorException.class, () -> new Synthesis<>(guesser, oracle, GENEROUS).run());
  }

  @Test
  void unboundedSearchOverFiniteLanguageStillStopsOnTime() {
    Symbol start = Symbol.of("S");
    Grammar grammar = Grammar.builder(start).add(start, IntValue.of(1)).build();
    SynthesisContext ctx = new SynthesisContext(grammar, EVALUATOR, List.of("x"));
    InOutExampleOracle oracle =
        new InOutExampleOracle(List.of(new Example(Map.of("x", 1L), 2L)), ctx);
    SynthesisOptions tight = GENEROUS.withTimeBudget(Duration.ofMillis(100));

    SynthesisResult result =
        assertTimeoutPreemptively(
            Duration.ofSeconds(5),
            () -> new Synthesis<>(new EnumerativeGuesser<Example>(ctx), oracle, tight).run());

    assertEquals(SynthesisResult.TIME_BUDGET_EXCEEDED, result.terminationReason());
    assertEquals(1, result.candidatesTried());
  }

  @Test
  void unboundVariablesPropagateFromOracleAndRun() {
    SynthesisContext ctx = arithmeticContext();
    InOutExampleOracle oracle =
        new InOutExampleOracle(List.of(new Example(Map.of("x", 1L), 1L)), ctx);
    Tree readsZ = Node.of("add", Variable.of("z"), IntValue.of(1));

    UnboundVariableException fromOracle =
        assertThrows(UnboundVariableException.class, () -> oracle.assess(readsZ));
    assertEquals("z", fromOracle.variable());
    assertThrows(
        UnboundVariableException.class,
        () -> new Synthesis<>(new ListGuesser(readsZ), oracle, GENEROUS).run());
  }

  @Test
  void optionsRejectNonsense() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SynthesisOptions.defaults().withTimeBudget(Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class, () -> SynthesisOptions.defaults().withMaxDepth(-1));
    assertEquals(SynthesisOptions.defaults(), SynthesisOptions.normalize(null));
  }

  @Test
  void emptyGrammarExhaustsImmediately() {
    Grammar grammar = Grammar.builder(Symbol.of("S")).build();
    SynthesisContext ctx = new SynthesisContext(grammar, EVALUATOR, List.of("x"));

    SynthesisResult result =
        new Synthesis<>(
                new EnumerativeGuesser<Example>(ctx, 4),
                new InOutExampleOracle(List.of(), ctx),
                GENEROUS)
            .run();

    assertEquals(SynthesisResult.SEARCH_SPACE_EXHAUSTED, result.terminationReason());
    assertEquals(0, result.candidatesTried());
  }
}
