package synthesis.enumerate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import synthesis.ast.IntValue;
import synthesis.ast.Node;
import synthesis.ast.SymmetricNode;
import synthesis.ast.Term;
import synthesis.ast.Tree;
import synthesis.ast.Variable;
import synthesis.constraint.DistinctChildren;
import synthesis.constraint.Dynamic;
import synthesis.grammar.Grammar;
import synthesis.grammar.Symbol;

final class BottomUpEnumeratorTest {

  private static final Symbol A = Symbol.of("A");
  private static final Symbol VAL = Symbol.of("val");

  private static Grammar grammar(boolean symmetricAdd) {
    Node add = symmetricAdd ? SymmetricNode.of("add", A, A) : Node.of("add", A, A);
    return Grammar.builder(A)
        .add(VAL, IntValue.of(0))
        .add(VAL, IntValue.of(1))
        .add(VAL, Variable.of("x"))
        .add(A, VAL)
        .add(A, add, new DistinctChildren(), new Dynamic())
        .build();
  }

  private static List<String> rendered(Iterator<Tree> trees) {
    return ImmutableList.copyOf(trees).stream().map(Term::render).toList();
  }

  @Test
  void depthTwoKeepsOnlyDistinctDynamicSums() {
    List<String> programs =
        rendered(grammar(false).enumerateBottomUp(2, new EquivalenceScreen()));

    assertEquals(
        List.of("0", "1", "x", "add(0, x)", "add(1, x)", "add(x, 0)", "add(x, 1)"), programs);
    assertFalse(programs.contains("add(0, 0)"));
    assertFalse(programs.contains("add(0, 1)"));
    assertFalse(programs.contains("add(x, x)"));
  }

  @Test
  void symmetricOperatorsAreScreenedOnce() {
    EquivalenceScreen screen = new EquivalenceScreen();

    List<String> programs = rendered(grammar(true).enumerateBottomUp(2, screen));

    assertEquals(List.of("0", "1", "x", "add(0, x)", "add(1, x)"), programs);
    assertEquals(2, screen.duplicatesRejected());
    assertEquals(5, screen.size());
  }

  @Test
  void enumerationIsDeterministic() {
    List<String> first = rendered(grammar(true).enumerateUpTo(3, new EquivalenceScreen()));
    List<String> second = rendered(grammar(true).enumerateUpTo(3, new EquivalenceScreen()));

    assertEquals(first, second);
  }

  @Test
  void deeperBoundsProduceSupersets() {
    Grammar grammar = grammar(false);
    for (int depth = 1; depth < 4; depth++) {
      Set<Tree> shallow = new HashSet<>();
      grammar.enumerateBottomUp(depth, new EquivalenceScreen()).forEachRemaining(shallow::add);
      Set<Tree> deep = new HashSet<>();
      grammar.enumerateBottomUp(depth + 1, new EquivalenceScreen()).forEachRemaining(deep::add);

      assertTrue(deep.containsAll(shallow), "depth " + depth);
    }
  }

  @Test
  void foreverNeverRepeatsAProgram() {
    Iterator<Tree> programs = grammar(true).enumerateForever();
    List<Tree> first = ImmutableList.copyOf(Iterators.limit(programs, 300));

    assertEquals(300, first.size());
    assertEquals(first.size(), new HashSet<>(first).size());
  }

  @Test
  void upToVisitsDepthsInOrder() {
    List<String> programs = rendered(grammar(false).enumerateUpTo(2, new EquivalenceScreen()));

    assertEquals(
        List.of("0", "1", "x", "add(0, x)", "add(1, x)", "add(x, 0)", "add(x, 1)"), programs);
  }

  @Test
  void depthZeroYieldsNothing() {
    assertFalse(grammar(false).enumerateBottomUp(0, new EquivalenceScreen()).hasNext());
    assertFalse(grammar(false).enumerateUpTo(0, new EquivalenceScreen()).hasNext());
    assertThrows(
        IllegalArgumentException.class,
        () -> grammar(false).enumerateUpTo(-1, new EquivalenceScreen()));
  }

  @Test
  void stopConditionEndsEnumerationOfFiniteLanguage() {
    Symbol start = Symbol.of("S");
    Grammar grammar = Grammar.builder(start).add(start, IntValue.of(1)).build();
    AtomicBoolean stop = new AtomicBoolean();
    Iterator<Tree> programs = grammar.enumerateForever(new EquivalenceScreen(), stop::get);

    assertEquals(IntValue.of(1), programs.next());
    stop.set(true);

    assertFalse(assertTimeoutPreemptively(Duration.ofSeconds(5), programs::hasNext));
  }

  @Test
  void stopConditionIsIgnoredWhileProgramsKeepComing() {
    List<String> programs =
        rendered(grammar(false).enumerateUpTo(2, new EquivalenceScreen(), () -> false));

    assertEquals(7, programs.size());
  }

  @Test
  void sharedScreenSuppressesProgramsSeenEarlier() {
    EquivalenceScreen screen = new EquivalenceScreen();
    Grammar grammar = grammar(false);

    assertEquals(3, Iterators.size(grammar.enumerateBottomUp(1, screen)));
    assertEquals(
        List.of("add(0, x)", "add(1, x)", "add(x, 0)", "add(x, 1)"),
        rendered(grammar.enumerateBottomUp(2, screen)));
  }
}
