package d20;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class SelectorTest {

  @Test
  public void comparisonSelectors() {
    FakeDicePool pool = new FakeDicePool(3, 5, 5, 1);

    assertThat(Selector.exact(5).select(pool)).containsExactly(1, 2).inOrder();
    assertThat(Selector.lessThan(3).select(pool)).containsExactly(3);
    assertThat(Selector.greaterThan(3).select(pool)).containsExactly(1, 2).inOrder();
    assertThat(Selector.exact(6).select(pool)).isEmpty();
  }

  @Test
  public void highestBreaksTiesByRollOrder() {
    FakeDicePool pool = new FakeDicePool(3, 5, 5, 1);

    assertThat(Selector.highest(1).select(pool)).containsExactly(1);
    assertThat(Selector.highest(2).select(pool)).containsExactly(1, 2).inOrder();
    assertThat(Selector.highest(3).select(pool)).containsExactly(0, 1, 2).inOrder();
  }

  @Test
  public void lowest() {
    FakeDicePool pool = new FakeDicePool(2, 1, 2, 6);

    assertThat(Selector.lowest(1).select(pool)).containsExactly(1);
    assertThat(Selector.lowest(2).select(pool)).containsExactly(0, 1).inOrder();
  }

  @Test
  public void countLargerThanPool() {
    FakeDicePool pool = new FakeDicePool(4, 2);

    assertThat(Selector.highest(10).select(pool)).containsExactly(0, 1).inOrder();
    assertThat(Selector.lowest(0).select(pool)).isEmpty();
  }

  @Test
  public void droppedDiceAreNeverSelected() {
    FakeDicePool pool = new FakeDicePool(3, 6, 5, 6);
    pool.setKept(1, false);

    assertThat(Selector.highest(1).select(pool)).containsExactly(3);
    assertThat(Selector.exact(6).select(pool)).containsExactly(3);
    assertThat(Selector.lowest(4).select(pool)).containsExactly(0, 2, 3).inOrder();
  }

  @Test
  public void matches() {
    assertThat(Selector.exact(4).matches(4)).isTrue();
    assertThat(Selector.lessThan(4).matches(4)).isFalse();
    assertThat(Selector.greaterThan(4).matches(5)).isTrue();
    assertThrows(IllegalStateException.class, () -> Selector.highest(1).matches(4));
  }

  @Test
  public void negativeCount() {
    assertThrows(IllegalArgumentException.class, () -> Selector.lowest(-1));
  }

  @Test
  public void parseAndRepr() {
    assertThat(Selector.Type.parse("h")).hasValue(Selector.Type.HIGHEST);
    assertThat(Selector.Type.parse("")).hasValue(Selector.Type.EXACT);
    assertThat(Selector.Type.parse("x")).isEmpty();
    assertThat(Selector.highest(3).toString()).isEqualTo("h3");
    assertThat(Selector.lessThan(2).toString()).isEqualTo("<2");
    assertThat(Selector.exact(4).toString()).isEqualTo("4");
  }
}
