package d20;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableMap;

public class DistributionTest {

  private static final double TOLERANCE = 1e-9;

  @Test
  public void uniform() {
    Distribution d6 = Distribution.uniform(6);

    assertThat(d6.keys()).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 6.0).inOrder();
    assertThat(d6.get(3)).isWithin(TOLERANCE).of(1.0 / 6);
    assertThat(d6.get(7)).isEqualTo(0.0);
    assertThat(d6.has(7)).isFalse();
    assertThat(d6.min()).isEqualTo(1.0);
    assertThat(d6.max()).isEqualTo(6.0);
    assertThat(d6.size()).isEqualTo(6);
    assertThat(d6.mean()).isWithin(TOLERANCE).of(3.5);
    assertThat(d6.stddev()).isWithin(1e-6).of(Math.sqrt(35.0 / 12));
  }

  @Test
  public void constant() {
    Distribution five = Distribution.constant(5);

    assertThat(five.keys()).containsExactly(5.0);
    assertThat(five.get(5)).isEqualTo(1.0);
    assertThat(five.stddev()).isEqualTo(0.0);
    assertThat(Distribution.zero()).isEqualTo(Distribution.constant(0));
  }

  @Test
  public void negativeZeroIsZero() {
    Distribution zero = Distribution.constant(-0.0);

    assertThat(zero.has(0)).isTrue();
    assertThat(zero).isEqualTo(Distribution.zero());
    assertThat(Distribution.zero().negate()).isEqualTo(Distribution.zero());
  }

  @Test
  public void massMustSumToOne() {
    assertThrows(VerifyException.class, () -> Distribution.of(ImmutableMap.of(1.0, 0.5)));
    assertThrows(
        VerifyException.class, () -> Distribution.of(ImmutableMap.of(1.0, 0.5, 2.0, 0.6)));
  }

  @Test
  public void ofMergesEqualKeys() {
    Distribution d = Distribution.of(ImmutableMap.of(0.0, 0.5, -0.0, 0.5));

    assertThat(d.keys()).containsExactly(0.0);
  }

  @Test
  public void meanOfTransform() {
    Distribution d4 = Distribution.uniform(4);

    assertThat(d4.mean(x -> x * x)).isWithin(TOLERANCE).of(7.5);
    assertThat(d4.mean(x -> 1)).isWithin(TOLERANCE).of(1.0);
  }

  @Test
  public void transformKeysMergesCollisions() {
    Distribution folded = Distribution.uniform(20).transformKeys(k -> k % 4 + 1);

    assertThat(folded.keys()).containsExactly(1.0, 2.0, 3.0, 4.0).inOrder();
    for (double key : folded.keys()) {
      assertThat(folded.get(key)).isWithin(TOLERANCE).of(0.25);
    }
  }

  @Test
  public void add() {
    Distribution twoD6 = Distribution.uniform(6).add(Distribution.uniform(6));

    assertThat(twoD6.min()).isEqualTo(2.0);
    assertThat(twoD6.max()).isEqualTo(12.0);
    assertThat(twoD6.get(7)).isWithin(TOLERANCE).of(6.0 / 36);
    assertThat(twoD6.get(2)).isWithin(TOLERANCE).of(1.0 / 36);
  }

  @Test
  public void subtractAndNegate() {
    Distribution d4 = Distribution.uniform(4);

    assertThat(d4.subtract(d4).keys()).containsExactly(-3.0, -2.0, -1.0, 0.0, 1.0, 2.0, 3.0);
    assertThat(d4.negate().keys()).containsExactly(-4.0, -3.0, -2.0, -1.0).inOrder();
    assertThat(d4.negate().mean()).isWithin(TOLERANCE).of(-2.5);
  }

  @Test
  public void multiply() {
    Distribution doubled = Distribution.uniform(3).multiply(Distribution.constant(2));

    assertThat(doubled.keys()).containsExactly(2.0, 4.0, 6.0).inOrder();
  }

  @Test
  public void divideRoundsDown() throws DivisionByZeroException {
    Distribution halved = Distribution.uniform(4).divide(Distribution.constant(2));

    assertThat(halved.keys()).containsExactly(0.0, 1.0, 2.0).inOrder();
    assertThat(halved.get(0)).isWithin(TOLERANCE).of(0.25);
    assertThat(halved.get(1)).isWithin(TOLERANCE).of(0.5);
    assertThat(halved.get(2)).isWithin(TOLERANCE).of(0.25);
  }

  @Test
  public void modulo() throws DivisionByZeroException {
    Distribution mod = Distribution.uniform(6).modulo(Distribution.constant(3));

    assertThat(mod.keys()).containsExactly(0.0, 1.0, 2.0).inOrder();
    assertThat(mod.get(0)).isWithin(TOLERANCE).of(1.0 / 3);
  }

  @Test
  public void divisorThatCanBeZero() {
    Distribution maybeZero = Distribution.uniform(3).subtract(Distribution.constant(2));

    assertThrows(
        DivisionByZeroException.class, () -> Distribution.uniform(6).divide(maybeZero));
    assertThrows(
        DivisionByZeroException.class, () -> Distribution.uniform(6).modulo(Distribution.zero()));
  }

  @Test
  public void advantageAndDisadvantage() {
    Distribution d20 = Distribution.uniform(20);

    assertThat(d20.advantage().mean()).isWithin(1e-6).of(13.825);
    assertThat(d20.disadvantage().mean()).isWithin(1e-6).of(7.175);
    assertThat(d20.advantage().get(20)).isWithin(TOLERANCE).of(39.0 / 400);
    assertThat(d20.disadvantage().get(20)).isWithin(TOLERANCE).of(1.0 / 400);
  }

  @Test
  public void uniformNeedsSides() {
    assertThrows(IllegalArgumentException.class, () -> Distribution.uniform(0));
  }
}
