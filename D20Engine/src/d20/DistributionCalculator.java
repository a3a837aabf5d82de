package d20;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.math.LongMath;

/**
 * Computes the exact {@link Distribution} of an {@link Expression}'s total.
 *
 * <p>Unmodified dice are convolved. Modified dice are enumerated: every multiset of faces is
 * generated once as a sorted tuple, weighted by its number of orderings, and run through {@link
 * Modifier#apply}. Only modifiers that never draw new dice can be enumerated this way.
 */
public final class DistributionCalculator {

  @AutoValue
  public abstract static class Limits {
    /** Largest {@code count * sides} accepted for an unmodified dice group. */
    public abstract long maxDiceSize();

    /** Largest {@code sides ^ count}, and largest count, accepted for a modified dice group. */
    public abstract long maxOutcomes();

    public static Limits defaults() {
      return builder().build();
    }

    public static Builder builder() {
      return new AutoValue_DistributionCalculator_Limits.Builder()
          .setMaxDiceSize(101 * 101)
          .setMaxOutcomes(8192);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setMaxDiceSize(long maxDiceSize);

      public abstract Builder setMaxOutcomes(long maxOutcomes);

      public abstract Limits build();
    }
  }

  private final Limits limits;

  public DistributionCalculator() {
    this(Limits.defaults());
  }

  public DistributionCalculator(Limits limits) {
    this.limits = limits;
  }

  public Limits limits() {
    return limits;
  }

  public Distribution distribution(Expression expression) throws DiceException {
    ModifierValidator.check(expression);
    DistributionSupportValidator.check(expression);
    return compute(expression);
  }

  private Distribution compute(Expression expr) throws DiceException {
    switch (expr.type()) {
      case LITERAL:
        return Distribution.constant(expr.<Expression.Literal>cast().value());
      case DICE:
        {
          Expression.Dice dice = expr.cast();
          return dice.isModified() ? enumerate(dice) : convolve(dice);
        }
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          Distribution operand = compute(unary.operand());
          return unary.op() == Expression.UnaryOperator.MINUS ? operand.negate() : operand;
        }
      case BINARY:
        {
          Expression.Binary binary = expr.cast();
          Distribution lhs = compute(binary.lhs());
          Distribution rhs = compute(binary.rhs());
          return lhs.apply(binary.op(), rhs, binary.pos());
        }
      case PARENTHETICAL:
        return compute(expr.<Expression.Parenthetical>cast().inner());
      default:
        throw new IllegalArgumentException(
            "Cannot compute distribution of intermediary node: " + expr.type());
    }
  }

  private Distribution convolve(Expression.Dice dice) throws SizeExceededException {
    int count = dice.count();
    int sides = dice.sides();
    if ((long) count * sides > limits.maxDiceSize()) {
      throw new SizeExceededException(
          dice.pos(),
          String.format(
              "'%s' is too large to compute exactly (count * sides must be at most %d)",
              dice.raw(), limits.maxDiceSize()));
    }
    if (count == 0) return Distribution.zero();

    // masses[s] is the probability that the dice rolled so far sum to s.
    double[] masses = new double[count * sides + 1];
    masses[0] = 1.0;
    for (int die = 0; die < count; die++) {
      double[] next = new double[masses.length];
      int reached = die * sides;
      for (int s = die; s <= reached; s++) {
        if (masses[s] == 0) continue;
        double share = masses[s] / sides;
        for (int face = 1; face <= sides; face++) {
          next[s + face] += share;
        }
      }
      masses = next;
    }

    Map<Double, Double> result = new HashMap<>();
    for (int s = count; s < masses.length; s++) {
      if (masses[s] > 0) result.put((double) s, masses[s]);
    }
    return Distribution.of(result);
  }

  private Distribution enumerate(Expression.Dice dice) throws DiceException {
    int count = dice.count();
    int sides = dice.sides();
    long outcomes = LongMath.saturatedPow(sides, count);
    // One-sided dice have a single outcome at any count, so the count is bounded too.
    if (outcomes > limits.maxOutcomes() || count > limits.maxOutcomes()) {
      throw new SizeExceededException(
          dice.pos(),
          String.format(
              "'%s' has too many outcomes to compute exactly"
                  + " (sides ^ count and count must be at most %d)",
              dice.raw(), limits.maxOutcomes()));
    }

    Map<Double, Double> result = new HashMap<>();
    int[] faces = new int[count];
    Arrays.fill(faces, 1);
    do {
      OutcomePool pool = new OutcomePool(faces);
      for (Modifier modifier : dice.modifiers()) {
        modifier.apply(pool);
      }
      result.merge((double) pool.keptTotal(), orderings(faces) / (double) outcomes, Double::sum);
    } while (advance(faces, sides));

    return Distribution.of(result);
  }

  // Steps to the next non-decreasing tuple. Returns false once every tuple has been visited.
  private static boolean advance(int[] faces, int sides) {
    int i = faces.length - 1;
    while (i >= 0 && faces[i] == sides) {
      i--;
    }
    if (i < 0) return false;

    faces[i]++;
    for (int j = i + 1; j < faces.length; j++) {
      faces[j] = faces[i];
    }
    return true;
  }

  // Number of distinct orderings of a sorted tuple: n! / (k1! k2! ...).
  private static long orderings(int[] sortedFaces) {
    long orderings = 1;
    int remaining = sortedFaces.length;
    int i = 0;
    while (i < sortedFaces.length) {
      int j = i;
      while (j < sortedFaces.length && sortedFaces[j] == sortedFaces[i]) {
        j++;
      }
      orderings *= LongMath.binomial(remaining, j - i);
      remaining -= j - i;
      i = j;
    }
    return orderings;
  }

  /** One enumerated outcome. Modifiers may clamp or drop its dice, but never draw new ones. */
  private static final class OutcomePool implements DicePool {
    private final int[] values;
    private final boolean[] kept;

    OutcomePool(int[] faces) {
      this.values = faces.clone();
      this.kept = new boolean[faces.length];
      Arrays.fill(kept, true);
    }

    long keptTotal() {
      long total = 0;
      for (int i = 0; i < values.length; i++) {
        if (kept[i]) total += values[i];
      }
      return total;
    }

    @Override
    public int size() {
      return values.length;
    }

    @Override
    public int value(int index) {
      return values[index];
    }

    @Override
    public boolean isKept(int index) {
      return kept[index];
    }

    @Override
    public void setValue(int index, int value) {
      values[index] = value;
    }

    @Override
    public void setKept(int index, boolean kept) {
      this.kept[index] = kept;
    }

    @Override
    public void reroll(int index) throws DiceException {
      throw new UnsupportedModifierException(
          Tokenizer.Pos.internal(), "rerolls cannot be computed exactly");
    }

    @Override
    public void addDie() throws DiceException {
      throw new UnsupportedModifierException(
          Tokenizer.Pos.internal(), "exploding dice cannot be computed exactly");
    }
  }
}
