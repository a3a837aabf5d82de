package d20;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

/**
 * Draws dice for one top-level evaluation and caps how many may be drawn, so that modifiers
 * such as {@code rr} or {@code e} on degenerate dice fail instead of looping forever.
 */
public final class RollBudget {
  public static final int DEFAULT_MAX_ROLLS = 1000;

  private final DieSource source;
  private final int maxRolls;
  private int rolls = 0;

  public RollBudget(DieSource source) {
    this(source, DEFAULT_MAX_ROLLS);
  }

  public RollBudget(DieSource source, int maxRolls) {
    Preconditions.checkArgument(maxRolls >= 0, "Negative roll budget: %s", maxRolls);
    this.source = source;
    this.maxRolls = maxRolls;
  }

  public int draw(int sides) throws ModifierException, TooManyRollsException {
    if (sides < 1) {
      throw new ModifierException(
          Tokenizer.Pos.internal(), String.format("cannot roll a die with %d sides", sides));
    }
    if (rolls >= maxRolls) {
      throw new TooManyRollsException(
          Tokenizer.Pos.internal(),
          String.format("rolled too many times: the limit is %d dice", maxRolls));
    }

    rolls++;
    int value = source.roll(sides);
    Verify.verify(value >= 1 && value <= sides, "d%s rolled %s", sides, value);
    return value;
  }

  public int rolls() {
    return rolls;
  }

  public int maxRolls() {
    return maxRolls;
  }
}
