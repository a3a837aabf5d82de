package d20;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

// The live pool of a single dice term while its modifiers are applied.
final class RolledDice implements DicePool {
  private final int sides;
  private final RollBudget budget;
  private final List<RolledDie> dice = new ArrayList<>();

  RolledDice(int sides, RollBudget budget) {
    this.sides = sides;
    this.budget = budget;
  }

  @Override
  public int size() {
    return dice.size();
  }

  @Override
  public int value(int index) {
    return dice.get(index).value();
  }

  @Override
  public boolean isKept(int index) {
    return dice.get(index).isKept();
  }

  @Override
  public void setValue(int index, int value) {
    dice.get(index).setValue(value);
  }

  @Override
  public void setKept(int index, boolean kept) {
    dice.get(index).setKept(kept);
  }

  @Override
  public void reroll(int index) throws DiceException {
    dice.get(index).setValue(budget.draw(sides));
  }

  @Override
  public void addDie() throws DiceException {
    dice.add(new RolledDie(sides, budget.draw(sides)));
  }

  ImmutableList<RolledDie> dice() {
    return ImmutableList.copyOf(dice);
  }
}
