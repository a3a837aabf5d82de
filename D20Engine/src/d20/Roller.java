package d20;

import com.google.common.base.Preconditions;

/**
 * Rolls an {@link Expression} once. Every call to {@link #roll} draws from a fresh {@link
 * RollBudget}, so a single roller may be reused across evaluations.
 */
public final class Roller {
  private final DieSource source;
  private final int maxRolls;

  public Roller(DieSource source) {
    this(source, RollBudget.DEFAULT_MAX_ROLLS);
  }

  public Roller(DieSource source, int maxRolls) {
    Preconditions.checkArgument(maxRolls >= 0, "Negative roll budget: %s", maxRolls);
    this.source = source;
    this.maxRolls = maxRolls;
  }

  public RolledExpression roll(Expression expression) throws DiceException {
    ModifierValidator.check(expression);
    return roll(expression, new RollBudget(source, maxRolls));
  }

  private RolledExpression roll(Expression expr, RollBudget budget) throws DiceException {
    switch (expr.type()) {
      case LITERAL:
        return new RolledExpression.Literal(expr.cast());
      case DICE:
        return rollDice(expr.cast(), budget);
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          return new RolledExpression.Unary(unary, roll(unary.operand(), budget));
        }
      case BINARY:
        {
          Expression.Binary binary = expr.cast();
          RolledExpression lhs = roll(binary.lhs(), budget);
          RolledExpression rhs = roll(binary.rhs(), budget);
          double total = binary.op().apply(lhs.total(), rhs.total(), binary.pos());
          return new RolledExpression.Binary(binary, lhs, rhs, total);
        }
      case PARENTHETICAL:
        {
          Expression.Parenthetical parenthetical = expr.cast();
          return new RolledExpression.Parenthetical(
              parenthetical, roll(parenthetical.inner(), budget));
        }
      default:
        throw new IllegalArgumentException("Cannot roll intermediary node: " + expr.type());
    }
  }

  private static RolledExpression.Dice rollDice(Expression.Dice dice, RollBudget budget)
      throws DiceException {
    RolledDice pool = new RolledDice(dice.sides(), budget);
    for (int i = 0; i < dice.count(); i++) {
      pool.addDie();
    }

    // Order matters: 'ro1kh3' and 'kh3ro1' differ.
    for (Modifier modifier : dice.modifiers()) {
      modifier.apply(pool);
    }

    return new RolledExpression.Dice(dice, pool.dice());
  }
}
