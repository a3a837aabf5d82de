package d20;

/** Entry points for parsing, rolling and computing distributions of dice expressions. */
public final class DiceNotation {
  private DiceNotation() {}

  /** Parses {@code text} and checks that every dice term and modifier is well formed. */
  public static Expression parse(String text) throws DiceException {
    Expression expression = Expression.parse(text);
    ModifierValidator.check(expression);
    return expression;
  }

  public static RolledExpression roll(String text) throws DiceException {
    return roll(text, DieSource.random());
  }

  public static RolledExpression roll(String text, DieSource source) throws DiceException {
    return new Roller(source).roll(parse(text));
  }

  public static Distribution distribution(String text) throws DiceException {
    return distribution(text, DistributionCalculator.Limits.defaults());
  }

  public static Distribution distribution(String text, DistributionCalculator.Limits limits)
      throws DiceException {
    return new DistributionCalculator(limits).distribution(parse(text));
  }
}
