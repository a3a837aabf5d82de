package d20;

/** Reports dice terms whose modifiers or sizes make no sense, before anything is rolled. */
class ModifierValidator extends ErrorCollectingValidator {

  public static void check(Expression expression) throws DiceException {
    new ModifierValidator().throwFirstError(expression);
  }

  @Override
  public void visitImpl(Expression.Dice dice) {
    if (dice.count() > 0 && dice.sides() == 0)
      logError(new ModifierException(dice.pos(), "cannot roll a die with 0 sides"));

    super.visitImpl(dice);
  }

  @Override
  public void visitImpl(Modifier modifier) {
    Selector selector = modifier.selector();
    switch (modifier.type()) {
      case MIN:
      case MAX:
        if (selector.type() != Selector.Type.EXACT) {
          logError(
              new ModifierException(
                  modifier.pos(),
                  String.format(
                      "'%s' takes a plain value, e.g. '%s%d'",
                      modifier.type().repr(),
                      modifier.type().repr(),
                      selector.value())));
        }
        break;
      case REROLL:
        if (selector.type().isRanking()) {
          logError(
              new ModifierException(
                  modifier.pos(),
                  String.format("'rr' cannot select the highest or lowest dice: '%s'", modifier)));
        }
        break;
      default:
        break;
    }
  }
}
