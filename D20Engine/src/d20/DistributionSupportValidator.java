package d20;

/** Reports modifiers that can be rolled but have no exact distribution. */
class DistributionSupportValidator extends ErrorCollectingValidator {

  public static void check(Expression expression) throws DiceException {
    new DistributionSupportValidator().throwFirstError(expression);
  }

  @Override
  public void visitImpl(Modifier modifier) {
    if (!modifier.type().hasExactDistribution()) {
      logError(
          new UnsupportedModifierException(
              modifier.pos(),
              String.format("modifier '%s' is not supported for distributions", modifier)));
    }
  }
}
