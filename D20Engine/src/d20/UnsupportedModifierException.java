package d20;

/** A modifier that can be rolled but has no exact distribution. */
public class UnsupportedModifierException extends DiceException {
  private static final long serialVersionUID = 1L;

  public UnsupportedModifierException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
