package d20;

/** The roll budget of a single evaluation was exhausted. */
public class TooManyRollsException extends DiceException {
  private static final long serialVersionUID = 1L;

  public TooManyRollsException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
