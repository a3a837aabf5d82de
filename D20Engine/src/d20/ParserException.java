package d20;

/** Malformed expression text. */
public class ParserException extends DiceException {
  private static final long serialVersionUID = 1L;

  public ParserException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
