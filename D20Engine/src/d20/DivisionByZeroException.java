package d20;

public class DivisionByZeroException extends DiceException {
  private static final long serialVersionUID = 1L;

  public DivisionByZeroException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
