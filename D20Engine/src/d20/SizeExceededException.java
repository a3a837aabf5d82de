package d20;

/** An exact distribution would need more work than the configured limits allow. */
public class SizeExceededException extends DiceException {
  private static final long serialVersionUID = 1L;

  public SizeExceededException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
