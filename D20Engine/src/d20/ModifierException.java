package d20;

/**
 * A dice term that is structurally invalid: a modifier used with a selector it cannot take, or a
 * die that cannot produce a value.
 */
public class ModifierException extends DiceException {
  private static final long serialVersionUID = 1L;

  public ModifierException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
