package d20;

/**
 * Base class of every failure reported while parsing or evaluating a dice expression. Each
 * failure is terminal for the call that raised it.
 */
public abstract class DiceException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final String errorMsg;

  protected DiceException(Tokenizer.Pos pos, String errorMsg) {
    super(
        pos.isInternal()
            ? errorMsg
            : String.format("%s (at column %d)", errorMsg, pos.column() + 1));
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    if (pos.isInternal()) {
      System.out.println(String.format("ERROR: %s", errorMsg));
    } else {
      System.out.println(String.format("ERROR: col %d: %s", pos.column() + 1, errorMsg));
    }
  }
}
