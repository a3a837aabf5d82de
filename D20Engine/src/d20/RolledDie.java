package d20;

/** One physical die of a rolled pool. Only the roller changes its value or kept flag. */
public final class RolledDie {
  private final int sides;
  private int value;
  private boolean kept = true;

  RolledDie(int sides, int value) {
    this.sides = sides;
    this.value = value;
  }

  public int sides() {
    return sides;
  }

  public int value() {
    return value;
  }

  public boolean isKept() {
    return kept;
  }

  void setValue(int value) {
    this.value = value;
  }

  void setKept(boolean kept) {
    this.kept = kept;
  }

  @Override
  public String toString() {
    return kept ? Integer.toString(value) : "~" + value;
  }
}
