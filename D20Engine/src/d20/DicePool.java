package d20;

/**
 * The ordered dice of a single dice term, as seen by {@link Modifier#apply}.
 *
 * <p>Indices follow roll order and are stable: dice are only ever appended, and dropping a die
 * only clears its kept flag. The roller backs this with live dice; the distribution engine backs
 * it with one enumerated outcome, where drawing new values is not possible.
 */
public interface DicePool {
  int size();

  int value(int index);

  boolean isKept(int index);

  void setValue(int index, int value);

  void setKept(int index, boolean kept);

  /** Replaces the value of die {@code index} with a fresh draw. */
  void reroll(int index) throws DiceException;

  /** Appends a freshly drawn, kept die with the same number of sides. */
  void addDie() throws DiceException;
}
