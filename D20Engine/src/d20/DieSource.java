package d20;

import java.util.Random;

/** Source of raw die faces. */
@FunctionalInterface
public interface DieSource {
  /** Returns a value uniformly drawn from [1, sides]. */
  int roll(int sides);

  static DieSource random(Random random) {
    return sides -> random.nextInt(sides) + 1;
  }

  static DieSource random() {
    return random(new Random());
  }
}
