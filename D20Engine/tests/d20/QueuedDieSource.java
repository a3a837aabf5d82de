package d20;

import java.util.ArrayDeque;
import java.util.Deque;

/** Returns preset faces in order; fails the test if more dice are drawn than were queued. */
final class QueuedDieSource implements DieSource {
  private final Deque<Integer> faces = new ArrayDeque<>();

  QueuedDieSource(int... faces) {
    for (int face : faces) {
      this.faces.add(face);
    }
  }

  @Override
  public int roll(int sides) {
    if (faces.isEmpty()) throw new AssertionError("No more queued faces for d" + sides);
    return faces.remove();
  }

  int remaining() {
    return faces.size();
  }
}
