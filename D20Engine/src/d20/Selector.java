package d20;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

/**
 * Chooses which dice of a pool a {@link Modifier} affects.
 *
 * <p>Comparison selectors ({@code EXACT}, {@code LESS_THAN}, {@code GREATER_THAN}) match on a
 * threshold. Ranking selectors ({@code HIGHEST}, {@code LOWEST}) pick a count of dice by value;
 * ties are broken by roll order. Only kept dice are ever selected.
 */
@AutoValue
public abstract class Selector {

  public enum Type {
    EXACT(""),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    HIGHEST("h"),
    LOWEST("l");

    private final String repr;

    Type(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public boolean isRanking() {
      return this == HIGHEST || this == LOWEST;
    }

    private static final ImmutableMap<String, Type> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), Type::repr);

    public static Optional<Type> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }
  }

  public abstract Type type();

  public abstract int value();

  public static Selector create(Type type, int value) {
    Preconditions.checkArgument(
        !type.isRanking() || value >= 0, "Negative count for %s selector: %s", type, value);
    return new AutoValue_Selector(type, value);
  }

  public static Selector exact(int value) {
    return create(Type.EXACT, value);
  }

  public static Selector lessThan(int value) {
    return create(Type.LESS_THAN, value);
  }

  public static Selector greaterThan(int value) {
    return create(Type.GREATER_THAN, value);
  }

  public static Selector highest(int count) {
    return create(Type.HIGHEST, count);
  }

  public static Selector lowest(int count) {
    return create(Type.LOWEST, count);
  }

  /** Whether a single die value satisfies this comparison selector. */
  public final boolean matches(int dieValue) {
    switch (type()) {
      case EXACT:
        return dieValue == value();
      case LESS_THAN:
        return dieValue < value();
      case GREATER_THAN:
        return dieValue > value();
      default:
        throw new IllegalStateException("Ranking selector cannot match a single value: " + this);
    }
  }

  /** Returns the indices, in roll order, of the kept dice of {@code pool} this selector picks. */
  public final ImmutableSortedSet<Integer> select(DicePool pool) {
    int[] kept = IntStream.range(0, pool.size()).filter(pool::isKept).toArray();
    if (!type().isRanking()) {
      return Arrays.stream(kept)
          .filter(i -> matches(pool.value(i)))
          .boxed()
          .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
    }

    Comparator<Integer> byValue = Comparator.comparingInt(pool::value);
    if (type() == Type.HIGHEST) byValue = byValue.reversed();

    // Stable sort: equal values keep roll order.
    List<Integer> ranked = Arrays.asList(Arrays.stream(kept).boxed().toArray(Integer[]::new));
    ranked.sort(byValue);
    return ImmutableSortedSet.copyOf(ranked.subList(0, Math.min(value(), ranked.size())));
  }

  @Override
  public final String toString() {
    return type().repr() + value();
  }
}
