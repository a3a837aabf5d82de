package d20;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import d20.processor.ASTNode;

/**
 * A single dice modifier such as {@code kh3} or {@code ro1}.
 *
 * <p>{@link #apply} is the only implementation of modifier semantics: the roller applies it to
 * live dice and the distribution engine to each enumerated outcome.
 */
@ASTNode
@AutoValue
public abstract class Modifier implements Modifier_ASTNode {

  public enum Type {
    MIN("mi", true),
    MAX("ma", true),
    REROLL_ONCE("ro", false),
    REROLL("rr", false),
    EXPLODE_ONCE("ra", false),
    EXPLODE("e", false),
    KEEP("k", true),
    DROP("p", true);

    private final String repr;
    private final boolean exact;

    Type(String repr, boolean exact) {
      this.repr = repr;
      this.exact = exact;
    }

    public String repr() {
      return repr;
    }

    /**
     * Whether the modifier only rearranges or clamps existing values, so that its effect on a
     * single outcome can be computed without drawing new dice.
     */
    public boolean hasExactDistribution() {
      return exact;
    }

    private static final ImmutableMap<String, Type> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), Type::repr);

    public static Optional<Type> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }
  }

  private static final Pattern MODIFIER_PATTERN =
      Pattern.compile("(mi|ma|ro|rr|ra|e|k|p)([hl<>]?)([0-9]+)");

  public abstract Type type();

  public abstract Selector selector();

  public abstract Tokenizer.Pos pos();

  public static Modifier create(Type type, Selector selector, Tokenizer.Pos pos) {
    return new AutoValue_Modifier(type, selector, pos);
  }

  public static Modifier create(Type type, Selector selector) {
    return create(type, selector, Tokenizer.Pos.internal());
  }

  // Parses a run of modifiers such as 'kh3ro1', starting at 'pos'.
  public static ImmutableList<Modifier> parseAll(String text, Tokenizer.Pos pos)
      throws ParserException {
    ImmutableList.Builder<Modifier> modifiers = ImmutableList.builder();
    List<String> unknown = new ArrayList<>();
    Optional<Tokenizer.Pos> firstUnknownPos = Optional.empty();

    Matcher matcher = MODIFIER_PATTERN.matcher(text);
    int end = 0;
    while (matcher.find()) {
      if (matcher.start() > end) {
        unknown.add(text.substring(end, matcher.start()));
        if (!firstUnknownPos.isPresent()) firstUnknownPos = Optional.of(pos.addColumns(end));
      }

      Tokenizer.Pos modifierPos = pos.addColumns(matcher.start());
      int value;
      try {
        value = Integer.parseInt(matcher.group(3));
      } catch (NumberFormatException ex) {
        throw new ParserException(modifierPos, "could not parse modifier value as integer");
      }

      modifiers.add(
          create(
              Type.parse(matcher.group(1)).get(),
              Selector.create(Selector.Type.parse(matcher.group(2)).get(), value),
              modifierPos));
      end = matcher.end();
    }
    if (end < text.length()) {
      unknown.add(text.substring(end));
      if (!firstUnknownPos.isPresent()) firstUnknownPos = Optional.of(pos.addColumns(end));
    }

    if (unknown.size() == 1) {
      throw new ParserException(
          firstUnknownPos.get(), String.format("unknown modifier '%s'", unknown.get(0)));
    } else if (unknown.size() > 1) {
      List<String> quoted = new ArrayList<>();
      unknown.forEach(u -> quoted.add("'" + u + "'"));
      String joined =
          Joiner.on(", ").join(quoted.subList(0, quoted.size() - 1))
              + " and "
              + quoted.get(quoted.size() - 1);
      throw new ParserException(firstUnknownPos.get(), "unknown modifiers " + joined);
    }

    return modifiers.build();
  }

  /** Applies this modifier to {@code pool} in place. */
  public final void apply(DicePool pool) throws DiceException {
    Selector selector = selector();
    switch (type()) {
      case MIN:
        for (int i = 0; i < pool.size(); i++) {
          if (pool.value(i) < selector.value()) pool.setValue(i, selector.value());
        }
        break;
      case MAX:
        for (int i = 0; i < pool.size(); i++) {
          if (pool.value(i) > selector.value()) pool.setValue(i, selector.value());
        }
        break;
      case REROLL:
        Verify.verify(!selector.type().isRanking(), "rr with ranking selector: %s", this);
        for (int i : selector.select(pool)) {
          while (selector.matches(pool.value(i))) {
            pool.reroll(i);
          }
        }
        break;
      case REROLL_ONCE:
        for (int i : selector.select(pool)) {
          pool.reroll(i);
        }
        break;
      case EXPLODE_ONCE:
        if (!selector.select(pool).isEmpty()) pool.addDie();
        break;
      case EXPLODE:
        {
          Set<Integer> exploded = new HashSet<>();
          while (true) {
            Set<Integer> fresh = Sets.difference(selector.select(pool), exploded).immutableCopy();
            if (fresh.isEmpty()) break;

            for (int i : fresh) {
              exploded.add(i);
              pool.addDie();
            }
          }
          break;
        }
      case KEEP:
        {
          ImmutableSortedSet<Integer> selected = selector.select(pool);
          for (int i = 0; i < pool.size(); i++) {
            if (!selected.contains(i)) pool.setKept(i, false);
          }
          break;
        }
      case DROP:
        for (int i : selector.select(pool)) {
          pool.setKept(i, false);
        }
        break;
    }
  }

  /** Canonical text of this modifier, e.g. {@code kh3}. */
  @Memoized
  public String repr() {
    return type().repr() + selector();
  }

  @Override
  public final String toString() {
    return repr();
  }
}
