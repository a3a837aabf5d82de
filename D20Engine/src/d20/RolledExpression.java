package d20;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of rolling an {@link Expression}: a tree parallel to the expression holding the
 * concrete dice and the total of every node.
 */
public abstract class RolledExpression {
  private final Expression source;
  private final double total;

  private RolledExpression(Expression source, double total) {
    this.source = source;
    this.total = total;
  }

  /** The expression that was rolled. */
  public Expression source() {
    return source;
  }

  /** The numeric result, counting kept dice only. */
  public double total() {
    return total;
  }

  /** Canonical text of the rolled expression, independent of the values rolled. */
  public String expression() {
    return source.raw();
  }

  /** Every die rolled in this subtree, dropped ones included, in roll order. */
  public abstract ImmutableList<RolledDie> dice();

  public final ImmutableList<RolledDie> keptDice() {
    return dice().stream().filter(RolledDie::isKept).collect(ImmutableList.toImmutableList());
  }

  /** Kept die values in roll order, composed through the expression's operators. */
  @Override
  public abstract String toString();

  public static final class Literal extends RolledExpression {
    Literal(Expression.Literal source) {
      super(source, source.value());
    }

    @Override
    public ImmutableList<RolledDie> dice() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return Expression.formatNumber(total());
    }
  }

  public static final class Dice extends RolledExpression {
    private final ImmutableList<RolledDie> dice;

    Dice(Expression.Dice source, ImmutableList<RolledDie> dice) {
      super(source, dice.stream().filter(RolledDie::isKept).mapToLong(RolledDie::value).sum());
      this.dice = dice;
    }

    @Override
    public ImmutableList<RolledDie> dice() {
      return dice;
    }

    @Override
    public String toString() {
      return keptDice()
          .stream()
          .map(d -> Integer.toString(d.value()))
          .collect(Collectors.joining(",", "[", "]"));
    }
  }

  public static final class Unary extends RolledExpression {
    private final RolledExpression operand;

    Unary(Expression.Unary source, RolledExpression operand) {
      super(source, source.op().apply(operand.total()));
      this.operand = operand;
    }

    public RolledExpression operand() {
      return operand;
    }

    @Override
    public ImmutableList<RolledDie> dice() {
      return operand.dice();
    }

    @Override
    public String toString() {
      return source().<Expression.Unary>cast().op().repr() + operand;
    }
  }

  public static final class Binary extends RolledExpression {
    private final RolledExpression lhs;
    private final RolledExpression rhs;

    Binary(Expression.Binary source, RolledExpression lhs, RolledExpression rhs, double total) {
      super(source, total);
      this.lhs = lhs;
      this.rhs = rhs;
    }

    public RolledExpression lhs() {
      return lhs;
    }

    public RolledExpression rhs() {
      return rhs;
    }

    @Override
    public ImmutableList<RolledDie> dice() {
      return ImmutableList.<RolledDie>builder().addAll(lhs.dice()).addAll(rhs.dice()).build();
    }

    @Override
    public String toString() {
      return lhs + " " + source().<Expression.Binary>cast().op().repr() + " " + rhs;
    }
  }

  public static final class Parenthetical extends RolledExpression {
    private final RolledExpression inner;

    Parenthetical(Expression.Parenthetical source, RolledExpression inner) {
      super(source, inner.total());
      this.inner = inner;
    }

    public RolledExpression inner() {
      return inner;
    }

    @Override
    public ImmutableList<RolledDie> dice() {
      return inner.dice();
    }

    @Override
    public String toString() {
      return "(" + inner + ")";
    }
  }
}
