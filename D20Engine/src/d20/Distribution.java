package d20;

import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * Exact probability mass function of an expression's total.
 *
 * <p>Instances are immutable; every combinator returns a new distribution. Masses are checked to
 * sum to 1 on construction, and a violation is reported as a {@link
 * com.google.common.base.VerifyException} since it can only come from a bug in a combinator.
 */
@CheckReturnValue
public final class Distribution {
  public static final double EPSILON = 1e-6;

  private static final Distribution ZERO = constant(0);

  private final ImmutableSortedMap<Double, Double> masses;

  private Distribution(Map<Double, Double> masses) {
    double total = masses.values().stream().mapToDouble(Double::doubleValue).sum();
    Verify.verify(
        Math.abs(1.0 - total) < EPSILON, "Distribution masses total %s instead of 1.0", total);
    this.masses = ImmutableSortedMap.copyOf(masses);
  }

  public static Distribution of(Map<Double, Double> masses) {
    Map<Double, Double> normalized = new HashMap<>();
    masses.forEach((key, mass) -> normalized.merge(normalize(key), mass, Double::sum));
    return new Distribution(normalized);
  }

  public static Distribution constant(double value) {
    return new Distribution(ImmutableSortedMap.of(normalize(value), 1.0));
  }

  public static Distribution zero() {
    return ZERO;
  }

  /** A single fair die with faces 1 through {@code sides}. */
  public static Distribution uniform(int sides) {
    Preconditions.checkArgument(sides >= 1, "A die needs at least one side: %s", sides);
    Map<Double, Double> masses = new HashMap<>();
    for (int face = 1; face <= sides; face++) {
      masses.put((double) face, 1.0 / sides);
    }
    return new Distribution(masses);
  }

  // -0.0 and 0.0 are distinct map keys.
  private static double normalize(double key) {
    return key + 0.0;
  }

  public double get(double key) {
    return masses.getOrDefault(normalize(key), 0.0);
  }

  public boolean has(double key) {
    return masses.containsKey(normalize(key));
  }

  /** Outcomes with non-zero mass, ascending. */
  public ImmutableList<Double> keys() {
    return masses.keySet().asList();
  }

  public ImmutableSortedMap<Double, Double> asMap() {
    return masses;
  }

  public int size() {
    return masses.size();
  }

  public double min() {
    return masses.firstKey();
  }

  public double max() {
    return masses.lastKey();
  }

  public double mean() {
    return mean(DoubleUnaryOperator.identity());
  }

  /** Expected value of {@code transform} applied to the outcome. */
  public double mean(DoubleUnaryOperator transform) {
    double mean = 0;
    for (Map.Entry<Double, Double> entry : masses.entrySet()) {
      mean += entry.getValue() * transform.applyAsDouble(entry.getKey());
    }
    return mean;
  }

  public double stddev() {
    // variance = E[X^2] - E[X]^2
    double mean = mean();
    double variance = mean(x -> x * x) - mean * mean;
    return Math.sqrt(Math.max(0, variance));
  }

  /** Remaps every outcome; masses of outcomes mapped to the same key are summed. */
  public Distribution transformKeys(DoubleUnaryOperator transform) {
    Map<Double, Double> transformed = new HashMap<>();
    masses.forEach(
        (key, mass) ->
            transformed.merge(normalize(transform.applyAsDouble(key)), mass, Double::sum));
    return new Distribution(transformed);
  }

  public Distribution negate() {
    return transformKeys(x -> -x);
  }

  public Distribution add(Distribution other) {
    return arithmetic(Expression.BinaryOperator.ADD, other);
  }

  public Distribution subtract(Distribution other) {
    return arithmetic(Expression.BinaryOperator.SUBTRACT, other);
  }

  public Distribution multiply(Distribution other) {
    return arithmetic(Expression.BinaryOperator.MULTIPLY, other);
  }

  public Distribution divide(Distribution other) throws DivisionByZeroException {
    return apply(Expression.BinaryOperator.DIVIDE, other, Tokenizer.Pos.internal());
  }

  public Distribution modulo(Distribution other) throws DivisionByZeroException {
    return apply(Expression.BinaryOperator.MODULO, other, Tokenizer.Pos.internal());
  }

  /** The better of two independent draws. */
  public Distribution advantage() {
    return combine(this, Math::max);
  }

  /** The worse of two independent draws. */
  public Distribution disadvantage() {
    return combine(this, Math::min);
  }

  /**
   * Combines two independent distributions with {@code op}. Fails if {@code op} divides and
   * {@code other} can be 0, reporting {@code pos}.
   */
  Distribution apply(Expression.BinaryOperator op, Distribution other, Tokenizer.Pos pos)
      throws DivisionByZeroException {
    if (op.isDivision() && other.has(0)) {
      throw new DivisionByZeroException(
          pos,
          String.format(
              "%s by a distribution that can be zero",
              op == Expression.BinaryOperator.DIVIDE ? "division" : "modulo"));
    }

    return combine(
        other,
        (a, b) -> {
          try {
            return op.apply(a, b, pos);
          } catch (DivisionByZeroException ex) {
            throw new AssertionError(ex);
          }
        });
  }

  private Distribution arithmetic(Expression.BinaryOperator op, Distribution other) {
    try {
      return apply(op, other, Tokenizer.Pos.internal());
    } catch (DivisionByZeroException ex) {
      throw new AssertionError(ex);
    }
  }

  // Keys are visited in ascending order so that summation order is deterministic.
  private Distribution combine(Distribution other, DoubleBinaryOperator keyTransform) {
    Map<Double, Double> combined = new HashMap<>();
    for (Map.Entry<Double, Double> a : masses.entrySet()) {
      for (Map.Entry<Double, Double> b : other.masses.entrySet()) {
        double key = normalize(keyTransform.applyAsDouble(a.getKey(), b.getKey()));
        combined.merge(key, a.getValue() * b.getValue(), Double::sum);
      }
    }
    return new Distribution(combined);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Distribution)) return false;
    return masses.equals(((Distribution) o).masses);
  }

  @Override
  public int hashCode() {
    return masses.hashCode();
  }

  @Override
  public String toString() {
    return masses.toString();
  }
}
