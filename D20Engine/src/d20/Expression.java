package d20;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.math.DoubleMath;

import d20.processor.ASTChild;
import d20.processor.ASTNode;

// AST and infix parser for dice expressions
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    // Intermediary nodes.
    // These don't exist in the final node hierarchy when parsing is complete.
    PARENTHESIS,
    OPERATOR,

    // Value atoms
    LITERAL,
    DICE,

    // Compounds
    UNARY,
    BINARY,
    PARENTHETICAL;

    public boolean isOperator() {
      return this == OPERATOR;
    }
  }

  public enum UnaryOperator {
    PLUS("+"),
    MINUS("-");

    private final String repr;

    UnaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public double apply(double value) {
      switch (this) {
        case PLUS:
          return value;
        case MINUS:
          // Adding 0.0 turns -0.0 into 0.0.
          return -value + 0.0;
      }
      throw new AssertionError(this);
    }

    private static final ImmutableMap<String, UnaryOperator> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), UnaryOperator::repr);

    public static Optional<UnaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }
  }

  public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public boolean isDivision() {
      return this == DIVIDE || this == MODULO;
    }

    // Division rounds down; modulo takes the sign of the dividend.
    public double apply(double lhs, double rhs, Tokenizer.Pos pos)
        throws DivisionByZeroException {
      if (isDivision() && rhs == 0) {
        throw new DivisionByZeroException(
            pos, String.format("%s by zero", this == DIVIDE ? "division" : "modulo"));
      }

      switch (this) {
        case ADD:
          return lhs + rhs + 0.0;
        case SUBTRACT:
          return lhs - rhs + 0.0;
        case MULTIPLY:
          return lhs * rhs + 0.0;
        case DIVIDE:
          return Math.floor(lhs / rhs) + 0.0;
        case MODULO:
          return lhs % rhs + 0.0;
      }
      throw new AssertionError(this);
    }

    private static final ImmutableMap<String, BinaryOperator> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BinaryOperator::repr);

    public static Optional<BinaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }

    private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
        ImmutableList.of(ImmutableSet.of(MULTIPLY, DIVIDE, MODULO), ImmutableSet.of(ADD, SUBTRACT));

    static {
      // Ensure each operator is listed exactly once.
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
    }

    public static ImmutableList<ImmutableSet<BinaryOperator>> orderOfOperations() {
      return ORDER_OF_OPERATIONS;
    }
  }

  // Renders integral values without a trailing '.0'.
  public static String formatNumber(double value) {
    if (DoubleMath.isMathematicalInteger(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static final Pattern NUMBER_PATTERN = Pattern.compile("[0-9]*\\.?[0-9]*");
  private static final Pattern DICE_PATTERN = Pattern.compile("([0-9]*)d([0-9]*)(.*)");

  // Parses a singular expression atom, no spaces.
  private static Expression parseAtom(Tokenizer.Token token) throws ParserException {
    Tokenizer.Pos pos = token.pos();
    switch (token.kind()) {
      case OPEN_PARENTHESIS:
        return new Parenthesis(true, pos);
      case CLOSE_PARENTHESIS:
        return new Parenthesis(false, pos);
      case OPERATOR:
        return new OperatorAtom(token.text(), pos);
      case WORD:
        break;
    }

    String atom = token.text();
    if (NUMBER_PATTERN.matcher(atom).matches()) return Literal.parse(atom, pos);

    Matcher dice = DICE_PATTERN.matcher(atom);
    if (dice.matches()) return Dice.parse(dice, pos);

    throw new ParserException(pos, String.format("unexpected token '%s'", atom));
  }

  public static Expression parse(String expression) throws ParserException {
    return parse(new Tokenizer(expression).tokenize());
  }

  // Parses a full expression
  public static Expression parse(List<Tokenizer.Token> tokens) throws ParserException {
    if (tokens.isEmpty()) throw new ParserException(new Tokenizer.Pos(0), "empty expression");

    List<Expression> atoms = new ArrayList<>();
    for (Tokenizer.Token token : tokens) {
      atoms.add(parseAtom(token));
    }

    // Parse parenthesis
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.PARENTHESIS) continue;

      Parenthesis paren = expr.cast();
      if (paren.isOpen()) {
        stack.push(i);
      } else {
        if (stack.isEmpty()) throw new ParserException(paren.pos(), "unmatched parenthesis");

        int start = stack.pop();
        if (start + 1 == i) throw new ParserException(paren.pos(), "empty parenthesis");

        Expression inner = parseNoSeparators(new ArrayList<>(atoms.subList(start + 1, i)));
        Parenthetical parenthetical = new Parenthetical(inner, atoms.get(start).pos());
        // Replace.
        atoms.subList(start + 1, i + 1).clear();
        atoms.set(start, parenthetical);
        i = start;
      }
    }

    if (!stack.isEmpty())
      throw new ParserException(atoms.get(stack.pop()).pos(), "unmatched parenthesis");

    return parseNoSeparators(atoms);
  }

  private static void parseBinaryOperators(ImmutableSet<BinaryOperator> ops, List<Expression> atoms)
      throws ParserException {
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.OPERATOR) continue;

      OperatorAtom operator = expr.cast();
      BinaryOperator op = operator.binaryOp();
      if (!ops.contains(op)) continue;

      // Consume the previous and subsequent arguments.
      if (i - 1 < 0
          || i + 1 >= atoms.size()
          || atoms.get(i - 1).type().isOperator()
          || atoms.get(i + 1).type().isOperator()) {
        throw new ParserException(
            operator.pos(), "binary operator is missing left or right arguments");
      }

      // Removal of 'i - 1' shifts 'i + 1' to 'i'
      atoms.set(i - 1, new Binary(atoms.remove(i - 1), op, operator.pos(), atoms.remove(i)));
      i--;
    }
  }

  private static Expression parseNoSeparators(List<Expression> atoms) throws ParserException {
    Preconditions.checkArgument(!atoms.isEmpty());

    // Pass 1: prefix sign operators
    for (int i = atoms.size() - 2; i >= 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.OPERATOR) continue;

      OperatorAtom operator = expr.cast();
      Optional<UnaryOperator> unary = UnaryOperator.parse(operator.raw());
      if (!unary.isPresent()) continue;

      if (i == 0 || atoms.get(i - 1).type().isOperator()) {
        if (atoms.get(i + 1).type().isOperator())
          throw new ParserException(operator.pos(), "unary operator has no argument");

        atoms.set(i, new Unary(unary.get(), operator.pos(), atoms.remove(i + 1)));
      }
    }

    // Pass 2: binary operators
    for (ImmutableSet<BinaryOperator> ops : BinaryOperator.orderOfOperations()) {
      parseBinaryOperators(ops, atoms);
    }

    // In the end, we should be left with a single expression.
    if (atoms.size() > 1) {
      throw new ParserException(
          atoms.get(1).pos(), "unexpected token: expected end of expression");
    }
    if (atoms.get(0).type().isOperator()) {
      throw new ParserException(atoms.get(0).pos(), "operator has no arguments");
    }
    return atoms.get(0);
  }

  private final Type type;
  private final String raw;
  private final Tokenizer.Pos pos;

  private Expression(Type type, String raw, Tokenizer.Pos pos) {
    this.type = type;
    this.raw = raw;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  /** Canonical, whitespace-normalized source text of this expression. */
  public String raw() {
    return raw;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return raw;
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  private abstract static class IntermediaryExpression extends Expression {
    protected IntermediaryExpression(Expression.Type type, String raw, Tokenizer.Pos pos) {
      super(type, raw, pos);
    }

    @Override
    public final <V> V accept(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }
  }

  private static class Parenthesis extends IntermediaryExpression {
    private final boolean open;

    private Parenthesis(boolean open, Tokenizer.Pos pos) {
      super(Type.PARENTHESIS, open ? "(" : ")", pos);
      this.open = open;
    }

    public boolean isOpen() {
      return open;
    }
  }

  private static class OperatorAtom extends IntermediaryExpression {
    private OperatorAtom(String repr, Tokenizer.Pos pos) {
      super(Type.OPERATOR, repr, pos);
    }

    public BinaryOperator binaryOp() {
      return BinaryOperator.parse(raw()).get();
    }
  }

  @ASTNode
  public static class Literal extends Expression implements Expression_Literal_ASTNode {
    private final double value;

    private Literal(double value, Tokenizer.Pos pos) {
      super(Type.LITERAL, formatNumber(value), pos);
      this.value = value;
    }

    public static Literal internal(double value) {
      return new Literal(value, Tokenizer.Pos.internal());
    }

    public double value() {
      return value;
    }

    public static Literal parse(String in, Tokenizer.Pos pos) throws ParserException {
      try {
        return new Literal(Double.parseDouble(in), pos);
      } catch (NumberFormatException ex) {
        throw new ParserException(pos, String.format("could not parse '%s' as a number", in));
      }
    }
  }

  @ASTNode
  public static class Dice extends Expression implements Expression_Dice_ASTNode {
    private final int count;
    private final int sides;
    private final ImmutableList<Modifier> modifiers;

    private Dice(int count, int sides, ImmutableList<Modifier> modifiers, Tokenizer.Pos pos) {
      super(
          Type.DICE,
          count
              + "d"
              + sides
              + modifiers.stream().map(Modifier::repr).collect(Collectors.joining()),
          pos);
      Preconditions.checkArgument(count >= 0, "Negative dice count: %s", count);
      Preconditions.checkArgument(sides >= 0, "Negative dice sides: %s", sides);
      this.count = count;
      this.sides = sides;
      this.modifiers = modifiers;
    }

    public static Dice internal(int count, int sides, Modifier... modifiers) {
      return new Dice(count, sides, ImmutableList.copyOf(modifiers), Tokenizer.Pos.internal());
    }

    public int count() {
      return count;
    }

    public int sides() {
      return sides;
    }

    @ASTChild
    @Override
    public ImmutableList<Modifier> modifiers() {
      return modifiers;
    }

    public boolean isModified() {
      return !modifiers.isEmpty();
    }

    private static Dice parse(Matcher matcher, Tokenizer.Pos pos) throws ParserException {
      String countText = matcher.group(1);
      String sidesText = matcher.group(2);
      if (sidesText.isEmpty()) {
        throw new ParserException(
            pos.addColumns(matcher.end(1) + 1), "expected a number of sides after 'd'");
      }

      int count = countText.isEmpty() ? 1 : parseInt(countText, pos);
      int sides = parseInt(sidesText, pos.addColumns(matcher.start(2)));
      ImmutableList<Modifier> modifiers =
          Modifier.parseAll(matcher.group(3), pos.addColumns(matcher.start(3)));
      return new Dice(count, sides, modifiers, pos);
    }

    private static int parseInt(String in, Tokenizer.Pos pos) throws ParserException {
      try {
        return Integer.parseInt(in);
      } catch (NumberFormatException ex) {
        throw new ParserException(pos, "could not parse as integer");
      }
    }
  }

  @ASTNode
  public static class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOperator op;
    private final Expression operand;

    private Unary(UnaryOperator op, Tokenizer.Pos pos, Expression operand) {
      super(Type.UNARY, op.repr() + operand.raw(), pos);
      this.op = op;
      this.operand = operand;
    }

    public static Unary internal(UnaryOperator op, Expression operand) {
      return new Unary(op, Tokenizer.Pos.internal(), operand);
    }

    public UnaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    private Binary(Expression lhs, BinaryOperator op, Tokenizer.Pos opPos, Expression rhs) {
      super(Type.BINARY, lhs.raw() + " " + op.repr() + " " + rhs.raw(), opPos);
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    public static Binary internal(Expression lhs, BinaryOperator op, Expression rhs) {
      return new Binary(lhs, op, Tokenizer.Pos.internal(), rhs);
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }
  }

  @ASTNode
  public static class Parenthetical extends Expression
      implements Expression_Parenthetical_ASTNode {
    private final Expression inner;

    private Parenthetical(Expression inner, Tokenizer.Pos pos) {
      super(Type.PARENTHETICAL, "(" + inner.raw() + ")", pos);
      this.inner = inner;
    }

    public static Parenthetical internal(Expression inner) {
      return new Parenthetical(inner, Tokenizer.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression inner() {
      return inner;
    }
  }
}
