package d20;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ExpressionTest {

  private static ParserException parseError(String text) {
    return assertThrows(ParserException.class, () -> Expression.parse(text));
  }

  @Test
  public void literal() throws ParserException {
    Expression expr = Expression.parse("2.50");

    assertThat(expr.type()).isEqualTo(Expression.Type.LITERAL);
    assertThat(expr.<Expression.Literal>cast().value()).isEqualTo(2.5);
    assertThat(expr.raw()).isEqualTo("2.5");
  }

  @Test
  public void diceWithModifiers() throws ParserException {
    Expression.Dice dice = Expression.parse("4D6KH3ro<2").cast();

    assertThat(dice.type()).isEqualTo(Expression.Type.DICE);
    assertThat(dice.count()).isEqualTo(4);
    assertThat(dice.sides()).isEqualTo(6);
    assertThat(dice.modifiers())
        .containsExactly(
            Modifier.create(Modifier.Type.KEEP, Selector.highest(3), new Tokenizer.Pos(3)),
            Modifier.create(Modifier.Type.REROLL_ONCE, Selector.lessThan(2), new Tokenizer.Pos(6)))
        .inOrder();
    assertThat(dice.raw()).isEqualTo("4d6kh3ro<2");
  }

  @Test
  public void diceCountDefaultsToOne() throws ParserException {
    Expression.Dice dice = Expression.parse("d20").cast();

    assertThat(dice.count()).isEqualTo(1);
    assertThat(dice.sides()).isEqualTo(20);
    assertThat(dice.isModified()).isFalse();
    assertThat(dice.raw()).isEqualTo("1d20");
  }

  @Test
  public void multiplicationBindsTighter() throws ParserException {
    Expression.Binary sum = Expression.parse("1+2*3").cast();

    assertThat(sum.op()).isEqualTo(Expression.BinaryOperator.ADD);
    assertThat(sum.lhs().type()).isEqualTo(Expression.Type.LITERAL);
    assertThat(sum.rhs().<Expression.Binary>cast().op())
        .isEqualTo(Expression.BinaryOperator.MULTIPLY);
    assertThat(sum.raw()).isEqualTo("1 + 2 * 3");
    assertThat(sum.pos().column()).isEqualTo(1);
  }

  @Test
  public void leftAssociative() throws ParserException {
    Expression.Binary diff = Expression.parse("8 - 3 - 2").cast();

    assertThat(diff.lhs().raw()).isEqualTo("8 - 3");
    assertThat(diff.rhs().raw()).isEqualTo("2");
  }

  @Test
  public void parenthesesOverridePrecedence() throws ParserException {
    Expression.Binary product = Expression.parse("(1 + 2) * ((3))").cast();

    assertThat(product.op()).isEqualTo(Expression.BinaryOperator.MULTIPLY);
    assertThat(product.lhs().type()).isEqualTo(Expression.Type.PARENTHETICAL);
    assertThat(product.raw()).isEqualTo("(1 + 2) * ((3))");
  }

  @Test
  public void prefixSigns() throws ParserException {
    Expression.Binary expr = Expression.parse("-1d6 * --2").cast();

    assertThat(expr.lhs().type()).isEqualTo(Expression.Type.UNARY);
    assertThat(expr.lhs().<Expression.Unary>cast().op())
        .isEqualTo(Expression.UnaryOperator.MINUS);
    Expression.Unary rhs = expr.rhs().cast();
    assertThat(rhs.operand().type()).isEqualTo(Expression.Type.UNARY);
    assertThat(expr.raw()).isEqualTo("-1d6 * --2");
  }

  @Test
  public void signAfterBinaryOperator() throws ParserException {
    Expression.Binary expr = Expression.parse("3 - -2").cast();

    assertThat(expr.op()).isEqualTo(Expression.BinaryOperator.SUBTRACT);
    assertThat(expr.rhs().type()).isEqualTo(Expression.Type.UNARY);
  }

  @Test
  public void emptyExpression() {
    assertThat(parseError("  ").errorMsg()).isEqualTo("empty expression");
  }

  @Test
  public void danglingOperator() {
    ParserException ex = parseError("1d6 +");

    assertThat(ex.pos().column()).isEqualTo(4);
  }

  @Test
  public void consecutiveBinaryOperators() {
    parseError("1 * * 2");
  }

  @Test
  public void unmatchedParentheses() {
    assertThat(parseError("(1d6").pos().column()).isEqualTo(0);
    assertThat(parseError("1d6)").pos().column()).isEqualTo(3);
  }

  @Test
  public void emptyParentheses() {
    assertThat(parseError("1 + ()").errorMsg()).isEqualTo("empty parenthesis");
  }

  @Test
  public void trailingToken() {
    assertThat(parseError("1d6 2").pos().column()).isEqualTo(4);
  }

  @Test
  public void missingSides() {
    parseError("4d");
  }

  @Test
  public void malformedNumber() {
    assertThat(parseError("1..2").errorMsg()).contains("'1..2'");
  }

  @Test
  public void loneDecimalPoint() {
    assertThat(parseError("1 + .").errorMsg()).isEqualTo("could not parse '.' as a number");
  }

  @Test
  public void diceCountOverflow() {
    assertThat(parseError("99999999999d6").errorMsg()).isEqualTo("could not parse as integer");
  }

  @Test
  public void unknownToken() {
    parseError("abc");
  }

  @Test
  public void unknownModifier() {
    ParserException ex = parseError("1d6x");

    assertThat(ex.errorMsg()).isEqualTo("unknown modifier 'x'");
    assertThat(ex.pos().column()).isEqualTo(3);
  }

  @Test
  public void unknownModifiers() {
    assertThat(parseError("1d6xkh1yy").errorMsg()).isEqualTo("unknown modifiers 'x' and 'yy'");
    assertThat(parseError("1d6akh1bk1c").errorMsg())
        .isEqualTo("unknown modifiers 'a', 'b' and 'c'");
  }

  @Test
  public void modifierValueOverflow() {
    parseError("1d6kh99999999999");
  }

  @Test
  public void binaryOperatorSemantics() throws DivisionByZeroException {
    Tokenizer.Pos pos = Tokenizer.Pos.internal();

    assertThat(Expression.BinaryOperator.DIVIDE.apply(7, 2, pos)).isEqualTo(3.0);
    assertThat(Expression.BinaryOperator.DIVIDE.apply(-7, 2, pos)).isEqualTo(-4.0);
    assertThat(Expression.BinaryOperator.MODULO.apply(7, 3, pos)).isEqualTo(1.0);
    assertThat(Expression.BinaryOperator.MODULO.apply(-7, 3, pos)).isEqualTo(-1.0);
    assertThrows(
        DivisionByZeroException.class, () -> Expression.BinaryOperator.MODULO.apply(1, 0, pos));
  }

  @Test
  public void formatNumber() {
    assertThat(Expression.formatNumber(3.0)).isEqualTo("3");
    assertThat(Expression.formatNumber(-0.5)).isEqualTo("-0.5");
  }
}
