package d20;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of a dice expression. */
public class Tokenizer {
  public static class Pos {
    private static final Pos INTERNAL = new Pos(-1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final int column;

    public Pos(int column) {
      this.column = column;
    }

    public int column() {
      return column;
    }

    public boolean isInternal() {
      return column < 0;
    }

    public Pos addColumns(int columns) {
      if (isInternal()) return this;
      return new Pos(column + columns);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      return column == ((Pos) o).column;
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(column);
    }

    @Override
    public String toString() {
      return isInternal() ? "<internal>" : "col " + (column + 1);
    }
  }

  public enum Kind {
    OPERATOR,
    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,
    // A number or a dice term, e.g. '2.5' or '4d6kh3'.
    WORD;
  }

  @AutoValue
  public abstract static class Token {
    public abstract Kind kind();

    public abstract String text();

    public abstract Pos pos();

    public static Token create(Kind kind, String text, Pos pos) {
      return new AutoValue_Tokenizer_Token(kind, text, pos);
    }

    @Override
    public String toString() {
      return text();
    }
  }

  private enum State {
    BETWEEN_TOKENS,
    WORD;
  }

  private static final String OPERATOR_CHARS = "+-*/%";

  private final String content;
  private int col = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';
  private State state = State.BETWEEN_TOKENS;

  private StringBuilder word = new StringBuilder();
  private Pos wordPos = null;

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Tokenizer(String content) {
    this.content = content;
  }

  public ImmutableList<Token> tokenize() throws ParserException {
    while (advance()) {
      switch (state) {
        case BETWEEN_TOKENS:
          {
            if (Character.isWhitespace(ch)) {
              break;
            } else if (OPERATOR_CHARS.indexOf(ch) >= 0) {
              tokensBuilder.add(Token.create(Kind.OPERATOR, Character.toString(ch), pos()));
              break;
            } else if (ch == '(') {
              tokensBuilder.add(Token.create(Kind.OPEN_PARENTHESIS, "(", pos()));
              break;
            } else if (ch == ')') {
              tokensBuilder.add(Token.create(Kind.CLOSE_PARENTHESIS, ")", pos()));
              break;
            } else if (!isWordChar(ch)) {
              throw error(String.format("unexpected character '%c'", ch));
            }

            // Start a word.
            wordPos = pos();
            growWord();
            break;
          }
        case WORD:
          {
            growWord();
            break;
          }
      }
    }

    return tokensBuilder.build();
  }

  private static boolean isWordChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '.' || ch == '<' || ch == '>';
  }

  private ParserException error(String msg) {
    return new ParserException(pos(), msg);
  }

  private boolean canPeek() {
    return col + 1 < content.length();
  }

  private char peek() {
    return Character.toLowerCase(content.charAt(col + 1));
  }

  private boolean advance() {
    if (!canPeek()) return false;

    ch = Character.toLowerCase(content.charAt(++col));
    return true;
  }

  private Pos pos() {
    return new Pos(col);
  }

  private void growWord() {
    word.append(ch);
    if (canPeek() && isWordChar(peek())) {
      state = State.WORD;
      return;
    }

    tokensBuilder.add(Token.create(Kind.WORD, word.toString(), wordPos));
    word = new StringBuilder();
    wordPos = null;
    state = State.BETWEEN_TOKENS;
  }
}
