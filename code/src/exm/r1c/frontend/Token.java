package exm.r1c.frontend;

/**
 * A lexical token with its 1-based source position
 */
public class Token {
  public static enum TokenType {
    LPAREN, RPAREN, LBRACKET, RBRACKET, INTEGER, SYMBOL, EOF
  }

  public final TokenType type;
  public final String text;
  public final int line;
  public final int column;

  public Token(TokenType type, String text, int line, int column) {
    super();
    this.type = type;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public boolean isSymbol(String s) {
    return type == TokenType.SYMBOL && text.equals(s);
  }

  /**
   * @return description for error messages
   */
  public String describe() {
    if (type == TokenType.EOF) {
      return "end of input";
    }
    return "'" + text + "'";
  }

  @Override
  public String toString() {
    return type + "(" + text + ")@" + line + ":" + column;
  }
}
