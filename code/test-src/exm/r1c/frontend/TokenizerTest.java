package exm.r1c.frontend;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.r1c.common.exceptions.InvalidSyntaxException;
import exm.r1c.frontend.Token.TokenType;

public class TokenizerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testNegativeLiteralVsMinus() throws InvalidSyntaxException {
    List<Token> toks = new Tokenizer("(- -5 x-y)").tokenize();
    assertEquals(6, toks.size());
    assertEquals(TokenType.LPAREN, toks.get(0).type);
    assertEquals(TokenType.SYMBOL, toks.get(1).type);
    assertEquals("-", toks.get(1).text);
    assertEquals("Leading minus with digits is a literal",
                 TokenType.INTEGER, toks.get(2).type);
    assertEquals("-5", toks.get(2).text);
    assertEquals(TokenType.SYMBOL, toks.get(3).type);
    assertEquals("x-y", toks.get(3).text);
    assertEquals(TokenType.RPAREN, toks.get(4).type);
    assertEquals(TokenType.EOF, toks.get(5).type);
  }

  @Test
  public void testNonAsciiDigitsRejected() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("\u0663");
    new Tokenizer("\u0663").tokenize();
  }

  @Test
  public void testNonAsciiLetterRejected() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    new Tokenizer("(+ \u00e9 1)").tokenize();
  }

  @Test
  public void testBracketsDelimit() throws InvalidSyntaxException {
    List<Token> toks = new Tokenizer("([x 1])").tokenize();
    assertEquals(TokenType.LBRACKET, toks.get(1).type);
    assertEquals("x", toks.get(2).text);
    assertEquals("1", toks.get(3).text);
    assertEquals(TokenType.RBRACKET, toks.get(4).type);
  }

  @Test
  public void testPositions() throws InvalidSyntaxException {
    List<Token> toks = new Tokenizer("(+ 1\n  22)").tokenize();
    Token t = toks.get(3);
    assertEquals("22", t.text);
    assertEquals(2, t.line);
    assertEquals(3, t.column);
  }

  @Test
  public void testUnknownToken() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("unknown token '#x'");
    new Tokenizer("(+ #x 1)").tokenize();
  }

  @Test
  public void testColonNotAllowedInSymbol() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    new Tokenizer("tmp:1").tokenize();
  }
}
