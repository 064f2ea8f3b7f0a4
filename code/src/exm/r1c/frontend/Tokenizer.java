/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.r1c.frontend;

import java.util.ArrayList;
import java.util.List;

import exm.r1c.common.exceptions.InvalidSyntaxException;
import exm.r1c.frontend.Token.TokenType;

/**
 * Splits R1 source text into tokens.  Tokens are delimited by whitespace,
 * parentheses and square brackets.
 */
public class Tokenizer {

  private final String input;
  private int pos = 0;
  private int line = 1;
  private int column = 1;

  public Tokenizer(String input) {
    this.input = input;
  }

  public static boolean isDelimiter(char c) {
    return c == '(' || c == ')' || c == '[' || c == ']';
  }

  public static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isSymbolStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
        || "_!?*<>=/".indexOf(c) >= 0;
  }

  public static boolean isSymbolPart(char c) {
    return isSymbolStart(c) || isAsciiDigit(c) || c == '-';
  }

  /**
   * Tokenize the whole input.  The returned list always ends with an
   * EOF token.
   * @throws InvalidSyntaxException on a malformed atom
   */
  public List<Token> tokenize() throws InvalidSyntaxException {
    List<Token> tokens = new ArrayList<Token>();
    while (true) {
      skipWhitespace();
      if (atEnd()) {
        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
      }
      char c = current();
      int startLine = line, startCol = column;
      switch (c) {
        case '(':
          tokens.add(new Token(TokenType.LPAREN, "(", startLine, startCol));
          next();
          break;
        case ')':
          tokens.add(new Token(TokenType.RPAREN, ")", startLine, startCol));
          next();
          break;
        case '[':
          tokens.add(new Token(TokenType.LBRACKET, "[", startLine, startCol));
          next();
          break;
        case ']':
          tokens.add(new Token(TokenType.RBRACKET, "]", startLine, startCol));
          next();
          break;
        default:
          tokens.add(atom(startLine, startCol));
      }
    }
  }

  private Token atom(int startLine, int startCol)
      throws InvalidSyntaxException {
    StringBuilder sb = new StringBuilder();
    while (!atEnd() && !Character.isWhitespace(current())
           && !isDelimiter(current())) {
      sb.append(current());
      next();
    }
    String text = sb.toString();
    if (isIntegerLiteral(text)) {
      return new Token(TokenType.INTEGER, text, startLine, startCol);
    } else if (text.equals("+") || text.equals("-") || isSymbol(text)) {
      return new Token(TokenType.SYMBOL, text, startLine, startCol);
    } else {
      throw new InvalidSyntaxException(startLine, startCol,
                                  "unknown token '" + text + "'");
    }
  }

  /**
   * A leading '-' directly followed by digits is part of the literal
   */
  private static boolean isIntegerLiteral(String text) {
    int start = text.startsWith("-") ? 1 : 0;
    if (text.length() <= start) {
      return false;
    }
    for (int i = start; i < text.length(); i++) {
      if (!isAsciiDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isSymbol(String text) {
    if (!isSymbolStart(text.charAt(0))) {
      return false;
    }
    for (int i = 1; i < text.length(); i++) {
      if (!isSymbolPart(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(current())) {
      next();
    }
  }

  private boolean atEnd() {
    return pos >= input.length();
  }

  private char current() {
    return input.charAt(pos);
  }

  private void next() {
    if (input.charAt(pos) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }
}
