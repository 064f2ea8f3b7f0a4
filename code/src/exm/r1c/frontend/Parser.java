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

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.r1c.ast.AST.Add;
import exm.r1c.ast.AST.Expr;
import exm.r1c.ast.AST.Fixnum;
import exm.r1c.ast.AST.Let;
import exm.r1c.ast.AST.Neg;
import exm.r1c.ast.AST.Program;
import exm.r1c.ast.AST.Read;
import exm.r1c.ast.AST.Var;
import exm.r1c.common.Logging;
import exm.r1c.common.exceptions.InvalidSyntaxException;
import exm.r1c.frontend.Token.TokenType;

/**
 * Recursive descent parser for the S-expression syntax:
 * <pre>
 * exp ::= integer-literal
 *       | symbol
 *       | ( read )
 *       | ( - exp )
 *       | ( + exp exp )
 *       | ( let ( [ symbol exp ] ) exp )
 * </pre>
 */
public class Parser {

  private static final Set<String> RESERVED = new HashSet<String>(
                        Arrays.asList("read", "let", "+", "-"));

  private final Logger logger = Logging.getR1CLogger();
  private final List<Token> tokens;
  private int pos = 0;

  private Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parse a complete program.  The entire input must be consumed.
   * @param source
   * @return the root of the tree
   * @throws InvalidSyntaxException if the input is malformed.  No partial
   *          tree is returned in this case
   */
  public static Program parse(String source) throws InvalidSyntaxException {
    List<Token> tokens = new Tokenizer(source).tokenize();
    Parser p = new Parser(tokens);
    Expr body = p.expr();
    Token trailing = p.peek();
    if (trailing.type != TokenType.EOF) {
      throw error(trailing, "unexpected " + trailing.describe()
                            + " after end of expression");
    }
    Program prog = new Program(body);
    if (p.logger.isDebugEnabled()) {
      p.logger.debug("Parsed: " + prog);
    }
    return prog;
  }

  private Expr expr() throws InvalidSyntaxException {
    Token t = advance();
    switch (t.type) {
      case INTEGER:
        return fixnum(t);
      case SYMBOL:
        return new Var(checkVarName(t));
      case LPAREN:
        return form(t);
      default:
        throw error(t, "expected expression but got " + t.describe());
    }
  }

  private Expr form(Token open) throws InvalidSyntaxException {
    Token head = advance();
    Expr result;
    if (head.isSymbol("read")) {
      result = new Read();
    } else if (head.isSymbol("-")) {
      result = new Neg(expr());
    } else if (head.isSymbol("+")) {
      Expr left = expr();
      Expr right = expr();
      result = new Add(left, right);
    } else if (head.isSymbol("let")) {
      result = let();
    } else {
      throw error(head, "expected one of read, -, +, let after '(' but got "
                        + head.describe());
    }
    expectClose(open, head.text);
    return result;
  }

  private Let let() throws InvalidSyntaxException {
    expect(TokenType.LPAREN, "'(' to open let bindings");
    expect(TokenType.LBRACKET, "'[' to open let binding");
    Token name = advance();
    if (name.type != TokenType.SYMBOL) {
      throw error(name, "expected variable name in let binding but got "
                        + name.describe());
    }
    String boundName = checkVarName(name);
    Expr boundExpr = expr();
    expect(TokenType.RBRACKET, "']' to close let binding");
    expect(TokenType.RPAREN, "')' to close let bindings");
    Expr body = expr();
    return new Let(boundName, boundExpr, body);
  }

  private void expectClose(Token open, String formName)
      throws InvalidSyntaxException {
    Token t = advance();
    if (t.type == TokenType.EOF) {
      throw error(t, "unmatched '(' at " + open.line + ":" + open.column);
    } else if (t.type != TokenType.RPAREN) {
      throw error(t, "too many arguments to " + formName + ": expected ')'"
                   + " but got " + t.describe());
    }
  }

  private void expect(TokenType type, String what)
      throws InvalidSyntaxException {
    Token t = advance();
    if (t.type != type) {
      throw error(t, "expected " + what + " but got " + t.describe());
    }
  }

  private static Fixnum fixnum(Token t) throws InvalidSyntaxException {
    try {
      return new Fixnum(Long.parseLong(t.text));
    } catch (NumberFormatException e) {
      throw error(t, "integer literal out of range: " + t.text);
    }
  }

  private static String checkVarName(Token t) throws InvalidSyntaxException {
    if (RESERVED.contains(t.text)) {
      throw error(t, "'" + t.text + "' cannot be used as a variable");
    }
    return t.text;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token advance() {
    Token t = tokens.get(pos);
    // EOF is sticky
    if (t.type != TokenType.EOF) {
      pos++;
    }
    return t;
  }

  private static InvalidSyntaxException error(Token t, String msg) {
    return new InvalidSyntaxException(t.line, t.column, msg);
  }
}
