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
package exm.r1c.ast;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.r1c.common.exceptions.R1RuntimeError;

/**
 * Abstract syntax tree for R1 expressions.
 *
 * Each interior node exclusively owns its children.  Passes that change the
 * variant of a node (e.g. folding an Add into a Fixnum) do so by replacing
 * the node in its parent's child slot, or in the Program root slot.
 */
public class AST {

  public static enum ExprKind {
    FIXNUM, READ, VAR, NEG, ADD, LET
  }

  public static abstract class Expr {
    public final ExprKind kind;

    protected Expr(ExprKind kind) {
      this.kind = kind;
    }

    public ExprKind kind() {
      return kind;
    }

    /**
     * @return direct children, left to right.  Empty for leaves
     */
    public abstract List<Expr> children();

    public boolean isFixnum() {
      return kind == ExprKind.FIXNUM;
    }

    /**
     * Render in concrete syntax
     */
    public abstract void prettyPrint(StringBuilder sb);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb);
      return sb.toString();
    }
  }

  public static class Fixnum extends Expr {
    private final long value;

    public Fixnum(long value) {
      super(ExprKind.FIXNUM);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(value);
    }
  }

  public static class Read extends Expr {
    public Read() {
      super(ExprKind.READ);
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(read)");
    }
  }

  public static class Var extends Expr {
    private String name;

    public Var(String name) {
      super(ExprKind.VAR);
      assert(name != null);
      this.name = name;
    }

    public String name() {
      return name;
    }

    public void rename(String newName) {
      assert(newName != null);
      this.name = newName;
    }

    @Override
    public List<Expr> children() {
      return Collections.emptyList();
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append(name);
    }
  }

  public static class Neg extends Expr {
    private Expr operand;

    public Neg(Expr operand) {
      super(ExprKind.NEG);
      this.operand = operand;
    }

    public Expr operand() {
      return operand;
    }

    public void replaceOperand(Expr newOperand) {
      this.operand = newOperand;
    }

    @Override
    public List<Expr> children() {
      return Collections.singletonList(operand);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(- ");
      operand.prettyPrint(sb);
      sb.append(")");
    }
  }

  public static class Add extends Expr {
    private Expr left;
    private Expr right;

    public Add(Expr left, Expr right) {
      super(ExprKind.ADD);
      this.left = left;
      this.right = right;
    }

    public Expr left() {
      return left;
    }

    public Expr right() {
      return right;
    }

    public void replaceLeft(Expr newLeft) {
      this.left = newLeft;
    }

    public void replaceRight(Expr newRight) {
      this.right = newRight;
    }

    @Override
    public List<Expr> children() {
      return Arrays.asList(left, right);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(+ ");
      left.prettyPrint(sb);
      sb.append(" ");
      right.prettyPrint(sb);
      sb.append(")");
    }
  }

  public static class Let extends Expr {
    private String boundName;
    private Expr boundExpr;
    private Expr body;

    public Let(String boundName, Expr boundExpr, Expr body) {
      super(ExprKind.LET);
      assert(boundName != null);
      this.boundName = boundName;
      this.boundExpr = boundExpr;
      this.body = body;
    }

    public String boundName() {
      return boundName;
    }

    public Expr boundExpr() {
      return boundExpr;
    }

    public Expr body() {
      return body;
    }

    public void renameBinding(String newName) {
      assert(newName != null);
      this.boundName = newName;
    }

    public void replaceBoundExpr(Expr newBoundExpr) {
      this.boundExpr = newBoundExpr;
    }

    public void replaceBody(Expr newBody) {
      this.body = newBody;
    }

    @Override
    public List<Expr> children() {
      return Arrays.asList(boundExpr, body);
    }

    @Override
    public void prettyPrint(StringBuilder sb) {
      sb.append("(let ([").append(boundName).append(" ");
      boundExpr.prettyPrint(sb);
      sb.append("]) ");
      body.prettyPrint(sb);
      sb.append(")");
    }
  }

  /**
   * Root holder, so that passes can replace the top-level expression
   */
  public static class Program {
    private Expr body;

    public Program(Expr body) {
      if (body == null) {
        throw new R1RuntimeError("Program created with null body");
      }
      this.body = body;
    }

    public Expr body() {
      return body;
    }

    public void replaceBody(Expr newBody) {
      if (newBody == null) {
        throw new R1RuntimeError("Program body replaced with null");
      }
      this.body = newBody;
    }

    public void log(PrintStream out, String comment) {
      out.println("# " + comment);
      out.println(this.toString());
      out.println();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(program ");
      body.prettyPrint(sb);
      sb.append(")");
      return sb.toString();
    }
  }
}
