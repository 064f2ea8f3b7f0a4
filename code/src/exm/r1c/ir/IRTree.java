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
package exm.r1c.ir;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.r1c.common.exceptions.R1RuntimeError;

/**
 * Flattened intermediate form: a list of assignments of simple
 * expressions to variables, followed by a tail simple expression.
 */
public class IRTree {

  /**
   * Operand of a simple expression: an integer literal or a variable
   */
  public static class Atom {
    public static enum AtomKind {
      INTVAL, VAR
    }

    public final AtomKind kind;
    private final long intlit;
    private final String var;

    private Atom(AtomKind kind, long intlit, String var) {
      this.kind = kind;
      this.intlit = intlit;
      this.var = var;
    }

    public static Atom createIntLit(long v) {
      return new Atom(AtomKind.INTVAL, v, null);
    }

    public static Atom createVar(String name) {
      assert(name != null);
      return new Atom(AtomKind.VAR, -1, name);
    }

    public boolean isVar() {
      return kind == AtomKind.VAR;
    }

    public long getIntLit() {
      if (kind == AtomKind.INTVAL) {
        return intlit;
      } else {
        throw new R1RuntimeError("getIntLit for non-int atom");
      }
    }

    public String getVar() {
      if (kind == AtomKind.VAR) {
        return var;
      } else {
        throw new R1RuntimeError("getVar for non-variable atom");
      }
    }

    @Override
    public String toString() {
      return isVar() ? var : Long.toString(intlit);
    }

    @Override
    public int hashCode() {
      return isVar() ? var.hashCode() : Long.valueOf(intlit).hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Atom))
        return false;
      Atom other = (Atom) obj;
      if (kind != other.kind)
        return false;
      return isVar() ? var.equals(other.var) : intlit == other.intlit;
    }
  }

  /**
   * An atom, (read), or a single negation or addition over atoms
   */
  public static class SimpleExpr {
    public static enum Opcode {
      ATOM, READ, NEG, ADD
    }

    public final Opcode op;
    private final List<Atom> args;

    private SimpleExpr(Opcode op, List<Atom> args) {
      this.op = op;
      this.args = args;
    }

    public static SimpleExpr atom(Atom a) {
      return new SimpleExpr(Opcode.ATOM, ImmutableList.of(a));
    }

    public static SimpleExpr read() {
      return new SimpleExpr(Opcode.READ, ImmutableList.<Atom>of());
    }

    public static SimpleExpr neg(Atom a) {
      return new SimpleExpr(Opcode.NEG, ImmutableList.of(a));
    }

    public static SimpleExpr add(Atom left, Atom right) {
      return new SimpleExpr(Opcode.ADD, ImmutableList.of(left, right));
    }

    public boolean isAtom() {
      return op == Opcode.ATOM;
    }

    public Atom getAtom() {
      if (op != Opcode.ATOM) {
        throw new R1RuntimeError("getAtom for " + op);
      }
      return args.get(0);
    }

    public List<Atom> args() {
      return args;
    }

    @Override
    public String toString() {
      switch (op) {
        case ATOM:
          return args.get(0).toString();
        case READ:
          return "(read)";
        case NEG:
          return "(- " + args.get(0) + ")";
        case ADD:
          return "(+ " + args.get(0) + " " + args.get(1) + ")";
        default:
          throw new R1RuntimeError("Unknown opcode " + op);
      }
    }

    @Override
    public int hashCode() {
      return 31 * op.hashCode() + args.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof SimpleExpr))
        return false;
      SimpleExpr other = (SimpleExpr) obj;
      return op == other.op && args.equals(other.args);
    }
  }

  /**
   * target := expr
   */
  public static class Statement {
    public final String target;
    public final SimpleExpr expr;

    public Statement(String target, SimpleExpr expr) {
      assert(target != null && expr != null);
      this.target = target;
      this.expr = expr;
    }

    @Override
    public String toString() {
      return target + " := " + expr;
    }
  }

  public static class IRProgram implements Iterable<Statement> {
    private final ImmutableList<Statement> statements;
    private final SimpleExpr tail;

    public IRProgram(List<Statement> statements, SimpleExpr tail) {
      this.statements = ImmutableList.copyOf(statements);
      this.tail = tail;
    }

    public List<Statement> statements() {
      return statements;
    }

    public SimpleExpr tail() {
      return tail;
    }

    /**
     * Walk statements in execution order
     */
    @Override
    public Iterator<Statement> iterator() {
      return statements.iterator();
    }

    public void log(PrintStream out, String comment) {
      out.println("# " + comment);
      out.print(this.toString());
      out.println();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      for (Statement s: statements) {
        sb.append(s).append('\n');
      }
      sb.append("return ").append(tail).append('\n');
      return sb.toString();
    }
  }
}
