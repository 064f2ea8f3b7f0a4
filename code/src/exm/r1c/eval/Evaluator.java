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
package exm.r1c.eval;

import java.util.HashMap;
import java.util.Map;

import exm.r1c.ast.AST.Add;
import exm.r1c.ast.AST.Expr;
import exm.r1c.ast.AST.Fixnum;
import exm.r1c.ast.AST.Let;
import exm.r1c.ast.AST.Neg;
import exm.r1c.ast.AST.Var;
import exm.r1c.common.exceptions.R1RuntimeError;
import exm.r1c.ir.IRTree.Atom;
import exm.r1c.ir.IRTree.IRProgram;
import exm.r1c.ir.IRTree.SimpleExpr;
import exm.r1c.ir.IRTree.Statement;

/**
 * Reference interpreter for both the tree and flattened forms.
 * Arithmetic wraps on overflow, as in the partial evaluator.
 */
public class Evaluator {

  private final InputSource input;

  public Evaluator(InputSource input) {
    this.input = input;
  }

  public long eval(Expr e) {
    return eval(e, new HashMap<String, Long>());
  }

  private long eval(Expr e, Map<String, Long> env) {
    switch (e.kind()) {
      case FIXNUM:
        return ((Fixnum)e).value();
      case READ:
        return input.readInt();
      case VAR:
        return lookup(env, ((Var)e).name());
      case NEG:
        return -eval(((Neg)e).operand(), env);
      case ADD: {
        Add add = (Add)e;
        long left = eval(add.left(), env);
        long right = eval(add.right(), env);
        return left + right;
      }
      case LET: {
        Let let = (Let)e;
        long bound = eval(let.boundExpr(), env);
        Map<String, Long> inner = new HashMap<String, Long>(env);
        inner.put(let.boundName(), bound);
        return eval(let.body(), inner);
      }
      default:
        throw new R1RuntimeError("Unknown expression kind " + e.kind());
    }
  }

  public long eval(IRProgram prog) {
    Map<String, Long> env = new HashMap<String, Long>();
    for (Statement s: prog) {
      env.put(s.target, eval(s.expr, env));
    }
    return eval(prog.tail(), env);
  }

  private long eval(SimpleExpr e, Map<String, Long> env) {
    switch (e.op) {
      case ATOM:
        return eval(e.getAtom(), env);
      case READ:
        return input.readInt();
      case NEG:
        return -eval(e.args().get(0), env);
      case ADD:
        return eval(e.args().get(0), env) + eval(e.args().get(1), env);
      default:
        throw new R1RuntimeError("Unknown opcode " + e.op);
    }
  }

  private static long eval(Atom a, Map<String, Long> env) {
    return a.isVar() ? lookup(env, a.getVar()) : a.getIntLit();
  }

  private static long lookup(Map<String, Long> env, String name) {
    Long val = env.get(name);
    if (val == null) {
      throw new R1RuntimeError("Unbound variable " + name);
    }
    return val;
  }
}
