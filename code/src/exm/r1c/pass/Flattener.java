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
package exm.r1c.pass;

import java.util.ArrayList;
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
import exm.r1c.ast.AST.Var;
import exm.r1c.common.exceptions.R1RuntimeError;
import exm.r1c.ir.IRTree.Atom;
import exm.r1c.ir.IRTree.IRProgram;
import exm.r1c.ir.IRTree.SimpleExpr;
import exm.r1c.ir.IRTree.Statement;

/**
 * Linearize an expression tree into assignments plus a tail expression.
 * Operands are evaluated left to right, innermost first.
 *
 * Precondition: variable names are unique (uniquify has run), so let
 * bindings can be assigned directly to their bound name.
 */
public class Flattener {

  public static final String TEMP_PREFIX = "tmp:";

  private final Logger logger;
  private final List<Statement> statements = new ArrayList<Statement>();
  /** Names assigned so far in the output */
  private final Set<String> defined = new HashSet<String>();
  private int tempCounter = 0;

  private Flattener(Logger logger) {
    this.logger = logger;
  }

  public static IRProgram flatten(Logger logger, Program program) {
    Flattener f = new Flattener(logger);
    SimpleExpr tail = f.flattenExpr(program.body());
    IRProgram result = new IRProgram(f.statements, tail);
    if (logger.isDebugEnabled()) {
      logger.debug("Flattened into " + result.statements().size()
                   + " statements");
    }
    return result;
  }

  /**
   * Emit statements for e
   * @return simple expression giving the value of e
   */
  private SimpleExpr flattenExpr(Expr e) {
    switch (e.kind()) {
      case FIXNUM:
        return SimpleExpr.atom(Atom.createIntLit(((Fixnum)e).value()));
      case VAR:
        return SimpleExpr.atom(varRef((Var)e));
      case READ:
        return SimpleExpr.read();
      case NEG:
        return SimpleExpr.neg(flattenToAtom(((Neg)e).operand()));
      case ADD: {
        Add add = (Add)e;
        Atom left = flattenToAtom(add.left());
        Atom right = flattenToAtom(add.right());
        return SimpleExpr.add(left, right);
      }
      case LET: {
        Let let = (Let)e;
        SimpleExpr bound = flattenExpr(let.boundExpr());
        if (defined.contains(let.boundName())) {
          throw new R1RuntimeError("Variable " + let.boundName() +
              " bound twice: variable names must be unique before flattening");
        }
        emit(let.boundName(), bound);
        return flattenExpr(let.body());
      }
      default:
        throw new R1RuntimeError("Unknown expression kind " + e.kind());
    }
  }

  /**
   * Flatten an operand, assigning it to a temporary if it isn't an atom
   */
  private Atom flattenToAtom(Expr e) {
    SimpleExpr simple = flattenExpr(e);
    if (simple.isAtom()) {
      return simple.getAtom();
    }
    String tmp = TEMP_PREFIX + (++tempCounter);
    emit(tmp, simple);
    return Atom.createVar(tmp);
  }

  private Atom varRef(Var var) {
    if (!defined.contains(var.name())) {
      throw new R1RuntimeError("Reference to " + var.name() + " before any"
          + " assignment: uniquify skipped or produced inconsistent names");
    }
    return Atom.createVar(var.name());
  }

  private void emit(String target, SimpleExpr expr) {
    Statement s = new Statement(target, expr);
    if (logger.isTraceEnabled()) {
      logger.trace("Emit " + s);
    }
    statements.add(s);
    defined.add(target);
  }
}
