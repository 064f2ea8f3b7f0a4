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

import org.apache.log4j.Logger;

import exm.r1c.ast.AST.Add;
import exm.r1c.ast.AST.Expr;
import exm.r1c.ast.AST.Fixnum;
import exm.r1c.ast.AST.Let;
import exm.r1c.ast.AST.Neg;
import exm.r1c.ast.AST.Program;
import exm.r1c.common.Settings;

/**
 * Constant folding of negation and addition over integer literals.
 *
 * Let nodes are opaque unless foldLet is set: neither the bound
 * expression nor the body is visited.
 */
public class PartialEvaluator implements CompilerPass {

  private final boolean foldLet;

  public PartialEvaluator() {
    this(false);
  }

  public PartialEvaluator(boolean foldLet) {
    this.foldLet = foldLet;
  }

  @Override
  public String getPassName() {
    return "Partial evaluation";
  }

  @Override
  public String getConfigEnabledKey() {
    return Settings.OPT_PARTIAL_EVAL;
  }

  @Override
  public void apply(Logger logger, Program program) {
    program.replaceBody(fold(logger, program.body()));
  }

  /**
   * Fold the tree rooted at e in post-order
   * @return e, or a Fixnum replacing it
   */
  public Expr fold(Logger logger, Expr e) {
    switch (e.kind()) {
      case NEG: {
        Neg neg = (Neg)e;
        neg.replaceOperand(fold(logger, neg.operand()));
        if (neg.operand().isFixnum()) {
          Fixnum result = new Fixnum(-((Fixnum)neg.operand()).value());
          logFold(logger, neg, result);
          return result;
        }
        return neg;
      }
      case ADD: {
        Add add = (Add)e;
        add.replaceLeft(fold(logger, add.left()));
        add.replaceRight(fold(logger, add.right()));
        if (add.left().isFixnum() && add.right().isFixnum()) {
          Fixnum result = new Fixnum(((Fixnum)add.left()).value() +
                                     ((Fixnum)add.right()).value());
          logFold(logger, add, result);
          return result;
        }
        return add;
      }
      case LET:
        if (foldLet) {
          Let let = (Let)e;
          let.replaceBoundExpr(fold(logger, let.boundExpr()));
          let.replaceBody(fold(logger, let.body()));
        }
        return e;
      default:
        // FIXNUM, READ, VAR
        return e;
    }
  }

  private static void logFold(Logger logger, Expr from, Fixnum to) {
    if (logger.isTraceEnabled()) {
      logger.trace("Folded " + from + " => " + to);
    }
  }
}
