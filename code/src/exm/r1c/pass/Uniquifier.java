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

import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

import exm.r1c.ast.AST.Expr;
import exm.r1c.ast.AST.ExprKind;
import exm.r1c.ast.AST.Let;
import exm.r1c.ast.AST.Program;
import exm.r1c.ast.AST.Var;
import exm.r1c.common.exceptions.R1RuntimeError;

/**
 * Rename variables so that each let binding has a distinct name.
 * A reference takes the suffix of the innermost enclosing binding of its
 * name.  Free references get suffix 0.
 *
 * The bound expression of a let is left alone unless renameBoundExpr
 * is set, in which case it is renamed in the enclosing scope.  A name left
 * alone in a bound expression must not spell a name this pass produced,
 * otherwise it would silently resolve to an unrelated binding.
 */
public class Uniquifier implements CompilerPass {

  /** Inserted between a name ending in a digit and its suffix */
  public static final char SUFFIX_SEPARATOR = ':';

  private final boolean renameBoundExpr;

  /** Names written by the current traversal */
  private final Set<String> produced = new HashSet<String>();

  /** Names in bound expressions the current traversal left alone */
  private final Set<String> untouched = new HashSet<String>();

  public Uniquifier() {
    this(false);
  }

  public Uniquifier(boolean renameBoundExpr) {
    this.renameBoundExpr = renameBoundExpr;
  }

  @Override
  public String getPassName() {
    return "Uniquify variable names";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public void apply(Logger logger, Program program) {
    SymbolTable table = new SymbolTable();
    produced.clear();
    untouched.clear();
    uniquify(logger, program.body(), table);
    if (!table.isEmpty()) {
      throw new R1RuntimeError("Symbol table not restored after uniquify: "
                               + table);
    }
    checkUntouchedNames();
  }

  /**
   * @throws R1RuntimeError if an unrenamed name in a bound expression
   *      coincides with a renamed one
   */
  public void checkUntouchedNames() {
    Set<String> clash = Sets.intersection(untouched, produced);
    if (!clash.isEmpty()) {
      throw new R1RuntimeError("Unrenamed names in let initializers " + clash
          + " coincide with renamed variables");
    }
  }

  private void collectVarNames(Expr e, Set<String> names) {
    if (e.kind() == ExprKind.VAR) {
      names.add(((Var)e).name());
    }
    for (Expr child: e.children()) {
      collectVarNames(child, names);
    }
  }

  /**
   * Rename variables in tree in place.  The table is left in the state
   * it was in on entry.
   */
  public void uniquify(Logger logger, Expr e, SymbolTable table) {
    switch (e.kind()) {
      case VAR: {
        Var var = (Var)e;
        String newName = suffixName(var.name(), table.get(var.name()));
        if (logger.isTraceEnabled()) {
          logger.trace("Rename reference " + var.name() + " => " + newName);
        }
        var.rename(newName);
        produced.add(newName);
        break;
      }
      case LET: {
        Let let = (Let)e;
        String name = let.boundName();
        if (renameBoundExpr) {
          uniquify(logger, let.boundExpr(), table);
        } else {
          collectVarNames(let.boundExpr(), untouched);
        }
        int saved = table.get(name);
        int count = table.enterScope(name);
        try {
          uniquify(logger, let.body(), table);
        } finally {
          table.store(name, saved);
        }
        String newName = suffixName(name, count);
        if (logger.isTraceEnabled()) {
          logger.trace("Rename binding " + name + " => " + newName);
        }
        let.renameBinding(newName);
        produced.add(newName);
        break;
      }
      default:
        // NEG, ADD recurse.  FIXNUM, READ have no children
        for (Expr child: e.children()) {
          uniquify(logger, child, table);
        }
    }
  }

  /**
   * Build name with counter appended.  A separator is added if name
   * already ends with a digit so that different (name, count) pairs
   * can't produce the same result.
   */
  public static String suffixName(String name, int count) {
    assert(count >= 0);
    StringBuilder sb = new StringBuilder(name);
    if (name.length() > 0 &&
        Character.isDigit(name.charAt(name.length() - 1))) {
      sb.append(SUFFIX_SEPARATOR);
    }
    sb.append(count);
    return sb.toString();
  }
}
