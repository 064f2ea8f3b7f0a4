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
package exm.r1c.ui;

import java.io.PrintStream;

import org.apache.log4j.Logger;

import exm.r1c.ast.AST.Program;
import exm.r1c.common.Settings;
import exm.r1c.common.exceptions.InvalidOptionException;
import exm.r1c.common.exceptions.R1Fatal;
import exm.r1c.common.exceptions.UserException;
import exm.r1c.frontend.Parser;
import exm.r1c.ir.IRTree.IRProgram;
import exm.r1c.pass.Flattener;
import exm.r1c.pass.PartialEvaluator;
import exm.r1c.pass.PassPipeline;
import exm.r1c.pass.Uniquifier;

/**
 * This is the main entry point to the compiler
 */
public class R1Compiler {

  private final Logger logger;

  public R1Compiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Compile source text to flattened form.  Errors are reported to
   * stderr and converted to R1Fatal with the matching exit code.
   *
   * @param source
   * @param treeOutput if not null, trees are printed here after each pass
   * @return the flattened program
   */
  public IRProgram compileOrFail(String source, PrintStream treeOutput) {
    try {
      return compile(source, treeOutput);
    }
    catch (UserException e) {
      System.err.println("r1c error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug("User error", e);
      throw new R1Fatal(ExitCode.ERROR_USER.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new R1Fatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (RuntimeException e) {
      reportInternalError(e);
      throw new R1Fatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run the whole pipeline: parse, partial eval, uniquify, flatten.
   * Each step completes before the next starts.
   */
  public IRProgram compile(String source, PrintStream treeOutput)
      throws UserException {
    logger.debug("R1C starting");
    Program prog = Parser.parse(source);
    if (treeOutput != null) {
      prog.log(treeOutput, "input");
    }

    buildPipeline(treeOutput).runPipeline(logger, prog);

    IRProgram result = Flattener.flatten(logger, prog);
    if (treeOutput != null) {
      result.log(treeOutput, "after Flatten");
    }
    logger.debug("R1C done");
    return result;
  }

  public static PassPipeline buildPipeline(PrintStream treeOutput)
      throws InvalidOptionException {
    PassPipeline pipeline = new PassPipeline(treeOutput);
    pipeline.addPass(new PartialEvaluator(
                 Settings.getBoolean(Settings.PARTIAL_EVAL_FOLD_LET)));
    pipeline.addPass(new Uniquifier(
                 Settings.getBoolean(Settings.UNIQUIFY_RENAME_BOUND_EXPR)));
    return pipeline;
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("R1C INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
