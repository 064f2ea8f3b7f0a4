package exm.r1c.pass;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.r1c.ast.AST.Program;
import exm.r1c.common.Settings;
import exm.r1c.common.exceptions.InvalidOptionException;
import exm.r1c.common.exceptions.R1RuntimeError;


public class PassPipeline {

  public PassPipeline(PrintStream treeOutput) {
    this.treeOutput = treeOutput;
  }

  private final List<CompilerPass> passes = new ArrayList<CompilerPass>();
  private final PrintStream treeOutput;

  public void addPass(CompilerPass pass) {
    passes.add(pass);
  }

  public List<CompilerPass> getPasses() {
    return passes;
  }

  /**
   * Run each enabled pass in order.  Each pass completes before the
   * next starts.
   */
  public void runPipeline(Logger logger, Program program) {
    for (CompilerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        pass.apply(logger, program);
        if (treeOutput != null) {
          program.log(treeOutput, "after " + pass.getPassName());
        }
      } else {
        logger.debug("Pass disabled: " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(CompilerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new R1RuntimeError("Expected config key " + pass.getConfigEnabledKey()
          + " to exist", e);
    }
  }
}
