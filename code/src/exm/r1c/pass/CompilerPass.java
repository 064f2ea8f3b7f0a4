package exm.r1c.pass;

import org.apache.log4j.Logger;

import exm.r1c.ast.AST.Program;

/**
 * A tree-rewriting pass over the AST
 */
public interface CompilerPass {
  public abstract String getPassName();
  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();
  public abstract void apply(Logger logger, Program program);
}
