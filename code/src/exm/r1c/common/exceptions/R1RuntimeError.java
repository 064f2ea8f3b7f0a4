
package exm.r1c.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug or a misuse of the pass
 * pipeline, never a problem with the user's program.
 * */
public class R1RuntimeError extends RuntimeException
{
  public R1RuntimeError(String msg)
  {
    super(msg);
  }

  public R1RuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
