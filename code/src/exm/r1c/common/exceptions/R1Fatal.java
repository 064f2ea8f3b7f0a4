package exm.r1c.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class R1Fatal extends RuntimeException {
  public final int exitCode;

  public R1Fatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
