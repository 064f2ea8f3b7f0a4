package exm.r1c.common.exceptions;

/**
 * Malformed source text: unknown token, wrong arity for a form,
 * unmatched delimiter or trailing input.
 */
public class InvalidSyntaxException extends UserException {

  /**
   * 
   */
  private static final long serialVersionUID = 1060914609057739598L;

  public InvalidSyntaxException(int line, int col, String message) {
    super(line, col, message);
  }

}
