package exm.r1c.eval;

import java.util.ArrayList;
import java.util.List;

import exm.r1c.common.exceptions.R1RuntimeError;

/**
 * Supplies values for (read)
 */
public interface InputSource {
  public long readInt();

  /**
   * Returns a fixed sequence of values, failing once they run out
   */
  public static class ListInputSource implements InputSource {
    private final List<Long> values;
    private int next = 0;

    public ListInputSource(List<Long> values) {
      this.values = new ArrayList<Long>(values);
    }

    @Override
    public long readInt() {
      if (next >= values.size()) {
        throw new R1RuntimeError("Input exhausted after " + values.size()
                                 + " reads");
      }
      return values.get(next++);
    }

    /**
     * @return number of values consumed so far
     */
    public int consumed() {
      return next;
    }
  }
}
