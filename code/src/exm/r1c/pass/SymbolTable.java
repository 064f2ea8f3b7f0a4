package exm.r1c.pass;

import java.util.HashMap;
import java.util.Map;

/**
 * Rename counters for variable names, used while uniquifying.
 * Absent names have counter 0.  Entering a scope for a name is done by
 * saving the counter, calling enterScope() and restoring the saved value
 * with store() on exit, so the visible counters act as a stack of
 * bindings keyed by name.
 *
 * Counters handed out by enterScope() increase monotonically per name,
 * so sibling scopes never share a counter.
 */
public class SymbolTable {
  /** Counter of innermost enclosing binding */
  private final HashMap<String, Integer> map;
  /** Highest counter handed out so far */
  private final HashMap<String, Integer> allocated;

  public SymbolTable() {
    this.map = new HashMap<String, Integer>();
    this.allocated = new HashMap<String, Integer>();
  }

  public int get(String name) {
    Integer res = map.get(name);
    return res == null ? 0 : res;
  }

  public void store(String name, int count) {
    assert(count >= 0) : count;
    if (count == 0) {
      map.remove(name);
    } else {
      map.put(name, count);
    }
  }

  /**
   * Make a new counter current for name
   * @return the new counter value, always > 0
   */
  public int enterScope(String name) {
    Integer prev = allocated.get(name);
    int count = Math.max(get(name), prev == null ? 0 : prev) + 1;
    allocated.put(name, count);
    store(name, count);
    return count;
  }

  /**
   * @return true if all names are at counter 0
   */
  public boolean isEmpty() {
    return map.isEmpty();
  }

  /**
   * @return copy of the non-zero counters
   */
  public Map<String, Integer> snapshot() {
    return new HashMap<String, Integer>(map);
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
