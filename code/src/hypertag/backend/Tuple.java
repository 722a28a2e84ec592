package hypertag.backend;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable sequence of values, possibly containing nulls.
 */
public class Tuple extends AbstractList<Object> {
  private final Object items[];

  private Tuple(Object items[]) {
    this.items = items;
  }

  public static Tuple of(Object... items) {
    return new Tuple(Arrays.copyOf(items, items.length));
  }

  public static Tuple copyOf(Collection<?> items) {
    return new Tuple(items.toArray());
  }

  @Override
  public Object get(int index) {
    return items[index];
  }

  @Override
  public int size() {
    return items.length;
  }
}
