package hypertag.common.lang;

/**
 * Slot whose value is known at analysis time: a global symbol or a
 * hypertag definition.  The value still has to be written into the state
 * when the enclosing block is translated.
 */
public class ValueSlot extends Slot {
  private final Object value;

  public ValueSlot(int id, String symbol, int depth, int hypertagDepth,
                   Object value) {
    super(id, symbol, depth, hypertagDepth);
    this.value = value;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(State state) {
    set(state, value);
  }
}
