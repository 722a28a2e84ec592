package hypertag.frontend.tree;

import java.util.Collections;
import java.util.Map;

import hypertag.common.lang.Slot;
import hypertag.common.lang.ValueSlot;

/**
 * Symbols a document starts with and the symbols it leaves defined at
 * its top level, both filled in by the analyzer.
 */
public class Document {
  private final Map<String, ValueSlot> slotsIn;
  private final Map<String, Slot> slotsOut;

  public Document(Map<String, ValueSlot> slotsIn, Map<String, Slot> slotsOut) {
    this.slotsIn = Collections.unmodifiableMap(slotsIn);
    this.slotsOut = Collections.unmodifiableMap(slotsOut);
  }

  public Map<String, ValueSlot> getSlotsIn() {
    return slotsIn;
  }

  public Map<String, Slot> getSlotsOut() {
    return slotsOut;
  }
}
