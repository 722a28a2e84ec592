package hypertag.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbols exported by an importable module, keyed by prefixed symbol
 * ("%tag", "$var"), together with the state its hypertags were
 * defined in.
 */
public class Module {
  private final Map<String, Object> symbols;
  private final Map<Integer, Object> state;

  public Module(Map<String, Object> symbols, Map<Integer, Object> state) {
    this.symbols = Collections.unmodifiableMap(
                        new LinkedHashMap<String, Object>(symbols));
    this.state = state == null ? Collections.<Integer, Object>emptyMap()
                               : Collections.unmodifiableMap(state);
  }

  public Module(Map<String, Object> symbols) {
    this(symbols, null);
  }

  public Map<String, Object> getSymbols() {
    return symbols;
  }

  public boolean contains(String symbol) {
    return symbols.containsKey(symbol);
  }

  public Object get(String symbol) {
    return symbols.get(symbol);
  }

  /** Slot values of the module's top level, by slot id */
  public Map<Integer, Object> getState() {
    return state;
  }
}
