package hypertag.backend;

import java.util.Collections;
import java.util.Map;

import hypertag.common.exceptions.UserException;
import hypertag.common.lang.State;
import hypertag.dom.HRoot;

/**
 * Result of translating a document: the DOM, the top-level symbols that
 * ended up with a value, and the final state those values live in.
 */
public class TranslatedDocument {
  private final HRoot dom;
  private final Map<String, Object> symbols;
  private final State state;

  public TranslatedDocument(HRoot dom, Map<String, Object> symbols,
                            State state) {
    this.dom = dom;
    this.symbols = Collections.unmodifiableMap(symbols);
    this.state = state;
  }

  public HRoot getDom() {
    return dom;
  }

  /** Values by prefixed symbol, e.g. "$x" or "%H" */
  public Map<String, Object> getSymbols() {
    return symbols;
  }

  /** Values of top-level slots, by slot id */
  public State getState() {
    return state;
  }

  public String render() throws UserException {
    return dom.render();
  }
}
