package hypertag.backend;

import java.util.List;
import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.State;
import hypertag.dom.Sequence;
import hypertag.runtime.Tag;

/**
 * Native hypertag imported from another document.  It is expanded in the
 * final state of its own module, with the caller's indentation.
 */
public class ImportedTag implements Tag {
  private final NativeTag tag;
  private final Map<Integer, Object> moduleState;

  public ImportedTag(NativeTag tag, Map<Integer, Object> moduleState) {
    this.tag = tag;
    this.moduleState = moduleState;
  }

  public NativeTag getTag() {
    return tag;
  }

  @Override
  public Sequence translateTag(State state, Sequence body, List<Object> attrs,
                       Map<String, Object> kwattrs, HypertagAST caller)
                                                  throws UserException {
    State local = new State(moduleState);
    local.setIndentation(state.getIndentation());
    return tag.translateTag(local, body, attrs, kwattrs, caller);
  }

  @Override
  public String toString() {
    return tag.toString();
  }
}
