package hypertag.backend;

import java.util.List;
import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.State;
import hypertag.dom.Sequence;
import hypertag.frontend.tree.HypertagDef;
import hypertag.runtime.Runtime;
import hypertag.runtime.Tag;

/**
 * Hypertag defined in a document with a %name block.  Unlike external
 * tags, it is expanded right away, during translation.
 */
public class NativeTag implements Tag {
  private final HypertagAST definition;
  private final Runtime runtime;

  public NativeTag(HypertagAST definition, Runtime runtime) {
    assert(definition.getKind() == NodeKind.BLOCK_DEF);
    this.definition = definition;
    this.runtime = runtime;
  }

  public String getName() {
    return ((HypertagDef) definition.getDescriptor()).getName();
  }

  @Override
  public Sequence translateTag(State state, Sequence body, List<Object> attrs,
                       Map<String, Object> kwattrs, HypertagAST caller)
                                                  throws UserException {
    return new Translator(runtime).expand(definition, state, body, attrs,
                                          kwattrs, caller);
  }

  @Override
  public String toString() {
    return "%" + getName();
  }
}
