package hypertag.frontend.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Maps;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;

/**
 * Occurrence of a tag with its actual attributes.  Unnamed and named
 * attributes may be mixed; unnamed ones are passed first.  A name may
 * repeat, in which case its values are space-concatenated.
 */
public class TagExpand {
  /** Name used when only shorthand attributes are given: .x or #x */
  public static final String DEFAULT_NAME = "div";

  private final String name;
  private final List<HypertagAST> attrs;
  private final List<HypertagAST> unnamed;
  private final List<Map.Entry<String, HypertagAST>> named;

  private TagExpand(String name, List<HypertagAST> attrs,
                    List<HypertagAST> unnamed,
                    List<Map.Entry<String, HypertagAST>> named) {
    this.name = name;
    this.attrs = attrs;
    this.unnamed = Collections.unmodifiableList(unnamed);
    this.named = Collections.unmodifiableList(named);
  }

  public String getName() {
    return name;
  }

  public List<HypertagAST> getAttrs() {
    return attrs;
  }

  /** @return expressions of unnamed attributes */
  public List<HypertagAST> getUnnamed() {
    return unnamed;
  }

  /** @return names and expressions of named attributes, in source order */
  public List<Map.Entry<String, HypertagAST>> getNamed() {
    return named;
  }

  public static TagExpand fromAST(HypertagAST tree) {
    assert(tree.getKind() == NodeKind.TAG_EXPAND);
    String name;
    List<HypertagAST> attrs;
    HypertagAST head = tree.child(0);
    if (head.getKind() == NodeKind.NAME_ID) {
      name = head.getName();
      attrs = tree.children(1);
    } else {
      name = DEFAULT_NAME;
      attrs = tree.children();
    }

    List<HypertagAST> unnamed = new ArrayList<HypertagAST>();
    List<Map.Entry<String, HypertagAST>> named =
                          new ArrayList<Map.Entry<String, HypertagAST>>();
    for (HypertagAST attr: attrs) {
      HypertagAST expr = attr.child(attr.childCount() - 1);
      if (attr.getKind() == NodeKind.ATTR_UNNAMED) {
        unnamed.add(expr);
      } else {
        named.add(Maps.immutableEntry(attr.getName(), expr));
      }
    }
    return new TagExpand(name, attrs, unnamed, named);
  }
}
