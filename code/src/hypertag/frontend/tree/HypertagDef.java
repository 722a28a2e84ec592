/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package hypertag.frontend.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.InvalidSyntaxException;

/**
 * Definition of a native hypertag: %name [@body] attr[=default]... body
 */
public class HypertagDef {
  private final String name;

  /** All formal attributes, the body attribute first if present */
  private final List<HypertagAST> attrs;
  private final HypertagAST attrBody;
  private final List<HypertagAST> attrRegular;
  private final Map<String, HypertagAST> attrNames;
  private final HypertagAST body;

  private HypertagDef(String name, List<HypertagAST> attrs, HypertagAST attrBody,
              List<HypertagAST> attrRegular, Map<String, HypertagAST> attrNames,
              HypertagAST body) {
    this.name = name;
    this.attrs = Collections.unmodifiableList(attrs);
    this.attrBody = attrBody;
    this.attrRegular = Collections.unmodifiableList(attrRegular);
    this.attrNames = Collections.unmodifiableMap(attrNames);
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public List<HypertagAST> getAttrs() {
    return attrs;
  }

  /** @return the @body attribute, or null if the tag is void */
  public HypertagAST getAttrBody() {
    return attrBody;
  }

  public List<HypertagAST> getAttrRegular() {
    return attrRegular;
  }

  public HypertagAST getAttr(String attrName) {
    return attrNames.get(attrName);
  }

  public HypertagAST getBody() {
    return body;
  }

  public static HypertagDef fromAST(HypertagAST tree)
                                        throws InvalidSyntaxException {
    assert(tree.getKind() == NodeKind.BLOCK_DEF);
    int count = tree.childCount();
    String name = tree.child(0).getName();
    List<HypertagAST> attrs = new ArrayList<HypertagAST>(
                                        tree.children().subList(1, count - 1));
    HypertagAST body = tree.child(count - 1);

    Map<String, HypertagAST> attrNames = new LinkedHashMap<String, HypertagAST>();
    for (HypertagAST attr: attrs) {
      if (attrNames.containsKey(attr.getName())) {
        throw new InvalidSyntaxException(tree, "duplicate attribute '" +
            attr.getName() + "' in hypertag definition '" + name + "'");
      }
      attrNames.put(attr.getName(), attr);
    }

    HypertagAST attrBody = null;
    List<HypertagAST> attrRegular = attrs;
    if (!attrs.isEmpty() && attrs.get(0).getKind() == NodeKind.ATTR_BODY) {
      attrBody = attrs.get(0);
      attrRegular = attrs.subList(1, attrs.size());
    }
    return new HypertagDef(name, attrs, attrBody, attrRegular, attrNames, body);
  }
}
