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
package hypertag.dom;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.UserException;
import hypertag.common.exceptions.VoidTagException;
import hypertag.runtime.ExternalTag;

/**
 * Node of the DOM tree.  A node with a tag passes its body and the actual
 * attribute values to the tag when rendered; a node without a tag renders
 * its body as is.
 */
public class HNode {

  protected final Sequence body;

  private final ExternalTag tag;
  private final List<Object> attrs;
  private final Map<String, Object> kwattrs;

  /** Start on a new line when rendered, with a leading newline */
  private boolean outline = false;

  /**
   * Absolute indentation when starting with a newline, otherwise relative
   * to the parent; null for an inline node
   */
  protected String indent = null;

  public HNode(Sequence body, ExternalTag tag, List<Object> attrs,
               Map<String, Object> kwattrs) {
    this.body = body == null ? new Sequence() : body;
    this.tag = tag;
    this.attrs = attrs == null ? Collections.emptyList() : attrs;
    this.kwattrs = kwattrs == null ? Collections.<String, Object>emptyMap() : kwattrs;
  }

  public HNode(Sequence body, String indent) {
    this(body, null, null, null);
    setIndent(indent);
  }

  public Sequence getBody() {
    return body;
  }

  public ExternalTag getTag() {
    return tag;
  }

  public List<Object> getAttrs() {
    return attrs;
  }

  public Map<String, Object> getKwattrs() {
    return kwattrs;
  }

  public boolean isOutline() {
    return outline;
  }

  public void setOutline() {
    this.outline = true;
  }

  public String getIndent() {
    return indent;
  }

  /**
   * Set absolute indentation and make the indentation of children
   * relative to it.
   */
  public void setIndent(String indent) {
    this.indent = indent;
    if (indent != null && !indent.isEmpty()) {
      for (HNode child: body) {
        child.relativeIndent(indent);
      }
    }
  }

  /**
   * Convert absolute indentation to relative by removing the parent's
   * prefix.  Inline nodes pass the call on to their children.
   */
  void relativeIndent(String parentIndent) {
    if (indent == null) {
      for (HNode child: body) {
        child.relativeIndent(parentIndent);
      }
    } else if (indent.startsWith("\n")) {
      if (!indent.startsWith(parentIndent)) {
        throw new HypertagRuntimeError("indentation '" + indent +
            "' is not nested in parent indentation '" + parentIndent + "'");
      }
      indent = indent.substring(parentIndent.length());
    }
  }

  public String render() throws UserException {
    String text = (outline ? "\n" : "") + renderBody();
    if (outline && indent != null && !indent.isEmpty()) {
      assert !indent.startsWith("\n") : "indentation is still absolute";
      text = Indents.addIndent(text, indent);
    }
    return text;
  }

  protected String renderBody() throws UserException {
    if (tag == null) {
      return body.render();
    }
    Object content;
    if (tag.isVoid()) {
      if (!body.isEmpty()) {
        throw new VoidTagException("body must be empty for a void tag " + tag);
      }
      content = null;
    } else if (tag.isText()) {
      content = body.render();
    } else {
      content = body;
    }
    return tag.expand(content, attrs, kwattrs);
  }

  @Override
  public String toString() {
    return (tag == null ? "HNode" : "HNode<" + tag + ">") + body.getNodes();
  }
}
