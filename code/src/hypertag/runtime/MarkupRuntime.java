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
package hypertag.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

import hypertag.common.Settings;
import hypertag.common.exceptions.InvalidOptionException;
import hypertag.common.lang.Symbols;

/**
 * Runtime for HTML output: element tags for HTML 5 and escaping of
 * plain text, both configured from {@link Settings}.
 */
public class MarkupRuntime extends StandardRuntime {

  /** Elements that take no body */
  static final Set<String> VOID_TAGS = ImmutableSet.of(
      "area", "base", "br", "col", "embed", "hr", "img", "input", "link",
      "meta", "param", "source", "track", "wbr");

  static final Set<String> TAGS = ImmutableSet.of(
      "a", "abbr", "address", "article", "aside", "audio", "b", "bdi", "bdo",
      "blockquote", "body", "button", "canvas", "caption", "cite", "code",
      "colgroup", "data", "datalist", "dd", "del", "details", "dfn", "dialog",
      "div", "dl", "dt", "em", "fieldset", "figcaption", "figure", "footer",
      "form", "h1", "h2", "h3", "h4", "h5", "h6", "head", "header", "html",
      "i", "iframe", "ins", "kbd", "label", "legend", "li", "main", "map",
      "mark", "meter", "nav", "noscript", "object", "ol", "optgroup",
      "option", "output", "p", "picture", "pre", "progress", "q", "rp", "rt",
      "ruby", "s", "samp", "script", "section", "select", "small", "span",
      "strong", "style", "sub", "summary", "sup", "table", "tbody", "td",
      "template", "textarea", "tfoot", "th", "thead", "time", "title", "tr",
      "u", "ul", "var", "video");

  private static final String ESCAPED[] = {"&", "<", ">"};
  private static final String ENTITIES[] = {"&amp;", "&lt;", "&gt;"};

  private final boolean escapeHtml;
  private final Map<String, Object> defaults;

  public MarkupRuntime() throws InvalidOptionException {
    Settings.checkOneOf(Settings.ESCAPE, Settings.escapeModes());
    escapeHtml = Settings.get(Settings.ESCAPE).equalsIgnoreCase("html");
    boolean xhtml = Settings.getBoolean(Settings.XHTML);

    defaults = new LinkedHashMap<String, Object>(super.importDefault());
    for (String name: TAGS) {
      defaults.put(Symbols.tag(name), new MarkupTag(name, false, xhtml));
    }
    for (String name: VOID_TAGS) {
      defaults.put(Symbols.tag(name), new MarkupTag(name, true, xhtml));
    }
  }

  @Override
  public String escape(String text) {
    if (!escapeHtml) {
      return text;
    }
    return StringUtils.replaceEach(text, ESCAPED, ENTITIES);
  }

  @Override
  public Map<String, Object> importDefault() {
    return defaults;
  }
}
