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
package hypertag.frontend;

import java.util.Locale;

/**
 * The four characters that encode indentation changes in preprocessed
 * text: indent and dedent by one space, indent and dedent by one tab.
 * They must not occur in the script being parsed.
 */
public class IndentMarkers {

  public static final char DEFAULT_FIRST = '❨';

  public static final IndentMarkers DEFAULT =
      new IndentMarkers('❨', '❩', '❪', '❫');

  private final char indentS;
  private final char dedentS;
  private final char indentT;
  private final char dedentT;

  public IndentMarkers(char indentS, char dedentS, char indentT, char dedentT) {
    this.indentS = indentS;
    this.dedentS = dedentS;
    this.indentT = indentT;
    this.dedentT = dedentT;
  }

  /**
   * Choose markers that do not collide with characters of the text:
   * the defaults if possible, otherwise the first four free characters
   * counting up from the first default.
   */
  public static IndentMarkers choose(String text) {
    if (!DEFAULT.anyIn(text)) {
      return DEFAULT;
    }
    char chars[] = new char[4];
    char code = DEFAULT_FIRST;
    for (int i = 0; i < 4; i++) {
      while (text.indexOf(code) >= 0) {
        code++;
      }
      chars[i] = code;
      code++;
    }
    return new IndentMarkers(chars[0], chars[1], chars[2], chars[3]);
  }

  public boolean anyIn(String text) {
    return text.indexOf(indentS) >= 0 || text.indexOf(dedentS) >= 0 ||
           text.indexOf(indentT) >= 0 || text.indexOf(dedentT) >= 0;
  }

  public char indentS() {
    return indentS;
  }

  public char dedentS() {
    return dedentS;
  }

  public char indentT() {
    return indentT;
  }

  public char dedentT() {
    return dedentT;
  }

  public char indentFor(char whitespace) {
    return whitespace == ' ' ? indentS : indentT;
  }

  public char dedentFor(char whitespace) {
    return whitespace == ' ' ? dedentS : dedentT;
  }

  /**
   * @return the markers as a regex character-class body
   */
  public String regexClass() {
    StringBuilder sb = new StringBuilder();
    for (char c: new char[] {indentS, dedentS, indentT, dedentT}) {
      sb.append(String.format(Locale.ROOT, "\\x{%X}", (int) c));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "[U+%04X U+%04X U+%04X U+%04X]",
        (int) indentS, (int) dedentS, (int) indentT, (int) dedentT);
  }
}
