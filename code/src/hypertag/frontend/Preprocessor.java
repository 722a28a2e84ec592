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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import hypertag.common.Logging;
import hypertag.common.exceptions.IndentationException;

/**
 * Turns leading whitespace into explicit indent/dedent markers so that the
 * grammar can be context free.
 *
 * - markers for an indentation increase are appended to the previous code
 *   line, markers for a decrease likewise (in reverse order)
 * - trailing whitespace is removed from every line
 * - blank lines are moved after any neighbouring dedent markers, so they
 *   become the top margin of the following block
 * - an empty line is prepended, so the first block has a margin too
 */
public class Preprocessor {

  private static final Logger logger = Logging.getHypertagLogger();

  private final IndentMarkers markers;

  public Preprocessor(IndentMarkers markers) {
    this.markers = markers;
  }

  public String preprocess(String text) throws IndentationException {
    List<StringBuilder> lines = new ArrayList<StringBuilder>();
    lines.add(new StringBuilder());
    String current = "";
    int margin = 0;

    // trailing empty line gives equal numbers of indents and dedents
    String script[] = (text + "\n").split("\n", -1);
    int total = script.length - 1;

    for (int i = 0; i < script.length; i++) {
      int lineNum = i + 1;
      String line = script[i].stripTrailing();
      String tail = line.stripLeading();
      String indent = line.substring(0, line.length() - tail.length());

      if (tail.isEmpty() && lineNum <= total) {
        margin++;
        continue;
      }

      StringBuilder last = lines.get(lines.size() - 1);
      if (indent.equals(current)) {
        // no change
      } else if (indent.startsWith(current)) {
        String increment = indent.substring(current.length());
        for (char c: increment.toCharArray()) {
          last.append(markers.indentFor(c));
        }
        current = indent;
      } else if (current.startsWith(indent)) {
        String decrement = current.substring(indent.length());
        for (int k = decrement.length() - 1; k >= 0; k--) {
          last.append(markers.dedentFor(decrement.charAt(k)));
        }
        current = indent;
      } else {
        throw new IndentationException(lineNum);
      }

      lines.add(new StringBuilder(StringUtils.repeat('\n', margin) + tail));
      margin = 0;
    }
    assert current.isEmpty() : "unbalanced indentation: '" + current + "'";

    String output = StringUtils.join(lines, '\n') +
                    StringUtils.repeat('\n', margin);
    assert output.endsWith("\n");
    // drop the empty line appended before the loop
    output = output.substring(0, output.length() - 1);

    if (logger.isTraceEnabled()) {
      logger.trace("preprocessed script:\n" + output);
    }
    return output;
  }
}
