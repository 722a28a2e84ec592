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

import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.ast.SourceText;
import hypertag.common.Logging;
import hypertag.common.exceptions.InvalidSyntaxException;
import hypertag.common.exceptions.UserException;
import hypertag.frontend.peg.Grammar;
import hypertag.frontend.peg.IncompleteParseException;
import hypertag.frontend.peg.ParseTree;

/**
 * Turns script text into a set-up AST: chooses indentation markers,
 * preprocesses, parses, rewrites the parse tree and runs node setup.
 */
public class HypertagParser {

  /** Longest part of the offending line quoted in syntax errors */
  private static final int QUOTE_LENGTH = 15;

  private final Logger logger = Logging.getHypertagLogger();

  public HypertagAST parse(String script, String fileName)
                                                throws UserException {
    IndentMarkers markers = IndentMarkers.choose(script);
    if (IndentMarkers.DEFAULT.anyIn(script)) {
      logger.debug("script contains default indentation markers, using: "
                   + markers);
    }
    Grammar grammar = HypertagGrammar.create(markers);
    Preprocessor preprocessor = new Preprocessor(markers);
    String flat = preprocessor.preprocess(script);

    ParseTree parseTree;
    try {
      parseTree = grammar.parse(flat, HypertagGrammar.START_RULE);
    } catch (IncompleteParseException e) {
      logger.debug("parse failed: " + e.getMessage());
      throw locateError(script, grammar, preprocessor);
    }

    SourceText source = new SourceText(fileName, flat, script);
    HypertagAST root = new TreeRewriter(source).rewrite(parseTree);
    assert(root.getKind() == NodeKind.DOCUMENT);
    NodeSetup.setup(root);
    LogHelper.traceTree("AST after setup", root);
    return root;
  }

  /**
   * Find the first line that breaks parsing by bisecting over truncated
   * copies of the script.  A prefix of a valid script is always valid,
   * since every block may have an empty body.
   */
  private InvalidSyntaxException locateError(String script, Grammar grammar,
                                             Preprocessor preprocessor) {
    String lines[] = script.split("\n", -1);
    int lineGood = 0;
    int lineBad = lines.length;

    while (lineGood + 1 < lineBad) {
      int split = (lineGood + lineBad) / 2;
      String partial = StringUtils.join(Arrays.asList(lines).subList(0, split), "\n");
      try {
        grammar.parse(preprocessor.preprocess(partial),
                      HypertagGrammar.START_RULE);
        lineGood = split;
      } catch (IncompleteParseException | UserException e) {
        lineBad = split;
      }
    }
    if (lineBad == 0) {
      lineBad = 1;
    }

    String line = lines[lineBad - 1].strip();
    String quote = line;
    if (line.length() > QUOTE_LENGTH) {
      quote = line.substring(0, QUOTE_LENGTH) + "...";
    }
    return new InvalidSyntaxException("invalid syntax near line " + lineBad +
                                      ": " + quote);
  }
}
