// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Fails the parse at the first lexer or parser error. Parser errors name the offending token;
 * lexer errors have no token to name.
 */
public class CoroutineErrorListener extends BaseErrorListener {
  private final String filename;
  private final String sourceCode;

  public CoroutineErrorListener(String filename, String sourceCode) {
    this.filename = filename;
    this.sourceCode = sourceCode;
  }

  @Override
  public void syntaxError(
      Recognizer<?, ?> recognizer,
      Object offendingSymbol,
      int line,
      int column,
      String msg,
      RecognitionException e) {
    var location = "%s:%d:%d".formatted(filename, line, column);
    String message =
        offendingSymbol instanceof Token token && token.getType() != Token.EOF
            ? "Syntax error at %s near '%s': %s".formatted(location, token.getText(), msg)
            : "Syntax error at %s: %s".formatted(location, msg);
    String sourceLine =
        line > 0 ? sourceCode.lines().skip(line - 1).findFirst().orElse("") : "";
    throw new ParseException(message, filename, line, column, sourceLine);
  }
}
