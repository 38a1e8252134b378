// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.parser;

/**
 * Syntax error in coroutine source. The message ends with the offending source line and a caret
 * under the error column.
 */
public class ParseException extends RuntimeException {
  public final String filename;
  public final int errorLine;
  public final int errorColumn;
  public final String sourceLine;

  public ParseException(
      String message, String filename, int errorLine, int errorColumn, String sourceLine) {
    super("%s%n%s%n%s".formatted(message, sourceLine, caret(errorColumn, sourceLine)));
    this.filename = filename;
    this.errorLine = errorLine;
    this.errorColumn = errorColumn;
    this.sourceLine = sourceLine;
  }

  // Tabs are kept so the caret lines up with the source line.
  private static String caret(int column, String sourceLine) {
    var marker = new StringBuilder();
    for (int i = 0; i < column && i < sourceLine.length(); ++i) {
      marker.append(sourceLine.charAt(i) == '\t' ? '\t' : ' ');
    }
    return marker.append('^').toString();
  }
}
