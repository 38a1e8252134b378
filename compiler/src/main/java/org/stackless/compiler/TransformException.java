// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

/** Fatal diagnostic raised while transforming a coroutine definition. */
public class TransformException extends RuntimeException {
  public final int lineno;

  public TransformException(int lineno, String message) {
    super(message);
    this.lineno = lineno;
  }

  /** Message prefixed with the source line, for reporting to users. */
  public String describe() {
    return lineno >= 0 ? "line %d: %s".formatted(lineno, getMessage()) : getMessage();
  }
}
