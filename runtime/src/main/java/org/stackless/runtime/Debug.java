// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

/** Process-wide debug logging shared by the runtime and the compiler. */
public final class Debug {
  public interface DebugLogger {
    /** Formats `message` containing printf-style "%s", "%d", etc with values from `args`. */
    void log(String message, Object... args);
  }

  private static volatile DebugLogger logger = (message, args) -> {};

  private static volatile boolean verbose = false;

  private Debug() {}

  // To enable debug logging to stderr:
  // Debug.setLogger((str, args) -> System.err.printf(str + "%n", args));
  public static void setLogger(DebugLogger newLogger) {
    logger = newLogger;
  }

  public static void setVerbose(boolean enable) {
    verbose = enable;
  }

  public static boolean isVerbose() {
    return verbose;
  }

  public static void log(String message, Object... args) {
    logger.log(message, args);
  }
}
