// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

/** Arithmetic over Int, Long and Double values. Both operands are widened to the wider type. */
public class Numbers {
  private Numbers() {}

  private enum Width {
    INT,
    LONG,
    DOUBLE
  }

  public static Number add(Number x, Number y) {
    switch (widthOf(x, y)) {
      case DOUBLE:
        return x.doubleValue() + y.doubleValue();
      case LONG:
        return x.longValue() + y.longValue();
      default:
        return x.intValue() + y.intValue();
    }
  }

  public static Number subtract(Number x, Number y) {
    switch (widthOf(x, y)) {
      case DOUBLE:
        return x.doubleValue() - y.doubleValue();
      case LONG:
        return x.longValue() - y.longValue();
      default:
        return x.intValue() - y.intValue();
    }
  }

  public static Number multiply(Number x, Number y) {
    switch (widthOf(x, y)) {
      case DOUBLE:
        return x.doubleValue() * y.doubleValue();
      case LONG:
        return x.longValue() * y.longValue();
      default:
        return x.intValue() * y.intValue();
    }
  }

  // Integral operands use truncating division.
  public static Number divide(Number x, Number y) {
    switch (widthOf(x, y)) {
      case DOUBLE:
        return x.doubleValue() / y.doubleValue();
      case LONG:
        return x.longValue() / y.longValue();
      default:
        return x.intValue() / y.intValue();
    }
  }

  public static Number remainder(Number x, Number y) {
    switch (widthOf(x, y)) {
      case DOUBLE:
        return x.doubleValue() % y.doubleValue();
      case LONG:
        return x.longValue() % y.longValue();
      default:
        return x.intValue() % y.intValue();
    }
  }

  public static int compare(Number x, Number y) {
    if (widthOf(x, y) == Width.DOUBLE) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    return Long.compare(x.longValue(), y.longValue());
  }

  private static Width widthOf(Number x, Number y) {
    var xWidth = widthOf(x);
    var yWidth = widthOf(y);
    return xWidth.compareTo(yWidth) >= 0 ? xWidth : yWidth;
  }

  private static Width widthOf(Number number) {
    if (number instanceof Integer) {
      return Width.INT;
    } else if (number instanceof Long) {
      return Width.LONG;
    } else if (number instanceof Double) {
      return Width.DOUBLE;
    }
    throw new IllegalArgumentException(
        "Unsupported number type: %s (%s)".formatted(number, number.getClass().getName()));
  }
}
