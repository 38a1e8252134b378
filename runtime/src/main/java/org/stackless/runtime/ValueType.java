// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.runtime;

import java.util.Collection;

/**
 * Declared type of a coroutine variable. Primitive types are stored in a {@link LongStack} through
 * an encode/decode pair; reference types are stored as-is in a {@link RefStack}.
 */
public enum ValueType {
  INT("Int", Category.PRIMITIVE),
  LONG("Long", Category.PRIMITIVE),
  DOUBLE("Double", Category.PRIMITIVE),
  BOOLEAN("Boolean", Category.PRIMITIVE),
  STRING("String", Category.REFERENCE),
  UNIT("Unit", Category.REFERENCE),
  COROUTINE("Coroutine", Category.REFERENCE),
  ANY("Any", Category.REFERENCE);

  /** Storage region category. */
  public enum Category {
    PRIMITIVE,
    REFERENCE
  }

  private final String typeName;
  private final Category category;

  ValueType(String typeName, Category category) {
    this.typeName = typeName;
    this.category = category;
  }

  public String typeName() {
    return typeName;
  }

  public Category category() {
    return category;
  }

  public boolean isNumeric() {
    return this == INT || this == LONG || this == DOUBLE;
  }

  public static ValueType parse(String typeName) {
    for (var type : values()) {
      if (type.typeName.equals(typeName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown type: " + typeName);
  }

  public long encode(Object value) {
    switch (this) {
      case INT:
        return ((Number) value).intValue();
      case LONG:
        return ((Number) value).longValue();
      case DOUBLE:
        return Double.doubleToRawLongBits(((Number) value).doubleValue());
      case BOOLEAN:
        return ((Boolean) value) ? 1L : 0L;
      default:
        throw new UnsupportedOperationException(typeName + " values are not long-encoded");
    }
  }

  public Object decode(long encoded) {
    switch (this) {
      case INT:
        return (int) encoded;
      case LONG:
        return encoded;
      case DOUBLE:
        return Double.longBitsToDouble(encoded);
      case BOOLEAN:
        return encoded != 0L;
      default:
        throw new UnsupportedOperationException(typeName + " values are not long-encoded");
    }
  }

  /** Value a variable slot holds before its declaration executes. */
  public Object defaultValue() {
    switch (this) {
      case INT:
        return 0;
      case LONG:
        return 0L;
      case DOUBLE:
        return 0.0;
      case BOOLEAN:
        return false;
      default:
        return null;
    }
  }

  /**
   * Converts {@code value} to this type's runtime representation, widening numbers where allowed.
   *
   * @throws IllegalArgumentException if the value does not conform to this type
   */
  public Object coerce(Object value) {
    switch (this) {
      case INT:
        if (value instanceof Integer) {
          return value;
        }
        break;
      case LONG:
        if (value instanceof Integer || value instanceof Long) {
          return ((Number) value).longValue();
        }
        break;
      case DOUBLE:
        if (value instanceof Number number) {
          return number.doubleValue();
        }
        break;
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value;
        }
        break;
      case STRING:
        if (value == null || value instanceof String) {
          return value;
        }
        break;
      case UNIT:
        if (value == null) {
          return null;
        }
        break;
      case COROUTINE:
        if (value == null || value instanceof Coroutine) {
          return value;
        }
        break;
      case ANY:
        return value;
    }
    throw new IllegalArgumentException(
        "Expected value of type %s but got %s".formatted(typeName, describe(value)));
  }

  /** Parses a command-line argument into a value of this type. */
  public Object parseValue(String text) {
    switch (this) {
      case INT:
        return Integer.parseInt(text);
      case LONG:
        return Long.parseLong(text);
      case DOUBLE:
        return Double.parseDouble(text);
      case BOOLEAN:
        return Boolean.parseBoolean(text);
      case UNIT:
        return null;
      case COROUTINE:
        throw new IllegalArgumentException("Coroutine instances cannot be given as text");
      default:
        return text;
    }
  }

  /** Whether a value of type {@code found} may be used where {@code this} is required. */
  public boolean accepts(ValueType found) {
    if (this == found || this == ANY) {
      return true;
    }
    if (this == LONG) {
      return found == INT;
    } else if (this == DOUBLE) {
      return found == INT || found == LONG;
    } else {
      return false;
    }
  }

  /** Least upper bound of {@code types}; {@link #UNIT} for an empty collection. */
  public static ValueType lub(Collection<ValueType> types) {
    ValueType result = null;
    for (var type : types) {
      result = result == null ? type : lub(result, type);
    }
    return result == null ? UNIT : result;
  }

  public static ValueType lub(ValueType a, ValueType b) {
    if (a == b) {
      return a;
    }
    if (a.isNumeric() && b.isNumeric()) {
      return a.ordinal() > b.ordinal() ? a : b;
    }
    return ANY;
  }

  public static String describe(Object value) {
    if (value == null) {
      return "()";
    }
    return value.getClass().getSimpleName() + " " + value;
  }

  @Override
  public String toString() {
    return typeName;
  }
}
