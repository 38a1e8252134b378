// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import org.stackless.runtime.ValueType;

/**
 * A declared variable. Ids are unique within one definition, so two variables with the same name in
 * different chains are distinct symbols.
 */
public record Symbol(
    int id, String name, ValueType type, boolean mutable, boolean parameter, int lineno) {
  @Override
  public String toString() {
    return name;
  }
}
