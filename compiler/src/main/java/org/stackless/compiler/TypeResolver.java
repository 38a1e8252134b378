// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import org.stackless.compiler.Tree.*;
import org.stackless.runtime.ValueType;

/** Computes static types of expressions whose identifiers are already bound in a {@link Table}. */
public final class TypeResolver {
  private final Table table;

  public TypeResolver(Table table) {
    this.table = table;
  }

  public ValueType typeOf(Expression expression, int lineno) {
    if (expression instanceof Constant constant) {
      return constant.type();
    } else if (expression instanceof Identifier identifier) {
      return table.symbolOf(identifier).type();
    } else if (expression instanceof UnaryOp unaryOp) {
      var operandType = typeOf(unaryOp.operand(), lineno);
      if (unaryOp.op() == Op.NOT) {
        require(ValueType.BOOLEAN, operandType, lineno, "Operand of '!'");
        return ValueType.BOOLEAN;
      }
      if (!operandType.isNumeric()) {
        throw new TransformException(
            lineno, "Bad operand type for unary -: %s".formatted(operandType));
      }
      return operandType;
    } else if (expression instanceof BinaryOp binaryOp) {
      return typeOfBinaryOp(binaryOp, lineno);
    } else if (expression instanceof Assign assign) {
      var symbol = table.symbolOf(assign.target());
      require(symbol.type(), typeOf(assign.value(), lineno), lineno, "Assignment to " + symbol);
      return ValueType.UNIT;
    } else {
      throw new IllegalStateException("Unexpected expression: " + expression);
    }
  }

  private ValueType typeOfBinaryOp(BinaryOp binaryOp, int lineno) {
    var op = binaryOp.op();
    var lhs = typeOf(binaryOp.lhs(), lineno);
    var rhs = typeOf(binaryOp.rhs(), lineno);
    if (op == Op.ADD && (lhs == ValueType.STRING || rhs == ValueType.STRING)) {
      return ValueType.STRING;
    }
    if (op.isArithmetic()) {
      checkNumeric(op, lhs, rhs, lineno);
      return ValueType.lub(lhs, rhs);
    }
    if (op.isComparison()) {
      checkNumeric(op, lhs, rhs, lineno);
      return ValueType.BOOLEAN;
    }
    if (op.isLogical()) {
      require(ValueType.BOOLEAN, lhs, lineno, "Left operand of '%s'".formatted(op.symbol()));
      require(ValueType.BOOLEAN, rhs, lineno, "Right operand of '%s'".formatted(op.symbol()));
    }
    return ValueType.BOOLEAN;
  }

  private static void checkNumeric(Op op, ValueType lhs, ValueType rhs, int lineno) {
    if (!lhs.isNumeric() || !rhs.isNumeric()) {
      throw new TransformException(
          lineno,
          "Unsupported operand types for %s: %s and %s".formatted(op.symbol(), lhs, rhs));
    }
  }

  /**
   * Type of the value a fragment leaves behind when it is the last statement executed: the
   * expression type of a leaf, the callee's result type of an unbound invocation, Unit otherwise.
   */
  public ValueType valueTypeOf(Fragment fragment) {
    if (fragment instanceof Leaf leaf) {
      return typeOf(leaf.expression(), leaf.lineno());
    } else if (fragment instanceof Sequence sequence) {
      var statements = sequence.statements();
      return statements.isEmpty()
          ? ValueType.UNIT
          : valueTypeOf(statements.get(statements.size() - 1));
    } else if (fragment instanceof Branch branch) {
      return ValueType.lub(valueTypeOf(branch.thenBranch()), valueTypeOf(branch.elseBranch()));
    } else if (fragment instanceof NestedInvocation invocation && invocation.result().isEmpty()) {
      return table.calleeOf(invocation).resultType();
    } else {
      return ValueType.UNIT;
    }
  }

  /**
   * Result type of a definition without a declared one: the least upper bound of its body's value
   * type and the types of all values it yields.
   */
  public ValueType inferResultType(Fragment body) {
    var types = new ArrayList<ValueType>(table.yieldTypes());
    types.add(valueTypeOf(body));
    return ValueType.lub(types);
  }

  /** @throws TransformException unless {@code found} conforms to {@code required} */
  public static void require(ValueType required, ValueType found, int lineno, String what) {
    if (!required.accepts(found)) {
      throw new TransformException(
          lineno,
          "%s has invalid type.\nrequired: %s\nfound:    %s".formatted(what, required, found));
    }
  }
}
