// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.stackless.runtime.ValueType;

/**
 * Statement tree of a coroutine definition.
 *
 * <p>Records are compared by identity wherever the compiler keys state on tree nodes, since two
 * structurally equal fragments at different source locations are distinct program points.
 */
public final class Tree {
  private Tree() {}

  /** String form of a runtime value, with Unit shown as {@code ()}. */
  public static String show(Object value) {
    return value == null ? "()" : value.toString();
  }

  /** Value of a coroutine definition: a function literal, or any other (malformed) statement. */
  public sealed interface Term permits Lambda, Fragment {
    int lineno();
  }

  public record Parameter(String name, ValueType type) {
    @Override
    public String toString() {
      return "%s: %s".formatted(name, type);
    }
  }

  public record Lambda(int lineno, List<Parameter> parameters, Fragment body) implements Term {
    @Override
    public String toString() {
      return "(%s) => %s"
          .formatted(
              parameters.stream().map(Parameter::toString).collect(Collectors.joining(", ")),
              body);
    }
  }

  public record CoroutineDef(
      int lineno, String name, Optional<ValueType> resultType, Term value) {}

  public sealed interface Fragment extends Term
      permits Declaration, Branch, Sequence, Leaf, SuspensionPoint, YieldTo, NestedInvocation {}

  /** {@code val} or {@code var} declaration with an initializer. */
  public record Declaration(
      int lineno,
      boolean mutable,
      String name,
      Optional<ValueType> declaredType,
      Expression initializer)
      implements Fragment {
    @Override
    public String toString() {
      return "%s %s%s = %s"
          .formatted(
              mutable ? "var" : "val",
              name,
              declaredType.map(t -> ": " + t).orElse(""),
              initializer);
    }
  }

  /** Two-way conditional. */
  public record Branch(int lineno, Expression condition, Fragment thenBranch, Fragment elseBranch)
      implements Fragment {
    @Override
    public String toString() {
      return "if (%s) %s else %s".formatted(condition, thenBranch, elseBranch);
    }
  }

  public record Sequence(int lineno, List<Fragment> statements) implements Fragment {
    @Override
    public String toString() {
      return statements.stream()
          .map(Object::toString)
          .collect(Collectors.joining("; ", "{ ", " }"));
    }
  }

  /** Expression evaluated as a statement. */
  public record Leaf(int lineno, Expression expression) implements Fragment {
    @Override
    public String toString() {
      return expression.toString();
    }
  }

  /** {@code yieldval(payload)} */
  public record SuspensionPoint(int lineno, Expression payload) implements Fragment {
    @Override
    public String toString() {
      return "yieldval(%s)".formatted(payload);
    }
  }

  /**
   * {@code yieldto[T](target)}: resumes another coroutine instance and yields what it yields, as a
   * value of {@code yieldType}.
   */
  public record YieldTo(int lineno, ValueType yieldType, Expression target) implements Fragment {
    @Override
    public String toString() {
      return "yieldto[%s](%s)".formatted(yieldType, target);
    }
  }

  /** Where the result of a nested coroutine invocation is bound, if anywhere. */
  public record Target(boolean mutable, String name, Optional<ValueType> declaredType) {
    @Override
    public String toString() {
      return "%s %s%s".formatted(
          mutable ? "var" : "val", name, declaredType.map(t -> ": " + t).orElse(""));
    }
  }

  /** Invocation of another coroutine from within a coroutine body. */
  public record NestedInvocation(
      int lineno, Optional<Target> result, String callee, List<Expression> args)
      implements Fragment {
    @Override
    public String toString() {
      String call =
          "%s(%s)"
              .formatted(
                  callee, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
      return result.map(t -> t + " = " + call).orElse(call);
    }
  }

  public enum Op {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    MOD("%"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("=="),
    NOT_EQ("!="),
    AND("&&"),
    OR("||"),
    USUB("-"),
    NOT("!");

    private final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public boolean isArithmetic() {
      return this == ADD || this == SUB || this == MULT || this == DIV || this == MOD;
    }

    public boolean isComparison() {
      return this == LT || this == LTE || this == GT || this == GTE;
    }

    public boolean isEquality() {
      return this == EQ || this == NOT_EQ;
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }

    /** Maps an operator name in the JSON AST, e.g. "Add" or "NotEq", to an operator. */
    public static Op fromJsonName(String name) {
      switch (name) {
        case "Add":
          return ADD;
        case "Sub":
          return SUB;
        case "Mult":
          return MULT;
        case "Div":
          return DIV;
        case "Mod":
          return MOD;
        case "Lt":
          return LT;
        case "LtE":
          return LTE;
        case "Gt":
          return GT;
        case "GtE":
          return GTE;
        case "Eq":
          return EQ;
        case "NotEq":
          return NOT_EQ;
        case "And":
          return AND;
        case "Or":
          return OR;
        case "USub":
          return USUB;
        case "Not":
          return NOT;
        default:
          throw new IllegalArgumentException("Unsupported operator: " + name);
      }
    }
  }

  public sealed interface Expression permits Identifier, Constant, BinaryOp, UnaryOp, Assign {
    Object eval(Context context);
  }

  public record Identifier(String name) implements Expression {
    @Override
    public Object eval(Context context) {
      return context.get(this);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public record Constant(ValueType type, Object value) implements Expression {
    public static Constant unit() {
      return new Constant(ValueType.UNIT, null);
    }

    @Override
    public Object eval(Context context) {
      return value;
    }

    @Override
    public String toString() {
      if (type == ValueType.UNIT) {
        return "()";
      } else if (type == ValueType.STRING) {
        return "\"%s\"".formatted(value.toString().replace("\\", "\\\\").replace("\"", "\\\""));
      } else if (type == ValueType.LONG) {
        return value + "L";
      } else {
        return value.toString();
      }
    }
  }

  public record UnaryOp(Op op, Expression operand) implements Expression {
    @Override
    public Object eval(Context context) {
      Object value = operand.eval(context);
      if (op == Op.NOT) {
        return !(Boolean) value;
      }
      if (value instanceof Integer i) {
        return -i;
      } else if (value instanceof Long l) {
        return -l;
      } else {
        return -(Double) value;
      }
    }

    @Override
    public String toString() {
      return op.symbol() + operand;
    }
  }

  public record BinaryOp(Expression lhs, Op op, Expression rhs) implements Expression {
    @Override
    public Object eval(Context context) {
      Object lhsValue = lhs.eval(context);
      if (op == Op.AND) {
        return (Boolean) lhsValue && (Boolean) rhs.eval(context);
      }
      if (op == Op.OR) {
        return (Boolean) lhsValue || (Boolean) rhs.eval(context);
      }
      Object rhsValue = rhs.eval(context);
      if (op == Op.ADD && (lhsValue instanceof String || rhsValue instanceof String)) {
        return show(lhsValue) + show(rhsValue);
      }
      if (op.isEquality()) {
        boolean equal =
            lhsValue instanceof Number x && rhsValue instanceof Number y
                ? Numbers.compare(x, y) == 0
                : Objects.equals(lhsValue, rhsValue);
        return op == Op.EQ ? equal : !equal;
      }
      var lhsNum = (Number) lhsValue;
      var rhsNum = (Number) rhsValue;
      if (op.isComparison()) {
        int cmp = Numbers.compare(lhsNum, rhsNum);
        switch (op) {
          case LT:
            return cmp < 0;
          case LTE:
            return cmp <= 0;
          case GT:
            return cmp > 0;
          default:
            return cmp >= 0;
        }
      }
      switch (op) {
        case ADD:
          return Numbers.add(lhsNum, rhsNum);
        case SUB:
          return Numbers.subtract(lhsNum, rhsNum);
        case MULT:
          return Numbers.multiply(lhsNum, rhsNum);
        case DIV:
          return Numbers.divide(lhsNum, rhsNum);
        case MOD:
          return Numbers.remainder(lhsNum, rhsNum);
        default:
          throw new IllegalStateException("Unexpected binary operator: " + op);
      }
    }

    @Override
    public String toString() {
      return "(%s %s %s)".formatted(lhs, op.symbol(), rhs);
    }
  }

  /** Assignment to a {@code var}; evaluates to Unit. */
  public record Assign(Identifier target, Expression value) implements Expression {
    @Override
    public Object eval(Context context) {
      context.assign(target, value.eval(context));
      return null;
    }

    @Override
    public String toString() {
      return "%s = %s".formatted(target, value);
    }
  }
}
