// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.stackless.compiler.Tree.Expression;
import org.stackless.runtime.Coroutine;
import org.stackless.runtime.Definition;
import org.stackless.runtime.ValueType;

/** Structured code of synthesized entry procedures. */
public class Code {
  private Code() {}

  /** Entry procedure of one subgraph. */
  public record Procedure(int id, int subgraphId, List<Statement> prelude, Block body) {
    public String name() {
      return "ep" + subgraphId;
    }

    public void exec(Context context) {
      for (var statement : prelude) {
        statement.exec(context);
      }
      body.exec(context);
    }

    @Override
    public String toString() {
      var out = new StringBuilder();
      out.append("def %s(c: Coroutine): Unit = {\n".formatted(name()));
      for (var statement : prelude) {
        statement.render(out, "  ");
      }
      body.render(out, "  ");
      out.append("}\n");
      return out.toString();
    }
  }

  public interface Statement {
    void exec(Context context);

    default void render(StringBuilder out, String indent) {
      out.append(indent).append(this).append('\n');
    }
  }

  public record Block(List<Statement> statements) {
    public void exec(Context context) {
      for (var statement : statements) {
        if (context.skipStatement()) {
          return;
        }
        statement.exec(context);
      }
    }

    void render(StringBuilder out, String indent) {
      for (var statement : statements) {
        statement.render(out, indent);
      }
    }

    /** Accumulates statements; a block is only nested into its parent once finished. */
    public static class Builder {
      private final List<Statement> statements = new ArrayList<>();
      private boolean finished = false;

      public Builder append(Statement statement) {
        if (finished) {
          throw new IllegalStateException("Cannot append to a finished block: " + statement);
        }
        statements.add(statement);
        return this;
      }

      public Block finish() {
        finished = true;
        return new Block(Collections.unmodifiableList(statements));
      }
    }
  }

  /** Where a restored variable's value comes from. */
  public sealed interface Source permits StackRead, ReturnValue {
    Object read(Context context);
  }

  public record StackRead(Table.VarInfo info) implements Source {
    @Override
    public Object read(Context context) {
      return info.read(context.coroutine());
    }

    @Override
    public String toString() {
      return "%s[%d]".formatted(info.regionName(), info.stackpos());
    }
  }

  /** Value of the frame that most recently completed on the same instance. */
  public record ReturnValue() implements Source {
    @Override
    public Object read(Context context) {
      return context.coroutine().getReturnValue();
    }

    @Override
    public String toString() {
      return "c.returnValue";
    }
  }

  /** Reconstructs a local from storage. */
  public record Restore(Symbol symbol, Source source) implements Statement {
    @Override
    public void exec(Context context) {
      context.declare(symbol, symbol.type().coerce(source.read(context)));
    }

    @Override
    public String toString() {
      return "%s %s: %s = %s"
          .formatted(symbol.mutable() ? "var" : "val", symbol, symbol.type(), source);
    }
  }

  /**
   * Value of a completed nested invocation used as the last expression value. A procedure that is
   * also reached by resuming after a yield starts from Unit instead.
   */
  public record ResumeValue() implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      var coroutine = context.coroutine();
      context.setLastValue(coroutine.resumedByReturn() ? coroutine.getReturnValue() : null);
    }

    @Override
    public String toString() {
      return "c.returnValue";
    }
  }

  public record Declare(Symbol symbol, Expression initializer) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      context.declare(symbol, symbol.type().coerce(initializer.eval(context)));
      context.setLastValue(null);
    }

    @Override
    public String toString() {
      return "%s %s: %s = %s"
          .formatted(symbol.mutable() ? "var" : "val", symbol, symbol.type(), initializer);
    }
  }

  public record Exec(Expression expression) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      context.setLastValue(expression.eval(context));
    }

    @Override
    public String toString() {
      return expression.toString();
    }
  }

  public record If(Expression condition, Block thenBody, Block elseBody) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      if ((Boolean) condition.eval(context)) {
        thenBody.exec(context);
      } else {
        elseBody.exec(context);
      }
    }

    @Override
    public void render(StringBuilder out, String indent) {
      out.append(indent).append("if (").append(condition).append(") {\n");
      thenBody.render(out, indent + "  ");
      out.append(indent).append("} else {\n");
      elseBody.render(out, indent + "  ");
      out.append(indent).append("}\n");
    }

    @Override
    public String toString() {
      var out = new StringBuilder();
      render(out, "");
      return out.toString();
    }
  }

  /** Writes a local back to its storage slot. */
  public record Persist(Table.VarInfo info) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      info.write(context.coroutine(), context.get(info.symbol()));
    }

    @Override
    public String toString() {
      return "%s[%d] = %s".formatted(info.regionName(), info.stackpos(), info.symbol());
    }
  }

  /** Records the subgraph that resumption continues into. */
  public record SetPc(int pc) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      context.coroutine().pcstack().update(pc);
    }

    @Override
    public String toString() {
      return "pcstack.top = " + pc;
    }
  }

  public record Suspend(Expression payload) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      context.coroutine().yieldValue(payload.eval(context));
      context.returnFromProcedure();
    }

    @Override
    public String toString() {
      return "yieldval(%s); return".formatted(payload);
    }
  }

  /** Hands control to another instance and yields its value; falls through if it yields none. */
  public record Transfer(Expression target, ValueType yieldType) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      var other = (Coroutine) target.eval(context);
      context.coroutine().yieldTo(other, yieldType);
      context.returnFromProcedure();
    }

    @Override
    public String toString() {
      return "yieldto[%s](%s); return".formatted(yieldType, target);
    }
  }

  /** Pushes a frame of another coroutine onto the same instance. */
  public record Invoke(String callee, List<Expression> args) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      Definition definition = context.definition(callee);
      var values = new Object[args.size()];
      for (int i = 0; i < values.length; ++i) {
        values[i] = args.get(i).eval(context);
      }
      definition.push(context.coroutine(), values);
      context.returnFromProcedure();
    }

    @Override
    public String toString() {
      return "%s.push(c, %s); return"
          .formatted(
              callee, args.stream().map(Object::toString).collect(Collectors.joining(", ")));
    }
  }

  /** Pops this frame, handing the last expression value to the frame below. */
  public record Complete(ValueType resultType) implements Statement {
    @Override
    public void exec(Context context) {
      if (context.skipStatement()) {
        return;
      }
      context.coroutine().complete(resultType.coerce(context.lastValue()));
      context.returnFromProcedure();
    }

    @Override
    public String toString() {
      return "c.complete(lastValue); return";
    }
  }
}
