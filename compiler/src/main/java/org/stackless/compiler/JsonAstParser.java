// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.stackless.compiler.Tree.*;
import org.stackless.runtime.ValueType;

/**
 * Reads the JSON AST produced by {@code CoroutineParser} into statement trees. Calls are classified
 * here: {@code yieldval} and {@code yieldto} become suspension points and a call to a coroutine
 * defined in the same module becomes a nested invocation.
 */
public record JsonAstParser(Set<String> coroutineNames) {
  public static final String YIELDVAL = "yieldval";
  public static final String YIELDTO = "yieldto";

  public static List<CoroutineDef> parseModule(JsonElement element) {
    if (!getType(element).equals("Module")) {
      throw new TransformException(
          getLineno(element), "Expected Module but got " + getType(element));
    }
    var names = new LinkedHashSet<String>();
    for (var definition : getBody(element)) {
      String name = getAttr(definition, "name").getAsString();
      if (!names.add(name)) {
        throw new TransformException(
            getLineno(definition), "Duplicate coroutine definition: " + name);
      }
    }
    var parser = new JsonAstParser(names);
    var definitions = new ArrayList<CoroutineDef>();
    for (var definition : getBody(element)) {
      definitions.add(parser.parseDefinition(definition));
    }
    return definitions;
  }

  public CoroutineDef parseDefinition(JsonElement element) {
    String type = getType(element);
    if (!type.equals("CoroutineDef")) {
      throw new TransformException(getLineno(element), "Expected CoroutineDef but got " + type);
    }
    var returns = getAttr(element, "returns");
    Optional<ValueType> resultType =
        returns == null || returns.isJsonNull()
            ? Optional.empty()
            : Optional.of(parseType(returns, getLineno(element)));
    var value = getAttr(element, "value");
    final Term term;
    if (getType(value).equals("Lambda")) {
      var parameters = new ArrayList<Parameter>();
      for (var arg : getAttr(value, "args").getAsJsonArray()) {
        parameters.add(
            new Parameter(
                getAttr(arg, "arg").getAsString(),
                parseType(getAttr(arg, "annotation"), getLineno(value))));
      }
      term = new Lambda(getLineno(value), parameters, parseStatement(getAttr(value, "body")));
    } else {
      term = parseStatement(value);
    }
    return new CoroutineDef(
        getLineno(element), getAttr(element, "name").getAsString(), resultType, term);
  }

  public Fragment parseStatement(JsonElement element) {
    String type = getType(element);
    int lineno = getLineno(element);
    switch (type) {
      case "Block":
        {
          var statements = new ArrayList<Fragment>();
          for (var statement : getBody(element)) {
            statements.add(parseStatement(statement));
          }
          return new Sequence(lineno, statements);
        }

      case "ValDef":
        {
          String name = getAttr(element, "name").getAsString();
          boolean mutable = getAttr(element, "mutable").getAsBoolean();
          var annotation = getAttr(element, "annotation");
          Optional<ValueType> declaredType =
              annotation == null || annotation.isJsonNull()
                  ? Optional.empty()
                  : Optional.of(parseType(annotation, lineno));
          var value = getAttr(element, "value");
          if (isCoroutineCall(value)) {
            return parseInvocation(
                value, Optional.of(new Target(mutable, name, declaredType)), lineno);
          }
          return new Declaration(lineno, mutable, name, declaredType, parseExpression(value));
        }

      case "Assign":
        {
          var target = getId(getAttr(element, "target"));
          return new Leaf(lineno, new Assign(target, parseExpression(getAttr(element, "value"))));
        }

      case "If":
        {
          var orelse = getAttr(element, "orelse");
          Fragment elseBranch =
              orelse == null || orelse.isJsonNull()
                  ? new Leaf(lineno, Constant.unit())
                  : parseStatement(orelse);
          return new Branch(
              lineno,
              parseExpression(getAttr(element, "test")),
              parseStatement(getAttr(element, "body")),
              elseBranch);
        }

      case "Expr":
        {
          var value = getAttr(element, "value");
          if (isCall(value) && getCallee(value).equals(YIELDVAL)) {
            var args = getAttr(value, "args").getAsJsonArray();
            if (args.size() != 1) {
              throw new TransformException(
                  lineno, "yieldval takes 1 argument but %d given".formatted(args.size()));
            }
            return new SuspensionPoint(lineno, parseExpression(args.get(0)));
          }
          if (isCall(value) && getCallee(value).equals(YIELDTO)) {
            return parseYieldTo(value, lineno);
          }
          if (isCoroutineCall(value)) {
            return parseInvocation(value, Optional.empty(), lineno);
          }
          return new Leaf(lineno, parseExpression(value));
        }

      default:
        throw new TransformException(lineno, "Unsupported statement type: " + type);
    }
  }

  // The type argument of yieldto[T](target) defaults to Any.
  private YieldTo parseYieldTo(JsonElement call, int lineno) {
    var args = getAttr(call, "args").getAsJsonArray();
    if (args.size() != 1) {
      throw new TransformException(
          lineno, "yieldto takes 1 argument but %d given".formatted(args.size()));
    }
    var typeArg = getAttr(call, "typearg");
    ValueType yieldType =
        typeArg == null || typeArg.isJsonNull() ? ValueType.ANY : parseType(typeArg, lineno);
    return new YieldTo(lineno, yieldType, parseExpression(args.get(0)));
  }

  private NestedInvocation parseInvocation(
      JsonElement call, Optional<Target> result, int lineno) {
    var args = new ArrayList<Expression>();
    for (var arg : getAttr(call, "args").getAsJsonArray()) {
      args.add(parseExpression(arg));
    }
    return new NestedInvocation(lineno, result, getCallee(call), args);
  }

  public Expression parseExpression(JsonElement element) {
    String type = getType(element);
    int lineno = getLineno(element);
    switch (type) {
      case "Name":
        return getId(element);

      case "Constant":
        return parseConstant(element);

      case "UnaryOp":
        return new UnaryOp(
            Op.fromJsonName(getType(getAttr(element, "op"))),
            parseExpression(getAttr(element, "operand")));

      case "BinOp":
        return new BinaryOp(
            parseExpression(getAttr(element, "left")),
            Op.fromJsonName(getType(getAttr(element, "op"))),
            parseExpression(getAttr(element, "right")));

      case "Call":
        {
          String callee = getCallee(element);
          if (callee.equals(YIELDVAL) || callee.equals(YIELDTO)) {
            throw new TransformException(
                lineno, "%s(...) may only be used as a statement".formatted(callee));
          }
          if (coroutineNames.contains(callee)) {
            throw new TransformException(
                lineno,
                "%s(...) may only be used as a statement or a val/var initializer"
                    .formatted(callee));
          }
          throw new TransformException(lineno, "Unknown function: " + callee);
        }

      default:
        throw new TransformException(lineno, "Unsupported expression type: " + type);
    }
  }

  private static Constant parseConstant(JsonElement element) {
    var value = getAttr(element, "value");
    String typename = getAttr(element, "typename").getAsString();
    switch (typename) {
      case "int":
        return new Constant(ValueType.INT, value.getAsInt());
      case "long":
        return new Constant(ValueType.LONG, value.getAsLong());
      case "float":
        return new Constant(ValueType.DOUBLE, value.getAsDouble());
      case "str":
        return new Constant(ValueType.STRING, value.getAsString());
      case "bool":
        return new Constant(ValueType.BOOLEAN, value.getAsBoolean());
      case "unit":
        return Constant.unit();
      default:
        throw new TransformException(getLineno(element), "Unsupported constant type: " + typename);
    }
  }

  private static ValueType parseType(JsonElement element, int lineno) {
    String typeName = element.getAsString();
    try {
      return ValueType.parse(typeName);
    } catch (IllegalArgumentException e) {
      throw new TransformException(lineno, e.getMessage());
    }
  }

  private boolean isCoroutineCall(JsonElement element) {
    return isCall(element) && coroutineNames.contains(getCallee(element));
  }

  private static boolean isCall(JsonElement element) {
    return getType(element).equals("Call");
  }

  private static String getCallee(JsonElement call) {
    var func = getAttr(call, "func");
    if (!getType(func).equals("Name")) {
      throw new TransformException(getLineno(call), "Callee must be a name");
    }
    return getAttr(func, "id").getAsString();
  }

  private static String getType(JsonElement element) {
    return element.getAsJsonObject().get("type").getAsString();
  }

  private static int getLineno(JsonElement element) {
    var lineno = element.getAsJsonObject().get("lineno");
    return lineno == null ? -1 : lineno.getAsInt();
  }

  private static JsonElement getAttr(JsonElement element, String attr) {
    return element.getAsJsonObject().get(attr);
  }

  private static JsonArray getBody(JsonElement element) {
    return element.getAsJsonObject().get("body").getAsJsonArray();
  }

  private static Identifier getId(JsonElement element) {
    JsonObject object = element.getAsJsonObject();
    return new Identifier(object.get("id").getAsString());
  }
}
