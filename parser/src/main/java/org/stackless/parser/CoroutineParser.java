// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.stackless.grammar.CoroutinesBaseVisitor;
import org.stackless.grammar.CoroutinesLexer;
import org.stackless.grammar.CoroutinesParser;

public class CoroutineParser {
  public record ParserOutput(
      String source, CoroutinesParser parser, ParseTree parseTree, JsonElement jsonAst) {}

  public static JsonElement parse(String filename, String code) {
    return parseTrees(filename, code).jsonAst();
  }

  public static ParserOutput parseTrees(String code) {
    return parseTrees("<stdin>", code);
  }

  public static ParserOutput parseTrees(String filename, String code) {
    CharStream input = CharStreams.fromString(code);
    CoroutinesLexer lexer = new CoroutinesLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(new CoroutineErrorListener(filename, code));

    CommonTokenStream tokens = new CommonTokenStream(lexer);
    CoroutinesParser parser = new CoroutinesParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(new CoroutineErrorListener(filename, code));

    ParseTree parseTree = parser.file_input();
    var visitor = new CoroutinesJsonVisitor();
    var ast = visitor.visit(parseTree);
    return new ParserOutput(code, parser, parseTree, ast);
  }
}

class CoroutinesJsonVisitor extends CoroutinesBaseVisitor<JsonElement> {

  @Override
  public JsonElement visitFile_input(CoroutinesParser.File_inputContext ctx) {
    var node = createNode(ctx, "Module");
    var body = new JsonArray();
    for (var definition : ctx.definition()) {
      body.add(visitDefinition(definition));
    }
    node.add("body", body);
    return node;
  }

  @Override
  public JsonElement visitDefinition(CoroutinesParser.DefinitionContext ctx) {
    var node = createNode(ctx, "CoroutineDef");
    node.addProperty("name", ctx.NAME().getText());
    if (ctx.type_name() != null) {
      node.addProperty("returns", ctx.type_name().getText());
    } else {
      node.add("returns", JsonNull.INSTANCE);
    }
    node.add("value", visitCoroutine_body(ctx.coroutine_body()));
    return node;
  }

  @Override
  public JsonElement visitCoroutine_body(CoroutinesParser.Coroutine_bodyContext ctx) {
    if (ctx.lambda() != null) {
      return visitLambda(ctx.lambda());
    }
    return visit(ctx.statement());
  }

  @Override
  public JsonElement visitLambda(CoroutinesParser.LambdaContext ctx) {
    var node = createNode(ctx, "Lambda");
    var args = new JsonArray();
    for (var parameter : ctx.parameter()) {
      var arg = createNode(parameter, "arg");
      arg.addProperty("arg", parameter.NAME().getText());
      arg.addProperty("annotation", parameter.type_name().getText());
      args.add(arg);
    }
    node.add("args", args);
    node.add("body", visit(ctx.statement()));
    return node;
  }

  @Override
  public JsonElement visitBlock(CoroutinesParser.BlockContext ctx) {
    var node = createNode(ctx, "Block");
    var body = new JsonArray();
    for (var statement : ctx.statement()) {
      body.add(visit(statement));
    }
    node.add("body", body);
    return node;
  }

  @Override
  public JsonElement visitValStatement(CoroutinesParser.ValStatementContext ctx) {
    return createValDef(ctx, false, ctx.NAME().getText(), ctx.type_name(), ctx.expression());
  }

  @Override
  public JsonElement visitVarStatement(CoroutinesParser.VarStatementContext ctx) {
    return createValDef(ctx, true, ctx.NAME().getText(), ctx.type_name(), ctx.expression());
  }

  private JsonObject createValDef(
      ParserRuleContext ctx,
      boolean mutable,
      String name,
      CoroutinesParser.Type_nameContext typeName,
      CoroutinesParser.ExpressionContext value) {
    var node = createNode(ctx, "ValDef");
    node.addProperty("name", name);
    node.addProperty("mutable", mutable);
    if (typeName != null) {
      node.addProperty("annotation", typeName.getText());
    } else {
      node.add("annotation", JsonNull.INSTANCE);
    }
    node.add("value", visit(value));
    return node;
  }

  @Override
  public JsonElement visitAssignStatement(CoroutinesParser.AssignStatementContext ctx) {
    var node = createNode(ctx, "Assign");
    var target = createNode(ctx, "Name");
    target.addProperty("id", ctx.NAME().getText());
    node.add("target", target);
    node.add("value", visit(ctx.expression()));
    return node;
  }

  @Override
  public JsonElement visitIfStatement(CoroutinesParser.IfStatementContext ctx) {
    var node = createNode(ctx, "If");
    node.add("test", visit(ctx.expression()));
    node.add("body", visit(ctx.statement(0)));
    if (ctx.statement().size() > 1) {
      node.add("orelse", visit(ctx.statement(1)));
    } else {
      node.add("orelse", JsonNull.INSTANCE);
    }
    return node;
  }

  @Override
  public JsonElement visitBlockStatement(CoroutinesParser.BlockStatementContext ctx) {
    return visitBlock(ctx.block());
  }

  @Override
  public JsonElement visitExpressionStatement(CoroutinesParser.ExpressionStatementContext ctx) {
    var node = createNode(ctx, "Expr");
    node.add("value", visit(ctx.expression()));
    return node;
  }

  @Override
  public JsonElement visitCallExpression(CoroutinesParser.CallExpressionContext ctx) {
    var node = createNode(ctx, "Call");
    var func = createNode(ctx, "Name");
    func.addProperty("id", ctx.NAME().getText());
    node.add("func", func);
    if (ctx.type_name() != null) {
      node.addProperty("typearg", ctx.type_name().getText());
    }
    var args = new JsonArray();
    if (ctx.arguments() != null) {
      for (var arg : ctx.arguments().expression()) {
        args.add(visit(arg));
      }
    }
    node.add("args", args);
    return node;
  }

  @Override
  public JsonElement visitParenExpression(CoroutinesParser.ParenExpressionContext ctx) {
    return visit(ctx.expression());
  }

  @Override
  public JsonElement visitLiteralExpression(CoroutinesParser.LiteralExpressionContext ctx) {
    return visitLiteral(ctx.literal());
  }

  @Override
  public JsonElement visitNameExpression(CoroutinesParser.NameExpressionContext ctx) {
    var node = createNode(ctx, "Name");
    node.addProperty("id", ctx.NAME().getText());
    return node;
  }

  @Override
  public JsonElement visitUnaryExpression(CoroutinesParser.UnaryExpressionContext ctx) {
    var node = createNode(ctx, "UnaryOp");
    node.add("op", createOp(ctx.op.getText().equals("-") ? "USub" : "Not"));
    node.add("operand", visit(ctx.expression()));
    return node;
  }

  @Override
  public JsonElement visitMultiplicativeExpression(
      CoroutinesParser.MultiplicativeExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  @Override
  public JsonElement visitAdditiveExpression(CoroutinesParser.AdditiveExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  @Override
  public JsonElement visitRelationalExpression(CoroutinesParser.RelationalExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  @Override
  public JsonElement visitEqualityExpression(CoroutinesParser.EqualityExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  @Override
  public JsonElement visitAndExpression(CoroutinesParser.AndExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  @Override
  public JsonElement visitOrExpression(CoroutinesParser.OrExpressionContext ctx) {
    return createBinOp(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
  }

  private JsonObject createBinOp(
      ParserRuleContext ctx,
      String op,
      CoroutinesParser.ExpressionContext lhs,
      CoroutinesParser.ExpressionContext rhs) {
    var node = createNode(ctx, "BinOp");
    node.add("left", visit(lhs));
    node.add("op", createOp(opName(op)));
    node.add("right", visit(rhs));
    return node;
  }

  private static String opName(String op) {
    switch (op) {
      case "+":
        return "Add";
      case "-":
        return "Sub";
      case "*":
        return "Mult";
      case "/":
        return "Div";
      case "%":
        return "Mod";
      case "<":
        return "Lt";
      case "<=":
        return "LtE";
      case ">":
        return "Gt";
      case ">=":
        return "GtE";
      case "==":
        return "Eq";
      case "!=":
        return "NotEq";
      case "&&":
        return "And";
      case "||":
        return "Or";
      default:
        throw new IllegalArgumentException("Unsupported binary operator: " + op);
    }
  }

  @Override
  public JsonElement visitLiteral(CoroutinesParser.LiteralContext ctx) {
    var node = createNode(ctx, "Constant");
    if (ctx.INTEGER() != null) {
      node.addProperty("typename", "int");
      node.addProperty("value", Integer.parseInt(ctx.INTEGER().getText()));
    } else if (ctx.LONG_INTEGER() != null) {
      String text = ctx.LONG_INTEGER().getText();
      node.addProperty("typename", "long");
      node.addProperty("value", Long.parseLong(text.substring(0, text.length() - 1)));
    } else if (ctx.FLOAT() != null) {
      node.addProperty("typename", "float");
      node.addProperty("value", Double.parseDouble(ctx.FLOAT().getText()));
    } else if (ctx.STRING() != null) {
      node.addProperty("typename", "str");
      node.addProperty("value", unquote(ctx.STRING().getText()));
    } else if (ctx.getText().equals("true") || ctx.getText().equals("false")) {
      node.addProperty("typename", "bool");
      node.addProperty("value", Boolean.parseBoolean(ctx.getText()));
    } else {
      node.addProperty("typename", "unit");
      node.add("value", JsonNull.INSTANCE);
    }
    return node;
  }

  private static String unquote(String quoted) {
    String str = quoted.substring(1, quoted.length() - 1);
    var sb = new StringBuilder();
    for (int i = 0; i < str.length(); ++i) {
      char ch = str.charAt(i);
      if (ch == '\\' && i + 1 < str.length()) {
        char nextChar = str.charAt(++i);
        switch (nextChar) {
          case 'n':
            ch = '\n';
            break;
          case 't':
            ch = '\t';
            break;
          case 'r':
            ch = '\r';
            break;
          case '"':
          case '\\':
            ch = nextChar;
            break;
          default:
            sb.append('\\');
            ch = nextChar;
        }
      }
      sb.append(ch);
    }
    return sb.toString();
  }

  @Override
  protected JsonElement defaultResult() {
    return new JsonObject();
  }

  private static JsonObject createOp(String op) {
    var node = new JsonObject();
    node.addProperty("type", op);
    return node;
  }

  private static JsonObject createNode(ParserRuleContext ctx, String type) {
    var node = new JsonObject();
    node.addProperty("type", type);
    node.addProperty("lineno", ctx.start.getLine());
    return node;
  }
}
